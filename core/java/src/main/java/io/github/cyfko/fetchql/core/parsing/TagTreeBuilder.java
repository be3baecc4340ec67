package io.github.cyfko.fetchql.core.parsing;

import io.github.cyfko.fetchql.core.config.ParserPolicy;
import io.github.cyfko.fetchql.core.exception.StructuralException;
import io.github.cyfko.fetchql.core.exception.StructuralException.Reason;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Builds the {@link TagNode} tree of a token stream with an explicit stack.
 * <p>
 * An open tag pushes a node builder, the matching close tag pops it and attaches the finished
 * node to its parent; a self-closing tag is attached directly. Because nesting is tracked on a
 * stack instead of matched by pattern, elements nest to any depth (up to
 * {@link ParserPolicy#maxNestingDepth()}).
 * </p>
 *
 * <p><strong>States:</strong></p>
 * <pre>
 * ExpectOpen --open--> InTag(depth) --close (depth 0)--> Done
 *                        |  any violation
 *                        v
 *                      Error (immediate, no backtracking)
 * </pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TagTreeBuilder {

    private static final SourcePosition START = new SourcePosition(0, 1, 1);

    private final ParserPolicy policy;

    public TagTreeBuilder() {
        this(ParserPolicy.defaults());
    }

    public TagTreeBuilder(ParserPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "Parser policy is required");
    }

    /**
     * Assembles the tokens into a single rooted tree.
     *
     * @param tokens tokens produced by {@link FetchXmlTokenizer}
     * @return the root element
     * @throws StructuralException on the first nesting violation
     */
    public TagNode buildTree(List<Token> tokens) {
        Objects.requireNonNull(tokens, "Tokens cannot be null");

        Deque<TagNode.Builder> stack = new ArrayDeque<>();
        TagNode root = null;

        for (Token token : tokens) {
            switch (token.type()) {
                case OPEN_TAG -> {
                    if (stack.isEmpty() && root != null) {
                        throw multipleRoots(token);
                    }
                    checkDepth(stack.size() + 1, token);
                    stack.push(new TagNode.Builder(token.name(), token.attributes(), token.position()));
                }
                case SELF_CLOSING_TAG -> {
                    checkDepth(stack.size() + 1, token);
                    TagNode node = new TagNode(token.name(), token.attributes(), List.of(), null, token.position());
                    if (stack.isEmpty()) {
                        if (root != null) {
                            throw multipleRoots(token);
                        }
                        root = node;
                    } else {
                        stack.peek().addChild(node);
                    }
                }
                case CLOSE_TAG -> {
                    if (stack.isEmpty()) {
                        throw new StructuralException(Reason.UNEXPECTED_CLOSE_TAG,
                                "Closing tag </" + token.name() + "> has no matching opening tag", token.position());
                    }
                    TagNode.Builder open = stack.pop();
                    if (!open.name().equals(token.name())) {
                        throw new StructuralException(Reason.MISMATCHED_TAG,
                                "Expected </" + open.name() + "> but found </" + token.name() + ">", token.position());
                    }
                    TagNode node = open.build();
                    if (stack.isEmpty()) {
                        root = node;
                    } else {
                        stack.peek().addChild(node);
                    }
                }
                case TEXT -> {
                    if (stack.isEmpty()) {
                        throw new StructuralException(Reason.TEXT_OUTSIDE_ROOT,
                                "Text is not allowed outside the root element", token.position());
                    }
                    stack.peek().appendText(token.text());
                }
            }
        }

        if (!stack.isEmpty()) {
            throw unterminated(stack);
        }
        if (root == null) {
            throw new StructuralException(Reason.EMPTY_DOCUMENT, "Document has no root element",
                    tokens.isEmpty() ? START : tokens.get(0).position());
        }
        return root;
    }

    private void checkDepth(int depth, Token token) {
        if (depth > policy.maxNestingDepth()) {
            throw new StructuralException(Reason.NESTING_TOO_DEEP, String.format(
                    "Elements nested too deeply (max: %d). Policy applied: %s",
                    policy.maxNestingDepth(), policy.policyName()), token.position());
        }
    }

    private static StructuralException multipleRoots(Token token) {
        return new StructuralException(Reason.MULTIPLE_ROOTS,
                "Element <" + token.name() + "> follows the root element", token.position());
    }

    private static StructuralException unterminated(Deque<TagNode.Builder> stack) {
        StringJoiner open = new StringJoiner(", ");
        Iterator<TagNode.Builder> outermostFirst = stack.descendingIterator();
        while (outermostFirst.hasNext()) {
            open.add("<" + outermostFirst.next().name() + ">");
        }
        TagNode.Builder innermost = stack.peek();
        return new StructuralException(Reason.UNTERMINATED_TAG,
                "Unterminated tag <" + innermost.name() + "> (still open: " + open + ")", innermost.position());
    }
}
