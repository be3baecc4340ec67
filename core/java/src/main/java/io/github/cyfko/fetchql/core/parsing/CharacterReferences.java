package io.github.cyfko.fetchql.core.parsing;

import io.github.cyfko.fetchql.core.exception.TokenizeException;

import java.util.Map;

/**
 * Decoding and encoding of markup entity references.
 * <p>
 * Decoding understands the five predefined entities ({@code &amp; &lt; &gt; &quot; &apos;})
 * and decimal or hexadecimal character references; anything else is an error.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class CharacterReferences {

    private static final Map<String, String> PREDEFINED = Map.of(
            "amp", "&",
            "lt", "<",
            "gt", ">",
            "quot", "\"",
            "apos", "'"
    );

    // Longest reference accepted between '&' and ';', e.g. "#x10FFFF"
    private static final int MAX_REFERENCE_LENGTH = 10;

    private CharacterReferences() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Replaces the entity references of {@code raw}.
     *
     * @param raw        the text as written in the source
     * @param baseOffset offset of {@code raw} in the source, used for error positions
     * @param lines      position lookup of the source
     * @return the decoded text
     * @throws TokenizeException INVALID_CHARACTER_REFERENCE on an unknown, unterminated or out-of-range reference
     */
    static String decode(String raw, int baseOffset, LineIndex lines) {
        int amp = raw.indexOf('&');
        if (amp < 0) return raw;

        StringBuilder out = new StringBuilder(raw.length());
        int i = 0;
        while (amp >= 0) {
            out.append(raw, i, amp);
            int semi = raw.indexOf(';', amp + 1);
            if (semi < 0 || semi - amp - 1 > MAX_REFERENCE_LENGTH || semi == amp + 1) {
                throw new TokenizeException(TokenizeException.Reason.INVALID_CHARACTER_REFERENCE,
                        "Unterminated or empty entity reference", lines.at(baseOffset + amp));
            }
            String reference = raw.substring(amp + 1, semi);
            out.append(resolve(reference, baseOffset + amp, lines));
            i = semi + 1;
            amp = raw.indexOf('&', i);
        }
        out.append(raw, i, raw.length());
        return out.toString();
    }

    private static String resolve(String reference, int offset, LineIndex lines) {
        if (reference.charAt(0) != '#') {
            String value = PREDEFINED.get(reference);
            if (value == null) {
                throw new TokenizeException(TokenizeException.Reason.INVALID_CHARACTER_REFERENCE,
                        "Unknown entity reference '&" + reference + ";'", lines.at(offset));
            }
            return value;
        }

        boolean hex = reference.length() > 1 && (reference.charAt(1) == 'x' || reference.charAt(1) == 'X');
        String digits = reference.substring(hex ? 2 : 1);
        int codePoint;
        try {
            codePoint = digits.isEmpty() ? -1 : Integer.parseInt(digits, hex ? 16 : 10);
        } catch (NumberFormatException e) {
            codePoint = -1;
        }
        if (codePoint <= 0 || !Character.isValidCodePoint(codePoint)
                || (codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE)) {
            throw new TokenizeException(TokenizeException.Reason.INVALID_CHARACTER_REFERENCE,
                    "Invalid character reference '&" + reference + ";'", lines.at(offset));
        }
        return new String(Character.toChars(codePoint));
    }

    /**
     * Escapes text for use inside a double-quoted attribute value or element content.
     *
     * @param text the text to escape
     * @return the escaped text
     */
    public static String encode(String text) {
        StringBuilder out = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&apos;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
