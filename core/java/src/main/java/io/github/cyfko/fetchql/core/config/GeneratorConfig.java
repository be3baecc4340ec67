package io.github.cyfko.fetchql.core.config;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Settings of the SQL generator.
 * <ul>
 *   <li><strong>clock</strong>: the "now" relative-date operators are resolved against (default: system UTC clock)</li>
 *   <li><strong>outputZone</strong>: zone date literals are printed in and day boundaries are computed in (default: UTC)</li>
 *   <li><strong>sourceZone</strong>: zone of date literals written without an offset (default: UTC)</li>
 *   <li><strong>limitStyle</strong>: {@code TOP n} or trailing {@code LIMIT n} (default: TOP)</li>
 * </ul>
 *
 * <pre>{@code
 * GeneratorConfig config = GeneratorConfig.builder()
 *     .clock(Clock.fixed(Instant.parse("2024-03-10T12:00:00Z"), ZoneOffset.UTC))
 *     .limitStyle(LimitStyle.LIMIT)
 *     .build();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class GeneratorConfig {

    private final Clock clock;
    private final ZoneId outputZone;
    private final ZoneId sourceZone;
    private final LimitStyle limitStyle;

    private GeneratorConfig(Builder builder) {
        this.clock = builder.clock;
        this.outputZone = builder.outputZone;
        this.sourceZone = builder.sourceZone;
        this.limitStyle = builder.limitStyle;
    }

    public static GeneratorConfig defaults() { return builder().build(); }

    public static Builder builder() { return new Builder(); }

    public Clock getClock() { return clock; }
    public ZoneId getOutputZone() { return outputZone; }
    public ZoneId getSourceZone() { return sourceZone; }
    public LimitStyle getLimitStyle() { return limitStyle; }

    public static final class Builder {
        private Clock clock = Clock.systemUTC();
        private ZoneId outputZone = ZoneOffset.UTC;
        private ZoneId sourceZone = ZoneOffset.UTC;
        private LimitStyle limitStyle = LimitStyle.TOP;

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder outputZone(ZoneId zone) {
            this.outputZone = Objects.requireNonNull(zone, "outputZone");
            return this;
        }

        public Builder sourceZone(ZoneId zone) {
            this.sourceZone = Objects.requireNonNull(zone, "sourceZone");
            return this;
        }

        public Builder limitStyle(LimitStyle style) {
            this.limitStyle = Objects.requireNonNull(style, "limitStyle");
            return this;
        }

        public GeneratorConfig build() { return new GeneratorConfig(this); }
    }
}
