package io.hearthwarrio.autoapply.core.answer;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of answer resolution for one field.
 * <p>
 * A decision is pure data: {@link FieldInteractor} turns it into browser actions.
 */
public final class Decision {

    public enum Kind {
        /**
         * Type a value.
         */
        VALUE,
        /**
         * Pick the named options.
         */
        SELECT,
        /**
         * Leave the field alone.
         */
        SKIP,
        /**
         * No deterministic answer; ask the oracle.
         */
        DEFER_TO_ORACLE
    }

    public static final String PROFILE = "profile";
    public static final String RULE = "rule";
    public static final String ORACLE = "oracle";

    private final Kind kind;
    private final String value;
    private final List<String> options;
    private final String source;

    private Decision(Kind kind, String value, List<String> options, String source) {
        this.kind = kind;
        this.value = value;
        this.options = List.copyOf(options);
        this.source = source;
    }

    public static Decision value(String value, String source) {
        Objects.requireNonNull(value, "value must not be null");
        return new Decision(Kind.VALUE, value, List.of(), source);
    }

    /**
     * @param options displayed option texts, in selection order
     */
    public static Decision select(List<String> options, String source) {
        Objects.requireNonNull(options, "options must not be null");
        if (options.isEmpty()) {
            throw new IllegalArgumentException("select needs at least one option");
        }
        return new Decision(Kind.SELECT, null, options, source);
    }

    public static Decision select(String option, String source) {
        return select(List.of(Objects.requireNonNull(option, "option must not be null")), source);
    }

    public static Decision skip(String reason) {
        return new Decision(Kind.SKIP, reason, List.of(), RULE);
    }

    /**
     * @param question question to ask, or null when none could be derived
     * @param options  candidate option texts; empty for a free-text answer
     */
    public static Decision deferToOracle(String question, List<String> options) {
        return new Decision(Kind.DEFER_TO_ORACLE, question, options == null ? List.of() : options, ORACLE);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Typed value for {@link Kind#VALUE}, skip reason for {@link Kind#SKIP}, question for
     * {@link Kind#DEFER_TO_ORACLE}; null otherwise.
     */
    public String value() {
        return value;
    }

    public List<String> options() {
        return options;
    }

    /**
     * First selected option; null unless {@link Kind#SELECT}.
     */
    public String option() {
        return options.isEmpty() ? null : options.get(0);
    }

    public String source() {
        return source;
    }

    public boolean isSkip() {
        return kind == Kind.SKIP;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Decision other)) {
            return false;
        }
        return kind == other.kind
                && Objects.equals(value, other.value)
                && options.equals(other.options)
                && Objects.equals(source, other.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, options, source);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case VALUE -> "value='" + value + "'";
            case SELECT -> "select=" + options;
            case SKIP -> "skip" + (value == null ? "" : " (" + value + ")");
            case DEFER_TO_ORACLE -> "oracle";
        };
    }
}
