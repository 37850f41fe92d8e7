package io.hearthwarrio.autoapply.core.strategy;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Tagged result of a {@link FirstSuccess} evaluation: either the value and the name of the strategy
 * that produced it, or nothing. Failed attempts are kept in evaluation order for diagnostics.
 */
public final class Outcome<O> {

    private final String strategy;
    private final O value;
    private final List<String> failures;

    private Outcome(String strategy, O value, List<String> failures) {
        this.strategy = strategy;
        this.value = value;
        this.failures = List.copyOf(failures);
    }

    static <O> Outcome<O> success(String strategy, O value, List<String> failures) {
        return new Outcome<>(strategy, value, failures);
    }

    static <O> Outcome<O> failure(List<String> failures) {
        return new Outcome<>(null, null, failures);
    }

    public boolean isSuccess() {
        return value != null;
    }

    public O value() {
        if (value == null) {
            throw new NoSuchElementException("no strategy succeeded: " + failures);
        }
        return value;
    }

    public Optional<O> toOptional() {
        return Optional.ofNullable(value);
    }

    /**
     * @return name of the strategy that produced the value, or null on failure
     */
    public String strategy() {
        return strategy;
    }

    /**
     * @return "name: reason" entries for every strategy that was tried and did not produce a value
     */
    public List<String> failures() {
        return failures;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Outcome{" + strategy + " -> " + value + "}" : "Outcome{failed " + failures + "}";
    }
}
