package io.hearthwarrio.autoapply.core.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered list of named strategies evaluated until the first one yields a value.
 * <p>
 * A strategy that throws a {@link RuntimeException} counts as failed; the exception is logged and
 * recorded in the {@link Outcome}, and evaluation moves on. Instances are immutable and can be shared.
 *
 * @param <I> input type
 * @param <O> result type
 */
public final class FirstSuccess<I, O> implements Strategy<I, O> {

    private static final Logger log = LoggerFactory.getLogger(FirstSuccess.class);

    private final String chainName;
    private final List<String> names;
    private final List<Strategy<I, O>> strategies;

    private FirstSuccess(String chainName, List<String> names, List<Strategy<I, O>> strategies) {
        this.chainName = chainName;
        this.names = Collections.unmodifiableList(names);
        this.strategies = Collections.unmodifiableList(strategies);
    }

    public static <I, O> FirstSuccess<I, O> named(String chainName) {
        return new FirstSuccess<>(Objects.requireNonNull(chainName, "chainName must not be null"),
                new ArrayList<>(), new ArrayList<>());
    }

    /**
     * Returns a new chain with the strategy appended.
     */
    public FirstSuccess<I, O> then(String name, Strategy<I, O> strategy) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        List<String> n = new ArrayList<>(names);
        List<Strategy<I, O>> s = new ArrayList<>(strategies);
        n.add(name);
        s.add(strategy);
        return new FirstSuccess<>(chainName, n, s);
    }

    public List<String> strategyNames() {
        return names;
    }

    public Outcome<O> evaluate(I input) {
        List<String> failures = new ArrayList<>();
        for (int i = 0; i < strategies.size(); i++) {
            String name = names.get(i);
            try {
                Optional<O> result = strategies.get(i).attempt(input);
                if (result != null && result.isPresent()) {
                    log.debug("{}: '{}' succeeded", chainName, name);
                    return Outcome.success(name, result.get(), failures);
                }
                failures.add(name + ": no result");
            } catch (RuntimeException e) {
                log.debug("{}: '{}' failed", chainName, name, e);
                failures.add(name + ": " + e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
        log.debug("{}: every strategy failed {}", chainName, failures);
        return Outcome.failure(failures);
    }

    @Override
    public Optional<O> attempt(I input) {
        return evaluate(input).toOptional();
    }
}
