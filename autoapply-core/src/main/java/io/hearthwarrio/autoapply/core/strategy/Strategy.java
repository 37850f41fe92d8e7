package io.hearthwarrio.autoapply.core.strategy;

import java.util.Optional;

/**
 * One way of producing a result. An empty result means "not applicable here, try the next one".
 */
@FunctionalInterface
public interface Strategy<I, O> {

    Optional<O> attempt(I input);
}
