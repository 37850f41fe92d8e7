package io.hearthwarrio.autoapply.core.navigation;

import io.hearthwarrio.autoapply.core.model.NavigationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Forward-only holder of the current navigation state of one job.
 * <p>
 * Every observation is recorded; the state itself only moves when the observation is later than the
 * current one, so the recorded history of {@link #current()} values never decreases.
 */
public final class NavigationStateTracker {

    private static final Logger log = LoggerFactory.getLogger(NavigationStateTracker.class);

    private NavigationState current = NavigationState.DESCRIPTION;
    private final List<NavigationState> history = new ArrayList<>();

    public NavigationStateTracker() {
        history.add(current);
    }

    public NavigationState current() {
        return current;
    }

    /**
     * @return the state after the observation
     */
    public NavigationState observe(NavigationState observed) {
        Objects.requireNonNull(observed, "observed must not be null");
        if (observed.isAfter(current)) {
            log.info("Navigation state {} -> {}", current, observed);
            current = observed;
        } else if (observed != current) {
            log.debug("Ignoring detector for {} while in {}", observed, current);
        }
        history.add(current);
        return current;
    }

    public boolean isSubmitted() {
        return current == NavigationState.SUBMITTED;
    }

    /**
     * States held after each observation, starting with the initial one.
     */
    public List<NavigationState> history() {
        return List.copyOf(history);
    }
}
