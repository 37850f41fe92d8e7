package io.hearthwarrio.autoapply.core.model;

/**
 * Coarse phase of an application flow. Declaration order is the only allowed direction of travel;
 * {@link #DESCRIPTION} is the base state of every job.
 */
public enum NavigationState {
    DESCRIPTION,
    AUTH,
    LOGGED_IN,
    SUBMITTED;

    public boolean isAfter(NavigationState other) {
        return compareTo(other) > 0;
    }
}
