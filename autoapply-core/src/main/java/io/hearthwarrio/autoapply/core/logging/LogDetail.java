package io.hearthwarrio.autoapply.core.logging;

/**
 * Controls which data a {@link DecisionLogger} receives.
 */
public enum LogDetail {

    /**
     * Do not log decisions.
     */
    NONE,

    /**
     * Target, decision and source only.
     */
    DECISION_ONLY,

    /**
     * Also the locator used for the interaction.
     */
    WITH_LOCATOR,

    /**
     * Also the normalized field metadata.
     */
    FULL;

    public boolean includesLocator() {
        return this == WITH_LOCATOR || this == FULL;
    }
}
