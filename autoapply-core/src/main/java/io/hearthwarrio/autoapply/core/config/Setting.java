package io.hearthwarrio.autoapply.core.config;

/**
 * Named, overridable tuning values. Defaults live in {@code autoapply-defaults.json}.
 */
public enum Setting {
    /**
     * Tag-derived and text-derived labels at or above this similarity are treated as one label.
     */
    LABEL_SIMILARITY("labelSimilarity"),
    /**
     * Radio/checkbox items whose ids are at least this similar belong to one group.
     */
    MERGE_ID_SIMILARITY("mergeIdSimilarity"),
    /**
     * Oracle ranking: every option at or above this score is selected.
     */
    ORACLE_HIGH_SIMILARITY("oracleHighSimilarity"),
    ORACLE_MID_SIMILARITY("oracleMidSimilarity"),
    /**
     * Oracle ranking: below this score an optional field is skipped.
     */
    ORACLE_FLOOR_SIMILARITY("oracleFloorSimilarity"),
    SCHOOL_CLOSEST_SIMILARITY("schoolClosestSimilarity"),
    SEARCH_CANDIDATE_SIMILARITY("searchCandidateSimilarity"),
    FALSE_ANSWER_SIMILARITY("falseAnswerSimilarity"),
    /**
     * Share of interactive fingerprints that must survive a click for the page to count as unchanged.
     */
    PRESERVED_RATIO("preservedRatio"),
    ORACLE_TOP_K("oracleTopK"),
    MULTISELECT_MAX_LEVELS("multiselectMaxLevels"),
    NAVIGATION_MAX_DEPTH("navigationMaxDepth"),
    PARENT_FALLBACK_LEVELS("parentFallbackLevels"),
    ASSOCIATED_TEXT_MAX_LEVELS("associatedTextMaxLevels"),
    SECTION_LABEL_MAX_WORDS("sectionLabelMaxWords"),
    DATE_LABEL_MAX_WORDS("dateLabelMaxWords"),
    JOB_MAX_ITERATIONS("jobMaxIterations"),
    JOB_MAX_MINUTES("jobMaxMinutes"),
    INTERACTION_TIMEOUT_SECONDS("interactionTimeoutSeconds"),
    STABLE_DOM_TIMEOUT_SECONDS("stableDomTimeoutSeconds"),
    STABLE_DOM_PADDING_SECONDS("stableDomPaddingSeconds"),
    VERIFICATION_WAIT_SECONDS("verificationWaitSeconds"),
    WORKER_COUNT("workerCount"),
    QUEUE_POLL_SECONDS("queuePollSeconds");

    private final String key;

    Setting(String key) {
        this.key = key;
    }

    /**
     * JSON key, also used as the {@code autoapply.<key>} system property suffix.
     */
    public String key() {
        return key;
    }
}
