package io.hearthwarrio.autoapply.core.extract;

import io.hearthwarrio.autoapply.core.config.Profile;
import io.hearthwarrio.autoapply.core.model.SectionCategory;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Running counters of one extraction pass. Created fresh by every {@link PageExtractor#parse()} call
 * and threaded through the classifiers; never shared between passes or sessions.
 */
public final class ParseContext {

    private final Map<SectionCategory, Integer> limits = new EnumMap<>(SectionCategory.class);
    private final Map<SectionCategory, List<String>> primaryIdentifiers = new EnumMap<>(SectionCategory.class);
    private final Map<SectionCategory, Integer> primaryCounters = new EnumMap<>(SectionCategory.class);
    private final Map<SectionCategory, Map<String, Integer>> subtypeCounters = new EnumMap<>(SectionCategory.class);
    private SectionCategory lastSection;
    private int verificationDigits;
    private final boolean namespaced;

    public ParseContext(Profile profile, boolean namespaced) {
        Objects.requireNonNull(profile, "profile must not be null");
        for (SectionCategory c : SectionCategory.values()) {
            if (c.isProfileBacked()) {
                limits.put(c, profile.entryCount(c));
            }
        }
        this.namespaced = namespaced;
    }

    public boolean isNamespaced() {
        return namespaced;
    }

    /**
     * Number of profile entries for the category; 0 for categories the profile does not back.
     */
    public int limit(SectionCategory category) {
        return limits.getOrDefault(category, 0);
    }

    public List<String> primaryIdentifiers(SectionCategory category) {
        return primaryIdentifiers.get(category);
    }

    /**
     * Fixes which identifier set opens a new section of the category. Only the first call per category counts.
     */
    public void choosePrimary(SectionCategory category, List<String> identifiers) {
        primaryIdentifiers.putIfAbsent(category, List.copyOf(identifiers));
    }

    public void openSection(SectionCategory category) {
        primaryCounters.merge(category, 1, Integer::sum);
        lastSection = category;
    }

    public int primaryOrdinal(SectionCategory category) {
        return primaryCounters.getOrDefault(category, 0);
    }

    public SectionCategory lastSection() {
        return lastSection;
    }

    public int subtypeCount(SectionCategory category, String subtype) {
        return subtypeCounters.getOrDefault(category, Map.of()).getOrDefault(subtype, 0);
    }

    /**
     * Counts one more field of the subtype unless the profile has no entry left for it.
     *
     * @return the new 1-based ordinal, or 0 when the cap is reached
     */
    public int claim(SectionCategory category, String subtype) {
        int current = subtypeCount(category, subtype);
        if (current >= limit(category)) {
            return 0;
        }
        subtypeCounters.computeIfAbsent(category, c -> new HashMap<>()).put(subtype, current + 1);
        return current + 1;
    }

    public int nextVerificationDigit() {
        return ++verificationDigits;
    }

    public int verificationDigits() {
        return verificationDigits;
    }
}
