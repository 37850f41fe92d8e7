package io.hearthwarrio.autoapply.core.answer;

import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.config.Profile;
import io.hearthwarrio.autoapply.core.config.ProfileFieldRule;
import io.hearthwarrio.autoapply.core.model.FieldDescriptor;
import io.hearthwarrio.autoapply.core.model.SectionCategory;
import io.hearthwarrio.autoapply.core.model.SectionSubtypes;
import io.hearthwarrio.autoapply.core.model.SectionTag;
import io.hearthwarrio.autoapply.core.text.TextQuery;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Deterministic answers straight from the profile: section entries by ordinal and subtype, then
 * contact values by the loadable {@link ProfileFieldRule}s.
 */
public final class ProfileLookup {

    private final Profile profile;
    private final List<ProfileFieldRule> rules;

    public ProfileLookup(Profile profile, KeywordTables tables) {
        this.profile = Objects.requireNonNull(profile, "profile must not be null");
        this.rules = Objects.requireNonNull(tables, "tables must not be null").profileFieldRules();
    }

    public Profile profile() {
        return profile;
    }

    /**
     * Value of the profile entry the field's section tag points at.
     */
    public Optional<String> sectionValue(FieldDescriptor field) {
        SectionTag tag = field.getSection();
        if (!isProfileSection(tag)) {
            return Optional.empty();
        }
        String v = profile.entryValue(tag.getCategory(), tag.getOrdinal(), tag.getSubtype());
        return v.isEmpty() ? Optional.empty() : Optional.of(v);
    }

    public boolean sectionFlag(FieldDescriptor field) {
        SectionTag tag = field.getSection();
        return isProfileSection(tag) && profile.entryFlag(tag.getCategory(), tag.getOrdinal(), tag.getSubtype());
    }

    /**
     * Contact value for a free-text field.
     *
     * @return a value, a skip (optional field not worth filling), or empty when no rule applies
     */
    public Optional<Decision> contactValue(FieldDescriptor field) {
        for (ProfileFieldRule rule : rules) {
            if (!applies(rule, field)) {
                continue;
            }
            if (!field.isRequired() && matchesAny(rule, field, rule.getSkipWhenOptionalAnd())) {
                return Optional.of(Decision.skip("optional " + rule.getProfileKey() + " variant"));
            }
            String v = profile.text(rule.getProfileKey());
            if (v.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(Decision.value(v, Decision.PROFILE));
        }
        return Optional.empty();
    }

    static boolean isProfileSection(SectionTag tag) {
        return tag != null
                && tag.getCategory().isProfileBacked()
                && tag.getOrdinal() >= 1
                && tag.getSubtype() != null
                && !tag.getSubtype().isEmpty();
    }

    private static boolean applies(ProfileFieldRule rule, FieldDescriptor field) {
        if (rule.isRequiredOnly() && !field.isRequired()) {
            return false;
        }
        boolean typeMatch = !rule.getFieldType().isEmpty() && rule.getFieldType().equals(field.getType().code());
        boolean textMatch = TextQuery.of(rule.getKeys(), rule.getIdentifiers())
                .caseSensitive(rule.isCaseSensitive())
                .normalizeWhitespace(rule.isNormalizeWhitespace())
                .exact(rule.isExact())
                .matches(field);
        if (!typeMatch && !textMatch) {
            return false;
        }
        if (matchesAny(rule, field, rule.getVetoes())) {
            return false;
        }
        return rule.getAlsoRequires().isEmpty() || matchesAny(rule, field, rule.getAlsoRequires());
    }

    private static boolean matchesAny(ProfileFieldRule rule, FieldDescriptor field, List<String> words) {
        return !words.isEmpty() && TextQuery.of(rule.getKeys(), words).matches(field);
    }

    /**
     * True for work-experience or education fields; used to keep section answers away from the oracle.
     */
    public static boolean inProfileSection(FieldDescriptor field) {
        SectionTag tag = field.getSection();
        return tag != null && (tag.is(SectionCategory.WORK_EXPERIENCE) || tag.is(SectionCategory.EDUCATION));
    }

    /**
     * What to type into a searchable education list (school, degree, field of study), and what it should surface.
     */
    public OptionCollector.SearchPlan searchPlan(FieldDescriptor field) {
        SectionTag tag = field.getSection();
        if (tag == null || !tag.is(SectionCategory.EDUCATION) || !isProfileSection(tag)) {
            return OptionCollector.SearchPlan.none();
        }
        String subtype = tag.getSubtype();
        if (!SectionSubtypes.SCHOOL.equals(subtype) && !SectionSubtypes.DEGREE.equals(subtype)
                && !SectionSubtypes.FIELD_OF_STUDY.equals(subtype)) {
            return OptionCollector.SearchPlan.none();
        }
        List<String> expected = new ArrayList<>();
        String value = profile.entryValue(tag.getCategory(), tag.getOrdinal(), subtype);
        if (!value.isEmpty()) {
            expected.add(value);
        }
        expected.addAll(profile.entryList(tag.getCategory(), tag.getOrdinal(), subtype + " Aliases"));
        return OptionCollector.SearchPlan.of(profile.searchTerms(tag.getCategory(), tag.getOrdinal(), subtype), expected);
    }
}
