package io.hearthwarrio.autoapply.core.answer;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.KeywordTable;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.config.Profile;
import io.hearthwarrio.autoapply.core.config.Setting;
import io.hearthwarrio.autoapply.core.model.FieldDescriptor;
import io.hearthwarrio.autoapply.core.model.SearchKey;
import io.hearthwarrio.autoapply.core.model.SectionCategory;
import io.hearthwarrio.autoapply.core.model.SectionSubtypes;
import io.hearthwarrio.autoapply.core.model.SectionTag;
import io.hearthwarrio.autoapply.core.strategy.FirstSuccess;
import io.hearthwarrio.autoapply.core.strategy.Outcome;
import io.hearthwarrio.autoapply.core.text.OptionMatcher;
import io.hearthwarrio.autoapply.core.text.OptionMatcher.RankedOption;
import io.hearthwarrio.autoapply.core.text.TextQuery;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Fixed answers for single-choice questions (radio groups, dropdowns, dynamic lists).
 * <p>
 * Rules depend on the number of options: one (agreement), two (yes/no tables), three (yes/no/decline,
 * disability, Hispanic or Latino) and more than three (demographics, country, citizenship). Rules that do not
 * depend on the option count follow: education entries, location, phone type, salary, relocation.
 * Every rule yields the displayed text of the chosen option.
 */
public final class ChoiceRules {

    public static final String GENDER = "Gender";
    public static final String SEXUAL_ORIENTATION = "Sexual Orientation";
    public static final String ETHNICITY = "Ethnicity";
    public static final String VETERAN_STATUS = "Veteran Status";
    public static final String DISABILITY = "Disability";
    public static final String HISPANIC_OR_LATINO = "Hispanic or Latino";
    public static final String CITIZENSHIP = "Citizenship";

    static final String NO_DISABILITY = "No, I do not have a disability and have not had one in the past";
    static final String OTHER_OPTION = "Other";

    private static final Pattern YES = Pattern.compile("^Yes");
    private static final Pattern YES_OR_AGREE = Pattern.compile("^(Yes|I agree)");
    private static final Pattern NO = Pattern.compile("^No");
    private static final Pattern NO_DISABILITY_OPTION = Pattern.compile("^No, I do(n't| not)");

    private final KeywordTables tables;
    private final Profile profile;
    private final int schoolClosest;
    private final FirstSuccess<ChoiceQuestion, String> chain;

    public ChoiceRules(KeywordTables tables, Profile profile, AutofillSettings settings) {
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
        this.profile = Objects.requireNonNull(profile, "profile must not be null");
        this.schoolClosest = Objects.requireNonNull(settings, "settings must not be null")
                .getInt(Setting.SCHOOL_CLOSEST_SIMILARITY);
        this.chain = FirstSuccess.<ChoiceQuestion, String>named("single choice rules")
                .then("single option", this::singleOption)
                .then("paired options", this::pairedOptions)
                .then("three options", this::threeOptions)
                .then("many options", this::manyOptions)
                .then("education entry", this::education)
                .then("location and contact", this::locationAndContact)
                .then("employment and relocation", this::employmentAndRelocation);
    }

    /**
     * @param options displayed option texts in page order
     * @return the chosen option text and the rule that chose it; a failed outcome defers to the oracle
     */
    public Outcome<String> choose(FieldDescriptor field, List<String> options) {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(options, "options must not be null");
        return chain.evaluate(new ChoiceQuestion(field, options));
    }

    /**
     * Deterministic match against a partial option list, for lists that load options while scrolling:
     * exact profile values and configured aliases only, never a closest guess.
     */
    public Optional<String> progressive(FieldDescriptor field, List<String> options) {
        SectionTag tag = field.getSection();
        if (tag != null && tag.is(SectionCategory.EDUCATION) && ProfileLookup.isProfileSection(tag)) {
            String subtype = tag.getSubtype();
            String value = profile.entryValue(tag.getCategory(), tag.getOrdinal(), subtype);
            if (!value.isEmpty() && options.contains(value)) {
                return Optional.of(value);
            }
            if (SectionSubtypes.DEGREE.equals(subtype) || SectionSubtypes.FIELD_OF_STUDY.equals(subtype)) {
                List<String> aliases = profile.entryList(tag.getCategory(), tag.getOrdinal(), subtype + " Aliases");
                OptionalInt idx = OptionMatcher.findMatchingOption(aliases, options, true, true, false);
                if (idx.isPresent()) {
                    return Optional.of(options.get(idx.getAsInt()));
                }
            }
            return Optional.empty();
        }
        for (String key : List.of(Profile.CITY, Profile.STATE, Profile.COUNTRY)) {
            if (labelIs(field, key)) {
                String value = profile.text(key);
                return options.contains(value) ? Optional.of(value) : Optional.empty();
            }
        }
        return Optional.empty();
    }

    private Optional<String> singleOption(ChoiceQuestion q) {
        if (q.size() == 1 && q.matchesWs(KeywordTable.AGREEMENT_IDENTIFIERS, SearchKey.FIELD)) {
            return q.option(0);
        }
        return Optional.empty();
    }

    private Optional<String> pairedOptions(ChoiceQuestion q) {
        if (q.size() != 2) {
            return Optional.empty();
        }
        if (q.matchesWs(KeywordTable.AGREEMENT_IDENTIFIERS, SearchKey.FIELD) && YES_OR_AGREE.matcher(q.text(0)).find()) {
            return q.option(0);
        }
        if (!q.isYesNo()) {
            return Optional.empty();
        }
        if (q.matchesWs(KeywordTable.PAIRED_YES_QUESTIONS, SearchKey.LABELS)) {
            return q.option(0);
        }
        if (q.matchesWs(KeywordTable.PAIRED_NO_QUESTIONS, SearchKey.LABELS)) {
            return q.option(1);
        }
        if (q.matchesWs(KeywordTable.WORK_AUTHORIZATION_QUESTIONS, SearchKey.LABELS)) {
            return q.matchesWs(KeywordTable.WORK_AUTHORIZATION_NEGATIONS, SearchKey.LABELS) ? q.option(1) : q.option(0);
        }
        return Optional.empty();
    }

    private Optional<String> threeOptions(ChoiceQuestion q) {
        if (q.size() != 3) {
            return Optional.empty();
        }
        if (q.isYesNo() && q.matchesWs(KeywordTable.TRIPLE_NO_QUESTIONS, SearchKey.LABELS)) {
            return q.option(1);
        }
        if (q.matches(KeywordTable.DISABILITY_IDENTIFIERS, SearchKey.FIELD)) {
            if (NO_DISABILITY_OPTION.matcher(q.text(1)).find()) {
                return q.option(1);
            }
            return closest(q.options, preferred(DISABILITY, NO_DISABILITY));
        }
        if (q.matches(KeywordTable.HISPANIC_IDENTIFIERS, SearchKey.FIELD)) {
            if (NO.matcher(q.text(1)).find()) {
                return q.option(1);
            }
            OptionalInt idx = OptionMatcher.findMatchingOption(List.of("No"), q.options, true, false, false);
            if (idx.isEmpty()) {
                idx = OptionMatcher.findMatchingOption(List.of("Not hispanic or"), q.options);
            }
            return idx.isPresent() ? q.option(idx.getAsInt()) : Optional.empty();
        }
        return Optional.empty();
    }

    private Optional<String> manyOptions(ChoiceQuestion q) {
        if (q.size() <= 3) {
            return Optional.empty();
        }
        if (q.matches(KeywordTable.GENDER_IDENTIFIERS, SearchKey.FIELD)) {
            // exact, so that "Male" never picks "Female"
            return selfIdentified(q, GENDER, true);
        }
        if (q.matches(KeywordTable.SEXUAL_ORIENTATION_IDENTIFIERS, SearchKey.FIELD)) {
            return selfIdentified(q, SEXUAL_ORIENTATION, false);
        }
        if (q.matches(KeywordTable.ETHNICITY_IDENTIFIERS, SearchKey.FIELD)) {
            return selfIdentified(q, ETHNICITY, false);
        }
        if (q.matches(KeywordTable.VETERAN_IDENTIFIERS, SearchKey.FIELD)) {
            return selfIdentified(q, VETERAN_STATUS, true);
        }
        if (q.matches(KeywordTable.COUNTRY_IDENTIFIERS, SearchKey.FIELD)) {
            return exactOrContained(q, profile.text(Profile.COUNTRY), true);
        }
        if (TextQuery.of(SearchKey.FIELD, tables.get(KeywordTable.CITIZENSHIP_IDENTIFIERS_CASE_SENSITIVE))
                .caseSensitive().matches(q.field)) {
            return exactOrContained(q, profile.selfIdentification(CITIZENSHIP), false);
        }
        return Optional.empty();
    }

    private Optional<String> education(ChoiceQuestion q) {
        SectionTag tag = q.field.getSection();
        if (tag == null || !tag.is(SectionCategory.EDUCATION) || !ProfileLookup.isProfileSection(tag)) {
            return Optional.empty();
        }
        String value = profile.entryValue(tag.getCategory(), tag.getOrdinal(), tag.getSubtype());
        if (value.isEmpty()) {
            return Optional.empty();
        }
        if (q.options.contains(value)) {
            return Optional.of(value);
        }
        String subtype = tag.getSubtype();
        if (SectionSubtypes.SCHOOL.equals(subtype)) {
            RankedOption<String> best = OptionMatcher.closest(OptionRanker.asMap(q.options), value);
            if (best != null && best.similarity() > schoolClosest) {
                return Optional.of(best.text());
            }
            return closest(q.options, OTHER_OPTION);
        }
        if (SectionSubtypes.DEGREE.equals(subtype) || SectionSubtypes.FIELD_OF_STUDY.equals(subtype)) {
            return closest(q.options, value);
        }
        return Optional.empty();
    }

    private Optional<String> locationAndContact(ChoiceQuestion q) {
        if (labelIs(q.field, Profile.CITY)) {
            return closest(q.options, profile.text(Profile.CITY));
        }
        if (labelIs(q.field, Profile.STATE)) {
            return closest(q.options, profile.text(Profile.STATE));
        }
        if (q.matchesWs(KeywordTable.PHONE_TYPE_IDENTIFIERS, SearchKey.LABELS)) {
            return closest(q.options, profile.text(Profile.PHONE_DEVICE_TYPE));
        }
        if (q.matchesWs(KeywordTable.COUNTRY_TERRITORY_IDENTIFIERS, SearchKey.FIELD) || labelIs(q.field, Profile.COUNTRY)) {
            return closest(q.options, profile.text(Profile.COUNTRY));
        }
        return Optional.empty();
    }

    private Optional<String> employmentAndRelocation(ChoiceQuestion q) {
        if (q.matches(KeywordTable.EMPLOYED_BY_IDENTIFIERS, SearchKey.FIELD)
                && q.matches(KeywordTable.SUBSIDIARY_IDENTIFIERS, SearchKey.FIELD)) {
            OptionalInt idx = OptionMatcher.findMatchingOption(List.of("No"), q.options, false, false, true);
            return idx.isPresent() ? q.option(idx.getAsInt()) : Optional.empty();
        }
        if (q.matches(KeywordTable.SALARY_IDENTIFIERS, SearchKey.FIELD_AND_PLACEHOLDER)
                && q.matches(KeywordTable.SALARY_EXPECTATION_MARKERS, SearchKey.FIELD_AND_PLACEHOLDER)) {
            return closest(q.options, profile.text(Profile.SALARY_EXPECTATION));
        }
        if (q.matches(KeywordTable.RELOCATION_IDENTIFIERS, SearchKey.FIELD)
                && !q.matches(KeywordTable.RELOCATION_EXCLUSIONS, SearchKey.LABELS)) {
            for (int i = 0; i < q.size(); i++) {
                if (YES.matcher(q.text(i)).find()) {
                    return q.option(i);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * The profile's self-identification answer, or a "decline to answer" option when the profile has none.
     */
    private Optional<String> selfIdentified(ChoiceQuestion q, String key, boolean exact) {
        String preferred = profile.selfIdentification(key);
        if (!preferred.isEmpty()) {
            return exactOrContained(q, preferred, exact);
        }
        OptionalInt idx = OptionMatcher.findMatchingOption(tables.get(KeywordTable.DECLINE_ANSWERS), q.options);
        return idx.isPresent() ? q.option(idx.getAsInt()) : Optional.empty();
    }

    private static Optional<String> exactOrContained(ChoiceQuestion q, String answer, boolean exact) {
        if (answer.isEmpty()) {
            return Optional.empty();
        }
        OptionalInt idx = OptionMatcher.findMatchingOption(List.of(answer), q.options, exact, false, false);
        return idx.isPresent() ? q.option(idx.getAsInt()) : Optional.empty();
    }

    private String preferred(String key, String fallback) {
        String v = profile.selfIdentification(key);
        return v.isEmpty() ? fallback : v;
    }

    private boolean labelIs(FieldDescriptor field, String profileKey) {
        KeywordTable table = switch (profileKey) {
            case Profile.CITY -> KeywordTable.CITY_LABEL_IDENTIFIERS_CASE_SENSITIVE;
            case Profile.STATE -> KeywordTable.STATE_LABEL_IDENTIFIERS_CASE_SENSITIVE;
            default -> KeywordTable.COUNTRY_LABEL_IDENTIFIERS_CASE_SENSITIVE;
        };
        return TextQuery.of(SearchKey.LABELS, tables.get(table)).caseSensitive().normalizeWhitespace().matches(field);
    }

    private static Optional<String> closest(List<String> options, String target) {
        if (target == null || target.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(OptionRanker.closest(options, target));
    }

    private final class ChoiceQuestion {

        private final FieldDescriptor field;
        private final List<String> options;

        ChoiceQuestion(FieldDescriptor field, List<String> options) {
            this.field = field;
            this.options = List.copyOf(options);
        }

        int size() {
            return options.size();
        }

        String text(int i) {
            return options.get(i);
        }

        Optional<String> option(int i) {
            return Optional.of(options.get(i));
        }

        boolean isYesNo() {
            return options.size() >= 2 && YES.matcher(options.get(0)).find() && NO.matcher(options.get(1)).find();
        }

        boolean matches(KeywordTable table, List<SearchKey> keys) {
            return TextQuery.of(keys, tables.get(table)).matches(field);
        }

        boolean matchesWs(KeywordTable table, List<SearchKey> keys) {
            return TextQuery.of(keys, tables.get(table)).normalizeWhitespace().matches(field);
        }
    }
}
