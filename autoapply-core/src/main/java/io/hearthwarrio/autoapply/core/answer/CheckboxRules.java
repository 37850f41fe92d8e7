package io.hearthwarrio.autoapply.core.answer;

import io.hearthwarrio.autoapply.core.config.KeywordTable;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.model.FieldDescriptor;
import io.hearthwarrio.autoapply.core.model.SearchKey;
import io.hearthwarrio.autoapply.core.model.SectionCategory;
import io.hearthwarrio.autoapply.core.model.SectionTag;
import io.hearthwarrio.autoapply.core.text.TextQuery;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Fixed answers for checkbox groups.
 * <p>
 * A present result is final: either the options to tick or a skip (the box must stay unticked).
 * Empty means no rule applied.
 */
public final class CheckboxRules {

    private static final Pattern YES_OR_AGREE = Pattern.compile("^(Yes|I agree)");
    private static final Pattern NO_DISABILITY_OPTION = Pattern.compile("^No, I do(n't| not)");

    private final KeywordTables tables;
    private final ProfileLookup lookup;

    public CheckboxRules(KeywordTables tables, ProfileLookup lookup) {
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
        this.lookup = Objects.requireNonNull(lookup, "lookup must not be null");
    }

    public Optional<Decision> decide(FieldDescriptor field, List<String> options) {
        SectionTag tag = field.getSection();
        if (tag != null && (tag.is(SectionCategory.WORK_EXPERIENCE) || tag.is(SectionCategory.EDUCATION))) {
            return Optional.of(statusBox(field, tag, options));
        }
        int count = options.size();
        if (count == 1) {
            if (matchesWs(field, KeywordTable.AGREEMENT_IDENTIFIERS)) {
                return Optional.of(Decision.select(options, Decision.RULE));
            }
            if (matchesWs(field, KeywordTable.PREFERRED_NAME_IDENTIFIERS)) {
                return Optional.of(Decision.skip("preferred name toggle"));
            }
        } else if (count == 2) {
            if (matchesWs(field, KeywordTable.AGREEMENT_IDENTIFIERS) && YES_OR_AGREE.matcher(options.get(0)).find()) {
                return Optional.of(Decision.select(options.get(0), Decision.RULE));
            }
        } else if (TextQuery.of(SearchKey.FIELD, tables.get(KeywordTable.DISABILITY_IDENTIFIERS)).matches(field)) {
            if (count == 3 && NO_DISABILITY_OPTION.matcher(options.get(1)).find()) {
                return Optional.of(Decision.select(options.get(1), Decision.RULE));
            }
            String preferred = lookup.profile().selfIdentification(ChoiceRules.DISABILITY);
            String best = OptionRanker.closest(options, preferred.isEmpty() ? ChoiceRules.NO_DISABILITY : preferred);
            if (best != null) {
                return Optional.of(Decision.select(best, Decision.RULE));
            }
        }
        return Optional.empty();
    }

    /**
     * "I currently work here" and "Graduated" / "Currently enrolled" boxes follow the profile entry.
     */
    private Decision statusBox(FieldDescriptor field, SectionTag tag, List<String> options) {
        if (options.isEmpty() || !ProfileLookup.isProfileSection(tag)) {
            return Decision.skip("no profile entry");
        }
        boolean flag = lookup.sectionFlag(field);
        boolean tick;
        if (tag.is(SectionCategory.WORK_EXPERIENCE)) {
            tick = flag;
        } else if (TextQuery.of(SearchKey.FIELD, tables.get(KeywordTable.CURRENT_ENROLLMENT_MARKERS)).matches(field)) {
            // the profile stores "graduated"; an enrollment box is its negation
            tick = !flag;
        } else {
            tick = flag;
        }
        return tick ? Decision.select(options.get(0), Decision.PROFILE) : Decision.skip("profile entry says unticked");
    }

    private boolean matchesWs(FieldDescriptor field, KeywordTable table) {
        return TextQuery.of(SearchKey.FIELD, tables.get(table)).normalizeWhitespace().matches(field);
    }
}
