package io.hearthwarrio.autoapply.core.extract;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.KeywordTable;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.config.Setting;
import io.hearthwarrio.autoapply.core.model.FieldDescriptor;
import io.hearthwarrio.autoapply.core.model.FieldType;
import io.hearthwarrio.autoapply.core.model.LabelSource;
import io.hearthwarrio.autoapply.core.model.SearchKey;
import io.hearthwarrio.autoapply.core.model.SectionCategory;
import io.hearthwarrio.autoapply.core.model.SectionSubtypes;
import io.hearthwarrio.autoapply.core.model.SectionTag;
import io.hearthwarrio.autoapply.core.text.TextCleaner;
import io.hearthwarrio.autoapply.core.text.TextQuery;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Assigns work-experience and education fields to numbered sections.
 * <p>
 * The first job-title (or company) field seen fixes what opens a new work section, likewise school (or degree)
 * for education. Each subtype is counted on its own and capped at the number of matching profile entries;
 * a field past the cap is dropped rather than tied to an entry that does not exist.
 */
public final class SectionGrouper {

    private static final Logger log = LoggerFactory.getLogger(SectionGrouper.class);

    private static final Set<FieldType> NOT_SECTION_OPENERS =
            EnumSet.of(FieldType.RADIO, FieldType.CHECKBOX, FieldType.TEXTAREA, FieldType.DATE, FieldType.DATELIST);

    private static final int STATUS_LABEL_WORDS = 8;

    private final KeywordTables tables;
    private final int maxLabelWords;

    public SectionGrouper(KeywordTables tables, AutofillSettings settings) {
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
        this.maxLabelWords = Objects.requireNonNull(settings, "settings must not be null").getInt(Setting.SECTION_LABEL_MAX_WORDS);
    }

    /**
     * Whether the field's tag (or text) label is short enough to be a section caption.
     */
    public boolean labelWithinLimit(FieldDescriptor field) {
        String label = field.label(LabelSource.TAG);
        if (label.isEmpty()) {
            label = field.label(LabelSource.TEXT);
        }
        return TextCleaner.wordCount(label) <= maxLabelWords;
    }

    /**
     * Tags the field with its section, when it has one.
     *
     * @return false when the field must be dropped: its subtype is already used up or it is hidden
     */
    public boolean classify(FieldDescriptor field, Element element, ParseContext context) {
        if (!labelWithinLimit(field)) {
            return true;
        }
        choosePrimary(field, context, SectionCategory.WORK_EXPERIENCE,
                KeywordTable.JOB_TITLE_IDENTIFIERS, KeywordTable.COMPANY_IDENTIFIERS);
        choosePrimary(field, context, SectionCategory.EDUCATION,
                KeywordTable.SCHOOL_IDENTIFIERS, KeywordTable.DEGREE_IDENTIFIERS);

        boolean opener = !NOT_SECTION_OPENERS.contains(field.getType());
        if (context.primaryIdentifiers(SectionCategory.WORK_EXPERIENCE) != null
                && !classifyWork(field, element, context, opener)) {
            return false;
        }
        if (context.primaryIdentifiers(SectionCategory.EDUCATION) != null
                && !classifyEducation(field, context, opener)) {
            return false;
        }
        return true;
    }

    private boolean classifyWork(FieldDescriptor field, Element element, ParseContext context, boolean opener) {
        SectionCategory work = SectionCategory.WORK_EXPERIENCE;
        if (opener && query(context.primaryIdentifiers(work)).matches(field)) {
            context.openSection(work);
        }
        if (opener && matches(field, KeywordTable.JOB_TITLE_IDENTIFIERS)) {
            return claim(field, context, work, SectionSubtypes.JOB_TITLE);
        }
        if (opener && matches(field, KeywordTable.COMPANY_IDENTIFIERS)) {
            return claim(field, context, work, SectionSubtypes.COMPANY);
        }
        if (opener && matches(field, KeywordTable.LOCATION_IDENTIFIERS)) {
            if (isWorkLocation(field, element)) {
                return claim(field, context, work, SectionSubtypes.LOCATION);
            }
            return true;
        }
        if (matches(field, KeywordTable.CURRENTLY_WORKING_IDENTIFIERS)
                && field.getType() == FieldType.CHECKBOX
                && context.lastSection() == work
                && shortLabels(field)) {
            return claim(field, context, work, SectionSubtypes.CURRENTLY_WORKING);
        }
        if (matches(field, KeywordTable.ROLE_DESCRIPTION_IDENTIFIERS)
                && ("textarea".equals(field.getTagName()) || (field.getType() == FieldType.TEXT && !field.isRequired()))) {
            return claim(field, context, work, SectionSubtypes.ROLE_DESCRIPTION);
        }
        return true;
    }

    private boolean classifyEducation(FieldDescriptor field, ParseContext context, boolean opener) {
        SectionCategory edu = SectionCategory.EDUCATION;
        if (opener && query(context.primaryIdentifiers(edu)).matches(field)) {
            context.openSection(edu);
        }
        if (opener && matches(field, KeywordTable.SCHOOL_IDENTIFIERS)) {
            return claim(field, context, edu, SectionSubtypes.SCHOOL);
        }
        if (opener && matches(field, KeywordTable.DEGREE_IDENTIFIERS)) {
            return claim(field, context, edu, SectionSubtypes.DEGREE);
        }
        if (opener && matches(field, KeywordTable.FIELD_OF_STUDY_IDENTIFIERS)) {
            return claim(field, context, edu, SectionSubtypes.FIELD_OF_STUDY);
        }
        if (opener && matches(field, KeywordTable.GRADE_IDENTIFIERS)) {
            return claim(field, context, edu, SectionSubtypes.GRADE);
        }
        if (matches(field, KeywordTable.CURRENTLY_ENROLLED_IDENTIFIERS)
                && field.getType() == FieldType.CHECKBOX
                && context.lastSection() == edu
                && shortLabels(field)) {
            return claim(field, context, edu, SectionSubtypes.GRADUATED);
        }
        return true;
    }

    private void choosePrimary(FieldDescriptor field, ParseContext context, SectionCategory category,
                               KeywordTable first, KeywordTable second) {
        if (context.primaryIdentifiers(category) != null) {
            return;
        }
        if (matches(field, first)) {
            context.choosePrimary(category, tables.get(first));
        } else if (matches(field, second)) {
            context.choosePrimary(category, tables.get(second));
        }
    }

    private boolean claim(FieldDescriptor field, ParseContext context, SectionCategory category, String subtype) {
        if (field.getType() == FieldType.HIDDEN) {
            return false;
        }
        int ordinal = context.claim(category, subtype);
        if (ordinal == 0) {
            log.debug("Dropping {}: no {} entry left for '{}'", field, category.label(), subtype);
            return false;
        }
        field.setSection(SectionTag.of(category, ordinal, subtype));
        return true;
    }

    private boolean isWorkLocation(FieldDescriptor field, Element element) {
        boolean idSaysWork = TextQuery.of(List.of(SearchKey.ID, SearchKey.CUSTOM_ID), List.of("work"))
                .normalizeWhitespace().matches(field);
        return idSaysWork
                || ElementAttributes.searchValue(element, tables.get(KeywordTable.WORK_LOCATION_MARKERS)).isPresent();
    }

    private static boolean shortLabels(FieldDescriptor field) {
        for (LabelSource s : new LabelSource[]{LabelSource.TAG, LabelSource.TEXT, LabelSource.ATTRIBUTE, LabelSource.CUSTOM}) {
            if (TextCleaner.wordCount(field.label(s)) >= STATUS_LABEL_WORDS) {
                return false;
            }
        }
        return true;
    }

    private boolean matches(FieldDescriptor field, KeywordTable table) {
        return query(tables.get(table)).matches(field);
    }

    private static TextQuery query(List<String> identifiers) {
        return TextQuery.of(SearchKey.FIELD, identifiers).normalizeWhitespace();
    }
}
