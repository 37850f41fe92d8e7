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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Recognizes date inputs, their base format and whether they open or close a period.
 * <p>
 * Base formats: {@code MMDDYYYY}, {@code DDMMYYYY}, {@code MMYYYY}, {@code DD}, {@code MM}, {@code YYYY}.
 */
public final class DateFieldDetector {

    private static final Logger log = LoggerFactory.getLogger(DateFieldDetector.class);

    public static final String MMDDYYYY = "MMDDYYYY";
    public static final String DDMMYYYY = "DDMMYYYY";
    public static final String MMYYYY = "MMYYYY";
    public static final String DD = "DD";
    public static final String MM = "MM";
    public static final String YYYY = "YYYY";

    private static final Map<String, List<String>> VARIANTS = new LinkedHashMap<>();

    static {
        VARIANTS.put(MMDDYYYY, List.of("MM/DD/YYYY", "MM-DD-YYYY", "month.day.year", "month-day-year"));
        VARIANTS.put(DDMMYYYY, List.of("DD/MM/YYYY", "DD-MM-YYYY", "day.month.year", "day-month-year"));
        VARIANTS.put(MMYYYY, List.of("MM/YYYY", "Month/Year", "Month Year", "month-year"));
        VARIANTS.put(DD, List.of("DD", "Day", ".day", "-day"));
        VARIANTS.put(MM, List.of("MM", "Month", ".month", "-month"));
        VARIANTS.put(YYYY, List.of("YYYY", "Year", ".year"));
    }

    private static final List<SearchKey> FORMAT_KEYS = List.of(
            SearchKey.PLACEHOLDER, SearchKey.LABEL_ATTRIBUTE, SearchKey.LABEL_CUSTOM, SearchKey.ID,
            SearchKey.CUSTOM_ID, SearchKey.LABEL_TAG, SearchKey.LABEL_TEXT, SearchKey.NAME);

    private final List<String> dateWords;
    private final TextQuery dateVocabulary;
    private final TextQuery misidentifiers;
    private final TextQuery start;
    private final TextQuery startCaseSensitive;
    private final TextQuery end;
    private final TextQuery endCaseSensitive;
    private final int maxLabelWords;

    public DateFieldDetector(KeywordTables tables, AutofillSettings settings) {
        Objects.requireNonNull(tables, "tables must not be null");
        this.dateWords = tables.get(KeywordTable.DATE_IDENTIFIERS);
        this.dateVocabulary = TextQuery.of(SearchKey.FIELD, dateWords).normalizeWhitespace();
        this.misidentifiers = TextQuery.of(SearchKey.FIELD, tables.get(KeywordTable.DATE_MISIDENTIFIERS)).normalizeWhitespace();
        this.start = TextQuery.of(SearchKey.FIELD, tables.get(KeywordTable.START_DATE_IDENTIFIERS)).normalizeWhitespace();
        this.startCaseSensitive = TextQuery.of(SearchKey.FIELD, tables.get(KeywordTable.START_DATE_IDENTIFIERS_CASE_SENSITIVE))
                .normalizeWhitespace().caseSensitive();
        this.end = TextQuery.of(SearchKey.FIELD, tables.get(KeywordTable.END_DATE_IDENTIFIERS)).normalizeWhitespace();
        this.endCaseSensitive = TextQuery.of(SearchKey.FIELD, tables.get(KeywordTable.END_DATE_IDENTIFIERS_CASE_SENSITIVE))
                .normalizeWhitespace().caseSensitive();
        this.maxLabelWords = Objects.requireNonNull(settings, "settings must not be null").getInt(Setting.DATE_LABEL_MAX_WORDS);
    }

    /**
     * Reclassifies a field as {@code date} (or {@code datelist} for list fields) when its metadata speaks of dates.
     * Long labels and words that merely contain "date" ("candidate", "update") rule it out.
     */
    public void reclassify(FieldDescriptor field) {
        if (!dateVocabulary.matches(field) || field.getType() == FieldType.HIDDEN) {
            return;
        }
        for (LabelSource s : new LabelSource[]{LabelSource.TAG, LabelSource.TEXT, LabelSource.ATTRIBUTE, LabelSource.CUSTOM}) {
            String label = field.label(s);
            if (containsAny(label, dateWords) && TextCleaner.wordCount(label) > maxLabelWords) {
                return;
            }
        }
        if (misidentifiers.matches(field)) {
            return;
        }
        field.setType(field.getType() == FieldType.LIST ? FieldType.DATELIST : FieldType.DATE);
    }

    /**
     * Section tag of a date field: start/end subtype, the ordinal of the section it follows, and the base format.
     *
     * @param labelWithinLimit whether the label is short enough to belong to a repeated section
     */
    public void tag(FieldDescriptor field, Element element, ParseContext context, boolean labelWithinLimit) {
        if (!field.getType().isDate()) {
            return;
        }
        String format = baseFormat(field, element);
        SectionCategory last = labelWithinLimit ? context.lastSection() : null;
        SectionTag tag;
        if (start.matches(field) || startCaseSensitive.matches(field)) {
            tag = inSection(last, context, SectionSubtypes.START_DATE, SectionSubtypes.START_DATE);
        } else if (end.matches(field) || endCaseSensitive.matches(field)) {
            tag = inSection(last, context, SectionSubtypes.END_DATE, SectionSubtypes.EDUCATION_END_DATE);
        } else {
            tag = SectionTag.other("", null);
        }
        field.setSection(tag.withFormat(format));
    }

    /**
     * Ties the date to the section it follows. An ordinal the profile cannot back makes it a standalone date.
     */
    private static SectionTag inSection(SectionCategory last, ParseContext context, String workSubtype, String educationSubtype) {
        if (last == null) {
            return SectionTag.other(workSubtype, null);
        }
        int ordinal = context.primaryOrdinal(last);
        if (ordinal < 1 || ordinal > context.limit(last)) {
            return SectionTag.other(workSubtype, null);
        }
        return SectionTag.of(last, ordinal, last == SectionCategory.EDUCATION ? educationSubtype : workSubtype);
    }

    /**
     * Base format from known spellings, then from the date components the metadata mentions.
     *
     * @return the format, or null when nothing hints at one
     */
    String baseFormat(FieldDescriptor field, Element element) {
        for (Map.Entry<String, List<String>> e : VARIANTS.entrySet()) {
            for (String variant : e.getValue()) {
                if (variant.equalsIgnoreCase(field.getPlaceholder())
                        || TextQuery.of(FORMAT_KEYS, List.of(variant)).normalizeWhitespace().caseSensitive().matches(field)) {
                    return e.getKey();
                }
            }
        }
        List<String> parts = new ArrayList<>();
        for (SearchKey k : FORMAT_KEYS) {
            parts.add(field.valueOf(k));
        }
        String flat = String.join(" ", parts).strip();
        boolean day = flat.contains("DD");
        boolean month = flat.contains("MM");
        boolean year = flat.contains("YYYY");
        if (!(day || month || year)) {
            day = flat.contains("day");
            month = flat.contains("month");
            year = flat.contains("year");
        }
        if (!(day || month || year)) {
            if ("text".equals(element.attr("type"))) {
                return MMDDYYYY;
            }
            log.warn("Cannot determine date format of {}", field);
            return null;
        }
        if (day && month && year) {
            return MMDDYYYY;
        }
        if (month && year) {
            return MMYYYY;
        }
        if (day && !month && !year) {
            return DD;
        }
        if (month && !day && !year) {
            return MM;
        }
        if (year && !day && !month) {
            return YYYY;
        }
        return null;
    }

    private static boolean containsAny(String text, List<String> words) {
        for (String w : words) {
            if (text.contains(w)) {
                return true;
            }
        }
        return false;
    }
}
