package io.hearthwarrio.autoapply.core.model;

import java.util.Objects;

/**
 * Places a field inside a repeated section: category, 1-based ordinal, subtype and optional date format.
 * <p>
 * Ordinal 0 means "not tied to a profile entry".
 */
public final class SectionTag {

    private final SectionCategory category;
    private final int ordinal;
    private final String subtype;
    private final String format;

    private SectionTag(SectionCategory category, int ordinal, String subtype, String format) {
        this.category = Objects.requireNonNull(category, "category must not be null");
        this.ordinal = ordinal;
        this.subtype = subtype;
        this.format = format;
    }

    public static SectionTag of(SectionCategory category, int ordinal, String subtype) {
        return new SectionTag(category, ordinal, subtype, null);
    }

    public static SectionTag other(String subtype, String format) {
        return new SectionTag(SectionCategory.OTHER, 0, subtype, format);
    }

    public SectionTag withFormat(String format) {
        return new SectionTag(category, ordinal, subtype, format);
    }

    public SectionTag withSubtype(String subtype) {
        return new SectionTag(category, ordinal, subtype, format);
    }

    public SectionCategory getCategory() {
        return category;
    }

    public int getOrdinal() {
        return ordinal;
    }

    /**
     * @return subtype name (e.g. "Company", "From Start Date"), or null
     */
    public String getSubtype() {
        return subtype;
    }

    /**
     * @return date base format (e.g. "MMDDYYYY"), or null when unknown or not a date
     */
    public String getFormat() {
        return format;
    }

    public boolean is(SectionCategory c) {
        return category == c;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SectionTag other)) {
            return false;
        }
        return ordinal == other.ordinal
                && category == other.category
                && Objects.equals(subtype, other.subtype)
                && Objects.equals(format, other.format);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, ordinal, subtype, format);
    }

    @Override
    public String toString() {
        return category.label() + "#" + ordinal + (subtype == null ? "" : "/" + subtype)
                + (format == null ? "" : " [" + format + "]");
    }
}
