package io.hearthwarrio.autoapply.core.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Classified type of an interactive field.
 */
public enum FieldType {
    TEXT("text"),
    TEXTAREA("textarea"),
    EMAIL("email"),
    PASSWORD("password"),
    NUMBER("number"),
    URL("url"),
    TEL("tel"),
    SELECT("select"),
    RADIO("radio"),
    CHECKBOX("checkbox"),
    LIST("list"),
    MULTISELECT("multiselect"),
    DATE("date"),
    DATELIST("datelist"),
    FILE("file"),
    /**
     * A hidden native control whose visible stand-in is a button; resolved by clicking it.
     */
    BUTTON("button"),
    HIDDEN("hidden"),
    OTHER("other");

    private static final Set<FieldType> TEXTUAL = EnumSet.of(TEXT, TEXTAREA, EMAIL, PASSWORD, NUMBER, URL, TEL);

    private final String code;

    FieldType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isTextual() {
        return TEXTUAL.contains(this);
    }

    public boolean isDate() {
        return this == DATE || this == DATELIST;
    }

    public boolean isOptionGroup() {
        return this == RADIO || this == CHECKBOX;
    }

    /**
     * Whether the navigator has an interaction for this type.
     */
    public boolean isResolvable() {
        return isTextual() || isDate() || this == SELECT || this == RADIO || this == CHECKBOX
                || this == LIST || this == MULTISELECT || this == BUTTON;
    }

    /**
     * Maps an HTML {@code type} attribute (or pseudo type) to a field type; unknown values map to {@link #OTHER}.
     */
    public static FieldType fromCode(String code) {
        String c = code == null ? "" : code.trim().toLowerCase(Locale.ROOT);
        if (c.isEmpty()) {
            return TEXT;
        }
        for (FieldType t : values()) {
            if (t.code.equals(c)) {
                return t;
            }
        }
        switch (c) {
            case "search":
                return TEXT;
            case "datetime-local":
            case "month":
            case "week":
                return DATE;
            default:
                return OTHER;
        }
    }
}
