package io.hearthwarrio.autoapply.core.model;

import java.util.List;

/**
 * Searchable properties of page items.
 */
public enum SearchKey {
    LABEL_TAG,
    LABEL_TEXT,
    LABEL_ATTRIBUTE,
    LABEL_CUSTOM,
    LABEL_PARENT,
    NAME,
    ID,
    CUSTOM_ID,
    PLACEHOLDER,
    TEXT,
    TYPE,
    VALUE,
    HREF;

    public static final List<SearchKey> LABELS = List.of(LABEL_TAG, LABEL_TEXT, LABEL_ATTRIBUTE, LABEL_CUSTOM);

    public static final List<SearchKey> FIELD = List.of(
            LABEL_TAG, LABEL_TEXT, LABEL_ATTRIBUTE, LABEL_CUSTOM, NAME, ID, CUSTOM_ID);

    public static final List<SearchKey> FIELD_AND_PLACEHOLDER = List.of(
            LABEL_TAG, LABEL_TEXT, LABEL_ATTRIBUTE, LABEL_CUSTOM, NAME, ID, CUSTOM_ID, PLACEHOLDER);

    public static final List<SearchKey> BUTTON = List.of(
            TEXT, LABEL_TAG, LABEL_TEXT, LABEL_ATTRIBUTE, LABEL_CUSTOM, NAME, ID, CUSTOM_ID);

    public static final List<SearchKey> TEXT_ONLY = List.of(TEXT);

    public static SearchKey of(LabelSource source) {
        return switch (source) {
            case TAG -> LABEL_TAG;
            case TEXT -> LABEL_TEXT;
            case ATTRIBUTE -> LABEL_ATTRIBUTE;
            case CUSTOM -> LABEL_CUSTOM;
            case PARENT -> LABEL_PARENT;
        };
    }
}
