package io.hearthwarrio.autoapply.core.model;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Common part of fields, buttons and links: locator, identifiers and label variants.
 * <p>
 * Mutable: the extractor fills it in several passes. Not thread-safe.
 */
public abstract class PageItem {

    private Locator locator;
    private final String tagName;
    private final EnumMap<LabelSource, String> labels = new EnumMap<>(LabelSource.class);
    private String id = "";
    private String customId = "";
    private String name = "";
    private String text = "";

    protected PageItem(String tagName, Locator locator) {
        this.tagName = Objects.requireNonNull(tagName, "tagName must not be null");
        this.locator = Objects.requireNonNull(locator, "locator must not be null");
    }

    public Locator getLocator() {
        return locator;
    }

    public void setLocator(Locator locator) {
        this.locator = Objects.requireNonNull(locator, "locator must not be null");
    }

    public String getTagName() {
        return tagName;
    }

    /**
     * @return label of the given source, or an empty string
     */
    public String label(LabelSource source) {
        String v = labels.get(source);
        return v == null ? "" : v;
    }

    public void setLabel(LabelSource source, String value) {
        if (value == null || value.isBlank()) {
            labels.remove(source);
        } else {
            labels.put(source, value.trim());
        }
    }

    public Map<LabelSource, String> labels() {
        return Map.copyOf(labels);
    }

    /**
     * First non-empty label among tag, text, attribute and custom labels.
     */
    public String primaryLabel() {
        for (LabelSource s : new LabelSource[]{LabelSource.TAG, LabelSource.TEXT, LabelSource.ATTRIBUTE, LabelSource.CUSTOM}) {
            String v = label(s);
            if (!v.isEmpty()) {
                return v;
            }
        }
        return "";
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id == null ? "" : id;
    }

    public String getCustomId() {
        return customId;
    }

    public void setCustomId(String customId) {
        this.customId = customId == null ? "" : customId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name == null ? "" : name;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text == null ? "" : text;
    }

    /**
     * Value of a searchable property; empty string when absent.
     */
    public String valueOf(SearchKey key) {
        return switch (key) {
            case LABEL_TAG -> label(LabelSource.TAG);
            case LABEL_TEXT -> label(LabelSource.TEXT);
            case LABEL_ATTRIBUTE -> label(LabelSource.ATTRIBUTE);
            case LABEL_CUSTOM -> label(LabelSource.CUSTOM);
            case LABEL_PARENT -> label(LabelSource.PARENT);
            case NAME -> name;
            case ID -> id;
            case CUSTOM_ID -> customId;
            case TEXT -> text;
            default -> extraValue(key);
        };
    }

    protected String extraValue(SearchKey key) {
        return "";
    }
}
