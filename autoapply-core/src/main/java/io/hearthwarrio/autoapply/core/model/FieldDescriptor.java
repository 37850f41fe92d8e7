package io.hearthwarrio.autoapply.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One interactive field of a {@link PageModel}.
 * <p>
 * Option-bearing fields (radio/checkbox groups, selects) keep their options as an ordered
 * {@code displayed text -> locator} map. Section-bound fields carry a {@link SectionTag}.
 */
public final class FieldDescriptor extends PageItem {

    private FieldType type;
    private boolean required;
    private String placeholder = "";
    private String value = "";
    private final LinkedHashMap<String, Locator> choices = new LinkedHashMap<>();
    private SectionTag section;
    private UploadKind uploadKind;
    private String multiselectId = "";

    public FieldDescriptor(String tagName, Locator locator, FieldType type) {
        super(tagName, locator);
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    public FieldType getType() {
        return type;
    }

    public void setType(FieldType type) {
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    public boolean isRequired() {
        return required;
    }

    public void setRequired(boolean required) {
        this.required = required;
    }

    public String getPlaceholder() {
        return placeholder;
    }

    public void setPlaceholder(String placeholder) {
        this.placeholder = placeholder == null ? "" : placeholder;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value == null ? "" : value;
    }

    public Map<String, Locator> getChoices() {
        return Collections.unmodifiableMap(choices);
    }

    /**
     * Adds an option unless an option with the same text is already present.
     */
    public void addChoice(String text, Locator locator) {
        choices.putIfAbsent(Objects.requireNonNull(text, "text must not be null"),
                Objects.requireNonNull(locator, "locator must not be null"));
    }

    public void clearChoices() {
        choices.clear();
    }

    public SectionTag getSection() {
        return section;
    }

    public void setSection(SectionTag section) {
        this.section = section;
    }

    public boolean inSection(SectionCategory category) {
        return section != null && section.is(category);
    }

    public UploadKind getUploadKind() {
        return uploadKind;
    }

    public void setUploadKind(UploadKind uploadKind) {
        this.uploadKind = uploadKind;
    }

    public String getMultiselectId() {
        return multiselectId;
    }

    public void setMultiselectId(String multiselectId) {
        this.multiselectId = multiselectId == null ? "" : multiselectId;
    }

    /**
     * Deep copy; locators and section tags are immutable and shared.
     */
    public FieldDescriptor copy() {
        FieldDescriptor c = new FieldDescriptor(getTagName(), getLocator(), type);
        for (Map.Entry<LabelSource, String> e : labels().entrySet()) {
            c.setLabel(e.getKey(), e.getValue());
        }
        c.setId(getId());
        c.setCustomId(getCustomId());
        c.setName(getName());
        c.setText(getText());
        c.required = required;
        c.placeholder = placeholder;
        c.value = value;
        c.choices.putAll(choices);
        c.section = section;
        c.uploadKind = uploadKind;
        c.multiselectId = multiselectId;
        return c;
    }

    @Override
    protected String extraValue(SearchKey key) {
        return switch (key) {
            case PLACEHOLDER -> placeholder;
            case TYPE -> type.code();
            case VALUE -> value;
            default -> "";
        };
    }

    /**
     * Structural equality over everything the extractor fills in.
     */
    public boolean sameAs(FieldDescriptor other) {
        return other != null
                && getTagName().equals(other.getTagName())
                && getLocator().equals(other.getLocator())
                && type == other.type
                && labels().equals(other.labels())
                && getId().equals(other.getId())
                && getCustomId().equals(other.getCustomId())
                && getName().equals(other.getName())
                && required == other.required
                && placeholder.equals(other.placeholder)
                && value.equals(other.value)
                && choices.equals(other.choices)
                && Objects.equals(section, other.section)
                && uploadKind == other.uploadKind
                && multiselectId.equals(other.multiselectId);
    }

    @Override
    public String toString() {
        return "Field{" + type.code() + ", '" + primaryLabel() + "', " + getLocator() + "}";
    }
}
