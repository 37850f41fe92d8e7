package io.hearthwarrio.autoapply.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Result of one extraction pass. Rebuilt on every parse; the previous instance is discarded.
 * <p>
 * Fields and buttons stay mutable so elements revealed during resolution can be spliced in
 * at their document position.
 */
public final class PageModel {

    private final PageMetadata metadata;
    private final List<FieldDescriptor> fields;
    private final List<ButtonDescriptor> buttons;
    private final List<LinkDescriptor> links;

    public PageModel(PageMetadata metadata,
                     List<FieldDescriptor> fields,
                     List<ButtonDescriptor> buttons,
                     List<LinkDescriptor> links) {
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
        this.fields = new ArrayList<>(Objects.requireNonNull(fields, "fields must not be null"));
        this.buttons = new ArrayList<>(Objects.requireNonNull(buttons, "buttons must not be null"));
        this.links = List.copyOf(Objects.requireNonNull(links, "links must not be null"));
    }

    public PageMetadata getMetadata() {
        return metadata;
    }

    public List<FieldDescriptor> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public List<ButtonDescriptor> getButtons() {
        return Collections.unmodifiableList(buttons);
    }

    public List<LinkDescriptor> getLinks() {
        return links;
    }

    public FieldDescriptor field(int index) {
        return fields.get(index);
    }

    public int fieldCount() {
        return fields.size();
    }

    public void insertField(int index, FieldDescriptor field) {
        fields.add(Math.min(Math.max(index, 0), fields.size()), Objects.requireNonNull(field, "field must not be null"));
    }

    public void addButton(ButtonDescriptor button) {
        buttons.add(Objects.requireNonNull(button, "button must not be null"));
    }

    public List<FieldDescriptor> fieldsMatching(Predicate<FieldDescriptor> predicate) {
        List<FieldDescriptor> out = new ArrayList<>();
        for (FieldDescriptor f : fields) {
            if (predicate.test(f)) {
                out.add(f);
            }
        }
        return out;
    }

    public List<FieldDescriptor> fieldsOfType(FieldType type) {
        return fieldsMatching(f -> f.getType() == type);
    }

    public int indexOf(FieldDescriptor field) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i) == field) {
                return i;
            }
        }
        return -1;
    }
}
