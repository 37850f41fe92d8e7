package io.hearthwarrio.autoapply.core.model;

/**
 * Where a label variant of a page item came from.
 */
public enum LabelSource {
    /**
     * An explicit {@code <label>} association or enclosing label element.
     */
    TAG,
    /**
     * Heading/paragraph/label text found by walking backwards through ancestors.
     */
    TEXT,
    /**
     * {@code aria-label}, {@code title} and similar attributes.
     */
    ATTRIBUTE,
    /**
     * {@code aria-labelledby} / {@code aria-describedby} targets.
     */
    CUSTOM,
    /**
     * Question of the field whose answer revealed this one.
     */
    PARENT
}
