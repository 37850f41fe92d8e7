package io.hearthwarrio.autoapply.core.model;

/**
 * Repeated entity sections a form may contain. The label doubles as the profile key.
 */
public enum SectionCategory {
    WORK_EXPERIENCE("Work Experience"),
    EDUCATION("Education"),
    VERIFICATION("Verification"),
    OTHER("other");

    private final String label;

    SectionCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isProfileBacked() {
        return this == WORK_EXPERIENCE || this == EDUCATION;
    }
}
