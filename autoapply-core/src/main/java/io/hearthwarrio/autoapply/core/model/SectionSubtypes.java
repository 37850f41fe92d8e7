package io.hearthwarrio.autoapply.core.model;

/**
 * Subtype names of section-bound fields. They double as keys of the matching profile entries.
 */
public final class SectionSubtypes {

    public static final String JOB_TITLE = "Job Title";
    public static final String COMPANY = "Company";
    public static final String LOCATION = "Location";
    public static final String CURRENTLY_WORKING = "I currently work here";
    public static final String ROLE_DESCRIPTION = "Role Description";

    public static final String SCHOOL = "School or University";
    public static final String DEGREE = "Degree";
    public static final String FIELD_OF_STUDY = "Field of Study or Major";
    public static final String GRADE = "Overall Result (GPA) or Grade";
    public static final String GRADUATED = "Graduated";

    public static final String START_DATE = "From Start Date";
    public static final String END_DATE = "To End Date";
    public static final String EDUCATION_END_DATE = "To End Date (Actual or Expected)";

    private SectionSubtypes() {
        // utility class
    }
}
