package io.hearthwarrio.autoapply.core.config;

import java.util.Locale;

/**
 * Keys of the loadable keyword tables in {@code keyword-tables.json}.
 * <p>
 * Tables with a {@code _FULL} suffix are matched by equality, {@code _PARTIAL} by containment,
 * everything else as documented at the call site.
 */
public enum KeywordTable {
    // navigation and page-state vocabulary
    START_APPLY_IDENTIFIERS,
    SIGN_UP_IDENTIFIERS,
    SIGN_IN_IDENTIFIERS,
    VERIFY_IDENTIFIERS,
    OTHER_AUTH_IDENTIFIERS,
    PROGRESS_IDENTIFIERS,
    ACK_IDENTIFIERS,
    ACK_LINK_IDENTIFIERS,
    SUBMITTED_PAGE_TEXT,
    ALREADY_SUBMITTED_PAGE_TEXT,
    EMAIL_VERIFICATION_PAGE_TEXT,
    OTP_VERIFICATION_PAGE_TEXT,
    PAGE_ERROR_TEXT,
    EXPAND_ALL_IDENTIFIERS,
    REMOVE_SECTION_IDENTIFIERS,
    ADD_SECTION_IDENTIFIERS,
    WORK_SECTION_HEADINGS_CASE_SENSITIVE,
    EDUCATION_SECTION_HEADINGS_CASE_SENSITIVE,
    UPLOADED_FILE_IDENTIFIERS,
    CLEAR_FILE_IDENTIFIERS,
    IFRAME_SOURCE_BLACKLIST,
    FIRST_NAME_IDENTIFIERS,
    EMAIL_IDENTIFIERS,

    // field and button blacklists
    FIELD_ID_BLACKLIST_PARTIAL,
    FIELD_LABEL_BLACKLIST_PARTIAL,
    FIELD_PLACEHOLDER_BLACKLIST_PARTIAL,
    BUTTON_ID_BLACKLIST_FULL,
    BUTTON_TEXT_BLACKLIST_FULL,
    BUTTON_ID_BLACKLIST_PARTIAL,
    BUTTON_LABEL_BLACKLIST_PARTIAL,
    BUTTON_TEXT_BLACKLIST_PARTIAL,
    BUTTON_ATTRIBUTE_VALUE_BLACKLIST_PARTIAL,
    LIST_TYPE_BLACKLIST_PARTIAL,
    LIST_OPTION_BLACKLIST_PARTIAL,
    DROPDOWN_OPTION_BLACKLIST_FULL,
    DROPDOWN_OPTION_BLACKLIST_PARTIAL,
    MULTISELECT_TYPE_BLACKLIST_PARTIAL,
    MULTISELECT_OPTION_BLACKLIST_FULL,
    MULTISELECT_XPATH_KEYWORD_BLACKLIST,
    NEW_BUTTON_TEXT_BLACKLIST_PARTIAL,
    NEW_BUTTON_ID_BLACKLIST_PARTIAL,
    ASSOCIATED_TEXT_BLACKLIST_TEXT_FULL,
    ASSOCIATED_TEXT_BLACKLIST_ID_PARTIAL,
    ASSOCIATED_TEXT_BLACKLIST_TEXT_PARTIAL,
    OPTION_PLACEHOLDER_BLACKLIST,
    ESCAPE_REFRESH_MULTISELECT_PARTIAL,
    ESCAPE_REFRESH_LIST_FULL,
    ESCAPE_REFRESH_LIST_PARTIAL,

    // classification and section vocabulary
    JOB_TITLE_IDENTIFIERS,
    COMPANY_IDENTIFIERS,
    LOCATION_IDENTIFIERS,
    WORK_LOCATION_MARKERS,
    CURRENTLY_WORKING_IDENTIFIERS,
    SCHOOL_IDENTIFIERS,
    DEGREE_IDENTIFIERS,
    FIELD_OF_STUDY_IDENTIFIERS,
    GRADE_IDENTIFIERS,
    CURRENTLY_ENROLLED_IDENTIFIERS,
    ROLE_DESCRIPTION_IDENTIFIERS,
    DATE_IDENTIFIERS,
    DATE_MISIDENTIFIERS,
    START_DATE_IDENTIFIERS,
    START_DATE_IDENTIFIERS_CASE_SENSITIVE,
    END_DATE_IDENTIFIERS,
    END_DATE_IDENTIFIERS_CASE_SENSITIVE,
    UPLOAD_IDENTIFIERS,
    RESUME_IDENTIFIERS,
    CLOUD_UPLOAD_IDENTIFIERS,
    VERIFICATION_IDENTIFIERS,

    // fixed answer rules
    AGREEMENT_IDENTIFIERS,
    PAIRED_YES_QUESTIONS,
    PAIRED_NO_QUESTIONS,
    WORK_AUTHORIZATION_QUESTIONS,
    WORK_AUTHORIZATION_NEGATIONS,
    TRIPLE_NO_QUESTIONS,
    DISABILITY_IDENTIFIERS,
    HISPANIC_IDENTIFIERS,
    GENDER_IDENTIFIERS,
    SEXUAL_ORIENTATION_IDENTIFIERS,
    ETHNICITY_IDENTIFIERS,
    VETERAN_IDENTIFIERS,
    COUNTRY_IDENTIFIERS,
    CITIZENSHIP_IDENTIFIERS_CASE_SENSITIVE,
    CITY_LABEL_IDENTIFIERS_CASE_SENSITIVE,
    STATE_LABEL_IDENTIFIERS_CASE_SENSITIVE,
    PHONE_TYPE_IDENTIFIERS,
    COUNTRY_TERRITORY_IDENTIFIERS,
    COUNTRY_LABEL_IDENTIFIERS_CASE_SENSITIVE,
    PREFERRED_NAME_IDENTIFIERS,
    EMPLOYED_BY_IDENTIFIERS,
    SUBSIDIARY_IDENTIFIERS,
    SALARY_IDENTIFIERS,
    SALARY_EXPECTATION_MARKERS,
    RELOCATION_IDENTIFIERS,
    RELOCATION_EXCLUSIONS,
    CURRENT_ENROLLMENT_MARKERS,
    DECLINE_ANSWERS,
    NOT_APPLICABLE_ANSWERS;

    /**
     * Key of the table inside the {@code tables} object.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
