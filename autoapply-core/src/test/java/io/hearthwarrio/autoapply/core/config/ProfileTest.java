package io.hearthwarrio.autoapply.core.config;

import io.hearthwarrio.autoapply.core.model.SectionCategory;
import io.hearthwarrio.autoapply.core.model.SectionSubtypes;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ProfileTest {

    private final Profile profile = JsonProfileStore.fromClasspath("test-profile.json");

    @Test
    void readsContactValues() {
        assertEquals("alex.morgan@example.com", profile.text(Profile.EMAIL));
        assertTrue(profile.has(Profile.CITY));
        assertFalse(profile.has("Middle Name"));
        assertEquals("", profile.text("Middle Name"));
    }

    @Test
    void sectionEntriesAreOneBased() {
        assertEquals(1, profile.entryCount(SectionCategory.WORK_EXPERIENCE));
        assertEquals("Acme Corp", profile.entryValue(SectionCategory.WORK_EXPERIENCE, 1, SectionSubtypes.COMPANY));
        assertEquals("", profile.entryValue(SectionCategory.WORK_EXPERIENCE, 0, SectionSubtypes.COMPANY));
        assertEquals("", profile.entryValue(SectionCategory.WORK_EXPERIENCE, 2, SectionSubtypes.COMPANY));
        assertTrue(profile.entryFlag(SectionCategory.WORK_EXPERIENCE, 1, SectionSubtypes.CURRENTLY_WORKING));
        assertFalse(profile.entryFlag(SectionCategory.WORK_EXPERIENCE, 2, SectionSubtypes.CURRENTLY_WORKING));
    }

    @Test
    void searchTermsFallBackToValue() {
        assertEquals(List.of("Texas at Austin", "UT Austin"),
                profile.searchTerms(SectionCategory.EDUCATION, 1, SectionSubtypes.SCHOOL));
        assertEquals(List.of("Bachelor of Science"),
                profile.searchTerms(SectionCategory.EDUCATION, 1, SectionSubtypes.DEGREE));
        assertEquals(List.of(), profile.searchTerms(SectionCategory.EDUCATION, 1, SectionSubtypes.GRADE));
    }

    @Test
    void aliasesAndSelfIdentification() {
        assertEquals(List.of("BS", "B.S."), profile.entryList(SectionCategory.EDUCATION, 1, "Degree Aliases"));
        assertEquals("Decline to self-identify", profile.selfIdentification("Gender"));
        assertEquals("", profile.selfIdentification("Ethnicity"));
    }

    @Test
    void resumePathIsOptional() {
        assertEquals(Optional.of(Path.of("/tmp/alex-morgan-resume.pdf")), profile.resumePath());
        assertTrue(JsonProfileStore.parse("{}").resumePath().isEmpty());
    }

    @Test
    void malformedDocumentsAreRejected() {
        assertThrows(ConfigurationException.class, () -> JsonProfileStore.parse("{not json"));
        assertThrows(ConfigurationException.class, () -> JsonProfileStore.parse("[1, 2]"));
        assertThrows(ConfigurationException.class, () -> JsonProfileStore.fromClasspath("missing-profile.json"));
    }
}
