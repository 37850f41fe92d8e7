package io.hearthwarrio.autoapply.core.extract;

import io.hearthwarrio.autoapply.core.config.JsonProfileStore;
import io.hearthwarrio.autoapply.core.config.Profile;
import io.hearthwarrio.autoapply.core.model.SectionCategory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParseContextTest {

    private static final Profile TWO_JOBS = JsonProfileStore.parse(
            "{\"Work Experience\": [{\"Job Title\": \"A\"}, {\"Job Title\": \"B\"}], \"Education\": []}");

    @Test
    void limitsFollowProfileEntries() {
        ParseContext context = new ParseContext(TWO_JOBS, false);

        assertEquals(2, context.limit(SectionCategory.WORK_EXPERIENCE));
        assertEquals(0, context.limit(SectionCategory.EDUCATION));
        assertEquals(0, context.limit(SectionCategory.OTHER));
    }

    @Test
    void ordinalsNeverExceedTheCap() {
        ParseContext context = new ParseContext(TWO_JOBS, false);

        assertEquals(1, context.claim(SectionCategory.WORK_EXPERIENCE, "Job Title"));
        assertEquals(2, context.claim(SectionCategory.WORK_EXPERIENCE, "Job Title"));
        for (int i = 0; i < 5; i++) {
            assertEquals(0, context.claim(SectionCategory.WORK_EXPERIENCE, "Job Title"));
        }
        assertEquals(2, context.subtypeCount(SectionCategory.WORK_EXPERIENCE, "Job Title"));
        assertEquals(1, context.claim(SectionCategory.WORK_EXPERIENCE, "Company"));
        assertEquals(0, context.claim(SectionCategory.EDUCATION, "Degree"));
    }

    @Test
    void firstPrimaryChoiceWins() {
        ParseContext context = new ParseContext(TWO_JOBS, false);

        context.choosePrimary(SectionCategory.WORK_EXPERIENCE, List.of("job title"));
        context.choosePrimary(SectionCategory.WORK_EXPERIENCE, List.of("company"));

        assertEquals(List.of("job title"), context.primaryIdentifiers(SectionCategory.WORK_EXPERIENCE));
    }

    @Test
    void freshContextStartsFromZero() {
        ParseContext first = new ParseContext(TWO_JOBS, true);
        first.openSection(SectionCategory.WORK_EXPERIENCE);
        first.nextVerificationDigit();

        ParseContext second = new ParseContext(TWO_JOBS, false);

        assertTrue(first.isNamespaced());
        assertEquals(SectionCategory.WORK_EXPERIENCE, first.lastSection());
        assertEquals(0, second.primaryOrdinal(SectionCategory.WORK_EXPERIENCE));
        assertEquals(0, second.verificationDigits());
        assertNull(second.lastSection());
        assertEquals(1, second.nextVerificationDigit());
    }
}
