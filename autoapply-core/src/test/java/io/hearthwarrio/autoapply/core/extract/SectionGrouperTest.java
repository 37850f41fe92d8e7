package io.hearthwarrio.autoapply.core.extract;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.JsonProfileStore;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.model.FieldDescriptor;
import io.hearthwarrio.autoapply.core.model.FieldType;
import io.hearthwarrio.autoapply.core.model.LabelSource;
import io.hearthwarrio.autoapply.core.model.Locator;
import io.hearthwarrio.autoapply.core.model.SectionCategory;
import io.hearthwarrio.autoapply.core.model.SectionSubtypes;
import io.hearthwarrio.autoapply.core.model.SectionTag;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SectionGrouperTest {

    private final SectionGrouper grouper = new SectionGrouper(KeywordTables.defaults(), AutofillSettings.defaults());
    private final Element element = Jsoup.parse("<input>").selectFirst("input");

    @Test
    void fieldsPastTheProfileEntriesAreDropped() {
        ParseContext context = new ParseContext(JsonProfileStore.fromClasspath("test-profile.json"), false);
        FieldDescriptor first = field("Job Title", FieldType.TEXT);
        FieldDescriptor second = field("Job Title", FieldType.TEXT);

        assertTrue(grouper.classify(first, element, context));
        assertFalse(grouper.classify(second, element, context));

        assertEquals(SectionTag.of(SectionCategory.WORK_EXPERIENCE, 1, SectionSubtypes.JOB_TITLE), first.getSection());
        assertNull(second.getSection());
        assertEquals(1, context.primaryOrdinal(SectionCategory.WORK_EXPERIENCE));
    }

    @Test
    void educationSubtypesAreCountedSeparately() {
        ParseContext context = new ParseContext(JsonProfileStore.fromClasspath("test-profile.json"), false);
        FieldDescriptor school = field("School", FieldType.LIST);
        FieldDescriptor degree = field("Degree", FieldType.LIST);
        FieldDescriptor major = field("Field of study", FieldType.MULTISELECT);

        assertTrue(grouper.classify(school, element, context));
        assertTrue(grouper.classify(degree, element, context));
        assertTrue(grouper.classify(major, element, context));

        assertEquals(SectionSubtypes.SCHOOL, school.getSection().getSubtype());
        assertEquals(SectionSubtypes.DEGREE, degree.getSection().getSubtype());
        assertEquals(SectionSubtypes.FIELD_OF_STUDY, major.getSection().getSubtype());
        assertEquals(1, major.getSection().getOrdinal());
    }

    @Test
    void unrelatedFieldKeepsNoSection() {
        ParseContext context = new ParseContext(JsonProfileStore.fromClasspath("test-profile.json"), false);
        FieldDescriptor f = field("Preferred pronouns", FieldType.TEXT);

        assertTrue(grouper.classify(f, element, context));
        assertNull(f.getSection());
    }

    @Test
    void longLabelsAreNotSectionCaptions() {
        FieldDescriptor f = field("Please describe the job title you would hold in your ideal next role", FieldType.TEXT);

        assertFalse(grouper.labelWithinLimit(f));
    }

    private static FieldDescriptor field(String label, FieldType type) {
        FieldDescriptor f = new FieldDescriptor("input", Locator.of("//input"), type);
        f.setLabel(LabelSource.TAG, label);
        return f;
    }
}
