package io.hearthwarrio.autoapply.core.answer;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.JsonProfileStore;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.config.Profile;
import io.hearthwarrio.autoapply.core.model.FieldDescriptor;
import io.hearthwarrio.autoapply.core.model.FieldType;
import io.hearthwarrio.autoapply.core.model.LabelSource;
import io.hearthwarrio.autoapply.core.model.Locator;
import io.hearthwarrio.autoapply.core.model.SectionCategory;
import io.hearthwarrio.autoapply.core.model.SectionSubtypes;
import io.hearthwarrio.autoapply.core.model.SectionTag;
import io.hearthwarrio.autoapply.core.session.OracleException;
import io.hearthwarrio.autoapply.core.session.ReasoningOracle;
import io.hearthwarrio.autoapply.core.text.QuestionBuilder;
import io.hearthwarrio.autoapply.core.text.TextRelevanceEvaluator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class AnswerEngineTest {

    private ReasoningOracle oracle;
    private AnswerEngine engine;

    @BeforeEach
    void setUp() {
        Profile profile = JsonProfileStore.fromClasspath("test-profile.json");
        KeywordTables tables = KeywordTables.defaults();
        AutofillSettings settings = AutofillSettings.defaults();
        oracle = mock(ReasoningOracle.class);
        QuestionBuilder questions = new QuestionBuilder(new TextRelevanceEvaluator(Set.of()), oracle, settings);
        engine = new AnswerEngine(new ProfileLookup(profile, tables), tables, settings, questions, oracle);
    }

    @Test
    void sponsorshipQuestionSelectsFirstOptionWithoutOracle() {
        FieldDescriptor field = field(FieldType.RADIO, "Will you require sponsorship now or in future?");
        field.setRequired(true);

        Decision d = engine.resolveChoice(field, List.of("Yes", "No"));

        assertEquals(Decision.Kind.SELECT, d.kind());
        assertEquals("Yes", d.option());
        assertEquals(Decision.RULE, d.source());
        verifyNoInteractions(oracle);
    }

    @Test
    void oracleAnswerSelectsOnlyCloseOption() {
        FieldDescriptor field = field(FieldType.CHECKBOX, "Which employment types are you open to?");
        List<String> options = List.of("Full-time employment", "Full-time contractor", "Internship");
        when(oracle.resolve(anyString(), anyList(), anyBoolean(), anyInt())).thenReturn("Full time employment");

        Decision d = engine.resolveMultiple(field, options);

        assertEquals(Decision.Kind.SELECT, d.kind());
        assertEquals(List.of("Full-time employment"), d.options());
        assertEquals(Decision.ORACLE, d.source());
        verify(oracle).resolve(eq("Which employment types are you open to?"), eq(options), eq(true), eq(15));
    }

    @Test
    void deterministicChoiceDefersWithoutCallingOracle() {
        FieldDescriptor field = field(FieldType.RADIO, "What is your favourite colour?");

        Decision d = engine.deterministicChoice(field, List.of("Red", "Green", "Blue", "Yellow"));

        assertEquals(Decision.Kind.DEFER_TO_ORACLE, d.kind());
        verifyNoInteractions(oracle);
    }

    @Test
    void contactFieldIsFilledFromProfile() {
        FieldDescriptor field = field(FieldType.EMAIL, "Email");

        Decision d = engine.resolveText(field);

        assertEquals(Decision.Kind.VALUE, d.kind());
        assertEquals("alex.morgan@example.com", d.value());
        assertEquals(Decision.PROFILE, d.source());
        verifyNoInteractions(oracle);
    }

    @Test
    void sectionFieldIsFilledFromProfileEntry() {
        FieldDescriptor field = field(FieldType.TEXT, "Job Title");
        field.setSection(SectionTag.of(SectionCategory.WORK_EXPERIENCE, 1, SectionSubtypes.JOB_TITLE));

        Decision d = engine.resolveText(field);

        assertEquals("Software Engineer", d.value());
        verifyNoInteractions(oracle);
    }

    @Test
    void optionalUnknownTextFieldIsSkipped() {
        FieldDescriptor field = field(FieldType.TEXT, "How did you hear about us?");

        assertTrue(engine.resolveText(field).isSkip());
        verifyNoInteractions(oracle);
    }

    @Test
    void requiredUnknownTextFieldAsksOracle() {
        FieldDescriptor field = field(FieldType.TEXT, "How did you hear about us?");
        field.setRequired(true);
        when(oracle.resolve("How did you hear about us?")).thenReturn("  A friend  ");

        Decision d = engine.resolveText(field);

        assertEquals("A friend", d.value());
        assertEquals(Decision.ORACLE, d.source());
    }

    @Test
    void blankOracleAnswerIsAnError() {
        FieldDescriptor field = field(FieldType.TEXT, "How did you hear about us?");
        field.setRequired(true);
        when(oracle.resolve(anyString())).thenReturn(" ");

        assertThrows(OracleException.class, () -> engine.resolveText(field));
    }

    @Test
    void chooseKnownFallsBackToClosestOption() {
        Decision exact = engine.chooseKnown(List.of("2021", "2022"), "2022");
        Decision closest = engine.chooseKnown(List.of("March", "May"), "Mar");

        assertEquals("2022", exact.option());
        assertEquals("March", closest.option());
        assertTrue(engine.chooseKnown(List.of(), "x").isSkip());
    }

    private static FieldDescriptor field(FieldType type, String label) {
        FieldDescriptor f = new FieldDescriptor("input", Locator.of("//input[@id='f']", null), type);
        f.setLabel(LabelSource.TAG, label);
        return f;
    }
}
