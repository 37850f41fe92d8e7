package io.hearthwarrio.autoapply.core.answer;

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
import io.hearthwarrio.autoapply.core.session.BrowserSession;
import io.hearthwarrio.autoapply.core.session.ReasoningOracle;
import io.hearthwarrio.autoapply.core.text.QuestionBuilder;
import io.hearthwarrio.autoapply.core.text.TextRelevanceEvaluator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class MultiselectDrillerTest {

    private static final String TOP = "//div[@id='fos']";

    private BrowserSession session;
    private OptionCollector collector;
    private ReasoningOracle oracle;
    private MultiselectDriller driller;

    @BeforeEach
    void setUp() {
        KeywordTables tables = KeywordTables.defaults();
        AutofillSettings settings = AutofillSettings.defaults();
        ProfileLookup lookup = new ProfileLookup(JsonProfileStore.fromClasspath("test-profile.json"), tables);
        session = mock(BrowserSession.class);
        collector = mock(OptionCollector.class);
        oracle = mock(ReasoningOracle.class);
        QuestionBuilder questions = new QuestionBuilder(new TextRelevanceEvaluator(Set.of()), oracle, settings);
        AnswerEngine engine = new AnswerEngine(lookup, tables, settings, questions, oracle);
        driller = new MultiselectDriller(session, collector, engine, lookup, tables, settings);
    }

    @Test
    void profileLeafOnSecondLevelIsClickedWithoutOracle() {
        FieldDescriptor field = new FieldDescriptor("div", Locator.of(TOP), FieldType.MULTISELECT);
        field.setLabel(LabelSource.TAG, "Field of Study");
        field.setSection(SectionTag.of(SectionCategory.EDUCATION, 1, SectionSubtypes.FIELD_OF_STUDY));

        Map<String, Locator> categories = options(
                "Business", "//div[@id='biz']",
                "Engineering", "//div[@id='eng']",
                "Arts", "//div[@id='arts']");
        Map<String, Locator> engineering = options(
                "Mechanical Engineering", "//input[@id='mech']",
                "Computer Engineering", "//input[@id='comp']");
        when(collector.open(eq(Locator.of(TOP)), eq(TOP), any())).thenReturn(categories);
        when(collector.open(eq(Locator.of("//div[@id='eng']")), eq(TOP), any())).thenReturn(engineering);

        MultiselectDriller.Result result = driller.drill(field);

        assertEquals(MultiselectDriller.Result.Status.SELECTED, result.status());
        assertEquals(List.of("Engineering", "Computer Engineering"), result.path());
        assertEquals(2, result.levels());
        assertEquals(Decision.PROFILE, result.source());
        verify(session).click("//input[@id='comp']");
        verify(collector, times(2)).open(any(), eq(TOP), any());
        verifyNoInteractions(oracle);
    }

    @Test
    void oracleChoosesWhenNoProfileValueMatches() {
        FieldDescriptor field = new FieldDescriptor("div", Locator.of("//div[@id='dept']"), FieldType.MULTISELECT);
        field.setLabel(LabelSource.TAG, "Preferred department");
        when(collector.open(any(), anyString(), any())).thenReturn(options(
                "Sales", "//input[@id='sales']",
                "Research", "//input[@id='research']"));
        when(oracle.resolve(anyString(), anyList(), anyBoolean(), anyInt())).thenReturn("Research");
        when(session.count("//input[@id='research']")).thenReturn(1);

        MultiselectDriller.Result result = driller.drill(field);

        assertEquals(MultiselectDriller.Result.Status.SELECTED, result.status());
        assertEquals(List.of("Research"), result.path());
        assertEquals(Decision.ORACLE, result.source());
        verify(session).click("//input[@id='research']");
    }

    @Test
    void choiceThatCannotBeRelocatedFails() {
        FieldDescriptor field = new FieldDescriptor("div", Locator.of("//div[@id='dept']"), FieldType.MULTISELECT);
        field.setLabel(LabelSource.TAG, "Preferred department");
        when(collector.open(any(), anyString(), any())).thenReturn(options(
                "Sales", "//input[@id='sales']",
                "Research", "//input[@id='research']"));
        when(oracle.resolve(anyString(), anyList(), anyBoolean(), anyInt())).thenReturn("Research");

        MultiselectDriller.Result result = driller.drill(field);

        assertTrue(result.isFailure());
        verify(session, never()).click(anyString());
    }

    @Test
    void scrollingIsAnchoredOnTheLastOptionStillOnThePage() {
        FieldDescriptor field = new FieldDescriptor("div", Locator.of("//div[@id='dept']"), FieldType.MULTISELECT);
        field.setLabel(LabelSource.TAG, "Preferred department");
        when(collector.open(any(), anyString(), any())).thenReturn(options(
                "Sales", "//input[@id='sales']",
                "Research", "//input[@id='research']",
                "Support", "//input[@id='support']"));
        when(session.count("//input[@id='sales']")).thenReturn(1);
        when(session.count("//input[@id='research']")).thenReturn(1);
        when(oracle.resolve(anyString(), anyList(), anyBoolean(), anyInt())).thenReturn("Sales");

        driller.drill(field);

        verify(collector).scroll(eq(Locator.of("//input[@id='research']")), any(), eq("//div[@id='dept']"));
        verify(collector, never()).scroll(eq(Locator.of("//input[@id='support']")), any(), any());
    }

    @Test
    void noUniqueOptionMeansNoScrolling() {
        FieldDescriptor field = new FieldDescriptor("div", Locator.of("//div[@id='dept']"), FieldType.MULTISELECT);
        field.setLabel(LabelSource.TAG, "Preferred department");
        when(collector.open(any(), anyString(), any())).thenReturn(options(
                "Sales", "//input[@id='sales']",
                "Research", "//input[@id='research']"));
        when(oracle.resolve(anyString(), anyList(), anyBoolean(), anyInt())).thenReturn("Sales");

        driller.drill(field);

        verify(collector, never()).scroll(any(), any(), any());
    }

    @Test
    void leafIsRecognisedByItsLastStep() {
        assertTrue(MultiselectDriller.isLeaf(Locator.of("//ul/li[2]/input[@type='checkbox']")));
        assertFalse(MultiselectDriller.isLeaf(Locator.of("//div[@data-input='x']")));
    }

    private static Map<String, Locator> options(String... pairs) {
        Map<String, Locator> m = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            m.put(pairs[i], Locator.of(pairs[i + 1]));
        }
        return m;
    }
}
