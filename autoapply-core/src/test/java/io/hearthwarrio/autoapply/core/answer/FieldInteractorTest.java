package io.hearthwarrio.autoapply.core.answer;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.JsonProfileStore;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.config.Profile;
import io.hearthwarrio.autoapply.core.locator.LocatorEngine;
import io.hearthwarrio.autoapply.core.logging.DecisionLogger;
import io.hearthwarrio.autoapply.core.logging.LogDetail;
import io.hearthwarrio.autoapply.core.model.FieldDescriptor;
import io.hearthwarrio.autoapply.core.model.FieldType;
import io.hearthwarrio.autoapply.core.model.LabelSource;
import io.hearthwarrio.autoapply.core.model.Locator;
import io.hearthwarrio.autoapply.core.model.SectionCategory;
import io.hearthwarrio.autoapply.core.model.SectionTag;
import io.hearthwarrio.autoapply.core.session.FakeBrowserSession;
import io.hearthwarrio.autoapply.core.session.NativeFileDialog;
import io.hearthwarrio.autoapply.core.session.ReasoningOracle;
import io.hearthwarrio.autoapply.core.text.QuestionBuilder;
import io.hearthwarrio.autoapply.core.text.TextRelevanceEvaluator;
import io.hearthwarrio.autoapply.core.upload.FileUploader;
import io.hearthwarrio.autoapply.core.upload.UploadQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

public class FieldInteractorTest {

    private static final String PAGE = "<html><body><form>"
            + "<label for=\"email\">Email</label><input type=\"email\" id=\"email\">"
            + "<label for=\"hear\">How did you hear about us?</label><input type=\"text\" id=\"hear\">"
            + "<input type=\"text\" id=\"locked\" disabled>"
            + "<fieldset><legend>Will you require sponsorship now or in future?</legend>"
            + "<input type=\"radio\" id=\"sp-yes\" name=\"sponsor\"><label for=\"sp-yes\">Yes</label>"
            + "<input type=\"radio\" id=\"sp-no\" name=\"sponsor\"><label for=\"sp-no\">No</label>"
            + "</fieldset>"
            + "<input type=\"text\" id=\"code-1\"><input type=\"text\" id=\"code-2\">"
            + "<button type=\"submit\">Submit application</button>"
            + "</form></body></html>";

    private FakeBrowserSession session;
    private ReasoningOracle oracle;
    private final List<String> logged = new ArrayList<>();
    private FieldInteractor interactor;

    @BeforeEach
    void setUp() {
        session = FakeBrowserSession.of(PAGE);
        oracle = mock(ReasoningOracle.class);
        Profile profile = JsonProfileStore.fromClasspath("test-profile.json");
        KeywordTables tables = KeywordTables.defaults();
        AutofillSettings settings = AutofillSettings.defaults();
        TextRelevanceEvaluator relevance = new TextRelevanceEvaluator(Set.of());
        LocatorEngine locators = new LocatorEngine(session, settings);
        ProfileLookup lookup = new ProfileLookup(profile, tables);
        AnswerEngine engine = new AnswerEngine(lookup, tables, settings,
                new QuestionBuilder(relevance, oracle, settings), oracle);
        OptionCollector collector = new OptionCollector(session, locators, tables, settings);
        MultiselectDriller driller = new MultiselectDriller(session, collector, engine, lookup, tables, settings);
        FileUploader uploader = new FileUploader(session, mock(NativeFileDialog.class), UploadQueue.global(), locators, settings);
        DecisionLogger decisions = new DecisionLogger() {
            @Override
            public void logDecision(String target, Locator locator, String decision, String source, String details) {
                logged.add(target + " -> " + decision);
            }

            @Override
            public LogDetail detail() {
                return LogDetail.DECISION_ONLY;
            }
        };
        interactor = new FieldInteractor(session, locators, engine, collector, driller, uploader,
                lookup, tables, settings, relevance, decisions, Clock.systemUTC());
    }

    @Test
    void contactFieldIsTypedFromProfile() {
        FieldDescriptor email = field(FieldType.EMAIL, "//input[@id='email']", "Email");

        FieldOutcome outcome = interactor.resolve(email, InteractionContext.root("test"));

        assertTrue(outcome.isSuccess());
        assertEquals(Decision.PROFILE, outcome.decision().source());
        assertEquals("alex.morgan@example.com", session.typed().get("//input[@id='email']"));
        assertEquals(1, logged.size());
        assertTrue(logged.get(0).startsWith("Email -> "));
    }

    @Test
    void matchingValueIsNotRetyped() {
        session.document().getElementById("email").attr("value", "alex.morgan@example.com");
        FieldDescriptor email = field(FieldType.EMAIL, "//input[@id='email']", "Email");

        assertTrue(interactor.resolve(email, InteractionContext.root("test")).isSuccess());
        assertTrue(session.typed().isEmpty());
    }

    @Test
    void optionalUnknownFieldIsSkippedWithoutOracle() {
        FieldDescriptor hear = field(FieldType.TEXT, "//input[@id='hear']", "How did you hear about us?");

        FieldOutcome outcome = interactor.resolve(hear, InteractionContext.root("test"));

        assertEquals(FieldOutcome.Status.SKIPPED, outcome.status());
        assertTrue(session.typed().isEmpty());
        verifyNoInteractions(oracle);
    }

    @Test
    void disabledFieldIsNotTouched() {
        FieldDescriptor locked = field(FieldType.TEXT, "//input[@id='locked']", "Email");

        FieldOutcome outcome = interactor.resolve(locked, InteractionContext.root("test"));

        assertEquals(FieldOutcome.Status.SKIPPED, outcome.status());
        assertEquals("not interactable", outcome.reason());
    }

    @Test
    void vanishedRequiredFieldIsMisplaced() {
        FieldDescriptor email = field(FieldType.EMAIL, "//input[@id='email']", "Email");
        email.setRequired(true);
        session.setHtml("<html><body><p>Session expired</p></body></html>");

        assertEquals(FieldOutcome.Status.MISPLACED, interactor.resolve(email, InteractionContext.root("test")).status());

        email.setRequired(false);
        assertEquals(FieldOutcome.Status.SKIPPED, interactor.resolve(email, InteractionContext.root("test")).status());
    }

    @Test
    void radioRuleClicksChoiceAndReportsRevealedFields() {
        FieldDescriptor sponsor = field(FieldType.RADIO, "//input[@id='sp-yes']",
                "Will you require sponsorship now or in future?");
        sponsor.addChoice("Yes", Locator.of("//input[@id='sp-yes']"));
        sponsor.addChoice("No", Locator.of("//input[@id='sp-no']"));
        sponsor.setRequired(true);
        session.onClick("//input[@id='sp-yes']", s -> s.document().selectFirst("fieldset")
                .after("<label for=\"visa\">Visa type</label><input type=\"text\" id=\"visa\">"));

        FieldOutcome outcome = interactor.resolve(sponsor, InteractionContext.root("test"));

        assertTrue(outcome.isSuccess());
        assertEquals("Yes", outcome.decision().option());
        assertEquals(List.of("//input[@id='sp-yes']"), session.clicks());
        assertEquals(1, outcome.revealed().size());
        assertEquals("visa", outcome.revealed().get(0).id());
        verifyNoInteractions(oracle);
    }

    @Test
    void verificationCellsTakeOneCharacterEach() {
        FieldDescriptor second = field(FieldType.TEXT, "//input[@id='code-2']", "");
        second.setSection(SectionTag.of(SectionCategory.VERIFICATION, 2, null));

        FieldOutcome outcome = interactor.resolve(second, InteractionContext.root("test").withVerificationCode("4821", 4));

        assertTrue(outcome.isSuccess());
        assertEquals("8", session.typed().get("//input[@id='code-2']"));
    }

    @Test
    void singleVerificationCellTakesWholeCode() {
        FieldDescriptor cell = field(FieldType.TEXT, "//input[@id='code-1']", "");
        cell.setSection(SectionTag.of(SectionCategory.VERIFICATION, 1, null));

        interactor.resolve(cell, InteractionContext.root("test").withVerificationCode("4821", 1));

        assertEquals("4821", session.typed().get("//input[@id='code-1']"));
    }

    @Test
    void missingVerificationCodeFails() {
        FieldDescriptor cell = field(FieldType.TEXT, "//input[@id='code-1']", "");
        cell.setSection(SectionTag.of(SectionCategory.VERIFICATION, 1, null));

        assertEquals(FieldOutcome.Status.FAILED, interactor.resolve(cell, InteractionContext.root("test")).status());
    }

    private static FieldDescriptor field(FieldType type, String xpath, String label) {
        FieldDescriptor f = new FieldDescriptor("input", Locator.of(xpath), type);
        f.setLabel(LabelSource.TAG, label);
        return f;
    }
}
