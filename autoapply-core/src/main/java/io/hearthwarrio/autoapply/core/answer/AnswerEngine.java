package io.hearthwarrio.autoapply.core.answer;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.KeywordTable;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.config.Setting;
import io.hearthwarrio.autoapply.core.model.FieldDescriptor;
import io.hearthwarrio.autoapply.core.model.SectionCategory;
import io.hearthwarrio.autoapply.core.model.SectionTag;
import io.hearthwarrio.autoapply.core.session.OracleException;
import io.hearthwarrio.autoapply.core.session.ReasoningOracle;
import io.hearthwarrio.autoapply.core.strategy.Outcome;
import io.hearthwarrio.autoapply.core.text.QuestionBuilder;
import io.hearthwarrio.autoapply.core.text.Similarity;
import io.hearthwarrio.autoapply.core.text.TextCleaner;
import io.hearthwarrio.autoapply.core.text.TextQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides what to put into a field.
 * <p>
 * Precedence: profile lookup, then fixed rules, then the oracle. The {@code deterministic*} methods never
 * contact the oracle and answer {@link Decision.Kind#DEFER_TO_ORACLE} when they run out of rules; the
 * {@code resolve*} methods finish the job and only ever return a value, a selection or a skip.
 * <p>
 * Oracle failures propagate as {@link OracleException}.
 */
public final class AnswerEngine {

    private static final Logger log = LoggerFactory.getLogger(AnswerEngine.class);

    static final String NOT_APPLICABLE = "N/A";

    private final ProfileLookup lookup;
    private final ChoiceRules choiceRules;
    private final CheckboxRules checkboxRules;
    private final OptionRanker ranker;
    private final QuestionBuilder questions;
    private final ReasoningOracle oracle;
    private final TextQuery notApplicable;
    private final int topK;
    private final int falseAnswerSimilarity;

    public AnswerEngine(ProfileLookup lookup,
                        KeywordTables tables,
                        AutofillSettings settings,
                        QuestionBuilder questions,
                        ReasoningOracle oracle) {
        this.lookup = Objects.requireNonNull(lookup, "lookup must not be null");
        Objects.requireNonNull(tables, "tables must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        this.questions = Objects.requireNonNull(questions, "questions must not be null");
        this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
        this.choiceRules = new ChoiceRules(tables, lookup.profile(), settings);
        this.checkboxRules = new CheckboxRules(tables, lookup);
        this.ranker = new OptionRanker(settings);
        this.notApplicable = TextQuery.any(tables.get(KeywordTable.NOT_APPLICABLE_ANSWERS));
        this.topK = settings.getInt(Setting.ORACLE_TOP_K);
        this.falseAnswerSimilarity = settings.getInt(Setting.FALSE_ANSWER_SIMILARITY);
    }

    public ChoiceRules choiceRules() {
        return choiceRules;
    }

    // ---------------------------------------------------------------- free text

    public Decision deterministicText(FieldDescriptor field) {
        Optional<String> section = lookup.sectionValue(field);
        if (section.isPresent()) {
            return Decision.value(section.get(), Decision.PROFILE);
        }
        Optional<Decision> contact = lookup.contactValue(field);
        if (contact.isPresent()) {
            return contact.get();
        }
        if (!field.isRequired()) {
            return Decision.skip("optional field without a profile value");
        }
        return Decision.deferToOracle(questions.fromLabels(field, 1).orElse(null), List.of());
    }

    public Decision resolveText(FieldDescriptor field) {
        Decision d = deterministicText(field);
        if (d.kind() != Decision.Kind.DEFER_TO_ORACLE) {
            return d;
        }
        Optional<String> question = questions.question(field, 1);
        if (question.isEmpty()) {
            return Decision.value(NOT_APPLICABLE, Decision.RULE);
        }
        String answer = oracle.resolve(question.get());
        if (answer == null || answer.isBlank()) {
            throw new OracleException("Empty answer for '" + question.get() + "'");
        }
        return Decision.value(answer.strip(), Decision.ORACLE);
    }

    // ---------------------------------------------------------------- single choice

    /**
     * @param options displayed option texts in page order
     */
    public Decision deterministicChoice(FieldDescriptor field, List<String> options) {
        if (options.isEmpty()) {
            return Decision.skip("no options");
        }
        Outcome<String> outcome = choiceRules.choose(field, options);
        if (outcome.isSuccess()) {
            log.debug("Rule '{}' chose '{}' for {}", outcome.strategy(), outcome.value(), field);
            return Decision.select(outcome.value(), isProfileRule(field) ? Decision.PROFILE : Decision.RULE);
        }
        return Decision.deferToOracle(null, options);
    }

    public Decision resolveChoice(FieldDescriptor field, List<String> options) {
        Decision d = deterministicChoice(field, options);
        if (d.kind() != Decision.Kind.DEFER_TO_ORACLE) {
            return d;
        }
        Optional<String> answer = askForOptions(field, options, false);
        if (answer.isEmpty()) {
            return Decision.skip("oracle found no applicable option");
        }
        String chosen = ranker.selectSingle(options, answer.get(), field.isRequired());
        return chosen == null ? Decision.skip("no option close to the oracle answer") : Decision.select(chosen, Decision.ORACLE);
    }

    /**
     * Answer typed into a dynamic list when the field carries a known value (a formatted date, for instance):
     * the exact option, else the closest one.
     */
    public Decision chooseKnown(List<String> options, String value) {
        if (options.contains(value)) {
            return Decision.select(value, Decision.PROFILE);
        }
        String best = OptionRanker.closest(options, value);
        return best == null ? Decision.skip("no options") : Decision.select(best, Decision.PROFILE);
    }

    // ---------------------------------------------------------------- multiple choice

    public Decision deterministicMultiple(FieldDescriptor field, List<String> options) {
        if (options.isEmpty()) {
            return Decision.skip("no options");
        }
        Optional<Decision> rule = checkboxRules.decide(field, options);
        return rule.orElseGet(() -> Decision.deferToOracle(null, options));
    }

    public Decision resolveMultiple(FieldDescriptor field, List<String> options) {
        Decision d = deterministicMultiple(field, options);
        if (d.kind() != Decision.Kind.DEFER_TO_ORACLE) {
            return d;
        }
        Optional<String> question = questions.question(field, 1);
        Optional<String> answer = askForOptions(field, options, options.size() > 1, question);
        if (answer.isEmpty()) {
            return Decision.skip("oracle found no applicable option");
        }
        if (options.size() == 1 && isRefusal(answer.get(), question.orElse(null))) {
            return Decision.skip("oracle declined the box");
        }
        List<String> chosen = ranker.selectMultiple(options, answer.get(), field.isRequired());
        return chosen.isEmpty() ? Decision.skip("every option below the similarity floor") : Decision.select(chosen, Decision.ORACLE);
    }

    // ---------------------------------------------------------------- oracle

    private Optional<String> askForOptions(FieldDescriptor field, List<String> options, boolean multiSelect) {
        return askForOptions(field, options, multiSelect, questions.question(field, 1));
    }

    /**
     * @return the oracle's free-text answer; empty when it declared the question not applicable
     */
    private Optional<String> askForOptions(FieldDescriptor field, List<String> options, boolean multiSelect,
                                           Optional<String> question) {
        String answer;
        if (question.isPresent()) {
            answer = oracle.resolve(question.get(), options, multiSelect, topK);
        } else {
            answer = oracle.resolve(orphanPrompt(options, multiSelect));
            if (answer != null && notApplicable.matchesText(answer) && (multiSelect || !field.isRequired())) {
                return Optional.empty();
            }
        }
        if (answer == null || answer.isBlank()) {
            throw new OracleException("Empty answer for options " + options);
        }
        log.debug("Oracle answered '{}' for {}", answer, field);
        return Optional.of(answer.strip());
    }

    /**
     * A lone checkbox answered "false": a short reply, or one that merely echoes the question.
     */
    boolean isRefusal(String answer, String question) {
        if (!answer.toLowerCase(Locale.ROOT).contains("false")) {
            return false;
        }
        if (question == null) {
            return true;
        }
        return TextCleaner.wordCount(answer) < TextCleaner.wordCount(question) + 3
                || Similarity.percent(answer, question) > falseAnswerSimilarity;
    }

    static String orphanPrompt(List<String> options, boolean multiSelect) {
        StringBuilder sb = new StringBuilder();
        sb.append("A job application form shows the following options without a question.\n");
        sb.append(multiSelect
                ? "Reply with the options an applicant would normally choose, one per line, copied exactly.\n"
                : "Reply with the one option an applicant would normally choose, copied exactly.\n");
        sb.append("If none applies, reply N/A.\n\nOptions:\n");
        for (String o : options) {
            sb.append("- ").append(o).append('\n');
        }
        return sb.toString();
    }

    private static boolean isProfileRule(FieldDescriptor field) {
        SectionTag tag = field.getSection();
        return tag != null && tag.is(SectionCategory.EDUCATION);
    }
}
