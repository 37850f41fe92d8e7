package io.hearthwarrio.autoapply.core.text;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.Setting;
import io.hearthwarrio.autoapply.core.model.FieldDescriptor;
import io.hearthwarrio.autoapply.core.model.LabelSource;
import io.hearthwarrio.autoapply.core.session.ReasoningOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Derives the question a field asks.
 * <p>
 * Labels are preferred. Without a usable label the relevant parts of the field metadata are
 * collected with a relevance threshold relaxed step by step, and the oracle is asked to phrase
 * them as a question.
 */
public final class QuestionBuilder {

    private static final Logger log = LoggerFactory.getLogger(QuestionBuilder.class);

    private static final double START_THRESHOLD = 0.2;
    private static final double THRESHOLD_STEP = 0.04;

    static final String PHRASE_PROMPT =
            "The following metadata describes one field of a job application form.\n"
                    + "Reply with the question the field asks, in one sentence, and nothing else.\n\n";

    private final TextRelevanceEvaluator relevance;
    private final ReasoningOracle oracle;
    private final int labelSimilarity;

    public QuestionBuilder(TextRelevanceEvaluator relevance, ReasoningOracle oracle, AutofillSettings settings) {
        this.relevance = Objects.requireNonNull(relevance, "relevance must not be null");
        this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
        this.labelSimilarity = Objects.requireNonNull(settings, "settings must not be null")
                .getInt(Setting.LABEL_SIMILARITY);
    }

    /**
     * @param minWords minimum number of words a label needs to count as a question
     */
    public Optional<String> question(FieldDescriptor field, int minWords) {
        Objects.requireNonNull(field, "field must not be null");
        Optional<String> fromLabels = fromLabels(field, minWords);
        if (fromLabels.isPresent()) {
            return fromLabels;
        }
        log.debug("No usable label on {}, phrasing from metadata", field);
        return fromMetadata(field, minWords);
    }

    /**
     * Question from tag and text labels only; no oracle involvement.
     */
    public Optional<String> fromLabels(FieldDescriptor field, int minWords) {
        String tag = field.label(LabelSource.TAG);
        String text = field.label(LabelSource.TEXT);
        String q;
        if (!tag.isEmpty() && !text.isEmpty()) {
            if (Similarity.percent(tag, text) > labelSimilarity) {
                q = tag.length() >= text.length() ? tag : text;
            } else {
                q = tag + "\n" + text;
            }
        } else {
            q = tag.isEmpty() ? text : tag;
        }
        if (q.isEmpty() || TextCleaner.wordCount(q) < minWords) {
            return Optional.empty();
        }
        return Optional.of(withParent(field, q));
    }

    private Optional<String> fromMetadata(FieldDescriptor field, int minWords) {
        String metadata = "";
        for (double t = START_THRESHOLD; metadata.isEmpty() && t > 0; t -= THRESHOLD_STEP) {
            metadata = relevance.normalizedMetadata(field, t);
        }
        String parent = field.label(LabelSource.PARENT);
        if (metadata.isEmpty() || TextCleaner.wordCount(metadata) < minWords) {
            if (!parent.isEmpty()) {
                return Optional.of("Parent Question:\n" + parent);
            }
            log.warn("Unable to derive a question for {}", field);
            return Optional.empty();
        }
        String phrased = oracle.resolve(PHRASE_PROMPT + metadata);
        if (phrased == null || phrased.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(withParent(field, phrased.strip()));
    }

    private static String withParent(FieldDescriptor field, String question) {
        String parent = field.label(LabelSource.PARENT);
        if (parent.isEmpty()) {
            return question;
        }
        return "Parent Question:\n" + parent + "\nMain Question (current question):\n" + question;
    }
}
