package io.hearthwarrio.autoapply.core.text;

import io.hearthwarrio.autoapply.core.model.FieldDescriptor;
import io.hearthwarrio.autoapply.core.model.FieldType;
import io.hearthwarrio.autoapply.core.model.Locator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TextRelevanceEvaluatorTest {

    private final TextRelevanceEvaluator evaluator =
            new TextRelevanceEvaluator(Set.of("what", "your", "desire", "salary", "start", "date"));

    @Test
    void naturalQuestionIsRelevant() {
        assertTrue(evaluator.isRelevantLabel("What is your desired salary?", TextRelevanceEvaluator.DEFAULT_THRESHOLD));
    }

    @Test
    void generatedIdentifiersAreNotRelevant() {
        assertFalse(evaluator.isRelevantLabel("input_field_3a9f", TextRelevanceEvaluator.DEFAULT_THRESHOLD));
        assertFalse(evaluator.isRelevant("a1b2c3d4e5f60718293a4b5c6d7e8f90", 0.1, 1, 0, false));
        assertFalse(evaluator.isRelevant("", 0.1, 0, 0, false));
    }

    @Test
    void splitsCamelSnakeAndDigits() {
        assertEquals(List.of("start", "date", "2024"), TextRelevanceEvaluator.splitTokens("startDate_2024"));
        assertEquals(List.of("desired", "salary"), TextRelevanceEvaluator.splitTokens("desired-salary"));
    }

    @Test
    void suffixesReduceToLexiconStems() {
        assertTrue(evaluator.isWord("desired"));
        assertTrue(evaluator.isWord("salaries"));
        assertFalse(evaluator.isWord("qwerty"));
    }

    @Test
    void metadataKeepsOnlyRelevantParts() {
        FieldDescriptor field = new FieldDescriptor("input", Locator.of("//input[@id='desiredSalary']"), FieldType.TEXT);
        field.setId("desiredSalary");
        field.setName("fld_83");

        assertEquals("Id(s): desiredSalary", evaluator.normalizedMetadata(field, TextRelevanceEvaluator.DEFAULT_THRESHOLD));
    }

    @Test
    void bundledLexiconLoads() {
        TextRelevanceEvaluator bundled = TextRelevanceEvaluator.withBundledLexicon();

        assertTrue(bundled.isRelevantLabel("What is your desired salary?", TextRelevanceEvaluator.DEFAULT_THRESHOLD));
    }
}
