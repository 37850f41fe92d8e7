package io.hearthwarrio.autoapply.core.text;

import io.hearthwarrio.autoapply.core.model.FieldDescriptor;
import io.hearthwarrio.autoapply.core.model.FieldType;
import io.hearthwarrio.autoapply.core.model.LabelSource;
import io.hearthwarrio.autoapply.core.model.Locator;
import io.hearthwarrio.autoapply.core.model.SearchKey;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TextQueryTest {

    private final FieldDescriptor field = field();

    @Test
    void containmentIsCaseInsensitiveByDefault() {
        assertTrue(TextQuery.of(SearchKey.LABELS, List.of("first name")).matches(field));
        assertFalse(TextQuery.of(SearchKey.LABELS, List.of("first name")).caseSensitive().matches(field));
    }

    @Test
    void whitespaceNormalizationJoinsWords() {
        assertFalse(TextQuery.of(SearchKey.FIELD, List.of("first name")).withKeys(List.of(SearchKey.ID)).matches(field));
        assertTrue(TextQuery.of(List.of(SearchKey.ID), List.of("first name")).normalizeWhitespace().matches(field));
    }

    @Test
    void exactRequiresWholeValue() {
        assertFalse(TextQuery.of(SearchKey.LABELS, List.of("first")).exact().matches(field));
        assertTrue(TextQuery.of(SearchKey.LABELS, List.of("legal first name")).exact().matches(field));
    }

    @Test
    void onlyListedKeysAreSearched() {
        assertFalse(TextQuery.of(List.of(SearchKey.NAME), List.of("first")).matches(field));
        assertFalse(TextQuery.of(SearchKey.LABELS, List.of()).matches(field));
        assertFalse(TextQuery.of(SearchKey.LABELS, List.of("x")).matches(null));
    }

    @Test
    void plainTextMatching() {
        assertTrue(TextQuery.any(List.of("N/A")).matchesText("n/a"));
        assertFalse(TextQuery.any(List.of("N/A")).matchesText("Yes"));
    }

    private static FieldDescriptor field() {
        FieldDescriptor f = new FieldDescriptor("input", Locator.of("//input[@id='firstname']"), FieldType.TEXT);
        f.setLabel(LabelSource.TAG, "Legal First Name");
        f.setId("firstName");
        f.setName("applicant");
        return f;
    }
}
