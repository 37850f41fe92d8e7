package io.hearthwarrio.autoapply.core.extract;

import io.hearthwarrio.autoapply.core.config.KeywordTable;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.model.FieldDescriptor;
import io.hearthwarrio.autoapply.core.model.FieldType;
import io.hearthwarrio.autoapply.core.model.SearchKey;
import io.hearthwarrio.autoapply.core.model.SectionCategory;
import io.hearthwarrio.autoapply.core.model.SectionTag;
import io.hearthwarrio.autoapply.core.text.TextQuery;

import java.util.List;
import java.util.Objects;

/**
 * Tags one-time-code cells ({@code ###} placeholders, "verification code" labels) with their position.
 */
public final class VerificationFieldDetector {

    private static final TextQuery PLACEHOLDER_MASK = TextQuery.of(List.of(SearchKey.PLACEHOLDER), List.of("###"));

    private final TextQuery vocabulary;

    public VerificationFieldDetector(KeywordTables tables) {
        Objects.requireNonNull(tables, "tables must not be null");
        this.vocabulary = TextQuery.of(SearchKey.FIELD, tables.get(KeywordTable.VERIFICATION_IDENTIFIERS))
                .normalizeWhitespace();
    }

    public void apply(FieldDescriptor field, ParseContext context) {
        if (field.getType() != FieldType.NUMBER && field.getType() != FieldType.TEXT) {
            return;
        }
        if (vocabulary.matches(field) || PLACEHOLDER_MASK.matches(field)) {
            field.setSection(SectionTag.of(SectionCategory.VERIFICATION, context.nextVerificationDigit(), null));
        }
    }
}
