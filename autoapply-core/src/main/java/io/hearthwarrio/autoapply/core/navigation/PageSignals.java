package io.hearthwarrio.autoapply.core.navigation;

import io.hearthwarrio.autoapply.core.config.KeywordTable;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.model.ButtonDescriptor;
import io.hearthwarrio.autoapply.core.model.FieldDescriptor;
import io.hearthwarrio.autoapply.core.model.FieldType;
import io.hearthwarrio.autoapply.core.model.LinkDescriptor;
import io.hearthwarrio.autoapply.core.model.PageItem;
import io.hearthwarrio.autoapply.core.model.PageModel;
import io.hearthwarrio.autoapply.core.model.SearchKey;
import io.hearthwarrio.autoapply.core.model.SectionCategory;
import io.hearthwarrio.autoapply.core.text.TextQuery;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Keyword lookups over one parsed page, shared by state detection, auth classification and action selection.
 */
final class PageSignals {

    private final PageModel page;
    private final KeywordTables tables;

    PageSignals(PageModel page, KeywordTables tables) {
        this.page = Objects.requireNonNull(page, "page must not be null");
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
    }

    PageModel page() {
        return page;
    }

    int fieldCount() {
        return page.fieldCount();
    }

    /**
     * Fields typed {@code email}, or text fields whose labels or identifiers mention an email.
     */
    List<FieldDescriptor> emailFields() {
        List<FieldDescriptor> typed = page.fieldsOfType(FieldType.EMAIL);
        if (!typed.isEmpty()) {
            return typed;
        }
        TextQuery q = TextQuery.of(SearchKey.FIELD, tables.get(KeywordTable.EMAIL_IDENTIFIERS));
        return page.fieldsMatching(f -> f.getType() == FieldType.TEXT && q.matches(f));
    }

    List<FieldDescriptor> passwordFields() {
        return page.fieldsOfType(FieldType.PASSWORD);
    }

    List<FieldDescriptor> verificationFields() {
        return page.fieldsMatching(f -> f.inSection(SectionCategory.VERIFICATION));
    }

    boolean hasFirstNameField() {
        TextQuery q = TextQuery.of(SearchKey.FIELD, tables.get(KeywordTable.FIRST_NAME_IDENTIFIERS));
        return !page.fieldsMatching(f -> f.getType() == FieldType.TEXT && q.matches(f)).isEmpty();
    }

    boolean hasButton(KeywordTable... identifiers) {
        return !buttons(identifiers).isEmpty();
    }

    boolean hasButtonOrLink(KeywordTable... identifiers) {
        return hasButton(identifiers) || !links(identifiers).isEmpty();
    }

    /**
     * Buttons whose visible text contains any identifier of the tables, in document order.
     */
    List<ButtonDescriptor> buttons(KeywordTable... identifiers) {
        TextQuery q = TextQuery.of(SearchKey.TEXT_ONLY, merged(identifiers));
        List<ButtonDescriptor> out = new ArrayList<>();
        for (ButtonDescriptor b : page.getButtons()) {
            if (q.matches(b)) {
                out.add(b);
            }
        }
        return out;
    }

    List<LinkDescriptor> links(KeywordTable... identifiers) {
        TextQuery q = TextQuery.of(SearchKey.TEXT_ONLY, merged(identifiers));
        List<LinkDescriptor> out = new ArrayList<>();
        for (LinkDescriptor l : page.getLinks()) {
            if (q.matches(l)) {
                out.add(l);
            }
        }
        return out;
    }

    /**
     * First button or link naming the apply action, searching identifiers in table order so the most
     * specific wording wins.
     *
     * @return null when the page has no apply control
     */
    PageItem applyControl() {
        for (String identifier : tables.get(KeywordTable.START_APPLY_IDENTIFIERS)) {
            TextQuery q = TextQuery.of(SearchKey.TEXT_ONLY, List.of(identifier));
            for (ButtonDescriptor b : page.getButtons()) {
                if (q.matches(b)) {
                    return b;
                }
            }
            for (LinkDescriptor l : page.getLinks()) {
                if (q.matches(l)) {
                    return l;
                }
            }
        }
        return null;
    }

    boolean textPresent(String pageText, KeywordTable table) {
        return pageText != null && TextQuery.any(tables.get(table)).matchesText(pageText);
    }

    private List<String> merged(KeywordTable... identifiers) {
        List<String> all = new ArrayList<>();
        for (KeywordTable t : identifiers) {
            all.addAll(tables.get(t));
        }
        return all;
    }
}
