package io.hearthwarrio.autoapply.core.navigation;

import io.hearthwarrio.autoapply.core.config.KeywordTable;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.model.ButtonDescriptor;
import io.hearthwarrio.autoapply.core.model.LinkDescriptor;
import io.hearthwarrio.autoapply.core.model.PageModel;
import io.hearthwarrio.autoapply.core.model.SearchKey;
import io.hearthwarrio.autoapply.core.text.TextQuery;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Picks the controls that commit a page: acknowledgements first, then progress buttons.
 * <p>
 * Buttons are searched from the bottom of the page up, since the committing control of a form is
 * usually its last one.
 */
public final class ActionSelector {

    private final KeywordTables tables;

    public ActionSelector(KeywordTables tables) {
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
    }

    /**
     * A visibly labelled acknowledge button, else a link that opens the terms in a dialog.
     */
    public Optional<ActionItem> acknowledge(PageModel page) {
        TextQuery buttons = TextQuery.of(SearchKey.BUTTON, tables.get(KeywordTable.ACK_IDENTIFIERS));
        for (ButtonDescriptor b : reversed(page.getButtons())) {
            if (buttons.matches(b) && !b.getText().isEmpty()) {
                return Optional.of(ActionItem.of(b, ActionItem.Role.ACKNOWLEDGE));
            }
        }
        TextQuery links = TextQuery.of(SearchKey.TEXT_ONLY, tables.get(KeywordTable.ACK_LINK_IDENTIFIERS));
        for (LinkDescriptor l : reversed(page.getLinks())) {
            if (links.matches(l) && l.looksLikeModalTrigger()) {
                return Optional.of(ActionItem.of(l, ActionItem.Role.ACKNOWLEDGE));
            }
        }
        return Optional.empty();
    }

    /**
     * A submit-typed progress button, else any progress button, else the only submit button of the page.
     */
    public Optional<ActionItem> progress(PageModel page) {
        TextQuery q = TextQuery.of(SearchKey.TEXT_ONLY, tables.get(KeywordTable.PROGRESS_IDENTIFIERS));
        List<ButtonDescriptor> submits = new ArrayList<>();
        for (ButtonDescriptor b : reversed(page.getButtons())) {
            if (b.isSubmit()) {
                submits.add(b);
            }
        }
        for (ButtonDescriptor b : submits) {
            if (q.matches(b)) {
                return Optional.of(ActionItem.of(b, ActionItem.Role.PROGRESS));
            }
        }
        for (ButtonDescriptor b : reversed(page.getButtons())) {
            if (q.matches(b)) {
                return Optional.of(ActionItem.of(b, ActionItem.Role.PROGRESS));
            }
        }
        if (submits.size() == 1) {
            return Optional.of(ActionItem.of(submits.get(0), ActionItem.Role.PROGRESS));
        }
        return Optional.empty();
    }

    public Optional<ActionItem> apply(PageModel page) {
        return Optional.ofNullable(new PageSignals(page, tables).applyControl())
                .map(item -> ActionItem.of(item, ActionItem.Role.APPLY));
    }

    private static <T> List<T> reversed(List<T> items) {
        List<T> out = new ArrayList<>(items.size());
        for (int i = items.size() - 1; i >= 0; i--) {
            out.add(items.get(i));
        }
        return out;
    }
}
