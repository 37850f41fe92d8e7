package io.hearthwarrio.autoapply.core.extract;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.KeywordTable;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.config.Setting;
import io.hearthwarrio.autoapply.core.model.FieldDescriptor;
import io.hearthwarrio.autoapply.core.model.LabelSource;
import io.hearthwarrio.autoapply.core.model.Locator;
import io.hearthwarrio.autoapply.core.model.SearchKey;
import io.hearthwarrio.autoapply.core.text.Similarity;
import io.hearthwarrio.autoapply.core.text.TextCleaner;
import io.hearthwarrio.autoapply.core.text.TextQuery;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Folds radio buttons and checkboxes of one question into a single field.
 * <p>
 * Two items belong together when they share a non-empty label, name or id, or when their ids are at least
 * {@link Setting#MERGE_ID_SIMILARITY} percent similar. The group keeps the first item's metadata and the
 * union of options; its tag label is dropped because it named one option, not the question.
 */
public final class OptionGroupMerger {

    private static final List<SearchKey> SHARED_KEYS = List.of(
            SearchKey.LABEL_TEXT, SearchKey.LABEL_ATTRIBUTE, SearchKey.LABEL_CUSTOM,
            SearchKey.NAME, SearchKey.ID, SearchKey.CUSTOM_ID);

    private static final int STANDALONE_LABEL_WORDS = 5;

    private final TextQuery standalone;
    private final int idSimilarity;

    public OptionGroupMerger(KeywordTables tables, AutofillSettings settings) {
        Objects.requireNonNull(tables, "tables must not be null");
        List<String> status = new ArrayList<>(tables.get(KeywordTable.CURRENTLY_WORKING_IDENTIFIERS));
        status.addAll(tables.get(KeywordTable.CURRENTLY_ENROLLED_IDENTIFIERS));
        this.standalone = TextQuery.of(SearchKey.FIELD, status).normalizeWhitespace();
        this.idSimilarity = Objects.requireNonNull(settings, "settings must not be null").getInt(Setting.MERGE_ID_SIMILARITY);
    }

    /**
     * Merges the item into a matching group of {@code fields}.
     *
     * @return true when merged; the caller must then drop {@code item}
     */
    public boolean mergeInto(FieldDescriptor item, List<FieldDescriptor> fields) {
        if (!item.getType().isOptionGroup() || isStandaloneStatusBox(item)) {
            return false;
        }
        for (FieldDescriptor group : fields) {
            if (group == item || group.getType() != item.getType()) {
                continue;
            }
            if (sharesIdentity(item, group)) {
                for (Map.Entry<String, Locator> e : item.getChoices().entrySet()) {
                    group.addChoice(e.getKey(), e.getValue());
                }
                group.setLabel(LabelSource.TAG, null);
                return true;
            }
        }
        return false;
    }

    /**
     * Merges a raw extraction without touching it: every item is copied first.
     */
    public List<FieldDescriptor> mergeAll(List<FieldDescriptor> raw) {
        List<FieldDescriptor> out = new ArrayList<>();
        for (FieldDescriptor f : raw) {
            FieldDescriptor c = f.copy();
            if (!mergeInto(c, out)) {
                out.add(c);
            }
        }
        return out;
    }

    /**
     * "I currently work here" style checkboxes with short labels stand alone even when they share ids.
     */
    private boolean isStandaloneStatusBox(FieldDescriptor item) {
        if (!standalone.matches(item)) {
            return false;
        }
        for (String label : item.labels().values()) {
            if (TextCleaner.wordCount(label) >= STANDALONE_LABEL_WORDS) {
                return false;
            }
        }
        return true;
    }

    private boolean sharesIdentity(FieldDescriptor a, FieldDescriptor b) {
        for (SearchKey k : SHARED_KEYS) {
            String v = a.valueOf(k);
            if (!v.isEmpty() && v.equals(b.valueOf(k))) {
                return true;
            }
        }
        for (SearchKey k : new SearchKey[]{SearchKey.ID, SearchKey.CUSTOM_ID}) {
            String va = a.valueOf(k);
            String vb = b.valueOf(k);
            if (!va.isEmpty() && !vb.isEmpty() && Similarity.percent(va, vb) >= idSimilarity) {
                return true;
            }
        }
        return false;
    }
}
