package io.hearthwarrio.autoapply.core.extract;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.KeywordTable;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.model.ButtonDescriptor;
import io.hearthwarrio.autoapply.core.model.LabelSource;
import io.hearthwarrio.autoapply.core.model.LinkDescriptor;
import io.hearthwarrio.autoapply.core.model.Locator;
import io.hearthwarrio.autoapply.core.model.SearchKey;
import io.hearthwarrio.autoapply.core.text.TextCleaner;
import io.hearthwarrio.autoapply.core.text.TextQuery;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds {@link ButtonDescriptor}s and navigation {@link LinkDescriptor}s.
 */
public final class ControlExtractor {

    private static final List<String> HEADER_CHROME = List.of("header", "nav");
    private static final List<String> FOOTER = List.of("footer");

    private final Blacklist blacklist;
    private final LabelResolver labels = new LabelResolver();
    private final AssociatedTextFinder associatedText;
    private final TextQuery navigationLinkText;
    private final List<String> resumeWords;

    public ControlExtractor(KeywordTables tables, AutofillSettings settings) {
        Objects.requireNonNull(tables, "tables must not be null");
        this.blacklist = new Blacklist(tables);
        this.associatedText = new AssociatedTextFinder(settings);
        List<String> words = new ArrayList<>();
        for (KeywordTable t : List.of(KeywordTable.START_APPLY_IDENTIFIERS, KeywordTable.SIGN_UP_IDENTIFIERS,
                KeywordTable.SIGN_IN_IDENTIFIERS, KeywordTable.VERIFY_IDENTIFIERS, KeywordTable.OTHER_AUTH_IDENTIFIERS)) {
            words.addAll(tables.get(t));
        }
        this.navigationLinkText = TextQuery.of(SearchKey.TEXT_ONLY, words).normalizeWhitespace().exact();
        this.resumeWords = tables.get(KeywordTable.RESUME_IDENTIFIERS);
    }

    /**
     * @param force keep buttons that the chrome and blacklist filters would drop
     */
    public Optional<ButtonDescriptor> button(Element element, Locator locator, ParseContext context, boolean force) {
        ButtonDescriptor button = new ButtonDescriptor(element.normalName(), locator);
        String declared = element.attr("type").toLowerCase(Locale.ROOT);
        button.setType("submit".equals(declared) ? "submit" : "button");

        String text = "input".equals(element.normalName()) ? element.attr("value") : "";
        if (text.isEmpty()) {
            text = TextCleaner.clean(element.text());
        }
        if (text.isEmpty()) {
            text = element.attr("title");
        }
        button.setText(text);
        button.setId(element.attr("id"));
        button.setCustomId(ElementAttributes.custom(element, "id"));
        button.setName(element.hasAttr("name") ? element.attr("name") : element.attr("title"));
        button.setOnclick(element.attr("onclick"));
        button.setLabel(LabelSource.TAG, labels.tagLabel(element).orElse(""));
        button.setLabel(LabelSource.CUSTOM, ElementAttributes.custom(element, "label"));

        if (!force) {
            if (ElementAttributes.isInside(element, HEADER_CHROME)) {
                return Optional.empty();
            }
            if (!button.isSubmit() && ElementAttributes.isInside(element, FOOTER)) {
                return Optional.empty();
            }
            if (isBlacklisted(button, element)) {
                return Optional.empty();
            }
        }

        if (!context.isNamespaced() && lookUpAssociatedText(button)) {
            String associated = associatedText.find(element).orElse("");
            if (!blacklist.partial(KeywordTable.BUTTON_LABEL_BLACKLIST_PARTIAL, associated)) {
                button.setLabel(LabelSource.TEXT, associated);
            }
        }
        if (button.label(LabelSource.TEXT).isEmpty()
                && TextQuery.of(List.of(SearchKey.ID, SearchKey.CUSTOM_ID), resumeWords).matches(button)) {
            button.setLabel(LabelSource.TEXT, "Resume");
        }
        return Optional.of(button);
    }

    /**
     * @return a descriptor only for links whose text reads like an apply or authentication step
     */
    public Optional<LinkDescriptor> link(Element element, Locator locator) {
        LinkDescriptor link = new LinkDescriptor(locator);
        link.setText(TextCleaner.clean(element.text()));
        if (!navigationLinkText.matches(link)) {
            return Optional.empty();
        }
        link.setHref(element.attr("href"));
        link.setTarget(element.attr("target"));
        link.setOnclick(element.attr("onclick"));
        link.setId(element.attr("id"));
        link.setName(element.attr("name"));
        link.setLabel(LabelSource.TAG, labels.tagLabel(element).orElse(""));
        link.setLabel(LabelSource.ATTRIBUTE, element.attr("aria-label"));
        return Optional.of(link);
    }

    private boolean isBlacklisted(ButtonDescriptor button, Element element) {
        String text = button.getText();
        return blacklist.attributeValue(KeywordTable.BUTTON_ATTRIBUTE_VALUE_BLACKLIST_PARTIAL, element)
                || blacklist.full(KeywordTable.BUTTON_TEXT_BLACKLIST_FULL, text)
                || blacklist.partial(KeywordTable.BUTTON_TEXT_BLACKLIST_PARTIAL, text)
                || blacklist.full(KeywordTable.BUTTON_ID_BLACKLIST_FULL, button.getId(), button.getCustomId())
                || blacklist.partial(KeywordTable.BUTTON_ID_BLACKLIST_PARTIAL, button.getId(), button.getCustomId());
    }

    /**
     * Buttons with a self-explanatory caption ("Add another", "Remove") skip the costly text lookup.
     */
    private boolean lookUpAssociatedText(ButtonDescriptor button) {
        String text = button.getText();
        if (text.isEmpty()) {
            return true;
        }
        return !(blacklist.full(KeywordTable.ASSOCIATED_TEXT_BLACKLIST_TEXT_FULL, text)
                || blacklist.partial(KeywordTable.ASSOCIATED_TEXT_BLACKLIST_TEXT_PARTIAL, text)
                || blacklist.partial(KeywordTable.ASSOCIATED_TEXT_BLACKLIST_ID_PARTIAL, button.getId(), button.getCustomId()));
    }
}
