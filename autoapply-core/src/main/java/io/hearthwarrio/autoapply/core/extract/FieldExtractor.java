package io.hearthwarrio.autoapply.core.extract;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.KeywordTable;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.model.FieldDescriptor;
import io.hearthwarrio.autoapply.core.model.FieldType;
import io.hearthwarrio.autoapply.core.model.LabelSource;
import io.hearthwarrio.autoapply.core.model.Locator;
import io.hearthwarrio.autoapply.core.session.BrowserSession;
import io.hearthwarrio.autoapply.core.text.TextCleaner;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Builds the raw {@link FieldDescriptor} of one form control: type, labels, identifiers, required flag,
 * placeholder and options. Grouping with other fields happens afterwards in {@link PageExtractor}.
 */
public final class FieldExtractor {

    static final List<String> PAGE_CHROME = List.of("header", "footer", "nav");

    private static final Pattern MULTISELECT_ID = Pattern.compile(".*multiselect.*[-_]id$");

    private final BrowserSession session;
    private final Blacklist blacklist;
    private final LabelResolver labels = new LabelResolver();
    private final AssociatedTextFinder associatedText;
    private final RequiredDetector required;

    public FieldExtractor(BrowserSession session, KeywordTables tables, AutofillSettings settings) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.blacklist = new Blacklist(tables);
        this.associatedText = new AssociatedTextFinder(settings);
        this.required = new RequiredDetector(session);
    }

    /**
     * @param force       skip page-chrome and blacklist filtering (used for controls revealed by an answer)
     * @param parentLabel question of the field whose answer revealed this one; may be null
     * @return empty when the control is filtered out
     */
    public Optional<FieldDescriptor> extract(Element element, Locator locator, ParseContext context,
                                             boolean force, String parentLabel) {
        String declaredType = element.attr("type").toLowerCase(Locale.ROOT);
        if ("hidden".equals(declaredType) && element.hasAttr("disabled")) {
            return Optional.empty();
        }
        if (!force && ElementAttributes.isInside(element, PAGE_CHROME)) {
            return Optional.empty();
        }

        FieldType type = initialType(element, declaredType);
        FieldDescriptor field = new FieldDescriptor(element.normalName(), locator, type);

        String tagLabel = labels.tagLabel(element).orElse("");
        String attributeLabel = firstValue(ElementAttributes.search(element, List.of("label")).values());
        if (attributeLabel.isEmpty()) {
            attributeLabel = element.attr("aria-label");
        }
        String customLabel = ElementAttributes.custom(element, "label");
        String textLabel = context.isNamespaced() ? "" : associatedText.find(element).orElse("");
        field.setLabel(LabelSource.TAG, tagLabel);
        field.setLabel(LabelSource.ATTRIBUTE, attributeLabel);
        field.setLabel(LabelSource.CUSTOM, customLabel);
        field.setLabel(LabelSource.TEXT, textLabel);
        field.setLabel(LabelSource.PARENT, parentLabel);

        field.setId(element.attr("id"));
        field.setCustomId(ElementAttributes.custom(element, "id"));
        field.setRequired(required.isRequired(element, locator, context.isNamespaced())
                || RequiredDetector.hasRequiredMarker(field.label(LabelSource.TAG), field.label(LabelSource.TEXT)));
        field.setPlaceholder("button".equals(element.normalName())
                ? TextCleaner.clean(element.text())
                : element.attr("placeholder"));

        if (!force && !field.isRequired() && isBlacklistedOptional(field)) {
            return Optional.empty();
        }

        field.setName(element.attr("name"));
        field.setValue(element.attr("value"));

        String multiselectId = multiselectId(element);
        if (multiselectId != null) {
            field.setType(FieldType.MULTISELECT);
            field.setMultiselectId(multiselectId);
        } else if (field.getType() == FieldType.SELECT) {
            addSelectOptions(field, element, locator);
        } else if (field.getType().isOptionGroup()) {
            String caption = field.primaryLabel();
            if (!caption.isEmpty()) {
                field.addChoice(caption, locator);
            }
        }

        if (!force && isBlacklistedByType(field)) {
            return Optional.empty();
        }
        if (!session.isDisplayed(locator.expression())) {
            field.setType(FieldType.HIDDEN);
        }
        return Optional.of(field);
    }

    static FieldType initialType(Element element, String declaredType) {
        String tag = element.normalName();
        FieldType type;
        if ("select".equals(tag)) {
            type = FieldType.SELECT;
        } else if ("textarea".equals(tag)) {
            type = FieldType.TEXTAREA;
        } else if ("input".equals(tag)) {
            type = FieldType.fromCode(declaredType);
        } else {
            type = FieldType.OTHER;
        }
        return ElementAttributes.isListType(element) ? FieldType.LIST : type;
    }

    private boolean isBlacklistedOptional(FieldDescriptor field) {
        return blacklist.partial(KeywordTable.FIELD_LABEL_BLACKLIST_PARTIAL,
                field.label(LabelSource.TAG), field.label(LabelSource.TEXT),
                field.label(LabelSource.ATTRIBUTE), field.label(LabelSource.CUSTOM))
                || blacklist.partial(KeywordTable.FIELD_ID_BLACKLIST_PARTIAL, field.getId(), field.getCustomId())
                || blacklist.partial(KeywordTable.FIELD_PLACEHOLDER_BLACKLIST_PARTIAL, field.getPlaceholder());
    }

    private boolean isBlacklistedByType(FieldDescriptor field) {
        String[] candidates = {
                field.label(LabelSource.TAG), field.label(LabelSource.TEXT), field.label(LabelSource.ATTRIBUTE),
                field.label(LabelSource.CUSTOM), field.getName(), field.getId(), field.getCustomId(), field.getPlaceholder()
        };
        return switch (field.getType()) {
            case LIST -> blacklist.partial(KeywordTable.LIST_TYPE_BLACKLIST_PARTIAL, candidates);
            case MULTISELECT -> blacklist.partial(KeywordTable.MULTISELECT_TYPE_BLACKLIST_PARTIAL, candidates);
            default -> false;
        };
    }

    private void addSelectOptions(FieldDescriptor field, Element select, Locator locator) {
        int position = 0;
        for (Element option : select.getElementsByTag("option")) {
            position++;
            String text = TextCleaner.clean(option.text());
            if (blacklist.full(KeywordTable.DROPDOWN_OPTION_BLACKLIST_FULL, text)
                    || blacklist.partial(KeywordTable.DROPDOWN_OPTION_BLACKLIST_PARTIAL, text)) {
                continue;
            }
            field.addChoice(text, Locator.of("(" + locator.expression() + "//option)[" + position + "]"));
        }
    }

    private static String multiselectId(Element element) {
        for (Attribute a : element.attributes()) {
            if (MULTISELECT_ID.matcher(a.getKey().toLowerCase(Locale.ROOT)).matches()) {
                return a.getValue();
            }
        }
        return null;
    }

    private static String firstValue(Iterable<String> values) {
        for (String v : values) {
            return v == null ? "" : v;
        }
        return "";
    }
}
