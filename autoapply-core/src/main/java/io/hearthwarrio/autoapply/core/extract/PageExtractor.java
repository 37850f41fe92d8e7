package io.hearthwarrio.autoapply.core.extract;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.config.Profile;
import io.hearthwarrio.autoapply.core.diff.DomSnapshot;
import io.hearthwarrio.autoapply.core.diff.NewElementFinder;
import io.hearthwarrio.autoapply.core.locator.LocatorEngine;
import io.hearthwarrio.autoapply.core.model.ButtonDescriptor;
import io.hearthwarrio.autoapply.core.model.FieldDescriptor;
import io.hearthwarrio.autoapply.core.model.FieldType;
import io.hearthwarrio.autoapply.core.model.LabelSource;
import io.hearthwarrio.autoapply.core.model.LinkDescriptor;
import io.hearthwarrio.autoapply.core.model.Locator;
import io.hearthwarrio.autoapply.core.model.PageMetadata;
import io.hearthwarrio.autoapply.core.model.PageModel;
import io.hearthwarrio.autoapply.core.model.SearchKey;
import io.hearthwarrio.autoapply.core.model.UploadKind;
import io.hearthwarrio.autoapply.core.session.BrowserSession;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns the current page into a {@link PageModel}.
 * <p>
 * One pass: snapshot the live DOM, collect candidate controls in document order, give each a live
 * {@link Locator}, then classify. All per-pass counters live in a {@link ParseContext}; nothing is kept
 * between calls of {@link #parse()}.
 */
public final class PageExtractor {

    private static final Logger log = LoggerFactory.getLogger(PageExtractor.class);

    private static final Set<String> NON_FIELD_INPUTS = Set.of("submit", "button", "reset", "image");

    private static final List<SearchKey> BUTTON_FIELD_KEYS = List.of(
            SearchKey.LABEL_TAG, SearchKey.LABEL_TEXT, SearchKey.LABEL_CUSTOM,
            SearchKey.NAME, SearchKey.ID, SearchKey.CUSTOM_ID, SearchKey.VALUE);

    private final BrowserSession session;
    private final LocatorEngine locators;
    private final Profile profile;
    private final FieldExtractor fieldExtractor;
    private final ControlExtractor controlExtractor;
    private final VerificationFieldDetector verification;
    private final DateFieldDetector dates;
    private final OptionGroupMerger merger;
    private final SectionGrouper sections;
    private final UploadFieldDetector uploads;

    public PageExtractor(BrowserSession session,
                         LocatorEngine locators,
                         AutofillSettings settings,
                         KeywordTables tables,
                         Profile profile) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.locators = Objects.requireNonNull(locators, "locators must not be null");
        this.profile = Objects.requireNonNull(profile, "profile must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(tables, "tables must not be null");
        this.fieldExtractor = new FieldExtractor(session, tables, settings);
        this.controlExtractor = new ControlExtractor(tables, settings);
        this.verification = new VerificationFieldDetector(tables);
        this.dates = new DateFieldDetector(tables, settings);
        this.merger = new OptionGroupMerger(tables, settings);
        this.sections = new SectionGrouper(tables, settings);
        this.uploads = new UploadFieldDetector(tables);
    }

    /**
     * Parses the page with a fresh context.
     */
    public PageModel parse() {
        DomSnapshot snapshot = DomSnapshot.parse(session.snapshot());
        return parse(snapshot, new ParseContext(profile, snapshot.hasNamespaces()));
    }

    /**
     * Parses an already captured snapshot; the caller keeps the context to extract revealed
     * elements against the same counters later.
     */
    public PageModel parse(DomSnapshot snapshot, ParseContext context) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(context, "context must not be null");
        PageMetadata metadata = new PageMetadata(session.currentUrl(), session.title(), context.isNamespaced());

        List<FieldDescriptor> fields = new ArrayList<>();
        List<Element> listButtons = new ArrayList<>();
        for (Element e : fieldCandidates(snapshot)) {
            if ("button".equals(e.normalName())) {
                listButtons.add(e);
            }
            addField(e, null, context, false, null, fields);
        }

        List<ButtonDescriptor> buttons = new ArrayList<>();
        for (Element e : snapshot.select(NewElementFinder.BUTTON_QUERIES)) {
            if (listButtons.contains(e) || ElementAttributes.isMarkedHidden(e)) {
                continue;
            }
            Optional<Locator> locator = locators.synthesize(e, context.isNamespaced());
            if (locator.isEmpty()) {
                continue;
            }
            controlExtractor.button(e, locator.get(), context, false)
                    .ifPresent(b -> synchronizeButton(b, e, fields, buttons));
        }

        List<LinkDescriptor> links = new ArrayList<>();
        for (Element e : snapshot.document().select("a[href]")) {
            Optional<Locator> locator = locators.synthesize(e, context.isNamespaced());
            if (locator.isPresent()) {
                controlExtractor.link(e, locator.get()).ifPresent(links::add);
            }
        }

        removeHidden(fields);
        log.debug("Parsed {}: {} fields, {} buttons, {} links", metadata.getUrl(), fields.size(), buttons.size(), links.size());
        return new PageModel(metadata, fields, buttons, links);
    }

    /**
     * Extracts controls revealed by an interaction, found in a later capture of the page.
     *
     * @param ancestorPaths absolute paths of changed subtrees, used to scope locators
     * @param parentLabel   question of the field whose answer revealed them
     */
    public Revealed extractRevealed(List<Element> elements, List<String> ancestorPaths,
                                    ParseContext context, String parentLabel) {
        List<FieldDescriptor> fields = new ArrayList<>();
        List<ButtonDescriptor> buttons = new ArrayList<>();
        for (Element e : elements) {
            if (ElementAttributes.isMarkedHidden(e)) {
                continue;
            }
            if (isFieldCandidate(e)) {
                Optional<Locator> locator = locators.synthesizeRevealed(e, ancestorPaths, context.isNamespaced());
                if (locator.isPresent()) {
                    addField(e, locator.get(), context, true, parentLabel, fields);
                }
            } else if (isButtonLike(e)) {
                Optional<Locator> locator = locators.synthesizeRevealed(e, ancestorPaths, context.isNamespaced());
                if (locator.isPresent()) {
                    controlExtractor.button(e, locator.get(), context, true)
                            .ifPresent(b -> synchronizeButton(b, e, fields, buttons));
                }
            }
        }
        removeHidden(fields);
        return new Revealed(fields, buttons);
    }

    private void addField(Element element, Locator known, ParseContext context, boolean force,
                          String parentLabel, List<FieldDescriptor> fields) {
        if (ElementAttributes.isMarkedHidden(element)) {
            return;
        }
        Locator locator = known;
        if (locator == null) {
            Optional<Locator> synthesized = locators.synthesize(element, context.isNamespaced());
            if (synthesized.isEmpty()) {
                return;
            }
            locator = synthesized.get();
        }
        Optional<FieldDescriptor> extracted = fieldExtractor.extract(element, locator, context, force, parentLabel);
        if (extracted.isPresent()) {
            synchronizeField(extracted.get(), element, context, fields);
        }
    }

    private void synchronizeField(FieldDescriptor field, Element element, ParseContext context,
                                  List<FieldDescriptor> fields) {
        verification.apply(field, context);
        dates.reclassify(field);
        if (merger.mergeInto(field, fields)) {
            return;
        }
        if (!sections.classify(field, element, context)) {
            return;
        }
        if (field.getType().isDate()) {
            dates.tag(field, element, context, sections.labelWithinLimit(field));
        }
        UploadFieldDetector.Verdict verdict = uploads.inspect(field, element,
                element.attr("type").toLowerCase(Locale.ROOT), SearchKey.FIELD_AND_PLACEHOLDER);
        if (verdict == UploadFieldDetector.Verdict.CLOUD) {
            log.debug("Dropping cloud upload control {}", field);
            return;
        }
        if (verdict.isUpload()) {
            field.setType(FieldType.FILE);
            field.setUploadKind(verdict.kind());
        }
        fields.add(field);
    }

    private void synchronizeButton(ButtonDescriptor button, Element element,
                                   List<FieldDescriptor> fields, List<ButtonDescriptor> buttons) {
        if (button.getText().isEmpty() && button.primaryLabel().isEmpty()
                && button.getId().isEmpty() && button.getName().isEmpty()) {
            return;
        }
        UploadFieldDetector.Verdict verdict = uploads.inspect(button, element,
                element.attr("type").toLowerCase(Locale.ROOT), SearchKey.BUTTON);
        if (verdict == UploadFieldDetector.Verdict.CLOUD) {
            return;
        }
        if (verdict.isUpload()) {
            button.setType("file");
            button.setUploadKind(verdict.kind());
        }
        if (!button.isSubmit() && attachToField(button, fields)) {
            return;
        }
        buttons.add(button);
    }

    /**
     * A button standing in for a field (custom dropdown trigger, styled upload) is folded into the field.
     *
     * @return true when the button was absorbed
     */
    private static boolean attachToField(ButtonDescriptor button, List<FieldDescriptor> fields) {
        for (FieldDescriptor field : fields) {
            if (!sharesValue(button, field)) {
                continue;
            }
            if (field.getType() == FieldType.LIST) {
                field.setLocator(button.getLocator());
            } else if (field.getType() == FieldType.HIDDEN) {
                if ("file".equals(button.getType())) {
                    field.setType(FieldType.FILE);
                    field.setUploadKind(button.getUploadKind() == null ? UploadKind.OTHER : button.getUploadKind());
                } else {
                    field.setType(FieldType.BUTTON);
                }
                field.setLocator(button.getLocator());
            }
            fillEmpty(field, button);
            return true;
        }
        return false;
    }

    private static boolean sharesValue(ButtonDescriptor button, FieldDescriptor field) {
        for (SearchKey key : BUTTON_FIELD_KEYS) {
            String fieldValue = field.valueOf(key);
            String buttonValue = key == SearchKey.VALUE ? button.getText() : button.valueOf(key);
            if (!fieldValue.isEmpty() && fieldValue.equals(buttonValue)) {
                return true;
            }
        }
        return false;
    }

    private static void fillEmpty(FieldDescriptor field, ButtonDescriptor button) {
        for (LabelSource source : LabelSource.values()) {
            if (field.label(source).isEmpty()) {
                field.setLabel(source, button.label(source));
            }
        }
        if (field.getId().isEmpty()) {
            field.setId(button.getId());
        }
        if (field.getCustomId().isEmpty()) {
            field.setCustomId(button.getCustomId());
        }
        if (field.getName().isEmpty()) {
            field.setName(button.getName());
        }
        if (field.getPlaceholder().isEmpty()) {
            field.setPlaceholder(button.getText());
        }
    }

    private static void removeHidden(List<FieldDescriptor> fields) {
        Iterator<FieldDescriptor> it = fields.iterator();
        while (it.hasNext()) {
            if (it.next().getType() == FieldType.HIDDEN) {
                it.remove();
            }
        }
    }

    private static List<Element> fieldCandidates(DomSnapshot snapshot) {
        List<Element> out = new ArrayList<>();
        Element body = snapshot.body();
        if (body == null) {
            return out;
        }
        for (Element e : body.getAllElements()) {
            if (isFieldCandidate(e)) {
                out.add(e);
            }
        }
        return out;
    }

    static boolean isFieldCandidate(Element e) {
        return switch (e.normalName()) {
            case "input" -> !NON_FIELD_INPUTS.contains(e.attr("type").toLowerCase(Locale.ROOT));
            case "textarea", "select" -> true;
            case "button" -> ElementAttributes.isListType(e);
            default -> false;
        };
    }

    private static boolean isButtonLike(Element e) {
        String tag = e.normalName();
        String type = e.attr("type").toLowerCase(Locale.ROOT);
        return "button".equals(tag)
                || ("input".equals(tag) && ("submit".equals(type) || "button".equals(type)))
                || "button".equals(e.attr("role"));
    }

    /**
     * Fields and buttons found among revealed elements, in document order.
     */
    public static final class Revealed {

        private final List<FieldDescriptor> fields;
        private final List<ButtonDescriptor> buttons;

        public Revealed(List<FieldDescriptor> fields, List<ButtonDescriptor> buttons) {
            this.fields = List.copyOf(fields);
            this.buttons = List.copyOf(buttons);
        }

        public List<FieldDescriptor> fields() {
            return fields;
        }

        public List<ButtonDescriptor> buttons() {
            return buttons;
        }

        public boolean isEmpty() {
            return fields.isEmpty() && buttons.isEmpty();
        }
    }
}
