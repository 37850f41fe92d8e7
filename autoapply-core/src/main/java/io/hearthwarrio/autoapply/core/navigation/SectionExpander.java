package io.hearthwarrio.autoapply.core.navigation;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.KeywordTable;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.config.Profile;
import io.hearthwarrio.autoapply.core.config.Setting;
import io.hearthwarrio.autoapply.core.extract.PageExtractor;
import io.hearthwarrio.autoapply.core.locator.XPaths;
import io.hearthwarrio.autoapply.core.model.ButtonDescriptor;
import io.hearthwarrio.autoapply.core.model.FieldDescriptor;
import io.hearthwarrio.autoapply.core.model.PageModel;
import io.hearthwarrio.autoapply.core.model.SearchKey;
import io.hearthwarrio.autoapply.core.model.SectionCategory;
import io.hearthwarrio.autoapply.core.model.SectionSubtypes;
import io.hearthwarrio.autoapply.core.session.BrowserSession;
import io.hearthwarrio.autoapply.core.session.SessionException;
import io.hearthwarrio.autoapply.core.text.TextQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Makes the repeatable sections of a logged-in form match the profile: expands collapsed sections, adds
 * or removes work experience and education blocks until their count equals the profile's, and clears
 * previously uploaded files.
 * <p>
 * Each step that touches the page is followed by a fresh parse; the number of rounds is bounded by
 * {@code 5 + work entries + education entries}.
 */
public final class SectionExpander {

    private static final Logger log = LoggerFactory.getLogger(SectionExpander.class);

    private static final int BASE_ROUNDS = 5;
    private static final String HEADING_TAGS =
            "self::label or self::h1 or self::h2 or self::h3 or self::h4 or self::h5 or self::h6";

    private enum Phase {
        EXPAND_ALL,
        WORK_EXPERIENCE,
        EDUCATION,
        UPLOADED_FILES,
        DONE
    }

    private final BrowserSession session;
    private final PageExtractor extractor;
    private final ActionClicker clicker;
    private final KeywordTables tables;
    private final Profile profile;
    private final Duration settle;

    private Phase phase;

    public SectionExpander(BrowserSession session,
                           PageExtractor extractor,
                           ActionClicker clicker,
                           KeywordTables tables,
                           Profile profile,
                           AutofillSettings settings) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.clicker = Objects.requireNonNull(clicker, "clicker must not be null");
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
        this.profile = Objects.requireNonNull(profile, "profile must not be null");
        this.settle = Objects.requireNonNull(settings, "settings must not be null").seconds(Setting.STABLE_DOM_TIMEOUT_SECONDS);
    }

    /**
     * @return the page as parsed after the last change, or the given capture when nothing changed
     */
    public PageCapture expand(PageCapture capture) {
        phase = Phase.EXPAND_ALL;
        int maxRounds = BASE_ROUNDS
                + profile.entryCount(SectionCategory.WORK_EXPERIENCE)
                + profile.entryCount(SectionCategory.EDUCATION);
        PageCapture current = capture;
        int round = 1;
        while (step(current.page())) {
            log.debug("Sections changed in phase {}, round {}", phase, round);
            current = PageCapture.take(session, extractor, profile);
            round++;
            if (round > maxRounds) {
                log.warn("Section expansion stopped after {} rounds", maxRounds);
                break;
            }
        }
        return current;
    }

    /**
     * @return true when the page was touched and must be parsed again
     */
    private boolean step(PageModel page) {
        if (phase == Phase.EXPAND_ALL) {
            phase = Phase.WORK_EXPERIENCE;
            List<ButtonDescriptor> expand = buttons(page, KeywordTable.EXPAND_ALL_IDENTIFIERS);
            if (!expand.isEmpty() && press(expand.get(0))) {
                return true;
            }
        }
        boolean hasWork = hasWorkSection(page);
        if (phase == Phase.WORK_EXPERIENCE) {
            if (hasWork) {
                Resize r = resize(page, sectionFields(page, SectionCategory.WORK_EXPERIENCE, SectionSubtypes.JOB_TITLE),
                        profile.entryCount(SectionCategory.WORK_EXPERIENCE), 0, 0);
                if (r != Resize.NOTHING) {
                    return r == Resize.CHANGED;
                }
            }
            phase = Phase.EDUCATION;
        }
        if (phase == Phase.EDUCATION) {
            if (hasEducationSection(page)) {
                List<FieldDescriptor> schools = sectionFields(page, SectionCategory.EDUCATION, SectionSubtypes.SCHOOL);
                int firstAdd = hasWork ? 1 : 0;
                int removePadding = session.pageText().contains(SectionCategory.WORK_EXPERIENCE.label())
                        ? sectionFields(page, SectionCategory.WORK_EXPERIENCE, SectionSubtypes.JOB_TITLE).size()
                        : 0;
                Resize r = resize(page, schools, profile.entryCount(SectionCategory.EDUCATION), firstAdd, removePadding);
                if (r != Resize.NOTHING) {
                    return r == Resize.CHANGED;
                }
            }
            phase = Phase.UPLOADED_FILES;
        }
        if (phase == Phase.UPLOADED_FILES) {
            phase = Phase.DONE;
            return clearUploadedFiles(page);
        }
        return false;
    }

    private enum Resize {
        CHANGED,
        /**
         * No way to fix the count; ends the expansion with the page as it is.
         */
        STUCK,
        NOTHING
    }

    /**
     * @param primary       first field of every present section, in document order
     * @param firstAdd      index of the category's "add" button while no section exists
     * @param removePadding remove buttons of other sections preceding this category's
     */
    private Resize resize(PageModel page, List<FieldDescriptor> primary, int wanted, int firstAdd, int removePadding) {
        int present = primary.size();
        if (present < wanted) {
            List<ButtonDescriptor> adds = buttons(page, KeywordTable.ADD_SECTION_IDENTIFIERS);
            ButtonDescriptor target = null;
            if (present == 0) {
                target = firstAdd < adds.size() ? adds.get(firstAdd) : null;
            } else {
                String last = primary.get(present - 1).getLocator().expression();
                for (ButtonDescriptor add : adds) {
                    if (session.isAfter(add.getLocator().expression(), last)) {
                        target = add;
                        break;
                    }
                }
            }
            if (target != null && press(target)) {
                log.info("Added a section ({} of {})", present + 1, wanted);
                return Resize.CHANGED;
            }
            log.info("No add button for {} more sections", wanted - present);
            return Resize.NOTHING;
        }
        if (present > wanted) {
            List<ButtonDescriptor> removes = buttons(page, KeywordTable.REMOVE_SECTION_IDENTIFIERS);
            if (removes.isEmpty()) {
                log.warn("{} sections present, {} wanted, and no remove button", present, wanted);
                return Resize.STUCK;
            }
            int toRemove = present - wanted;
            if (toRemove > removes.size()) {
                for (int i = removes.size() - 1; i >= 0; i--) {
                    press(removes.get(i));
                }
                return Resize.CHANGED;
            }
            // from the bottom, so earlier buttons keep their positions
            for (int i = removePadding + present - 1; i >= 0 && toRemove > 0; i--) {
                if (i < removes.size() && press(removes.get(i))) {
                    toRemove--;
                }
            }
            return Resize.CHANGED;
        }
        return Resize.NOTHING;
    }

    private boolean clearUploadedFiles(PageModel page) {
        TextQuery fileButton = TextQuery.of(SearchKey.BUTTON, tables.get(KeywordTable.UPLOADED_FILE_IDENTIFIERS));
        TextQuery clear = TextQuery.of(SearchKey.BUTTON, tables.get(KeywordTable.CLEAR_FILE_IDENTIFIERS));
        List<ButtonDescriptor> buttons = page.getButtons();
        boolean changed = false;
        for (int i = buttons.size() - 1; i >= 0; i--) {
            ButtonDescriptor b = buttons.get(i);
            if (!fileButton.matches(b) || !clear.matches(b)) {
                continue;
            }
            if (!clicker.isLive(ActionItem.of(b, ActionItem.Role.OTHER))) {
                // positions shifted under us; parse again
                return true;
            }
            if (press(b)) {
                log.info("Cleared uploaded file via '{}'", b.getText());
                changed = true;
            }
        }
        return changed;
    }

    private boolean press(ButtonDescriptor button) {
        String xpath = button.getLocator().expression();
        try {
            session.scrollIntoView(xpath);
            session.click(xpath);
        } catch (SessionException e) {
            log.debug("Section control '{}' rejected the click: {}", button.getText(), e.getMessage());
            return false;
        }
        session.waitUntilStable(settle, 0);
        return true;
    }

    private boolean hasWorkSection(PageModel page) {
        return !sectionFields(page, SectionCategory.WORK_EXPERIENCE, SectionSubtypes.JOB_TITLE).isEmpty()
                || headingPresent(KeywordTable.WORK_SECTION_HEADINGS_CASE_SENSITIVE);
    }

    private boolean hasEducationSection(PageModel page) {
        return !sectionFields(page, SectionCategory.EDUCATION, SectionSubtypes.SCHOOL).isEmpty()
                || headingPresent(KeywordTable.EDUCATION_SECTION_HEADINGS_CASE_SENSITIVE);
    }

    private boolean headingPresent(KeywordTable headings) {
        for (String h : tables.get(headings)) {
            if (session.count("//*[" + HEADING_TAGS + "][contains(., " + XPaths.literal(h) + ")]") > 0) {
                return true;
            }
        }
        return false;
    }

    private List<ButtonDescriptor> buttons(PageModel page, KeywordTable identifiers) {
        return new PageSignals(page, tables).buttons(identifiers);
    }

    private static List<FieldDescriptor> sectionFields(PageModel page, SectionCategory category, String subtype) {
        return page.fieldsMatching(f -> f.inSection(category) && subtype.equals(f.getSection().getSubtype()));
    }
}
