package io.hearthwarrio.autoapply.core.upload;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.Setting;
import io.hearthwarrio.autoapply.core.diff.DomSnapshot;
import io.hearthwarrio.autoapply.core.diff.HtmlDiff;
import io.hearthwarrio.autoapply.core.diff.NewElementFinder;
import io.hearthwarrio.autoapply.core.locator.LocatorEngine;
import io.hearthwarrio.autoapply.core.model.Locator;
import io.hearthwarrio.autoapply.core.session.BrowserSession;
import io.hearthwarrio.autoapply.core.session.NativeFileDialog;
import io.hearthwarrio.autoapply.core.session.SessionException;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Attaches a file to a page, either straight into a file input or through whatever a button opens.
 * <p>
 * Button uploads run inside the {@link UploadQueue}: click, and if an OS picker opened, choose the file
 * there; otherwise look for a file input the click revealed. A second click gives the picker another
 * chance. The picker is always dismissed before the queue is released.
 */
public final class FileUploader {

    private static final Logger log = LoggerFactory.getLogger(FileUploader.class);

    private static final List<String> FILE_INPUTS = List.of("//input[@type='file']");

    private final BrowserSession session;
    private final NativeFileDialog dialog;
    private final UploadQueue queue;
    private final LocatorEngine locators;
    private final Duration settle;
    private final int padding;

    public FileUploader(BrowserSession session,
                        NativeFileDialog dialog,
                        UploadQueue queue,
                        LocatorEngine locators,
                        AutofillSettings settings) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.dialog = Objects.requireNonNull(dialog, "dialog must not be null");
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.locators = Objects.requireNonNull(locators, "locators must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        this.settle = settings.seconds(Setting.STABLE_DOM_TIMEOUT_SECONDS);
        this.padding = settings.getInt(Setting.STABLE_DOM_PADDING_SECONDS);
    }

    /**
     * True when the file name already shows on the page, i.e. an earlier upload stuck.
     */
    public boolean isAttached(Path file) {
        return session.pageText().contains(file.getFileName().toString());
    }

    /**
     * Sends the path to a file input and checks that the page now names the file.
     */
    public boolean uploadToInput(Locator input, Path file) {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(file, "file must not be null");
        try {
            session.uploadFile(input.expression(), file);
        } catch (SessionException e) {
            log.warn("File input {} rejected {}", input, file, e);
            return false;
        }
        session.waitUntilStable(settle, padding);
        boolean ok = isAttached(file) || file.getFileName().toString().equals(fileNameOf(input));
        log.info("Upload of {} through input {}: {}", file.getFileName(), input, ok ? "attached" : "not visible");
        return ok;
    }

    /**
     * Clicks an upload control and attaches the file through the picker or a revealed file input.
     *
     * @param caller queue identity, for logs
     */
    public boolean uploadThroughButton(Locator button, Path file, String caller) {
        Objects.requireNonNull(button, "button must not be null");
        Objects.requireNonNull(file, "file must not be null");
        return queue.run(caller, () -> {
            try {
                return attach(button, file);
            } finally {
                if (dialog.isOpen()) {
                    dialog.dismiss();
                }
            }
        });
    }

    private boolean attach(Locator button, Path file) {
        DomSnapshot before = DomSnapshot.parse(session.snapshot());
        session.click(button.expression());
        session.waitUntilStable(settle, padding);
        if (dialog.isOpen()) {
            return choose(file);
        }

        DomSnapshot after = DomSnapshot.parse(session.snapshot());
        Optional<Locator> input = revealedInput(before, after);
        if (input.isPresent() && uploadToInput(input.get(), file)) {
            return true;
        }

        session.click(button.expression());
        session.waitUntilStable(settle, padding);
        if (dialog.isOpen()) {
            return choose(file);
        }
        log.warn("Upload control {} opened neither a picker nor a file input", button);
        return false;
    }

    private boolean choose(Path file) {
        boolean accepted = dialog.choose(file);
        session.waitUntilStable(settle, padding);
        boolean ok = accepted && isAttached(file);
        log.info("Upload of {} through the file picker: {}", file.getFileName(), ok ? "attached" : "failed");
        return ok;
    }

    private Optional<Locator> revealedInput(DomSnapshot before, DomSnapshot after) {
        List<Element> found = NewElementFinder.find(before, after, FILE_INPUTS);
        if (found.isEmpty()) {
            // inputs that existed all along but stayed hidden until now
            found = after.select(FILE_INPUTS);
        }
        List<String> ancestors = HtmlDiff.diff(before, after).ancestorPaths();
        for (Element e : found) {
            Optional<Locator> l = locators.synthesizeRevealed(e, ancestors, after.hasNamespaces());
            if (l.isPresent()) {
                return l;
            }
        }
        return Optional.empty();
    }

    private String fileNameOf(Locator input) {
        String v = session.attribute(input.expression(), "value");
        if (v == null) {
            return "";
        }
        int slash = Math.max(v.lastIndexOf('/'), v.lastIndexOf('\\'));
        return v.substring(slash + 1);
    }
}
