package io.hearthwarrio.autoapply.core.navigation;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.KeywordTable;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.config.Setting;
import io.hearthwarrio.autoapply.core.model.AuthType;
import io.hearthwarrio.autoapply.core.model.ButtonDescriptor;
import io.hearthwarrio.autoapply.core.model.LinkDescriptor;
import io.hearthwarrio.autoapply.core.model.PageItem;
import io.hearthwarrio.autoapply.core.model.PageModel;
import io.hearthwarrio.autoapply.core.model.SearchKey;
import io.hearthwarrio.autoapply.core.session.BrowserSession;
import io.hearthwarrio.autoapply.core.session.VerificationMailbox;
import io.hearthwarrio.autoapply.core.text.TextQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Classifies auth pages, picks the control that submits them and clears verification locks.
 * <p>
 * Codes and links are read from a {@link VerificationMailbox}; this class only knows how many cells the
 * page asks for and what to do with the answer.
 */
public final class AuthResolver {

    private static final Logger log = LoggerFactory.getLogger(AuthResolver.class);

    /**
     * Cell counts a verification code may be split into.
     */
    public static final Set<Integer> CODE_CELLS = Set.of(1, 4, 6);

    private static final Duration MAILBOX_POLL = Duration.ofSeconds(5);
    private static final int RELOAD_PADDING_SECONDS = 1;

    /**
     * What a verification-lock check did.
     */
    public enum Lock {
        /**
         * The lock was handled or is being handled by the page; parse again.
         */
        RETRY,
        FAILED,
        ABSENT
    }

    private final BrowserSession session;
    private final ActionClicker clicker;
    private final VerificationMailbox mailbox;
    private final KeywordTables tables;
    private final Clock clock;
    private final Duration mailboxWait;
    private final Duration settle;

    public AuthResolver(BrowserSession session,
                        ActionClicker clicker,
                        VerificationMailbox mailbox,
                        KeywordTables tables,
                        AutofillSettings settings,
                        Clock clock) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.clicker = Objects.requireNonNull(clicker, "clicker must not be null");
        this.mailbox = mailbox == null ? VerificationMailbox.NONE : mailbox;
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        this.mailboxWait = settings.seconds(Setting.VERIFICATION_WAIT_SECONDS);
        this.settle = settings.seconds(Setting.STABLE_DOM_TIMEOUT_SECONDS);
    }

    /**
     * Decides the auth type of the page and the item that submits it.
     * <p>
     * Buttons are scanned bottom-up into sign-up, sign-in, verify and other slots, a {@code submit} button
     * replacing a non-submit one in its slot. A submit button of a known type wins, corrected by the number
     * of password fields (one means sign-in, two mean sign-up). When no typed button fits, a generic
     * button is used with the type inferred from the fields. Pages without any usable button are moved on
     * by clicking a generic button, a sign-up or sign-in link, or the apply control, in that order.
     */
    public AuthPlan classify(PageModel page) {
        PageSignals s = new PageSignals(page, tables);
        int emails = s.emailFields().size();
        int passwords = s.passwordFields().size();

        ButtonDescriptor signUp = null;
        ButtonDescriptor signIn = null;
        ButtonDescriptor verify = null;
        ButtonDescriptor other = null;
        TextQuery signUpQ = textQuery(KeywordTable.SIGN_UP_IDENTIFIERS);
        TextQuery signInQ = textQuery(KeywordTable.SIGN_IN_IDENTIFIERS);
        TextQuery verifyQ = textQuery(KeywordTable.VERIFY_IDENTIFIERS);
        TextQuery otherQ = textQuery(KeywordTable.OTHER_AUTH_IDENTIFIERS);
        List<ButtonDescriptor> buttons = page.getButtons();
        for (int i = buttons.size() - 1; i >= 0; i--) {
            ButtonDescriptor b = buttons.get(i);
            if (signUpQ.matches(b)) {
                signUp = preferSubmit(signUp, b);
            } else if (signInQ.matches(b)) {
                signIn = preferSubmit(signIn, b);
            } else if (verifyQ.matches(b)) {
                verify = preferSubmit(verify, b);
            } else if (otherQ.matches(b)) {
                other = preferSubmit(other, b);
            }
        }

        ButtonDescriptor chosen = null;
        AuthType type = null;
        if (isSubmit(signUp)) {
            chosen = signUp;
            type = AuthType.SIGN_UP;
        } else if (isSubmit(signIn)) {
            chosen = signIn;
            type = AuthType.SIGN_IN;
        } else if (isSubmit(verify)) {
            chosen = verify;
            type = AuthType.VERIFY;
        }
        if (chosen == signUp && chosen != null && passwords == 1) {
            ButtonDescriptor alt = isSubmit(signIn) ? signIn : isSubmit(other) ? other : null;
            if (alt != null) {
                chosen = alt;
                type = AuthType.SIGN_IN;
            }
        } else if (chosen == signIn && chosen != null && passwords == 2) {
            ButtonDescriptor alt = signUp != null ? signUp : other;
            if (alt != null) {
                chosen = alt;
                type = AuthType.SIGN_UP;
            }
        }

        if (chosen == null && isSubmit(other)) {
            type = inferFromFields(emails, passwords, s);
            if (type != null) {
                chosen = other;
            }
        }

        if (chosen == null) {
            if (signUp != null) {
                chosen = signUp;
                type = AuthType.SIGN_UP;
                if (passwords == 1 && (signIn != null || other != null)) {
                    chosen = signIn != null ? signIn : other;
                    type = AuthType.SIGN_IN;
                }
            } else if (signIn != null) {
                chosen = signIn;
                type = AuthType.SIGN_IN;
                if (passwords == 2 && other != null) {
                    chosen = other;
                    type = AuthType.SIGN_UP;
                }
            } else if (verify != null) {
                chosen = verify;
                type = AuthType.VERIFY;
            }
            if (chosen == null && other != null) {
                type = inferFromFields(emails, passwords, s);
                if (type != null) {
                    chosen = other;
                }
            }
        }

        if (chosen == null) {
            return lastResort(page, s, other);
        }

        ActionItem item = ActionItem.of(chosen, ActionItem.Role.AUTH);
        if ((type == AuthType.SIGN_UP || type == AuthType.SIGN_IN) && emails + passwords == 0) {
            log.info("{} control without credential fields, clicking through", type);
            clicker.click(item);
            return AuthPlan.handled();
        }
        if (type == AuthType.VERIFY && page.fieldCount() == 0) {
            log.info("Verify control without fields, clicking through");
            clicker.click(item);
            return AuthPlan.handled();
        }

        Map<AuthType, List<ActionItem>> byType = new EnumMap<>(AuthType.class);
        byType.put(AuthType.SIGN_UP, items(signUp, other));
        byType.put(AuthType.SIGN_IN, items(signIn, other));
        byType.put(AuthType.VERIFY, items(verify, other));
        AuthPlan plan = AuthPlan.planned(type, item, byType);
        log.info("Auth page classified: {}", plan);
        return plan;
    }

    /**
     * Waits for a code of the page's cell count.
     *
     * @param cells number of verification inputs; a single cell may take a 4 or 6 character code
     */
    public Optional<String> awaitCode(int cells) {
        log.info("Waiting up to {}s for a verification code ({} cells)", mailboxWait.toSeconds(), cells);
        return poll(() -> mailbox.latestCode(cells));
    }

    /**
     * Called after the auth control was clicked without effect. An email-link lock is cleared by visiting
     * the link in another tab, then signing in (after a sign-up) or reloading (after a sign-in).
     */
    public Lock resolveVerificationLock(AuthPlan plan, String pageText) {
        boolean emailStep = textPresent(pageText, KeywordTable.EMAIL_VERIFICATION_PAGE_TEXT);
        boolean codeStep = textPresent(pageText, KeywordTable.OTP_VERIFICATION_PAGE_TEXT);
        if (codeStep) {
            // code cells appeared without the page counting as changed
            return Lock.RETRY;
        }
        if (!emailStep) {
            return Lock.ABSENT;
        }
        log.info("Email verification required, waiting up to {}s for the link", mailboxWait.toSeconds());
        Optional<String> link = poll(mailbox::latestLink);
        if (link.isEmpty()) {
            log.error("No verification link arrived");
            return Lock.FAILED;
        }
        session.visitInNewTab(link.get());
        log.info("Email verification completed");
        if (plan.type() == AuthType.SIGN_UP) {
            for (ActionItem signIn : plan.items(AuthType.SIGN_IN)) {
                if (clicker.isLive(signIn)) {
                    clicker.click(signIn);
                    return Lock.RETRY;
                }
            }
            reload();
            return Lock.RETRY;
        }
        if (plan.type() == AuthType.SIGN_IN) {
            reload();
            return Lock.RETRY;
        }
        return Lock.ABSENT;
    }

    /**
     * Switches between sign-up and sign-in when the clicked item belongs to one of them.
     *
     * @return true when the counterpart control was clicked
     */
    public boolean toggle(AuthPlan plan, ActionItem clicked) {
        AuthType counterpart;
        if (plan.items(AuthType.SIGN_UP).contains(clicked)) {
            counterpart = AuthType.SIGN_IN;
        } else if (plan.items(AuthType.SIGN_IN).contains(clicked)) {
            counterpart = AuthType.SIGN_UP;
        } else {
            return false;
        }
        List<ActionItem> items = plan.items(counterpart);
        if (items.isEmpty() || !clicker.isLive(items.get(0))) {
            return false;
        }
        log.info("Switching auth flow to {}", counterpart);
        clicker.click(items.get(0));
        return true;
    }

    private AuthPlan lastResort(PageModel page, PageSignals s, ButtonDescriptor other) {
        if (other != null) {
            clicker.click(ActionItem.of(other, ActionItem.Role.OTHER));
            return AuthPlan.handled();
        }
        List<LinkDescriptor> links = s.links(KeywordTable.SIGN_UP_IDENTIFIERS);
        if (links.isEmpty()) {
            links = s.links(KeywordTable.SIGN_IN_IDENTIFIERS);
        }
        if (!links.isEmpty()) {
            clicker.click(ActionItem.of(links.get(links.size() - 1), ActionItem.Role.AUTH));
            return AuthPlan.handled();
        }
        PageItem apply = s.applyControl();
        if (apply != null) {
            // the description step can come back in the middle of an auth flow
            ActionItem item = ActionItem.of(apply, ActionItem.Role.APPLY);
            if (item.href() != null) {
                session.open(item.href());
            } else {
                clicker.click(item);
            }
            return AuthPlan.handled();
        }
        log.error("No auth control on {}", page.getMetadata().getUrl());
        return AuthPlan.unresolvable();
    }

    private static AuthType inferFromFields(int emails, int passwords, PageSignals s) {
        if (passwords == 0) {
            if (emails == 1) {
                return AuthType.SIGN_IN;
            }
            return s.verificationFields().isEmpty() ? null : AuthType.VERIFY;
        }
        if (passwords == 1) {
            return AuthType.SIGN_IN;
        }
        return passwords == 2 ? AuthType.SIGN_UP : null;
    }

    private static ButtonDescriptor preferSubmit(ButtonDescriptor existing, ButtonDescriptor candidate) {
        if (existing == null || (candidate.isSubmit() && !existing.isSubmit())) {
            return candidate;
        }
        return existing;
    }

    private static boolean isSubmit(ButtonDescriptor b) {
        return b != null && b.isSubmit();
    }

    private static List<ActionItem> items(ButtonDescriptor typed, ButtonDescriptor other) {
        List<ActionItem> out = new ArrayList<>(2);
        if (typed != null) {
            out.add(ActionItem.of(typed, ActionItem.Role.AUTH));
        }
        if (other != null) {
            out.add(ActionItem.of(other, ActionItem.Role.AUTH));
        }
        return List.copyOf(out);
    }

    private TextQuery textQuery(KeywordTable table) {
        return TextQuery.of(SearchKey.TEXT_ONLY, tables.get(table));
    }

    private boolean textPresent(String pageText, KeywordTable table) {
        return pageText != null && TextQuery.any(tables.get(table)).matchesText(pageText);
    }

    private void reload() {
        session.refresh();
        session.waitUntilStable(settle, RELOAD_PADDING_SECONDS);
    }

    private Optional<String> poll(Supplier<Optional<String>> source) {
        Instant deadline = clock.instant().plus(mailboxWait);
        while (true) {
            Optional<String> value = source.get();
            if (value.isPresent()) {
                return value;
            }
            Duration left = Duration.between(clock.instant(), deadline);
            if (left.isNegative() || left.isZero()) {
                return Optional.empty();
            }
            try {
                Thread.sleep(Math.min(left.toMillis(), MAILBOX_POLL.toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
    }
}
