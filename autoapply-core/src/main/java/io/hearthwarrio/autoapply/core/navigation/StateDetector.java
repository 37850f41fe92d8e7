package io.hearthwarrio.autoapply.core.navigation;

import io.hearthwarrio.autoapply.core.config.KeywordTable;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.model.NavigationState;
import io.hearthwarrio.autoapply.core.model.PageModel;

import java.util.Objects;
import java.util.Optional;

import static io.hearthwarrio.autoapply.core.config.KeywordTable.ACK_IDENTIFIERS;
import static io.hearthwarrio.autoapply.core.config.KeywordTable.OTHER_AUTH_IDENTIFIERS;
import static io.hearthwarrio.autoapply.core.config.KeywordTable.PROGRESS_IDENTIFIERS;
import static io.hearthwarrio.autoapply.core.config.KeywordTable.SIGN_IN_IDENTIFIERS;
import static io.hearthwarrio.autoapply.core.config.KeywordTable.SIGN_UP_IDENTIFIERS;
import static io.hearthwarrio.autoapply.core.config.KeywordTable.VERIFY_IDENTIFIERS;

/**
 * Independent predicates deciding which phase a parsed page belongs to.
 * <p>
 * Detectors are asked from the latest state backwards; the first that fires names the observed state.
 * Whether the flow may actually move there is the tracker's decision, not the detector's.
 */
public final class StateDetector {

    static final int SUBMITTED_MAX_FIELDS = 3;
    static final int AUTH_MAX_FIELDS = 6;
    static final int DESCRIPTION_MAX_FIELDS = 4;

    private final KeywordTables tables;

    public StateDetector(KeywordTables tables) {
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
    }

    /**
     * @param current state the flow is in, some detectors depend on it
     * @return the most advanced state whose detector fires, or empty when none does
     */
    public Optional<NavigationState> detect(PageModel page, String pageText, NavigationState current) {
        PageSignals s = new PageSignals(page, tables);
        if (isSubmitted(s, pageText, current)) {
            return Optional.of(NavigationState.SUBMITTED);
        }
        if (isLoggedIn(s)) {
            return Optional.of(NavigationState.LOGGED_IN);
        }
        if (isAuth(s)) {
            return Optional.of(NavigationState.AUTH);
        }
        if (isDescription(s)) {
            return Optional.of(NavigationState.DESCRIPTION);
        }
        return Optional.empty();
    }

    boolean isSubmitted(PageSignals s, String pageText, NavigationState current) {
        if (s.textPresent(pageText, KeywordTable.ALREADY_SUBMITTED_PAGE_TEXT)) {
            return true;
        }
        boolean ack = s.hasButton(ACK_IDENTIFIERS);
        boolean auth = s.hasButton(SIGN_UP_IDENTIFIERS, SIGN_IN_IDENTIFIERS, VERIFY_IDENTIFIERS, OTHER_AUTH_IDENTIFIERS);
        boolean email = !s.emailFields().isEmpty();
        boolean password = !s.passwordFields().isEmpty();
        if (s.textPresent(pageText, KeywordTable.SUBMITTED_PAGE_TEXT) && !auth && !email && !password && !ack) {
            return true;
        }
        boolean few = s.fieldCount() <= SUBMITTED_MAX_FIELDS;
        if (current == NavigationState.LOGGED_IN && few && !s.hasButton(PROGRESS_IDENTIFIERS) && !ack) {
            return true;
        }
        return current == NavigationState.AUTH && few && !email && !password && !auth && !ack
                && s.applyControl() == null;
    }

    boolean isLoggedIn(PageSignals s) {
        boolean authControl = s.hasButtonOrLink(SIGN_UP_IDENTIFIERS, SIGN_IN_IDENTIFIERS);
        boolean verify = s.hasButton(VERIFY_IDENTIFIERS);
        if (authControl || verify) {
            return false;
        }
        return s.hasFirstNameField()
                || (s.hasButton(KeywordTable.EXPAND_ALL_IDENTIFIERS) && s.hasButton(PROGRESS_IDENTIFIERS));
    }

    boolean isAuth(PageSignals s) {
        if (!s.passwordFields().isEmpty() || s.hasButtonOrLink(SIGN_UP_IDENTIFIERS, SIGN_IN_IDENTIFIERS)) {
            return true;
        }
        return !s.emailFields().isEmpty() && s.fieldCount() <= AUTH_MAX_FIELDS && s.applyControl() == null;
    }

    boolean isDescription(PageSignals s) {
        return s.applyControl() != null && s.fieldCount() <= DESCRIPTION_MAX_FIELDS;
    }
}
