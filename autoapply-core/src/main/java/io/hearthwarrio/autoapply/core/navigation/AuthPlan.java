package io.hearthwarrio.autoapply.core.navigation;

import io.hearthwarrio.autoapply.core.model.AuthType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of classifying an auth page.
 * <p>
 * {@link Status#PLANNED} carries the auth type, the item to click and, per type, the items that belong
 * to it (used to toggle between sign-up and sign-in). {@link Status#HANDLED} means a click already
 * happened and the page must be parsed again.
 */
public final class AuthPlan {

    public enum Status {
        PLANNED,
        HANDLED,
        UNRESOLVABLE
    }

    private static final AuthPlan HANDLED = new AuthPlan(Status.HANDLED, null, null, Map.of());
    private static final AuthPlan UNRESOLVABLE = new AuthPlan(Status.UNRESOLVABLE, null, null, Map.of());

    private final Status status;
    private final AuthType type;
    private final ActionItem item;
    private final Map<AuthType, List<ActionItem>> itemsByType;

    private AuthPlan(Status status, AuthType type, ActionItem item, Map<AuthType, List<ActionItem>> itemsByType) {
        this.status = status;
        this.type = type;
        this.item = item;
        this.itemsByType = itemsByType;
    }

    static AuthPlan planned(AuthType type, ActionItem item, Map<AuthType, List<ActionItem>> itemsByType) {
        return new AuthPlan(Status.PLANNED, type, item, new EnumMap<>(itemsByType));
    }

    static AuthPlan handled() {
        return HANDLED;
    }

    static AuthPlan unresolvable() {
        return UNRESOLVABLE;
    }

    public Status status() {
        return status;
    }

    public AuthType type() {
        return type;
    }

    public ActionItem item() {
        return item;
    }

    public List<ActionItem> items(AuthType authType) {
        return itemsByType.getOrDefault(authType, List.of());
    }

    @Override
    public String toString() {
        return status == Status.PLANNED ? "AuthPlan{" + type + ", " + item + "}" : status.name();
    }
}
