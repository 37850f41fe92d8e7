package io.hearthwarrio.autoapply.core.navigation;

import io.hearthwarrio.autoapply.core.model.ButtonDescriptor;
import io.hearthwarrio.autoapply.core.model.LinkDescriptor;
import io.hearthwarrio.autoapply.core.model.Locator;
import io.hearthwarrio.autoapply.core.model.PageItem;

import java.util.Objects;

/**
 * A button or link that may move the application forward.
 */
public final class ActionItem {

    public enum Role {
        ACKNOWLEDGE,
        PROGRESS,
        AUTH,
        APPLY,
        OTHER
    }

    private final PageItem item;
    private final Role role;

    private ActionItem(PageItem item, Role role) {
        this.item = Objects.requireNonNull(item, "item must not be null");
        this.role = Objects.requireNonNull(role, "role must not be null");
    }

    public static ActionItem of(PageItem item, Role role) {
        return new ActionItem(item, role);
    }

    public PageItem item() {
        return item;
    }

    public Role role() {
        return role;
    }

    public Locator locator() {
        return item.getLocator();
    }

    public String text() {
        return item.getText();
    }

    public boolean isLink() {
        return item instanceof LinkDescriptor || "a".equals(item.getTagName());
    }

    public boolean isSubmit() {
        return item instanceof ButtonDescriptor b && b.isSubmit();
    }

    /**
     * @return href of a link, or null
     */
    public String href() {
        return item instanceof LinkDescriptor l && !l.getHref().isEmpty() ? l.getHref() : null;
    }

    /**
     * Identity used by the visited set; stable across re-parses of the same page generation.
     */
    public String fingerprint() {
        return locator().fingerprint();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ActionItem other)) {
            return false;
        }
        return fingerprint().equals(other.fingerprint());
    }

    @Override
    public int hashCode() {
        return fingerprint().hashCode();
    }

    @Override
    public String toString() {
        return role + " '" + text() + "' " + locator().expression();
    }
}
