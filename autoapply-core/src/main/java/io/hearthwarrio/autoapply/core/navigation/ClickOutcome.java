package io.hearthwarrio.autoapply.core.navigation;

import org.jsoup.nodes.Element;

import java.util.List;

/**
 * Observable effect of clicking an action item.
 */
public final class ClickOutcome {

    public enum Kind {
        /**
         * The page changed enough to count as a new step.
         */
        ADVANCED,
        /**
         * The page stayed, but new fields or buttons appeared.
         */
        NEW_ELEMENTS_REVEALED,
        NO_CHANGE
    }

    private static final ClickOutcome ADVANCED = new ClickOutcome(Kind.ADVANCED, List.of(), List.of());
    private static final ClickOutcome NO_CHANGE = new ClickOutcome(Kind.NO_CHANGE, List.of(), List.of());

    private final Kind kind;
    private final List<Element> revealed;
    private final List<String> ancestorPaths;

    private ClickOutcome(Kind kind, List<Element> revealed, List<String> ancestorPaths) {
        this.kind = kind;
        this.revealed = List.copyOf(revealed);
        this.ancestorPaths = List.copyOf(ancestorPaths);
    }

    public static ClickOutcome advanced() {
        return ADVANCED;
    }

    public static ClickOutcome noChange() {
        return NO_CHANGE;
    }

    public static ClickOutcome revealed(List<Element> elements, List<String> ancestorPaths) {
        if (elements.isEmpty()) {
            return NO_CHANGE;
        }
        return new ClickOutcome(Kind.NEW_ELEMENTS_REVEALED, elements, ancestorPaths);
    }

    public Kind kind() {
        return kind;
    }

    public List<Element> revealed() {
        return revealed;
    }

    public List<String> ancestorPaths() {
        return ancestorPaths;
    }

    @Override
    public String toString() {
        return kind == Kind.NEW_ELEMENTS_REVEALED ? kind + "(" + revealed.size() + ")" : kind.name();
    }
}
