package io.hearthwarrio.autoapply.core.navigation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Traversal bookkeeping of one page: which action items were clicked without advancing, and the stack of
 * non-link "parent" items that may still own an open dialog.
 * <p>
 * Identity is the locator fingerprint, so cycle detection does not depend on recursion depth or on
 * descriptor instances surviving a re-parse.
 */
public final class ActionGraph {

    private final Set<String> visited = new HashSet<>();
    private final Deque<ActionItem> parents = new ArrayDeque<>();

    public boolean isVisited(ActionItem item) {
        return visited.contains(item.fingerprint());
    }

    public int visitedCount() {
        return visited.size();
    }

    /**
     * First candidate that is live and not yet visited; when every live candidate was visited, the first
     * live one, so a page never runs out of something to click while candidates exist.
     *
     * @param isLive whether the candidate currently resolves to exactly one element
     * @return null when no candidate is live
     */
    public ActionItem selectFresh(List<ActionItem> candidates, Predicate<ActionItem> isLive) {
        Objects.requireNonNull(candidates, "candidates must not be null");
        ActionItem fallback = null;
        for (ActionItem c : candidates) {
            if (c == null) {
                continue;
            }
            if (!isLive.test(c)) {
                continue;
            }
            if (!isVisited(c)) {
                return c;
            }
            if (fallback == null) {
                fallback = c;
            }
        }
        return fallback;
    }

    /**
     * Records an item whose click did not advance the page. Non-link items become parents, since they
     * may have opened a dialog that is still on screen.
     *
     * @return true when the item was new to the graph
     */
    public boolean recordIneffective(ActionItem item) {
        if (!visited.add(item.fingerprint())) {
            return false;
        }
        if (!item.isLink()) {
            parents.push(item);
        }
        return true;
    }

    /**
     * Parents, most recent first.
     */
    public List<ActionItem> parents() {
        return new ArrayList<>(parents);
    }

    public boolean hasParents() {
        return !parents.isEmpty();
    }

    /**
     * Removes a parent that no longer resolves; the other parents keep their order.
     *
     * @return true when the item was on the stack
     */
    public boolean drop(ActionItem parent) {
        return parents.remove(parent);
    }

    /**
     * Drops a parent and every parent pushed after it.
     */
    public void unwindTo(ActionItem parent, boolean keepParent) {
        Iterator<ActionItem> it = parents.iterator();
        while (it.hasNext()) {
            ActionItem p = it.next();
            if (p.equals(parent)) {
                if (!keepParent) {
                    it.remove();
                }
                return;
            }
            it.remove();
        }
    }
}
