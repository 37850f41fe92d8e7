package io.hearthwarrio.autoapply.core.diff;

import org.jsoup.nodes.Element;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Structural delta between two captures: the new or modified elements of the later capture, and
 * the absolute paths of already existing parents under which new elements appeared.
 */
public final class DiffResult {

    private static final DiffResult EMPTY = new DiffResult(List.of(), List.of());

    private final List<Element> changed;
    private final List<String> ancestorPaths;

    DiffResult(List<Element> changed, List<String> ancestorPaths) {
        this.changed = List.copyOf(changed);
        this.ancestorPaths = List.copyOf(ancestorPaths);
    }

    public static DiffResult empty() {
        return EMPTY;
    }

    /**
     * Changed elements, as nodes of the later capture's document.
     */
    public List<Element> changed() {
        return changed;
    }

    public List<String> ancestorPaths() {
        return ancestorPaths;
    }

    public boolean isEmpty() {
        return changed.isEmpty();
    }

    /**
     * Serialized changed fragment, one element per line.
     */
    public String fragment() {
        return changed.stream().map(Element::outerHtml).collect(Collectors.joining("\n"));
    }

    @Override
    public String toString() {
        return "DiffResult{changed=" + changed.size() + ", ancestors=" + ancestorPaths + "}";
    }
}
