package io.hearthwarrio.autoapply.core.diff;

import org.jsoup.nodes.Element;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides whether a click moved the page on, by comparing fingerprints of interactive elements.
 * <p>
 * A fingerprint is the element's {@code name}, {@code id}, {@code placeholder}, {@code type},
 * {@code aria-label} and {@code role}. The page counts as changed when the share of earlier
 * fingerprints still present falls below the threshold.
 */
public final class ChangeDetector {

    private static final List<String> INTERACTIVE = List.of(
            "//input", "//select", "//textarea", "//button", "//*[@role='button']");

    private static final List<String> KEY_ATTRIBUTES = List.of("name", "id", "placeholder", "type", "aria-label", "role");

    private ChangeDetector() {
        // utility class
    }

    /**
     * @param threshold preserved ratio below which the page counts as changed, e.g. 0.69
     */
    public static boolean hasChanged(DomSnapshot before, DomSnapshot after, double threshold) {
        return preservedRatio(before, after) < threshold;
    }

    /**
     * Share of earlier fingerprints still present; 0 when there was nothing interactive before.
     */
    public static double preservedRatio(DomSnapshot before, DomSnapshot after) {
        Set<String> b = fingerprints(before);
        if (b.isEmpty()) {
            return 0.0;
        }
        Set<String> a = fingerprints(after);
        int preserved = 0;
        for (String f : b) {
            if (a.contains(f)) {
                preserved++;
            }
        }
        return (double) preserved / b.size();
    }

    static Set<String> fingerprints(DomSnapshot snapshot) {
        Set<String> out = new HashSet<>();
        for (Element e : snapshot.select(INTERACTIVE)) {
            StringBuilder sb = new StringBuilder();
            for (String k : KEY_ATTRIBUTES) {
                if (sb.length() > 0) {
                    sb.append('|');
                }
                sb.append(k).append(':').append(e.attr(k));
            }
            out.add(sb.toString());
        }
        return out;
    }
}
