package io.hearthwarrio.autoapply.core.text;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Matches desired answers against displayed option texts.
 */
public final class OptionMatcher {

    private OptionMatcher() {
        // utility class
    }

    /**
     * Index of the first option matched by the first answer that matches anything.
     * Answers are tried in priority order; an option matches when it contains the answer
     * (or equals it, when {@code exact}).
     */
    public static OptionalInt findMatchingOption(Collection<String> answers,
                                                 List<String> options,
                                                 boolean exact,
                                                 boolean normalizeWhitespace,
                                                 boolean caseSensitive) {
        Objects.requireNonNull(answers, "answers must not be null");
        Objects.requireNonNull(options, "options must not be null");
        List<String> keys = new ArrayList<>(options.size());
        for (String o : options) {
            keys.add(normalize(o, normalizeWhitespace, caseSensitive));
        }
        for (String answer : answers) {
            String a = normalize(answer, normalizeWhitespace, caseSensitive);
            for (int i = 0; i < keys.size(); i++) {
                if (exact ? keys.get(i).equals(a) : keys.get(i).contains(a)) {
                    return OptionalInt.of(i);
                }
            }
        }
        return OptionalInt.empty();
    }

    public static OptionalInt findMatchingOption(Collection<String> answers, List<String> options) {
        return findMatchingOption(answers, options, false, false, false);
    }

    /**
     * Options ranked by similarity to the text, best first. Ties keep option order.
     *
     * @param threshold minimum similarity to keep, or a negative number to keep everything
     * @param topK      maximum number of results, or 0 for all
     */
    public static <L> List<RankedOption<L>> rank(Map<String, L> options, String text, int threshold, int topK) {
        List<RankedOption<L>> out = new ArrayList<>();
        if (options == null || options.isEmpty() || text == null || text.isEmpty()) {
            return out;
        }
        for (Map.Entry<String, L> e : options.entrySet()) {
            int score = Similarity.percent(e.getKey(), text);
            if (threshold < 0 || score >= threshold) {
                out.add(new RankedOption<>(e.getKey(), e.getValue(), score));
            }
        }
        out.sort(Comparator.comparingInt((RankedOption<L> r) -> r.similarity()).reversed());
        if (topK > 0 && out.size() > topK) {
            return new ArrayList<>(out.subList(0, topK));
        }
        return out;
    }

    /**
     * Option most similar to the target; null when there are no options.
     */
    public static <L> RankedOption<L> closest(Map<String, L> options, String target) {
        List<RankedOption<L>> ranked = rank(options, target, -1, 1);
        return ranked.isEmpty() ? null : ranked.get(0);
    }

    private static String normalize(String text, boolean normalizeWhitespace, boolean caseSensitive) {
        String t = text == null ? "" : text;
        if (normalizeWhitespace) {
            t = t.replaceAll("\\s+", "");
        }
        return caseSensitive ? t : t.toLowerCase(Locale.ROOT);
    }

    /**
     * One option with its similarity score.
     */
    public static final class RankedOption<L> {

        private final String text;
        private final L target;
        private final int similarity;

        RankedOption(String text, L target, int similarity) {
            this.text = text;
            this.target = target;
            this.similarity = similarity;
        }

        public String text() {
            return text;
        }

        public L target() {
            return target;
        }

        public int similarity() {
            return similarity;
        }

        @Override
        public String toString() {
            return "'" + text + "' " + similarity + "%";
        }
    }
}
