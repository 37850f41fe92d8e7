package io.hearthwarrio.autoapply.core.answer;

import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.Setting;
import io.hearthwarrio.autoapply.core.text.OptionMatcher;
import io.hearthwarrio.autoapply.core.text.OptionMatcher.RankedOption;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps a free-text oracle answer back onto displayed options.
 * <p>
 * Multi-select: every option at or above the high threshold; otherwise the options at or above the mid
 * threshold when there are several of them among more than three options, else the best one; otherwise
 * the best option when it reaches the floor or the field is required; otherwise nothing.
 */
public final class OptionRanker {

    private static final int MANY_OPTIONS = 3;

    private final int high;
    private final int mid;
    private final int floor;

    public OptionRanker(AutofillSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        this.high = settings.getInt(Setting.ORACLE_HIGH_SIMILARITY);
        this.mid = settings.getInt(Setting.ORACLE_MID_SIMILARITY);
        this.floor = settings.getInt(Setting.ORACLE_FLOOR_SIMILARITY);
    }

    /**
     * @return selected option texts, best first; empty means skip
     */
    public List<String> selectMultiple(List<String> options, String answer, boolean required) {
        List<RankedOption<String>> ranked = OptionMatcher.rank(asMap(options), answer, -1, 0);
        List<String> out = new ArrayList<>();
        if (ranked.isEmpty()) {
            return out;
        }
        for (RankedOption<String> r : ranked) {
            if (r.similarity() >= high) {
                out.add(r.text());
            }
        }
        if (!out.isEmpty()) {
            return out;
        }
        List<String> aboveMid = new ArrayList<>();
        for (RankedOption<String> r : ranked) {
            if (r.similarity() >= mid) {
                aboveMid.add(r.text());
            }
        }
        if (!aboveMid.isEmpty()) {
            return aboveMid.size() > 1 && options.size() > MANY_OPTIONS ? aboveMid : List.of(aboveMid.get(0));
        }
        RankedOption<String> best = ranked.get(0);
        if (best.similarity() >= floor || required) {
            out.add(best.text());
        }
        return out;
    }

    /**
     * Best option for a single-choice field; null when it is below the floor and the field is optional.
     */
    public String selectSingle(List<String> options, String answer, boolean required) {
        List<RankedOption<String>> ranked = OptionMatcher.rank(asMap(options), answer, -1, 1);
        if (ranked.isEmpty()) {
            return required && !options.isEmpty() ? options.get(0) : null;
        }
        RankedOption<String> best = ranked.get(0);
        return best.similarity() >= floor || required ? best.text() : null;
    }

    /**
     * Closest option regardless of thresholds; null when there are no options.
     */
    public static String closest(List<String> options, String target) {
        RankedOption<String> best = OptionMatcher.closest(asMap(options), target);
        return best == null ? null : best.text();
    }

    static Map<String, String> asMap(List<String> options) {
        Map<String, String> m = new LinkedHashMap<>();
        for (String o : options) {
            m.put(o, o);
        }
        return m;
    }
}
