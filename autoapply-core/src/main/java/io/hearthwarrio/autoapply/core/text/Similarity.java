package io.hearthwarrio.autoapply.core.text;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Ratcliff/Obershelp similarity ("gestalt pattern matching") between two strings.
 * <p>
 * Ratio is {@code 2 * M / T} where {@code M} is the number of characters in matching blocks and
 * {@code T} the total length. Long second strings (200+ chars) treat characters occurring in more
 * than 1% of positions as junk, which keeps the score comparable with common fuzzy-match tooling.
 */
public final class Similarity {

    private static final int AUTOJUNK_MIN_LENGTH = 200;

    private Similarity() {
        // utility class
    }

    /**
     * Case-insensitive similarity as an integer percentage, 0..100.
     */
    public static int percent(String a, String b) {
        return (int) Math.round(ratio(lower(a), lower(b)) * 100);
    }

    /**
     * Case-sensitive ratio in [0, 1]. Two empty strings are identical.
     */
    public static double ratio(String a, String b) {
        String s1 = a == null ? "" : a;
        String s2 = b == null ? "" : b;
        int total = s1.length() + s2.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(s1, s2) / total;
    }

    static int matchingCharacters(String a, String b) {
        Map<Character, List<Integer>> b2j = index(b);
        int matched = 0;
        Deque<int[]> queue = new ArrayDeque<>();
        queue.push(new int[]{0, a.length(), 0, b.length()});
        while (!queue.isEmpty()) {
            int[] r = queue.pop();
            int[] m = longestMatch(a, b2j, r[0], r[1], r[2], r[3]);
            int i = m[0];
            int j = m[1];
            int k = m[2];
            if (k == 0) {
                continue;
            }
            matched += k;
            if (r[0] < i && r[2] < j) {
                queue.push(new int[]{r[0], i, r[2], j});
            }
            if (i + k < r[1] && j + k < r[3]) {
                queue.push(new int[]{i + k, r[1], j + k, r[3]});
            }
        }
        return matched;
    }

    private static Map<Character, List<Integer>> index(String b) {
        Map<Character, List<Integer>> b2j = new HashMap<>();
        for (int j = 0; j < b.length(); j++) {
            b2j.computeIfAbsent(b.charAt(j), c -> new ArrayList<>()).add(j);
        }
        int n = b.length();
        if (n >= AUTOJUNK_MIN_LENGTH) {
            int popular = n / 100 + 1;
            Set<Character> junk = new HashSet<>();
            for (Map.Entry<Character, List<Integer>> e : b2j.entrySet()) {
                if (e.getValue().size() > popular) {
                    junk.add(e.getKey());
                }
            }
            junk.forEach(b2j::remove);
        }
        return b2j;
    }

    /**
     * Longest block a[i..i+k) == b[j..j+k) inside the given ranges; earliest in a, then in b, on ties.
     */
    private static int[] longestMatch(String a, Map<Character, List<Integer>> b2j, int alo, int ahi, int blo, int bhi) {
        int besti = alo;
        int bestj = blo;
        int bestsize = 0;
        Map<Integer, Integer> j2len = new HashMap<>();
        for (int i = alo; i < ahi; i++) {
            Map<Integer, Integer> newj2len = new HashMap<>();
            List<Integer> js = b2j.get(a.charAt(i));
            if (js != null) {
                for (int j : js) {
                    if (j < blo) {
                        continue;
                    }
                    if (j >= bhi) {
                        break;
                    }
                    int k = j2len.getOrDefault(j - 1, 0) + 1;
                    newj2len.put(j, k);
                    if (k > bestsize) {
                        besti = i - k + 1;
                        bestj = j - k + 1;
                        bestsize = k;
                    }
                }
            }
            j2len = newj2len;
        }
        return new int[]{besti, bestj, bestsize};
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
