package io.hearthwarrio.autoapply.core.text;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

public class OptionMatcherTest {

    private static final List<String> GENDERS = List.of("Male", "Female", "Decline to self-identify");

    @Test
    void answersAreTriedInPriorityOrder() {
        assertEquals(OptionalInt.of(2),
                OptionMatcher.findMatchingOption(List.of("decline", "prefer not"), GENDERS));
        assertEquals(OptionalInt.of(2),
                OptionMatcher.findMatchingOption(List.of("not listed", "self-identify"), GENDERS));
    }

    @Test
    void containsMatchIsCaseInsensitiveByDefault() {
        // "male" is contained in "Female" too; the first option wins
        assertEquals(OptionalInt.of(0), OptionMatcher.findMatchingOption(List.of("male"), GENDERS));
    }

    @Test
    void exactMatchRequiresWholeOption() {
        assertEquals(OptionalInt.of(1),
                OptionMatcher.findMatchingOption(List.of("female"), GENDERS, true, false, false));
        assertTrue(OptionMatcher.findMatchingOption(List.of("Decline"), GENDERS, true, false, false).isEmpty());
    }

    @Test
    void whitespaceAndCaseOptions() {
        List<String> options = List.of("Full time", "Part time");

        assertEquals(OptionalInt.of(0),
                OptionMatcher.findMatchingOption(List.of("fulltime"), options, true, true, false));
        assertTrue(OptionMatcher.findMatchingOption(List.of("full time"), options, false, false, true).isEmpty());
    }

    @Test
    void rankOrdersBySimilarityAndHonorsLimits() {
        Map<String, Integer> options = new LinkedHashMap<>();
        options.put("Canada", 1);
        options.put("United States", 2);
        options.put("United Kingdom", 3);

        List<OptionMatcher.RankedOption<Integer>> ranked = OptionMatcher.rank(options, "United States", -1, 0);

        assertEquals(3, ranked.size());
        assertEquals("United States", ranked.get(0).text());
        assertEquals(100, ranked.get(0).similarity());
        assertEquals(2, ranked.get(0).target());
        assertEquals(1, OptionMatcher.rank(options, "United States", -1, 1).size());
        assertEquals(1, OptionMatcher.rank(options, "United States", 100, 0).size());
    }

    @Test
    void closestOfNothingIsNull() {
        assertNull(OptionMatcher.closest(Map.of(), "Texas"));
        assertTrue(OptionMatcher.rank(Map.of("Texas", 1), "", -1, 0).isEmpty());
    }
}
