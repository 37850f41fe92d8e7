package io.hearthwarrio.autoapply.core.answer;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class DateFormatterTest {

    @Test
    void fullDateIsReordered() {
        assertEquals(Optional.of("03152021"), DateFormatter.format("3/15/2021", "MMDDYYYY"));
        assertEquals(Optional.of("2021-03-15"), DateFormatter.format("03/15/2021", "YYYY-MM-DD"));
    }

    @Test
    void monthYearAssumesFirstDay() {
        assertEquals(Optional.of("06/01/2019"), DateFormatter.format("6/2019", "MM/DD/YYYY"));
        assertEquals(Optional.of("062019"), DateFormatter.format("06/2019", "MMYYYY"));
    }

    @Test
    void malformedDatesAreRejected() {
        assertTrue(DateFormatter.format("Present", "MMYYYY").isEmpty());
        assertTrue(DateFormatter.format("06/19", "MMYYYY").isEmpty());
        assertTrue(DateFormatter.format("1/2/3/2020", "MMYYYY").isEmpty());
        assertTrue(DateFormatter.format(null, "MMYYYY").isEmpty());
        assertTrue(DateFormatter.format("06/2019", null).isEmpty());
    }

    @Test
    void todayIsPadded() {
        assertEquals("01052024", DateFormatter.today("MMDDYYYY", LocalDate.of(2024, 1, 5)));
    }
}
