package com.ververica.bundle_lift.flink.mining.shared.processor;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FestivalCalendarTest {

    private final FestivalCalendar calendar = FestivalCalendar.loadDefault();

    @Test
    public void majorFestivalTest() {
        assertEquals(Optional.of("diwali"), calendar.majorFestivalOn(LocalDate.of(2024, 11, 12)));
        assertEquals(Optional.of("christmas"), calendar.majorFestivalOn(LocalDate.of(2024, 12, 25)));
    }

    @Test
    public void windowSpanningYearEndTest() {
        assertEquals(Optional.of("new_year"), calendar.majorFestivalOn(LocalDate.of(2024, 12, 31)));
        assertEquals(Optional.of("new_year"), calendar.majorFestivalOn(LocalDate.of(2025, 1, 2)));
    }

    @Test
    public void minorFestivalYieldsNothingTest() {
        assertFalse(calendar.majorFestivalOn(LocalDate.of(2024, 1, 14)).isPresent());
        assertFalse(calendar.majorFestivalOn(LocalDate.of(2024, 5, 15)).isPresent());
    }

    @Test
    public void firstMatchWinsTest() {
        // navratri and dussehra overlap on Oct 23-24
        assertEquals(Optional.of("navratri"), calendar.majorFestivalOn(LocalDate.of(2024, 10, 23)));
    }

    @Test
    public void customCalendarTest() {
        FestivalCalendar custom = new FestivalCalendar(Arrays.asList(
            new FestivalCalendar.Festival("sale_week", true,
                Arrays.asList(new FestivalCalendar.Window(6, 1, 7)))));

        assertTrue(custom.majorFestivalOn(LocalDate.of(2024, 6, 3)).isPresent());
        assertFalse(FestivalCalendar.empty().majorFestivalOn(LocalDate.of(2024, 6, 3)).isPresent());
    }

    @Test
    public void missingResourceTest() {
        assertThrows(IllegalStateException.class, () -> FestivalCalendar.load("/no-such-calendar.json"));
    }
}
