package io.telemetry.insights.pipeline.clients_daily_batch.rollup;

import org.junit.jupiter.api.Test;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ActivityDateConventionTest {

    private static final OffsetDateTime LATE_EVENING_EDT = OffsetDateTime.parse("2017-05-25T23:30:00.0-04:00");

    @Test
    void testActivityDate_Utc_UsesInstantNotRecordedOffset() {
        assertEquals(LocalDate.of(2017, 5, 26), ActivityDateConvention.utc().activityDate(LATE_EVENING_EDT));
    }

    @Test
    void testActivityDate_NamedZone() {
        ActivityDateConvention newYork = ActivityDateConvention.of("America/New_York");

        assertEquals(LocalDate.of(2017, 5, 25), newYork.activityDate(LATE_EVENING_EDT));
    }

    @Test
    void testDateOfEpochDay_Utc_IsTheEpochDay() {
        long day = LocalDate.of(2016, 9, 8).toEpochDay();

        assertEquals(LocalDate.of(2016, 9, 8), ActivityDateConvention.utc().dateOfEpochDay(day));
        assertEquals(LocalDate.of(1970, 1, 1), ActivityDateConvention.utc().dateOfEpochDay(0));
    }

    @Test
    void testDateOfEpochDay_WestOfGreenwich_IsPreviousDay() {
        long day = LocalDate.of(2016, 9, 8).toEpochDay();

        assertEquals(LocalDate.of(2016, 9, 7), ActivityDateConvention.of("America/Los_Angeles").dateOfEpochDay(day));
        assertEquals(LocalDate.of(2016, 9, 8), ActivityDateConvention.of("Asia/Tokyo").dateOfEpochDay(day));
    }

    @Test
    void testOf_System_PinsJvmDefault() {
        assertEquals(ZoneId.systemDefault(), ActivityDateConvention.of("system").zone());
        assertEquals(ZoneOffset.UTC, ActivityDateConvention.utc().zone());
    }

    @Test
    void testOf_UnknownZone_Throws() {
        assertThrows(DateTimeException.class, () -> ActivityDateConvention.of("Mars/Olympus_Mons"));
    }
}
