package io.remindrunr.schedule;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class FlexibleDatesTest {

    private static final ZoneId TOKYO = ZoneId.of("Asia/Tokyo");

    @Test
    void shouldParseSlashedDateInZone() {
        assertEquals(Instant.parse("2025-01-06T00:00:00Z"), FlexibleDates.parse("2025/1/6 09:00", TOKYO));
    }

    @Test
    void shouldParseIsoWithOffset() {
        assertEquals(Instant.parse("2025-01-06T00:00:00Z"),
                FlexibleDates.parse("2025-01-06T01:00:00+01:00", TOKYO));
        assertEquals(Instant.parse("2025-01-06T00:00:00Z"), FlexibleDates.parse("2025-01-06T00:00:00Z", TOKYO));
    }

    @Test
    void shouldParseLocalIsoInZone() {
        assertEquals(Instant.parse("2025-01-06T00:00:00Z"), FlexibleDates.parse("2025-01-06T09:00:00", TOKYO));
    }

    @Test
    void shouldRejectImpossibleDate() {
        var error = assertThrows(InvalidScheduleException.class, () -> FlexibleDates.parse("2025/2/30 09:00", TOKYO));
        assertTrue(error.getMessage().startsWith("Invalid date values"));
    }

    @Test
    void shouldRejectUnknownFormat() {
        assertThrows(InvalidScheduleException.class, () -> FlexibleDates.parse("next tuesday", TOKYO));
        assertThrows(InvalidScheduleException.class, () -> FlexibleDates.parse("", TOKYO));
    }

    @Test
    void shouldFormatInZone() {
        assertEquals("2025/1/6 09:00", FlexibleDates.format(Instant.parse("2025-01-06T00:00:00Z"), TOKYO));
    }
}
