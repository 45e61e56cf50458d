package io.remindrunr.schedule;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CronValuesTest {

    @Test
    void shouldParseSingleExpression() {
        TriggerSpec trigger = CronValues.toTrigger(" 0 9 * * 1-5 ");

        var single = assertInstanceOf(TriggerSpec.SingleCron.class, trigger);
        assertEquals("0 9 * * 1-5", single.expression());
    }

    @Test
    void shouldParseJsonEncodedArray() {
        TriggerSpec trigger = CronValues.toTrigger("[\"0 9 * * *\", \"0 18 * * *\"]");

        var multiple = assertInstanceOf(TriggerSpec.MultipleCron.class, trigger);
        assertEquals(List.of("0 9 * * *", "0 18 * * *"), multiple.expressions());
    }

    @Test
    void shouldCollapseSingletonArray() {
        assertInstanceOf(TriggerSpec.SingleCron.class, CronValues.toTrigger("[\"30 7 * * *\"]"));
    }

    @Test
    void shouldRejectMalformedArray() {
        var error = assertThrows(InvalidScheduleException.class, () -> CronValues.toTrigger("[\"0 9 * * *\","));
        assertEquals("Invalid JSON format for cron expression array", error.getMessage());
    }

    @Test
    void shouldRejectEmptyArray() {
        assertThrows(InvalidScheduleException.class, () -> CronValues.toTrigger("[]"));
    }

    @Test
    void shouldRejectNonStringElements() {
        assertThrows(InvalidScheduleException.class, () -> CronValues.toTrigger("[\"0 9 * * *\", 5]"));
    }

    @Test
    void shouldRejectBlankValue() {
        assertThrows(InvalidScheduleException.class, () -> CronValues.toTrigger("  "));
        assertThrows(InvalidScheduleException.class, () -> CronValues.toTrigger(null));
    }
}
