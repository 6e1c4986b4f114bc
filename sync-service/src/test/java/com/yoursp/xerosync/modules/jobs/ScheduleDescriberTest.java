package com.yoursp.xerosync.modules.jobs;

import com.yoursp.xerosync.config.ScheduleProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleDescriberTest {

    @Test
    @DisplayName("Default schedule reads as every 6 hours")
    void describesDefaultSchedule() {
        assertEquals("every 6 hours", ScheduleDescriber.describe(new ScheduleProperties()));
    }

    @Test
    @DisplayName("Hour step wins over every other step")
    void hourStepWinsOverOtherSteps() {
        assertEquals("every 2 hours", ScheduleDescriber.describe("*/2", "*/5", "*/10", "*/3"));
    }

    @Test
    @DisplayName("Day step wins over minute step")
    void dayStepWinsOverMinuteStep() {
        assertEquals("every 3 days", ScheduleDescriber.describe("0", "*/5", "0", "*/3"));
    }

    @Test
    @DisplayName("Minute and second steps are described")
    void minuteAndSecondSteps() {
        assertEquals("every 15 minutes", ScheduleDescriber.describe("*", "*/15", "0", "*"));
        assertEquals("every 30 seconds", ScheduleDescriber.describe("*", "*", "*/30", "*"));
    }

    @Test
    @DisplayName("Fixed times and malformed steps are a custom schedule")
    void fixedTimesAreCustom() {
        assertEquals("on a custom schedule", ScheduleDescriber.describe("2", "30", "0", "*"));
        assertEquals("on a custom schedule", ScheduleDescriber.describe("*/x", "0", "0", "*"));
    }
}
