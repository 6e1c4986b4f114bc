package com.yoursp.xerosync.modules.jobs;

import com.yoursp.xerosync.config.ScheduleProperties;

/**
 * Human readable cadence for the global cron fields. Only step values
 * ("*&#47;N") are recognised; hour wins over day, day over minute,
 * minute over second.
 */
public final class ScheduleDescriber {

    private ScheduleDescriber() {
    }

    public static String describe(ScheduleProperties schedule) {
        return describe(schedule.getHour(), schedule.getMinute(), schedule.getSecond(), schedule.getDay());
    }

    public static String describe(String hour, String minute, String second, String day) {
        if (isStep(hour)) {
            return "every " + step(hour) + " hours";
        } else if (isStep(day)) {
            return "every " + step(day) + " days";
        } else if (isStep(minute)) {
            return "every " + step(minute) + " minutes";
        } else if (isStep(second)) {
            return "every " + step(second) + " seconds";
        }
        return "on a custom schedule";
    }

    private static boolean isStep(String field) {
        return field != null && field.startsWith("*/") && field.length() > 2
                && field.substring(2).chars().allMatch(Character::isDigit);
    }

    private static int step(String field) {
        return Integer.parseInt(field.substring(2));
    }
}
