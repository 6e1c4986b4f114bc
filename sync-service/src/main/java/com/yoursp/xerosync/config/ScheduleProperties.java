package com.yoursp.xerosync.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;

/**
 * Global cron schedule shared by every tenant job ({@code schedule.*}).
 * <p>
 * Field syntax follows Spring's {@link org.springframework.scheduling.support.CronExpression};
 * numeric day-of-week values use 0/7 = Sunday, names (MON-SUN) are recommended.
 * </p>
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "schedule")
public class ScheduleProperties {

    private String second = "0";
    private String minute = "0";
    private String hour = "*/6";
    private String day = "*";
    private String month = "*";
    private String dayOfWeek = "*";
    private ZoneId zone = ZoneId.of("UTC");

    /** Re-install triggers for every active job once the application is ready. */
    private boolean restoreOnStartup = true;

    /** Six-field expression in Spring order: second minute hour day month day-of-week. */
    public String toCronExpression() {
        return String.join(" ", second, minute, hour, day, month, dayOfWeek);
    }
}
