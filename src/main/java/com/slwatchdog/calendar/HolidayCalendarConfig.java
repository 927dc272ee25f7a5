package com.slwatchdog.calendar;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Exchange holiday list bound from {@code trading-calendar.*}. Updated yearly from the
 * NSE published schedule.
 */
@Component
@ConfigurationProperties(prefix = "trading-calendar")
@Getter
@Setter
public class HolidayCalendarConfig {

    private String timezone = "Asia/Kolkata";
    private List<Holiday> holidays = new ArrayList<>();

    @Getter
    @Setter
    public static class Holiday {

        private LocalDate date;
        private String name;
        private HolidayType type = HolidayType.FULL_HOLIDAY;
    }
}
