package com.zerotrust.access.risk;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Business hours are weekdays, start hour inclusive to end hour exclusive,
 * in the configured zone.
 */
@Slf4j
@Component
public class BusinessHours {

    private final ZoneId zone;
    private final int startHour;
    private final int endHour;

    public BusinessHours(@Value("${zerotrust.risk.business-hours.zone:UTC}") String zone,
                         @Value("${zerotrust.risk.business-hours.start:8}") int startHour,
                         @Value("${zerotrust.risk.business-hours.end:18}") int endHour) {
        this.zone = ZoneId.of(zone);
        this.startHour = startHour;
        this.endHour = endHour;
        if (startHour < 0 || endHour > 24 || startHour >= endHour) {
            throw new IllegalArgumentException("Invalid business hours window " + startHour + "-" + endHour);
        }
    }

    public boolean isWeekday(Instant instant) {
        DayOfWeek day = instant.atZone(zone).getDayOfWeek();
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
    }

    public boolean isBusinessHours(Instant instant) {
        if (!isWeekday(instant)) return false;
        int hour = hourOf(instant);
        return hour >= startHour && hour < endHour;
    }

    public int hourOf(Instant instant) {
        ZonedDateTime local = instant.atZone(zone);
        return local.getHour();
    }

    public ZoneId getZone() {
        return zone;
    }
}
