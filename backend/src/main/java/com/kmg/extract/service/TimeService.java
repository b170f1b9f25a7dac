package com.kmg.extract.service;

import com.kmg.extract.config.ExtractorProperties;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Calendar time in the zone where the inference service resets its daily quota.
 */
@Service
public class TimeService {
    private final ZoneId zoneId;

    public TimeService(ExtractorProperties properties) {
        this.zoneId = ZoneId.of(properties.getCredentials().getTimezone());
    }

    public ZonedDateTime now() {
        return ZonedDateTime.now(zoneId);
    }

    public ZonedDateTime nextDailyResetAt() {
        return now().toLocalDate().plusDays(1).atStartOfDay(zoneId);
    }

    public ZoneId zoneId() {
        return zoneId;
    }
}
