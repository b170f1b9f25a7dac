package com.kmg.extract.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class QuotaResetScheduler {
    private static final Logger log = LoggerFactory.getLogger(QuotaResetScheduler.class);

    private final CredentialPool credentialPool;
    private final EventService eventService;

    public QuotaResetScheduler(CredentialPool credentialPool, EventService eventService) {
        this.credentialPool = credentialPool;
        this.eventService = eventService;
    }

    @Scheduled(cron = "0 0 0 * * *", zone = "${extractor.credentials.timezone:America/Los_Angeles}")
    public void resetAtDayBoundary() {
        log.info("Day boundary reached; resetting daily quotas");
        resetNow();
    }

    public int resetNow() {
        int restored = credentialPool.resetDailyQuotas();
        eventService.publish("quota-reset", null, "Daily quotas reset", Map.of("restored", restored));
        return restored;
    }
}
