package com.kmg.extract.api;

import com.kmg.extract.dto.CredentialPoolView;
import com.kmg.extract.dto.QuotaResetResponse;
import com.kmg.extract.service.QuotaResetScheduler;
import com.kmg.extract.service.TimeService;
import com.kmg.extract.service.UsageStatsTracker;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/credentials")
public class CredentialController {
    private final UsageStatsTracker usageStatsTracker;
    private final QuotaResetScheduler quotaResetScheduler;
    private final TimeService timeService;

    public CredentialController(
            UsageStatsTracker usageStatsTracker,
            QuotaResetScheduler quotaResetScheduler,
            TimeService timeService
    ) {
        this.usageStatsTracker = usageStatsTracker;
        this.quotaResetScheduler = quotaResetScheduler;
        this.timeService = timeService;
    }

    @GetMapping
    public CredentialPoolView pool() {
        return new CredentialPoolView(
                usageStatsTracker.snapshot(),
                usageStatsTracker.usableCount(),
                timeService.zoneId().getId(),
                timeService.nextDailyResetAt().toOffsetDateTime().toString()
        );
    }

    @PostMapping("/reset-quota")
    public QuotaResetResponse resetQuota() {
        return new QuotaResetResponse(quotaResetScheduler.resetNow());
    }
}
