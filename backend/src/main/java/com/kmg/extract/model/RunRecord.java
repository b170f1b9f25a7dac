package com.kmg.extract.model;

import java.time.OffsetDateTime;

public record RunRecord(
        String id,
        String backlogDir,
        InsurerProfile profile,
        int startIndex,
        Integer itemLimit,
        String outputDir,
        int workers,
        RunStatus status,
        OffsetDateTime createdAt,
        OffsetDateTime startedAt,
        OffsetDateTime endedAt,
        String stopReason,
        int totalItems,
        int processedItems,
        Integer currentIndex,
        int succeeded,
        int failed,
        int skipped,
        Integer nextIndex,
        String lastError
) {
}
