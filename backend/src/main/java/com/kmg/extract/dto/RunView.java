package com.kmg.extract.dto;

import com.kmg.extract.model.InsurerProfile;
import com.kmg.extract.model.RunStatus;

public record RunView(
        String id,
        String backlogDir,
        InsurerProfile profile,
        int startIndex,
        Integer limit,
        String outputDir,
        int workers,
        RunStatus status,
        String createdAt,
        String startedAt,
        String endedAt,
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
