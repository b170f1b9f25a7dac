package com.kmg.extract.model;

public record RunSummary(
        BatchStatus status,
        int startIndex,
        Integer limit,
        int sliceSize,
        int succeeded,
        int failedRetryable,
        int failedPermanent,
        int skipped,
        int pending,
        int nextIndex,
        long durationMillis,
        String startedAt,
        String endedAt
) {
    public int failed() {
        return failedRetryable + failedPermanent;
    }
}
