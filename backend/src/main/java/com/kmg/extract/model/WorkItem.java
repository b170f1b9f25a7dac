package com.kmg.extract.model;

public class WorkItem {
    private final int index;
    private final String itemKey;
    private final String sourceRef;
    private WorkItemStatus status = WorkItemStatus.PENDING;
    private int attempts;
    private ClassifiedError lastError;

    public WorkItem(BacklogEntry entry) {
        this.index = entry.index();
        this.itemKey = entry.itemKey();
        this.sourceRef = entry.sourceRef();
    }

    public int getIndex() {
        return index;
    }

    public String getItemKey() {
        return itemKey;
    }

    public String getSourceRef() {
        return sourceRef;
    }

    public WorkItemStatus getStatus() {
        return status;
    }

    public void setStatus(WorkItemStatus status) {
        this.status = status;
    }

    public int getAttempts() {
        return attempts;
    }

    public void addAttempts(int count) {
        this.attempts += count;
    }

    public ClassifiedError getLastError() {
        return lastError;
    }

    public void setLastError(ClassifiedError lastError) {
        this.lastError = lastError;
    }
}
