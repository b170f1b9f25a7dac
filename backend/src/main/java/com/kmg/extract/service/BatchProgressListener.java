package com.kmg.extract.service;

import com.kmg.extract.model.ClassifiedError;
import com.kmg.extract.model.WorkItem;

/**
 * Progress callbacks from {@link BatchOrchestrator}. Called from worker threads.
 */
public interface BatchProgressListener {
    BatchProgressListener NONE = new BatchProgressListener() {
    };

    default void itemStarted(WorkItem item) {
    }

    /**
     * Called once an item reaches a terminal status, including items skipped as already done.
     */
    default void itemFinished(WorkItem item, boolean skipped) {
    }

    default void paused(WorkItem item, ClassifiedError reason) {
    }
}
