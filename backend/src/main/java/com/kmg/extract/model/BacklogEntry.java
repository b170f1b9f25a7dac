package com.kmg.extract.model;

/**
 * One position of the ordered backlog. {@code itemKey} is stable across runs and keys persisted results.
 */
public record BacklogEntry(int index, String itemKey, String sourceRef) {
}
