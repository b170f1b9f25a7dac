package com.kmg.extract.service;

/**
 * Yields the raw text of a source document.
 */
public interface TextSource {

    /**
     * @throws com.kmg.extract.model.ExtractionException with kind {@code UNREADABLE} if the document cannot be read
     */
    String getText(String sourceRef);
}
