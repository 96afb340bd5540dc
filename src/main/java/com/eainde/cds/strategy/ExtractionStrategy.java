package com.eainde.cds.strategy;

import com.eainde.cds.ingest.DocumentContent;

import java.util.Optional;

/**
 * One way of locating a field's value in a document.
 *
 * @param <T> the field's value type
 */
@FunctionalInterface
public interface ExtractionStrategy<T> {

    /**
     * @return the value, or empty when this strategy cannot resolve the field
     */
    Optional<T> attempt(DocumentContent document);

    /** Short label for log output. */
    default String describe() {
        return getClass().getSimpleName();
    }
}
