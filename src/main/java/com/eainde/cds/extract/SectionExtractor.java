package com.eainde.cds.extract;

import com.eainde.cds.ingest.DocumentContent;

/**
 * Reduces one document to one section of the record.
 *
 * <p>Implementations are stateless: extracting the same document twice yields equal
 * results, and fields that cannot be located keep their zero default instead of failing.</p>
 *
 * @param <T> the section record type
 */
public interface SectionExtractor<T> {

    T extract(DocumentContent document);
}
