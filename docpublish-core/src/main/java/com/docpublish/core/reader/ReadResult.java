package com.docpublish.core.reader;

import com.docpublish.core.transform.TransformRunResult;
import com.docpublish.core.tree.Document;

import java.util.Objects;

/**
 * Outcome of reading a source: the transformed document and what the transform run did.
 *
 * @param document parsed and transformed document
 * @param transforms scheduler run summary
 */
public record ReadResult(
    Document document,
    TransformRunResult transforms
) {
    /**
     * Compact constructor with validation.
     */
    public ReadResult {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(transforms, "transforms must not be null");
    }
}
