package eu.virtualparadox.readingpos.backfill;

import eu.virtualparadox.readingpos.position.DocumentPosition;

import java.util.Objects;

/**
 * Resolved start and end of a reading session.
 */
public record PositionSpan(DocumentPosition start, DocumentPosition end) {

    public PositionSpan {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
    }
}
