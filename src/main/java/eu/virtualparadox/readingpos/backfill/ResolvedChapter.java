package eu.virtualparadox.readingpos.backfill;

import eu.virtualparadox.readingpos.position.DocumentPosition;

import java.util.Optional;

/**
 * A chapter after backfill. Either bound may be missing, never both.
 */
public record ResolvedChapter(DocumentPosition start, DocumentPosition end) {

    public ResolvedChapter {
        if (start == null && end == null) {
            throw new IllegalArgumentException("at least one bound must be resolved");
        }
    }

    public Optional<DocumentPosition> startPosition() {
        return Optional.ofNullable(start);
    }

    public Optional<DocumentPosition> endPosition() {
        return Optional.ofNullable(end);
    }
}
