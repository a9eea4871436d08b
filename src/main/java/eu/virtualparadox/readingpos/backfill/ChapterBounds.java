package eu.virtualparadox.readingpos.backfill;

import eu.virtualparadox.readingpos.position.PositionEncoding;

import java.util.Objects;

/**
 * A table-of-contents entry with the xpoints where it starts and ends.
 *
 * @param id    caller's identifier
 * @param start first position of the chapter, may be {@code null}
 * @param end   last position of the chapter, may be {@code null}
 */
public record ChapterBounds(String id, PositionEncoding start, PositionEncoding end) {

    public ChapterBounds {
        Objects.requireNonNull(id, "id must not be null");
    }
}
