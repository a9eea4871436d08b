package eu.virtualparadox.readingpos.matching;

import eu.virtualparadox.readingpos.position.PositionEncoding;
import eu.virtualparadox.readingpos.position.PositionRange;

import java.util.Objects;

/**
 * Positional view of a highlight owned by the surrounding application.
 *
 * @param id       caller's identifier
 * @param position highlighted range, {@code null} for documents without xpoints
 * @param page     page number reported by the reader, may be {@code null}
 */
public record Highlight(String id, PositionRange position, Integer page) {

    public Highlight {
        Objects.requireNonNull(id, "id must not be null");
    }

    public static Highlight at(final String id, final PositionEncoding point, final Integer page) {
        return new Highlight(id, point == null ? null : PositionRange.of(point), page);
    }

    /**
     * @return the point used for matching: the start of the highlighted range, or {@code null}
     */
    public PositionEncoding anchor() {
        return position == null ? null : position.start();
    }
}
