package eu.virtualparadox.readingpos.matching;

import eu.virtualparadox.readingpos.position.PositionRange;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Positional view of a reading session owned by the surrounding application.
 *
 * @param id        caller's identifier
 * @param range     start and end xpoints, {@code null} when the reader reported none
 * @param startPage first page read, may be {@code null}
 * @param endPage   last page read, may be {@code null}
 * @param startTime session start, may be {@code null}
 * @param endTime   session end, may be {@code null}
 */
public record ReadingSession(String id,
                             PositionRange range,
                             Integer startPage,
                             Integer endPage,
                             Instant startTime,
                             Instant endTime) {

    public ReadingSession {
        Objects.requireNonNull(id, "id must not be null");
        if (startPage != null && endPage != null && startPage > endPage) {
            throw new IllegalArgumentException(
                    "Invalid page range: startPage (" + startPage + ") > endPage (" + endPage + ") for session " + id);
        }
    }

    public static ReadingSession of(final String id, final PositionRange range, final Integer startPage, final Integer endPage) {
        return new ReadingSession(id, range, startPage, endPage, null, null);
    }

    public boolean hasPages() {
        return startPage != null && endPage != null;
    }

    /**
     * @return true if the session starts and ends at the same place, i.e. nothing was read
     */
    public boolean isZeroSpan() {
        final boolean samePosition = range == null || range.start().equals(range.end());
        return samePosition && Objects.equals(startPage, endPage);
    }

    /**
     * @return session length, {@code null} when either timestamp is missing
     */
    public Duration duration() {
        if (startTime == null || endTime == null) {
            return null;
        }
        return Duration.between(startTime, endTime);
    }
}
