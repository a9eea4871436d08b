package eu.virtualparadox.readingpos.position;

import java.util.Objects;

/**
 * Closed range {@code [start, end]} of positions, e.g. a highlight or a reading session.
 * <p>Construction fails only when the bounds are provably reversed. Bounds that cannot be
 * ordered structurally are accepted: the document is needed to tell.</p>
 */
public record PositionRange(PositionEncoding start, PositionEncoding end) {

    public PositionRange {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (PositionComparator.compare(start, end) == EPositionOrder.GREATER) {
            throw new IllegalArgumentException(
                    "Invalid range: start (" + start.asString() + ") comes after end (" + end.asString() + ")");
        }
    }

    public static PositionRange of(final PositionEncoding point) {
        return new PositionRange(point, point);
    }

    /**
     * Three-valued containment.
     *
     * @param point the position to test
     * @return {@link EContainment#UNKNOWN} if either bound is incomparable with {@code point}
     */
    public EContainment locate(final PositionEncoding point) {
        final EPositionOrder fromStart = PositionComparator.compare(start, point);
        final EPositionOrder toEnd = PositionComparator.compare(point, end);

        if (fromStart == EPositionOrder.GREATER || toEnd == EPositionOrder.GREATER) {
            return EContainment.OUTSIDE;
        }
        if (!fromStart.isOrdered() || !toEnd.isOrdered()) {
            return EContainment.UNKNOWN;
        }
        return EContainment.INSIDE;
    }

    /**
     * @return true only if {@code point} is provably inside the range; false when outside or unknown
     */
    public boolean contains(final PositionEncoding point) {
        return locate(point) == EContainment.INSIDE;
    }
}
