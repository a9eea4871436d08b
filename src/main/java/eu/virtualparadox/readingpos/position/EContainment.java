package eu.virtualparadox.readingpos.position;

/**
 * Where a point lies relative to a {@link PositionRange}.
 */
public enum EContainment {
    INSIDE,
    OUTSIDE,
    /** At least one bound could not be compared with the point. */
    UNKNOWN
}
