package eu.virtualparadox.readingpos.index;

/**
 * One indexed element: its address and document-order number.
 */
public record PositionIndexEntry(int fragmentIndex, String canonicalPath, int position) {
}
