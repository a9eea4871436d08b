package eu.virtualparadox.readingpos.position;

/**
 * A resolved location: the document-order number of the addressed element and the
 * character offset carried by the encoding. Totally ordered.
 */
public record DocumentPosition(int index, int charIndex) implements Comparable<DocumentPosition> {

    public DocumentPosition {
        if (index < 1) {
            throw new IllegalArgumentException("index must be >= 1, was " + index);
        }
        if (charIndex < 0) {
            throw new IllegalArgumentException("charIndex must be >= 0, was " + charIndex);
        }
    }

    @Override
    public int compareTo(final DocumentPosition other) {
        final int cmp = Integer.compare(index, other.index);
        return cmp != 0 ? cmp : Integer.compare(charIndex, other.charIndex);
    }
}
