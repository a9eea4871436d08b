package eu.virtualparadox.readingpos.position;

/**
 * Outcome of comparing two {@link PositionEncoding}s.
 * <p>{@link #INCOMPARABLE} is a regular result: same-name sibling counters say nothing about
 * how differently-named siblings interleave, so some pairs cannot be ordered without the document.</p>
 */
public enum EPositionOrder {
    LESS,
    EQUAL,
    GREATER,
    INCOMPARABLE;

    public EPositionOrder reverse() {
        switch (this) {
            case LESS:
                return GREATER;
            case GREATER:
                return LESS;
            default:
                return this;
        }
    }

    public boolean isOrdered() {
        return this != INCOMPARABLE;
    }

    static EPositionOrder of(final int cmp) {
        if (cmp < 0) return LESS;
        if (cmp > 0) return GREATER;
        return EQUAL;
    }
}
