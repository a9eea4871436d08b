package eu.virtualparadox.readingpos.matching;

/**
 * Which evidence decided a (session, highlight) pair, in order of preference.
 */
public enum EMatchBasis {
    DOCUMENT_ORDER,
    PAGE,
    STRUCTURE,
    NONE
}
