package eu.virtualparadox.readingpos.matching;

public enum EMatchDecision {
    CONTAINED,
    NOT_CONTAINED,
    /** No evidence either way; the highlight is never linked on this basis. */
    UNDETERMINED
}
