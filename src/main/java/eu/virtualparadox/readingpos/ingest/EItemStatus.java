package eu.virtualparadox.readingpos.ingest;

public enum EItemStatus {
    ACCEPTED,
    DUPLICATE,
    MALFORMED_POSITION,
    INVALID_RANGE,
    EMPTY_CONTENT
}
