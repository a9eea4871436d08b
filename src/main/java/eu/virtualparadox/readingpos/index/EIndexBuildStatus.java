package eu.virtualparadox.readingpos.index;

public enum EIndexBuildStatus {
    QUEUED,
    WALKING,
    /** The walk finished and the index is being swapped in; the job can no longer be cancelled. */
    INSTALLING,
    INSTALLED,
    FAILED,
    CANCELLED;

    public boolean isFinal() {
        return this == INSTALLED || this == FAILED || this == CANCELLED;
    }
}
