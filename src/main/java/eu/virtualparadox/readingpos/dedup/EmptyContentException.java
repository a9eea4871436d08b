package eu.virtualparadox.readingpos.dedup;

/**
 * Raised when the content to hash is empty, so the digest would identify nothing.
 */
public class EmptyContentException extends IllegalArgumentException {

    public EmptyContentException(final String message) {
        super(message);
    }
}
