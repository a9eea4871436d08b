package eu.virtualparadox.readingpos.position;

import lombok.Getter;

/**
 * Raised when a raw xpoint string does not follow the KOReader grammar.
 * <p>Per-item error: callers reject the offending annotation and keep processing the batch.</p>
 */
@Getter
public class MalformedPositionException extends IllegalArgumentException {

    private final String raw;

    public MalformedPositionException(final String raw, final String reason) {
        super("Malformed xpoint '" + raw + "': " + reason);
        this.raw = raw;
    }
}
