package eu.virtualparadox.readingpos.index;

import eu.virtualparadox.readingpos.position.PositionEncoding;
import lombok.Getter;

/**
 * Lookup miss in a {@link PositionIndex}. Only the strict {@link PositionIndex#require} throws it;
 * matching treats a miss as "position unknown" and falls back.
 */
@Getter
public class NotIndexedException extends IllegalStateException {

    private final transient PositionEncoding encoding;

    public NotIndexedException(final PositionEncoding encoding) {
        super("Position not indexed: " + encoding.asString());
        this.encoding = encoding;
    }
}
