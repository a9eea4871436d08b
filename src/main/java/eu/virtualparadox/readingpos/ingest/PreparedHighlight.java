package eu.virtualparadox.readingpos.ingest;

import eu.virtualparadox.readingpos.dedup.ContentHash;
import eu.virtualparadox.readingpos.position.PositionRange;

/**
 * A validated highlight ready to be stored by the caller.
 */
public record PreparedHighlight(RawHighlight raw, ContentHash hash, PositionRange position) {
}
