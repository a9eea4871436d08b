package eu.virtualparadox.readingpos.ingest;

/**
 * Outcome for one uploaded item.
 *
 * @param index    0-based position in the uploaded batch
 * @param clientId uploader's identifier
 * @param status   what happened to the item
 * @param reason   human-readable rejection reason, {@code null} for accepted items
 * @param prepared validated highlight, {@code null} unless parsing and hashing succeeded
 */
public record ItemOutcome(int index, String clientId, EItemStatus status, String reason, PreparedHighlight prepared) {
}
