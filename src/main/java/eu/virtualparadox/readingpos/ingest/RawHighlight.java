package eu.virtualparadox.readingpos.ingest;

/**
 * A highlight as uploaded by the reader, before validation.
 *
 * @param clientId   identifier assigned by the uploader, echoed in the report
 * @param text       highlighted text
 * @param startXpoint start xpoint, {@code null} for page-only documents
 * @param endXpoint  end xpoint, {@code null} for a single point
 * @param page       page number, may be {@code null}
 */
public record RawHighlight(String clientId, String text, String startXpoint, String endXpoint, Integer page) {
}
