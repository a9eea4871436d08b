package eu.virtualparadox.readingpos.dedup;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * Computes {@link ContentHash}es over ordered content parts.
 *
 * <h2>Canonical form</h2>
 * Every part is written as {@code <utf-8 byte length>:<part>} and the pieces are concatenated
 * in the given order before hashing with SHA-256. The length prefix keeps part boundaries
 * unambiguous: {@code ("ab", "c")}, {@code ("a", "bc")} and {@code ("abc")} hash differently.
 *
 * <p>Callers fix the field order; {@link #forHighlight} and {@link #forReadingSession} encode the
 * orders used for the two annotation kinds.</p>
 *
 * <p>Stateless and thread-safe.</p>
 */
@Component
public class ContentHasher {

    private static final String ALGORITHM = "SHA-256";

    /**
     * Hashes ordered parts.
     *
     * @param parts content parts; {@code null} entries count as empty strings
     * @return the digest
     * @throws EmptyContentException if there are no parts or every part is blank
     */
    public ContentHash hash(final List<String> parts) {
        if (parts == null || parts.isEmpty()) {
            throw new EmptyContentException("Cannot compute hash without content parts");
        }
        if (parts.stream().allMatch(StringUtils::isBlank)) {
            throw new EmptyContentException("Cannot compute hash of blank content");
        }

        final StringBuilder canonical = new StringBuilder();
        for (final String part : parts) {
            final String value = Objects.toString(part, "");
            canonical.append(value.getBytes(StandardCharsets.UTF_8).length)
                    .append(':')
                    .append(value);
        }
        return digest(canonical.toString());
    }

    public ContentHash hash(final String... parts) {
        return hash(parts == null ? null : Arrays.asList(parts));
    }

    /**
     * Single-field case.
     *
     * @throws EmptyContentException if {@code text} is null or blank
     */
    public ContentHash computeFromText(final String text) {
        if (StringUtils.isBlank(text)) {
            throw new EmptyContentException("Cannot compute hash of empty content");
        }
        return hash(List.of(text));
    }

    /**
     * Highlight identity: trimmed text, book title and author. Book metadata is part of the
     * identity so the same passage highlighted in two books is kept twice.
     */
    public ContentHash forHighlight(final String text, final String bookTitle, final String bookAuthor) {
        if (StringUtils.isBlank(text)) {
            throw new EmptyContentException("Cannot compute hash of a highlight without text");
        }
        return hash(List.of(
                text.strip(),
                Objects.toString(bookTitle, "").strip(),
                Objects.toString(bookAuthor, "").strip()));
    }

    /**
     * Reading session identity: book, user, start instant and device.
     */
    public ContentHash forReadingSession(final long bookId,
                                         final long userId,
                                         final Instant startTime,
                                         final String deviceId) {
        Objects.requireNonNull(startTime, "startTime must not be null");
        return hash(List.of(
                String.valueOf(bookId),
                String.valueOf(userId),
                DateTimeFormatter.ISO_INSTANT.format(startTime),
                Objects.toString(deviceId, "").strip()));
    }

    private ContentHash digest(final String canonical) {
        try {
            final MessageDigest md = MessageDigest.getInstance(ALGORITHM);
            final byte[] bytes = md.digest(canonical.getBytes(StandardCharsets.UTF_8));
            return new ContentHash(HexFormat.of().formatHex(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }
}
