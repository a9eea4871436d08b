package eu.virtualparadox.readingpos.dedup;

import java.util.Objects;

/**
 * SHA-256 digest of an annotation's canonical content, as 64 lowercase hex characters.
 * <p>Used as a set key when filtering duplicate highlights and reading sessions.</p>
 */
public record ContentHash(String value) {

    static final int LENGTH = 64;

    public ContentHash {
        Objects.requireNonNull(value, "value must not be null");
        if (value.length() != LENGTH) {
            throw new IllegalArgumentException("ContentHash must be a " + LENGTH + " character hex string, was " + value.length());
        }
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
                throw new IllegalArgumentException("ContentHash must be lowercase hexadecimal: " + value);
            }
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
