package eu.virtualparadox.readingpos.dedup;

import java.util.Objects;

/**
 * An item paired with the hash of its content.
 */
public record HashedItem<T>(T item, ContentHash hash) {

    public HashedItem {
        Objects.requireNonNull(item, "item must not be null");
        Objects.requireNonNull(hash, "hash must not be null");
    }
}
