package eu.virtualparadox.readingpos.dedup;

import java.util.List;

/**
 * Result of {@link DuplicatePartitioner#partition}: both lists keep input order.
 */
public record DuplicatePartition<T>(List<T> unique, List<T> duplicates) {

    public DuplicatePartition {
        unique = List.copyOf(unique);
        duplicates = List.copyOf(duplicates);
    }
}
