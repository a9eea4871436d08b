package eu.virtualparadox.readingpos.dedup;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Splits a batch of hashed candidates into unique items and duplicates.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>A candidate is a duplicate if its hash is already stored ({@code existing}) or was seen
 *       earlier in the same batch.</li>
 *   <li>Candidates are processed in input order; the first occurrence of a hash wins.</li>
 *   <li>Both output lists preserve input order.</li>
 * </ul>
 */
@Slf4j
@Component
public class DuplicatePartitioner {

    /**
     * @param candidates hashed items in arrival order; may be {@code null} or empty
     * @param existing   hashes already persisted; may be {@code null}
     * @return the partition, never {@code null}
     */
    public <T> DuplicatePartition<T> partition(final List<HashedItem<T>> candidates,
                                               final Set<ContentHash> existing) {
        if (candidates == null || candidates.isEmpty()) {
            return new DuplicatePartition<>(List.of(), List.of());
        }

        final Set<ContentHash> seen = existing == null ? new HashSet<>() : new HashSet<>(existing);
        final List<T> unique = new ArrayList<>();
        final List<T> duplicates = new ArrayList<>();

        for (final HashedItem<T> candidate : candidates) {
            Objects.requireNonNull(candidate, "candidates must not contain null elements");
            if (seen.add(candidate.hash())) {
                unique.add(candidate.item());
            } else {
                duplicates.add(candidate.item());
            }
        }

        log.debug("Partitioned {} candidates: {} unique, {} duplicates",
                candidates.size(), unique.size(), duplicates.size());
        return new DuplicatePartition<>(unique, duplicates);
    }
}
