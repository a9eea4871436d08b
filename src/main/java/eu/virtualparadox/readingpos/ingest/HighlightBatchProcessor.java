package eu.virtualparadox.readingpos.ingest;

import eu.virtualparadox.readingpos.dedup.ContentHash;
import eu.virtualparadox.readingpos.dedup.ContentHasher;
import eu.virtualparadox.readingpos.dedup.DuplicatePartition;
import eu.virtualparadox.readingpos.dedup.DuplicatePartitioner;
import eu.virtualparadox.readingpos.dedup.EmptyContentException;
import eu.virtualparadox.readingpos.dedup.HashedItem;
import eu.virtualparadox.readingpos.position.MalformedPositionException;
import eu.virtualparadox.readingpos.position.PositionEncoding;
import eu.virtualparadox.readingpos.position.PositionEncodingParser;
import eu.virtualparadox.readingpos.position.PositionRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Validates an uploaded batch of highlights for one book.
 * <ol>
 *   <li>Hash each item's content (text, book title, author).</li>
 *   <li>Parse its xpoints into a {@link PositionRange}.</li>
 *   <li>Split the valid items into unique and duplicate against the stored hashes and the
 *       batch itself.</li>
 * </ol>
 * Bad items are reported individually; they never fail the batch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HighlightBatchProcessor {

    private final PositionEncodingParser parser;
    private final ContentHasher hasher;
    private final DuplicatePartitioner partitioner;

    /**
     * @param bookTitle      title of the book the batch belongs to
     * @param bookAuthor     author, may be {@code null}
     * @param highlights     uploaded items
     * @param existingHashes hashes of highlights already stored for the book
     * @return one outcome per uploaded item, in upload order
     */
    public BatchReport process(final String bookTitle,
                               final String bookAuthor,
                               final List<RawHighlight> highlights,
                               final Set<ContentHash> existingHashes) {
        Objects.requireNonNull(highlights, "highlights must not be null");

        final ItemOutcome[] outcomes = new ItemOutcome[highlights.size()];
        final List<HashedItem<ItemOutcome>> valid = new ArrayList<>();

        for (int i = 0; i < highlights.size(); i++) {
            final RawHighlight raw = Objects.requireNonNull(highlights.get(i), "highlights must not contain null elements");
            try {
                final ContentHash hash = hasher.forHighlight(raw.text(), bookTitle, bookAuthor);
                final PositionRange position = toRange(raw);
                final ItemOutcome accepted = new ItemOutcome(i, raw.clientId(), EItemStatus.ACCEPTED, null,
                        new PreparedHighlight(raw, hash, position));
                outcomes[i] = accepted;
                valid.add(new HashedItem<>(accepted, hash));
            } catch (EmptyContentException e) {
                outcomes[i] = reject(i, raw, EItemStatus.EMPTY_CONTENT, e);
            } catch (MalformedPositionException e) {
                outcomes[i] = reject(i, raw, EItemStatus.MALFORMED_POSITION, e);
            } catch (IllegalArgumentException e) {
                outcomes[i] = reject(i, raw, EItemStatus.INVALID_RANGE, e);
            }
        }

        final DuplicatePartition<ItemOutcome> partition = partitioner.partition(valid, existingHashes);
        final Map<ItemOutcome, Boolean> duplicates = new IdentityHashMap<>();
        for (final ItemOutcome duplicate : partition.duplicates()) {
            duplicates.put(duplicate, Boolean.TRUE);
        }
        final Map<ContentHash, Integer> firstInBatch = new HashMap<>();
        for (final ItemOutcome kept : partition.unique()) {
            firstInBatch.put(kept.prepared().hash(), kept.index());
        }
        for (int i = 0; i < outcomes.length; i++) {
            final ItemOutcome outcome = outcomes[i];
            if (duplicates.containsKey(outcome)) {
                outcomes[i] = new ItemOutcome(outcome.index(), outcome.clientId(), EItemStatus.DUPLICATE,
                        duplicateReason(outcome.prepared().hash(), firstInBatch), outcome.prepared());
            }
        }

        final BatchReport report = new BatchReport(List.of(outcomes));
        log.info("Processed highlight batch for '{}': {} accepted, {} duplicate, {} rejected",
                bookTitle,
                report.count(EItemStatus.ACCEPTED),
                report.count(EItemStatus.DUPLICATE),
                highlights.size() - report.count(EItemStatus.ACCEPTED) - report.count(EItemStatus.DUPLICATE));
        return report;
    }

    private PositionRange toRange(final RawHighlight raw) {
        if (StringUtils.isBlank(raw.startXpoint())) {
            return null;
        }
        final PositionEncoding start = parser.parse(raw.startXpoint());
        final PositionEncoding end = StringUtils.isBlank(raw.endXpoint()) ? start : parser.parse(raw.endXpoint());
        return new PositionRange(start, end);
    }

    private static String duplicateReason(final ContentHash hash, final Map<ContentHash, Integer> firstInBatch) {
        final Integer first = firstInBatch.get(hash);
        if (first != null) {
            return "repeats item " + first + " of this batch";
        }
        return "content hash " + hash + " already stored";
    }

    private ItemOutcome reject(final int index, final RawHighlight raw, final EItemStatus status, final RuntimeException e) {
        log.warn("Rejected highlight {} ({}) in batch: {}", index, raw.clientId(), e.getMessage());
        return new ItemOutcome(index, raw.clientId(), status, e.getMessage(), null);
    }
}
