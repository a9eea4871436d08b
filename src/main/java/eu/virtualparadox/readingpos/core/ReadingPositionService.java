package eu.virtualparadox.readingpos.core;

import eu.virtualparadox.readingpos.backfill.BackfillResult;
import eu.virtualparadox.readingpos.backfill.ChapterBounds;
import eu.virtualparadox.readingpos.backfill.PositionBackfiller;
import eu.virtualparadox.readingpos.dedup.ContentHash;
import eu.virtualparadox.readingpos.dedup.ContentHasher;
import eu.virtualparadox.readingpos.dedup.DuplicatePartition;
import eu.virtualparadox.readingpos.dedup.DuplicatePartitioner;
import eu.virtualparadox.readingpos.dedup.HashedItem;
import eu.virtualparadox.readingpos.document.DocumentFragment;
import eu.virtualparadox.readingpos.document.EpubFragmentReader;
import eu.virtualparadox.readingpos.index.IndexBuildJob;
import eu.virtualparadox.readingpos.index.IndexBuildOutcome;
import eu.virtualparadox.readingpos.index.PositionIndex;
import eu.virtualparadox.readingpos.index.PositionIndexManager;
import eu.virtualparadox.readingpos.index.PositionIndexRegistry;
import eu.virtualparadox.readingpos.ingest.BatchReport;
import eu.virtualparadox.readingpos.ingest.HighlightBatchProcessor;
import eu.virtualparadox.readingpos.ingest.RawHighlight;
import eu.virtualparadox.readingpos.matching.Highlight;
import eu.virtualparadox.readingpos.matching.HighlightSessionMatcher;
import eu.virtualparadox.readingpos.matching.ReadingSession;
import eu.virtualparadox.readingpos.matching.SessionHighlightLink;
import eu.virtualparadox.readingpos.matching.SessionHighlightLinker;
import eu.virtualparadox.readingpos.matching.SessionMatch;
import eu.virtualparadox.readingpos.position.EPositionOrder;
import eu.virtualparadox.readingpos.position.PositionComparator;
import eu.virtualparadox.readingpos.position.PositionEncoding;
import eu.virtualparadox.readingpos.position.PositionEncodingParser;
import eu.virtualparadox.readingpos.position.PositionRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Entry point for the host application.
 * <p>Thin delegation to the position, dedup, index and matching components. Nothing here is
 * persisted; storing encodings, hashes and links is up to the caller.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReadingPositionService {

    private final PositionEncodingParser parser;
    private final ContentHasher hasher;
    private final DuplicatePartitioner partitioner;
    private final EpubFragmentReader epubReader;
    private final PositionIndexRegistry indexRegistry;
    private final PositionIndexManager indexManager;
    private final HighlightSessionMatcher matcher;
    private final SessionHighlightLinker linker;
    private final HighlightBatchProcessor highlightBatchProcessor;
    private final PositionBackfiller backfiller;

    // ---- positions ----

    /**
     * @throws eu.virtualparadox.readingpos.position.MalformedPositionException if {@code raw} is not a valid xpoint
     */
    public PositionEncoding parsePosition(final String raw) {
        return parser.parse(raw);
    }

    public Optional<PositionEncoding> tryParsePosition(final String raw) {
        return parser.tryParse(raw);
    }

    public String serializePosition(final PositionEncoding encoding) {
        return parser.serialize(encoding);
    }

    public EPositionOrder comparePositions(final PositionEncoding a, final PositionEncoding b) {
        return PositionComparator.compare(a, b);
    }

    /**
     * Closed-range containment. An incomparable bound yields {@code false}.
     */
    public boolean rangeContains(final PositionRange range, final PositionEncoding point) {
        return range.contains(point);
    }

    // ---- dedup ----

    public ContentHash hashContent(final List<String> parts) {
        return hasher.hash(parts);
    }

    public <T> DuplicatePartition<T> partitionDuplicates(final List<HashedItem<T>> candidates,
                                                         final Set<ContentHash> existingHashes) {
        return partitioner.partition(candidates, existingHashes);
    }

    public BatchReport ingestHighlights(final String bookTitle,
                                        final String bookAuthor,
                                        final List<RawHighlight> highlights,
                                        final Set<ContentHash> existingHashes) {
        return highlightBatchProcessor.process(bookTitle, bookAuthor, highlights, existingHashes);
    }

    // ---- position index ----

    /**
     * Builds the index synchronously and installs it on success. A failed build keeps the
     * previous index of the book.
     */
    public IndexBuildOutcome buildPositionIndex(final String bookId, final List<DocumentFragment> fragments) {
        return indexRegistry.rebuild(bookId, fragments);
    }

    /**
     * Queues a rebuild from an EPUB file. The file is read on the indexing thread.
     */
    public IndexBuildJob submitPositionIndexBuild(final String bookId, final Path epub) {
        Objects.requireNonNull(epub, "epub must not be null");
        return indexManager.submitRebuild(bookId, () -> epubReader.read(epub));
    }

    public Optional<IndexBuildJob> getIndexBuildJob(final long jobId) {
        return indexManager.getJob(jobId);
    }

    public boolean cancelIndexBuild(final long jobId) {
        return indexManager.cancel(jobId);
    }

    public Optional<PositionIndex> currentIndex(final String bookId) {
        return indexRegistry.current(bookId);
    }

    /**
     * @return the document-order number, empty when the element is not indexed
     */
    public OptionalInt resolvePosition(final PositionIndex index, final PositionEncoding encoding) {
        Objects.requireNonNull(index, "index must not be null");
        return index.resolve(encoding);
    }

    /**
     * Resolves stored highlights, sessions and chapters against the index currently installed
     * for {@code bookId}. Returns an empty result when the book has no index yet.
     */
    public BackfillResult backfillPositions(final String bookId,
                                            final List<Highlight> highlights,
                                            final List<ReadingSession> sessions,
                                            final List<ChapterBounds> chapters) {
        final PositionIndex snapshot = indexRegistry.current(bookId).orElse(null);
        if (snapshot == null) {
            log.debug("No position index for book {}, nothing to backfill", bookId);
            return BackfillResult.empty();
        }
        return backfiller.backfill(snapshot, highlights, sessions, chapters);
    }

    // ---- matching ----

    /**
     * Matches against the index currently installed for {@code bookId}, if any. The index is
     * read once, so a concurrent rebuild cannot change it halfway through.
     */
    public SessionMatch matchHighlightsToSession(final String bookId,
                                                 final ReadingSession session,
                                                 final List<Highlight> candidates) {
        final PositionIndex snapshot = indexRegistry.current(bookId).orElse(null);
        if (snapshot == null) {
            log.debug("No position index for book {}, matching without document order", bookId);
        }
        return matcher.match(session, candidates, snapshot);
    }

    public SessionMatch matchHighlightsToSession(final ReadingSession session,
                                                 final List<Highlight> candidates,
                                                 final PositionIndex index) {
        return matcher.match(session, candidates, index);
    }

    public List<SessionHighlightLink> linkSessions(final String bookId,
                                                   final List<ReadingSession> sessions,
                                                   final List<Highlight> highlights) {
        return linker.link(sessions, highlights, indexRegistry.current(bookId).orElse(null));
    }
}
