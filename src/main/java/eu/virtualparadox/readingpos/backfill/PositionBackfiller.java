package eu.virtualparadox.readingpos.backfill;

import eu.virtualparadox.readingpos.index.PositionIndex;
import eu.virtualparadox.readingpos.matching.Highlight;
import eu.virtualparadox.readingpos.matching.ReadingSession;
import eu.virtualparadox.readingpos.position.DocumentPosition;
import eu.virtualparadox.readingpos.position.PositionEncoding;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves stored xpoints to document positions once a book's index becomes available.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>A highlight resolves from the start of its range.</li>
 *   <li>A session needs both its start and its end resolved.</li>
 *   <li>A chapter keeps whichever bounds resolve and is dropped when none do.</li>
 * </ul>
 * Unresolvable items are left out of the result; the caller keeps whatever it stored before.
 */
@Slf4j
@Service
public class PositionBackfiller {

    public BackfillResult backfill(final PositionIndex index,
                                   final List<Highlight> highlights,
                                   final List<ReadingSession> sessions,
                                   final List<ChapterBounds> chapters) {
        Objects.requireNonNull(index, "index must not be null");

        final Map<String, DocumentPosition> highlightPositions = new LinkedHashMap<>();
        for (final Highlight highlight : nullToEmpty(highlights)) {
            resolve(index, highlight.anchor()).ifPresent(p -> highlightPositions.put(highlight.id(), p));
        }

        final Map<String, PositionSpan> sessionSpans = new LinkedHashMap<>();
        for (final ReadingSession session : nullToEmpty(sessions)) {
            if (session.range() == null) {
                continue;
            }
            final Optional<DocumentPosition> start = resolve(index, session.range().start());
            final Optional<DocumentPosition> end = resolve(index, session.range().end());
            if (start.isPresent() && end.isPresent()) {
                sessionSpans.put(session.id(), new PositionSpan(start.get(), end.get()));
            }
        }

        final Map<String, ResolvedChapter> resolvedChapters = new LinkedHashMap<>();
        for (final ChapterBounds chapter : nullToEmpty(chapters)) {
            final DocumentPosition start = resolve(index, chapter.start()).orElse(null);
            final DocumentPosition end = resolve(index, chapter.end()).orElse(null);
            if (start != null || end != null) {
                resolvedChapters.put(chapter.id(), new ResolvedChapter(start, end));
            }
        }

        final BackfillResult result = new BackfillResult(highlightPositions, sessionSpans, resolvedChapters);
        log.info("Backfilled positions for book {}: {}/{} highlights, {}/{} sessions, {}/{} chapters",
                index.getBookId(),
                highlightPositions.size(), nullToEmpty(highlights).size(),
                sessionSpans.size(), nullToEmpty(sessions).size(),
                resolvedChapters.size(), nullToEmpty(chapters).size());
        return result;
    }

    private static Optional<DocumentPosition> resolve(final PositionIndex index, final PositionEncoding encoding) {
        return encoding == null ? Optional.empty() : index.resolvePosition(encoding);
    }

    private static <T> List<T> nullToEmpty(final List<T> items) {
        return items == null ? List.of() : items;
    }
}
