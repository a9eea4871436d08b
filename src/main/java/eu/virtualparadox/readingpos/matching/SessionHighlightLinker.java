package eu.virtualparadox.readingpos.matching;

import eu.virtualparadox.readingpos.index.PositionIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Links all sessions of one book to the highlights made during them.
 * <p>One index snapshot is used for the whole batch. A pair that fails (e.g. an entity with
 * inconsistent positional data) is logged and skipped; it never aborts the batch.
 * Re-running with the same inputs yields the same links.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionHighlightLinker {

    private final HighlightSessionMatcher matcher;
    private final SessionFilter sessionFilter;

    /**
     * @param sessions   sessions of one book
     * @param highlights highlights of the same book
     * @param index      the book's index snapshot, {@code null} if not built yet
     * @return links, grouped by session in input order, highlights in reading order
     */
    public List<SessionHighlightLink> link(final List<ReadingSession> sessions,
                                           final List<Highlight> highlights,
                                           final PositionIndex index) {
        if (highlights == null || highlights.isEmpty()) {
            return Collections.emptyList();
        }

        final List<ReadingSession> eligible = sessionFilter.filter(sessions);
        final List<SessionHighlightLink> links = new ArrayList<>();
        int undetermined = 0;

        for (final ReadingSession session : eligible) {
            try {
                final SessionMatch match = matcher.match(session, highlights, index);
                for (final Highlight highlight : match.matched()) {
                    links.add(new SessionHighlightLink(session.id(), highlight.id()));
                }
                undetermined += match.undetermined().size();
            } catch (RuntimeException e) {
                log.warn("Highlight matching failed for session {}, skipping it", session.id(), e);
            }
        }

        log.info("Linked {} highlights across {} sessions ({} undetermined pairs, index {})",
                links.size(), eligible.size(), undetermined, index == null ? "absent" : "present");
        return links;
    }
}
