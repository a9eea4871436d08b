package eu.virtualparadox.readingpos.backfill;

import eu.virtualparadox.readingpos.position.DocumentPosition;

import java.util.Map;

/**
 * Positions resolved by {@link PositionBackfiller}, keyed by the caller's identifiers. Items
 * that could not be resolved are absent.
 */
public record BackfillResult(Map<String, DocumentPosition> highlights,
                             Map<String, PositionSpan> sessions,
                             Map<String, ResolvedChapter> chapters) {

    public BackfillResult {
        highlights = Map.copyOf(highlights);
        sessions = Map.copyOf(sessions);
        chapters = Map.copyOf(chapters);
    }

    public static BackfillResult empty() {
        return new BackfillResult(Map.of(), Map.of(), Map.of());
    }

    public int size() {
        return highlights.size() + sessions.size() + chapters.size();
    }
}
