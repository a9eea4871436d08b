package eu.virtualparadox.readingpos.matching;

import java.util.List;

/**
 * Highlights of one session: {@code matched} in reading order, {@code undetermined} in input order.
 */
public record SessionMatch(ReadingSession session, List<Highlight> matched, List<Highlight> undetermined) {

    public SessionMatch {
        matched = List.copyOf(matched);
        undetermined = List.copyOf(undetermined);
    }
}
