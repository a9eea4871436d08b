package eu.virtualparadox.readingpos.matching;

import eu.virtualparadox.readingpos.index.PositionIndex;
import eu.virtualparadox.readingpos.position.DocumentPosition;
import eu.virtualparadox.readingpos.position.EContainment;
import eu.virtualparadox.readingpos.position.PositionEncoding;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Decides which highlights were made during a reading session.
 *
 * <h2>Decision chain, per (session, highlight) pair</h2>
 * <ol>
 *   <li><b>Document order</b>: session start, session end and the highlight anchor all resolve in
 *       the book's {@link PositionIndex}; contained iff {@code start <= anchor <= end}.</li>
 *   <li><b>Pages</b>: the session has both pages and the highlight has a page;
 *       contained iff {@code startPage <= page <= endPage}.</li>
 *   <li><b>Structure</b>: both carry xpoints; {@link eu.virtualparadox.readingpos.position.PositionRange#locate}
 *       decides. An incomparable bound makes the pair undetermined.</li>
 *   <li>Otherwise the pair is undetermined.</li>
 * </ol>
 * Undetermined pairs are reported separately and never matched.
 *
 * <h2>Ordering of matched highlights</h2>
 * Resolved document position first, then page, then the anchor's xpoint text (for a stable
 * order only), then id.
 *
 * <p>Pure function of its inputs. The index passed in is the caller's snapshot and is used for
 * the whole invocation.</p>
 */
@Slf4j
@Component
public class HighlightSessionMatcher {

    /**
     * @param session    the session
     * @param candidates highlights of the same book
     * @param index      the book's installed index, {@code null} if none
     * @return matched and undetermined highlights
     */
    public SessionMatch match(final ReadingSession session,
                              final List<Highlight> candidates,
                              final PositionIndex index) {
        Objects.requireNonNull(session, "session must not be null");
        Objects.requireNonNull(candidates, "candidates must not be null");

        final List<Highlight> matched = new ArrayList<>();
        final List<Highlight> undetermined = new ArrayList<>();

        for (final Highlight highlight : candidates) {
            Objects.requireNonNull(highlight, "candidates must not contain null elements");
            final MatchDecision decision = decide(session, highlight, index);
            log.debug("Session {} / highlight {}: {} by {}",
                    session.id(), highlight.id(), decision.decision(), decision.basis());

            switch (decision.decision()) {
                case CONTAINED:
                    matched.add(highlight);
                    break;
                case UNDETERMINED:
                    undetermined.add(highlight);
                    break;
                default:
                    break;
            }
        }

        matched.sort(readingOrder(index));
        return new SessionMatch(session, matched, undetermined);
    }

    /**
     * Evaluates the decision chain for one pair.
     */
    public MatchDecision decide(final ReadingSession session, final Highlight highlight, final PositionIndex index) {
        final PositionEncoding anchor = highlight.anchor();
        final boolean bothPositioned = session.range() != null && anchor != null;

        if (index != null && bothPositioned) {
            final OptionalInt start = index.resolve(session.range().start());
            final OptionalInt end = index.resolve(session.range().end());
            final OptionalInt point = index.resolve(anchor);
            if (start.isPresent() && end.isPresent() && point.isPresent()) {
                final int p = point.getAsInt();
                return MatchDecision.of(start.getAsInt() <= p && p <= end.getAsInt(), EMatchBasis.DOCUMENT_ORDER);
            }
            log.debug("Session {} / highlight {}: position not indexed, falling back", session.id(), highlight.id());
        }

        if (session.hasPages() && highlight.page() != null) {
            final int page = highlight.page();
            return MatchDecision.of(session.startPage() <= page && page <= session.endPage(), EMatchBasis.PAGE);
        }

        if (bothPositioned) {
            final EContainment containment = session.range().locate(anchor);
            if (containment == EContainment.UNKNOWN) {
                return new MatchDecision(EMatchDecision.UNDETERMINED, EMatchBasis.STRUCTURE);
            }
            return MatchDecision.of(containment == EContainment.INSIDE, EMatchBasis.STRUCTURE);
        }

        return MatchDecision.UNDETERMINED;
    }

    private Comparator<Highlight> readingOrder(final PositionIndex index) {
        return Comparator
                .comparingInt((Highlight h) -> tier(h, index))
                .thenComparing((a, b) -> compareWithinTier(a, b, index))
                .thenComparing(Highlight::id);
    }

    private int tier(final Highlight h, final PositionIndex index) {
        if (documentPosition(h, index).isPresent()) return 0;
        if (h.page() != null) return 1;
        return 2;
    }

    private int compareWithinTier(final Highlight a, final Highlight b, final PositionIndex index) {
        final Optional<DocumentPosition> posA = documentPosition(a, index);
        final Optional<DocumentPosition> posB = documentPosition(b, index);
        if (posA.isPresent() && posB.isPresent()) {
            return posA.get().compareTo(posB.get());
        }
        if (a.page() != null && b.page() != null) {
            return Integer.compare(a.page(), b.page());
        }
        return anchorText(a).compareTo(anchorText(b));
    }

    private Optional<DocumentPosition> documentPosition(final Highlight h, final PositionIndex index) {
        if (index == null || h.anchor() == null) {
            return Optional.empty();
        }
        return index.resolvePosition(h.anchor());
    }

    private String anchorText(final Highlight h) {
        return h.anchor() == null ? "" : h.anchor().asString();
    }
}
