package eu.virtualparadox.readingpos.position;

import java.util.List;
import java.util.Objects;

/**
 * Structural comparison of {@link PositionEncoding}s without access to the document.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Effective fragment index (absent counts as 1).</li>
 *   <li>Path steps, pairwise. At the first differing step: same element name compares the
 *       occurrence indices; different names yield {@link EPositionOrder#INCOMPARABLE}.</li>
 *   <li>If one path is a strict prefix of the other, the longer one (a descendant) comes after.</li>
 *   <li>Text node index, then character offset.</li>
 * </ol>
 *
 * <p>The result is a partial order: reflexive, antisymmetric, and {@code INCOMPARABLE} is symmetric.</p>
 */
public final class PositionComparator {

    private PositionComparator() {
        // prevent instantiation
    }

    public static EPositionOrder compare(final PositionEncoding a, final PositionEncoding b) {
        Objects.requireNonNull(a, "a must not be null");
        Objects.requireNonNull(b, "b must not be null");

        final int fragmentCmp = Integer.compare(a.effectiveFragmentIndex(), b.effectiveFragmentIndex());
        if (fragmentCmp != 0) {
            return EPositionOrder.of(fragmentCmp);
        }

        final List<PathStep> pathA = a.getPath();
        final List<PathStep> pathB = b.getPath();
        final int common = Math.min(pathA.size(), pathB.size());

        for (int i = 0; i < common; i++) {
            final PathStep stepA = pathA.get(i);
            final PathStep stepB = pathB.get(i);
            if (stepA.sameElement(stepB)) {
                continue;
            }
            if (!stepA.name().equals(stepB.name())) {
                return EPositionOrder.INCOMPARABLE;
            }
            return EPositionOrder.of(Integer.compare(stepA.index(), stepB.index()));
        }

        // a parent precedes its descendants
        if (pathA.size() != pathB.size()) {
            return EPositionOrder.of(Integer.compare(pathA.size(), pathB.size()));
        }

        final int textCmp = Integer.compare(a.getTextNodeIndex(), b.getTextNodeIndex());
        if (textCmp != 0) {
            return EPositionOrder.of(textCmp);
        }

        return EPositionOrder.of(Integer.compare(a.getCharOffset(), b.getCharOffset()));
    }
}
