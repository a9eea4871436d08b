package eu.virtualparadox.readingpos.index;

import java.util.Optional;

/**
 * Result of one build attempt for one book: either the newly installed index or the reason
 * the previous index was kept.
 */
public record IndexBuildOutcome(String bookId, PositionIndex index, String failure, boolean cancelled) {

    public static IndexBuildOutcome installed(final PositionIndex index) {
        return new IndexBuildOutcome(index.getBookId(), index, null, false);
    }

    public static IndexBuildOutcome failed(final IndexBuildException e) {
        return new IndexBuildOutcome(e.getBookId(), null, e.getMessage(), e.isCancelled());
    }

    public boolean isInstalled() {
        return index != null;
    }

    public Optional<PositionIndex> installedIndex() {
        return Optional.ofNullable(index);
    }
}
