package eu.virtualparadox.readingpos.index;

import lombok.Getter;

/**
 * A position index could not be built for a book. The previously installed index, if any,
 * stays in place.
 */
@Getter
public class IndexBuildException extends IllegalStateException {

    private final String bookId;
    private final boolean cancelled;

    public IndexBuildException(final String bookId, final String message, final boolean cancelled, final Throwable cause) {
        super("Position index build failed for book " + bookId + ": " + message, cause);
        this.bookId = bookId;
        this.cancelled = cancelled;
    }
}
