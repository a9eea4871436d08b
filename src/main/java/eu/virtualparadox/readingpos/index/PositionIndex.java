package eu.virtualparadox.readingpos.index;

import eu.virtualparadox.readingpos.position.DocumentPosition;
import eu.virtualparadox.readingpos.position.PositionEncoding;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Immutable map from element addresses to document-order numbers for one book.
 * <p>Lookups are element-level: the text node and offset of an encoding do not change the
 * resolved number. Instances are safe to share between threads.</p>
 */
public final class PositionIndex {

    private final String bookId;
    private final Map<String, Integer> positionsByKey;
    private final List<PositionIndexEntry> entries;

    PositionIndex(final String bookId,
                  final Map<String, Integer> positionsByKey,
                  final List<PositionIndexEntry> entries) {
        this.bookId = bookId;
        this.positionsByKey = Collections.unmodifiableMap(positionsByKey);
        this.entries = Collections.unmodifiableList(entries);
    }

    public String getBookId() {
        return bookId;
    }

    /**
     * @return number of indexed elements
     */
    public int size() {
        return entries.size();
    }

    /**
     * @return all entries in walk order
     */
    public List<PositionIndexEntry> entries() {
        return entries;
    }

    /**
     * @param encoding the position to resolve
     * @return the document-order number of the addressed element, or empty when not indexed
     */
    public OptionalInt resolve(final PositionEncoding encoding) {
        final Integer position = positionsByKey.get(encoding.elementKey());
        return position == null ? OptionalInt.empty() : OptionalInt.of(position);
    }

    /**
     * @return element number plus the encoding's character offset, or empty when not indexed
     */
    public Optional<DocumentPosition> resolvePosition(final PositionEncoding encoding) {
        final OptionalInt index = resolve(encoding);
        if (index.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new DocumentPosition(index.getAsInt(), encoding.getCharOffset()));
    }

    /**
     * Strict lookup.
     *
     * @throws NotIndexedException if the element is not in this index
     */
    public int require(final PositionEncoding encoding) {
        return resolve(encoding).orElseThrow(() -> new NotIndexedException(encoding));
    }
}
