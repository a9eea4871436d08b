package eu.virtualparadox.readingpos.index;

import eu.virtualparadox.readingpos.document.DocumentFragment;
import eu.virtualparadox.readingpos.document.DocumentWalker;
import eu.virtualparadox.readingpos.document.WalkedElement;
import eu.virtualparadox.readingpos.position.PositionEncoding;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a fresh {@link PositionIndex} from a book's fragments.
 * <p>The index is assembled in local structures and only returned once the whole walk succeeded;
 * nothing partially built ever escapes.</p>
 */
@Component
@RequiredArgsConstructor
public class PositionIndexBuilder {

    private final DocumentWalker walker;

    /**
     * @param bookId    owning book
     * @param fragments ordered spine fragments
     * @return the complete index
     * @throws IndexBuildException if two elements produce the same address
     * @throws java.util.concurrent.CancellationException if the thread is interrupted mid-walk
     */
    public PositionIndex build(final String bookId, final List<DocumentFragment> fragments) {
        Objects.requireNonNull(bookId, "bookId must not be null");

        final Map<String, Integer> positionsByKey = new HashMap<>();
        final List<PositionIndexEntry> entries = new ArrayList<>();

        walker.walk(fragments, (WalkedElement element) -> {
            final String key = PositionEncoding.elementKey(element.fragmentIndex(), element.canonicalPath());
            final Integer previous = positionsByKey.putIfAbsent(key, element.position());
            if (previous != null) {
                throw new IndexBuildException(bookId,
                        "address " + key + " visited twice (positions " + previous + " and " + element.position() + ")",
                        false, null);
            }
            entries.add(new PositionIndexEntry(element.fragmentIndex(), element.canonicalPath(), element.position()));
        });

        return new PositionIndex(bookId, positionsByKey, entries);
    }
}
