package eu.virtualparadox.readingpos.index;

import eu.virtualparadox.readingpos.document.DocumentFragment;

import java.io.IOException;
import java.util.List;

/**
 * Supplies a book's fragments when a build actually runs, so the document is only loaded on
 * the indexing thread.
 */
@FunctionalInterface
public interface FragmentSource {

    List<DocumentFragment> load() throws IOException;
}
