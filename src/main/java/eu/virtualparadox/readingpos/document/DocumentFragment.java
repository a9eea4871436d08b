package eu.virtualparadox.readingpos.document;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

import java.util.Objects;

/**
 * One parsed spine item of a book.
 * <p>The content is parsed as XML, so the tree is exactly the markup of the item: no
 * {@code tbody} or other elements are inserted the way an HTML5 tree builder would.</p>
 *
 * @param index    1-based spine position, the {@code N} of {@code DocFragment[N]}; skipped spine
 *                 items leave gaps
 * @param href     location of the item inside the container, informational only
 * @param document parsed content
 */
public record DocumentFragment(int index, String href, Document document) {

    public DocumentFragment {
        if (index < 1) {
            throw new IllegalArgumentException("Fragment index must be >= 1, was " + index);
        }
        Objects.requireNonNull(document, "document must not be null");
    }

    public static DocumentFragment parse(final int index, final String href, final String xhtml) {
        Objects.requireNonNull(xhtml, "xhtml must not be null");
        return new DocumentFragment(index, href, Jsoup.parse(xhtml, "", Parser.xmlParser()));
    }

    /**
     * @return the root element of the fragment (normally {@code html}), {@code null} for an empty item
     */
    public Element root() {
        return document.children().first();
    }
}
