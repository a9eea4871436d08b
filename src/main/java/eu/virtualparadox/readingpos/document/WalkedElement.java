package eu.virtualparadox.readingpos.document;

import eu.virtualparadox.readingpos.position.PathStep;

import java.util.List;

/**
 * An element visited by the {@link DocumentWalker}.
 *
 * @param fragmentIndex 1-based fragment the element belongs to
 * @param path          address from {@code body} down, every step with an explicit index;
 *                      empty for the {@code html} root
 * @param position      document-order number, strictly increasing over the whole walk
 */
public record WalkedElement(int fragmentIndex, List<PathStep> path, int position) {

    public WalkedElement {
        path = List.copyOf(path);
    }

    public String canonicalPath() {
        final StringBuilder sb = new StringBuilder();
        for (final PathStep step : path) {
            sb.append('/').append(step.canonical());
        }
        return sb.toString();
    }
}
