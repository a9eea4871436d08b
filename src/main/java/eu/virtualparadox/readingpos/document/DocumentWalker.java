package eu.virtualparadox.readingpos.document;

import eu.virtualparadox.readingpos.position.PathStep;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;

/**
 * Enumerates the elements of a book in document order.
 *
 * <h2>Walk</h2>
 * <ul>
 *   <li>Fragments are visited in list order and addressed by their own spine index, which must
 *       grow strictly; gaps left by skipped spine items are kept.</li>
 *   <li>Inside a fragment the element tree is traversed pre-order: a parent before its children,
 *       children left to right.</li>
 *   <li>Each element's path counts same-named siblings, like KOReader and lxml do:
 *       {@code div > (h2, p, blockquote, p)} yields {@code h2[1], p[1], blockquote[1], p[2]}.</li>
 *   <li>The {@code html} root is visited and numbered but is not part of any path, so
 *       addresses start at {@code body}.</li>
 *   <li>Positions start at 1 and grow by one per element across all fragments. Text nodes do
 *       not consume positions.</li>
 * </ul>
 *
 * <p>The walk checks the thread's interrupt flag and stops with a {@link CancellationException}
 * when it is set.</p>
 */
@Slf4j
@Component
public class DocumentWalker {

    private static final String ROOT_ELEMENT = "html";
    private static final int INTERRUPT_CHECK_INTERVAL = 512;

    /**
     * Walks all fragments.
     *
     * @param fragments ordered fragments of one book
     * @param visitor   receives every element in document order
     * @return number of visited elements
     * @throws CancellationException if the current thread is interrupted during the walk
     */
    public int walk(final List<DocumentFragment> fragments, final Consumer<WalkedElement> visitor) {
        Objects.requireNonNull(fragments, "fragments must not be null");
        Objects.requireNonNull(visitor, "visitor must not be null");

        int position = 0;
        int previousIndex = 0;
        for (final DocumentFragment fragment : fragments) {
            Objects.requireNonNull(fragment, "fragments must not contain null elements");
            if (fragment.index() <= previousIndex) {
                throw new IllegalArgumentException("Fragment indices must be strictly increasing, got "
                        + fragment.index() + " after " + previousIndex);
            }
            previousIndex = fragment.index();

            final Element root = fragment.root();
            if (root == null) {
                log.debug("Fragment {} ({}) has no elements", fragment.index(), fragment.href());
                continue;
            }
            position = walkFragment(fragment.index(), root, position, visitor);
            log.debug("Walked fragment {} ({}), {} elements so far", fragment.index(), fragment.href(), position);
        }
        return position;
    }

    private int walkFragment(final int fragmentIndex,
                             final Element root,
                             final int startPosition,
                             final Consumer<WalkedElement> visitor) {
        final Deque<Frame> stack = new ArrayDeque<>();
        final List<PathStep> rootPath = ROOT_ELEMENT.equals(root.normalName())
                ? Collections.emptyList()
                : List.of(PathStep.of(root.normalName(), 1));
        stack.push(new Frame(root, rootPath));

        int position = startPosition;
        while (!stack.isEmpty()) {
            final Frame frame = stack.pop();
            position++;
            if (position % INTERRUPT_CHECK_INTERVAL == 0 && Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Document walk interrupted at fragment " + fragmentIndex);
            }

            visitor.accept(new WalkedElement(fragmentIndex, frame.path, position));

            final List<Frame> children = childFrames(frame);
            for (int c = children.size() - 1; c >= 0; c--) {
                stack.push(children.get(c));
            }
        }

        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Document walk interrupted after fragment " + fragmentIndex);
        }
        return position;
    }

    private List<Frame> childFrames(final Frame parent) {
        final List<Element> children = parent.element.children();
        if (children.isEmpty()) {
            return Collections.emptyList();
        }

        final Map<String, Integer> occurrences = new HashMap<>();
        final List<Frame> frames = new ArrayList<>(children.size());
        for (final Element child : children) {
            final String name = child.normalName();
            final int index = occurrences.merge(name, 1, Integer::sum);

            final List<PathStep> path = new ArrayList<>(parent.path.size() + 1);
            path.addAll(parent.path);
            path.add(PathStep.of(name, index));
            frames.add(new Frame(child, path));
        }
        return frames;
    }

    private record Frame(Element element, List<PathStep> path) {
    }
}
