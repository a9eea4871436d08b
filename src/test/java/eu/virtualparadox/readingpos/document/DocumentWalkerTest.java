package eu.virtualparadox.readingpos.document;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;

import static eu.virtualparadox.readingpos.document.Chapters.chapter;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DocumentWalkerTest {

    private static final String CHAPTER =
            "<div><h2>Title</h2><p>first</p><blockquote>quote</blockquote><p>second</p></div>";

    private final DocumentWalker walker = new DocumentWalker();

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private List<WalkedElement> walkAll(List<DocumentFragment> fragments) {
        List<WalkedElement> visited = new ArrayList<>();
        walker.walk(fragments, visited::add);
        return visited;
    }

    @Test
    @DisplayName("Elements are visited pre-order with same-name sibling counters")
    void testPreOrderPaths() {
        List<WalkedElement> visited = walkAll(List.of(chapter(1, CHAPTER)));

        List<String> paths = visited.stream().map(WalkedElement::canonicalPath).toList();
        assertEquals(List.of(
                "",
                "/head[1]",
                "/body[1]",
                "/body[1]/div[1]",
                "/body[1]/div[1]/h2[1]",
                "/body[1]/div[1]/p[1]",
                "/body[1]/div[1]/blockquote[1]",
                "/body[1]/div[1]/p[2]"), paths);
    }

    @Test
    @DisplayName("Positions are strictly increasing and unique across fragments")
    void testPositionsAcrossFragments() {
        List<DocumentFragment> fragments = List.of(
                chapter(1, CHAPTER),
                chapter(2, "<section><p>a</p><p>b<span>c</span></p></section>"));

        List<WalkedElement> visited = walkAll(fragments);

        int previous = 0;
        Set<String> keys = new HashSet<>();
        for (WalkedElement e : visited) {
            assertTrue(e.position() > previous, "positions must increase");
            previous = e.position();
            assertTrue(keys.add(e.fragmentIndex() + ":" + e.canonicalPath()), "each element once");
        }
        assertEquals(1, visited.get(0).position());
        assertThat(visited).filteredOn(e -> e.fragmentIndex() == 2)
                .extracting(WalkedElement::canonicalPath)
                .contains("/body[1]/section[1]/p[2]/span[1]");
        assertEquals(visited.size(), walker.walk(fragments, e -> { }));
    }

    @Test
    @DisplayName("An interrupted thread stops the walk with CancellationException")
    void testInterrupt() {
        List<DocumentFragment> fragments = List.of(chapter(1, CHAPTER));

        Thread.currentThread().interrupt();

        assertThrows(CancellationException.class, () -> walker.walk(fragments, e -> { }));
    }

    @Test
    @DisplayName("Tables are walked as written, without an inserted tbody")
    void testTableWithoutTbody() {
        List<WalkedElement> visited = walkAll(List.of(chapter(1,
                "<table><tr><td>a</td></tr><tr><td>b</td></tr></table><p>after</p>")));

        List<String> paths = visited.stream().map(WalkedElement::canonicalPath).toList();
        assertThat(paths).containsSubsequence(
                "/body[1]/table[1]",
                "/body[1]/table[1]/tr[1]",
                "/body[1]/table[1]/tr[1]/td[1]",
                "/body[1]/table[1]/tr[2]/td[1]",
                "/body[1]/p[1]");
        assertThat(paths).noneMatch(path -> path.contains("tbody"));
    }

    @Test
    @DisplayName("Elements keep the spine index of their fragment, gaps included")
    void testSpineGaps() {
        List<WalkedElement> visited = walkAll(List.of(chapter(1, "<p>a</p>"), chapter(3, "<p>b</p>")));

        assertThat(visited).extracting(WalkedElement::fragmentIndex).containsOnly(1, 3);
        assertThat(visited).filteredOn(e -> e.fragmentIndex() == 3)
                .extracting(WalkedElement::canonicalPath)
                .contains("/body[1]/p[1]");
    }

    @Test
    @DisplayName("Fragments out of spine order are rejected")
    void testUnorderedFragments() {
        List<DocumentFragment> fragments = List.of(chapter(2, "<p>a</p>"), chapter(2, "<p>b</p>"));

        assertThrows(IllegalArgumentException.class, () -> walker.walk(fragments, e -> { }));
    }

    @Test
    @DisplayName("No fragments, no elements")
    void testEmpty() {
        assertEquals(0, walker.walk(List.of(), e -> fail("nothing to visit")));
    }
}
