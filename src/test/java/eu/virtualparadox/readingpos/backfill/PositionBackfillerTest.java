package eu.virtualparadox.readingpos.backfill;

import eu.virtualparadox.readingpos.document.DocumentWalker;
import eu.virtualparadox.readingpos.index.PositionIndex;
import eu.virtualparadox.readingpos.index.PositionIndexBuilder;
import eu.virtualparadox.readingpos.matching.Highlight;
import eu.virtualparadox.readingpos.matching.ReadingSession;
import eu.virtualparadox.readingpos.position.DocumentPosition;
import eu.virtualparadox.readingpos.position.PositionEncodingParser;
import eu.virtualparadox.readingpos.position.PositionRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static eu.virtualparadox.readingpos.document.Chapters.chapter;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PositionBackfillerTest {

    private final PositionEncodingParser parser = new PositionEncodingParser();
    private final PositionBackfiller backfiller = new PositionBackfiller();

    // html=1, head=2, body=3, then one number per element below
    private final PositionIndex index = new PositionIndexBuilder(new DocumentWalker()).build("book", List.of(
            chapter(1, "<h1>One</h1><p>a</p><p>b</p>"),
            chapter(2, "<h1>Two</h1><p>c</p>")));

    @Test
    @DisplayName("Highlights resolve from the start of their range")
    void testHighlights() {
        Highlight ranged = new Highlight("ranged", new PositionRange(
                parser.parse("/body/DocFragment[1]/body/p[1]/text().2"),
                parser.parse("/body/DocFragment[2]/body/p/text().1")), 12);
        Highlight unknown = Highlight.at("unknown", parser.parse("/body/DocFragment[1]/body/p[7].0"), null);
        Highlight pageOnly = new Highlight("page-only", null, 4);

        BackfillResult result = backfiller.backfill(index, List.of(ranged, unknown, pageOnly), List.of(), List.of());

        assertThat(result.highlights()).containsOnlyKeys("ranged");
        assertEquals(new DocumentPosition(5, 2), result.highlights().get("ranged"));
    }

    @Test
    @DisplayName("Sessions need both ends resolved")
    void testSessions() {
        ReadingSession both = ReadingSession.of("both", new PositionRange(
                parser.parse("/body/DocFragment[1]/body/p[2].0"),
                parser.parse("/body/DocFragment[2]/body/h1.0")), null, null);
        ReadingSession halfKnown = ReadingSession.of("half", new PositionRange(
                parser.parse("/body/DocFragment[1]/body/p[1].0"),
                parser.parse("/body/DocFragment[3]/body/p.0")), null, null);
        ReadingSession noRange = ReadingSession.of("pages", null, 1, 9);

        BackfillResult result = backfiller.backfill(index, List.of(), List.of(both, halfKnown, noRange), List.of());

        assertThat(result.sessions()).containsOnlyKeys("both");
        PositionSpan span = result.sessions().get("both");
        assertEquals(new DocumentPosition(6, 0), span.start());
        assertTrue(span.start().compareTo(span.end()) < 0);
    }

    @Test
    @DisplayName("Chapters keep whichever bound resolves")
    void testChapters() {
        ChapterBounds full = new ChapterBounds("one",
                parser.parse("/body/DocFragment[1]/body/h1.0"), parser.parse("/body/DocFragment[1]/body/p[2].0"));
        ChapterBounds openEnded = new ChapterBounds("two", parser.parse("/body/DocFragment[2]/body/h1.0"), null);
        ChapterBounds lost = new ChapterBounds("lost", parser.parse("/body/DocFragment[5]/body/h1.0"), null);

        BackfillResult result = backfiller.backfill(index, null, null, List.of(full, openEnded, lost));

        assertThat(result.chapters()).containsOnlyKeys("one", "two");
        assertEquals(new DocumentPosition(4, 0), result.chapters().get("one").start());
        assertEquals(new DocumentPosition(6, 0), result.chapters().get("one").end());
        assertTrue(result.chapters().get("two").endPosition().isEmpty());
        assertEquals(2, result.size());
    }
}
