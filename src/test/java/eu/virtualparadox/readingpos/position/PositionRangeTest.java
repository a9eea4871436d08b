package eu.virtualparadox.readingpos.position;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PositionRangeTest {

    private final PositionEncodingParser parser = new PositionEncodingParser();

    private PositionRange range(String start, String end) {
        return new PositionRange(parser.parse(start), parser.parse(end));
    }

    @Test
    @DisplayName("Both bounds are inside the range")
    void testClosedBounds() {
        PositionRange r = range("/body/div/p[1]/text().0", "/body/div/p[2]/text().15");

        assertTrue(r.contains(parser.parse("/body/div/p[1]/text().0")));
        assertTrue(r.contains(parser.parse("/body/div/p[2]/text().15")));
        assertTrue(r.contains(parser.parse("/body/div/p[1]/text().300")));
    }

    @Test
    @DisplayName("Points before the start or after the end are outside")
    void testOutside() {
        PositionRange r = range("/body/div/p[2].0", "/body/div/p[4].0");

        assertEquals(EContainment.OUTSIDE, r.locate(parser.parse("/body/div/p[1].0")));
        assertEquals(EContainment.OUTSIDE, r.locate(parser.parse("/body/div/p[4].1")));
        assertEquals(EContainment.OUTSIDE, r.locate(parser.parse("/body/DocFragment[2]/body/div/p[3].0")));
    }

    @Test
    @DisplayName("Incomparable bounds give UNKNOWN and contains() is false")
    void testUnknown() {
        PositionRange r = range("/body/div/p[1].0", "/body/div/p[2].0");
        PositionEncoding quote = parser.parse("/body/div/blockquote.0");

        assertEquals(EContainment.UNKNOWN, r.locate(quote));
        assertFalse(r.contains(quote));
    }

    @Test
    @DisplayName("Reversed bounds are rejected, unordered bounds are accepted")
    void testConstruction() {
        assertThrows(IllegalArgumentException.class, () -> range("/body/div/p[3].0", "/body/div/p[2].0"));
        assertDoesNotThrow(() -> range("/body/div/h2.0", "/body/div/p[2].0"));
    }

    @Test
    @DisplayName("A single point range contains only that point")
    void testSinglePoint() {
        PositionEncoding point = parser.parse("/body/p[4]/text().12");
        PositionRange r = PositionRange.of(point);

        assertTrue(r.contains(point));
        assertFalse(r.contains(parser.parse("/body/p[4]/text().13")));
    }
}
