package eu.virtualparadox.readingpos.matching;

public record SessionHighlightLink(String sessionId, String highlightId) {
}
