package eu.virtualparadox.readingpos.document;

/**
 * Builds spine items for tests from body markup.
 */
public final class Chapters {

    private Chapters() {
    }

    public static String xhtml(String body) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                + "<html xmlns=\"http://www.w3.org/1999/xhtml\"><head></head><body>"
                + body + "</body></html>";
    }

    public static DocumentFragment chapter(int index, String body) {
        return DocumentFragment.parse(index, "ch" + index + ".xhtml", xhtml(body));
    }
}
