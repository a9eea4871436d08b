package eu.virtualparadox.readingpos.document;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.*;

class EpubFragmentReaderTest {

    private static final String CONTAINER = """
            <?xml version="1.0" encoding="UTF-8"?>
            <container version="1.0" xmlns="urn:oasis:names:tc:opendocument:xmlns:container">
              <rootfiles>
                <rootfile full-path="OEBPS/content.opf" media-type="application/oebps-package+xml"/>
              </rootfiles>
            </container>
            """;

    private static final String OPF = """
            <?xml version="1.0" encoding="UTF-8"?>
            <package xmlns="http://www.idpf.org/2007/opf" version="3.0">
              <manifest>
                <item id="ch1" href="text/ch1.xhtml" media-type="application/xhtml+xml"/>
                <item id="ch2" href="text/ch%202.xhtml" media-type="application/xhtml+xml"/>
                <item id="ghost" href="text/missing.xhtml" media-type="application/xhtml+xml"/>
              </manifest>
              <spine>
                <itemref idref="ch2"/>
                <itemref idref="unknown"/>
                <itemref idref="ghost"/>
                <itemref idref="ch1"/>
              </spine>
            </package>
            """;

    private final EpubFragmentReader reader = new EpubFragmentReader();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Spine order is kept and unreadable items are skipped")
    void testSpineOrder() throws IOException {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("mimetype", "application/epub+zip");
        entries.put("META-INF/container.xml", CONTAINER);
        entries.put("OEBPS/content.opf", OPF);
        entries.put("OEBPS/text/ch1.xhtml", xhtml("<p>one</p>"));
        entries.put("OEBPS/text/ch 2.xhtml", xhtml("<div><p>two</p><p>three</p></div>"));
        Path epub = writeZip("book.epub", entries);

        List<DocumentFragment> fragments = reader.read(epub);

        assertEquals(2, fragments.size());
        assertEquals(1, fragments.get(0).index());
        assertEquals(4, fragments.get(1).index(), "skipped spine items keep their DocFragment number");
        assertEquals("OEBPS/text/ch 2.xhtml", fragments.get(0).href());
        assertEquals("OEBPS/text/ch1.xhtml", fragments.get(1).href());
        assertEquals("html", fragments.get(0).root().normalName());
        assertEquals(2, fragments.get(0).document().select("p").size());
    }

    @Test
    @DisplayName("A container without rootfile is not an EPUB")
    void testMissingRootfile() throws IOException {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("META-INF/container.xml", "<container><rootfiles/></container>");
        Path epub = writeZip("broken.epub", entries);

        assertThrows(IOException.class, () -> reader.read(epub));
    }

    @Test
    @DisplayName("A zip without container.xml is rejected")
    void testMissingContainer() throws IOException {
        Path epub = writeZip("plain.zip", Map.of("readme.txt", "hello"));

        assertThrows(IOException.class, () -> reader.read(epub));
    }

    private static String xhtml(String body) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                + "<html xmlns=\"http://www.w3.org/1999/xhtml\"><head><title>t</title></head><body>"
                + body + "</body></html>";
    }

    private Path writeZip(String name, Map<String, String> entries) throws IOException {
        Path file = tempDir.resolve(name);
        try (OutputStream os = Files.newOutputStream(file); ZipOutputStream zip = new ZipOutputStream(os)) {
            for (Map.Entry<String, String> e : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(e.getKey()));
                zip.write(e.getValue().getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        }
        return file;
    }
}
