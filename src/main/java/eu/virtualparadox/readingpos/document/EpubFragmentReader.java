package eu.virtualparadox.readingpos.document;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Reads the spine of an EPUB file into ordered {@link DocumentFragment}s.
 *
 * <ol>
 *   <li>{@code META-INF/container.xml} names the package document (OPF).</li>
 *   <li>The OPF manifest maps item ids to hrefs; the spine lists item ids in reading order.</li>
 *   <li>Every spine item is parsed with jsoup's XML parser. Spine references to missing manifest
 *       items or missing zip entries are skipped but keep their fragment number, so later items
 *       stay addressable as {@code DocFragment[N]} with their spine position.</li>
 * </ol>
 */
@Slf4j
@Component
public class EpubFragmentReader {

    private static final String CONTAINER_XML = "META-INF/container.xml";

    /**
     * @param epub path to the {@code .epub} file
     * @return spine fragments in reading order
     * @throws IOException if the file cannot be read or is not a valid EPUB container
     */
    public List<DocumentFragment> read(final Path epub) throws IOException {
        try (ZipFile zip = new ZipFile(epub.toFile())) {
            final String opfPath = findOpfPath(zip);
            final Document opf = parseXml(zip, opfPath);
            final String opfDir = dirOf(opfPath);

            final Map<String, String> hrefById = new HashMap<>();
            for (final Element item : elementsByLocalName(opf, "item")) {
                final String id = item.attr("id").trim();
                final String href = item.attr("href").trim();
                if (!id.isEmpty() && !href.isEmpty()) {
                    hrefById.put(id, href);
                }
            }

            final List<DocumentFragment> fragments = new ArrayList<>();
            int spineIndex = 0;
            for (final Element itemref : elementsByLocalName(opf, "itemref")) {
                spineIndex++;
                final String idref = itemref.attr("idref").trim();
                final String href = hrefById.get(idref);
                if (href == null) {
                    log.warn("Spine item {} has no manifest entry in {}", idref, epub);
                    continue;
                }

                final String entryName = normalizeZipPath(opfDir + decode(stripFragment(href)));
                final ZipEntry entry = zip.getEntry(entryName);
                if (entry == null) {
                    log.warn("Spine item {} points to missing entry {} in {}", idref, entryName, epub);
                    continue;
                }

                try (InputStream is = zip.getInputStream(entry)) {
                    final String html = new String(is.readAllBytes(), StandardCharsets.UTF_8);
                    fragments.add(DocumentFragment.parse(spineIndex, entryName, html));
                }
            }

            log.info("Read {} spine fragments from {}", fragments.size(), epub);
            return fragments;
        }
    }

    private String findOpfPath(final ZipFile zip) throws IOException {
        final Document container = parseXml(zip, CONTAINER_XML);
        for (final Element rootfile : elementsByLocalName(container, "rootfile")) {
            final String fullPath = rootfile.attr("full-path").trim();
            if (!fullPath.isEmpty()) {
                return fullPath;
            }
        }
        throw new IOException("No rootfile declared in " + CONTAINER_XML);
    }

    private Document parseXml(final ZipFile zip, final String name) throws IOException {
        final ZipEntry entry = zip.getEntry(name);
        if (entry == null) {
            throw new IOException("Missing EPUB entry: " + name);
        }
        try (InputStream is = zip.getInputStream(entry)) {
            return Jsoup.parse(is, StandardCharsets.UTF_8.name(), "", Parser.xmlParser());
        }
    }

    private static List<Element> elementsByLocalName(final Document doc, final String localName) {
        final List<Element> out = new ArrayList<>();
        for (final Element e : doc.getAllElements()) {
            if (localName.equalsIgnoreCase(localName(e.tagName()))) {
                out.add(e);
            }
        }
        return out;
    }

    private static String localName(final String tagName) {
        final int colon = tagName.indexOf(':');
        return colon >= 0 ? tagName.substring(colon + 1) : tagName;
    }

    private static String stripFragment(final String href) {
        final int hash = href.indexOf('#');
        return hash >= 0 ? href.substring(0, hash) : href;
    }

    private static String decode(final String href) {
        return URLDecoder.decode(href.replace("+", "%2B"), StandardCharsets.UTF_8);
    }

    private static String normalizeZipPath(final String path) {
        final ArrayDeque<String> stack = new ArrayDeque<>();
        for (final String p : path.replace('\\', '/').split("/")) {
            if (p.isEmpty() || ".".equals(p)) continue;
            if ("..".equals(p)) {
                if (!stack.isEmpty()) stack.removeLast();
                continue;
            }
            stack.addLast(p);
        }
        return String.join("/", stack);
    }

    private static String dirOf(final String path) {
        final int idx = path.lastIndexOf('/');
        return idx < 0 ? "" : path.substring(0, idx + 1);
    }
}
