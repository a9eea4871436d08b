package eu.virtualparadox.readingpos.position;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and prints KOReader xpoint strings.
 *
 * <h2>Grammar</h2>
 * <pre>
 *   xpoint   := [ "/body/DocFragment[" N "]" ] "/body" [ "[" N "]" ] { "/" segment } [ tail ]
 *   segment  := name [ "[" N "]" ]
 *   tail     := [ "/text()" [ "[" N "]" ] ] "." OFFSET
 * </pre>
 * <ul>
 *   <li>{@code name} starts with a letter, followed by letters, digits, {@code _} or {@code -}</li>
 *   <li>{@code N} is a positive integer, {@code OFFSET} a non-negative one; leading zeros are rejected</li>
 *   <li>{@code text()} needs an offset; an offset may follow an element directly ({@code .../img.0})</li>
 * </ul>
 *
 * <h2>Examples</h2>
 * <pre>
 *   /body/DocFragment[12]/body/div/p[88]/text().223
 *   /body/div[1]/p[5]/text()[2].42
 *   /body/DocFragment[14]/body/a
 *   /body/DocFragment[20]/body/div/p[1]/img.0
 * </pre>
 *
 * <p>{@link #serialize(PositionEncoding)} is the exact inverse of {@link #parse(String)}.
 * The parser is stateless and thread-safe.</p>
 */
@Component
public class PositionEncodingParser {

    private static final Pattern XPOINT = Pattern.compile(
            "^(?:/body/DocFragment\\[(\\d+)])?"      // group 1: fragment index
                    + "(/body(?:\\[\\d+])?(?:/[^/.\\s()]+)*)" // group 2: element path
                    + "(?:(/text\\(\\)(?:\\[(\\d+)])?)?"      // group 3: text() selector, group 4: its index
                    + "\\.(\\d+))?$");                        // group 5: offset

    private static final Pattern SEGMENT = Pattern.compile("^([a-zA-Z][a-zA-Z0-9_-]*)(?:\\[(\\d+)])?$");

    /**
     * Parses a raw xpoint.
     *
     * @param raw the xpoint string
     * @return the parsed encoding
     * @throws MalformedPositionException if {@code raw} does not follow the grammar or violates
     *                                    an index constraint
     */
    public PositionEncoding parse(final String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new MalformedPositionException(String.valueOf(raw), "does not match expected xpoint format");
        }

        final Matcher m = XPOINT.matcher(raw);
        if (!m.matches()) {
            throw new MalformedPositionException(raw, "does not match expected xpoint format");
        }

        final Integer fragmentIndex = m.group(1) == null ? null : positive(raw, m.group(1), "DocFragment index");
        final List<PathStep> path = parsePath(raw, m.group(2));

        final boolean textSelector = m.group(3) != null;
        final boolean textIndexExplicit = m.group(4) != null;
        final int textNodeIndex = textIndexExplicit ? positive(raw, m.group(4), "text node index") : 1;

        final boolean offsetPresent = m.group(5) != null;
        final int charOffset = offsetPresent ? number(raw, m.group(5), "character offset") : 0;

        return new PositionEncoding(fragmentIndex, path, textNodeIndex, charOffset,
                textSelector, textIndexExplicit, offsetPresent);
    }

    /**
     * Lenient variant of {@link #parse(String)} for ingestion paths that skip bad items.
     *
     * @param raw the xpoint string, may be {@code null}
     * @return the parsed encoding, or empty if {@code raw} is null, blank or malformed
     */
    public Optional<PositionEncoding> tryParse(final String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(parse(raw));
        } catch (MalformedPositionException e) {
            return Optional.empty();
        }
    }

    /**
     * Prints an encoding back into its xpoint form.
     *
     * @param encoding the encoding, never {@code null}
     * @return the xpoint string
     */
    public String serialize(final PositionEncoding encoding) {
        return encoding.asString();
    }

    private List<PathStep> parsePath(final String raw, final String xpath) {
        final String[] parts = xpath.substring(1).split("/");
        final List<PathStep> steps = new ArrayList<>(parts.length);
        for (final String part : parts) {
            final Matcher sm = SEGMENT.matcher(part);
            if (!sm.matches()) {
                throw new MalformedPositionException(raw, "invalid path segment '" + part + "'");
            }
            final String name = sm.group(1);
            if (sm.group(2) == null) {
                steps.add(new PathStep(name, 1, false));
            } else {
                steps.add(new PathStep(name, positive(raw, sm.group(2), "index of " + name), true));
            }
        }
        return steps;
    }

    private int positive(final String raw, final String digits, final String what) {
        final int value = number(raw, digits, what);
        if (value < 1) {
            throw new MalformedPositionException(raw, what + " must be >= 1");
        }
        return value;
    }

    private int number(final String raw, final String digits, final String what) {
        if (digits.length() > 1 && digits.charAt(0) == '0') {
            throw new MalformedPositionException(raw, what + " has leading zeros");
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new MalformedPositionException(raw, what + " is out of range");
        }
    }
}
