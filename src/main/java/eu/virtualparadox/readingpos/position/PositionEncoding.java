package eu.virtualparadox.readingpos.position;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Parsed KOReader xpoint: a structural address inside an EPUB document.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@code fragmentIndex}: 1-based spine item, {@code null} when the xpoint carried no
 *       {@code DocFragment} marker (treated as 1 for ordering)</li>
 *   <li>{@code path}: element steps starting at {@code body}, each counting same-named siblings</li>
 *   <li>{@code textNodeIndex}: 1-based text node inside the addressed element</li>
 *   <li>{@code charOffset}: 0-based offset inside that text node</li>
 * </ul>
 *
 * <p>Instances are immutable. Besides the semantic components they remember how the source
 * string was written (explicit {@code [1]} indices, a bare {@code text()} selector, an explicit
 * offset) so that {@link #asString()} reproduces the parsed text exactly.</p>
 *
 * <p>Equality is semantic: {@code /body/div/p} equals {@code /body/DocFragment[1]/body[1]/div[1]/p[1]}.</p>
 */
@Getter
public final class PositionEncoding {

    static final String FRAGMENT_PREFIX = "/body/DocFragment[";
    static final String TEXT_SELECTOR = "/text()";

    private final Integer fragmentIndex;
    private final List<PathStep> path;
    private final int textNodeIndex;
    private final int charOffset;

    private final boolean textSelector;
    private final boolean textIndexExplicit;
    private final boolean offsetPresent;

    PositionEncoding(final Integer fragmentIndex,
                     final List<PathStep> path,
                     final int textNodeIndex,
                     final int charOffset,
                     final boolean textSelector,
                     final boolean textIndexExplicit,
                     final boolean offsetPresent) {
        Objects.requireNonNull(path, "path must not be null");
        if (path.isEmpty()) {
            throw new IllegalArgumentException("path must not be empty");
        }
        if (fragmentIndex != null && fragmentIndex < 1) {
            throw new IllegalArgumentException("fragmentIndex must be >= 1, was " + fragmentIndex);
        }
        if (textNodeIndex < 1) {
            throw new IllegalArgumentException("textNodeIndex must be >= 1, was " + textNodeIndex);
        }
        if (charOffset < 0) {
            throw new IllegalArgumentException("charOffset must be >= 0, was " + charOffset);
        }

        this.fragmentIndex = fragmentIndex;
        this.path = Collections.unmodifiableList(new ArrayList<>(path));
        this.textNodeIndex = textNodeIndex;
        this.charOffset = charOffset;
        this.textSelector = textSelector;
        this.textIndexExplicit = textIndexExplicit;
        this.offsetPresent = offsetPresent;
    }

    /**
     * Builds an encoding programmatically. The written form follows KOReader's own output:
     * a {@code text()} selector and offset are emitted only when they differ from the defaults.
     */
    public static PositionEncoding of(final Integer fragmentIndex,
                                      final List<PathStep> path,
                                      final int textNodeIndex,
                                      final int charOffset) {
        final boolean nonDefault = textNodeIndex != 1 || charOffset != 0;
        return new PositionEncoding(fragmentIndex, path, textNodeIndex, charOffset,
                nonDefault, textNodeIndex != 1, nonDefault);
    }

    /**
     * @return the fragment index with the documented default of 1 applied
     */
    public int effectiveFragmentIndex() {
        return fragmentIndex == null ? 1 : fragmentIndex;
    }

    /**
     * @return the element path with an explicit index on every step, e.g. {@code /body[1]/div[1]/p[2]}
     */
    public String canonicalPath() {
        final StringBuilder sb = new StringBuilder();
        for (final PathStep step : path) {
            sb.append('/').append(step.canonical());
        }
        return sb.toString();
    }

    /**
     * @return the element path as written, e.g. {@code /body/div/p[2]}
     */
    public String xpath() {
        final StringBuilder sb = new StringBuilder();
        for (final PathStep step : path) {
            sb.append('/').append(step.asString());
        }
        return sb.toString();
    }

    /**
     * @return the key of the addressed element inside a position index
     */
    public String elementKey() {
        return elementKey(effectiveFragmentIndex(), canonicalPath());
    }

    public static String elementKey(final int fragmentIndex, final String canonicalPath) {
        return fragmentIndex + ":" + canonicalPath;
    }

    /**
     * @return the xpoint string this encoding was parsed from
     */
    public String asString() {
        final StringBuilder sb = new StringBuilder();
        if (fragmentIndex != null) {
            sb.append(FRAGMENT_PREFIX).append(fragmentIndex).append(']');
        }
        sb.append(xpath());
        if (textSelector) {
            sb.append(TEXT_SELECTOR);
            if (textIndexExplicit) {
                sb.append('[').append(textNodeIndex).append(']');
            }
        }
        if (offsetPresent) {
            sb.append('.').append(charOffset);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final PositionEncoding that = (PositionEncoding) o;
        return effectiveFragmentIndex() == that.effectiveFragmentIndex()
                && textNodeIndex == that.textNodeIndex
                && charOffset == that.charOffset
                && canonicalPath().equals(that.canonicalPath());
    }

    @Override
    public int hashCode() {
        return Objects.hash(effectiveFragmentIndex(), canonicalPath(), textNodeIndex, charOffset);
    }

    @Override
    public String toString() {
        return asString();
    }
}
