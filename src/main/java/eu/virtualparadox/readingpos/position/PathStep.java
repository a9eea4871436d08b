package eu.virtualparadox.readingpos.position;

import java.util.Objects;

/**
 * One step of an element path, e.g. {@code p[88]}.
 * <p>{@code index} is the 1-based occurrence of {@code name} among its same-named siblings,
 * not among all siblings. {@code explicitIndex} records whether the bracket was written,
 * so {@code div} and {@code div[1]} address the same element but print differently.</p>
 */
public record PathStep(String name, int index, boolean explicitIndex) {

    public PathStep {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Path step name must not be blank");
        }
        if (index < 1) {
            throw new IllegalArgumentException("Path step index must be >= 1, was " + index + " for " + name);
        }
    }

    public static PathStep of(final String name, final int index) {
        return new PathStep(name, index, true);
    }

    /**
     * @return true if both steps address the same element under the same parent
     */
    public boolean sameElement(final PathStep other) {
        return name.equals(other.name) && index == other.index;
    }

    /**
     * @return the step with an explicit index, as used for index keys
     */
    public String canonical() {
        return name + "[" + index + "]";
    }

    /**
     * @return the step as it was written
     */
    public String asString() {
        return explicitIndex ? canonical() : name;
    }
}
