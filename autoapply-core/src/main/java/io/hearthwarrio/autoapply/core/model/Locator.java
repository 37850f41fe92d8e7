package io.hearthwarrio.autoapply.core.model;

import java.util.Objects;

/**
 * XPath pair that re-identifies one DOM node: a relative expression plus an absolute fallback.
 * <p>
 * Valid only while it matches exactly one live element; never kept beyond one page generation.
 */
public final class Locator {

    private final String relative;
    private final String absolute;

    private Locator(String relative, String absolute) {
        if (isBlank(relative) && isBlank(absolute)) {
            throw new IllegalArgumentException("locator needs a relative or an absolute expression");
        }
        this.relative = isBlank(relative) ? null : relative;
        this.absolute = isBlank(absolute) ? null : absolute;
    }

    public static Locator of(String relative, String absolute) {
        return new Locator(relative, absolute);
    }

    /**
     * Wraps a single expression, sorting it into the relative or absolute slot.
     */
    public static Locator of(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        return expression.startsWith("/html") ? new Locator(null, expression) : new Locator(expression, null);
    }

    /**
     * @return the preferred expression: relative when present, otherwise absolute
     */
    public String expression() {
        return relative != null ? relative : absolute;
    }

    public String relative() {
        return relative;
    }

    public String absolute() {
        return absolute;
    }

    /**
     * Stable identity used by visited sets.
     */
    public String fingerprint() {
        return expression();
    }

    public boolean sameTarget(Locator other) {
        if (other == null) {
            return false;
        }
        return (relative != null && relative.equals(other.relative))
                || (absolute != null && absolute.equals(other.absolute));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Locator other)) {
            return false;
        }
        return Objects.equals(relative, other.relative) && Objects.equals(absolute, other.absolute);
    }

    @Override
    public int hashCode() {
        return Objects.hash(relative, absolute);
    }

    @Override
    public String toString() {
        return expression();
    }
}
