package io.jtv.core.ast;

import java.util.Locale;

/**
 * Purity levels of a function, ordered as a chain {@code TOTAL ⊆ PURE ⊆ IMPURE}. Declaration order
 * is the chain order; {@link #join} picks the less pure of two levels.
 */
public enum Purity {
    /** No loops, no I/O, structurally terminating. */
    TOTAL,
    /** May loop, no I/O. */
    PURE,
    /** Unrestricted. */
    IMPURE;

    /** Returns the least pure of this level and {@code other}. */
    public Purity join(Purity other) {
        return compareTo(other) >= 0 ? this : other;
    }

    /** Returns {@code true} if a body computed at this level may carry the {@code declared} annotation. */
    public boolean satisfies(Purity declared) {
        return compareTo(declared) <= 0;
    }

    /** The surface annotation token ({@code total}, {@code pure}, {@code impure}). */
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses an annotation token. A missing annotation means impure.
     *
     * @throws IllegalArgumentException for unknown tokens
     */
    public static Purity fromKeyword(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return IMPURE;
        }
        return switch (keyword.trim().toLowerCase(Locale.ROOT)) {
            case "total" -> TOTAL;
            case "pure" -> PURE;
            case "impure" -> IMPURE;
            default -> throw new IllegalArgumentException("Unknown purity annotation: '" + keyword + "'");
        };
    }
}
