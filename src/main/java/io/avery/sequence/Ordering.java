package io.avery.sequence;

/**
 * The result of a three-way comparison.
 */
public enum Ordering {
    LESS,
    EQUAL,
    GREATER;
    
    /**
     * Returns the ordering corresponding to the sign of an {@code int} comparison result, as returned by
     * {@link java.util.Comparator#compare Comparator.compare}.
     *
     * @param comparison a comparison result
     * @return {@code LESS} if negative, {@code GREATER} if positive, else {@code EQUAL}
     */
    public static Ordering of(int comparison) {
        return comparison < 0 ? LESS : comparison > 0 ? GREATER : EQUAL;
    }
    
    /**
     * Returns the ordering with its operands swapped.
     *
     * @return {@code GREATER} for {@code LESS}, {@code LESS} for {@code GREATER}, else {@code EQUAL}
     */
    public Ordering reverse() {
        return switch (this) {
            case LESS -> GREATER;
            case GREATER -> LESS;
            case EQUAL -> EQUAL;
        };
    }
}
