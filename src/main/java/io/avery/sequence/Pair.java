package io.avery.sequence;

import java.util.Objects;

/**
 * Two non-null values, such as the items yielded together by {@link Seqs#zip(Seq.Sequence, Seq.Sequence) zip}.
 *
 * @param first the first value
 * @param second the second value
 * @param <A> the first value type
 * @param <B> the second value type
 */
public record Pair<A, B>(A first, B second) {
    public Pair {
        Objects.requireNonNull(first);
        Objects.requireNonNull(second);
    }
}
