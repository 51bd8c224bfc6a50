package io.avery.sequence;

import java.util.Objects;

/**
 * An item paired with its zero-based position, as yielded by {@link Seqs#enumerate() enumerate}.
 *
 * @param index the position of the item
 * @param element the item
 * @param <T> the item type
 */
public record Indexed<T>(long index, T element) {
    public Indexed {
        Objects.requireNonNull(element);
    }
}
