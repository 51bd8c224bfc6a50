package io.avery.sequence;

import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.BinaryOperator;
import java.util.function.Consumer;
import java.util.function.IntFunction;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collector;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, pull-based sequences and the operators that connect them.
 *
 * <ul>
 *     <li>{@link Sequence Sequence} - yields items one at a time, on demand
 *     <li>{@link PeekableSequence PeekableSequence} - a sequence that can look at its next item without consuming it
 *     <li>{@link Operator Operator} - creates a downstream sequence from an upstream sequence
 *     <li>{@link PartialComparator PartialComparator} - a three-way comparison that may be undefined
 * </ul>
 *
 * <p>Implementations of producers and operators are provided by {@link Seqs}.
 */
public class Seq {
    private Seq() {}
    
    // Floating-point items compare by primitive value: -0.0 equals 0.0, and NaN equals nothing
    private static boolean isFloating(Object o) {
        return o instanceof Double || o instanceof Float;
    }
    
    private static boolean itemsEqual(Object a, Object b) {
        if (isFloating(a) && isFloating(b)) {
            return ((Number) a).doubleValue() == ((Number) b).doubleValue();
        }
        return a.equals(b);
    }
    
    private static Optional<Ordering> compareFloating(double a, double b) {
        if (a < b) {
            return Optional.of(Ordering.LESS);
        }
        if (a > b) {
            return Optional.of(Ordering.GREATER);
        }
        return a == b ? Optional.of(Ordering.EQUAL) : Optional.empty();
    }
    
    /**
     * A stateful, single-pass source of items. Nothing is computed until {@link #next next} is called, and each call
     * computes at most what is needed to yield one item.
     *
     * <p>A sequence is either a producer, which owns or borrows its data, or an adaptor, which exclusively owns one or
     * two upstream sequences. An upstream sequence should not be advanced by anything other than the adaptor that owns
     * it, once the adaptor is constructed.
     *
     * <p>Items are never {@code null}; {@code null} is reserved to signal exhaustion.
     *
     * <p>This is a functional interface whose functional method is {@link #next()}.
     *
     * @param <T> the item type
     */
    @FunctionalInterface
    public interface Sequence<T> {
        /**
         * Advances this sequence and returns the next item. Returns {@code null} if this sequence is exhausted.
         *
         * @implSpec Once this method returns {@code null}, subsequent calls must also return {@code null}, to indicate
         * the sequence is permanently exhausted. Calling this method after exhaustion must not throw.
         *
         * @return the next item from this sequence, or {@code null} if this sequence is exhausted
         */
        T next();
        
        /**
         * Returns {@code true} if this sequence supports {@link #copy copy}.
         *
         * @implSpec An adaptor should return {@code true} only if every upstream sequence it owns is copyable.
         *
         * @implNote The default implementation returns {@code false}.
         *
         * @return {@code true} if this sequence can be copied
         */
        default boolean isCopyable() {
            return false;
        }
        
        /**
         * Returns an independent sequence that starts in the current state of this sequence. Advancing either sequence
         * afterward does not affect the other. Callbacks captured by this sequence are shared with the copy, and so are
         * expected to be stateless.
         *
         * @implNote The default implementation throws {@link UnsupportedOperationException}.
         *
         * @return a copy of this sequence
         * @throws UnsupportedOperationException if this sequence is not {@link #isCopyable copyable}
         */
        default Sequence<T> copy() {
            throw new UnsupportedOperationException(getClass().getName() + " is not copyable");
        }
        
        /**
         * Connects the {@code downstream} operator after this sequence. Returns a downstream sequence obtained by
         * applying the {@code downstream} operator to this sequence. This sequence is owned by the result, and should
         * not be advanced directly afterward.
         *
         * @param downstream a function that creates a downstream sequence from an upstream sequence
         * @return a downstream sequence obtained by applying the {@code downstream} operator to this sequence
         * @param <U> the downstream item type
         * @throws NullPointerException if downstream is null
         */
        @SuppressWarnings("unchecked")
        default <U> Sequence<U> andThen(Operator<? super T, ? extends U> downstream) {
            return (Sequence<U>) downstream.compose(this);
        }
        
        // --- Full consumers ---
        
        /**
         * Performs the given action for each remaining item of this sequence.
         *
         * @param action the action to be performed for each item
         */
        default void forEach(Consumer<? super T> action) {
            Objects.requireNonNull(action);
            for (T t; (t = next()) != null; ) {
                action.accept(t);
            }
        }
        
        /**
         * Performs a mutable reduction operation on the remaining items of this sequence using a {@code Collector}.
         *
         * @see Stream#collect(Collector)
         *
         * @param collector the {@code Collector} describing the reduction
         * @return the result of the reduction
         * @param <A> the intermediate accumulation type of the {@code Collector}
         * @param <R> the type of the result
         */
        default <A, R> R collect(Collector<? super T, A, R> collector) {
            var accumulator = collector.accumulator();
            A acc = collector.supplier().get();
            for (T t; (t = next()) != null; ) {
                accumulator.accept(acc, t);
            }
            return collector.finisher().apply(acc);
        }
        
        /**
         * Adds the remaining items of this sequence, in order, to a collection obtained from the given supplier.
         *
         * @param collectionFactory supplies the collection to add to
         * @return the collection
         * @param <C> the collection type
         */
        default <C extends Collection<? super T>> C collect(Supplier<? extends C> collectionFactory) {
            C collection = collectionFactory.get();
            forEach(collection::add);
            return collection;
        }
        
        /**
         * Adds the remaining items of this sequence, in order, to a collection created by the given factory with the
         * given initial capacity, e.g. {@code ArrayList::new}.
         *
         * @param collectionFactory creates the collection, given a size hint
         * @param sizeHint the expected number of items
         * @return the collection
         * @param <C> the collection type
         */
        default <C extends Collection<? super T>> C collect(IntFunction<? extends C> collectionFactory, int sizeHint) {
            C collection = collectionFactory.apply(Math.max(0, sizeHint));
            forEach(collection::add);
            return collection;
        }
        
        /**
         * Splits the remaining items of this sequence into two collections. The first collection receives the items
         * that match the predicate, and the second receives the rest. Relative order is preserved in both.
         *
         * @param collectionFactory supplies each of the two collections
         * @param predicate the predicate used to split items
         * @return a pair of the matching and non-matching collections
         * @param <C> the collection type
         */
        default <C extends Collection<? super T>> Pair<C, C> partition(Supplier<? extends C> collectionFactory,
                                                                       Predicate<? super T> predicate) {
            Objects.requireNonNull(predicate);
            C matching = collectionFactory.get();
            C rest = collectionFactory.get();
            for (T t; (t = next()) != null; ) {
                (predicate.test(t) ? matching : rest).add(t);
            }
            return new Pair<>(matching, rest);
        }
        
        /**
         * Consumes this sequence and returns the number of items it yielded.
         *
         * @return the number of remaining items
         */
        default long count() {
            long count = 0;
            while (next() != null) {
                count++;
            }
            return count;
        }
        
        /**
         * Consumes this sequence and returns its last item, or an empty {@code Optional} if there were none.
         *
         * @return the last item
         */
        default Optional<T> last() {
            T last = null;
            for (T t; (t = next()) != null; ) {
                last = t;
            }
            return Optional.ofNullable(last);
        }
        
        /**
         * Adds all remaining items together, starting from the {@link Arithmetic#zero() zero} of the given
         * arithmetic. Returns zero for an empty sequence.
         *
         * @param arithmetic the arithmetic of the item type
         * @return the sum
         */
        default T sum(Arithmetic<T> arithmetic) {
            return fold(arithmetic.zero(), arithmetic::add);
        }
        
        /**
         * Multiplies all remaining items together, starting from the {@link Arithmetic#one() one} of the given
         * arithmetic. Returns one for an empty sequence.
         *
         * @param arithmetic the arithmetic of the item type
         * @return the product
         */
        default T product(Arithmetic<T> arithmetic) {
            return fold(arithmetic.one(), arithmetic::multiply);
        }
        
        /**
         * Reduces the remaining items into an accumulator, starting from the given seed. Each call to the
         * {@code folder} receives the previous accumulator and the current item, and returns the next accumulator.
         * Returns the seed for an empty sequence.
         *
         * @param seed the initial accumulator
         * @param folder combines the accumulator with an item
         * @return the final accumulator
         * @param <A> the accumulator type
         */
        default <A> A fold(A seed, BiFunction<? super A, ? super T, ? extends A> folder) {
            Objects.requireNonNull(folder);
            A acc = seed;
            for (T t; (t = next()) != null; ) {
                acc = folder.apply(acc, t);
            }
            return acc;
        }
        
        /**
         * Reduces the remaining items using the first item as the seed. Returns an empty {@code Optional} for an empty
         * sequence.
         *
         * @param reducer combines the accumulator with an item
         * @return the reduced value
         */
        default Optional<T> reduce(BinaryOperator<T> reducer) {
            Objects.requireNonNull(reducer);
            T first = next();
            if (first == null) {
                return Optional.empty();
            }
            return Optional.of(fold(first, reducer));
        }
        
        // --- Short-circuiting consumers ---
        
        /**
         * Returns {@code true} if the predicate holds for every remaining item. Stops at the first item for which it
         * does not hold. Returns {@code true} for an empty sequence.
         *
         * @param predicate the predicate
         * @return {@code true} if no item fails the predicate
         */
        default boolean all(Predicate<? super T> predicate) {
            Objects.requireNonNull(predicate);
            for (T t; (t = next()) != null; ) {
                if (!predicate.test(t)) {
                    return false;
                }
            }
            return true;
        }
        
        /**
         * Returns {@code true} if the predicate holds for any remaining item. Stops at the first item for which it
         * holds. Returns {@code false} for an empty sequence.
         *
         * @param predicate the predicate
         * @return {@code true} if some item passes the predicate
         */
        default boolean any(Predicate<? super T> predicate) {
            Objects.requireNonNull(predicate);
            for (T t; (t = next()) != null; ) {
                if (predicate.test(t)) {
                    return true;
                }
            }
            return false;
        }
        
        /**
         * Returns the first remaining item for which the predicate holds, consuming items up to and including it.
         *
         * @param predicate the predicate
         * @return the first matching item, or an empty {@code Optional} if there is none
         */
        default Optional<T> find(Predicate<? super T> predicate) {
            Objects.requireNonNull(predicate);
            for (T t; (t = next()) != null; ) {
                if (predicate.test(t)) {
                    return Optional.of(t);
                }
            }
            return Optional.empty();
        }
        
        /**
         * Returns the zero-based index, among the remaining items, of the first item for which the predicate holds.
         *
         * @param predicate the predicate
         * @return the index of the first matching item, or an empty {@code OptionalLong} if there is none
         */
        default OptionalLong position(Predicate<? super T> predicate) {
            Objects.requireNonNull(predicate);
            long index = 0;
            for (T t; (t = next()) != null; index++) {
                if (predicate.test(t)) {
                    return OptionalLong.of(index);
                }
            }
            return OptionalLong.empty();
        }
        
        /**
         * Returns the item at the given zero-based index among the remaining items, consuming {@code index + 1}
         * items. Returns an empty {@code Optional}, without consuming anything, if the index is negative.
         *
         * @param index the index of the item
         * @return the item, or an empty {@code Optional} if the sequence is too short
         */
        default Optional<T> nth(long index) {
            if (index < 0) {
                return Optional.empty();
            }
            long i = 0;
            for (T t; (t = next()) != null; i++) {
                if (i == index) {
                    return Optional.of(t);
                }
            }
            return Optional.empty();
        }
        
        // --- Extremum consumers ---
        
        /**
         * Returns the least remaining item according to the comparator. If several items are least, the first one is
         * returned.
         *
         * @param comparator the comparator
         * @return the least item, or an empty {@code Optional} for an empty sequence
         */
        default Optional<T> minBy(Comparator<? super T> comparator) {
            Objects.requireNonNull(comparator);
            T min = next();
            if (min == null) {
                return Optional.empty();
            }
            for (T t; (t = next()) != null; ) {
                if (comparator.compare(t, min) < 0) {
                    min = t;
                }
            }
            return Optional.of(min);
        }
        
        /**
         * Returns the greatest remaining item according to the comparator. If several items are greatest, the first
         * one is returned.
         *
         * @param comparator the comparator
         * @return the greatest item, or an empty {@code Optional} for an empty sequence
         */
        default Optional<T> maxBy(Comparator<? super T> comparator) {
            Objects.requireNonNull(comparator);
            T max = next();
            if (max == null) {
                return Optional.empty();
            }
            for (T t; (t = next()) != null; ) {
                if (comparator.compare(t, max) > 0) {
                    max = t;
                }
            }
            return Optional.of(max);
        }
        
        // --- Ordering checks ---
        
        /**
         * Returns {@code true} if no remaining item compares greater than the item before it. Stops at the first
         * out-of-order pair. Sequences of fewer than two items are sorted.
         *
         * @param comparator the comparator
         * @return {@code true} if the remaining items are sorted
         */
        default boolean isSortedBy(Comparator<? super T> comparator) {
            Objects.requireNonNull(comparator);
            T prev = next();
            if (prev == null) {
                return true;
            }
            for (T t; (t = next()) != null; prev = t) {
                if (comparator.compare(prev, t) > 0) {
                    return false;
                }
            }
            return true;
        }
        
        // --- Cross-sequence comparisons ---
        
        /**
         * Lexicographically compares the remaining items of this sequence with those of the {@code other} sequence,
         * advancing both in lockstep. The first unequal or incomparable pair decides the result. If one sequence is
         * exhausted first, it is less; if both are exhausted together, they are equal.
         *
         * @param other the other sequence
         * @param comparator compares a pair of items, possibly finding them incomparable
         * @return the ordering of this sequence relative to the other, or an empty {@code Optional} if an incomparable
         * pair was reached first
         */
        default Optional<Ordering> partialCmpBy(Sequence<? extends T> other,
                                                PartialComparator<? super T> comparator) {
            Objects.requireNonNull(other);
            Objects.requireNonNull(comparator);
            for (;;) {
                T a = next();
                T b = other.next();
                if (a == null) {
                    return Optional.of(b == null ? Ordering.EQUAL : Ordering.LESS);
                }
                if (b == null) {
                    return Optional.of(Ordering.GREATER);
                }
                Optional<Ordering> compared = comparator.compare(a, b);
                if (compared.isEmpty() || compared.get() != Ordering.EQUAL) {
                    return compared;
                }
            }
        }
        
        /**
         * Lexicographically compares the remaining items of this sequence with those of the {@code other} sequence,
         * with a total order over items.
         *
         * @see #partialCmpBy(Sequence, PartialComparator)
         *
         * @param other the other sequence
         * @param comparator the comparator
         * @return the ordering of this sequence relative to the other
         */
        default Ordering cmpBy(Sequence<? extends T> other, Comparator<? super T> comparator) {
            return partialCmpBy(other, PartialComparator.of(comparator)).orElseThrow();
        }
        
        /**
         * Returns {@code true} if this sequence and the {@code other} sequence have the same number of remaining
         * items, and each pair of items satisfies the given equality. Stops at the first unequal pair.
         *
         * @param other the other sequence
         * @param equality the item equality
         * @return {@code true} if the sequences are equal
         * @param <U> the other sequence's item type
         */
        default <U> boolean eqBy(Sequence<? extends U> other, BiPredicate<? super T, ? super U> equality) {
            Objects.requireNonNull(other);
            Objects.requireNonNull(equality);
            for (;;) {
                T a = next();
                U b = other.next();
                if (a == null) {
                    return b == null;
                }
                if (b == null || !equality.test(a, b)) {
                    return false;
                }
            }
        }
        
        /**
         * Returns {@code true} if this sequence and the {@code other} sequence have the same number of remaining
         * items, and each pair of items is {@link Object#equals equal}. Floating-point items are compared by primitive
         * value instead, so {@code -0.0} equals {@code 0.0} and {@code NaN} equals nothing.
         *
         * @param other the other sequence
         * @return {@code true} if the sequences are equal
         */
        default boolean eq(Sequence<?> other) {
            return eqBy(other, Seq::itemsEqual);
        }
        
        /**
         * Returns {@code true} if the sequences differ in length or in any pair of items.
         *
         * @param other the other sequence
         * @return {@code true} if the sequences are not equal
         */
        default boolean ne(Sequence<?> other) {
            return !eq(other);
        }
        
        // --- Host iteration ---
        
        /**
         * Returns an {@code Iterator} over the remaining items of this sequence. The iterator advances this sequence
         * at most one item ahead of what it has returned, to answer {@link Iterator#hasNext hasNext}.
         *
         * @return an iterator over the remaining items
         */
        default Iterator<T> iterator() {
            var source = this;
            
            class SequenceIterator implements Iterator<T> {
                T nextItem = null;
                boolean resolved = false;
                
                @Override
                public boolean hasNext() {
                    if (!resolved) {
                        nextItem = source.next();
                        resolved = true;
                    }
                    return nextItem != null;
                }
                
                @Override
                public T next() {
                    if (!hasNext()) {
                        throw new NoSuchElementException();
                    }
                    T t = nextItem;
                    nextItem = null;
                    resolved = false;
                    return t;
                }
            }
            
            return new SequenceIterator();
        }
        
        /**
         * Returns a sequential, ordered {@code Stream} over the remaining items of this sequence.
         *
         * @return a stream over the remaining items
         */
        default Stream<T> stream() {
            return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL),
                false
            );
        }
    }
    
    /**
     * A {@link Sequence Sequence} that can return its next item without consuming it.
     *
     * @param <T> the item type
     */
    public interface PeekableSequence<T> extends Sequence<T> {
        /**
         * Returns the next item without consuming it, or {@code null} if this sequence is exhausted. Repeated calls
         * without an intervening {@link #next next} return the same result, and do not advance the upstream sequence
         * more than once.
         *
         * @return the next item, or {@code null} if this sequence is exhausted
         */
        T peek();
        
        @Override
        PeekableSequence<T> copy();
    }
    
    /**
     * Represents an operation on an upstream {@link Sequence Sequence} that produces a downstream {@code Sequence}.
     *
     * <p>This is a functional interface whose functional method is {@link #compose(Sequence)}.
     *
     * @param <T> the upstream item type
     * @param <U> the downstream item type
     */
    @FunctionalInterface
    public interface Operator<T, U> {
        /**
         * Connects the {@code upstream} sequence before this operator. Returns a downstream sequence that owns the
         * upstream sequence.
         *
         * @implSpec Any validation of the upstream sequence should happen here, before any item is pulled.
         *
         * @param upstream the upstream sequence
         * @return the downstream sequence
         */
        Sequence<U> compose(Sequence<? extends T> upstream);
        
        /**
         * Connects the {@code upstream} operator before this operator. Returns a composed operator that applies this
         * operator to the result of the {@code upstream} operator.
         *
         * @param upstream the upstream operator
         * @return a composed operator that applies this operator to the result of the {@code upstream} operator
         * @param <V> the upstream item type
         * @throws NullPointerException if upstream is null
         */
        default <V> Operator<V, U> compose(Operator<? super V, ? extends T> upstream) {
            Objects.requireNonNull(upstream);
            return sequence -> compose(upstream.compose(sequence));
        }
        
        /**
         * Connects the {@code downstream} operator after this operator. Returns a composed operator that applies the
         * {@code downstream} operator to the result of this operator.
         *
         * @param downstream the downstream operator
         * @return a composed operator that applies the {@code downstream} operator to the result of this operator
         * @param <V> the downstream item type
         * @throws NullPointerException if downstream is null
         */
        @SuppressWarnings("unchecked")
        default <V> Operator<T, V> andThen(Operator<? super U, ? extends V> downstream) {
            Objects.requireNonNull(downstream);
            return sequence -> (Sequence<V>) downstream.compose(compose(sequence));
        }
    }
    
    /**
     * A three-way comparison that may find two items incomparable.
     *
     * <p>This is a functional interface whose functional method is {@link #compare(Object, Object)}.
     *
     * @param <T> the item type
     */
    @FunctionalInterface
    public interface PartialComparator<T> {
        /**
         * Compares two items.
         *
         * @param a the first item
         * @param b the second item
         * @return the ordering of {@code a} relative to {@code b}, or an empty {@code Optional} if they are
         * incomparable
         */
        Optional<Ordering> compare(T a, T b);
        
        /**
         * Returns a partial comparator that never finds items incomparable, deferring to the given comparator.
         *
         * @param comparator the total comparator
         * @return a partial comparator
         * @param <T> the item type
         */
        static <T> PartialComparator<T> of(Comparator<? super T> comparator) {
            Objects.requireNonNull(comparator);
            return (a, b) -> Optional.of(Ordering.of(comparator.compare(a, b)));
        }
        
        /**
         * Returns a partial comparator over the natural order. Floating-point items are compared by primitive value
         * instead: {@code -0.0} is equal to {@code 0.0}, and {@code NaN} is incomparable to everything, itself
         * included.
         *
         * @return a partial comparator over the natural order
         * @param <T> the item type
         */
        static <T extends Comparable<? super T>> PartialComparator<T> natural() {
            return (a, b) -> isFloating(a) && isFloating(b)
                ? compareFloating(((Number) a).doubleValue(), ((Number) b).doubleValue())
                : Optional.of(Ordering.of(a.compareTo(b)));
        }
    }
}
