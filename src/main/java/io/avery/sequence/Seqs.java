package io.avery.sequence;

import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Implementations of various useful {@link Seq.Sequence Sequences} and {@link Seq.Operator Operators}.
 *
 * <p>In addition to any documented contracts, implementations here are strictly lazy - no upstream item is pulled
 * until a downstream item is requested, and no more upstream items are pulled than are needed to produce it.
 * {@link #peekable(Seq.Sequence) peekable} is the exception, holding up to one item of lookahead.
 */
public class Seqs {
    private Seqs() {} // Utility
    
    // --- Producers ---
    
    /**
     * Returns a sequence that yields the items of the given collection, in iteration order. If the collection yields
     * a {@code null} item, the sequence will throw a {@link NullPointerException}.
     *
     * <p>The collection is borrowed, not copied. It should not be modified while the sequence is in use.
     *
     * <p>The returned sequence is copyable. A copy re-iterates the collection up to the position of the original.
     *
     * @param collection the collection to yield from
     * @return a sequence that yields the items of the collection
     * @param <T> the item type
     */
    public static <T> Seq.Sequence<T> fromCollection(Collection<? extends T> collection) {
        Objects.requireNonNull(collection);
        
        class CollectionSource implements Seq.Sequence<T> {
            final Iterator<? extends T> iterator;
            long position;
            
            CollectionSource(long position) {
                this.iterator = collection.iterator();
                this.position = position;
                for (long i = 0; i < position && iterator.hasNext(); i++) {
                    iterator.next();
                }
            }
            
            @Override
            public T next() {
                if (!iterator.hasNext()) {
                    return null;
                }
                position++;
                return Objects.requireNonNull(iterator.next());
            }
            
            @Override
            public boolean isCopyable() {
                return true;
            }
            
            @Override
            public Seq.Sequence<T> copy() {
                return new CollectionSource(position);
            }
        }
        
        return new CollectionSource(0);
    }
    
    /**
     * Returns a sequence that yields the items of the given list between a pair of cursors. The start cursor moves
     * toward the end cursor as items are yielded, and the sequence is exhausted when the two meet.
     *
     * <p>The list is borrowed, not copied. The returned sequence is copyable.
     *
     * @param list the list to yield from
     * @param start the index of the first item, inclusive
     * @param end the index after the last item, exclusive
     * @return a sequence that yields the items of the list from {@code start} to {@code end}
     * @param <T> the item type
     * @throws IndexOutOfBoundsException if the cursors are out of the list's bounds, or {@code start > end}
     */
    public static <T> Seq.Sequence<T> fromCursorPair(List<? extends T> list, int start, int end) {
        Objects.requireNonNull(list);
        Objects.checkFromToIndex(start, end, list.size());
        
        class CursorPair implements Seq.Sequence<T> {
            int cursor;
            
            CursorPair(int cursor) {
                this.cursor = cursor;
            }
            
            @Override
            public T next() {
                if (cursor == end) {
                    return null;
                }
                return Objects.requireNonNull(list.get(cursor++));
            }
            
            @Override
            public boolean isCopyable() {
                return true;
            }
            
            @Override
            public Seq.Sequence<T> copy() {
                return new CursorPair(cursor);
            }
        }
        
        return new CursorPair(start);
    }
    
    /**
     * Returns a sequence that yields the given items, in order. The array is borrowed, not copied.
     *
     * @param items the items to yield
     * @return a sequence that yields the given items
     * @param <T> the item type
     */
    @SafeVarargs
    public static <T> Seq.Sequence<T> fromArray(T... items) {
        return fromCursorPair(Arrays.asList(items), 0, items.length);
    }
    
    /**
     * Returns a sequence that yields the items from the given {@code iterator}. Each time the sequence is advanced, it
     * will advance the iterator, until the iterator is depleted. If the iterator ever yields {@code null}, the sequence
     * will throw a {@link NullPointerException}.
     *
     * <p>The returned sequence is not copyable, since the iterator cannot be restarted.
     *
     * @param iterator the iterator to yield from
     * @return a sequence that yields the items from the given {@code iterator}
     * @param <T> the item type
     */
    public static <T> Seq.Sequence<T> fromIterator(Iterator<? extends T> iterator) {
        Objects.requireNonNull(iterator);
        
        class IteratorSource implements Seq.Sequence<T> {
            boolean done = false;
            
            @Override
            public T next() {
                if (done || !iterator.hasNext()) {
                    done = true;
                    return null;
                }
                return Objects.requireNonNull(iterator.next());
            }
        }
        
        return new IteratorSource();
    }
    
    /**
     * Returns a sequence that yields {@code min}, then each following value incremented by one, while the value is
     * less than {@code maxExclusive}.
     *
     * @param min the first value
     * @param maxExclusive the exclusive upper bound
     * @return a range sequence
     */
    public static Seq.Sequence<Integer> range(int min, int maxExclusive) {
        return range(min, maxExclusive, 1);
    }
    
    /**
     * Returns a sequence that yields {@code min}, then each following value incremented by {@code step}, while the
     * value is less than {@code maxExclusive}.
     *
     * <p>A step that is zero or negative never moves the value past the bound, so the sequence does not end unless the
     * range was empty to begin with. Such a sequence should be bounded downstream, e.g. by {@link #take(long) take}.
     *
     * @param min the first value
     * @param maxExclusive the exclusive upper bound
     * @param step the increment
     * @return a range sequence
     */
    public static Seq.Sequence<Integer> range(int min, int maxExclusive, int step) {
        return range(min, maxExclusive, step, Arithmetic.INTEGER);
    }
    
    /**
     * Returns a sequence that yields {@code min}, then each following value incremented by {@code step}, while the
     * value is less than {@code maxExclusive}.
     *
     * @see #range(int, int, int)
     *
     * @param min the first value
     * @param maxExclusive the exclusive upper bound
     * @param step the increment
     * @return a range sequence
     */
    public static Seq.Sequence<Long> range(long min, long maxExclusive, long step) {
        return range(min, maxExclusive, step, Arithmetic.LONG);
    }
    
    /**
     * Returns a sequence that yields {@code min}, then each following value incremented by {@code step}, while the
     * value is less than {@code maxExclusive}.
     *
     * <p>If the step is smaller than the precision of the current value, adding it leaves the value unchanged, and the
     * sequence repeats that value without end.
     *
     * @see #range(int, int, int)
     *
     * @param min the first value
     * @param maxExclusive the exclusive upper bound
     * @param step the increment
     * @return a range sequence
     */
    public static Seq.Sequence<Double> range(double min, double maxExclusive, double step) {
        return range(min, maxExclusive, step, Arithmetic.DOUBLE);
    }
    
    /**
     * Returns a sequence that yields {@code min}, then each following value incremented by {@code step}, while the
     * value is less than {@code maxExclusive}, as determined by the given arithmetic. If adding the step overflows, the
     * sequence ends after the last value that did not overflow.
     *
     * @see #range(int, int, int)
     *
     * @param min the first value
     * @param maxExclusive the exclusive upper bound
     * @param step the increment
     * @param arithmetic the arithmetic of the value type
     * @return a range sequence
     * @param <T> the value type
     */
    public static <T> Seq.Sequence<T> range(T min, T maxExclusive, T step, Arithmetic<T> arithmetic) {
        return new Range<>(min, maxExclusive, step, arithmetic, false);
    }
    
    /**
     * Returns a sequence that yields {@code min}, then each following value incremented by one, while the value is
     * less than or equal to {@code maxInclusive}.
     *
     * @param min the first value
     * @param maxInclusive the inclusive upper bound
     * @return a range sequence
     */
    public static Seq.Sequence<Integer> rangeInclusive(int min, int maxInclusive) {
        return rangeInclusive(min, maxInclusive, 1);
    }
    
    /**
     * Returns a sequence that yields {@code min}, then each following value incremented by {@code step}, while the
     * value is less than or equal to {@code maxInclusive}.
     *
     * @see #range(int, int, int)
     *
     * @param min the first value
     * @param maxInclusive the inclusive upper bound
     * @param step the increment
     * @return a range sequence
     */
    public static Seq.Sequence<Integer> rangeInclusive(int min, int maxInclusive, int step) {
        return rangeInclusive(min, maxInclusive, step, Arithmetic.INTEGER);
    }
    
    /**
     * Returns a sequence that yields {@code min}, then each following value incremented by {@code step}, while the
     * value is less than or equal to {@code maxInclusive}.
     *
     * @see #range(int, int, int)
     *
     * @param min the first value
     * @param maxInclusive the inclusive upper bound
     * @param step the increment
     * @return a range sequence
     */
    public static Seq.Sequence<Long> rangeInclusive(long min, long maxInclusive, long step) {
        return rangeInclusive(min, maxInclusive, step, Arithmetic.LONG);
    }
    
    /**
     * Returns a sequence that yields {@code min}, then each following value incremented by {@code step}, while the
     * value is less than or equal to {@code maxInclusive}, as determined by the given arithmetic.
     *
     * @see #range(Object, Object, Object, Arithmetic)
     *
     * @param min the first value
     * @param maxInclusive the inclusive upper bound
     * @param step the increment
     * @param arithmetic the arithmetic of the value type
     * @return a range sequence
     * @param <T> the value type
     */
    public static <T> Seq.Sequence<T> rangeInclusive(T min, T maxInclusive, T step, Arithmetic<T> arithmetic) {
        return new Range<>(min, maxInclusive, step, arithmetic, true);
    }
    
    private static final class Range<T> implements Seq.Sequence<T> {
        final T bound;
        final T step;
        final Arithmetic<T> arithmetic;
        final boolean inclusive;
        T current;
        boolean done;
        
        Range(T current, T bound, T step, Arithmetic<T> arithmetic, boolean inclusive) {
            this.current = Objects.requireNonNull(current);
            this.bound = Objects.requireNonNull(bound);
            this.step = Objects.requireNonNull(step);
            this.arithmetic = Objects.requireNonNull(arithmetic);
            this.inclusive = inclusive;
        }
        
        @Override
        public T next() {
            if (done) {
                return null;
            }
            int c = arithmetic.compare(current, bound);
            if (inclusive ? c > 0 : c >= 0) {
                done = true;
                return null;
            }
            T value = current;
            current = arithmetic.add(value, step);
            // Overflow moves the value against the step
            int direction = arithmetic.signum(step);
            if (direction != 0 && Integer.signum(arithmetic.compare(current, value)) == -direction) {
                done = true;
            }
            return value;
        }
        
        @Override
        public boolean isCopyable() {
            return true;
        }
        
        @Override
        public Seq.Sequence<T> copy() {
            var copy = new Range<>(current, bound, step, arithmetic, inclusive);
            copy.done = done;
            return copy;
        }
    }
    
    /**
     * Returns a sequence that yields {@code start}, then each following value incremented by one, without end.
     *
     * @param start the first value
     * @return an infinite counting sequence
     */
    public static Seq.Sequence<Integer> infiniteRange(int start) {
        return infiniteRange(start, 1);
    }
    
    /**
     * Returns a sequence that yields {@code start}, then each following value incremented by {@code step}, without
     * end. Values wrap around on overflow.
     *
     * @param start the first value
     * @param step the increment
     * @return an infinite counting sequence
     */
    public static Seq.Sequence<Integer> infiniteRange(int start, int step) {
        return infiniteRange(start, step, Arithmetic.INTEGER);
    }
    
    /**
     * Returns a sequence that yields {@code start}, then each following value incremented by {@code step}, without
     * end. Values wrap around on overflow.
     *
     * @param start the first value
     * @param step the increment
     * @return an infinite counting sequence
     */
    public static Seq.Sequence<Long> infiniteRange(long start, long step) {
        return infiniteRange(start, step, Arithmetic.LONG);
    }
    
    /**
     * Returns a sequence that yields {@code start}, then each following value incremented by {@code step} using the
     * given arithmetic, without end.
     *
     * @param start the first value
     * @param step the increment
     * @param arithmetic the arithmetic of the value type
     * @return an infinite counting sequence
     * @param <T> the value type
     */
    public static <T> Seq.Sequence<T> infiniteRange(T start, T step, Arithmetic<T> arithmetic) {
        Objects.requireNonNull(start);
        Objects.requireNonNull(step);
        Objects.requireNonNull(arithmetic);
        
        class Counter implements Seq.Sequence<T> {
            T value;
            
            Counter(T value) {
                this.value = value;
            }
            
            @Override
            public T next() {
                T current = value;
                value = arithmetic.add(current, step);
                return current;
            }
            
            @Override
            public boolean isCopyable() {
                return true;
            }
            
            @Override
            public Seq.Sequence<T> copy() {
                return new Counter(value);
            }
        }
        
        return new Counter(start);
    }
    
    /**
     * Returns a sequence that yields nothing.
     *
     * @return an empty sequence
     * @param <T> the item type
     */
    public static <T> Seq.Sequence<T> empty() {
        class Empty implements Seq.Sequence<T> {
            @Override
            public T next() {
                return null;
            }
            
            @Override
            public boolean isCopyable() {
                return true;
            }
            
            @Override
            public Seq.Sequence<T> copy() {
                return this;
            }
        }
        
        return new Empty();
    }
    
    /**
     * Returns a sequence that yields the given value once.
     *
     * @param value the value
     * @return a sequence that yields the value once
     * @param <T> the item type
     */
    public static <T> Seq.Sequence<T> once(T value) {
        Objects.requireNonNull(value);
        return onceWith(() -> value);
    }
    
    /**
     * Returns a sequence that yields the result of the given supplier once. The supplier is not called until the
     * sequence is first advanced, and is not called again after that.
     *
     * <p>The returned sequence is copyable. A copy that has not yet been advanced will call the supplier itself.
     *
     * @param supplier supplies the value
     * @return a sequence that yields the supplied value once
     * @param <T> the item type
     */
    public static <T> Seq.Sequence<T> onceWith(Supplier<? extends T> supplier) {
        Objects.requireNonNull(supplier);
        
        class Once implements Seq.Sequence<T> {
            boolean done;
            
            Once(boolean done) {
                this.done = done;
            }
            
            @Override
            public T next() {
                if (done) {
                    return null;
                }
                done = true;
                return Objects.requireNonNull(supplier.get());
            }
            
            @Override
            public boolean isCopyable() {
                return true;
            }
            
            @Override
            public Seq.Sequence<T> copy() {
                return new Once(done);
            }
        }
        
        return new Once(false);
    }
    
    /**
     * Returns a sequence that yields the given value without end.
     *
     * @param value the value
     * @return a sequence that repeats the value
     * @param <T> the item type
     */
    public static <T> Seq.Sequence<T> repeat(T value) {
        Objects.requireNonNull(value);
        
        class Repeat implements Seq.Sequence<T> {
            @Override
            public T next() {
                return value;
            }
            
            @Override
            public boolean isCopyable() {
                return true;
            }
            
            @Override
            public Seq.Sequence<T> copy() {
                return this;
            }
        }
        
        return new Repeat();
    }
    
    /**
     * Returns a sequence that yields the result of calling the given supplier, each time it is advanced, without end.
     * If the supplier returns {@code null}, the sequence will throw a {@link NullPointerException}.
     *
     * <p>The returned sequence is not copyable, since the supplier may be stateful.
     *
     * @param generator supplies each item
     * @return an infinite generated sequence
     * @param <T> the item type
     */
    public static <T> Seq.Sequence<T> infiniteGenerator(Supplier<? extends T> generator) {
        Objects.requireNonNull(generator);
        return () -> Objects.requireNonNull(generator.get());
    }
    
    /**
     * Equivalent to {@link #infiniteGenerator(Supplier) infiniteGenerator}.
     *
     * @param generator supplies each item
     * @return an infinite generated sequence
     * @param <T> the item type
     */
    public static <T> Seq.Sequence<T> repeatWith(Supplier<? extends T> generator) {
        return infiniteGenerator(generator);
    }
    
    /**
     * Returns a sequence that yields the values returned by the given supplier, until the supplier first returns an
     * empty {@code Optional}. After that, the sequence is exhausted, and the supplier is not called again.
     *
     * <p>The returned sequence is not copyable, since the supplier may be stateful.
     *
     * @param generator supplies each item, or an empty {@code Optional} to end the sequence
     * @return a finite generated sequence
     * @param <T> the item type
     */
    public static <T> Seq.Sequence<T> finiteGenerator(Supplier<? extends Optional<? extends T>> generator) {
        Objects.requireNonNull(generator);
        
        class FiniteGenerator implements Seq.Sequence<T> {
            boolean done = false;
            
            @Override
            public T next() {
                if (done) {
                    return null;
                }
                Optional<? extends T> value = generator.get();
                if (value.isEmpty()) {
                    done = true;
                    return null;
                }
                return value.get();
            }
        }
        
        return new FiniteGenerator();
    }
    
    /**
     * Equivalent to {@link #finiteGenerator(Supplier) finiteGenerator}.
     *
     * @param generator supplies each item, or an empty {@code Optional} to end the sequence
     * @return a finite generated sequence
     * @param <T> the item type
     */
    public static <T> Seq.Sequence<T> fromFn(Supplier<? extends Optional<? extends T>> generator) {
        return finiteGenerator(generator);
    }
    
    /**
     * Returns a sequence that yields the seed, if present, and then each successor computed from the previous item.
     * The sequence is exhausted when the seed or a successor is empty. The successor of an item is not computed until
     * the item is yielded.
     *
     * <p>The returned sequence is copyable.
     *
     * @param seed the first item, if any
     * @param successor computes the item following the given item, or an empty {@code Optional} to end the sequence
     * @return a sequence of successive items
     * @param <T> the item type
     */
    public static <T> Seq.Sequence<T> successors(Optional<? extends T> seed,
                                                 Function<? super T, ? extends Optional<? extends T>> successor) {
        Objects.requireNonNull(seed);
        Objects.requireNonNull(successor);
        
        class Successors implements Seq.Sequence<T> {
            T current;
            
            Successors(T current) {
                this.current = current;
            }
            
            @Override
            public T next() {
                if (current == null) {
                    return null;
                }
                T t = current;
                current = successor.apply(t).orElse(null);
                return t;
            }
            
            @Override
            public boolean isCopyable() {
                return true;
            }
            
            @Override
            public Seq.Sequence<T> copy() {
                return new Successors(current);
            }
        }
        
        return new Successors(seed.orElse(null));
    }
    
    // --- Operators ---
    
    /**
     * Returns an operator that applies the {@code mapper} to each upstream item. If the {@code mapper} returns
     * {@code null}, the downstream sequence will throw a {@link NullPointerException}.
     *
     * <p>Example:
     * <pre>{@code
     * List<String> list = Seqs.range(0, 3)
     *     .andThen(Seqs.map(i -> i + "!"))
     *     .collect(ArrayList::new);
     *
     * System.out.println(list);
     * // Prints: [0!, 1!, 2!]
     * }</pre>
     *
     * @param mapper a function to be applied to the upstream items
     * @return an operator that applies the {@code mapper} to each upstream item
     * @param <T> the upstream item type
     * @param <U> the downstream item type
     */
    public static <T, U> Seq.Operator<T, U> map(Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper);
        
        class Map implements Seq.Sequence<U> {
            final Seq.Sequence<? extends T> source;
            
            Map(Seq.Sequence<? extends T> source) {
                this.source = Objects.requireNonNull(source);
            }
            
            @Override
            public U next() {
                T t = source.next();
                return t == null ? null : Objects.requireNonNull(mapper.apply(t));
            }
            
            @Override
            public boolean isCopyable() {
                return source.isCopyable();
            }
            
            @Override
            public Seq.Sequence<U> copy() {
                return new Map(source.copy());
            }
        }
        
        return Map::new;
    }
    
    /**
     * Returns an operator that passes through the upstream items for which the {@code predicate} holds. The downstream
     * sequence keeps pulling from upstream until an item passes or upstream is exhausted, so it may not return if the
     * upstream sequence is infinite and no remaining item passes.
     *
     * @param predicate the predicate
     * @return an operator that discards upstream items that fail the {@code predicate}
     * @param <T> the item type
     */
    public static <T> Seq.Operator<T, T> filter(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate);
        
        class Filter implements Seq.Sequence<T> {
            final Seq.Sequence<? extends T> source;
            
            Filter(Seq.Sequence<? extends T> source) {
                this.source = Objects.requireNonNull(source);
            }
            
            @Override
            public T next() {
                for (T t; (t = source.next()) != null; ) {
                    if (predicate.test(t)) {
                        return t;
                    }
                }
                return null;
            }
            
            @Override
            public boolean isCopyable() {
                return source.isCopyable();
            }
            
            @Override
            public Seq.Sequence<T> copy() {
                return new Filter(source.copy());
            }
        }
        
        return Filter::new;
    }
    
    /**
     * Returns an operator that applies the {@code mapper} to adapt or discard items from an upstream sequence. For each
     * upstream item, the downstream sequence yields the value of the {@code mapper}'s result, or discards the item if
     * the result is empty.
     *
     * <p>Example:
     * <pre>{@code
     * List<Integer> list = Seqs.fromArray(1, 2, 3, 4, 5, 6)
     *     .andThen(Seqs.filterMap(i -> i % 2 == 0 ? Optional.empty() : Optional.of(-i)))
     *     .collect(ArrayList::new);
     *
     * System.out.println(list);
     * // Prints: [-1, -3, -5]
     * }</pre>
     *
     * @param mapper a function to be applied to the upstream items
     * @return an operator that applies the {@code mapper} to adapt or discard items from an upstream sequence
     * @param <T> the upstream item type
     * @param <U> the downstream item type
     */
    public static <T, U> Seq.Operator<T, U> filterMap(Function<? super T, ? extends Optional<? extends U>> mapper) {
        Objects.requireNonNull(mapper);
        
        class FilterMap implements Seq.Sequence<U> {
            final Seq.Sequence<? extends T> source;
            
            FilterMap(Seq.Sequence<? extends T> source) {
                this.source = Objects.requireNonNull(source);
            }
            
            @Override
            public U next() {
                for (T t; (t = source.next()) != null; ) {
                    Optional<? extends U> u = mapper.apply(t);
                    if (u.isPresent()) {
                        return u.get();
                    }
                }
                return null;
            }
            
            @Override
            public boolean isCopyable() {
                return source.isCopyable();
            }
            
            @Override
            public Seq.Sequence<U> copy() {
                return new FilterMap(source.copy());
            }
        }
        
        return FilterMap::new;
    }
    
    /**
     * Returns a sequence that yields all items from the {@code first} sequence, then all items from the
     * {@code second} sequence. The {@code second} sequence is not advanced until the {@code first} is exhausted, and
     * the {@code first} is not advanced after that.
     *
     * @param first the first sequence
     * @param second the second sequence
     * @return a sequence that yields the items of both sequences, in turn
     * @param <T> the item type
     */
    public static <T> Seq.Sequence<T> chain(Seq.Sequence<? extends T> first, Seq.Sequence<? extends T> second) {
        Objects.requireNonNull(first);
        Objects.requireNonNull(second);
        
        class Chain implements Seq.Sequence<T> {
            final Seq.Sequence<? extends T> first;
            final Seq.Sequence<? extends T> second;
            boolean firstDone;
            
            Chain(Seq.Sequence<? extends T> first, Seq.Sequence<? extends T> second, boolean firstDone) {
                this.first = first;
                this.second = second;
                this.firstDone = firstDone;
            }
            
            @Override
            public T next() {
                if (!firstDone) {
                    T t = first.next();
                    if (t != null) {
                        return t;
                    }
                    firstDone = true;
                }
                return second.next();
            }
            
            @Override
            public boolean isCopyable() {
                return first.isCopyable() && second.isCopyable();
            }
            
            @Override
            public Seq.Sequence<T> copy() {
                return new Chain(first.copy(), second.copy(), firstDone);
            }
        }
        
        return new Chain(first, second, false);
    }
    
    /**
     * Returns an operator that yields all upstream items, then all items from the {@code next} sequence.
     *
     * @see #chain(Seq.Sequence, Seq.Sequence)
     *
     * @param next the sequence to yield from after upstream is exhausted
     * @return an operator that appends the {@code next} sequence to an upstream sequence
     * @param <T> the item type
     */
    public static <T> Seq.Operator<T, T> chain(Seq.Sequence<? extends T> next) {
        Objects.requireNonNull(next);
        return upstream -> chain(upstream, next);
    }
    
    /**
     * Returns a sequence that yields pairs of items, one from each of the given sequences, advancing both per item.
     * The sequence is exhausted as soon as either source is exhausted. The item pulled from the other source in that
     * step is discarded.
     *
     * @param first the first sequence
     * @param second the second sequence
     * @return a sequence of pairs of items
     * @param <A> the first sequence's item type
     * @param <B> the second sequence's item type
     */
    public static <A, B> Seq.Sequence<Pair<A, B>> zip(Seq.Sequence<? extends A> first,
                                                      Seq.Sequence<? extends B> second) {
        return zip(first, second, Pair::new);
    }
    
    /**
     * Returns a sequence that combines items, one from each of the given sequences, advancing both per item. The
     * items are combined using the given {@code combiner}, and the result is yielded. The sequence is exhausted as
     * soon as either source is exhausted. The item pulled from the other source in that step is discarded.
     *
     * @param first the first sequence
     * @param second the second sequence
     * @param combiner a function used to combine items from each sequence
     * @return a sequence of combined items
     * @param <A> the first sequence's item type
     * @param <B> the second sequence's item type
     * @param <T> the combined item type
     */
    public static <A, B, T> Seq.Sequence<T> zip(Seq.Sequence<? extends A> first,
                                                Seq.Sequence<? extends B> second,
                                                BiFunction<? super A, ? super B, ? extends T> combiner) {
        Objects.requireNonNull(first);
        Objects.requireNonNull(second);
        Objects.requireNonNull(combiner);
        
        class Zip implements Seq.Sequence<T> {
            final Seq.Sequence<? extends A> first;
            final Seq.Sequence<? extends B> second;
            boolean done;
            
            Zip(Seq.Sequence<? extends A> first, Seq.Sequence<? extends B> second, boolean done) {
                this.first = first;
                this.second = second;
                this.done = done;
            }
            
            @Override
            public T next() {
                if (done) {
                    return null;
                }
                A a = first.next();
                B b = second.next();
                if (a == null || b == null) {
                    done = true;
                    return null;
                }
                return Objects.requireNonNull(combiner.apply(a, b));
            }
            
            @Override
            public boolean isCopyable() {
                return first.isCopyable() && second.isCopyable();
            }
            
            @Override
            public Seq.Sequence<T> copy() {
                return new Zip(first.copy(), second.copy(), done);
            }
        }
        
        return new Zip(first, second, false);
    }
    
    /**
     * Returns an operator that pairs each upstream item with an item from the {@code other} sequence.
     *
     * @see #zip(Seq.Sequence, Seq.Sequence)
     *
     * @param other the sequence to pair upstream items with
     * @return an operator that pairs upstream items with items from the {@code other} sequence
     * @param <T> the upstream item type
     * @param <U> the other sequence's item type
     */
    public static <T, U> Seq.Operator<T, Pair<T, U>> zip(Seq.Sequence<? extends U> other) {
        Objects.requireNonNull(other);
        return upstream -> zip(upstream, other);
    }
    
    /**
     * Returns an operator that pairs each upstream item with its zero-based index.
     *
     * <p>Example:
     * <pre>{@code
     * Seqs.fromArray("a", "b")
     *     .andThen(Seqs.enumerate())
     *     .forEach(System.out::println);
     * // Prints:
     * // Indexed[index=0, element=a]
     * // Indexed[index=1, element=b]
     * }</pre>
     *
     * @return an operator that pairs each upstream item with its index
     * @param <T> the item type
     */
    public static <T> Seq.Operator<T, Indexed<T>> enumerate() {
        return upstream -> zip(infiniteRange(0L, 1L), upstream, (i, t) -> new Indexed<>(i, t));
    }
    
    /**
     * Returns an operator that yields the first upstream item, and after that every {@code step}-th upstream item.
     * For each item after the first, the downstream sequence pulls {@code step} upstream items and yields the last.
     * If {@code step} is zero or negative, the downstream sequence is empty, and never pulls from upstream.
     *
     * <p>Example:
     * <pre>{@code
     * List<Integer> list = Seqs.range(0, 10)
     *     .andThen(Seqs.stepBy(3))
     *     .collect(ArrayList::new);
     *
     * System.out.println(list);
     * // Prints: [0, 3, 6, 9]
     * }</pre>
     *
     * @param step the stride
     * @return an operator that yields every {@code step}-th upstream item
     * @param <T> the item type
     */
    public static <T> Seq.Operator<T, T> stepBy(long step) {
        class StepBy implements Seq.Sequence<T> {
            final Seq.Sequence<? extends T> source;
            boolean first;
            boolean done;
            
            StepBy(Seq.Sequence<? extends T> source, boolean first, boolean done) {
                this.source = Objects.requireNonNull(source);
                this.first = first;
                this.done = done;
            }
            
            @Override
            public T next() {
                if (done) {
                    return null;
                }
                T t = source.next();
                if (first) {
                    first = false;
                } else {
                    for (long i = 1; i < step && t != null; i++) {
                        t = source.next();
                    }
                }
                if (t == null) {
                    done = true;
                }
                return t;
            }
            
            @Override
            public boolean isCopyable() {
                return source.isCopyable();
            }
            
            @Override
            public Seq.Sequence<T> copy() {
                return new StepBy(source.copy(), first, done);
            }
        }
        
        return upstream -> new StepBy(upstream, true, step <= 0);
    }
    
    /**
     * Returns an operator that inserts the {@code separator} between consecutive upstream items. No separator is
     * yielded before the first item or after the last, so an upstream sequence of {@code n > 0} items becomes
     * {@code 2n - 1} items. The item following a separator is pulled from upstream when the separator is requested.
     *
     * <p>Example:
     * <pre>{@code
     * String s = Seqs.fromArray("a", "b", "c")
     *     .andThen(Seqs.intersperse(", "))
     *     .collect(Collectors.joining());
     *
     * System.out.println(s);
     * // Prints: a, b, c
     * }</pre>
     *
     * @param separator the separator
     * @return an operator that inserts the {@code separator} between upstream items
     * @param <T> the item type
     */
    public static <T> Seq.Operator<T, T> intersperse(T separator) {
        Objects.requireNonNull(separator);
        return intersperse(() -> separator, true);
    }
    
    /**
     * Returns an operator that inserts a separator between consecutive upstream items, obtained by calling the
     * {@code separatorSupplier} each time one is needed. The supplier is only called once it is known that another
     * upstream item follows.
     *
     * <p>The downstream sequence is not copyable, since the supplier may be stateful.
     *
     * @see #intersperse(Object)
     *
     * @param separatorSupplier supplies each separator
     * @return an operator that inserts supplied separators between upstream items
     * @param <T> the item type
     */
    public static <T> Seq.Operator<T, T> intersperseWith(Supplier<? extends T> separatorSupplier) {
        Objects.requireNonNull(separatorSupplier);
        return intersperse(separatorSupplier, false);
    }
    
    private static <T> Seq.Operator<T, T> intersperse(Supplier<? extends T> separatorSupplier, boolean copyable) {
        class Intersperse implements Seq.Sequence<T> {
            final Seq.Sequence<? extends T> source;
            T pending = null;
            boolean started = false;
            boolean done = false;
            
            Intersperse(Seq.Sequence<? extends T> source) {
                this.source = Objects.requireNonNull(source);
            }
            
            @Override
            public T next() {
                if (done) {
                    return null;
                }
                if (pending != null) {
                    T t = pending;
                    pending = null;
                    return t;
                }
                T t = source.next();
                if (t == null) {
                    done = true;
                    return null;
                }
                if (!started) {
                    started = true;
                    return t;
                }
                pending = t;
                return Objects.requireNonNull(separatorSupplier.get());
            }
            
            @Override
            public boolean isCopyable() {
                return copyable && source.isCopyable();
            }
            
            @Override
            public Seq.Sequence<T> copy() {
                if (!copyable) {
                    throw new UnsupportedOperationException("separator supplier is not copyable");
                }
                var copy = new Intersperse(source.copy());
                copy.pending = pending;
                copy.started = started;
                copy.done = done;
                return copy;
            }
        }
        
        return Intersperse::new;
    }
    
    /**
     * Returns an operator that discards upstream items while the {@code predicate} holds, then yields the first item
     * for which it fails and every item after it. The predicate is not evaluated again once it has failed.
     *
     * @param predicate the predicate
     * @return an operator that discards leading upstream items that pass the {@code predicate}
     * @param <T> the item type
     */
    public static <T> Seq.Operator<T, T> skipWhile(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate);
        
        class SkipWhile implements Seq.Sequence<T> {
            final Seq.Sequence<? extends T> source;
            boolean skipping;
            
            SkipWhile(Seq.Sequence<? extends T> source, boolean skipping) {
                this.source = Objects.requireNonNull(source);
                this.skipping = skipping;
            }
            
            @Override
            public T next() {
                if (skipping) {
                    skipping = false;
                    for (T t; (t = source.next()) != null; ) {
                        if (!predicate.test(t)) {
                            return t;
                        }
                    }
                    return null;
                }
                return source.next();
            }
            
            @Override
            public boolean isCopyable() {
                return source.isCopyable();
            }
            
            @Override
            public Seq.Sequence<T> copy() {
                return new SkipWhile(source.copy(), skipping);
            }
        }
        
        return upstream -> new SkipWhile(upstream, true);
    }
    
    /**
     * Returns an operator that yields upstream items while the {@code predicate} holds. The first item for which it
     * fails is discarded, and the downstream sequence is exhausted from then on, without pulling from upstream again.
     *
     * @param predicate the predicate
     * @return an operator that yields leading upstream items that pass the {@code predicate}
     * @param <T> the item type
     */
    public static <T> Seq.Operator<T, T> takeWhile(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate);
        
        class TakeWhile implements Seq.Sequence<T> {
            final Seq.Sequence<? extends T> source;
            boolean done;
            
            TakeWhile(Seq.Sequence<? extends T> source, boolean done) {
                this.source = Objects.requireNonNull(source);
                this.done = done;
            }
            
            @Override
            public T next() {
                if (done) {
                    return null;
                }
                T t = source.next();
                if (t == null || !predicate.test(t)) {
                    done = true;
                    return null;
                }
                return t;
            }
            
            @Override
            public boolean isCopyable() {
                return source.isCopyable();
            }
            
            @Override
            public Seq.Sequence<T> copy() {
                return new TakeWhile(source.copy(), done);
            }
        }
        
        return upstream -> new TakeWhile(upstream, false);
    }
    
    /**
     * Returns an operator that discards the first {@code count} upstream items, then yields the rest. The items are
     * discarded when the downstream sequence is first advanced. If {@code count} is zero or negative, nothing is
     * discarded.
     *
     * @param count the number of items to discard
     * @return an operator that discards leading upstream items
     * @param <T> the item type
     */
    public static <T> Seq.Operator<T, T> skip(long count) {
        class Skip implements Seq.Sequence<T> {
            final Seq.Sequence<? extends T> source;
            long remaining;
            
            Skip(Seq.Sequence<? extends T> source, long remaining) {
                this.source = Objects.requireNonNull(source);
                this.remaining = remaining;
            }
            
            @Override
            public T next() {
                for (; remaining > 0; remaining--) {
                    if (source.next() == null) {
                        remaining = 0;
                        return null;
                    }
                }
                return source.next();
            }
            
            @Override
            public boolean isCopyable() {
                return source.isCopyable();
            }
            
            @Override
            public Seq.Sequence<T> copy() {
                return new Skip(source.copy(), remaining);
            }
        }
        
        return upstream -> new Skip(upstream, Math.max(0, count));
    }
    
    /**
     * Returns an operator that yields at most the first {@code count} upstream items. Once {@code count} items have
     * been yielded, the downstream sequence is exhausted and does not pull from upstream again. If {@code count} is
     * zero or negative, the downstream sequence is empty.
     *
     * @param count the maximum number of items to yield
     * @return an operator that truncates an upstream sequence
     * @param <T> the item type
     */
    public static <T> Seq.Operator<T, T> take(long count) {
        class Take implements Seq.Sequence<T> {
            final Seq.Sequence<? extends T> source;
            long remaining;
            
            Take(Seq.Sequence<? extends T> source, long remaining) {
                this.source = Objects.requireNonNull(source);
                this.remaining = remaining;
            }
            
            @Override
            public T next() {
                if (remaining <= 0) {
                    return null;
                }
                T t = source.next();
                remaining = t == null ? 0 : remaining - 1;
                return t;
            }
            
            @Override
            public boolean isCopyable() {
                return source.isCopyable();
            }
            
            @Override
            public Seq.Sequence<T> copy() {
                return new Take(source.copy(), remaining);
            }
        }
        
        return upstream -> new Take(upstream, Math.max(0, count));
    }
    
    /**
     * Returns an operator that yields the items of each upstream sequence in turn, removing one level of nesting. The
     * next inner sequence is not pulled until the current one is exhausted.
     *
     * <p>Each copyable inner sequence is copied when it is pulled, and the copy is advanced in its place, so the inner
     * sequences held by upstream are never advanced. Inner sequences that are not copyable are advanced directly. The
     * downstream sequence is copyable if the upstream sequence is, and the current inner sequence, if any, is too.
     *
     * <p>Example:
     * <pre>{@code
     * List<Integer> list = Seqs.fromArray(List.of(1, 2), List.of(), List.of(3))
     *     .andThen(Seqs.map(Seqs::fromCollection))
     *     .andThen(Seqs.<Integer>flatten())
     *     .collect(ArrayList::new);
     *
     * System.out.println(list);
     * // Prints: [1, 2, 3]
     * }</pre>
     *
     * @return an operator that flattens a sequence of sequences
     * @param <T> the inner item type
     */
    public static <T> Seq.Operator<Seq.Sequence<? extends T>, T> flatten() {
        class Flatten implements Seq.Sequence<T> {
            final Seq.Sequence<? extends Seq.Sequence<? extends T>> source;
            Seq.Sequence<? extends T> inner;
            boolean done;
            
            Flatten(Seq.Sequence<? extends Seq.Sequence<? extends T>> source,
                    Seq.Sequence<? extends T> inner,
                    boolean done) {
                this.source = Objects.requireNonNull(source);
                this.inner = inner;
                this.done = done;
            }
            
            @Override
            public T next() {
                while (!done) {
                    if (inner != null) {
                        T t = inner.next();
                        if (t != null) {
                            return t;
                        }
                    }
                    Seq.Sequence<? extends T> next = source.next();
                    if (next == null) {
                        inner = null;
                        done = true;
                    } else {
                        inner = next.isCopyable() ? next.copy() : next;
                    }
                }
                return null;
            }
            
            @Override
            public boolean isCopyable() {
                return source.isCopyable() && (inner == null || inner.isCopyable());
            }
            
            @Override
            public Seq.Sequence<T> copy() {
                return new Flatten(source.copy(), inner == null ? null : inner.copy(), done);
            }
        }
        
        return upstream -> new Flatten(upstream, null, false);
    }
    
    /**
     * Returns an operator that maps each upstream item to a sequence, and yields the items of each such sequence in
     * turn. Equivalent to {@code map(mapper).andThen(flatten())}.
     *
     * @param mapper a function that maps an upstream item to a sequence
     * @return an operator that maps and flattens
     * @param <T> the upstream item type
     * @param <U> the downstream item type
     */
    public static <T, U> Seq.Operator<T, U> flatMap(Function<? super T, ? extends Seq.Sequence<? extends U>> mapper) {
        Seq.Operator<T, Seq.Sequence<? extends U>> map = map(mapper);
        return map.andThen(Seqs.<U>flatten());
    }
    
    /**
     * Returns an operator that calls the {@code action} on each upstream item as it is yielded, without altering it.
     *
     * @param action the action to be performed for each item
     * @return an operator that observes upstream items
     * @param <T> the item type
     */
    public static <T> Seq.Operator<T, T> inspect(Consumer<? super T> action) {
        Objects.requireNonNull(action);
        
        class Inspect implements Seq.Sequence<T> {
            final Seq.Sequence<? extends T> source;
            
            Inspect(Seq.Sequence<? extends T> source) {
                this.source = Objects.requireNonNull(source);
            }
            
            @Override
            public T next() {
                T t = source.next();
                if (t != null) {
                    action.accept(t);
                }
                return t;
            }
            
            @Override
            public boolean isCopyable() {
                return source.isCopyable();
            }
            
            @Override
            public Seq.Sequence<T> copy() {
                return new Inspect(source.copy());
            }
        }
        
        return Inspect::new;
    }
    
    /**
     * Returns an operator that repeats the upstream sequence without end. The downstream sequence captures a copy of
     * the upstream sequence when constructed, and each time upstream is exhausted, continues from a fresh copy of
     * that capture. If the first pass yields nothing, the downstream sequence yields nothing, without restarting.
     *
     * <p>The upstream sequence must be {@link Seq.Sequence#isCopyable copyable}. Otherwise, applying the operator will
     * throw an {@link IllegalStageException}, before any item is pulled.
     *
     * <p>Example:
     * <pre>{@code
     * List<Integer> list = Seqs.range(0, 3)
     *     .andThen(Seqs.cycle())
     *     .andThen(Seqs.take(7))
     *     .collect(ArrayList::new);
     *
     * System.out.println(list);
     * // Prints: [0, 1, 2, 0, 1, 2, 0]
     * }</pre>
     *
     * @return an operator that repeats an upstream sequence
     * @param <T> the item type
     */
    public static <T> Seq.Operator<T, T> cycle() {
        class Cycle implements Seq.Sequence<T> {
            final Seq.Sequence<? extends T> original;
            Seq.Sequence<? extends T> source;
            boolean yielded;
            
            Cycle(Seq.Sequence<? extends T> original, Seq.Sequence<? extends T> source, boolean yielded) {
                this.original = original;
                this.source = source;
                this.yielded = yielded;
            }
            
            @Override
            public T next() {
                T t = source.next();
                if (t != null) {
                    yielded = true;
                    return t;
                }
                if (!yielded) {
                    return null;
                }
                source = original.copy();
                return source.next();
            }
            
            @Override
            public boolean isCopyable() {
                return true;
            }
            
            @Override
            public Seq.Sequence<T> copy() {
                return new Cycle(original, source.copy(), yielded);
            }
        }
        
        return upstream -> {
            Objects.requireNonNull(upstream);
            if (!upstream.isCopyable()) {
                throw new IllegalStageException("cycle",
                                                "upstream sequence is not copyable: " + upstream.getClass().getName());
            }
            return new Cycle(upstream.copy(), upstream, false);
        };
    }
    
    private enum Lookahead { UNRESOLVED, ITEM, END }
    
    /**
     * Returns a sequence that yields the items of the given sequence, and can {@link Seq.PeekableSequence#peek peek}
     * at the next item without consuming it. Peeking pulls at most one item ahead from the given sequence, and holds
     * it until it is consumed.
     *
     * @param source the sequence to yield from
     * @return a peekable sequence
     * @param <T> the item type
     */
    public static <T> Seq.PeekableSequence<T> peekable(Seq.Sequence<? extends T> source) {
        Objects.requireNonNull(source);
        
        class Peekable implements Seq.PeekableSequence<T> {
            final Seq.Sequence<? extends T> source;
            Lookahead state;
            T item;
            
            Peekable(Seq.Sequence<? extends T> source, Lookahead state, T item) {
                this.source = source;
                this.state = state;
                this.item = item;
            }
            
            @Override
            public T peek() {
                if (state == Lookahead.UNRESOLVED) {
                    item = source.next();
                    state = item == null ? Lookahead.END : Lookahead.ITEM;
                }
                return item;
            }
            
            @Override
            public T next() {
                if (state == Lookahead.END) {
                    return null;
                }
                if (state == Lookahead.ITEM) {
                    T t = item;
                    item = null;
                    state = Lookahead.UNRESOLVED;
                    return t;
                }
                T t = source.next();
                if (t == null) {
                    state = Lookahead.END;
                }
                return t;
            }
            
            @Override
            public boolean isCopyable() {
                return source.isCopyable();
            }
            
            @Override
            public Seq.PeekableSequence<T> copy() {
                if (!source.isCopyable()) {
                    throw new UnsupportedOperationException(getClass().getName() + " is not copyable");
                }
                return new Peekable(source.copy(), state, item);
            }
        }
        
        return new Peekable(source, Lookahead.UNRESOLVED, null);
    }
    
    // --- Consumers over comparable items ---
    
    /**
     * Returns the least remaining item of the sequence in natural order. If several items are least, the first one is
     * returned.
     *
     * @param sequence the sequence
     * @return the least item, or an empty {@code Optional} for an empty sequence
     * @param <T> the item type
     */
    public static <T extends Comparable<? super T>> Optional<T> min(Seq.Sequence<T> sequence) {
        return sequence.minBy(Comparator.naturalOrder());
    }
    
    /**
     * Returns the greatest remaining item of the sequence in natural order. If several items are greatest, the first
     * one is returned.
     *
     * @param sequence the sequence
     * @return the greatest item, or an empty {@code Optional} for an empty sequence
     * @param <T> the item type
     */
    public static <T extends Comparable<? super T>> Optional<T> max(Seq.Sequence<T> sequence) {
        return sequence.maxBy(Comparator.naturalOrder());
    }
    
    public static <T extends Comparable<? super T>> boolean isSortedAscending(Seq.Sequence<T> sequence) {
        return sequence.isSortedBy(Comparator.naturalOrder());
    }
    
    public static <T extends Comparable<? super T>> boolean isSortedDescending(Seq.Sequence<T> sequence) {
        return sequence.isSortedBy(Comparator.reverseOrder());
    }
    
    /**
     * Lexicographically compares two sequences in the natural order of their items.
     *
     * @see Seq.Sequence#cmpBy(Seq.Sequence, Comparator)
     *
     * @param a the first sequence
     * @param b the second sequence
     * @return the ordering of {@code a} relative to {@code b}
     * @param <T> the item type
     */
    public static <T extends Comparable<? super T>> Ordering cmp(Seq.Sequence<T> a, Seq.Sequence<? extends T> b) {
        return a.cmpBy(b, Comparator.naturalOrder());
    }
    
    /**
     * Lexicographically compares two sequences in the natural order of their items, treating floating-point
     * {@code NaN} as incomparable.
     *
     * @see Seq.Sequence#partialCmpBy(Seq.Sequence, Seq.PartialComparator)
     *
     * @param a the first sequence
     * @param b the second sequence
     * @return the ordering of {@code a} relative to {@code b}, or an empty {@code Optional} if an incomparable pair was
     * reached first
     * @param <T> the item type
     */
    public static <T extends Comparable<? super T>> Optional<Ordering> partialCmp(Seq.Sequence<T> a,
                                                                                 Seq.Sequence<? extends T> b) {
        return a.partialCmpBy(b, Seq.PartialComparator.<T>natural());
    }
    
    /**
     * Returns {@code true} if {@code a} is lexicographically less than {@code b}. Returns {@code false} if the
     * comparison reached an incomparable pair.
     *
     * @param a the first sequence
     * @param b the second sequence
     * @return {@code true} if {@code a < b}
     * @param <T> the item type
     */
    public static <T extends Comparable<? super T>> boolean lt(Seq.Sequence<T> a, Seq.Sequence<? extends T> b) {
        return partialCmp(a, b).map(o -> o == Ordering.LESS).orElse(false);
    }
    
    /**
     * Returns {@code true} if {@code a} is lexicographically less than or equal to {@code b}. Returns {@code false}
     * if the comparison reached an incomparable pair.
     *
     * @param a the first sequence
     * @param b the second sequence
     * @return {@code true} if {@code a <= b}
     * @param <T> the item type
     */
    public static <T extends Comparable<? super T>> boolean le(Seq.Sequence<T> a, Seq.Sequence<? extends T> b) {
        return partialCmp(a, b).map(o -> o != Ordering.GREATER).orElse(false);
    }
    
    /**
     * Returns {@code true} if {@code a} is lexicographically greater than {@code b}. Returns {@code false} if the
     * comparison reached an incomparable pair.
     *
     * @param a the first sequence
     * @param b the second sequence
     * @return {@code true} if {@code a > b}
     * @param <T> the item type
     */
    public static <T extends Comparable<? super T>> boolean gt(Seq.Sequence<T> a, Seq.Sequence<? extends T> b) {
        return partialCmp(a, b).map(o -> o == Ordering.GREATER).orElse(false);
    }
    
    /**
     * Returns {@code true} if {@code a} is lexicographically greater than or equal to {@code b}. Returns
     * {@code false} if the comparison reached an incomparable pair.
     *
     * @param a the first sequence
     * @param b the second sequence
     * @return {@code true} if {@code a >= b}
     * @param <T> the item type
     */
    public static <T extends Comparable<? super T>> boolean ge(Seq.Sequence<T> a, Seq.Sequence<? extends T> b) {
        return partialCmp(a, b).map(o -> o != Ordering.LESS).orElse(false);
    }
    
    // --- Host iteration ---
    
    /**
     * Returns an {@code Iterable} over the remaining items of the given sequence, for use in an enhanced {@code for}
     * statement. The iterable can be iterated only once, since the sequence is single-pass.
     *
     * @param sequence the sequence
     * @return a one-shot iterable over the sequence
     * @param <T> the item type
     */
    public static <T> Iterable<T> iterable(Seq.Sequence<T> sequence) {
        Objects.requireNonNull(sequence);
        
        class OneShotIterable implements Iterable<T> {
            boolean called = false;
            
            @Override
            public Iterator<T> iterator() {
                if (called) {
                    throw new IllegalStateException("sequence has already been iterated");
                }
                called = true;
                return sequence.iterator();
            }
        }
        
        return new OneShotIterable();
    }
}
