package io.avery.sequence;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Comparator;
import java.util.Objects;
import java.util.function.BinaryOperator;

/**
 * The additive and multiplicative structure of a numeric item type, used by ranges and by the
 * {@link Seq.Sequence#sum sum} and {@link Seq.Sequence#product product} consumers.
 *
 * @param <T> the numeric type
 */
public interface Arithmetic<T> extends Comparator<T> {
    Arithmetic<Integer> INTEGER = of(0, 1, Integer::sum, (a, b) -> a * b, Comparator.naturalOrder());
    Arithmetic<Long> LONG = of(0L, 1L, Long::sum, (a, b) -> a * b, Comparator.naturalOrder());
    Arithmetic<Double> DOUBLE = of(0.0, 1.0, Double::sum, (a, b) -> a * b, Comparator.naturalOrder());
    Arithmetic<BigInteger> BIG_INTEGER =
        of(BigInteger.ZERO, BigInteger.ONE, BigInteger::add, BigInteger::multiply, Comparator.naturalOrder());
    Arithmetic<BigDecimal> BIG_DECIMAL =
        of(BigDecimal.ZERO, BigDecimal.ONE, BigDecimal::add, BigDecimal::multiply, Comparator.naturalOrder());
    
    /**
     * Returns the additive identity.
     *
     * @return zero
     */
    T zero();
    
    /**
     * Returns the multiplicative identity.
     *
     * @return one
     */
    T one();
    
    T add(T a, T b);
    
    T multiply(T a, T b);
    
    /**
     * Returns the sign of the given value, as -1, 0, or 1.
     *
     * @param value the value
     * @return the sign of the value
     */
    default int signum(T value) {
        return Integer.signum(compare(value, zero()));
    }
    
    /**
     * Returns an arithmetic assembled from the given identities, operations, and order.
     *
     * @param zero the additive identity
     * @param one the multiplicative identity
     * @param add the addition
     * @param multiply the multiplication
     * @param order the order
     * @return an arithmetic
     * @param <T> the numeric type
     * @throws NullPointerException if any argument is null
     */
    static <T> Arithmetic<T> of(T zero,
                                T one,
                                BinaryOperator<T> add,
                                BinaryOperator<T> multiply,
                                Comparator<? super T> order) {
        Objects.requireNonNull(zero);
        Objects.requireNonNull(one);
        Objects.requireNonNull(add);
        Objects.requireNonNull(multiply);
        Objects.requireNonNull(order);
        
        class Assembled implements Arithmetic<T> {
            @Override public T zero() { return zero; }
            @Override public T one() { return one; }
            @Override public T add(T a, T b) { return add.apply(a, b); }
            @Override public T multiply(T a, T b) { return multiply.apply(a, b); }
            @Override public int compare(T a, T b) { return order.compare(a, b); }
        }
        
        return new Assembled();
    }
}
