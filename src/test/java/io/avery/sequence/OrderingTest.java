package io.avery.sequence;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderingTest {
    
    @Test
    void testOf() {
        assertThat(Ordering.of(-42)).isEqualTo(Ordering.LESS);
        assertThat(Ordering.of(0)).isEqualTo(Ordering.EQUAL);
        assertThat(Ordering.of(7)).isEqualTo(Ordering.GREATER);
    }
    
    @Test
    void testReverse() {
        assertThat(Ordering.LESS.reverse()).isEqualTo(Ordering.GREATER);
        assertThat(Ordering.EQUAL.reverse()).isEqualTo(Ordering.EQUAL);
        assertThat(Ordering.GREATER.reverse()).isEqualTo(Ordering.LESS);
    }
    
    @Test
    void testNaturalPartialComparator() {
        Seq.PartialComparator<Double> comparator = Seq.PartialComparator.natural();
        assertThat(comparator.compare(1.0, 2.0)).contains(Ordering.LESS);
        assertThat(comparator.compare(Double.NaN, 2.0)).isEmpty();
        assertThat(comparator.compare(Double.NaN, Double.NaN)).isEmpty();
        assertThat(comparator.compare(-0.0, 0.0)).contains(Ordering.EQUAL);
    }
    
    @Test
    void testArithmeticSignum() {
        assertThat(Arithmetic.INTEGER.signum(-3)).isEqualTo(-1);
        assertThat(Arithmetic.LONG.signum(0L)).isZero();
        assertThat(Arithmetic.BIG_DECIMAL.signum(new BigDecimal("0.5"))).isEqualTo(1);
    }
    
    @Test
    void testValueTypesRejectNull() {
        assertThatThrownBy(() -> new Pair<>(null, 1)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new Indexed<>(0, null)).isInstanceOf(NullPointerException.class);
    }
    
    @Test
    void testIllegalStageExceptionMessage() {
        IllegalStageException e = new IllegalStageException("cycle", "not copyable");
        assertThat(e.stage()).isEqualTo("cycle");
        assertThat(e).hasMessage("cycle: not copyable");
    }
}
