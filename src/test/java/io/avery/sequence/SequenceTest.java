package io.avery.sequence;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.*;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SequenceTest {
    
    @Test
    void testForEachMatchesCount() {
        List<Integer> list = new ArrayList<>();
        Seqs.range(0, 7).forEach(list::add);
        assertThat(list).hasSize((int) Seqs.range(0, 7).count());
    }
    
    @Test
    void testCollect() {
        List<Integer> viaCollector = Seqs.range(0, 4).collect(Collectors.toList());
        List<Integer> viaSupplier = Seqs.range(0, 4).collect(ArrayList::new);
        List<Integer> viaSizeHint = Seqs.range(0, 4).collect(ArrayList::new, 4);
        Set<Integer> set = Seqs.fromArray(3, 1, 3).collect(TreeSet::new);
        
        assertThat(viaCollector).containsExactly(0, 1, 2, 3);
        assertThat(viaSupplier).containsExactly(0, 1, 2, 3);
        assertThat(viaSizeHint).containsExactly(0, 1, 2, 3);
        assertThat(set).containsExactly(1, 3);
    }
    
    @Test
    void testPartition() {
        Pair<List<Integer>, List<Integer>> parts = Seqs.range(0, 10).partition(ArrayList::new, i -> i % 2 == 0);
        assertThat(parts.first()).containsExactly(0, 2, 4, 6, 8);
        assertThat(parts.second()).containsExactly(1, 3, 5, 7, 9);
    }
    
    @Test
    void testCountAndLast() {
        assertThat(Seqs.range(0, 5).count()).isEqualTo(5);
        assertThat(Seqs.empty().count()).isZero();
        assertThat(Seqs.range(0, 5).last()).contains(4);
        assertThat(Seqs.empty().last()).isEmpty();
    }
    
    @Test
    void testSumAndProduct() {
        assertThat(Seqs.range(1, 5).sum(Arithmetic.INTEGER)).isEqualTo(10);
        assertThat(Seqs.rangeInclusive(1, 5).product(Arithmetic.INTEGER)).isEqualTo(120);
        assertThat(Seqs.<Integer>empty().sum(Arithmetic.INTEGER)).isZero();
        assertThat(Seqs.<Integer>empty().product(Arithmetic.INTEGER)).isEqualTo(1);
        assertThat(Seqs.fromArray(0.5, 1.5).sum(Arithmetic.DOUBLE)).isEqualTo(2.0);
    }
    
    @Test
    void testProductOfBigIntegers() {
        BigInteger factorial = Seqs.rangeInclusive(BigInteger.ONE, BigInteger.valueOf(20), BigInteger.ONE, Arithmetic.BIG_INTEGER)
            .product(Arithmetic.BIG_INTEGER);
        assertThat(factorial).isEqualTo(new BigInteger("2432902008176640000"));
    }
    
    @Test
    void testFold() {
        String result = Seqs.fromArray("hello", " world", "foo", "bar").fold("", String::concat);
        assertThat(result).isEqualTo("hello worldfoobar");
        assertThat(Seqs.<String>empty().fold("seed", String::concat)).isEqualTo("seed");
        assertThat(Seqs.range(1, 4).fold(new StringBuilder(), StringBuilder::append).toString()).isEqualTo("123");
    }
    
    @Test
    void testReduce() {
        assertThat(Seqs.range(1, 5).reduce(Integer::sum)).contains(10);
        assertThat(Seqs.fromArray("only").reduce(String::concat)).contains("only");
        assertThat(Seqs.<Integer>empty().reduce(Integer::sum)).isEmpty();
    }
    
    @Test
    void testAllAndAny() {
        assertThat(Seqs.<Integer>empty().all(i -> false)).isTrue();
        assertThat(Seqs.<Integer>empty().any(i -> true)).isFalse();
        assertThat(Seqs.range(0, 5).all(i -> i < 5)).isTrue();
        assertThat(Seqs.range(0, 5).any(i -> i == 3)).isTrue();
    }
    
    @Test
    void testAllShortCircuits() {
        Seq.Sequence<Integer> sequence = Seqs.range(0, 10);
        assertThat(sequence.all(i -> i < 3)).isFalse();
        assertThat(sequence.next()).isEqualTo(4);
    }
    
    @Test
    void testAnyShortCircuits() {
        Seq.Sequence<Integer> sequence = Seqs.range(0, 10);
        assertThat(sequence.any(i -> i == 2)).isTrue();
        assertThat(sequence.next()).isEqualTo(3);
    }
    
    @Test
    void testFind() {
        Seq.Sequence<Integer> sequence = Seqs.range(0, 10);
        assertThat(sequence.find(i -> i > 4)).contains(5);
        assertThat(sequence.next()).isEqualTo(6);
        assertThat(Seqs.range(0, 3).find(i -> i > 4)).isEmpty();
    }
    
    @Test
    void testPosition() {
        assertThat(Seqs.fromArray("a", "b", "c").position("c"::equals)).hasValue(2);
        assertThat(Seqs.fromArray("a", "b").position("z"::equals)).isEmpty();
    }
    
    @Test
    void testNth() {
        assertThat(Seqs.range(0, 10).nth(3)).contains(3);
        assertThat(Seqs.range(0, 10).nth(10)).isEmpty();
        
        Seq.Sequence<Integer> sequence = Seqs.range(0, 10);
        assertThat(sequence.nth(-1)).isEmpty();
        assertThat(sequence.next()).isEqualTo(0);
    }
    
    @Test
    void testMinAndMax() {
        assertThat(Seqs.min(Seqs.fromArray(3, 1, 2))).contains(1);
        assertThat(Seqs.max(Seqs.fromArray(3, 1, 2))).contains(3);
        assertThat(Seqs.min(Seqs.<Integer>empty())).isEmpty();
        assertThat(Seqs.max(Seqs.<Integer>empty())).isEmpty();
    }
    
    @Test
    void testMinByAndMaxByKeepFirstTie() {
        Comparator<String> byLength = Comparator.comparingInt(String::length);
        assertThat(Seqs.fromArray("bb", "a", "c", "dd").minBy(byLength)).contains("a");
        assertThat(Seqs.fromArray("bb", "a", "c", "dd").maxBy(byLength)).contains("bb");
    }
    
    @Test
    void testIsSorted() {
        assertThat(Seqs.isSortedAscending(Seqs.fromArray(1, 2, 2, 3))).isTrue();
        assertThat(Seqs.isSortedAscending(Seqs.fromArray(1, 3, 2))).isFalse();
        assertThat(Seqs.isSortedDescending(Seqs.fromArray(3, 2, 2, 1))).isTrue();
        assertThat(Seqs.isSortedDescending(Seqs.fromArray(1, 2))).isFalse();
        assertThat(Seqs.isSortedAscending(Seqs.<Integer>empty())).isTrue();
        assertThat(Seqs.isSortedAscending(Seqs.once(7))).isTrue();
        assertThat(Seqs.fromArray("ccc", "bb", "a").isSortedBy(Comparator.comparingInt(String::length).reversed())).isTrue();
    }
    
    @Test
    void testIsSortedShortCircuits() {
        Seq.Sequence<Integer> sequence = Seqs.fromArray(1, 3, 2, 5);
        assertThat(Seqs.isSortedAscending(sequence)).isFalse();
        assertThat(sequence.next()).isEqualTo(5);
    }
    
    @Test
    void testCmp() {
        assertThat(Seqs.cmp(Seqs.range(0, 2), Seqs.range(0, 10))).isEqualTo(Ordering.LESS);
        assertThat(Seqs.cmp(Seqs.range(0, 10), Seqs.range(0, 2))).isEqualTo(Ordering.GREATER);
        assertThat(Seqs.cmp(Seqs.range(0, 3), Seqs.fromArray(0, 1, 2))).isEqualTo(Ordering.EQUAL);
        assertThat(Seqs.cmp(Seqs.fromArray(0, 5), Seqs.fromArray(1))).isEqualTo(Ordering.LESS);
        assertThat(Seqs.cmp(Seqs.<Integer>empty(), Seqs.<Integer>empty())).isEqualTo(Ordering.EQUAL);
    }
    
    @Test
    void testCmpBy() {
        Ordering ordering = Seqs.fromArray("b", "a").cmpBy(Seqs.fromArray("a", "b"), Comparator.reverseOrder());
        assertThat(ordering).isEqualTo(Ordering.LESS);
    }
    
    @Test
    void testPartialCmpWithNaN() {
        assertThat(Seqs.partialCmp(Seqs.fromArray(1.0, Double.NaN), Seqs.fromArray(1.0, 2.0))).isEmpty();
        assertThat(Seqs.partialCmp(Seqs.fromArray(Double.NaN), Seqs.fromArray(Double.NaN))).isEmpty();
        assertThat(Seqs.partialCmp(Seqs.fromArray(0.0, Double.NaN), Seqs.fromArray(1.0, 2.0))).contains(Ordering.LESS);
    }
    
    @Test
    void testPartialCmpBy() {
        Seq.PartialComparator<Integer> evensOnly = (a, b) -> a % 2 == 0 && b % 2 == 0
            ? Optional.of(Ordering.of(Integer.compare(a, b)))
            : Optional.empty();
        assertThat(Seqs.fromArray(2, 4).partialCmpBy(Seqs.fromArray(2, 6), evensOnly)).contains(Ordering.LESS);
        assertThat(Seqs.fromArray(2, 3).partialCmpBy(Seqs.fromArray(2, 6), evensOnly)).isEmpty();
    }
    
    @Test
    void testRelationalComparisons() {
        assertThat(Seqs.lt(Seqs.range(0, 2), Seqs.range(0, 10))).isTrue();
        assertThat(Seqs.le(Seqs.range(0, 2), Seqs.range(0, 2))).isTrue();
        assertThat(Seqs.gt(Seqs.range(0, 2), Seqs.range(0, 10))).isFalse();
        assertThat(Seqs.ge(Seqs.range(0, 10), Seqs.range(0, 2))).isTrue();
    }
    
    @Test
    void testRelationalComparisonsAreFalseWhenIncomparable() {
        assertThat(Seqs.lt(Seqs.fromArray(Double.NaN), Seqs.fromArray(1.0))).isFalse();
        assertThat(Seqs.le(Seqs.fromArray(Double.NaN), Seqs.fromArray(1.0))).isFalse();
        assertThat(Seqs.gt(Seqs.fromArray(Double.NaN), Seqs.fromArray(1.0))).isFalse();
        assertThat(Seqs.ge(Seqs.fromArray(Double.NaN), Seqs.fromArray(1.0))).isFalse();
    }
    
    @Test
    void testSignedZerosAreEqual() {
        assertThat(Seqs.partialCmp(Seqs.fromArray(-0.0), Seqs.fromArray(0.0))).contains(Ordering.EQUAL);
        assertThat(Seqs.lt(Seqs.fromArray(-0.0), Seqs.fromArray(0.0))).isFalse();
        assertThat(Seqs.le(Seqs.fromArray(-0.0), Seqs.fromArray(0.0))).isTrue();
        assertThat(Seqs.fromArray(-0.0f).eq(Seqs.fromArray(0.0f))).isTrue();
        assertThat(Seqs.fromArray(1.0, -0.0).eq(Seqs.fromArray(1.0, 0.0))).isTrue();
    }
    
    @Test
    void testNaNIsNeverEqual() {
        assertThat(Seqs.fromArray(Double.NaN).eq(Seqs.fromArray(Double.NaN))).isFalse();
        assertThat(Seqs.fromArray(Float.NaN).ne(Seqs.fromArray(Float.NaN))).isTrue();
        assertThat(Seqs.le(Seqs.fromArray(Double.NaN), Seqs.fromArray(Double.NaN))).isFalse();
    }
    
    @Test
    void testEqAndNe() {
        assertThat(Seqs.range(0, 3).eq(Seqs.fromArray(0, 1, 2))).isTrue();
        assertThat(Seqs.range(0, 3).eq(Seqs.fromArray(0, 1))).isFalse();
        assertThat(Seqs.range(0, 3).ne(Seqs.fromArray(0, 1, 3))).isTrue();
        assertThat(Seqs.fromArray("A", "b").eqBy(Seqs.fromArray("a", "B"), String::equalsIgnoreCase)).isTrue();
    }
    
    @Test
    void testIterator() {
        Iterator<Integer> iterator = Seqs.range(0, 2).iterator();
        assertThat(iterator.hasNext()).isTrue();
        assertThat(iterator.hasNext()).isTrue();
        assertThat(iterator.next()).isEqualTo(0);
        assertThat(iterator.next()).isEqualTo(1);
        assertThat(iterator.hasNext()).isFalse();
        assertThatThrownBy(iterator::next).isInstanceOf(NoSuchElementException.class);
    }
    
    @Test
    void testStream() {
        List<Integer> list = Seqs.range(0, 5).stream().map(i -> i * 2).collect(Collectors.toList());
        assertThat(list).containsExactly(0, 2, 4, 6, 8);
    }
}
