package io.avery.sequence;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PeekableTest {
    
    @Test
    void testPeekDoesNotConsume() {
        int[] pulls = { 0 };
        Seq.PeekableSequence<Integer> sequence = Seqs.peekable(Seqs.range(0, 3).andThen(Seqs.inspect(i -> pulls[0]++)));
        
        assertThat(sequence.peek()).isEqualTo(0);
        assertThat(sequence.peek()).isEqualTo(0);
        assertThat(pulls[0]).isEqualTo(1);
        assertThat(sequence.next()).isEqualTo(0);
        assertThat(sequence.next()).isEqualTo(1);
        assertThat(sequence.peek()).isEqualTo(2);
        assertThat(sequence.count()).isEqualTo(1);
    }
    
    @Test
    void testPeekAtEnd() {
        int[] pulls = { 0 };
        Seq.PeekableSequence<Integer> sequence = Seqs.peekable(() -> {
            pulls[0]++;
            return null;
        });
        
        assertThat(sequence.peek()).isNull();
        assertThat(sequence.peek()).isNull();
        assertThat(sequence.next()).isNull();
        assertThat(pulls[0]).isEqualTo(1);
    }
    
    @Test
    void testNextWithoutPeek() {
        Seq.PeekableSequence<String> sequence = Seqs.peekable(Seqs.fromArray("a", "b"));
        assertThat(sequence.next()).isEqualTo("a");
        assertThat(sequence.next()).isEqualTo("b");
        assertThat(sequence.next()).isNull();
        assertThat(sequence.peek()).isNull();
    }
    
    @Test
    void testCopyKeepsLookahead() {
        Seq.PeekableSequence<Integer> sequence = Seqs.peekable(Seqs.range(0, 3));
        assertThat(sequence.peek()).isEqualTo(0);
        
        Seq.PeekableSequence<Integer> copy = sequence.copy();
        assertThat(copy.next()).isEqualTo(0);
        assertThat(copy.peek()).isEqualTo(1);
        assertThat(sequence.next()).isEqualTo(0);
    }
}
