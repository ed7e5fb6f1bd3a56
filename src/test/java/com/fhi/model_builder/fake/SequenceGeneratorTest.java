package com.fhi.model_builder.fake;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.junit.jupiter.api.Test;


class SequenceGeneratorTest
{
    @Test
    void counterNeverEnds()
    {
        SequenceGenerator<Long> generator = new SequenceGenerator<>("counter", () -> Sequences.counter(5, 10));

        assertEquals(5L,  generator.next());
        assertEquals(15L, generator.next());
        assertEquals(25L, generator.get());
        assertEquals(0, generator.getRestarts());
    }

    @Test
    void finiteSequenceRestartsWhenExhausted()
    {
        SequenceGenerator<Long> generator = new SequenceGenerator<>("range", () -> Sequences.range(1, 4));

        List<Long> values = List.of(generator.next(), generator.next(), generator.next(),
                                    generator.next(), generator.next());

        assertEquals(List.of(1L, 2L, 3L, 1L, 2L), values);
        assertEquals(1, generator.getRestarts());
        assertEquals("range", generator.getKind());
    }

    @Test
    void resetStartsOver()
    {
        SequenceGenerator<Long> generator = new SequenceGenerator<>("range", () -> Sequences.range(1, 3));
        generator.next();
        generator.next();
        generator.next();

        generator.reset();

        assertEquals(1L, generator.next());
        assertEquals(0, generator.getRestarts());
    }

    @Test
    void emptySequenceFails()
    {
        SequenceGenerator<String> generator = new SequenceGenerator<>("empty", Collections::emptyIterator);

        IllegalStateException e = assertThrows(IllegalStateException.class, generator::next);
        assertThat(e.getMessage()).contains("empty");
    }

    @Test
    void productVariesTheLastListFastest()
    {
        Iterator<List<String>> product = Sequences.product(List.of("a", "b"), List.of("x", "y", "z"));

        assertEquals(List.of("a", "x"), product.next());
        assertEquals(List.of("a", "y"), product.next());
        assertEquals(List.of("a", "z"), product.next());
        assertEquals(List.of("b", "x"), product.next());
        assertEquals(List.of("b", "y"), product.next());
        assertEquals(List.of("b", "z"), product.next());
        assertFalse(product.hasNext());
        assertThrows(NoSuchElementException.class, product::next);
    }

    @Test
    void productOfAnEmptyListIsEmpty()
    {
        assertFalse(Sequences.product(List.of("a"), List.<String>of()).hasNext());
        assertFalse(Sequences.<String>product().hasNext());
    }

    @Test
    void rangeStopsBeforeItsEnd()
    {
        Iterator<Long> range = Sequences.range(7, 9);

        assertEquals(7L, range.next());
        assertEquals(8L, range.next());
        assertFalse(range.hasNext());
    }
}
