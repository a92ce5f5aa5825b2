package com.seedforge.core.seeds;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class InterleaverTest {

    private static List<String> collect(Iterable<String> it) {
        List<String> out = new ArrayList<>();
        it.forEach(out::add);
        return out;
    }

    @Test
    void round_robin_skips_exhausted_sources() {
        List<String> out = collect(Interleaver.interleave(
                List.of("a1", "a2", "a3"), List.of("b1"), List.of("c1", "c2")));

        assertThat(out).containsExactly("a1", "b1", "c1", "a2", "c2", "a3");
    }

    @Test
    void output_length_is_sum_of_input_lengths() {
        List<List<String>> sources = List.of(List.of("x"), List.of(), List.of("y", "z"), List.of());
        assertThat(collect(Interleaver.interleave(sources))).hasSize(3);
    }

    @Test
    void per_source_order_is_preserved() {
        List<String> out = collect(Interleaver.interleave(
                List.of("a1", "a2", "a3", "a4"), List.of("b1", "b2")));

        assertThat(out.stream().filter(s -> s.startsWith("a"))).containsExactly("a1", "a2", "a3", "a4");
        assertThat(out.stream().filter(s -> s.startsWith("b"))).containsExactly("b1", "b2");
    }

    @Test
    void no_sources_yields_nothing() {
        Iterator<String> it = Interleaver.<String>interleave(List.<List<String>>of()).iterator();
        assertThat(it.hasNext()).isFalse();
        assertThatThrownBy(it::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void consumes_input_lazily() {
        AtomicInteger pulled = new AtomicInteger();
        Iterable<String> endless = () -> new Iterator<>() {
            @Override public boolean hasNext() { return true; }
            @Override public String next() { return "e" + pulled.incrementAndGet(); }
        };

        Iterator<String> it = Interleaver.interleave(endless, List.of("f1")).iterator();
        assertThat(it.next()).isEqualTo("e1");
        assertThat(it.next()).isEqualTo("f1");
        assertThat(it.next()).isEqualTo("e2");
        assertThat(it.next()).isEqualTo("e3");
        assertThat(pulled.get()).isEqualTo(3);
    }
}
