package com.seedforge.core.seeds;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * 여러 시퀀스를 라운드로빈으로 하나씩 번갈아 꺼낸다.
 * 소진된 시퀀스는 순환에서 빠지고 나머지로 계속 돈다.
 * 지연 평가: 요청한 만큼만 입력을 소비한다.
 */
public final class Interleaver {
    private Interleaver() {}

    @SafeVarargs
    public static <T> Iterable<T> interleave(Iterable<? extends T>... sources) {
        return interleave(Arrays.asList(sources));
    }

    public static <T> Iterable<T> interleave(List<? extends Iterable<? extends T>> sources) {
        List<Iterable<? extends T>> snapshot = List.copyOf(sources);
        return () -> new RoundRobin<>(snapshot);
    }

    private static final class RoundRobin<T> implements Iterator<T> {
        private final List<Iterator<? extends T>> rotation = new ArrayList<>();
        private int cursor = 0;

        RoundRobin(List<Iterable<? extends T>> sources) {
            for (Iterable<? extends T> s : sources) rotation.add(s.iterator());
        }

        @Override public boolean hasNext() {
            // 빈 이터레이터를 만날 때마다 순환에서 제거
            while (!rotation.isEmpty()) {
                if (cursor >= rotation.size()) cursor = 0;
                if (rotation.get(cursor).hasNext()) return true;
                rotation.remove(cursor);
            }
            return false;
        }

        @Override public T next() {
            if (!hasNext()) throw new NoSuchElementException();
            T value = rotation.get(cursor).next();
            cursor++;
            return value;
        }
    }
}
