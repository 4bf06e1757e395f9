package com.nothinghappen.dynchan.datastruct;

import java.util.Comparator;

public final class Buffers {

    private Buffers() { }

    /**
     * first in, first out. The default buffer of a chan.
     */
    public static <T> Buffer<T> fifo() {
        return new FifoBuffer<>();
    }

    /**
     * priority queue, the least element in natural order comes out first
     */
    public static <T extends Comparable<? super T>> Buffer<T> heap() {
        return new HeapBuffer<>(Comparator.<T>naturalOrder());
    }

    /**
     * priority queue, the least element according to comparator comes out first
     */
    public static <T> Buffer<T> heap(Comparator<? super T> comparator) {
        return new HeapBuffer<>(comparator);
    }
}
