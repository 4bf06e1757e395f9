package com.nothinghappen.dynchan.datastruct;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * An unbounded priority buffer backed by a binary min-heap.
 * The least element according to the comparator is always dequeued first,
 * elements that compare equal come out in no particular order.
 *
 * <p>The heap lives in a dense array, the children of node {@code i} are at
 * {@code 2i + 1} and {@code 2i + 2}.
 *
 * @param <T> element type
 */
public class HeapBuffer<T> implements Buffer<T> {

    private static final int INITIAL_CAPACITY = 16;

    static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Comparator<? super T> comparator;

    private Object[] items = new Object[INITIAL_CAPACITY];
    private int size;
    private boolean closed;

    public HeapBuffer(Comparator<? super T> comparator) {
        this.comparator = Objects.requireNonNull(comparator);
    }

    @Override
    public void enqueue(T item) {
        Objects.requireNonNull(item);
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("enqueue on closed buffer");
            }
            if (size == items.length) {
                grow();
            }
            siftUp(size, item);
            size++;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public T dequeue() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (size == 0 && !closed) {
                notEmpty.await();
            }
            if (size == 0) {
                return null;
            }
            T root = elementAt(0);
            int last = --size;
            T moved = elementAt(last);
            items[last] = null;
            if (last > 0) {
                siftDown(0, moved);
            }
            return root;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Place item, logically appended at i, on its way up to the root: it stops below the
     * first parent that is less than it. Comparisons run before any slot is touched so a
     * failing comparator leaves the heap as it was.
     */
    private void siftUp(int i, T item) {
        int target = i;
        while (target > 0) {
            int parent = (target - 1) >>> 1;
            if (less(elementAt(parent), item)) {
                break;
            }
            target = parent;
        }
        while (i > target) {
            int parent = (i - 1) >>> 1;
            items[i] = items[parent];
            i = parent;
        }
        items[target] = item;
    }

    /**
     * Place item, logically sitting at the hole i, on its way down to the leaves: the smaller
     * child moves up into the hole (right only when strictly less than left) until item is
     * less than that child or no child is left.
     */
    private void siftDown(int i, T item) {
        for (;;) {
            int left = (i << 1) + 1;
            if (left >= size) {
                break;
            }
            int child = left;
            int right = left + 1;
            if (right < size && less(elementAt(right), elementAt(left))) {
                child = right;
            }
            if (less(item, elementAt(child))) {
                break;
            }
            items[i] = items[child];
            i = child;
        }
        items[i] = item;
    }

    private void grow() {
        items = Arrays.copyOf(items, newCapacity(items.length));
    }

    /**
     * doubles, clamped to MAX_CAPACITY
     */
    static int newCapacity(int capacity) {
        if (capacity >= MAX_CAPACITY) {
            throw new OutOfMemoryError("heap buffer cannot grow beyond " + MAX_CAPACITY + " items");
        }
        return capacity > MAX_CAPACITY >>> 1 ? MAX_CAPACITY : capacity << 1;
    }

    private boolean less(T a, T b) {
        return comparator.compare(a, b) < 0;
    }

    private T elementAt(int i) {
        return (T) items[i];
    }
}
