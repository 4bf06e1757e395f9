package com.nothinghappen.dynchan.datastruct;

/**
 * A dynamically sized buffer sitting between the intake and the outtake of a chan.
 * Implementations decide the order in which items come out.
 *
 * @param <T> element type
 */
public interface Buffer<T> {

    /**
     * add an item, never waits for space
     *
     * @throws NullPointerException if item is null
     * @throws IllegalStateException if the buffer has been closed
     */
    void enqueue(T item);

    /**
     * remove and return the next item.
     * Blocks while the buffer is empty and not closed.
     *
     * @return null if the buffer is empty and closed
     */
    T dequeue() throws InterruptedException;

    /**
     * no more items will be added, wakes up every blocked {@link #dequeue()}
     */
    void close();

    int size();

    boolean isClosed();

}
