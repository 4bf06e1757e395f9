package com.nothinghappen.dynchan;

/**
 * write side of a {@link Chan}
 * @param <T>
 */
public interface Sender<T> extends AutoCloseable {

    /**
     * Hand an item to the chan. Only waits for the intake to pick it up, never for buffer space.
     *
     * @throws NullPointerException if item is null
     * @throws IllegalStateException if this sender has been closed
     */
    void send(T item) throws InterruptedException;

    /**
     * signal the end of input, must be called once the producers are done
     */
    @Override
    void close();

    boolean isClosed();
}
