package com.nothinghappen.dynchan;

import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * read side of a {@link Chan}
 * @param <T>
 */
public interface Receiver<T> {

    /**
     * wait for the next item
     *
     * @return null once the chan is drained and closed, or cancelled
     */
    T receive() throws InterruptedException;

    /**
     * @return null if no item is ready right now
     */
    T poll();

    T poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * receive until closed
     *
     * @return number of items handed to the consumer
     */
    int drainTo(Consumer<? super T> consumer) throws InterruptedException;

    boolean isClosed();
}
