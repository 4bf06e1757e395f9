package com.nothinghappen.dynchan;

/**
 * A dynamic channel. Like a blocking queue handoff, but the buffer between the two ends grows
 * as needed, so sending never waits for a consumer.
 *
 * <p>Producers send through {@link #sender()} and close it when done. Consumers receive from
 * {@link #receiver()} and call {@link #close()} once they are no longer interested, even if the
 * producers are not finished.
 *
 * @param <T> element type
 */
public interface Chan<T> extends AutoCloseable {

    Sender<T> sender();

    Receiver<T> receiver();

    /**
     * Stop delivering. The receiver is closed right away, items still buffered are dropped.
     * Sends keep being accepted until the sender is closed. Calling it again does nothing.
     */
    @Override
    void close();

    boolean isCancelled();
}
