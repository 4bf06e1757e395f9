package com.nothinghappen.dynchan;

import com.nothinghappen.dynchan.datastruct.Buffer;

/**
 * shortcuts for {@link ChanBuilder} with default settings
 */
public final class Chans {

    private Chans() { }

    /**
     * a chan with a FIFO buffer
     */
    public static <T> Chan<T> newChan() {
        return ChanBuilder.newBuilder().build();
    }

    /**
     * a chan over the given buffer, e.g. {@code Buffers.heap()} for priority order
     */
    public static <T> Chan<T> newChan(Buffer<T> buffer) {
        return ChanBuilder.newBuilder().build(buffer);
    }
}
