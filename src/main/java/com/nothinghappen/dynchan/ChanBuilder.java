package com.nothinghappen.dynchan;

import com.nothinghappen.dynchan.datastruct.Buffer;
import com.nothinghappen.dynchan.datastruct.Buffers;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

public class ChanBuilder {

    private static final AtomicInteger CHAN_SEQ = new AtomicInteger();

    public static ChanBuilder newBuilder() {
        return new ChanBuilder();
    }

    private String name;

    private Executor relayBackend;

    /**
     * used in relay thread names and log lines, "dynchan-N" by default
     */
    public ChanBuilder setName(String name) {
        this.name = name;
        return this;
    }

    /**
     * Runs the two long-lived relay tasks of every chan built. It must be able to run both at
     * once, an executor with fewer free threads stalls the chan. By default each task gets its
     * own daemon thread.
     */
    public ChanBuilder setRelayBackend(Executor relayBackend) {
        this.relayBackend = relayBackend;
        return this;
    }

    /**
     * a chan with a FIFO buffer
     */
    public <T> Chan<T> build() {
        return build(Buffers.<T>fifo());
    }

    public <T> Chan<T> build(Buffer<T> buffer) {
        Objects.requireNonNull(buffer);
        String chanName = name != null ? name : "dynchan-" + CHAN_SEQ.incrementAndGet();
        Executor backend = relayBackend != null ? relayBackend : new DaemonThreadExecutor(chanName);
        ChanImpl<T> chan = new ChanImpl<>(chanName, buffer, backend);
        chan.startRelays();
        return chan;
    }

    static class DaemonThreadExecutor implements Executor {

        private final String prefix;
        private final AtomicInteger threadSeq = new AtomicInteger();

        DaemonThreadExecutor(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public void execute(Runnable command) {
            Thread thread = new Thread(command, prefix + "-relay-" + threadSeq.getAndIncrement());
            thread.setDaemon(true);
            thread.start();
        }
    }
}
