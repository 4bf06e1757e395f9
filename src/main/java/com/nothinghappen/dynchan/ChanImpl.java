package com.nothinghappen.dynchan;

import com.nothinghappen.dynchan.annotations.RunIn;
import com.nothinghappen.dynchan.datastruct.Buffer;
import com.nothinghappen.dynchan.datastruct.Rendezvous;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

class ChanImpl<T> implements Chan<T> {

    private final Logger LOGGER = LoggerFactory.getLogger(ChanImpl.class);

    final String name;

    final Buffer<T> buffer;

    /**
     * sender -> intake
     */
    final Rendezvous<T> in = new Rendezvous<>();

    /**
     * outtake -> receiver
     */
    final Rendezvous<T> out = new Rendezvous<>();

    final AtomicBoolean cancelled = new AtomicBoolean();

    final Executor relayBackend;

    final Sender<T> sender = new ChanSender();

    final Receiver<T> receiver = new ChanReceiver();

    ChanImpl(String name, Buffer<T> buffer, Executor relayBackend) {
        this.name = Objects.requireNonNull(name);
        this.buffer = Objects.requireNonNull(buffer);
        this.relayBackend = Objects.requireNonNull(relayBackend);
    }

    @Override
    public Sender<T> sender() {
        return sender;
    }

    @Override
    public Receiver<T> receiver() {
        return receiver;
    }

    @Override
    @RunIn("consumer")
    public void close() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        LOGGER.debug("{} cancelled, {} buffered items dropped", name, buffer.size());
        out.close();
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    void startRelays() {
        try {
            relayBackend.execute(new Intake());
            relayBackend.execute(new Outtake());
        } catch (RejectedExecutionException ex) {
            LOGGER.error(name + " relay rejected", ex);
            // a started intake winds down and closes the buffer on its own
            in.close();
            out.close();
            throw ex;
        }
    }

    /**
     * drains the sender into the buffer
     */
    class Intake implements Runnable {

        @Override
        @RunIn("intake")
        public void run() {
            LOGGER.debug("{} intake started", name);
            try {
                T item;
                while ((item = in.take()) != null) {
                    buffer.enqueue(item);
                }
                LOGGER.debug("{} end of input", name);
            } catch (InterruptedException ex) {
                LOGGER.error(name + " intake interrupted", ex);
                Thread.currentThread().interrupt();
            } catch (RuntimeException ex) {
                LOGGER.error(name + " intake failed", ex);
            } catch (Error ex) {
                LOGGER.error(name + " intake failed", ex);
                throw ex;
            } finally {
                // no taker is left for later sends
                in.close();
                buffer.close();
            }
        }
    }

    /**
     * drains the buffer into the receiver
     */
    class Outtake implements Runnable {

        @Override
        @RunIn("outtake")
        public void run() {
            LOGGER.debug("{} outtake started", name);
            try {
                T item;
                while ((item = buffer.dequeue()) != null) {
                    if (!out.transfer(item)) {
                        LOGGER.debug("{} outtake stopped by cancel", name);
                        return;
                    }
                }
                LOGGER.debug("{} drained", name);
            } catch (InterruptedException ex) {
                LOGGER.error(name + " outtake interrupted", ex);
                Thread.currentThread().interrupt();
            } catch (RuntimeException ex) {
                LOGGER.error(name + " outtake failed", ex);
            } catch (Error ex) {
                LOGGER.error(name + " outtake failed", ex);
                throw ex;
            } finally {
                out.close();
            }
        }
    }

    class ChanSender implements Sender<T> {

        @Override
        @RunIn("producer")
        public void send(T item) throws InterruptedException {
            Objects.requireNonNull(item);
            if (!in.transfer(item)) {
                throw new IllegalStateException("send on closed chan " + name);
            }
        }

        @Override
        @RunIn("producer")
        public void close() {
            if (in.close()) {
                LOGGER.debug("{} sender closed", name);
            }
        }

        @Override
        public boolean isClosed() {
            return in.isClosed();
        }
    }

    class ChanReceiver implements Receiver<T> {

        @Override
        @RunIn("consumer")
        public T receive() throws InterruptedException {
            return out.take();
        }

        @Override
        @RunIn("consumer")
        public T poll() {
            return out.poll();
        }

        @Override
        @RunIn("consumer")
        public T poll(long timeout, TimeUnit unit) throws InterruptedException {
            return out.poll(timeout, unit);
        }

        @Override
        @RunIn("consumer")
        public int drainTo(Consumer<? super T> consumer) throws InterruptedException {
            Objects.requireNonNull(consumer);
            int count = 0;
            T item;
            while ((item = out.take()) != null) {
                consumer.accept(item);
                count++;
            }
            return count;
        }

        @Override
        public boolean isClosed() {
            return out.isClosed();
        }
    }
}
