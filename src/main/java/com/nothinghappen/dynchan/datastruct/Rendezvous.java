package com.nothinghappen.dynchan.datastruct;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * An unbuffered, closeable handoff point. Each {@link #transfer(Object)} waits for a matching
 * take, and vice versa. Once closed, pending and later transfers fail and takes return null.
 *
 * <p>Any number of threads may transfer and take concurrently, transfers are served one at a time.
 *
 * @param <T> element type
 */
public class Rendezvous<T> {

    private final ReentrantLock transferLock = new ReentrantLock();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition given = lock.newCondition();
    private final Condition taken = lock.newCondition();

    private T element;
    private boolean closed;

    /**
     * hand an item over to a taker
     *
     * @return true once taken, false if closed before a taker showed up
     * @throws InterruptedException if interrupted before the item was taken, the item is withdrawn
     */
    public boolean transfer(T item) throws InterruptedException {
        Objects.requireNonNull(item);
        // one offer at a time, otherwise offers overwrite each other
        transferLock.lockInterruptibly();
        try {
            lock.lockInterruptibly();
            try {
                if (closed) {
                    return false;
                }
                element = item;
                given.signal();
                do {
                    try {
                        taken.await();
                    } catch (InterruptedException ex) {
                        if (element != null) {
                            element = null;
                            throw ex;
                        }
                        // taken in the meantime, keep the interrupt for the caller
                        Thread.currentThread().interrupt();
                        return true;
                    }
                    if (closed) {
                        boolean delivered = element == null;
                        element = null;
                        return delivered;
                    }
                } while (element != null);
                return true;
            } finally {
                lock.unlock();
            }
        } finally {
            transferLock.unlock();
        }
    }

    /**
     * wait for an item
     *
     * @return null if closed
     */
    public T take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (element == null && !closed) {
                given.await();
            }
            return closed ? null : release();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return null if closed or no transfer is waiting
     */
    public T poll() {
        lock.lock();
        try {
            return closed || element == null ? null : release();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return null if closed or nothing was handed over within the timeout
     */
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (element == null && !closed) {
                if (nanos <= 0) {
                    return null;
                }
                nanos = given.awaitNanos(nanos);
            }
            return closed ? null : release();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true if this call closed it, false if already closed
     */
    public boolean close() {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            closed = true;
            given.signalAll();
            taken.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    private T release() {
        T ret = element;
        element = null;
        taken.signal();
        return ret;
    }
}
