package com.nothinghappen.dynchan.datastruct;

import com.nothinghappen.dynchan.base.Awaits;
import com.nothinghappen.dynchan.base.ConcurrentTest;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Random;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

public class HeapBufferTest {

    @Test
    public void natural_order() throws InterruptedException {
        Buffer<Integer> heap = Buffers.heap();
        heap.enqueue(2);
        heap.enqueue(1);
        heap.enqueue(0);
        Assert.assertEquals(Integer.valueOf(0), heap.dequeue());
        Assert.assertEquals(Integer.valueOf(1), heap.dequeue());
        Assert.assertEquals(Integer.valueOf(2), heap.dequeue());
        heap.close();
        Assert.assertNull(heap.dequeue());
    }

    @Test
    public void reverse_order() throws InterruptedException {
        Buffer<Integer> heap = Buffers.heap(Comparator.<Integer>reverseOrder());
        heap.enqueue(0);
        heap.enqueue(2);
        heap.enqueue(1);
        Assert.assertEquals(Integer.valueOf(2), heap.dequeue());
        Assert.assertEquals(Integer.valueOf(1), heap.dequeue());
        Assert.assertEquals(Integer.valueOf(0), heap.dequeue());
    }

    @Test
    public void custom_comparator() throws InterruptedException {
        Buffer<String> heap = Buffers.heap(Comparator.comparingInt(String::length));
        heap.enqueue("ccc");
        heap.enqueue("a");
        heap.enqueue("bb");
        heap.close();
        Assert.assertEquals("a", heap.dequeue());
        Assert.assertEquals("bb", heap.dequeue());
        Assert.assertEquals("ccc", heap.dequeue());
        Assert.assertNull(heap.dequeue());
    }

    @Test
    public void duplicates() throws InterruptedException {
        Buffer<Integer> heap = Buffers.heap();
        int[] values = {5, 3, 5, 1, 3, 1, 5, 3};
        for (int v : values) {
            heap.enqueue(v);
        }
        heap.close();
        int[] expected = {1, 1, 3, 3, 3, 5, 5, 5};
        for (int e : expected) {
            Assert.assertEquals(Integer.valueOf(e), heap.dequeue());
        }
        Assert.assertNull(heap.dequeue());
    }

    @Test
    public void grows_past_initial_capacity() throws InterruptedException {
        Buffer<Integer> heap = Buffers.heap();
        for (int i = 999; i >= 0; i--) {
            heap.enqueue(i);
        }
        Assert.assertEquals(1000, heap.size());
        for (int i = 0; i < 1000; i++) {
            Assert.assertEquals(Integer.valueOf(i), heap.dequeue());
        }
        Assert.assertEquals(0, heap.size());
    }

    @Test
    public void capacity_clamped_near_int_max() {
        Assert.assertEquals(32, HeapBuffer.newCapacity(16));
        Assert.assertEquals(1 << 30, HeapBuffer.newCapacity(1 << 29));
        // doubling 2^30 would overflow
        Assert.assertEquals(HeapBuffer.MAX_CAPACITY, HeapBuffer.newCapacity(1 << 30));
        Assert.assertEquals(HeapBuffer.MAX_CAPACITY, HeapBuffer.newCapacity(HeapBuffer.MAX_CAPACITY - 1));
        try {
            HeapBuffer.newCapacity(HeapBuffer.MAX_CAPACITY);
            Assert.fail();
        } catch (OutOfMemoryError expected) {
            // full
        }
    }

    @Test
    public void random_interleaving() throws InterruptedException {
        Random random = new Random(42);
        Buffer<Integer> heap = Buffers.heap();
        PriorityQueue<Integer> reference = new PriorityQueue<>();
        for (int round = 0; round < 20_000; round++) {
            if (reference.isEmpty() || random.nextInt(3) != 0) {
                int v = random.nextInt(500);
                heap.enqueue(v);
                reference.add(v);
            } else {
                Assert.assertEquals(reference.poll(), heap.dequeue());
            }
            Assert.assertEquals(reference.size(), heap.size());
        }
        heap.close();
        while (!reference.isEmpty()) {
            Assert.assertEquals(reference.poll(), heap.dequeue());
        }
        Assert.assertNull(heap.dequeue());
    }

    @Test
    public void failing_comparator_leaves_heap_intact() throws InterruptedException {
        Buffer<Integer> heap = Buffers.heap((a, b) -> {
            if (a == 13 || b == 13) {
                throw new IllegalArgumentException("unlucky");
            }
            return Integer.compare(a, b);
        });
        heap.enqueue(4);
        heap.enqueue(2);
        heap.enqueue(8);
        try {
            heap.enqueue(13);
            Assert.fail();
        } catch (IllegalArgumentException expected) {
            // rejected
        }
        Assert.assertEquals(3, heap.size());
        heap.close();
        Assert.assertEquals(Integer.valueOf(2), heap.dequeue());
        Assert.assertEquals(Integer.valueOf(4), heap.dequeue());
        Assert.assertEquals(Integer.valueOf(8), heap.dequeue());
        Assert.assertNull(heap.dequeue());
    }

    @Test(expected = IllegalStateException.class)
    public void enqueue_after_close() {
        Buffer<Integer> heap = Buffers.heap();
        heap.close();
        heap.enqueue(1);
    }

    @Test
    public void dequeue_blocks_until_enqueue() throws Exception {
        Buffer<Integer> heap = Buffers.heap();
        AtomicReference<Thread> taker = new AtomicReference<>();
        Future<Integer>[] futures = ConcurrentTest.supplyAsync(1, () -> {
            taker.set(Thread.currentThread());
            return heap.dequeue();
        });
        Awaits.await().until(() -> taker.get() != null);
        Awaits.awaitBlocked(taker.get());
        Assert.assertFalse(futures[0].isDone());
        heap.enqueue(7);
        Assert.assertEquals(Integer.valueOf(7), ConcurrentTest.await(futures[0]));
    }

    @Test
    public void close_wakes_dequeue() throws Exception {
        Buffer<Integer> heap = Buffers.heap();
        AtomicReference<Thread> taker = new AtomicReference<>();
        Future<Integer>[] futures = ConcurrentTest.supplyAsync(1, () -> {
            taker.set(Thread.currentThread());
            return heap.dequeue();
        });
        Awaits.await().until(() -> taker.get() != null);
        Awaits.awaitBlocked(taker.get());
        heap.close();
        Assert.assertNull(ConcurrentTest.await(futures[0]));
    }

    @Test
    public void concurrent_enqueue_then_sorted_drain() throws Exception {
        Buffer<Integer> heap = Buffers.heap();
        ConcurrentTest.run(8, () -> {
            Random random = new Random();
            for (int i = 0; i < 2_000; i++) {
                heap.enqueue(random.nextInt(100_000));
            }
        });
        heap.close();
        List<Integer> drained = new ArrayList<>();
        Integer item;
        while ((item = heap.dequeue()) != null) {
            drained.add(item);
        }
        Assert.assertEquals(16_000, drained.size());
        for (int i = 1; i < drained.size(); i++) {
            Assert.assertTrue(drained.get(i - 1) <= drained.get(i));
        }
    }
}
