package com.nothinghappen.dynchan;

import com.nothinghappen.dynchan.datastruct.Buffer;
import com.nothinghappen.dynchan.datastruct.Buffers;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Fork(value = 1, jvmArgs = {"-server"})
@BenchmarkMode({Mode.Throughput})
@Warmup(iterations = 2, time = 10, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 4, time = 10, timeUnit = TimeUnit.SECONDS)
@State(Scope.Thread)
public class BufferBenchmark {

    @Param({
            "FIFO",
            "HEAP"
    })
    public String type;

    /**
     * items kept in the buffer between operations
     */
    @Param({
            "16",
            "65536"
    })
    public int depth;

    private Buffer<Integer> buffer;

    @Setup
    public void setup() {
        buffer = "FIFO".equals(type) ? Buffers.<Integer>fifo() : Buffers.<Integer>heap();
        for (int i = 0; i < depth; i++) {
            buffer.enqueue(ThreadLocalRandom.current().nextInt());
        }
    }

    @Benchmark
    public Integer enqueue_dequeue() throws InterruptedException {
        buffer.enqueue(ThreadLocalRandom.current().nextInt());
        return buffer.dequeue();
    }

}
