package com.nothinghappen.dynchan;

import com.nothinghappen.dynchan.datastruct.Buffers;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Group;
import org.openjdk.jmh.annotations.GroupThreads;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;

import java.util.concurrent.TimeUnit;

@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Fork(value = 1, jvmArgs = {"-server"})
@BenchmarkMode({Mode.Throughput})
@Warmup(iterations = 2, time = 10, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 4, time = 10, timeUnit = TimeUnit.SECONDS)
@State(Scope.Group)
public class ChanBenchmark {

    @Param({
            "FIFO",
            "HEAP"
    })
    public String type;

    private Chan<Long> chan;

    private long seq;

    @Setup(Level.Iteration)
    public void setup() {
        chan = "FIFO".equals(type) ? Chans.<Long>newChan() : Chans.newChan(Buffers.<Long>heap());
    }

    @TearDown(Level.Iteration)
    public void tearDown() {
        chan.close();
        chan.sender().close();
    }

    @Benchmark
    @Group("send_receive")
    @GroupThreads(1)
    public void send() throws InterruptedException {
        chan.sender().send(seq++);
    }

    @Benchmark
    @Group("send_receive")
    @GroupThreads(1)
    public Long receive() {
        return chan.receiver().poll();
    }

}
