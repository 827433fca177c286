package express.mvp.myra.slotcache.benchmark;

import express.mvp.myra.slotcache.LruSlotCache;
import express.mvp.myra.slotcache.SlotAssignment;
import express.mvp.myra.slotcache.SlotCache;
import express.mvp.myra.slotcache.SlotCaches;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

/**
 * Micro-benchmark of {@link SlotCache#resolve(Object)}.
 *
 * <p>Three workloads over a 64-slot cache:
 *
 * <ul>
 *   <li><b>hit:</b> triple-buffered swapchain, the working set always fits
 *   <li><b>miss:</b> working set one larger than capacity, so strict LRU misses every call
 *   <li><b>synchronized hit:</b> the hit workload behind {@link SlotCaches#synchronizedCache}
 * </ul>
 *
 * <p>Both lookup and replacement scan every slot, so the miss workload shows the worst case.
 */
@BenchmarkMode(Mode.SampleTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Thread)
@Warmup(iterations = 3, time = 5, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 5, timeUnit = TimeUnit.SECONDS)
@Fork(value = 1)
public class SlotCacheBenchmark {

    @Param({"64"})
    public int capacity;

    private SlotCache<Object> cache;
    private SlotCache<Object> synchronizedCache;

    private Object[] swapchain;
    private Object[] overflow;

    private int swapIndex;
    private int overflowIndex;

    @Setup(Level.Trial)
    public void setup() {
        cache = new LruSlotCache<>(capacity);
        synchronizedCache = SlotCaches.synchronizedCache(new LruSlotCache<>(capacity));

        swapchain = new Object[3];
        for (int i = 0; i < swapchain.length; i++) {
            swapchain[i] = new Object();
        }

        overflow = new Object[capacity + 1];
        for (int i = 0; i < overflow.length; i++) {
            overflow[i] = new Object();
        }
    }

    @Benchmark
    public SlotAssignment<Object> resolve_hit() {
        Object buffer = swapchain[swapIndex];
        swapIndex = (swapIndex + 1) % swapchain.length;
        return cache.resolve(buffer);
    }

    @Benchmark
    public SlotAssignment<Object> resolve_miss() {
        Object buffer = overflow[overflowIndex];
        overflowIndex = (overflowIndex + 1) % overflow.length;
        return cache.resolve(buffer);
    }

    @Benchmark
    public SlotAssignment<Object> resolve_synchronizedHit() {
        Object buffer = swapchain[swapIndex];
        swapIndex = (swapIndex + 1) % swapchain.length;
        return synchronizedCache.resolve(buffer);
    }
}
