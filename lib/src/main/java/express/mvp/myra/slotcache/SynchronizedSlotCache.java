package express.mvp.myra.slotcache;

import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes all access to a delegate {@link SlotCache} behind one lock.
 *
 * <p>Replacement needs a consistent view of every slot's recency, so the whole table is guarded
 * by a single {@link ReentrantLock}; there is no per-slot locking. Prefer one unsynchronized cache
 * per composition thread where the threading model allows it.
 *
 * @param <B> the buffer type
 */
public final class SynchronizedSlotCache<B> implements SlotCache<B> {

    private final SlotCache<B> delegate;
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Wraps a cache. The delegate must not be used directly afterwards.
     *
     * @param delegate the cache to guard
     */
    public SynchronizedSlotCache(SlotCache<B> delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public SlotAssignment<B> resolve(B buffer) {
        lock.lock();
        try {
            return delegate.resolve(buffer);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public OptionalInt slotOf(B buffer) {
        lock.lock();
        try {
            return delegate.slotOf(buffer);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public OptionalInt invalidate(B buffer) {
        lock.lock();
        try {
            return delegate.invalidate(buffer);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            delegate.reset();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int capacity() {
        return delegate.capacity();
    }

    @Override
    public int liveSlots() {
        lock.lock();
        try {
            return delegate.liveSlots();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long counter() {
        lock.lock();
        try {
            return delegate.counter();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public SlotCacheStats stats() {
        lock.lock();
        try {
            return delegate.stats();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "SynchronizedSlotCache[" + delegate + "]";
    }
}
