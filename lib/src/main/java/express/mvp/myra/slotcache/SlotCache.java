package express.mvp.myra.slotcache;

import java.util.OptionalInt;

/**
 * Client-side mirror of a remote buffer cache.
 *
 * <p>A remote consumer (for example a hardware composer) keeps a fixed table of buffer slots per
 * display or layer. When a buffer is announced the client either sends the buffer together with a
 * slot index, or only the slot index when the remote side already holds that buffer. A {@code
 * SlotCache} tracks what the remote table contains so the second form can be used whenever
 * possible.
 *
 * <h2>Identity and Ownership</h2>
 *
 * <p>Buffers are matched by reference identity, never by {@code equals}. The cache holds only weak
 * references: it never keeps a buffer alive. A buffer collected after being cached leaves a stale
 * slot which is reclaimed by normal LRU eviction.
 *
 * <h2>Remote Agreement</h2>
 *
 * <p>The local and remote tables must agree on {@link #capacity()} and must be reset together.
 * Call {@link #reset()} whenever the remote side's cache is invalidated, e.g. after reconnecting to
 * a new remote session.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Implementations are not required to be thread-safe; see {@link SynchronizedSlotCache}.
 *
 * @param <B> the buffer type
 * @see LruSlotCache
 * @see SlotCaches
 */
public interface SlotCache<B> {

    /**
     * Returns the slot to use for {@code buffer} and whether its content must be transmitted.
     *
     * <p>On a hit the slot's recency is refreshed and the assignment carries no payload. On a miss
     * the least recently used slot (lowest index on ties) is overwritten with the buffer and the
     * assignment carries the buffer. Every call advances the recency counter by exactly one.
     *
     * @param buffer the buffer to announce
     * @return the slot assignment, never null
     * @throws NullPointerException if buffer is null
     */
    SlotAssignment<B> resolve(B buffer);

    /**
     * Returns the slot currently holding {@code buffer} without touching recency.
     *
     * @param buffer the buffer to look up
     * @return the slot index, or empty if the buffer is not cached
     * @throws NullPointerException if buffer is null
     */
    OptionalInt slotOf(B buffer);

    /**
     * Forgets a buffer that the owner is about to destroy.
     *
     * <p>The slot keeps its recency value and is treated exactly like a slot whose buffer was
     * collected. The counter is not advanced.
     *
     * @param buffer the buffer to forget
     * @return the slot that held the buffer, or empty if it was not cached
     * @throws NullPointerException if buffer is null
     */
    OptionalInt invalidate(B buffer);

    /**
     * Empties every slot, as when the remote cache has been discarded.
     *
     * <p>Slots are handed out again from index 0 upward. The recency counter is not reset.
     */
    void reset();

    /**
     * Returns the number of slots.
     *
     * @return the fixed capacity
     */
    int capacity();

    /**
     * Returns the number of slots whose buffer is still reachable.
     *
     * @return live slot count in {@code [0, capacity]}
     */
    int liveSlots();

    /**
     * Returns the counter value the next {@link #resolve(Object)} will issue.
     *
     * @return the next recency value, 1 for a fresh cache
     */
    long counter();

    /**
     * Returns a snapshot of lookup statistics.
     *
     * @return the current statistics
     */
    SlotCacheStats stats();
}
