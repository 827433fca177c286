package express.mvp.myra.slotcache;

import java.util.Locale;

/**
 * Immutable snapshot of slot cache statistics.
 *
 * <p>Every miss lands in exactly one of three kinds of slot, so {@code fills + staleReclaims +
 * evictions == misses}:
 *
 * <ul>
 *   <li><b>fills:</b> a slot never used since creation or the last reset
 *   <li><b>staleReclaims:</b> a slot whose buffer was collected or invalidated
 *   <li><b>evictions:</b> a slot whose buffer was still alive and got displaced
 * </ul>
 *
 * <p>A high eviction count means the remote side keeps receiving buffers it recently dropped; the
 * capacity is too small for the working set.
 *
 * @param hits lookups answered from the cache
 * @param misses lookups that required a transmit
 * @param fills misses stored into never-used slots
 * @param staleReclaims misses stored into slots whose buffer was gone
 * @param evictions misses that displaced a live buffer
 * @param liveSlots slots currently holding a reachable buffer
 * @param capacity total number of slots
 * @see SlotCache#stats()
 */
public record SlotCacheStats(
        long hits,
        long misses,
        long fills,
        long staleReclaims,
        long evictions,
        int liveSlots,
        int capacity) {

    /**
     * Returns the total number of lookups.
     *
     * @return hits plus misses
     */
    public long lookups() {
        return hits + misses;
    }

    /**
     * Returns the hit rate as a ratio between 0.0 and 1.0.
     *
     * @return hit rate (0.0 if no lookups happened)
     */
    public double hitRate() {
        long lookups = lookups();
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }

    /**
     * Returns the miss rate as a ratio between 0.0 and 1.0.
     *
     * @return miss rate (0.0 if no lookups happened)
     */
    public double missRate() {
        long lookups = lookups();
        return lookups == 0 ? 0.0 : (double) misses / lookups;
    }

    /**
     * Returns the fraction of slots holding a live buffer.
     *
     * @return occupancy ratio (0.0 for a zero capacity)
     */
    public double occupancy() {
        return capacity == 0 ? 0.0 : (double) liveSlots / capacity;
    }

    @Override
    public String toString() {
        return String.format(
                Locale.ROOT,
                "SlotCacheStats[hits=%d, misses=%d, fills=%d, staleReclaims=%d, evictions=%d, live=%d/%d, hitRate=%.1f%%]",
                hits,
                misses,
                fills,
                staleReclaims,
                evictions,
                liveSlots,
                capacity,
                hitRate() * 100);
    }
}
