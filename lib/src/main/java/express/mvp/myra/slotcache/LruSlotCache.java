package express.mvp.myra.slotcache;

import java.lang.ref.Reference;
import java.lang.ref.WeakReference;
import java.util.Arrays;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed-size slot table with weak buffer references and least-recently-used replacement.
 *
 * <p>The table is a pair of parallel arrays indexed by slot: a weak reference to the buffer held
 * in the slot and the recency value issued when the slot was last hit or filled. A single counter
 * issues recency values; it starts at 1 so a recency of 0 marks a slot never used.
 *
 * <h2>Slot States</h2>
 *
 * <p>The state of a slot is not stored but derived on each scan:
 *
 * <ul>
 *   <li><b>Never used:</b> no reference, recency 0
 *   <li><b>Live:</b> the reference still resolves to a buffer
 *   <li><b>Stale:</b> the buffer was collected or invalidated; the slot never matches a lookup but
 *       keeps its recency and competes for eviction like any other slot
 * </ul>
 *
 * <h2>Replacement</h2>
 *
 * <p>Both lookup and replacement are linear scans. The capacity is bounded by the remote table
 * (typically 64), so no ordering structure is kept. The victim is the slot with the smallest
 * recency; the strict comparison makes the lowest index win ties.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Not thread-safe. Confine each instance to the thread that composes frames for its target, or
 * wrap it in {@link SynchronizedSlotCache}.
 *
 * @param <B> the buffer type
 */
public final class LruSlotCache<B> implements SlotCache<B> {

    private static final Logger LOGGER = Logger.getLogger(LruSlotCache.class.getName());

    /** Recency of a slot that has not been used since creation or the last reset. */
    static final long NEVER_USED = 0L;

    private final String name;
    private final Function<? super B, ? extends Reference<B>> referenceFactory;

    /** Weak reference per slot, null when the slot holds nothing. */
    private final Reference<B>[] buffers;

    /** Recency value per slot. */
    private final long[] recency;

    /** Next recency value to issue. */
    private long counter = 1;

    private long hits;
    private long misses;
    private long fills;
    private long staleReclaims;
    private long evictions;

    /**
     * Creates a cache with the given number of slots.
     *
     * @param capacity the slot count
     * @throws IllegalArgumentException if capacity is not positive
     */
    public LruSlotCache(int capacity) {
        this(SlotCacheConfig.DEFAULT_NAME, capacity, WeakReference::new);
    }

    /**
     * Creates a cache from a configuration. The {@code threadSafe} flag is ignored here; use
     * {@link SlotCaches#create(SlotCacheConfig)} to honor it.
     *
     * @param config the configuration
     */
    public LruSlotCache(SlotCacheConfig config) {
        this(config.name(), config.capacity(), WeakReference::new);
    }

    /**
     * Creates a cache whose slot references come from {@code referenceFactory}.
     *
     * @param name the name used in logs
     * @param capacity the slot count
     * @param referenceFactory creates the non-owning reference stored for a buffer
     */
    LruSlotCache(
            String name, int capacity, Function<? super B, ? extends Reference<B>> referenceFactory) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.referenceFactory = Objects.requireNonNull(referenceFactory, "referenceFactory");
        @SuppressWarnings("unchecked")
        Reference<B>[] slots = (Reference<B>[]) new Reference<?>[capacity];
        this.buffers = slots;
        this.recency = new long[capacity];
    }

    @Override
    public SlotAssignment<B> resolve(B buffer) {
        Objects.requireNonNull(buffer, "buffer");

        int slot = findSlot(buffer);
        if (slot >= 0) {
            recency[slot] = nextCounter();
            hits++;
            if (LOGGER.isLoggable(Level.FINEST)) {
                LOGGER.finest(name + ": hit slot " + slot);
            }
            return SlotAssignment.hit(slot);
        }

        slot = leastRecentlyUsedSlot();
        Reference<B> previous = buffers[slot];
        if (previous == null && recency[slot] == NEVER_USED) {
            fills++;
        } else if (previous == null || previous.refersTo(null)) {
            staleReclaims++;
        } else {
            evictions++;
        }
        misses++;

        buffers[slot] = referenceFactory.apply(buffer);
        recency[slot] = nextCounter();
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest(name + ": miss, storing buffer in slot " + slot);
        }
        return SlotAssignment.miss(slot, buffer);
    }

    @Override
    public OptionalInt slotOf(B buffer) {
        Objects.requireNonNull(buffer, "buffer");
        int slot = findSlot(buffer);
        return slot >= 0 ? OptionalInt.of(slot) : OptionalInt.empty();
    }

    @Override
    public OptionalInt invalidate(B buffer) {
        Objects.requireNonNull(buffer, "buffer");
        int slot = findSlot(buffer);
        if (slot < 0) {
            return OptionalInt.empty();
        }
        buffers[slot] = null;
        LOGGER.log(Level.FINE, "{0}: invalidated slot {1}", new Object[] {name, slot});
        return OptionalInt.of(slot);
    }

    @Override
    public void reset() {
        Arrays.fill(buffers, null);
        Arrays.fill(recency, NEVER_USED);
        LOGGER.log(Level.FINE, "{0}: reset {1} slots", new Object[] {name, buffers.length});
    }

    @Override
    public int capacity() {
        return buffers.length;
    }

    @Override
    public int liveSlots() {
        int live = 0;
        for (Reference<B> ref : buffers) {
            if (ref != null && !ref.refersTo(null)) {
                live++;
            }
        }
        return live;
    }

    @Override
    public long counter() {
        return counter;
    }

    @Override
    public SlotCacheStats stats() {
        return new SlotCacheStats(
                hits, misses, fills, staleReclaims, evictions, liveSlots(), buffers.length);
    }

    /**
     * Returns the recency value recorded for a slot.
     *
     * @param slot the slot index
     * @return the recency value, 0 if never used
     */
    long recencyOf(int slot) {
        return recency[slot];
    }

    /**
     * Returns the configured name.
     *
     * @return the name
     */
    public String name() {
        return name;
    }

    /** Returns the slot whose reference resolves to {@code buffer}, or -1. */
    private int findSlot(B buffer) {
        for (int i = 0; i < buffers.length; i++) {
            Reference<B> ref = buffers[i];
            // refersTo compares without strongly reaching the referent
            if (ref != null && ref.refersTo(buffer)) {
                return i;
            }
        }
        return -1;
    }

    /** Returns the slot with the smallest recency, lowest index on ties. */
    private int leastRecentlyUsedSlot() {
        int victim = 0;
        long oldest = recency[0];
        for (int i = 1; i < recency.length; i++) {
            if (recency[i] < oldest) {
                oldest = recency[i];
                victim = i;
            }
        }
        return victim;
    }

    private long nextCounter() {
        return counter++;
    }

    @Override
    public String toString() {
        return "LruSlotCache[" + name + ", capacity=" + buffers.length + ", counter=" + counter
                + "]";
    }
}
