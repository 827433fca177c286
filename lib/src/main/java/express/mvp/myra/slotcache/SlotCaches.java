package express.mvp.myra.slotcache;

/**
 * Factory for slot cache instances.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * SlotCacheConfig config = SlotCacheConfig.builder()
 *     .capacity(64)
 *     .name("display-0/layer-3")
 *     .build();
 *
 * SlotCache<GraphicBuffer> cache = SlotCaches.create(config);
 * SlotAssignment<GraphicBuffer> assignment = cache.resolve(buffer);
 * }</pre>
 *
 * @see SlotCacheConfig
 * @see LruSlotCache
 */
public final class SlotCaches {

    /** Private constructor to prevent instantiation. All methods are static. */
    private SlotCaches() {
        // Utility class
    }

    /**
     * Creates a cache from a configuration, synchronized if the configuration asks for it.
     *
     * @param config the configuration
     * @param <B> the buffer type
     * @return a new, empty cache
     */
    public static <B> SlotCache<B> create(SlotCacheConfig config) {
        SlotCache<B> cache = new LruSlotCache<>(config);
        return config.threadSafe() ? new SynchronizedSlotCache<>(cache) : cache;
    }

    /**
     * Creates an unsynchronized cache with the given capacity.
     *
     * @param capacity the slot count
     * @param <B> the buffer type
     * @return a new, empty cache
     * @throws IllegalArgumentException if capacity is not positive
     */
    public static <B> SlotCache<B> create(int capacity) {
        return new LruSlotCache<>(capacity);
    }

    /**
     * Returns a view of {@code cache} that serializes every operation.
     *
     * @param cache the cache to guard
     * @param <B> the buffer type
     * @return the synchronized cache, or {@code cache} itself if already synchronized
     */
    public static <B> SlotCache<B> synchronizedCache(SlotCache<B> cache) {
        if (cache instanceof SynchronizedSlotCache) {
            return cache;
        }
        return new SynchronizedSlotCache<>(cache);
    }
}
