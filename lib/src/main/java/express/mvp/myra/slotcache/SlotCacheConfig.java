package express.mvp.myra.slotcache;

import java.util.Objects;

/**
 * Configuration for slot cache creation.
 *
 * <table border="1">
 *   <caption>Slot Cache Configuration Parameters</caption>
 *   <tr><th>Parameter</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>capacity</td><td>64</td><td>Number of slots, must match the remote cache</td></tr>
 *   <tr><td>name</td><td>slot-cache</td><td>Identifier used in logs</td></tr>
 *   <tr><td>threadSafe</td><td>false</td><td>Wrap in {@link SynchronizedSlotCache}</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * SlotCacheConfig config = SlotCacheConfig.builder()
 *     .capacity(32)
 *     .name("display-0")
 *     .build();
 *
 * SlotCache<GraphicBuffer> cache = SlotCaches.create(config);
 * }</pre>
 *
 * @see SlotCaches
 */
public final class SlotCacheConfig {

    /** Depth of the platform buffer queue, which bounds the remote slot table. */
    public static final int DEFAULT_CAPACITY = 64;

    /** Name used when none is configured. */
    public static final String DEFAULT_NAME = "slot-cache";

    private final int capacity;
    private final String name;
    private final boolean threadSafe;

    private SlotCacheConfig(Builder builder) {
        this.capacity = builder.capacity;
        this.name = builder.name;
        this.threadSafe = builder.threadSafe;
    }

    /**
     * Creates a new builder with default values.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a configuration with all defaults.
     *
     * @return default configuration
     */
    public static SlotCacheConfig defaults() {
        return builder().build();
    }

    /**
     * Returns the number of slots.
     *
     * @return the capacity
     */
    public int capacity() {
        return capacity;
    }

    /**
     * Returns the cache name.
     *
     * @return the name
     */
    public String name() {
        return name;
    }

    /**
     * Returns whether created caches are synchronized.
     *
     * @return true if caches are wrapped in {@link SynchronizedSlotCache}
     */
    public boolean threadSafe() {
        return threadSafe;
    }

    /**
     * Returns a builder initialized from this configuration.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        return new Builder().capacity(capacity).name(name).threadSafe(threadSafe);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SlotCacheConfig)) {
            return false;
        }
        SlotCacheConfig that = (SlotCacheConfig) o;
        return capacity == that.capacity && threadSafe == that.threadSafe && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(capacity, name, threadSafe);
    }

    @Override
    public String toString() {
        return "SlotCacheConfig[name=" + name + ", capacity=" + capacity + ", threadSafe="
                + threadSafe + "]";
    }

    /** Builder for {@link SlotCacheConfig}. */
    public static final class Builder {
        private int capacity = DEFAULT_CAPACITY;
        private String name = DEFAULT_NAME;
        private boolean threadSafe = false;

        private Builder() {}

        /**
         * Sets the number of slots.
         *
         * @param capacity the slot count, must equal the remote cache size
         * @return this builder
         * @throws IllegalArgumentException if capacity is not positive
         */
        public Builder capacity(int capacity) {
            if (capacity <= 0) {
                throw new IllegalArgumentException("capacity must be positive: " + capacity);
            }
            this.capacity = capacity;
            return this;
        }

        /**
         * Sets the cache name.
         *
         * @param name the name used in logs
         * @return this builder
         * @throws NullPointerException if name is null
         */
        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        /**
         * Sets whether created caches are synchronized.
         *
         * @param threadSafe true to serialize all access with a lock
         * @return this builder
         */
        public Builder threadSafe(boolean threadSafe) {
            this.threadSafe = threadSafe;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return a new configuration
         */
        public SlotCacheConfig build() {
            return new SlotCacheConfig(this);
        }
    }
}
