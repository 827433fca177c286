package express.mvp.myra.slotcache.mirror;

import express.mvp.myra.slotcache.SlotAssignment;
import express.mvp.myra.slotcache.SlotCache;
import express.mvp.myra.slotcache.SlotCacheConfig;
import express.mvp.myra.slotcache.SlotCaches;
import express.mvp.myra.slotcache.lifecycle.SessionState;
import express.mvp.myra.slotcache.lifecycle.SessionStateListener;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One slot cache per remote target, reset together with the remote side.
 *
 * <p>The remote consumer keeps a separate slot table for every display output and every layer.
 * This registry keeps the matching local mirrors keyed by target, creates them lazily from a
 * shared {@link SlotCacheConfig}, and resets all of them whenever the remote session starts or
 * ends.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * SlotCacheRegistry<LayerId, GraphicBuffer> registry =
 *         new SlotCacheRegistry<>(SlotCacheConfig.defaults());
 * session.addListener(registry);
 *
 * SlotAssignment<GraphicBuffer> assignment = registry.resolve(layerId, buffer);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>The target map is thread-safe. The per-target caches are only synchronized when the
 * configuration says so; otherwise session transitions must be delivered on the composition
 * thread.
 *
 * @param <K> the target key type
 * @param <B> the buffer type
 */
public final class SlotCacheRegistry<K, B> implements SessionStateListener {

    private static final Logger LOGGER = Logger.getLogger(SlotCacheRegistry.class.getName());

    private final SlotCacheConfig config;
    private final ConcurrentMap<K, SlotCache<B>> caches = new ConcurrentHashMap<>();
    private volatile boolean closed;

    /**
     * Creates an empty registry.
     *
     * @param config configuration applied to every target cache
     */
    public SlotCacheRegistry(SlotCacheConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Returns the cache for a target, creating it on first use.
     *
     * @param target the target key
     * @return the target's cache
     * @throws IllegalStateException if the registry was closed
     */
    public SlotCache<B> cacheFor(K target) {
        Objects.requireNonNull(target, "target");
        ensureOpen();
        SlotCache<B> cache =
                caches.computeIfAbsent(
                        target,
                        key -> {
                            ensureOpen();
                            return newCache(key);
                        });
        // a close may have cleared the map while the entry was being created
        if (closed) {
            caches.remove(target, cache);
            throw new IllegalStateException("Slot cache registry is closed");
        }
        return cache;
    }

    /**
     * Resolves a buffer against the target's cache.
     *
     * @param target the target key
     * @param buffer the buffer to announce
     * @return the slot assignment
     * @throws IllegalStateException if the registry was closed
     */
    public SlotAssignment<B> resolve(K target, B buffer) {
        return cacheFor(target).resolve(buffer);
    }

    /**
     * Drops the cache for a target that no longer exists remotely.
     *
     * @param target the target key
     * @return true if a cache was removed
     * @throws NullPointerException if target is null
     */
    public boolean remove(K target) {
        Objects.requireNonNull(target, "target");
        SlotCache<B> removed = caches.remove(target);
        if (removed != null) {
            LOGGER.log(Level.FINE, "Removed slot cache for target {0}", target);
            return true;
        }
        return false;
    }

    /** Resets every target cache. */
    public void resetAll() {
        for (SlotCache<B> cache : caches.values()) {
            cache.reset();
        }
        LOGGER.log(Level.FINE, "Reset {0} slot caches", caches.size());
    }

    /**
     * Returns the number of targets with a cache.
     *
     * @return the target count
     */
    public int size() {
        return caches.size();
    }

    /**
     * Returns a snapshot of the targets with a cache.
     *
     * @return the target keys
     */
    public Set<K> targets() {
        return Set.copyOf(caches.keySet());
    }

    /**
     * Returns whether the session this registry follows has closed.
     *
     * @return true once closed
     */
    public boolean isClosed() {
        return closed;
    }

    /**
     * Resets all caches when the remote slot tables appear or disappear.
     *
     * <p>Entering or leaving {@link SessionState#ACTIVE} means the remote side starts from an
     * empty table or has lost it. {@link SessionState#CLOSED} also drops every target.
     */
    @Override
    public void onSessionStateChanged(SessionState previousState, SessionState currentState) {
        if (previousState.isActive() || currentState.isActive()) {
            resetAll();
        }
        if (currentState.isTerminal()) {
            closed = true;
            caches.clear();
            LOGGER.fine("Session closed, slot cache registry cleared");
        }
    }

    private SlotCache<B> newCache(K target) {
        SlotCacheConfig targetConfig =
                config.toBuilder().name(config.name() + "/" + target).build();
        LOGGER.log(Level.FINE, "Created slot cache for target {0}", target);
        return SlotCaches.create(targetConfig);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Slot cache registry is closed");
        }
    }

    @Override
    public String toString() {
        return "SlotCacheRegistry[targets=" + caches.size() + ", capacity=" + config.capacity()
                + (closed ? ", closed" : "") + "]";
    }
}
