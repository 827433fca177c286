/**
 * Client-side mirror of a remote buffer slot cache.
 *
 * <p>A remote compositing backend caches buffer handles in a fixed slot table per display or
 * layer. This package tracks which buffer each remote slot holds, so a buffer already cached
 * remotely is announced by slot index alone instead of being transmitted again.
 *
 * <h2>Key Types</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.myra.slotcache.SlotCache} - The cache contract
 *   <li>{@link express.mvp.myra.slotcache.LruSlotCache} - Weak-reference LRU implementation
 *   <li>{@link express.mvp.myra.slotcache.SlotAssignment} - Slot index plus optional payload
 *   <li>{@link express.mvp.myra.slotcache.SlotCaches} - Factory honoring {@link
 *       express.mvp.myra.slotcache.SlotCacheConfig}
 * </ul>
 *
 * @see express.mvp.myra.slotcache.mirror.SlotCacheRegistry
 */
package express.mvp.myra.slotcache;
