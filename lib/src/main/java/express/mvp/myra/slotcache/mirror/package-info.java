/**
 * Per-target mirrors of the remote slot tables.
 *
 * @see express.mvp.myra.slotcache.mirror.SlotCacheRegistry
 */
package express.mvp.myra.slotcache.mirror;
