/**
 * Lifecycle of the session with the remote consumer.
 *
 * <p>The remote slot table is only meaningful while a session is {@link
 * express.mvp.myra.slotcache.lifecycle.SessionState#ACTIVE}. {@link
 * express.mvp.myra.slotcache.lifecycle.RemoteSession} publishes transitions so local mirrors can
 * be reset at the same moments the remote table is discarded.
 */
package express.mvp.myra.slotcache.lifecycle;
