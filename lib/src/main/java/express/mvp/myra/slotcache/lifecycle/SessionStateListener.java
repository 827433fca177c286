package express.mvp.myra.slotcache.lifecycle;

/**
 * Callback for remote session state changes.
 *
 * <p>Invoked synchronously on the thread performing the transition. Implementations should be
 * quick and non-blocking.
 *
 * @see RemoteSession
 */
@FunctionalInterface
public interface SessionStateListener {

    /**
     * Called after the session changed state.
     *
     * @param previousState the state before the transition
     * @param currentState the state after the transition
     */
    void onSessionStateChanged(SessionState previousState, SessionState currentState);
}
