package express.mvp.myra.slotcache.lifecycle;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe state machine for the session with a remote consumer.
 *
 * <p>Each entry into {@link SessionState#ACTIVE} starts a new epoch: the remote side begins with an
 * empty slot table, so anything mirrored during an earlier epoch is meaningless. Listeners, such
 * as {@link express.mvp.myra.slotcache.mirror.SlotCacheRegistry}, use the transitions to reset
 * their caches.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RemoteSession session = new RemoteSession("composer");
 * session.addListener(registry);
 *
 * session.transitionTo(SessionState.ACTIVE);   // attached
 * session.transitionTo(SessionState.LOST);     // remote died, registry resets
 * session.transitionTo(SessionState.ACTIVE);   // reattached, epoch 2
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All methods are thread-safe. Transitions use compare-and-set on the current state.
 *
 * @see SessionState
 * @see SessionStateListener
 */
public final class RemoteSession {

    private static final Logger LOGGER = Logger.getLogger(RemoteSession.class.getName());

    private static final Set<SessionState> FROM_NEW =
            EnumSet.of(SessionState.ACTIVE, SessionState.CLOSED);

    private static final Set<SessionState> FROM_ACTIVE =
            EnumSet.of(SessionState.LOST, SessionState.CLOSED);

    private static final Set<SessionState> FROM_LOST =
            EnumSet.of(SessionState.ACTIVE, SessionState.CLOSED);

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.NEW);

    private final AtomicLong epoch = new AtomicLong();

    private final List<SessionStateListener> listeners = new CopyOnWriteArrayList<>();

    private final String sessionId;

    /** Creates a session without an identifier. */
    public RemoteSession() {
        this(null);
    }

    /**
     * Creates a session with an identifier.
     *
     * @param sessionId identifier used in logs, may be null
     */
    public RemoteSession(String sessionId) {
        this.sessionId = sessionId;
    }

    /**
     * Returns the current state.
     *
     * @return the current state
     */
    public SessionState getState() {
        return state.get();
    }

    /**
     * Returns the session identifier.
     *
     * @return the identifier, or null if not set
     */
    public String getSessionId() {
        return sessionId;
    }

    /**
     * Returns how many times the session has become active.
     *
     * @return the epoch, 0 before the first activation
     */
    public long epoch() {
        return epoch.get();
    }

    /**
     * Checks if the remote slot table is currently valid.
     *
     * @return true if in {@link SessionState#ACTIVE}
     */
    public boolean isActive() {
        return state.get().isActive();
    }

    /**
     * Checks if the session is closed.
     *
     * @return true if in {@link SessionState#CLOSED}
     */
    public boolean isClosed() {
        return state.get().isTerminal();
    }

    /**
     * Registers a listener for state changes.
     *
     * @param listener the listener
     */
    public void addListener(SessionStateListener listener) {
        listeners.add(listener);
    }

    /**
     * Removes a previously registered listener.
     *
     * @param listener the listener
     * @return true if the listener was found and removed
     */
    public boolean removeListener(SessionStateListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Attempts to transition to a new state.
     *
     * @param newState the desired state
     * @return true if the transition was valid and applied
     */
    public boolean transitionTo(SessionState newState) {
        while (true) {
            SessionState current = state.get();

            if (!isValidTransition(current, newState)) {
                return false;
            }

            if (state.compareAndSet(current, newState)) {
                if (newState == SessionState.ACTIVE) {
                    epoch.incrementAndGet();
                }
                notifyListeners(current, newState);
                return true;
            }
        }
    }

    /**
     * Checks if a transition is allowed.
     *
     * @param from the source state
     * @param to the target state
     * @return true if the transition is allowed
     */
    public static boolean isValidTransition(SessionState from, SessionState to) {
        if (from == to) {
            return false;
        }

        return switch (from) {
            case NEW -> FROM_NEW.contains(to);
            case ACTIVE -> FROM_ACTIVE.contains(to);
            case LOST -> FROM_LOST.contains(to);
            case CLOSED -> false;
        };
    }

    private void notifyListeners(SessionState previous, SessionState current) {
        for (SessionStateListener listener : listeners) {
            try {
                listener.onSessionStateChanged(previous, current);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Session state listener failed", e);
            }
        }
    }

    @Override
    public String toString() {
        return sessionId != null
                ? "RemoteSession[" + sessionId + ":" + state.get() + ", epoch=" + epoch.get() + "]"
                : "RemoteSession[" + state.get() + ", epoch=" + epoch.get() + "]";
    }
}
