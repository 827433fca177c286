package express.mvp.myra.slotcache.lifecycle;

/**
 * States of the session with the remote consumer whose cache is being mirrored.
 *
 * <p>The remote slot table lives exactly as long as one {@link #ACTIVE} period. Whenever a session
 * ends or a new one starts, every local mirror must be reset.
 *
 * <pre>
 * NEW    → ACTIVE, CLOSED
 * ACTIVE → LOST, CLOSED
 * LOST   → ACTIVE, CLOSED
 * CLOSED → (terminal)
 * </pre>
 *
 * @see RemoteSession
 */
public enum SessionState {

    /** Created, remote side not yet attached. */
    NEW("New", false),

    /** Attached to a remote session; its slot table is valid. */
    ACTIVE("Active", false),

    /** Remote side went away (crash, reconnect in progress); its slot table is gone. */
    LOST("Lost", false),

    /** Terminal state; no further transitions. */
    CLOSED("Closed", true);

    private final String displayName;
    private final boolean terminal;

    SessionState(String displayName, boolean terminal) {
        this.displayName = displayName;
        this.terminal = terminal;
    }

    /**
     * Returns a human-readable name for this state.
     *
     * @return the display name
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Checks if the remote slot table is currently valid.
     *
     * @return true only in {@link #ACTIVE}
     */
    public boolean isActive() {
        return this == ACTIVE;
    }

    /**
     * Checks if this is the terminal state.
     *
     * @return true only in {@link #CLOSED}
     */
    public boolean isTerminal() {
        return terminal;
    }
}
