package express.mvp.myra.slotcache.lifecycle;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

/**
 * Unit tests for {@link RemoteSession}.
 */
@DisplayName("RemoteSession")
class RemoteSessionTest {

    private RemoteSession session;

    @BeforeEach
    void setUp() {
        session = new RemoteSession("composer");
    }

    @Nested
    @DisplayName("Initial state")
    class InitialStateTests {

        @Test
        @DisplayName("Starts in NEW with epoch 0")
        void startsInNew() {
            assertEquals(SessionState.NEW, session.getState());
            assertEquals(0, session.epoch());
            assertFalse(session.isActive());
            assertFalse(session.isClosed());
        }

        @Test
        @DisplayName("toString includes session ID and state")
        void toStringIncludesIdAndState() {
            String str = session.toString();
            assertTrue(str.contains("composer"));
            assertTrue(str.contains("NEW"));
            assertNull(new RemoteSession().getSessionId());
        }
    }

    @Nested
    @DisplayName("Transitions")
    class TransitionTests {

        @Test
        @DisplayName("Reconnect cycle increments the epoch")
        void reconnectCycle() {
            assertTrue(session.transitionTo(SessionState.ACTIVE));
            assertEquals(1, session.epoch());
            assertTrue(session.isActive());

            assertTrue(session.transitionTo(SessionState.LOST));
            assertFalse(session.isActive());
            assertEquals(1, session.epoch());

            assertTrue(session.transitionTo(SessionState.ACTIVE));
            assertEquals(2, session.epoch());
        }

        @Test
        @DisplayName("Invalid transitions are refused")
        void invalidTransitions() {
            assertFalse(session.transitionTo(SessionState.LOST));
            assertFalse(session.transitionTo(SessionState.NEW));
            assertEquals(SessionState.NEW, session.getState());
        }

        @ParameterizedTest(name = "CLOSED -> {0}")
        @EnumSource(SessionState.class)
        @DisplayName("CLOSED is terminal")
        void closedIsTerminal(SessionState target) {
            assertTrue(session.transitionTo(SessionState.CLOSED));
            assertTrue(session.isClosed());
            assertFalse(session.transitionTo(target));
        }

        @Test
        @DisplayName("Transition table")
        void transitionTable() {
            assertTrue(RemoteSession.isValidTransition(SessionState.NEW, SessionState.ACTIVE));
            assertTrue(RemoteSession.isValidTransition(SessionState.NEW, SessionState.CLOSED));
            assertTrue(RemoteSession.isValidTransition(SessionState.ACTIVE, SessionState.LOST));
            assertTrue(RemoteSession.isValidTransition(SessionState.ACTIVE, SessionState.CLOSED));
            assertTrue(RemoteSession.isValidTransition(SessionState.LOST, SessionState.ACTIVE));
            assertTrue(RemoteSession.isValidTransition(SessionState.LOST, SessionState.CLOSED));
            assertFalse(RemoteSession.isValidTransition(SessionState.ACTIVE, SessionState.ACTIVE));
            assertFalse(RemoteSession.isValidTransition(SessionState.ACTIVE, SessionState.NEW));
            assertFalse(RemoteSession.isValidTransition(SessionState.NEW, SessionState.LOST));
        }
    }

    @Nested
    @DisplayName("Listeners")
    class ListenerTests {

        @Test
        @DisplayName("Listener receives previous and current state")
        void listenerReceivesStates() {
            List<String> events = new ArrayList<>();
            session.addListener((prev, curr) -> events.add(prev + "->" + curr));

            session.transitionTo(SessionState.ACTIVE);
            session.transitionTo(SessionState.LOST);
            session.transitionTo(SessionState.LOST);

            assertEquals(List.of("NEW->ACTIVE", "ACTIVE->LOST"), events);
        }

        @Test
        @DisplayName("Failing listener does not block others or the transition")
        void failingListenerIsIsolated() {
            List<SessionState> seen = new ArrayList<>();
            session.addListener(
                    (prev, curr) -> {
                        throw new IllegalStateException("boom");
                    });
            session.addListener((prev, curr) -> seen.add(curr));

            assertTrue(session.transitionTo(SessionState.ACTIVE));
            assertEquals(List.of(SessionState.ACTIVE), seen);
            assertEquals(SessionState.ACTIVE, session.getState());
        }

        @Test
        @DisplayName("Removed listener is no longer notified")
        void removeListener() {
            List<SessionState> seen = new ArrayList<>();
            SessionStateListener listener = (prev, curr) -> seen.add(curr);
            session.addListener(listener);

            assertTrue(session.removeListener(listener));
            assertFalse(session.removeListener(listener));
            session.transitionTo(SessionState.ACTIVE);
            assertTrue(seen.isEmpty());
        }
    }
}
