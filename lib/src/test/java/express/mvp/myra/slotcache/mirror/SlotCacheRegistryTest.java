package express.mvp.myra.slotcache.mirror;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.myra.slotcache.SlotAssignment;
import express.mvp.myra.slotcache.SlotCache;
import express.mvp.myra.slotcache.SlotCacheConfig;
import express.mvp.myra.slotcache.SynchronizedSlotCache;
import express.mvp.myra.slotcache.lifecycle.RemoteSession;
import express.mvp.myra.slotcache.lifecycle.SessionState;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link SlotCacheRegistry}.
 */
@DisplayName("SlotCacheRegistry")
class SlotCacheRegistryTest {

    private RemoteSession session;
    private SlotCacheRegistry<String, Object> registry;

    private final Object front = new Object();
    private final Object back = new Object();

    @BeforeEach
    void setUp() {
        session = new RemoteSession("hwc");
        registry =
                new SlotCacheRegistry<>(
                        SlotCacheConfig.builder().capacity(2).name("display").build());
        session.addListener(registry);
        session.transitionTo(SessionState.ACTIVE);
    }

    @Nested
    @DisplayName("Targets")
    class TargetTests {

        @Test
        @DisplayName("Each target gets its own cache")
        void separateCachesPerTarget() {
            assertEquals(SlotAssignment.miss(0, front), registry.resolve("layer-1", front));
            assertEquals(SlotAssignment.miss(0, front), registry.resolve("layer-2", front));
            assertEquals(SlotAssignment.hit(0), registry.resolve("layer-1", front));

            assertEquals(2, registry.size());
            assertEquals(Set.of("layer-1", "layer-2"), registry.targets());
        }

        @Test
        @DisplayName("cacheFor returns the same instance for a target")
        void cacheForIsStable() {
            SlotCache<Object> cache = registry.cacheFor("layer-1");

            assertSame(cache, registry.cacheFor("layer-1"));
            assertEquals(2, cache.capacity());
        }

        @Test
        @DisplayName("Removed target starts over")
        void removeTarget() {
            registry.resolve("layer-1", front);

            assertTrue(registry.remove("layer-1"));
            assertFalse(registry.remove("layer-1"));
            assertTrue(registry.resolve("layer-1", front).requiresTransmit());
        }

        @Test
        @DisplayName("Thread-safe config yields synchronized caches")
        void threadSafeConfig() {
            SlotCacheRegistry<String, Object> guarded =
                    new SlotCacheRegistry<>(SlotCacheConfig.builder().threadSafe(true).build());

            assertInstanceOf(SynchronizedSlotCache.class, guarded.cacheFor("display-0"));
        }

        @Test
        @DisplayName("Null target is rejected")
        void rejectsNullTarget() {
            assertThrows(NullPointerException.class, () -> registry.cacheFor(null));
            assertThrows(NullPointerException.class, () -> registry.remove(null));
        }
    }

    @Nested
    @DisplayName("Session lifecycle")
    class SessionTests {

        @Test
        @DisplayName("Losing the remote session resets every cache")
        void lostSessionResets() {
            registry.resolve("layer-1", front);
            registry.resolve("layer-2", back);

            session.transitionTo(SessionState.LOST);

            assertEquals(0, registry.cacheFor("layer-1").liveSlots());
            assertEquals(0, registry.cacheFor("layer-2").liveSlots());
            assertEquals(2, registry.size());
        }

        @Test
        @DisplayName("Buffers are retransmitted after reconnect")
        void reconnectForcesRetransmit() {
            registry.resolve("layer-1", front);
            assertTrue(registry.resolve("layer-1", front).isHit());

            session.transitionTo(SessionState.LOST);
            session.transitionTo(SessionState.ACTIVE);

            SlotAssignment<Object> assignment = registry.resolve("layer-1", front);
            assertTrue(assignment.requiresTransmit());
            assertEquals(0, assignment.slot());
        }

        @Test
        @DisplayName("Counter keeps increasing across resets")
        void counterSurvivesReset() {
            registry.resolve("layer-1", front);
            long before = registry.cacheFor("layer-1").counter();

            session.transitionTo(SessionState.LOST);

            assertEquals(before, registry.cacheFor("layer-1").counter());
        }

        @Test
        @DisplayName("Closing drops targets and refuses further use")
        void closeDropsTargets() {
            registry.resolve("layer-1", front);

            session.transitionTo(SessionState.CLOSED);

            assertTrue(registry.isClosed());
            assertEquals(0, registry.size());
            assertThrows(IllegalStateException.class, () -> registry.cacheFor("layer-1"));
            assertThrows(IllegalStateException.class, () -> registry.resolve("layer-1", front));
        }

        @Test
        @DisplayName("Close during target creation leaves no target behind")
        void closeDuringCreation() {
            SlotCacheRegistry<Object, Object> racing =
                    new SlotCacheRegistry<>(SlotCacheConfig.builder().capacity(2).build());
            RemoteSession racingSession = new RemoteSession("racing");
            racingSession.addListener(racing);
            racingSession.transitionTo(SessionState.ACTIVE);
            Object target = new ClosingTarget(racingSession);

            assertThrows(IllegalStateException.class, () -> racing.cacheFor(target));

            assertTrue(racing.isClosed());
            assertEquals(0, racing.size());
        }

        @Test
        @DisplayName("toString reports target count")
        void toStringReportsTargets() {
            registry.resolve("layer-1", front);
            assertTrue(registry.toString().contains("targets=1"));
        }
    }

    /** Target key that closes the session the first time the registry hashes it. */
    private static final class ClosingTarget {
        private final RemoteSession session;
        private boolean closed;

        ClosingTarget(RemoteSession session) {
            this.session = session;
        }

        @Override
        public int hashCode() {
            if (!closed) {
                closed = true;
                session.transitionTo(SessionState.CLOSED);
            }
            return 42;
        }

        @Override
        public boolean equals(Object o) {
            return this == o;
        }
    }
}
