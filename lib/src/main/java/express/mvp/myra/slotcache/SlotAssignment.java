package express.mvp.myra.slotcache;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of {@link SlotCache#resolve(Object)}: the slot to announce to the remote side and,
 * on a miss, the buffer whose content must be transmitted with it.
 *
 * <h2>Outgoing Message</h2>
 *
 * <pre>{@code
 * SlotAssignment<GraphicBuffer> assignment = cache.resolve(buffer);
 * message.slot(assignment.slot());
 * if (assignment.requiresTransmit()) {
 *     message.payload(assignment.transmitBuffer());
 * }
 * }</pre>
 *
 * @param slot the slot index in {@code [0, capacity)}
 * @param transmitBuffer the buffer to send, or null when the remote side already holds it
 * @param <B> the buffer type
 */
@SuppressFBWarnings(
        value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
        justification = "The buffer is owned by the caller and handed back by identity.")
public record SlotAssignment<B>(int slot, B transmitBuffer) {

    /**
     * Validates the slot index.
     *
     * @throws IllegalArgumentException if slot is negative
     */
    public SlotAssignment {
        if (slot < 0) {
            throw new IllegalArgumentException("slot must be non-negative: " + slot);
        }
    }

    /**
     * Creates a hit result: the remote side reuses its cached content for the slot.
     *
     * @param slot the slot index
     * @param <B> the buffer type
     * @return an assignment with no payload
     */
    public static <B> SlotAssignment<B> hit(int slot) {
        return new SlotAssignment<>(slot, null);
    }

    /**
     * Creates a miss result: the buffer must be sent and stored by the remote side in the slot.
     *
     * @param slot the slot index
     * @param buffer the buffer to transmit
     * @param <B> the buffer type
     * @return an assignment carrying the buffer
     */
    public static <B> SlotAssignment<B> miss(int slot, B buffer) {
        return new SlotAssignment<>(slot, Objects.requireNonNull(buffer, "buffer"));
    }

    /**
     * Returns true when the remote side already caches this buffer in {@link #slot()}.
     *
     * @return true for a cache hit
     */
    public boolean isHit() {
        return transmitBuffer == null;
    }

    /**
     * Returns true when the buffer content has to accompany the slot index.
     *
     * @return true for a cache miss
     */
    public boolean requiresTransmit() {
        return transmitBuffer != null;
    }

    /**
     * Returns the buffer to transmit, if any.
     *
     * @return the payload, empty on a hit
     */
    public Optional<B> payload() {
        return Optional.ofNullable(transmitBuffer);
    }

    /**
     * Compares slot and buffer identity; buffers are never compared with {@code equals}.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SlotAssignment)) {
            return false;
        }
        SlotAssignment<?> that = (SlotAssignment<?>) o;
        return slot == that.slot && transmitBuffer == that.transmitBuffer;
    }

    @Override
    public int hashCode() {
        return 31 * slot + System.identityHashCode(transmitBuffer);
    }

    @Override
    public String toString() {
        return isHit()
                ? "SlotAssignment[slot=" + slot + ", hit]"
                : "SlotAssignment[slot=" + slot + ", transmit=" + transmitBuffer + "]";
    }
}
