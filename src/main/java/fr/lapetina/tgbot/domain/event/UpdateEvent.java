package fr.lapetina.tgbot.domain.event;

import fr.lapetina.tgbot.domain.model.Update;

import java.time.Instant;

/**
 * Slot object of the distribution ring buffer.
 *
 * This is a mutable holder that gets reused across the ring buffer. The poller fills it
 * on publish and exactly one worker takes the update out of it.
 *
 * IMPORTANT: the slot is recycled as soon as the worker that owns it moves on, so the
 * update must be taken with {@link #take()} rather than referenced after processing.
 */
public final class UpdateEvent {

    private Update update;
    private Instant enqueuedAt;
    private long sequence = -1;

    /**
     * Clears the slot for reuse.
     */
    public void clear() {
        this.update = null;
        this.enqueuedAt = null;
        this.sequence = -1;
    }

    /**
     * Fills the slot with a freshly fetched update.
     */
    public void initialize(Update update, long sequence) {
        clear();
        this.update = update;
        this.sequence = sequence;
        this.enqueuedAt = Instant.now();
    }

    /**
     * Returns the update and clears the slot.
     */
    public Update take() {
        Update taken = update;
        clear();
        return taken;
    }

    public Update getUpdate() {
        return update;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    public long getSequence() {
        return sequence;
    }

    @Override
    public String toString() {
        return "UpdateEvent{" +
                "updateId=" + (update != null ? update.updateId() : "null") +
                ", seq=" + sequence +
                '}';
    }
}
