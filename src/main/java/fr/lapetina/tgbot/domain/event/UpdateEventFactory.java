package fr.lapetina.tgbot.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for creating UpdateEvent slots in the distribution ring buffer.
 *
 * The ring is pre-allocated at startup; slots are then reused by clearing and
 * re-initializing them.
 */
public final class UpdateEventFactory implements EventFactory<UpdateEvent> {

    @Override
    public UpdateEvent newInstance() {
        return new UpdateEvent();
    }
}
