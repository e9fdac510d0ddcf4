package fr.lapetina.tgbot.dispatch;

import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.LifecycleAware;
import fr.lapetina.tgbot.domain.event.UpdateEvent;
import fr.lapetina.tgbot.domain.model.Update;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Single consumer of the update channel.
 *
 * Takes updates in publish order and hands each one to an idle worker. The ring slot is
 * freed as soon as the update is taken; its channel permit stays held until the handler
 * is done, or is released here when the update is dropped.
 */
final class UpdateDistributor implements EventHandler<UpdateEvent>, LifecycleAware {

    private static final Logger log = LoggerFactory.getLogger(UpdateDistributor.class);

    private final UpdateChannel channel;
    private final UpdateWorkerPool pool;
    private final CancellationToken token;
    private final CountDownLatch done = new CountDownLatch(1);

    UpdateDistributor(UpdateChannel channel, UpdateWorkerPool pool, CancellationToken token) {
        this.channel = channel;
        this.pool = pool;
        this.token = token;
    }

    @Override
    public void onEvent(UpdateEvent event, long sequence, boolean endOfBatch) {
        Update update = event.take();
        if (update == null) {
            return;
        }
        if (token.isCancelled() || !pool.submit(update)) {
            channel.release();
            log.debug("Update dropped on shutdown: updateId={}", update.updateId());
        }
    }

    @Override
    public void onStart() {
        log.debug("Distributor started: thread={}", Thread.currentThread().getName());
    }

    @Override
    public void onShutdown() {
        done.countDown();
        log.debug("Distributor stopped");
    }

    CountDownLatch done() {
        return done;
    }
}
