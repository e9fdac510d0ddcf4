package fr.lapetina.tgbot.dispatch.context;

import fr.lapetina.tgbot.dispatch.CancellationToken;
import fr.lapetina.tgbot.domain.model.Update;
import fr.lapetina.tgbot.infrastructure.telegram.TelegramApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lock-free pool of reusable {@link BotContext} instances.
 *
 * A context leaves the pool bound to one update and comes back reset, so the same
 * instance is never held by two workers and never carries state from one update to the
 * next. The pool grows on demand and is bounded in practice by the number of updates
 * handled concurrently.
 */
public final class BotContextPool {

    private static final Logger log = LoggerFactory.getLogger(BotContextPool.class);

    private final TelegramApi api;
    private final Queue<BotContext> idle = new ConcurrentLinkedQueue<>();
    private final AtomicInteger created = new AtomicInteger(0);

    public BotContextPool(TelegramApi api) {
        this.api = api;
    }

    /**
     * Takes an idle context, or creates one, and binds it to the update.
     */
    public BotContext acquire(Update update, CancellationToken token) {
        BotContext ctx = idle.poll();
        if (ctx == null) {
            ctx = new BotContext(api);
            int total = created.incrementAndGet();
            log.debug("Context allocated: total={}", total);
        }
        ctx.bind(update, token);
        return ctx;
    }

    /**
     * Resets the context and returns it to the pool.
     */
    public void release(BotContext ctx) {
        if (ctx == null || !ctx.isBound()) {
            return;
        }
        ctx.reset();
        idle.offer(ctx);
    }

    /**
     * Number of contexts ever allocated by this pool.
     */
    public int created() {
        return created.get();
    }

    /**
     * Number of contexts currently waiting in the pool.
     */
    public int idle() {
        return idle.size();
    }
}
