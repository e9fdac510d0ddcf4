package fr.lapetina.tgbot.dispatch;

import fr.lapetina.tgbot.dispatch.context.BotContext;
import fr.lapetina.tgbot.dispatch.context.BotContextPool;
import fr.lapetina.tgbot.dispatch.exception.DispatchException;
import fr.lapetina.tgbot.dispatch.exception.DispatchException.ErrorKind;
import fr.lapetina.tgbot.domain.command.Route;
import fr.lapetina.tgbot.domain.model.Chat;
import fr.lapetina.tgbot.domain.model.Update;
import fr.lapetina.tgbot.infrastructure.telegram.TelegramApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Handles one update from start to finish.
 *
 * Lifecycle:
 * - derive the handling scope (time-bounded when a timeout is configured)
 * - take a context from the pool and bind the update
 * - route under panic recovery
 * - release the context and the scope, whatever happened
 *
 * Sets MDC context (updateId, chatId, command) for the duration of the handler.
 */
public final class UpdateExecutor {

    private static final Logger log = LoggerFactory.getLogger(UpdateExecutor.class);

    private final DispatcherConfig config;
    private final UpdateRouter router;
    private final BotContextPool pool;
    private final CancellationToken token;
    private final ScheduledExecutorService scheduler;
    private final ErrorReporter reporter;

    UpdateExecutor(
            DispatcherConfig config,
            UpdateRouter router,
            BotContextPool pool,
            CancellationToken token,
            ScheduledExecutorService scheduler,
            ErrorReporter reporter
    ) {
        if (config.hasTimeout() && scheduler == null) {
            throw new IllegalArgumentException("A scheduler is required when a timeout is configured");
        }
        this.config = config;
        this.router = router;
        this.pool = pool;
        this.token = token;
        this.scheduler = scheduler;
        this.reporter = reporter;
    }

    public void execute(Update update) {
        long startNanos = System.nanoTime();
        CancellationToken scope = config.hasTimeout()
                ? token.withTimeout(config.getTimeout(), scheduler)
                : null;
        BotContext ctx = pool.acquire(update, scope != null ? scope : token);
        Route route = Route.IGNORED;
        setupMDC(ctx);
        try {
            route = router.classify(update);
            router.invoke(route, ctx);
            log.debug("Update dispatched: updateId={}, route={}", update.updateId(), route);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            recover(ctx, e);
        } catch (Exception e) {
            reporter.report(new DispatchException(ErrorKind.HANDLER,
                    "/" + ctx.command() + " failed: " + e.getMessage(), e, update.updateId()));
        } finally {
            pool.release(ctx);
            if (scope != null) {
                scope.close();
            }
            notifyHandled(update, route, Duration.ofNanos(System.nanoTime() - startNanos));
            clearMDC();
        }
    }

    private void recover(BotContext ctx, Throwable panic) {
        long updateId = ctx.update().updateId();
        log.error("Handler panicked: updateId={}", updateId, panic);
        reporter.report(new DispatchException(ErrorKind.PANIC, String.valueOf(panic), panic, updateId));

        String tip;
        try {
            tip = config.getPanicHandler().onPanic(panic);
        } catch (RuntimeException e) {
            log.error("Panic handler failed: updateId={}", updateId, e);
            return;
        }
        Chat chat = ctx.fromChat();
        if (tip == null || tip.isEmpty() || chat == null) {
            return;
        }
        try {
            ctx.replyText(tip);
        } catch (TelegramApiException | RuntimeException e) {
            reporter.report(new DispatchException(ErrorKind.REPLY,
                    "panic reply to chat " + chat.id() + " failed: " + e.getMessage(), e, updateId));
        }
    }

    private void notifyHandled(Update update, Route route, Duration latency) {
        try {
            config.getListener().onUpdateHandled(update, route, latency);
        } catch (RuntimeException e) {
            log.warn("Listener failed on handled update: updateId={}", update.updateId(), e);
        }
    }

    private void setupMDC(BotContext ctx) {
        Update update = ctx.update();
        MDC.put("updateId", String.valueOf(update.updateId()));
        Chat chat = update.fromChat();
        if (chat != null) {
            MDC.put("chatId", String.valueOf(chat.id()));
        }
        if (update.isCommand()) {
            MDC.put("command", ctx.command());
        }
    }

    private void clearMDC() {
        MDC.remove("updateId");
        MDC.remove("chatId");
        MDC.remove("command");
    }
}
