package fr.lapetina.tgbot.dispatch;

import com.lmax.disruptor.ExceptionHandler;
import fr.lapetina.tgbot.dispatch.context.BotContextPool;
import fr.lapetina.tgbot.dispatch.exception.DispatchException;
import fr.lapetina.tgbot.dispatch.exception.DispatchException.ErrorKind;
import fr.lapetina.tgbot.domain.command.Command;
import fr.lapetina.tgbot.domain.command.CommandHandler;
import fr.lapetina.tgbot.domain.command.CommandRegistry;
import fr.lapetina.tgbot.domain.event.UpdateEvent;
import fr.lapetina.tgbot.infrastructure.telegram.TelegramApi;
import fr.lapetina.tgbot.infrastructure.telegram.TelegramApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs a Telegram bot: one poller thread feeding a pool of worker threads through a
 * bounded ring buffer.
 *
 * CHANNEL AND WORKERS: the channel holds at most {@code bufferSize + workerNum} queued or
 * in-flight updates; a full channel blocks the poller. A single distributor takes updates in
 * order and hands each one to exactly one idle worker, so a stuck handler only holds its own
 * worker.
 *
 * LIFECYCLE: CONFIGURED -> RUNNING -> STOPPING -> STOPPED. Commands are registered while
 * CONFIGURED; {@link #start()} freezes them. Cancelling the parent token, if one was
 * configured, stops the dispatcher as well.
 *
 * SHUTDOWN: {@link #stop()} cancels the token, which aborts the pending fetch, wakes the
 * workers and drops queued updates. Handlers already running are left to finish; stop
 * waits for them.
 */
public final class UpdateDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UpdateDispatcher.class);

    private final TelegramApi api;
    private final DispatcherConfig config;
    private final CommandRegistry registry;
    private final CancellationToken token;
    private final ErrorReporter reporter;
    private final AtomicReference<DispatcherState> state = new AtomicReference<>(DispatcherState.CONFIGURED);
    private final AtomicInteger runningWorkers = new AtomicInteger(0);

    private volatile UpdateChannel channel;
    private volatile UpdatePoller poller;
    private volatile UpdateWorkerPool workerPool;
    private volatile UpdateDistributor distributor;
    private volatile Thread pollerThread;
    private volatile ScheduledExecutorService timeoutScheduler;

    public UpdateDispatcher(TelegramApi api, DispatcherConfig config) {
        this(api, config, new CommandRegistry());
    }

    public UpdateDispatcher(TelegramApi api, DispatcherConfig config, CommandRegistry registry) {
        this.api = Objects.requireNonNull(api, "TelegramApi is required");
        this.config = Objects.requireNonNull(config, "DispatcherConfig is required");
        this.registry = Objects.requireNonNull(registry, "CommandRegistry is required");
        this.token = config.getParentToken()
                .map(CancellationToken::child)
                .orElseGet(CancellationToken::create);
        this.reporter = new ErrorReporter(config);
        log.info("UpdateDispatcher created: {}", config);
    }

    // ==================== COMMANDS ====================

    public UpdateDispatcher addCommand(Command command) {
        registry.register(command);
        return this;
    }

    public UpdateDispatcher addCommand(String name, String description, CommandHandler handler) {
        return addCommand(Command.of(name, description, handler));
    }

    public CommandRegistry commands() {
        return registry;
    }

    // ==================== LIFECYCLE ====================

    /**
     * Publishes the command menu if enabled, then starts the workers and the poller.
     * Returns without waiting.
     *
     * @throws IllegalStateException if the dispatcher was already started
     * @throws DispatchException     with {@link ErrorKind#STARTUP} if the command menu could not
     *                               be published; no worker is started in that case
     */
    public void start() {
        if (!state.compareAndSet(DispatcherState.CONFIGURED, DispatcherState.RUNNING)) {
            throw new IllegalStateException("Dispatcher cannot start from state " + state.get());
        }
        registry.freeze();

        if (config.isAutoSetupCommands()) {
            try {
                api.setMyCommands(registry.toBotCommands(), token);
                log.info("Command menu published: commands={}", registry.visibleCommands().size());
            } catch (TelegramApiException | RuntimeException e) {
                state.set(DispatcherState.STOPPED);
                token.cancel();
                throw new DispatchException(ErrorKind.STARTUP, "setMyCommands failed: " + e.getMessage(), e);
            }
        }

        if (config.hasTimeout()) {
            timeoutScheduler = Executors.newSingleThreadScheduledExecutor(
                    new DispatcherThreadFactory("update-timeout", true));
        }

        UpdateChannel updateChannel = new UpdateChannel(config);
        UpdateExecutor executor = new UpdateExecutor(
                config,
                new UpdateRouter(registry, config),
                new BotContextPool(api),
                token,
                timeoutScheduler,
                reporter);

        UpdateWorkerPool pool = new UpdateWorkerPool(
                config.getWorkerNum(),
                executor,
                config.getExecutor().orElse(null),
                updateChannel,
                token,
                reporter,
                runningWorkers);
        UpdateDistributor distributor = new UpdateDistributor(updateChannel, pool, token);

        this.channel = updateChannel;
        this.distributor = distributor;
        this.workerPool = pool;

        pool.start();
        updateChannel.start(distributor, new DispatcherExceptionHandler());
        token.onCancel(updateChannel::halt);
        token.onCancel(pool::shutdown);

        UpdatePoller updatePoller = new UpdatePoller(api, updateChannel, config, token, reporter);
        this.poller = updatePoller;
        Thread thread = new Thread(updatePoller, "update-poller");
        this.pollerThread = thread;
        thread.start();

        log.info("UpdateDispatcher started: workers={}, capacity={}, commands={}",
                pool.workerNum(), updateChannel.capacity(), registry.size());
    }

    /**
     * Starts the dispatcher and blocks until it has stopped.
     */
    public void run() throws InterruptedException {
        start();
        awaitTermination();
    }

    /**
     * Stops polling, wakes the workers and waits for in-flight handlers. Idempotent.
     */
    public void stop() {
        if (state.compareAndSet(DispatcherState.CONFIGURED, DispatcherState.STOPPED)) {
            token.cancel();
            log.info("UpdateDispatcher stopped before start");
            return;
        }
        if (state.compareAndSet(DispatcherState.RUNNING, DispatcherState.STOPPING)) {
            log.info("Stopping UpdateDispatcher...");
            token.cancel();
        }
        try {
            awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the dispatcher to stop");
        }
    }

    /**
     * Blocks until the workers, the distributor and the poller have exited.
     */
    public void awaitTermination() throws InterruptedException {
        UpdateWorkerPool pool = workerPool;
        if (pool == null) {
            return;
        }
        pool.awaitTermination();
        distributor.done().await();
        Thread thread = pollerThread;
        if (thread != null) {
            thread.join();
        }
        terminated();
    }

    /**
     * Bounded variant of {@link #awaitTermination()}.
     *
     * @return true if the dispatcher terminated within the wait time
     */
    public boolean awaitTermination(Duration maxWait) throws InterruptedException {
        UpdateWorkerPool pool = workerPool;
        if (pool == null) {
            return true;
        }
        long deadline = System.nanoTime() + maxWait.toNanos();
        if (!pool.awaitTermination(maxWait.toNanos(), TimeUnit.NANOSECONDS)) {
            return false;
        }
        if (!distributor.done().await(deadline - System.nanoTime(), TimeUnit.NANOSECONDS)) {
            return false;
        }
        Thread thread = pollerThread;
        if (thread != null) {
            long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            thread.join(Math.max(1, remainingMillis));
            if (thread.isAlive()) {
                return false;
            }
        }
        terminated();
        return true;
    }

    @Override
    public void close() {
        stop();
    }

    private synchronized void terminated() {
        if (state.get() == DispatcherState.STOPPED) {
            return;
        }
        token.cancel();
        ScheduledExecutorService scheduler = timeoutScheduler;
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        state.set(DispatcherState.STOPPED);
        log.info("UpdateDispatcher stopped: offset={}", offset());
    }

    // ==================== INTROSPECTION ====================

    public DispatcherState state() {
        return state.get();
    }

    public int runningWorkers() {
        return runningWorkers.get();
    }

    /**
     * Next update id the poller will ask for.
     */
    public long offset() {
        UpdatePoller current = poller;
        return current != null ? current.offset() : 0;
    }

    /**
     * Free slots in the update channel, or 0 before start.
     */
    public long remainingCapacity() {
        UpdateChannel current = channel;
        return current != null ? current.remainingCapacity() : 0;
    }

    public CancellationToken token() {
        return token;
    }

    public DispatcherConfig config() {
        return config;
    }

    /**
     * Last-resort handler for anything escaping the execution lifecycle.
     */
    private static class DispatcherExceptionHandler implements ExceptionHandler<UpdateEvent> {

        private static final Logger log = LoggerFactory.getLogger(DispatcherExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, UpdateEvent event) {
            log.error("Exception in update distributor: sequence={}, event={}", sequence, event, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during distributor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during distributor shutdown", ex);
        }
    }
}
