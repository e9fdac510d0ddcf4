package fr.lapetina.tgbot.dispatch;

import fr.lapetina.tgbot.dispatch.exception.DispatchException;
import fr.lapetina.tgbot.dispatch.exception.DispatchException.ErrorKind;
import fr.lapetina.tgbot.domain.model.Update;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of worker threads running the execution lifecycle.
 *
 * An update is only submitted once a worker is idle, so a handler that never returns
 * occupies its own worker and nothing else. The worker runs the lifecycle itself, or hands
 * it to the external executor when one is configured; if the executor rejects it, the
 * rejection is reported and the worker runs it inline. Either way an update is handled once
 * and its channel permit is released when the handler is done.
 *
 * An update taken after cancellation is dropped.
 */
final class UpdateWorkerPool {

    private static final Logger log = LoggerFactory.getLogger(UpdateWorkerPool.class);

    private static final long IDLE_WAIT_MILLIS = 1;

    private final UpdateExecutor executor;
    private final ExecutorService external;
    private final UpdateChannel channel;
    private final CancellationToken token;
    private final ErrorReporter reporter;
    private final AtomicInteger running;
    private final int workerNum;
    private final Semaphore idle;
    private final CountDownLatch started;
    private final CountDownLatch exited;
    private final ThreadPoolExecutor workers;

    UpdateWorkerPool(
            int workerNum,
            UpdateExecutor executor,
            ExecutorService external,
            UpdateChannel channel,
            CancellationToken token,
            ErrorReporter reporter,
            AtomicInteger running
    ) {
        this.workerNum = workerNum;
        this.executor = executor;
        this.external = external;
        this.channel = channel;
        this.token = token;
        this.reporter = reporter;
        this.running = running;
        this.idle = new Semaphore(workerNum);
        this.started = new CountDownLatch(workerNum);
        this.exited = new CountDownLatch(workerNum);
        this.workers = new ThreadPoolExecutor(
                workerNum, workerNum,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                trackingThreadFactory(new DispatcherThreadFactory("update-worker", false)));
    }

    /**
     * Starts every worker thread and waits until they are all running.
     */
    void start() {
        workers.prestartAllCoreThreads();
        try {
            started.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for workers to start");
        }
    }

    /**
     * Hands an update to the next idle worker, waiting for one to free up.
     *
     * @return false if the update was not accepted; its channel permit is still held
     */
    boolean submit(Update update) {
        try {
            while (!idle.tryAcquire(IDLE_WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
                if (token.isCancelled()) {
                    return false;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        try {
            workers.execute(() -> run(update));
            return true;
        } catch (RejectedExecutionException e) {
            idle.release();
            return false;
        }
    }

    /**
     * Lets idle workers exit; busy ones exit once their handler returns.
     */
    void shutdown() {
        workers.shutdown();
    }

    void awaitTermination() throws InterruptedException {
        exited.await();
    }

    boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return exited.await(timeout, unit);
    }

    int workerNum() {
        return workerNum;
    }

    private void run(Update update) {
        boolean handedOff = false;
        try {
            if (token.isCancelled()) {
                log.debug("Update dropped on shutdown: updateId={}", update.updateId());
                return;
            }
            if (external == null) {
                executor.execute(update);
                return;
            }
            try {
                external.execute(() -> {
                    try {
                        executor.execute(update);
                    } finally {
                        channel.release();
                    }
                });
                handedOff = true;
            } catch (RejectedExecutionException e) {
                reporter.report(new DispatchException(ErrorKind.REJECTED,
                        "update " + update.updateId(), e, update.updateId()));
                executor.execute(update);
            }
        } finally {
            idle.release();
            if (!handedOff) {
                channel.release();
            }
        }
    }

    private ThreadFactory trackingThreadFactory(ThreadFactory delegate) {
        return runnable -> delegate.newThread(() -> {
            int count = running.incrementAndGet();
            started.countDown();
            log.debug("Worker started: thread={}, running={}", Thread.currentThread().getName(), count);
            try {
                runnable.run();
            } finally {
                count = running.decrementAndGet();
                exited.countDown();
                log.debug("Worker stopped: thread={}, running={}", Thread.currentThread().getName(), count);
            }
        });
    }
}
