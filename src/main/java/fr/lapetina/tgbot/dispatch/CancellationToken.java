package fr.lapetina.tgbot.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Broadcast cancellation signal passed explicitly to every blocking call.
 *
 * Tokens form a tree: cancelling a token cancels all of its children, never its parent.
 * A child may carry a deadline, after which it cancels itself with
 * {@link Reason#DEADLINE_EXCEEDED}. Closing a child detaches it from its parent and
 * cancels it, so short-lived children do not accumulate on a long-lived parent.
 *
 * Thread-safe. Cancellation is idempotent; only the first reason is kept.
 */
public final class CancellationToken implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    /**
     * Why a token was cancelled.
     */
    public enum Reason {
        CANCELLED,
        DEADLINE_EXCEEDED
    }

    private final CancellationToken parent;
    private final Instant deadline;
    private final AtomicReference<Reason> reason = new AtomicReference<>();
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final Set<Runnable> callbacks = ConcurrentHashMap.newKeySet();
    private final Set<CancellationToken> children = ConcurrentHashMap.newKeySet();
    private volatile ScheduledFuture<?> deadlineTask;

    private CancellationToken(CancellationToken parent, Instant deadline) {
        this.parent = parent;
        this.deadline = deadline;
    }

    /**
     * Creates a root token that is only cancelled by {@link #cancel()}.
     */
    public static CancellationToken create() {
        return new CancellationToken(null, null);
    }

    /**
     * Creates a child cancelled together with this token.
     */
    public CancellationToken child() {
        return attach(new CancellationToken(this, deadline));
    }

    /**
     * Creates a child that additionally cancels itself once {@code timeout} has elapsed.
     * The child keeps the earlier of its own deadline and the inherited one.
     *
     * @param timeout   positive timeout
     * @param scheduler scheduler firing the deadline
     */
    public CancellationToken withTimeout(Duration timeout, ScheduledExecutorService scheduler) {
        Objects.requireNonNull(scheduler, "Scheduler is required");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        Instant own = Instant.now().plus(timeout);
        Instant effective = deadline != null && deadline.isBefore(own) ? deadline : own;
        CancellationToken token = attach(new CancellationToken(this, effective));
        if (!token.isCancelled()) {
            long delayNanos = Math.max(0, Duration.between(Instant.now(), effective).toNanos());
            token.deadlineTask = scheduler.schedule(
                    () -> token.cancel(Reason.DEADLINE_EXCEEDED), delayNanos, TimeUnit.NANOSECONDS);
        }
        return token;
    }

    private CancellationToken attach(CancellationToken token) {
        children.add(token);
        // Parent may have been cancelled concurrently with registration
        Reason parentReason = reason.get();
        if (parentReason != null) {
            token.cancel(parentReason);
        }
        return token;
    }

    /**
     * Cancels this token and all of its descendants.
     */
    public void cancel() {
        cancel(Reason.CANCELLED);
    }

    private void cancel(Reason why) {
        if (!reason.compareAndSet(null, why)) {
            return;
        }
        cancelled.countDown();
        ScheduledFuture<?> task = deadlineTask;
        if (task != null) {
            task.cancel(false);
        }
        for (CancellationToken child : children) {
            child.cancel(why);
        }
        children.clear();
        for (Runnable callback : callbacks) {
            runCallback(callback);
        }
        callbacks.clear();
    }

    /**
     * Registers a callback run once on cancellation. Runs immediately on the calling
     * thread when the token is already cancelled.
     *
     * @return registration to close once the guarded operation is over
     */
    public Registration onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "Callback is required");
        callbacks.add(callback);
        if (isCancelled() && callbacks.remove(callback)) {
            runCallback(callback);
        }
        return () -> callbacks.remove(callback);
    }

    private void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public boolean isDeadlineExceeded() {
        return reason.get() == Reason.DEADLINE_EXCEEDED;
    }

    public Optional<Reason> reason() {
        return Optional.ofNullable(reason.get());
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Blocks until the token is cancelled.
     */
    public void await() throws InterruptedException {
        cancelled.await();
    }

    /**
     * Blocks until the token is cancelled or the wait time elapses.
     *
     * @return true if the token was cancelled
     */
    public boolean await(Duration maxWait) throws InterruptedException {
        return cancelled.await(maxWait.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Releases this token: detaches it from its parent and cancels it.
     * A no-op on a token that was already released.
     */
    @Override
    public void close() {
        if (parent != null) {
            parent.children.remove(this);
        }
        cancel(Reason.CANCELLED);
    }

    int childCount() {
        return children.size();
    }

    @Override
    public String toString() {
        return "CancellationToken{" +
                "reason=" + reason.get() +
                ", deadline=" + deadline +
                '}';
    }

    /**
     * Handle returned by {@link #onCancel(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
