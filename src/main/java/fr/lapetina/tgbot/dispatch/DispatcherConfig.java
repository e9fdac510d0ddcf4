package fr.lapetina.tgbot.dispatch;

import fr.lapetina.tgbot.domain.command.CommandHandler;
import fr.lapetina.tgbot.domain.command.ErrorHandler;
import fr.lapetina.tgbot.domain.command.PanicHandler;
import fr.lapetina.tgbot.domain.command.UpdateHandler;
import fr.lapetina.tgbot.infrastructure.config.BotConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * Immutable dispatcher settings.
 *
 * Built once through {@link Builder}, which validates every field and the cross-field
 * constraints; nothing is clamped silently.
 */
public final class DispatcherConfig {

    private static final Logger log = LoggerFactory.getLogger(DispatcherConfig.class);

    /** Upper bound of the Bot API long-poll timeout, in seconds */
    public static final int MAX_POLL_TIMEOUT_SECONDS = 50;

    /** Upper bound of the Bot API {@code getUpdates} limit */
    public static final int MAX_LIMIT = 100;

    public static final String DEFAULT_PANIC_MESSAGE = "oops! Service is temporarily unavailable";

    public static final Set<String> WAIT_STRATEGIES = Set.of("blocking", "yielding", "sleeping", "busy-spin");

    private static final ErrorHandler LOGGING_ERROR_HANDLER = error ->
            log.warn("Dispatch error: kind={}, updateId={}, message={}",
                    error.getKind(), error.getUpdateId(), error.getMessage(), error.getCause());

    private final Duration timeout;
    private final int pollTimeoutSeconds;
    private final int workerNum;
    private final ExecutorService executor;
    private final CommandHandler undefinedCommandHandler;
    private final ErrorHandler errorHandler;
    private final boolean autoSetupCommands;
    private final int bufferSize;
    private final int limit;
    private final UpdateHandler updatesHandler;
    private final PanicHandler panicHandler;
    private final List<String> allowedUpdates;
    private final CancellationToken parentToken;
    private final Duration fetchRetryDelay;
    private final String waitStrategy;
    private final DispatchListener listener;

    private DispatcherConfig(Builder builder) {
        this.timeout = builder.timeout;
        this.pollTimeoutSeconds = builder.pollTimeoutSeconds;
        this.workerNum = builder.workerNum;
        this.executor = builder.executor;
        this.undefinedCommandHandler = builder.undefinedCommandHandler;
        this.errorHandler = builder.errorHandler;
        this.autoSetupCommands = builder.autoSetupCommands;
        this.limit = builder.limit;
        this.bufferSize = builder.bufferSize > 0 ? builder.bufferSize : builder.limit;
        this.updatesHandler = builder.updatesHandler;
        this.panicHandler = builder.panicHandler;
        this.allowedUpdates = List.copyOf(builder.allowedUpdates);
        this.parentToken = builder.parentToken;
        this.fetchRetryDelay = builder.fetchRetryDelay;
        this.waitStrategy = builder.waitStrategy;
        this.listener = builder.listener;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Per-update handling timeout; zero means none.
     */
    public Duration getTimeout() {
        return timeout;
    }

    public boolean hasTimeout() {
        return !timeout.isZero();
    }

    public int getPollTimeoutSeconds() {
        return pollTimeoutSeconds;
    }

    public int getWorkerNum() {
        return workerNum;
    }

    /**
     * External executor that runs handlers; empty means workers run them inline.
     */
    public Optional<ExecutorService> getExecutor() {
        return Optional.ofNullable(executor);
    }

    public Optional<CommandHandler> getUndefinedCommandHandler() {
        return Optional.ofNullable(undefinedCommandHandler);
    }

    public ErrorHandler getErrorHandler() {
        return errorHandler;
    }

    public boolean isAutoSetupCommands() {
        return autoSetupCommands;
    }

    public int getBufferSize() {
        return bufferSize;
    }

    public int getLimit() {
        return limit;
    }

    public Optional<UpdateHandler> getUpdatesHandler() {
        return Optional.ofNullable(updatesHandler);
    }

    public PanicHandler getPanicHandler() {
        return panicHandler;
    }

    public List<String> getAllowedUpdates() {
        return allowedUpdates;
    }

    public Optional<CancellationToken> getParentToken() {
        return Optional.ofNullable(parentToken);
    }

    public Duration getFetchRetryDelay() {
        return fetchRetryDelay;
    }

    public String getWaitStrategy() {
        return waitStrategy;
    }

    public DispatchListener getListener() {
        return listener;
    }

    @Override
    public String toString() {
        return "DispatcherConfig{" +
                "timeout=" + timeout +
                ", pollTimeoutSeconds=" + pollTimeoutSeconds +
                ", workerNum=" + workerNum +
                ", executor=" + (executor != null) +
                ", autoSetupCommands=" + autoSetupCommands +
                ", bufferSize=" + bufferSize +
                ", limit=" + limit +
                ", allowedUpdates=" + allowedUpdates +
                ", fetchRetryDelay=" + fetchRetryDelay +
                ", waitStrategy=" + waitStrategy +
                '}';
    }

    /**
     * Builder for DispatcherConfig.
     */
    public static final class Builder {
        private Duration timeout = Duration.ZERO;
        private int pollTimeoutSeconds = MAX_POLL_TIMEOUT_SECONDS;
        private int workerNum = Runtime.getRuntime().availableProcessors();
        private ExecutorService executor;
        private CommandHandler undefinedCommandHandler;
        private ErrorHandler errorHandler = LOGGING_ERROR_HANDLER;
        private boolean autoSetupCommands = true;
        private int bufferSize;
        private int limit = MAX_LIMIT;
        private UpdateHandler updatesHandler;
        private PanicHandler panicHandler = panic -> DEFAULT_PANIC_MESSAGE;
        private List<String> allowedUpdates = List.of();
        private CancellationToken parentToken;
        private Duration fetchRetryDelay = Duration.ofSeconds(3);
        private String waitStrategy = "blocking";
        private DispatchListener listener = DispatchListener.NOOP;

        private Builder() {
        }

        public Builder timeout(Duration timeout) {
            if (timeout == null || timeout.isNegative()) {
                throw new IllegalArgumentException("Timeout must not be negative: " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        public Builder pollTimeoutSeconds(int seconds) {
            this.pollTimeoutSeconds = seconds;
            return this;
        }

        public Builder workerNum(int workerNum) {
            this.workerNum = workerNum;
            return this;
        }

        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder undefinedCommandHandler(CommandHandler handler) {
            if (handler != null) {
                this.undefinedCommandHandler = handler;
            }
            return this;
        }

        public Builder errorHandler(ErrorHandler handler) {
            if (handler != null) {
                this.errorHandler = handler;
            }
            return this;
        }

        public Builder autoSetupCommands(boolean autoSetupCommands) {
            this.autoSetupCommands = autoSetupCommands;
            return this;
        }

        /**
         * Number of queued updates the channel holds on top of the in-flight ones.
         * Defaults to the fetch limit.
         */
        public Builder bufferSize(int size) {
            if (size < 1) {
                throw new IllegalArgumentException("Buffer size must be positive: " + size);
            }
            this.bufferSize = size;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder updatesHandler(UpdateHandler handler) {
            this.updatesHandler = handler;
            return this;
        }

        public Builder panicHandler(PanicHandler handler) {
            if (handler != null) {
                this.panicHandler = handler;
            }
            return this;
        }

        public Builder allowedUpdates(String... kinds) {
            this.allowedUpdates = kinds != null ? Arrays.asList(kinds) : List.of();
            return this;
        }

        public Builder allowedUpdates(List<String> kinds) {
            this.allowedUpdates = kinds != null ? kinds : List.of();
            return this;
        }

        public Builder parentToken(CancellationToken token) {
            this.parentToken = token;
            return this;
        }

        public Builder fetchRetryDelay(Duration delay) {
            if (delay == null || delay.isNegative() || delay.isZero()) {
                throw new IllegalArgumentException("Fetch retry delay must be positive: " + delay);
            }
            this.fetchRetryDelay = delay;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder listener(DispatchListener listener) {
            if (listener != null) {
                this.listener = listener;
            }
            return this;
        }

        /**
         * Copies the dispatcher section of the YAML configuration. Handlers, executor and
         * parent token are code-only and left untouched.
         */
        public Builder fromConfig(BotConfig config) {
            BotConfig.DispatcherSection section = config.getDispatcher();
            if (section.getTimeoutMs() > 0) {
                timeout(Duration.ofMillis(section.getTimeoutMs()));
            }
            this.pollTimeoutSeconds = section.getPollTimeoutSeconds();
            if (section.getWorkerNum() > 0) {
                this.workerNum = section.getWorkerNum();
            }
            this.autoSetupCommands = section.isAutoSetupCommands();
            if (section.getBufferSize() > 0) {
                bufferSize(section.getBufferSize());
            }
            this.limit = section.getLimit();
            allowedUpdates(section.getAllowedUpdates());
            fetchRetryDelay(Duration.ofMillis(section.getFetchRetryDelayMs()));
            this.waitStrategy = section.getWaitStrategy();
            return this;
        }

        public DispatcherConfig build() {
            if (pollTimeoutSeconds < 0 || pollTimeoutSeconds > MAX_POLL_TIMEOUT_SECONDS) {
                throw new IllegalArgumentException("Poll timeout must be between 0 and "
                        + MAX_POLL_TIMEOUT_SECONDS + " seconds: " + pollTimeoutSeconds);
            }
            if (workerNum < 1) {
                throw new IllegalArgumentException("Worker count must be positive: " + workerNum);
            }
            if (limit < 1 || limit > MAX_LIMIT) {
                throw new IllegalArgumentException("Limit must be between 1 and " + MAX_LIMIT + ": " + limit);
            }
            if (waitStrategy == null || !WAIT_STRATEGIES.contains(waitStrategy.toLowerCase())) {
                throw new IllegalArgumentException("Unknown wait strategy '" + waitStrategy
                        + "', expected one of " + WAIT_STRATEGIES);
            }
            return new DispatcherConfig(this);
        }
    }
}
