package fr.lapetina.tgbot.dispatch;

import fr.lapetina.tgbot.dispatch.context.BotContext;
import fr.lapetina.tgbot.dispatch.context.BotContextPool;
import fr.lapetina.tgbot.dispatch.exception.DispatchException;
import fr.lapetina.tgbot.dispatch.exception.DispatchException.ErrorKind;
import fr.lapetina.tgbot.domain.command.Command;
import fr.lapetina.tgbot.domain.command.CommandRegistry;
import fr.lapetina.tgbot.domain.command.Route;
import fr.lapetina.tgbot.domain.model.Update;
import fr.lapetina.tgbot.infrastructure.telegram.TelegramApiException;
import fr.lapetina.tgbot.integration.StubTelegramApi;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicReference;

import static fr.lapetina.tgbot.integration.StubTelegramApi.textUpdate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UpdateExecutorTest {

    private StubTelegramApi api;
    private BotContextPool pool;
    private CommandRegistry registry;
    private List<DispatchException> errors;
    private List<Route> handled;
    private CancellationToken root;
    private ScheduledExecutorService scheduler;

    @BeforeEach
    void setUp() {
        api = new StubTelegramApi();
        pool = new BotContextPool(api);
        registry = new CommandRegistry();
        errors = new CopyOnWriteArrayList<>();
        handled = new CopyOnWriteArrayList<>();
        root = CancellationToken.create();
        scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        root.cancel();
        scheduler.shutdownNow();
    }

    @Test
    @DisplayName("should report a failing handler as HANDLER without replying")
    void shouldReportHandlerError() {
        registry.register(Command.of("fail", "Fails", ctx -> {
            throw new IOException("disk full");
        }));

        executor(DispatcherConfig.builder()).execute(textUpdate(1, 5, "/fail"));

        assertThat(errors).hasSize(1);
        DispatchException error = errors.get(0);
        assertThat(error.getKind()).isEqualTo(ErrorKind.HANDLER);
        assertThat(error.getUpdateId()).isEqualTo(1);
        assertThat(error.getMessage()).contains("/fail").contains("disk full");
        assertThat(error.getCause()).isInstanceOf(IOException.class);
        assertThat(api.sent()).isEmpty();
    }

    @Test
    @DisplayName("should recover from a panic and reply the apology")
    void shouldRecoverFromPanic() {
        registry.register(Command.of("boom", "Panics", ctx -> {
            throw new IllegalStateException("boom");
        }));

        executor(DispatcherConfig.builder()).execute(textUpdate(2, 9, "/boom"));

        assertThat(errors).extracting(DispatchException::getKind).containsExactly(ErrorKind.PANIC);
        assertThat(errors.get(0).getCause()).hasMessage("boom");
        assertThat(api.sentTexts()).containsExactly(DispatcherConfig.DEFAULT_PANIC_MESSAGE);
        assertThat(api.sent().get(0).chatId()).isEqualTo(9);
    }

    @Test
    @DisplayName("should recover from an Error thrown by a handler")
    void shouldRecoverFromError() {
        registry.register(Command.of("assert", "Asserts", ctx -> {
            throw new AssertionError("bad state");
        }));

        executor(DispatcherConfig.builder()).execute(textUpdate(3, 9, "/assert"));

        assertThat(errors).extracting(DispatchException::getKind).containsExactly(ErrorKind.PANIC);
    }

    @Test
    @DisplayName("should pass the panic to the panic handler and skip empty tips")
    void shouldUsePanicHandler() {
        AtomicReference<Throwable> seen = new AtomicReference<>();
        registry.register(Command.of("boom", "Panics", ctx -> {
            throw new IllegalStateException("boom");
        }));

        executor(DispatcherConfig.builder().panicHandler(panic -> {
            seen.set(panic);
            return "";
        })).execute(textUpdate(4, 9, "/boom"));

        assertThat(seen.get()).hasMessage("boom");
        assertThat(api.sent()).isEmpty();
    }

    @Test
    @DisplayName("should reply a whitespace-only tip as is")
    void shouldReplyWhitespaceTip() {
        registry.register(Command.of("boom", "Panics", ctx -> {
            throw new IllegalStateException("boom");
        }));

        executor(DispatcherConfig.builder().panicHandler(panic -> "  ")).execute(textUpdate(5, 9, "/boom"));

        assertThat(api.sentTexts()).containsExactly("  ");
    }

    @Test
    @DisplayName("should report a failed apology as REPLY")
    void shouldReportFailedApology() {
        api.failSend(new TelegramApiException("Forbidden: bot was blocked by the user", 403));
        registry.register(Command.of("boom", "Panics", ctx -> {
            throw new IllegalStateException("boom");
        }));

        executor(DispatcherConfig.builder()).execute(textUpdate(5, 9, "/boom"));

        assertThat(errors).extracting(DispatchException::getKind)
                .containsExactly(ErrorKind.PANIC, ErrorKind.REPLY);
        assertThat(((TelegramApiException) errors.get(1).getCause()).getErrorCode()).isEqualTo(403);
    }

    @Test
    @DisplayName("should release the context whatever the outcome")
    void shouldReleaseContext() {
        AtomicReference<BotContext> captured = new AtomicReference<>();
        registry.register(Command.of("boom", "Panics", ctx -> {
            captured.set(ctx);
            throw new IllegalStateException("boom");
        }));
        UpdateExecutor executor = executor(DispatcherConfig.builder());

        executor.execute(textUpdate(6, 9, "/boom"));

        assertThat(captured.get().isBound()).isFalse();
        assertThat(pool.idle()).isEqualTo(1);
        assertThat(MDC.get("updateId")).isNull();
        assertThat(MDC.get("command")).isNull();
    }

    @Test
    @DisplayName("should bind a deadline scope that is closed after handling")
    void shouldScopeHandlerWithTimeout() {
        AtomicReference<CancellationToken> scope = new AtomicReference<>();
        registry.register(Command.of("slow", "Slow", ctx -> {
            scope.set(ctx.token());
            assertThat(ctx.deadline()).isPresent();
        }));

        executor(DispatcherConfig.builder().timeout(Duration.ofSeconds(30))).execute(textUpdate(7, 9, "/slow"));

        assertThat(scope.get()).isNotSameAs(root);
        assertThat(scope.get().isCancelled()).isTrue();
        assertThat(scope.get().isDeadlineExceeded()).isFalse();
        assertThat(root.isCancelled()).isFalse();
        assertThat(root.childCount()).isZero();
        assertThat(errors).isEmpty();
    }

    @Test
    @DisplayName("should expire the scope when the handler outlives the timeout")
    void shouldExpireScope() {
        AtomicReference<Boolean> expired = new AtomicReference<>(false);
        registry.register(Command.of("slow", "Slow", ctx -> expired.set(ctx.token().await(Duration.ofSeconds(5))
                && ctx.token().isDeadlineExceeded())));

        executor(DispatcherConfig.builder().timeout(Duration.ofMillis(50))).execute(textUpdate(8, 9, "/slow"));

        assertThat(expired.get()).isTrue();
        assertThat(root.isCancelled()).isFalse();
    }

    @Test
    @DisplayName("should notify the listener with the route taken")
    void shouldNotifyListener() {
        registry.register(Command.of("ok", "Ok", ctx -> { }));
        UpdateExecutor executor = executor(DispatcherConfig.builder());

        executor.execute(textUpdate(9, 9, "/ok"));
        executor.execute(textUpdate(10, 9, "plain text"));

        assertThat(handled).containsExactly(Route.COMMAND, Route.IGNORED);
    }

    @Test
    @DisplayName("should survive a failing error handler")
    void shouldSurviveFailingErrorHandler() {
        registry.register(Command.of("boom", "Panics", ctx -> {
            throw new IllegalStateException("boom");
        }));
        DispatcherConfig config = DispatcherConfig.builder().autoSetupCommands(false).build();
        UpdateExecutor executor = new UpdateExecutor(config, new UpdateRouter(registry, config), pool, root, scheduler,
                new ErrorReporter(error -> {
                    throw new IllegalStateException("handler down");
                }, DispatchListener.NOOP));

        executor.execute(textUpdate(11, 9, "/boom"));

        assertThat(api.sentTexts()).containsExactly(DispatcherConfig.DEFAULT_PANIC_MESSAGE);
    }

    @Test
    @DisplayName("should require a scheduler when a timeout is configured")
    void shouldRequireScheduler() {
        DispatcherConfig config = DispatcherConfig.builder().timeout(Duration.ofSeconds(1)).build();

        assertThatThrownBy(() -> new UpdateExecutor(config, new UpdateRouter(registry, config), pool, root, null,
                new ErrorReporter(config)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private UpdateExecutor executor(DispatcherConfig.Builder builder) {
        DispatcherConfig config = builder
                .errorHandler(errors::add)
                .listener(new DispatchListener() {
                    @Override
                    public void onUpdateHandled(Update update, Route route, Duration latency) {
                        handled.add(route);
                    }
                })
                .build();
        return new UpdateExecutor(config, new UpdateRouter(registry, config), pool, root, scheduler,
                new ErrorReporter(config));
    }
}
