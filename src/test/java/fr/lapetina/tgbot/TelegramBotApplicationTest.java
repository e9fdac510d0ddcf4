package fr.lapetina.tgbot;

import fr.lapetina.tgbot.dispatch.DispatcherState;
import fr.lapetina.tgbot.integration.StubTelegramApi;
import fr.lapetina.tgbot.integration.TestBotFactory;
import io.micrometer.core.instrument.Counter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static fr.lapetina.tgbot.integration.StubTelegramApi.textUpdate;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Wires the application from test-config.yaml against the scripted Bot API.
 */
class TelegramBotApplicationTest {

    private TelegramBotApplication app;

    @AfterEach
    void tearDown() {
        if (app != null) {
            app.close();
        }
    }

    @Test
    @DisplayName("should apply the YAML dispatcher settings")
    void shouldApplyYamlSettings() throws Exception {
        TestBotFactory factory = TestBotFactory.create();
        app = new TelegramBotApplication(factory);

        assertThat(factory.getDispatcher().config().getWorkerNum()).isEqualTo(2);
        assertThat(factory.getDispatcher().config().getTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(factory.getDispatcher().config().getWaitStrategy()).isEqualTo("sleeping");
        assertThat(factory.getMetricsRegistry()).isNotNull();
        assertThat(app.getAdminServer()).isNotNull();
    }

    @Test
    @DisplayName("should publish the menu and answer built-in commands")
    void shouldAnswerBuiltInCommands() throws Exception {
        TestBotFactory factory = TestBotFactory.create();
        StubTelegramApi stub = factory.stub();
        stub.enqueueBatch(textUpdate(1, 5, "/ping"));
        app = new TelegramBotApplication(factory);

        app.start();

        assertThat(stub.awaitSent(1, Duration.ofSeconds(5))).isTrue();
        assertThat(stub.sentTexts()).containsExactly("pong");
        assertThat(stub.publishedMenus()).hasSize(1);
        assertThat(stub.publishedMenus().get(0)).hasSize(2);

        stub.enqueueBatch(textUpdate(2, 5, "/help"));
        assertThat(stub.awaitSent(2, Duration.ofSeconds(5))).isTrue();
        assertThat(stub.sentTexts().get(1))
                .isEqualTo("/help - Show available commands\n/ping - Check that the bot is alive");
    }

    @Test
    @DisplayName("should count handled updates in the metrics")
    void shouldCountHandledUpdates() throws Exception {
        TestBotFactory factory = TestBotFactory.create();
        factory.stub().enqueueBatch(textUpdate(1, 5, "/ping"), textUpdate(2, 5, "hello"));
        app = new TelegramBotApplication(factory);

        app.start();

        assertThat(factory.stub().awaitSent(1, Duration.ofSeconds(5))).isTrue();
        Counter received = factory.getMetricsRegistry().getRegistry().get("tgbot_test_updates_received").counter();
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (received.count() < 2.0 && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertThat(received.count()).isEqualTo(2.0);
        assertThat(factory.getDispatcher().offset()).isEqualTo(3);
    }

    @Test
    @DisplayName("should stop the dispatcher on close")
    void shouldStopOnClose() throws Exception {
        TestBotFactory factory = TestBotFactory.create(builder -> builder.workerNum(1));
        app = new TelegramBotApplication(factory);
        app.start();
        assertThat(factory.getDispatcher().runningWorkers()).isEqualTo(1);

        app.close();
        app = null;

        assertThat(factory.getDispatcher().state()).isEqualTo(DispatcherState.STOPPED);
        assertThat(factory.getDispatcher().runningWorkers()).isZero();
    }
}
