package fr.lapetina.tgbot.infrastructure.metrics;

import fr.lapetina.tgbot.dispatch.DispatcherConfig;
import fr.lapetina.tgbot.dispatch.UpdateDispatcher;
import fr.lapetina.tgbot.dispatch.exception.DispatchException;
import fr.lapetina.tgbot.dispatch.exception.DispatchException.ErrorKind;
import fr.lapetina.tgbot.domain.command.Route;
import fr.lapetina.tgbot.integration.StubTelegramApi;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static fr.lapetina.tgbot.integration.StubTelegramApi.textUpdate;
import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry("bot");
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("should count received and duplicate updates")
    void shouldCountUpdates() {
        metrics.onUpdateReceived(textUpdate(1, 5, "a"), 2);
        metrics.onUpdateReceived(textUpdate(2, 5, "b"), 3);
        metrics.onDuplicateDropped(textUpdate(1, 5, "a"), 3);

        MeterRegistry registry = metrics.getRegistry();
        assertThat(registry.get("bot_updates_received").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("bot_updates_duplicate").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should tag handled updates and latency by route")
    void shouldTagByRoute() {
        metrics.onUpdateHandled(textUpdate(1, 5, "/a"), Route.COMMAND, Duration.ofMillis(10));
        metrics.onUpdateHandled(textUpdate(2, 5, "/b"), Route.COMMAND, Duration.ofMillis(30));
        metrics.onUpdateHandled(textUpdate(3, 5, "c"), Route.IGNORED, Duration.ofMillis(1));

        MeterRegistry registry = metrics.getRegistry();
        assertThat(registry.get("bot_updates_handled").tag("route", "COMMAND").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("bot_updates_handled").tag("route", "IGNORED").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("bot_handler_latency").tag("route", "COMMAND").timer().count()).isEqualTo(2);
    }

    @Test
    @DisplayName("should count errors by kind")
    void shouldCountErrorsByKind() {
        metrics.onError(new DispatchException(ErrorKind.PANIC, "boom", null, 1));
        metrics.onError(new DispatchException(ErrorKind.PANIC, "boom", null, 2));
        metrics.onError(new DispatchException(ErrorKind.TRANSPORT, "down", null));

        MeterRegistry registry = metrics.getRegistry();
        assertThat(registry.get("bot_errors").tag("kind", "PANIC").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("bot_errors").tag("kind", "TRANSPORT").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should expose dispatcher gauges in the Prometheus scrape")
    void shouldExposeGauges() {
        UpdateDispatcher dispatcher = new UpdateDispatcher(new StubTelegramApi(),
                DispatcherConfig.builder().workerNum(1).build());

        metrics.bind(dispatcher);

        assertThat(metrics.getRegistry().get("bot_workers_running").gauge().value()).isZero();
        assertThat(metrics.scrape())
                .contains("bot_offset")
                .contains("bot_channel_remaining")
                .contains("jvm_memory_used_bytes");
    }
}
