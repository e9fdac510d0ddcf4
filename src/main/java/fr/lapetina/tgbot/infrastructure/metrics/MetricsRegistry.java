package fr.lapetina.tgbot.infrastructure.metrics;

import fr.lapetina.tgbot.dispatch.DispatchListener;
import fr.lapetina.tgbot.dispatch.UpdateDispatcher;
import fr.lapetina.tgbot.dispatch.exception.DispatchException;
import fr.lapetina.tgbot.domain.command.Route;
import fr.lapetina.tgbot.domain.model.Update;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dispatcher metrics on Micrometer, exposed in Prometheus format.
 *
 * Provides:
 * - Received, duplicate and handled update counters (handled tagged by route)
 * - Handler latency per route
 * - Error counters by kind
 * - Offset, running worker and channel capacity gauges once a dispatcher is bound
 * - JVM and system metrics
 */
public final class MetricsRegistry implements DispatchListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final Counter receivedCounter;
    private final Counter duplicateCounter;

    // Cache for tagged meters
    private final ConcurrentHashMap<Route, Counter> handledCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Route, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<DispatchException.ErrorKind, Counter> errorCounters = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.receivedCounter = Counter.builder(prefix + "_updates_received")
                .description("Updates accepted by the poller")
                .register(registry);
        this.duplicateCounter = Counter.builder(prefix + "_updates_duplicate")
                .description("Redelivered updates dropped by the poller")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("tgbot");
    }

    /**
     * Registers gauges reading the dispatcher state.
     */
    public void bind(UpdateDispatcher dispatcher) {
        Gauge.builder(prefix + "_offset", dispatcher, UpdateDispatcher::offset)
                .description("Next update id requested from the Bot API")
                .register(registry);
        Gauge.builder(prefix + "_workers_running", dispatcher, UpdateDispatcher::runningWorkers)
                .description("Running worker threads")
                .register(registry);
        Gauge.builder(prefix + "_channel_remaining", dispatcher, UpdateDispatcher::remainingCapacity)
                .description("Free slots in the update channel")
                .register(registry);
    }

    @Override
    public void onUpdateReceived(Update update, long offset) {
        receivedCounter.increment();
    }

    @Override
    public void onDuplicateDropped(Update update, long offset) {
        duplicateCounter.increment();
    }

    @Override
    public void onUpdateHandled(Update update, Route route, Duration latency) {
        handledCounters.computeIfAbsent(route, r ->
                Counter.builder(prefix + "_updates_handled")
                        .description("Updates that completed their handler")
                        .tag("route", r.name())
                        .register(registry)
        ).increment();
        latencyTimers.computeIfAbsent(route, r ->
                Timer.builder(prefix + "_handler_latency")
                        .description("Handler latency")
                        .tag("route", r.name())
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(latency);
    }

    @Override
    public void onError(DispatchException error) {
        errorCounters.computeIfAbsent(error.getKind(), kind ->
                Counter.builder(prefix + "_errors")
                        .description("Errors reported by the dispatcher")
                        .tag("kind", kind.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
