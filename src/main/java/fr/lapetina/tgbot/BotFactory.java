package fr.lapetina.tgbot;

import fr.lapetina.tgbot.dispatch.DispatcherConfig;
import fr.lapetina.tgbot.dispatch.UpdateDispatcher;
import fr.lapetina.tgbot.domain.command.Command;
import fr.lapetina.tgbot.domain.command.CommandHandler;
import fr.lapetina.tgbot.infrastructure.config.BotConfig;
import fr.lapetina.tgbot.infrastructure.config.ConfigLoader;
import fr.lapetina.tgbot.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.tgbot.infrastructure.telegram.TelegramApi;
import fr.lapetina.tgbot.infrastructure.telegram.TelegramHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Factory for creating a fully-wired dispatcher from configuration.
 * This is the primary entry point for running a bot.
 *
 * <p>Usage:
 * <pre>{@code
 * try (BotFactory factory = BotFactory.create("config.yaml")) {
 *     factory.addCommand("ping", "Health check", ctx -> ctx.replyText("pong"));
 *     factory.start();
 *     factory.getDispatcher().awaitTermination();
 * }
 * }</pre>
 */
public class BotFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BotFactory.class);

    private final BotConfig config;
    private final MetricsRegistry metricsRegistry;
    private final TelegramApi api;
    private final UpdateDispatcher dispatcher;

    /**
     * @param apiOverride replaces the HTTP client, for tests
     * @param customizer  sets the code-only options (handlers, executor, parent token)
     */
    protected BotFactory(String configPath, TelegramApi apiOverride, Consumer<DispatcherConfig.Builder> customizer) {
        log.info("Initializing BotFactory from config: {}", configPath);

        this.config = new ConfigLoader(configPath).load();

        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new MetricsRegistry(config.getMetrics().getPrefix())
                : null;

        this.api = apiOverride != null ? apiOverride : createHttpClient();

        DispatcherConfig.Builder builder = DispatcherConfig.builder().fromConfig(config);
        if (metricsRegistry != null) {
            builder.listener(metricsRegistry);
        }
        if (customizer != null) {
            customizer.accept(builder);
        }
        this.dispatcher = new UpdateDispatcher(api, builder.build());

        if (metricsRegistry != null) {
            metricsRegistry.bind(dispatcher);
        }

        log.info("BotFactory initialized");
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static BotFactory create(String configPath) {
        return new BotFactory(configPath, null, null);
    }

    /**
     * Creates a factory whose dispatcher options are adjusted in code after the file is applied.
     */
    public static BotFactory create(String configPath, Consumer<DispatcherConfig.Builder> customizer) {
        return new BotFactory(configPath, null, customizer);
    }

    public BotFactory addCommand(Command command) {
        dispatcher.addCommand(command);
        return this;
    }

    public BotFactory addCommand(String name, String description, CommandHandler handler) {
        dispatcher.addCommand(name, description, handler);
        return this;
    }

    /**
     * Starts the dispatcher. Commands must be registered before.
     */
    public BotFactory start() {
        dispatcher.start();
        log.info("Bot started");
        return this;
    }

    public UpdateDispatcher getDispatcher() {
        return dispatcher;
    }

    /**
     * Returns the metrics registry, or null when metrics are disabled.
     */
    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public TelegramApi getApi() {
        return api;
    }

    public BotConfig getConfig() {
        return config;
    }

    private TelegramApi createHttpClient() {
        BotConfig.TelegramConfig telegram = config.getTelegram();
        if (telegram.getToken() == null || telegram.getToken().isBlank()) {
            throw new ConfigLoader.ConfigurationException("Bot token is missing: set telegram.token or "
                    + ConfigLoader.TOKEN_ENV);
        }
        return new TelegramHttpClient(
                telegram.getApiUrl(),
                telegram.getToken(),
                Duration.ofMillis(telegram.getConnectTimeoutMs()),
                Duration.ofMillis(telegram.getRequestTimeoutMs()));
    }

    @Override
    public void close() {
        log.info("Shutting down BotFactory...");

        try {
            dispatcher.close();
        } catch (Exception e) {
            log.warn("Error closing dispatcher", e);
        }

        if (api instanceof AutoCloseable) {
            try {
                ((AutoCloseable) api).close();
            } catch (Exception e) {
                log.warn("Error closing Telegram client", e);
            }
        }

        if (metricsRegistry != null) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }

        log.info("BotFactory shut down");
    }
}
