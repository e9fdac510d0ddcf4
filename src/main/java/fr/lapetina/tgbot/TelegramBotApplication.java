package fr.lapetina.tgbot;

import fr.lapetina.tgbot.api.AdminServer;
import fr.lapetina.tgbot.domain.command.Command;
import fr.lapetina.tgbot.infrastructure.config.BotConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the Telegram bot.
 */
public class TelegramBotApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TelegramBotApplication.class);

    private final BotFactory factory;
    private final AdminServer adminServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public TelegramBotApplication(String configPath) throws Exception {
        this(BotFactory.create(configPath));
    }

    TelegramBotApplication(BotFactory factory) throws Exception {
        log.info("Starting Telegram bot...");

        this.factory = factory;
        registerCommands();

        BotConfig.AdminConfig admin = factory.getConfig().getAdmin();
        this.adminServer = admin.isEnabled()
                ? new AdminServer(
                        admin.getHost(),
                        admin.getPort(),
                        admin.getBacklog(),
                        factory.getDispatcher(),
                        factory.getMetricsRegistry())
                : null;

        log.info("Telegram bot initialized");
    }

    private void registerCommands() {
        factory.addCommand(Command.of("help", "Show available commands",
                ctx -> ctx.replyText(String.join("\n", factory.getDispatcher().commands().menu()))));
        factory.addCommand(Command.of("ping", "Check that the bot is alive",
                ctx -> ctx.replyText("pong")));
    }

    public void start() {
        if (adminServer != null) {
            adminServer.start();
        }
        factory.start();
        log.info("Telegram bot started");
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public BotFactory getFactory() {
        return factory;
    }

    AdminServer getAdminServer() {
        return adminServer;
    }

    @Override
    public void close() {
        log.info("Shutting down Telegram bot...");

        if (adminServer != null) {
            try {
                adminServer.close();
            } catch (Exception e) {
                log.warn("Error closing admin server", e);
            }
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Telegram bot shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            TelegramBotApplication app = new TelegramBotApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start Telegram bot", e);
            System.exit(1);
        }
    }
}
