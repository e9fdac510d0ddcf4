/**
 * Telegram bot update dispatcher.
 *
 * <p>Long-polls the Telegram Bot API, deduplicates updates by id and fans them out to a
 * bounded pool of workers that route each update to a command or catch-all handler.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.tgbot.BotFactory} - Builds a fully-wired dispatcher from YAML configuration</li>
 *   <li>{@link fr.lapetina.tgbot.TelegramBotApplication} - Standalone bot with an admin HTTP endpoint</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (BotFactory factory = BotFactory.create("config.yaml")) {
 *     factory.addCommand("start", "Say hello", ctx -> ctx.replyText("Hello!"));
 *     factory.start();
 *     factory.getDispatcher().awaitTermination();
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Exactly-once enqueue per update id, in fetch order</li>
 *   <li>Backpressure from the workers to the poller via the ring buffer</li>
 *   <li>Panic recovery with a configurable apology reply</li>
 *   <li>Per-update timeouts and cooperative cancellation</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.tgbot.BotFactory
 * @see fr.lapetina.tgbot.dispatch.UpdateDispatcher
 */
package fr.lapetina.tgbot;
