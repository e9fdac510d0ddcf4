/**
 * Update acquisition and dispatch.
 *
 * <p>One poller thread fetches updates and publishes them into a Disruptor ring buffer;
 * a single distributor hands each update to exactly one idle worker.
 *
 * <h2>Flow</h2>
 * <pre>
 * getUpdates → dedup by offset → ring buffer → distributor → worker → router → handler
 * </pre>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.tgbot.dispatch.UpdateDispatcher} - Lifecycle controller</li>
 *   <li>{@link fr.lapetina.tgbot.dispatch.DispatcherConfig} - Validated, immutable settings</li>
 *   <li>{@link fr.lapetina.tgbot.dispatch.CancellationToken} - Shutdown and timeout signal</li>
 *   <li>{@link fr.lapetina.tgbot.dispatch.DispatchListener} - Hook for metrics</li>
 * </ul>
 *
 * @see fr.lapetina.tgbot.dispatch.UpdateDispatcher
 */
package fr.lapetina.tgbot.dispatch;
