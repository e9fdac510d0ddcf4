/**
 * YAML configuration loading.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code telegram} - Bot token and API endpoint</li>
 *   <li>{@code dispatcher} - Polling, workers and ring buffer settings</li>
 *   <li>{@code admin} - Admin HTTP endpoint</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.tgbot.infrastructure.config.ConfigLoader
 */
package fr.lapetina.tgbot.infrastructure.config;
