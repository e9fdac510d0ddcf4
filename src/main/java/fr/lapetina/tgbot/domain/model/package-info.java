/**
 * Telegram Bot API data model.
 *
 * <p>All types are immutable records mapped with Jackson. Unknown JSON properties are
 * ignored so that newer Bot API versions do not break deserialization.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.tgbot.domain.model.Update} - Incoming update, identified by a strictly increasing id</li>
 *   <li>{@link fr.lapetina.tgbot.domain.model.Message} - Message payload with command parsing</li>
 *   <li>{@link fr.lapetina.tgbot.domain.model.SendMessage} - Outgoing text message</li>
 *   <li>{@link fr.lapetina.tgbot.domain.model.GetUpdatesRequest} - Long-poll parameters</li>
 * </ul>
 */
package fr.lapetina.tgbot.domain.model;
