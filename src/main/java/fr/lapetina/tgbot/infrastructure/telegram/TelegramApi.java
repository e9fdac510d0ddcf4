package fr.lapetina.tgbot.infrastructure.telegram;

import fr.lapetina.tgbot.dispatch.CancellationToken;
import fr.lapetina.tgbot.domain.model.BotCommand;
import fr.lapetina.tgbot.domain.model.GetUpdatesRequest;
import fr.lapetina.tgbot.domain.model.Message;
import fr.lapetina.tgbot.domain.model.SendMessage;
import fr.lapetina.tgbot.domain.model.Update;

import java.util.List;

/**
 * Bot API operations used by the dispatcher.
 *
 * Every call blocks until the server answers or the token is cancelled; a cancelled call
 * throws a {@link TelegramApiException} whose {@link TelegramApiException#isCancelled()}
 * is true.
 */
public interface TelegramApi {

    /**
     * Long-polls for the next batch of updates.
     */
    List<Update> getUpdates(GetUpdatesRequest request, CancellationToken token) throws TelegramApiException;

    /**
     * Replaces the bot command menu.
     */
    void setMyCommands(List<BotCommand> commands, CancellationToken token) throws TelegramApiException;

    /**
     * Sends a text message and returns the message as stored by Telegram.
     */
    Message send(SendMessage message, CancellationToken token) throws TelegramApiException;
}
