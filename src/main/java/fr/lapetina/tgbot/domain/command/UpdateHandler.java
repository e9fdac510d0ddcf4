package fr.lapetina.tgbot.domain.command;

import fr.lapetina.tgbot.dispatch.context.BotContext;

/**
 * Catch-all handler for updates that are not commands.
 */
@FunctionalInterface
public interface UpdateHandler {

    void handle(BotContext ctx);
}
