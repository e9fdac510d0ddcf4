package fr.lapetina.tgbot.domain.command;

import fr.lapetina.tgbot.dispatch.context.BotContext;

/**
 * Handles one command.
 *
 * A checked exception is a handler error: it is reported and the update is done.
 * An unchecked exception is treated as a panic and additionally triggers the panic reply.
 */
@FunctionalInterface
public interface CommandHandler {

    void handle(BotContext ctx) throws Exception;
}
