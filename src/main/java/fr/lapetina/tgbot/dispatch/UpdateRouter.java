package fr.lapetina.tgbot.dispatch;

import fr.lapetina.tgbot.dispatch.context.BotContext;
import fr.lapetina.tgbot.domain.command.CommandHandler;
import fr.lapetina.tgbot.domain.command.CommandRegistry;
import fr.lapetina.tgbot.domain.command.Route;
import fr.lapetina.tgbot.domain.command.UpdateHandler;
import fr.lapetina.tgbot.domain.model.Update;

/**
 * Chooses the handler for an update.
 *
 * Commands go to their registered handler, unknown commands to the fallback, anything
 * else to the catch-all update handler when one is configured. Routing depends only on
 * the update and the frozen registry.
 */
public final class UpdateRouter {

    public static final String UNRECOGNIZED_COMMAND_REPLY = "Unrecognized command!!!";

    private static final CommandHandler REPLY_UNRECOGNIZED = ctx -> ctx.replyText(UNRECOGNIZED_COMMAND_REPLY);

    private final CommandRegistry registry;
    private final CommandHandler fallback;
    private final UpdateHandler updatesHandler;

    public UpdateRouter(CommandRegistry registry, CommandHandler fallback, UpdateHandler updatesHandler) {
        this.registry = registry;
        this.fallback = fallback != null ? fallback : REPLY_UNRECOGNIZED;
        this.updatesHandler = updatesHandler;
    }

    public UpdateRouter(CommandRegistry registry, DispatcherConfig config) {
        this(registry,
                config.getUndefinedCommandHandler().orElse(null),
                config.getUpdatesHandler().orElse(null));
    }

    /**
     * Classifies the update without running anything.
     */
    public Route classify(Update update) {
        if (update.isCommand()) {
            return registry.find(update.message().command()).isPresent()
                    ? Route.COMMAND
                    : Route.UNDEFINED_COMMAND;
        }
        return updatesHandler != null ? Route.UPDATE : Route.IGNORED;
    }

    /**
     * Classifies the bound update and runs the handler selected for it.
     *
     * @return the route taken
     * @throws Exception whatever the command handler throws
     */
    public Route route(BotContext ctx) throws Exception {
        Route route = classify(ctx.update());
        invoke(route, ctx);
        return route;
    }

    /**
     * Runs the handler for an already classified update.
     */
    public void invoke(Route route, BotContext ctx) throws Exception {
        switch (route) {
            case COMMAND, UNDEFINED_COMMAND -> registry.resolve(ctx.command(), fallback).handle(ctx);
            case UPDATE -> updatesHandler.handle(ctx);
            case IGNORED -> {
                // nothing to do
            }
        }
    }
}
