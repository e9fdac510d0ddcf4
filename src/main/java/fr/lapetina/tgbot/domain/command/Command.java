package fr.lapetina.tgbot.domain.command;

import java.util.Objects;

/**
 * Telegram bot command.
 *
 * @param name        command name without the leading slash
 * @param description text shown in the command menu
 * @param hidden      whether the command is left out of the command menu
 * @param handler     handler invoked for the command
 */
public record Command(
        String name,
        String description,
        boolean hidden,
        CommandHandler handler
) {
    public Command {
        Objects.requireNonNull(name, "Name is required");
        Objects.requireNonNull(handler, "Handler is required");
        if (name.isBlank() || name.startsWith("/")) {
            throw new IllegalArgumentException("Command name must be non-blank and without '/': " + name);
        }
        description = description != null ? description : "";
    }

    /**
     * Creates a command listed in the command menu.
     */
    public static Command of(String name, String description, CommandHandler handler) {
        return new Command(name, description, false, handler);
    }

    /**
     * Creates a command that works but is left out of the command menu.
     */
    public static Command hidden(String name, String description, CommandHandler handler) {
        return new Command(name, description, true, handler);
    }

    /**
     * Menu line, e.g. {@code "/start - Start the bot"}.
     */
    @Override
    public String toString() {
        return "/" + name + " - " + description;
    }
}
