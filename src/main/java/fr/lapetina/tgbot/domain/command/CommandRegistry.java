package fr.lapetina.tgbot.domain.command;

import fr.lapetina.tgbot.domain.model.BotCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of bot commands.
 *
 * Keeps a name to handler map for O(1) lookup and the registration order for the
 * command menu. All registrations happen before the dispatcher starts; the dispatcher
 * freezes the registry on start, after which it is read-only.
 */
public final class CommandRegistry {

    private static final Logger log = LoggerFactory.getLogger(CommandRegistry.class);

    private final Map<String, Command> commandsByName = new ConcurrentHashMap<>();
    private final List<Command> commands = new CopyOnWriteArrayList<>();
    private volatile boolean frozen;

    /**
     * Registers a command.
     *
     * @throws IllegalArgumentException if a command with the same name exists
     * @throws IllegalStateException    if the registry is frozen
     */
    public void register(Command command) {
        if (frozen) {
            throw new IllegalStateException("Commands cannot be added once the dispatcher has started: /" + command.name());
        }
        if (commandsByName.putIfAbsent(command.name(), command) != null) {
            throw new IllegalArgumentException("Command already registered: /" + command.name());
        }
        commands.add(command);
        log.debug("Command registered: name={}, hidden={}", command.name(), command.hidden());
    }

    /**
     * Looks up the handler for a command name.
     */
    public Optional<CommandHandler> find(String name) {
        Command command = commandsByName.get(name);
        return command != null ? Optional.of(command.handler()) : Optional.empty();
    }

    /**
     * Resolves a command name to its handler, or to the fallback when unknown.
     */
    public CommandHandler resolve(String name, CommandHandler fallback) {
        Command command = commandsByName.get(name);
        return command != null ? command.handler() : fallback;
    }

    /**
     * Returns all commands in registration order, hidden ones included.
     */
    public List<Command> allCommands() {
        return Collections.unmodifiableList(new ArrayList<>(commands));
    }

    /**
     * Returns the menu commands: registration order, hidden ones excluded.
     */
    public List<Command> visibleCommands() {
        return commands.stream()
                .filter(command -> !command.hidden())
                .toList();
    }

    /**
     * Returns the menu as {@code "/name - description"} lines.
     */
    public List<String> menu() {
        return visibleCommands().stream()
                .map(Command::toString)
                .toList();
    }

    /**
     * Returns the visible commands in the form expected by {@code setMyCommands}.
     */
    public List<BotCommand> toBotCommands() {
        return visibleCommands().stream()
                .map(command -> new BotCommand(command.name(), command.description()))
                .toList();
    }

    /**
     * Makes the registry read-only. Called by the dispatcher on start.
     */
    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public int size() {
        return commands.size();
    }
}
