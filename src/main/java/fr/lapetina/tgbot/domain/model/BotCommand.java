package fr.lapetina.tgbot.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Entry of the bot command menu, as sent to {@code setMyCommands}.
 */
public record BotCommand(
        @JsonProperty("command") String command,
        @JsonProperty("description") String description
) {
}
