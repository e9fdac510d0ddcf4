package fr.lapetina.tgbot.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Special entity in a message text. Offsets and lengths are in UTF-16 code units,
 * which matches {@link String} indexing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MessageEntity(
        @JsonProperty("type") String type,
        @JsonProperty("offset") int offset,
        @JsonProperty("length") int length
) {

    public static final String BOT_COMMAND = "bot_command";

    public boolean isCommand() {
        return BOT_COMMAND.equals(type);
    }
}
