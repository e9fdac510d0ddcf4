package fr.lapetina.tgbot.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Telegram chat (private, group, supergroup or channel).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Chat(
        @JsonProperty("id") long id,
        @JsonProperty("type") String type,
        @JsonProperty("title") String title,
        @JsonProperty("username") String username
) {

    public static Chat ofPrivate(long id) {
        return new Chat(id, "private", null, null);
    }
}
