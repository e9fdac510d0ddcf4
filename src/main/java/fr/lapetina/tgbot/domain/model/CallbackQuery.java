package fr.lapetina.tgbot.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Callback from an inline keyboard button.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CallbackQuery(
        @JsonProperty("id") String id,
        @JsonProperty("from") User from,
        @JsonProperty("message") Message message,
        @JsonProperty("data") String data
) {
}
