package fr.lapetina.tgbot.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Parameters of one {@code getUpdates} long-poll call.
 *
 * @param offset          identifier of the first update to return; earlier ones are acknowledged
 * @param limit           maximum number of updates to return, 1 to 100
 * @param timeout         long polling timeout in seconds, 0 for short polling
 * @param allowedUpdates  update kinds to receive, empty for the server default
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record GetUpdatesRequest(
        @JsonProperty("offset") long offset,
        @JsonProperty("limit") int limit,
        @JsonProperty("timeout") int timeout,
        @JsonProperty("allowed_updates") List<String> allowedUpdates
) {
    public GetUpdatesRequest {
        allowedUpdates = allowedUpdates != null ? List.copyOf(allowedUpdates) : List.of();
    }
}
