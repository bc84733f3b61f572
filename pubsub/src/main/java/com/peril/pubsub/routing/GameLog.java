package com.peril.pubsub.routing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One line of game history, published under {@code game_logs.<username>}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GameLog(
        @JsonProperty("CurrentTime") Instant currentTime,
        @JsonProperty("Message") String message,
        @JsonProperty("Username") String username
) {
}
