package com.peril.pubsub.routing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Broadcast on {@link Routing#PAUSE_KEY} when the server pauses or resumes the game.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlayingState(@JsonProperty("IsPaused") boolean paused) {
}
