package org.javai.onboarding.dictionary;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where an attribute's value is delivered.
 */
public record SinkMetadata(
		@JsonProperty("system") String system,
		@JsonProperty("location") String location
) {
}
