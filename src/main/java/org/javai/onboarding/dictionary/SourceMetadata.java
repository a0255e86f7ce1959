package org.javai.onboarding.dictionary;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where an attribute's value originates.
 */
public record SourceMetadata(
		@JsonProperty("system") String system,
		@JsonProperty("location") String location,
		@JsonProperty("format") String format
) {
}
