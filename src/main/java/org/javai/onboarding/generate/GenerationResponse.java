package org.javai.onboarding.generate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param dsl the generated, validated DSL
 * @param verb the verb the matched template produces
 * @param parameters the matched pattern, the generation time and the values taken from the instruction
 */
public record GenerationResponse(String dsl, String verb, Map<String, Object> parameters) {

	public GenerationResponse {
		parameters = parameters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
	}
}
