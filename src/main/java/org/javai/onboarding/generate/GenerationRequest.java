package org.javai.onboarding.generate;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A free-text instruction plus optional context values, e.g. {@code from_state} for a workflow transition.
 */
public record GenerationRequest(String instruction, Map<String, Object> context) {

	public GenerationRequest {
		context = context != null ? Collections.unmodifiableMap(new HashMap<>(context)) : Map.of();
	}

	public static GenerationRequest of(String instruction) {
		return new GenerationRequest(instruction, Map.of());
	}

	public Optional<String> contextValue(String key) {
		Object value = context.get(key);
		return value != null ? Optional.of(value.toString()) : Optional.empty();
	}
}
