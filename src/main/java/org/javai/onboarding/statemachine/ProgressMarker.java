package org.javai.onboarding.statemachine;

/**
 * Links a context key to the state it proves has been reached.
 *
 * @param contextKey key in the extracted context, e.g. {@code kyc_started}
 * @param state the state reached once the key is set
 * @param verb verb whose presence sets the key as a boolean flag, or {@code null} when the key
 *             is filled by a captured value instead
 */
public record ProgressMarker(String contextKey, String state, String verb) {

	public ProgressMarker {
		if (contextKey == null || contextKey.isBlank()) {
			throw new IllegalArgumentException("Marker key must not be blank");
		}
		if (state == null || state.isBlank()) {
			throw new IllegalArgumentException("Marker state must not be blank");
		}
	}

	public static ProgressMarker verb(String verb, String contextKey, String state) {
		return new ProgressMarker(contextKey, state, verb);
	}

	public static ProgressMarker captured(String contextKey, String state) {
		return new ProgressMarker(contextKey, state, null);
	}
}
