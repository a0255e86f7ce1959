package org.javai.onboarding.vocabulary;

import java.util.List;

/**
 * Destination state attached to a verb.
 *
 * @param fromStates states the verb may be applied in; empty means the verb opens a case
 * @param toState the state the case moves to
 */
public record StateTransition(List<String> fromStates, String toState) {

	public StateTransition {
		fromStates = fromStates != null ? List.copyOf(fromStates) : List.of();
		if (toState == null || toState.isBlank()) {
			throw new VocabularyException("State transition must name a destination state");
		}
	}
}
