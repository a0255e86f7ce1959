package org.javai.onboarding.vocabulary;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable description of one domain's verbs, categories and workflow states.
 * <p>
 * Built once when a domain is constructed and never mutated afterwards, so it can be
 * shared between threads without locking.
 * <p>
 * Invariants checked on construction:
 * <ul>
 * <li>every verb names a declared category, and that category lists the verb;</li>
 * <li>every verb listed by a category exists;</li>
 * <li>state transitions only reference declared states.</li>
 * </ul>
 */
public record Vocabulary(
		String domain,
		String version,
		String description,
		List<String> states,
		Map<String, VerbDefinition> verbs,
		Map<String, VerbCategory> categories,
		Instant createdAt,
		Instant updatedAt
) {

	public Vocabulary {
		if (domain == null || domain.isBlank()) {
			throw new VocabularyException("Vocabulary is missing a domain name");
		}
		description = description != null ? description : "";
		states = states != null ? List.copyOf(states) : List.of();
		verbs = verbs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(verbs)) : Map.of();
		categories = categories != null ? Collections.unmodifiableMap(new LinkedHashMap<>(categories)) : Map.of();
		createdAt = createdAt != null ? createdAt : Instant.now();
		updatedAt = updatedAt != null ? updatedAt : createdAt;
		checkIntegrity(domain, states, verbs, categories);
	}

	private static void checkIntegrity(String domain, List<String> states, Map<String, VerbDefinition> verbs,
			Map<String, VerbCategory> categories) {
		for (VerbDefinition verb : verbs.values()) {
			VerbCategory category = categories.get(verb.category());
			if (category == null) {
				throw new VocabularyException(
						"Verb '" + verb.name() + "' in domain '" + domain + "' references unknown category: " + verb.category());
			}
			if (!category.verbs().contains(verb.name())) {
				throw new VocabularyException(
						"Category '" + category.name() + "' does not list its verb: " + verb.name());
			}
			verb.transition().ifPresent(transition -> {
				if (!states.contains(transition.toState())) {
					throw new VocabularyException(
							"Verb '" + verb.name() + "' transitions to unknown state: " + transition.toState());
				}
				for (String from : transition.fromStates()) {
					if (!states.contains(from)) {
						throw new VocabularyException(
								"Verb '" + verb.name() + "' transitions from unknown state: " + from);
					}
				}
			});
		}
		for (VerbCategory category : categories.values()) {
			for (String verbName : category.verbs()) {
				if (!verbs.containsKey(verbName)) {
					throw new VocabularyException(
							"Category '" + category.name() + "' lists unknown verb: " + verbName);
				}
			}
		}
	}

	public boolean hasVerb(String verbName) {
		return verbs.containsKey(verbName);
	}

	public Optional<VerbDefinition> verb(String verbName) {
		return Optional.ofNullable(verbs.get(verbName));
	}

	public Optional<VerbCategory> category(String categoryName) {
		return Optional.ofNullable(categories.get(categoryName));
	}

	public int verbCount() {
		return verbs.size();
	}

	/**
	 * Verbs that carry a state transition, keyed by verb name.
	 */
	public Map<String, StateTransition> stateTransitions() {
		Map<String, StateTransition> transitions = new LinkedHashMap<>();
		verbs.values().forEach(verb -> verb.transition().ifPresent(t -> transitions.put(verb.name(), t)));
		return Collections.unmodifiableMap(transitions);
	}
}
