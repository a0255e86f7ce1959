package org.javai.onboarding.vocabulary;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A named operation of a domain vocabulary.
 *
 * @param name dotted verb name, e.g. {@code case.create}
 * @param category the single category this verb belongs to
 * @param description human readable description
 * @param version semantic version of the verb
 * @param idempotent whether repeating the verb has no further effect
 * @param examples illustrative DSL snippets; each one must pass verb validation
 * @param stateTransition optional state the verb advances a case to
 * @param arguments argument schemas keyed by argument keyword
 */
public record VerbDefinition(
		String name,
		String category,
		String description,
		String version,
		boolean idempotent,
		List<String> examples,
		StateTransition stateTransition,
		Map<String, ArgumentSpec> arguments
) {

	public VerbDefinition {
		if (name == null || name.isBlank()) {
			throw new VocabularyException("Verb name must not be blank");
		}
		if (category == null || category.isBlank()) {
			throw new VocabularyException("Verb '" + name + "' must belong to a category");
		}
		description = description != null ? description : "";
		examples = examples != null ? List.copyOf(examples) : List.of();
		arguments = arguments != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
				: Map.of();
	}

	public Optional<StateTransition> transition() {
		return Optional.ofNullable(stateTransition);
	}

	public Optional<ArgumentSpec> argument(String argumentName) {
		return Optional.ofNullable(arguments.get(argumentName));
	}

	public boolean declaresArgument(String argumentName) {
		return arguments.containsKey(argumentName);
	}
}
