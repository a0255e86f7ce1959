package org.javai.onboarding.vocabulary;

import java.util.List;

/**
 * Grouping of verbs used for documentation and display.
 */
public record VerbCategory(
		String name,
		String description,
		List<String> verbs,
		String color,
		String icon
) {

	public VerbCategory {
		if (name == null || name.isBlank()) {
			throw new VocabularyException("Category name must not be blank");
		}
		description = description != null ? description : "";
		verbs = verbs != null ? List.copyOf(verbs) : List.of();
	}
}
