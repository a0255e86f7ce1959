package org.javai.onboarding.generate;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Binds trigger phrases to one canonical verb template.
 * <p>
 * The template text uses {@code {name}} placeholders filled from the values the
 * {@link ValueExtractor} pulls out of the request, and {@code {attr:<id>}} placeholders
 * rendered as attribute references.
 *
 * @param pattern the name reported back as the {@code pattern} parameter
 * @param verb the verb the template produces
 * @param triggers phrases that select this template, matched case-insensitively as substrings
 * @param template DSL text with placeholders
 * @param extractor pulls placeholder values out of the request
 */
public record InstructionTemplate(
		String pattern,
		String verb,
		List<String> triggers,
		String template,
		ValueExtractor extractor
) {

	/**
	 * Derives placeholder values from a request. Values are inserted verbatim, so string values
	 * must already be safe to place inside a quoted DSL literal.
	 */
	@FunctionalInterface
	public interface ValueExtractor {
		Map<String, String> extract(GenerationRequest request);
	}

	public InstructionTemplate {
		Objects.requireNonNull(pattern, "pattern must not be null");
		Objects.requireNonNull(verb, "verb must not be null");
		Objects.requireNonNull(template, "template must not be null");
		if (triggers == null || triggers.isEmpty()) {
			throw new IllegalArgumentException("Template '" + pattern + "' needs at least one trigger");
		}
		triggers = triggers.stream().map(t -> t.toLowerCase(Locale.ROOT)).toList();
		extractor = extractor != null ? extractor : request -> Map.of();
	}

	/**
	 * A template whose text has no name placeholders.
	 */
	public static InstructionTemplate fixed(String pattern, String verb, List<String> triggers, String template) {
		return new InstructionTemplate(pattern, verb, triggers, template, null);
	}

	public boolean matches(String instruction) {
		if (instruction == null) {
			return false;
		}
		String lower = instruction.toLowerCase(Locale.ROOT);
		return triggers.stream().anyMatch(lower::contains);
	}
}
