package org.javai.onboarding.generate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills the placeholders of an instruction template.
 * <p>
 * {@code {name}} takes the extracted value of that name. {@code {attr:<id>}} becomes whatever
 * the attribute reference function produces for the id: a canonical {@code @attr{...}} token
 * when the dictionary knows the attribute, or the resolver's fallback otherwise. Braces that
 * already belong to an {@code @attr{...}} token in the template text are left alone.
 */
final class TemplateRenderer {

	static final String ATTRIBUTE_PREFIX = "attr:";

	private static final Pattern PLACEHOLDER = Pattern.compile("(?<!@attr)\\{([^{}]+)}");

	private final Map<String, String> values;
	private final Function<String, String> attributeReferences;

	TemplateRenderer(Map<String, String> values, Function<String, String> attributeReferences) {
		this.values = Map.copyOf(Objects.requireNonNull(values, "values must not be null"));
		this.attributeReferences = Objects.requireNonNull(attributeReferences, "attributeReferences must not be null");
	}

	/**
	 * Renders the template. When any placeholder is left unfilled the outcome carries the
	 * template text unchanged.
	 */
	RenderOutcome render(String template) {
		if (template == null || template.isBlank()) {
			return new RenderOutcome(template, List.of(), List.of());
		}

		Matcher matcher = PLACEHOLDER.matcher(template);
		StringBuilder sb = new StringBuilder();
		List<String> missingValues = new ArrayList<>();
		List<String> unresolvedAttributes = new ArrayList<>();

		while (matcher.find()) {
			String body = matcher.group(1).trim();
			String replacement;
			if (body.startsWith(ATTRIBUTE_PREFIX)) {
				String attributeId = body.substring(ATTRIBUTE_PREFIX.length()).trim();
				replacement = attributeId.isEmpty() ? null : attributeReferences.apply(attributeId);
				if (replacement == null) {
					unresolvedAttributes.add(body);
				}
			} else {
				replacement = values.get(body);
				if (replacement == null) {
					missingValues.add(body);
				}
			}
			matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement != null ? replacement : matcher.group(0)));
		}
		matcher.appendTail(sb);

		if (missingValues.isEmpty() && unresolvedAttributes.isEmpty()) {
			return new RenderOutcome(sb.toString(), List.of(), List.of());
		}
		return new RenderOutcome(template, List.copyOf(missingValues), List.copyOf(unresolvedAttributes));
	}

	/**
	 * @param value the rendered text, or the original template when rendering failed
	 * @param missingValues named placeholders with no extracted value
	 * @param unresolvedAttributes {@code attr:} placeholders for which no reference could be produced
	 */
	record RenderOutcome(String value, List<String> missingValues, List<String> unresolvedAttributes) {

		boolean resolved() {
			return missingValues.isEmpty() && unresolvedAttributes.isEmpty();
		}
	}
}
