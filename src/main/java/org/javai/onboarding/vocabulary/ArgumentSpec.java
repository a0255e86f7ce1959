package org.javai.onboarding.vocabulary;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Schema of a single verb argument.
 * <p>
 * ENUM arguments must declare at least one permitted value; a pattern, when present,
 * must be a valid regular expression. Both are checked on construction.
 *
 * @param name argument keyword as written in the DSL, e.g. {@code cbu.id}
 * @param type declared value type
 * @param required whether the argument must be supplied
 * @param description human readable description
 * @param pattern optional regular expression constraining string values
 * @param enumValues closed set of permitted values for ENUM arguments
 */
public record ArgumentSpec(
		String name,
		ArgumentType type,
		boolean required,
		String description,
		String pattern,
		List<String> enumValues
) {

	public ArgumentSpec {
		if (name == null || name.isBlank()) {
			throw new VocabularyException("Argument name must not be blank");
		}
		type = type != null ? type : ArgumentType.STRING;
		description = description != null ? description : "";
		enumValues = enumValues != null ? List.copyOf(enumValues) : List.of();
		if (type == ArgumentType.ENUM && enumValues.isEmpty()) {
			throw new VocabularyException("Enum argument '" + name + "' must declare at least one value");
		}
		if (pattern != null) {
			if (pattern.isBlank()) {
				pattern = null;
			}
			else {
				try {
					Pattern.compile(pattern);
				}
				catch (PatternSyntaxException e) {
					throw new VocabularyException("Argument '" + name + "' has an invalid pattern: " + pattern, e);
				}
			}
		}
	}

	public static ArgumentSpec string(String name, boolean required, String description) {
		return new ArgumentSpec(name, ArgumentType.STRING, required, description, null, List.of());
	}

	public static ArgumentSpec enumOf(String name, boolean required, String description, List<String> values) {
		return new ArgumentSpec(name, ArgumentType.ENUM, required, description, null, values);
	}

	/**
	 * Whether this argument restricts literal values (ENUM values or a pattern).
	 */
	public boolean isConstrained() {
		return type == ArgumentType.ENUM || pattern != null;
	}

	/**
	 * Checks a literal value against the enum set and pattern. Unconstrained arguments accept anything.
	 */
	public boolean accepts(String value) {
		Objects.requireNonNull(value, "value must not be null");
		if (type == ArgumentType.ENUM && !enumValues.contains(value)) {
			return false;
		}
		return pattern == null || Pattern.compile(pattern).matcher(value).matches();
	}
}
