package org.javai.onboarding.vocabulary;

import java.util.Locale;

/**
 * Value types an argument of a verb may declare.
 */
public enum ArgumentType {
	STRING,
	ENUM,
	UUID,
	DATE,
	INTEGER,
	DECIMAL,
	BOOLEAN,
	ARRAY,
	OBJECT;

	/**
	 * Parses the lower-case names used in vocabulary files ({@code string}, {@code enum}, ...).
	 */
	public static ArgumentType fromString(String value) {
		if (value == null || value.isBlank()) {
			return STRING;
		}
		try {
			return valueOf(value.trim().toUpperCase(Locale.ROOT));
		}
		catch (IllegalArgumentException e) {
			throw new VocabularyException("Unknown argument type: " + value, e);
		}
	}
}
