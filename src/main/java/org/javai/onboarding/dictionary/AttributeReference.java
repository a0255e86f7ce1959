package org.javai.onboarding.dictionary;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An {@code @attr{id}} or {@code @attr{id:name}} reference found in DSL text.
 *
 * @param id the attribute id, 8 to 36 hex digits and hyphens
 * @param name the embedded semantic name, or {@code null} for a bare reference
 * @param start offset of the {@code @} in the source text, or -1 for a constructed reference
 * @param end offset just past the closing brace, or -1 for a constructed reference
 */
public record AttributeReference(String id, String name, int start, int end) {

	/** Any reference, bare or named. */
	public static final Pattern PATTERN = Pattern.compile("@attr\\{([a-fA-F0-9-]{8,36})(?::([^}]+))?\\}");

	/** Only references that carry no name yet. */
	public static final Pattern BARE_PATTERN = Pattern.compile("@attr\\{([a-fA-F0-9-]{8,36})\\}");

	private static final Pattern ID_PATTERN = Pattern.compile("[a-fA-F0-9-]{8,36}");

	public static AttributeReference bare(String id) {
		return new AttributeReference(id, null, -1, -1);
	}

	public static AttributeReference named(String id, String name) {
		return new AttributeReference(id, name, -1, -1);
	}

	public static boolean isValidId(String id) {
		return id != null && ID_PATTERN.matcher(id).matches();
	}

	/**
	 * All references in the text, in order of appearance.
	 */
	public static List<AttributeReference> findAll(String text) {
		List<AttributeReference> references = new ArrayList<>();
		if (text == null || text.isEmpty()) {
			return references;
		}
		Matcher matcher = PATTERN.matcher(text);
		while (matcher.find()) {
			references.add(new AttributeReference(matcher.group(1), matcher.group(2), matcher.start(), matcher.end()));
		}
		return references;
	}

	/**
	 * Parses text that consists of exactly one reference.
	 */
	public static Optional<AttributeReference> parse(String text) {
		if (text == null) {
			return Optional.empty();
		}
		Matcher matcher = PATTERN.matcher(text.trim());
		if (!matcher.matches()) {
			return Optional.empty();
		}
		return Optional.of(new AttributeReference(matcher.group(1), matcher.group(2), -1, -1));
	}

	public boolean isNamed() {
		return name != null;
	}

	@Override
	public String toString() {
		return isNamed() ? "@attr{" + id + ":" + name + "}" : "@attr{" + id + "}";
	}
}
