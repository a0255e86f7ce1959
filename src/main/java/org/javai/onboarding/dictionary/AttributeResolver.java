package org.javai.onboarding.dictionary;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns {@code @attr{id}} references into human readable {@code @attr{id:name}} references.
 * <p>
 * Two failure policies live side by side. Single-id resolution and reference validation are
 * strict and throw. Bulk resolution and document enhancement are lenient: an id that cannot be
 * resolved, for whatever reason, stands in for its own name. Without a repository the lenient
 * operations pass input through unchanged and reference validation does nothing.
 * <p>
 * Names already embedded in a reference are never re-checked.
 */
public class AttributeResolver {

	private static final Logger logger = LoggerFactory.getLogger(AttributeResolver.class);

	private final DictionaryRepository repository;

	public AttributeResolver(DictionaryRepository repository) {
		this.repository = repository;
	}

	public static AttributeResolver withoutDictionary() {
		return new AttributeResolver(null);
	}

	public boolean hasDictionary() {
		return repository != null;
	}

	public Optional<DictionaryRepository> repository() {
		return Optional.ofNullable(repository);
	}

	/**
	 * @throws NoDictionaryConfiguredException if no repository is configured
	 * @throws AttributeNotFoundException if the id is unknown
	 * @throws LookupCancelledException if the context is cancelled or expired
	 */
	public String resolveAttributeName(LookupContext context, String id) {
		Objects.requireNonNull(context, "context must not be null");
		if (repository == null) {
			throw new NoDictionaryConfiguredException();
		}
		context.checkActive();
		Optional<Attribute> attribute;
		try {
			attribute = repository.getById(context, id);
		}
		catch (AttributeResolutionException e) {
			throw e;
		}
		catch (RuntimeException e) {
			throw new AttributeResolutionException("failed to resolve attribute " + id, e);
		}
		return attribute.map(Attribute::name).orElseThrow(() -> new AttributeNotFoundException(id));
	}

	/**
	 * Maps every id to its name, falling back to the id itself when it cannot be resolved.
	 */
	public Map<String, String> resolveAttributesByIds(LookupContext context, List<String> ids) {
		Objects.requireNonNull(context, "context must not be null");
		Map<String, String> names = new LinkedHashMap<>();
		if (ids == null) {
			return names;
		}
		for (String id : ids) {
			if (repository == null) {
				names.put(id, id);
				continue;
			}
			try {
				names.put(id, resolveAttributeName(context, id));
			}
			catch (AttributeResolutionException e) {
				logger.warn("Could not resolve attribute {}, using id as name: {}", id, e.getMessage());
				names.put(id, id);
			}
		}
		return names;
	}

	/**
	 * Rewrites bare {@code @attr{id}} references to {@code @attr{id:name}}. References that
	 * cannot be resolved stay bare, so running this twice gives the same result as running it once.
	 */
	public String enhanceDslWithAttributeNames(LookupContext context, String dsl) {
		Objects.requireNonNull(context, "context must not be null");
		if (dsl == null || dsl.isEmpty() || repository == null) {
			return dsl;
		}
		Matcher matcher = AttributeReference.BARE_PATTERN.matcher(dsl);
		LinkedHashSet<String> ids = new LinkedHashSet<>();
		while (matcher.find()) {
			ids.add(matcher.group(1));
		}
		if (ids.isEmpty()) {
			return dsl;
		}
		Map<String, String> names = resolveAttributesByIds(context, List.copyOf(ids));

		matcher.reset();
		StringBuilder sb = new StringBuilder();
		while (matcher.find()) {
			String id = matcher.group(1);
			String name = names.get(id);
			String replacement = name != null && !name.equals(id)
					? AttributeReference.named(id, name).toString()
					: matcher.group(0);
			matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
		}
		matcher.appendTail(sb);
		return sb.toString();
	}

	/**
	 * The named form of a reference when the id resolves, the bare form otherwise.
	 *
	 * @throws IllegalArgumentException if the id is empty
	 */
	public String generateAttributeReference(LookupContext context, String id) {
		Objects.requireNonNull(context, "context must not be null");
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("attribute id must not be empty");
		}
		if (repository == null) {
			return AttributeReference.bare(id).toString();
		}
		try {
			return AttributeReference.named(id, resolveAttributeName(context, id)).toString();
		}
		catch (AttributeResolutionException e) {
			logger.debug("Generating bare reference for {}: {}", id, e.getMessage());
			return AttributeReference.bare(id).toString();
		}
	}

	/**
	 * Checks that every referenced id exists in the dictionary.
	 *
	 * @throws AttributeNotFoundException naming the first reference whose id is unknown
	 * @throws LookupCancelledException if the context is cancelled or expired
	 */
	public void validateAttributeReferences(LookupContext context, String dsl) {
		Objects.requireNonNull(context, "context must not be null");
		if (repository == null || dsl == null) {
			return;
		}
		for (AttributeReference reference : AttributeReference.findAll(dsl)) {
			try {
				resolveAttributeName(context, reference.id());
			}
			catch (AttributeNotFoundException e) {
				throw new AttributeNotFoundException(reference.id(), reference.toString());
			}
		}
	}
}
