package org.javai.onboarding.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.onboarding.dictionary.JsonDictionaryLoader;
import org.javai.onboarding.session.SessionAccumulator;
import org.javai.onboarding.vocabulary.VocabularyRegistry;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Configuration for a {@link DslPlatform}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Use defaults
 * DslPlatformConfig config = DslPlatformConfig.defaults();
 *
 * // Custom configuration
 * DslPlatformConfig config = DslPlatformConfig.builder()
 *         .lookupTimeout(Duration.ofMillis(500))
 *         .enabledDomains(List.of("onboarding"))
 *         .build();
 *
 * // From YAML
 * DslPlatformConfig config = DslPlatformConfig.load(in);
 * }</pre>
 *
 * @param lookupTimeout deadline applied to every attribute dictionary lookup
 * @param fragmentSeparator text placed between accumulated session fragments
 * @param vocabularyResources classpath vocabularies to load
 * @param dictionaryResource classpath JSON seeding the attribute dictionary, or {@code null} for none
 * @param enabledDomains domains to register
 */
public record DslPlatformConfig(
		Duration lookupTimeout,
		String fragmentSeparator,
		List<String> vocabularyResources,
		String dictionaryResource,
		List<String> enabledDomains
) {

	/**
	 * Classpath location of the platform YAML.
	 */
	public static final String DEFAULT_RESOURCE = "onboarding-dsl.yml";

	public static final Duration DEFAULT_LOOKUP_TIMEOUT = Duration.ofSeconds(5);

	public static final List<String> DEFAULT_DOMAINS = List.of("onboarding", "ubo");

	public DslPlatformConfig {
		if (lookupTimeout == null || lookupTimeout.isNegative() || lookupTimeout.isZero()) {
			throw new IllegalArgumentException("lookupTimeout must be positive");
		}
		if (fragmentSeparator == null || fragmentSeparator.isEmpty()) {
			throw new IllegalArgumentException("fragmentSeparator must not be empty");
		}
		enabledDomains = enabledDomains != null ? List.copyOf(enabledDomains) : List.of();
		vocabularyResources = vocabularyResources != null
				? List.copyOf(vocabularyResources)
				: enabledDomains.stream().map(VocabularyRegistry::resourceFor).toList();
		if (dictionaryResource != null && dictionaryResource.isBlank()) {
			dictionaryResource = null;
		}
	}

	/**
	 * Creates a configuration with default values: both bundled domains, the bundled
	 * dictionary and a five second lookup timeout.
	 *
	 * @return default configuration
	 */
	public static DslPlatformConfig defaults() {
		return builder().build();
	}

	/**
	 * Creates a new builder for custom configuration.
	 *
	 * @return a new builder
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Read a configuration from YAML. Keys that are absent keep their default.
	 * <pre>
	 * lookup-timeout-millis: 2000
	 * fragment-separator: "\n"
	 * dictionary-resource: dictionary/onboarding-attributes.json
	 * enabled-domains: [onboarding, ubo]
	 * vocabulary-resources:
	 *   - META-INF/dsl-vocabulary-onboarding.yml
	 * </pre>
	 *
	 * @throws IllegalArgumentException if the document is not a mapping or a value has the wrong type
	 */
	public static DslPlatformConfig load(InputStream inputStream) {
		Objects.requireNonNull(inputStream, "inputStream must not be null");
		Object root;
		try {
			root = new Yaml().load(inputStream);
		}
		catch (YAMLException e) {
			throw new IllegalArgumentException("Invalid platform configuration: " + e.getMessage(), e);
		}
		Builder builder = builder();
		if (root == null) {
			return builder.build();
		}
		if (!(root instanceof Map<?, ?> map)) {
			throw new IllegalArgumentException("Platform configuration must be a mapping");
		}
		Object timeout = map.get("lookup-timeout-millis");
		if (timeout != null) {
			if (!(timeout instanceof Number millis)) {
				throw new IllegalArgumentException("lookup-timeout-millis must be a number");
			}
			builder.lookupTimeout(Duration.ofMillis(millis.longValue()));
		}
		if (map.containsKey("fragment-separator")) {
			builder.fragmentSeparator(stringValue(map, "fragment-separator"));
		}
		if (map.containsKey("dictionary-resource")) {
			builder.dictionaryResource(stringValue(map, "dictionary-resource"));
		}
		if (map.containsKey("enabled-domains")) {
			builder.enabledDomains(stringList(map, "enabled-domains"));
		}
		if (map.containsKey("vocabulary-resources")) {
			builder.vocabularyResources(stringList(map, "vocabulary-resources"));
		}
		return builder.build();
	}

	/**
	 * Read {@link #DEFAULT_RESOURCE} from the given class loader, or fall back to the defaults
	 * when it is absent.
	 */
	public static DslPlatformConfig loadDefault(ClassLoader loader) {
		try (InputStream is = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
			return is != null ? load(is) : defaults();
		}
		catch (IOException e) {
			throw new IllegalStateException("Failed to read " + DEFAULT_RESOURCE, e);
		}
	}

	private static String stringValue(Map<?, ?> map, String key) {
		Object value = map.get(key);
		if (value != null && !(value instanceof String)) {
			throw new IllegalArgumentException(key + " must be a string");
		}
		return (String) value;
	}

	private static List<String> stringList(Map<?, ?> map, String key) {
		Object value = map.get(key);
		if (value == null) {
			return List.of();
		}
		if (!(value instanceof List<?> list)) {
			throw new IllegalArgumentException(key + " must be a list");
		}
		List<String> result = new ArrayList<>();
		for (Object item : list) {
			result.add(String.valueOf(item));
		}
		return result;
	}

	/**
	 * Builder for {@link DslPlatformConfig}.
	 */
	public static class Builder {
		private Duration lookupTimeout = DEFAULT_LOOKUP_TIMEOUT;
		private String fragmentSeparator = SessionAccumulator.DEFAULT_SEPARATOR;
		private List<String> vocabularyResources;
		private String dictionaryResource = JsonDictionaryLoader.DEFAULT_RESOURCE;
		private List<String> enabledDomains = DEFAULT_DOMAINS;

		private Builder() {}

		/**
		 * Sets the deadline for each attribute lookup made while generating DSL.
		 *
		 * @param lookupTimeout a positive duration
		 * @return this builder
		 */
		public Builder lookupTimeout(Duration lookupTimeout) {
			this.lookupTimeout = lookupTimeout;
			return this;
		}

		public Builder fragmentSeparator(String fragmentSeparator) {
			this.fragmentSeparator = fragmentSeparator;
			return this;
		}

		/**
		 * Sets the vocabularies to load. When never set, the bundled vocabulary of each
		 * enabled domain is loaded.
		 *
		 * @param vocabularyResources classpath resource paths
		 * @return this builder
		 */
		public Builder vocabularyResources(List<String> vocabularyResources) {
			this.vocabularyResources = vocabularyResources;
			return this;
		}

		/**
		 * Sets the JSON resource seeding the attribute dictionary. {@code null} runs without
		 * a dictionary, so attribute references stay bare.
		 *
		 * @param dictionaryResource classpath resource path, or {@code null}
		 * @return this builder
		 */
		public Builder dictionaryResource(String dictionaryResource) {
			this.dictionaryResource = dictionaryResource;
			return this;
		}

		public Builder enabledDomains(List<String> enabledDomains) {
			this.enabledDomains = enabledDomains;
			return this;
		}

		/**
		 * Builds the configuration.
		 *
		 * @return the configuration
		 */
		public DslPlatformConfig build() {
			return new DslPlatformConfig(lookupTimeout, fragmentSeparator, vocabularyResources, dictionaryResource,
					enabledDomains);
		}
	}
}
