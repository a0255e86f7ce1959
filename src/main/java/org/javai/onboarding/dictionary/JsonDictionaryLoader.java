package org.javai.onboarding.dictionary;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads attribute definitions from a JSON document of the form {@code {"attributes": [ ... ]}}.
 */
public final class JsonDictionaryLoader {

	private static final Logger logger = LoggerFactory.getLogger(JsonDictionaryLoader.class);

	public static final String DEFAULT_RESOURCE = "dictionary/onboarding-attributes.json";

	private final ObjectMapper mapper;

	public JsonDictionaryLoader() {
		this.mapper = new ObjectMapper()
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
	}

	public List<Attribute> load(InputStream inputStream) {
		Objects.requireNonNull(inputStream, "inputStream must not be null");
		try {
			DictionaryDocument document = mapper.readValue(inputStream, DictionaryDocument.class);
			return document.attributes() != null ? List.copyOf(document.attributes()) : List.of();
		}
		catch (IOException e) {
			throw new IllegalStateException("Failed to read attribute dictionary", e);
		}
	}

	/**
	 * @throws IllegalArgumentException if the resource cannot be found
	 */
	public List<Attribute> loadResource(String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new IllegalArgumentException("Resource not found: " + resourcePath);
			}
			List<Attribute> attributes = load(is);
			logger.debug("Loaded {} attributes from {}", attributes.size(), resourcePath);
			return attributes;
		}
		catch (IOException e) {
			throw new IllegalStateException("Failed to read attribute dictionary: " + resourcePath, e);
		}
	}

	/**
	 * Builds an in-memory repository seeded from a classpath resource.
	 */
	public InMemoryDictionaryRepository repositoryFrom(String resourcePath, ClassLoader loader) {
		return new InMemoryDictionaryRepository(loadResource(resourcePath, loader));
	}

	record DictionaryDocument(@JsonProperty("attributes") List<Attribute> attributes) {
	}
}
