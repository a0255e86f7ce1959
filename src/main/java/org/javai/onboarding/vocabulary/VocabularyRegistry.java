package org.javai.onboarding.vocabulary;

import java.io.InputStream;
import java.net.JarURLConnection;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of domain vocabularies loaded from YAML.
 * <p>
 * Vocabularies are keyed by domain id. Registrations are idempotent per domain id:
 * the first vocabulary registered for an id wins.
 */
public final class VocabularyRegistry {

	private static final Logger logger = LoggerFactory.getLogger(VocabularyRegistry.class);

	static final String RESOURCE_PREFIX = "dsl-vocabulary-";

	private final Map<String, Vocabulary> vocabularies = new LinkedHashMap<>();
	private final VocabularyParser parser;

	private VocabularyRegistry(VocabularyParser parser) {
		this.parser = parser;
	}

	/**
	 * Create an empty registry backed by a fresh parser.
	 */
	public static VocabularyRegistry create() {
		return new VocabularyRegistry(new VocabularyParser());
	}

	/**
	 * Classpath location of the bundled vocabulary for a domain.
	 */
	public static String resourceFor(String domain) {
		return "META-INF/" + RESOURCE_PREFIX + domain + ".yml";
	}

	/**
	 * Register a vocabulary object directly. If one with the same domain id is already
	 * present, the existing one is kept and returned.
	 */
	public synchronized Vocabulary register(Vocabulary vocabulary) {
		Objects.requireNonNull(vocabulary, "vocabulary must not be null");
		Vocabulary existing = vocabularies.get(vocabulary.domain());
		if (existing != null) {
			logger.debug("Vocabulary for domain '{}' already registered; skipping", vocabulary.domain());
			return existing;
		}
		vocabularies.put(vocabulary.domain(), vocabulary);
		return vocabulary;
	}

	/**
	 * Discover and register vocabularies found under META-INF on the classpath.
	 * <p>
	 * Scans both exploded directories and JARs for files named {@code dsl-vocabulary-*.yml}.
	 */
	public VocabularyRegistry registerMetaInfVocabularies(ClassLoader loader) {
		Objects.requireNonNull(loader, "loader must not be null");
		try {
			Enumeration<URL> resources = loader.getResources("META-INF/");
			while (resources.hasMoreElements()) {
				URL url = resources.nextElement();
				if ("file".equalsIgnoreCase(url.getProtocol())) {
					loadFromDirectory(url);
				}
				else if ("jar".equalsIgnoreCase(url.getProtocol())) {
					loadFromJar(url);
				}
			}
		}
		catch (Exception e) {
			throw new VocabularyException("Failed to scan META-INF for vocabularies", e);
		}
		return this;
	}

	/**
	 * Load a vocabulary from a classpath resource using this class' loader.
	 */
	public Vocabulary registerResource(String resourcePath) {
		return registerResource(resourcePath, VocabularyRegistry.class.getClassLoader());
	}

	/**
	 * Load and register a vocabulary from a classpath resource.
	 *
	 * @throws IllegalArgumentException if the resource cannot be found
	 * @throws VocabularyException if parsing fails
	 */
	public Vocabulary registerResource(String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new IllegalArgumentException("Resource not found: " + resourcePath);
			}
			return register(parser.parse(is));
		} catch (IllegalArgumentException | VocabularyException e) {
			throw e;
		} catch (Exception e) {
			throw new VocabularyException("Failed to load vocabulary from resource: " + resourcePath, e);
		}
	}

	/**
	 * Load and register a vocabulary from a filesystem path.
	 */
	public Vocabulary registerPath(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		return register(parser.parse(path));
	}

	/**
	 * Bulk register vocabularies from resource paths using the provided loader.
	 */
	public VocabularyRegistry registerResources(List<String> resourcePaths, ClassLoader loader) {
		if (resourcePaths == null) {
			return this;
		}
		for (String path : resourcePaths) {
			if (path != null) {
				registerResource(path, loader);
			}
		}
		return this;
	}

	public synchronized Optional<Vocabulary> vocabularyFor(String domain) {
		return Optional.ofNullable(vocabularies.get(domain));
	}

	/**
	 * Retrieve a vocabulary by domain id or throw if not present.
	 */
	public Vocabulary requireVocabulary(String domain) {
		return vocabularyFor(domain)
				.orElseThrow(() -> new VocabularyException("No vocabulary registered for domain: " + domain));
	}

	/**
	 * All registered vocabularies in insertion order.
	 */
	public synchronized List<Vocabulary> vocabularies() {
		return List.copyOf(vocabularies.values());
	}

	private void loadFromDirectory(URL url) {
		try {
			Path path = Paths.get(url.toURI());
			if (!Files.isDirectory(path)) {
				return;
			}
			try (Stream<Path> files = Files.list(path)) {
				files.filter(Files::isRegularFile)
						.filter(p -> p.getFileName().toString().startsWith(RESOURCE_PREFIX))
						.filter(p -> p.getFileName().toString().endsWith(".yml"))
						.sorted()
						.forEach(p -> {
							try (InputStream is = Files.newInputStream(p)) {
								register(parser.parse(is));
							}
							catch (Exception ex) {
								logger.warn("Failed to load vocabulary from {}", p, ex);
							}
						});
			}
		}
		catch (Exception e) {
			logger.warn("Failed to scan directory {}", url, e);
		}
	}

	private void loadFromJar(URL url) {
		try {
			JarURLConnection conn = (JarURLConnection) url.openConnection();
			conn.setUseCaches(false);
			try (JarFile jar = conn.getJarFile()) {
				Enumeration<JarEntry> entries = jar.entries();
				while (entries.hasMoreElements()) {
					JarEntry entry = entries.nextElement();
					if (entry.isDirectory()) {
						continue;
					}
					String name = entry.getName();
					if (!name.startsWith("META-INF/" + RESOURCE_PREFIX) || !name.endsWith(".yml")) {
						continue;
					}
					try (InputStream is = jar.getInputStream(entry)) {
						register(parser.parse(is));
					}
					catch (Exception ex) {
						logger.warn("Failed to load vocabulary from JAR entry {}", name, ex);
					}
				}
			}
		}
		catch (Exception e) {
			logger.warn("Failed to scan JAR {}", url, e);
		}
	}
}
