package org.javai.onboarding.vocabulary;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;

/**
 * Parser for vocabulary YAML files.
 * <p>
 * Expected layout:
 * <pre>
 * domain:
 *   id: onboarding
 *   version: 1.0.0
 *   description: ...
 * states: [CREATE, PRODUCTS_ADDED, ...]
 * categories:
 *   case-management:
 *     description: ...
 *     verbs: [case.create, ...]
 * verbs:
 *   case.create:
 *     category: case-management
 *     transition: { from: [], to: CREATE }
 *     arguments:
 *       cbu.id: { type: string, required: true, pattern: "^CBU-[A-Z0-9]+$" }
 *     examples:
 *       - '(case.create (cbu.id "CBU-1234") (nature-purpose "..."))'
 * </pre>
 */
public class VocabularyParser {

	private final Yaml yaml = new Yaml();

	/**
	 * Parse a vocabulary YAML file from a path.
	 */
	public Vocabulary parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (VocabularyException e) {
			throw e;
		} catch (Exception e) {
			throw new VocabularyException("Failed to parse vocabulary from path: " + path, e);
		}
	}

	/**
	 * Parse a vocabulary YAML file from an input stream.
	 */
	public Vocabulary parse(InputStream inputStream) {
		try {
			Map<String, Object> data = yaml.load(inputStream);
			return buildVocabulary(data);
		} catch (VocabularyException e) {
			throw e;
		} catch (Exception e) {
			throw new VocabularyException("Failed to parse vocabulary from input stream", e);
		}
	}

	/**
	 * Parse a vocabulary YAML file from a reader.
	 */
	public Vocabulary parse(Reader reader) {
		try {
			Map<String, Object> data = yaml.load(reader);
			return buildVocabulary(data);
		} catch (VocabularyException e) {
			throw e;
		} catch (Exception e) {
			throw new VocabularyException("Failed to parse vocabulary from reader", e);
		}
	}

	/**
	 * Parse a vocabulary from YAML text.
	 */
	public Vocabulary parseString(String yamlContent) {
		try {
			Map<String, Object> data = yaml.load(yamlContent);
			return buildVocabulary(data);
		} catch (VocabularyException e) {
			throw e;
		} catch (Exception e) {
			throw new VocabularyException("Failed to parse vocabulary from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private Vocabulary buildVocabulary(Map<String, Object> data) {
		if (data == null) {
			throw new VocabularyException("Vocabulary document is empty");
		}
		Map<String, Object> domainMap = (Map<String, Object>) data.get("domain");
		if (domainMap == null) {
			throw new VocabularyException("Missing required 'domain' section");
		}
		String domain = toString(domainMap.get("id"));
		String version = toString(domainMap.get("version"));
		String description = toString(domainMap.get("description"));

		List<String> states = toStringList(data.get("states"));

		Map<String, VerbCategory> categories = buildCategories((Map<String, Object>) data.get("categories"));
		Map<String, VerbDefinition> verbs = buildVerbs((Map<String, Object>) data.get("verbs"), version);

		return new Vocabulary(domain, version, description, states, verbs, categories, null, null);
	}

	@SuppressWarnings("unchecked")
	private Map<String, VerbCategory> buildCategories(Map<String, Object> categoriesMap) {
		if (categoriesMap == null) {
			return Map.of();
		}
		Map<String, VerbCategory> categories = new LinkedHashMap<>();
		for (Map.Entry<String, Object> entry : categoriesMap.entrySet()) {
			Map<String, Object> categoryData = (Map<String, Object>) entry.getValue();
			categories.put(entry.getKey(), new VerbCategory(
					entry.getKey(),
					toString(categoryData.get("description")),
					toStringList(categoryData.get("verbs")),
					toString(categoryData.get("color")),
					toString(categoryData.get("icon"))
			));
		}
		return categories;
	}

	@SuppressWarnings("unchecked")
	private Map<String, VerbDefinition> buildVerbs(Map<String, Object> verbsMap, String defaultVersion) {
		if (verbsMap == null) {
			return Map.of();
		}
		Map<String, VerbDefinition> verbs = new LinkedHashMap<>();
		for (Map.Entry<String, Object> entry : verbsMap.entrySet()) {
			String verbName = entry.getKey();
			Map<String, Object> verbData = (Map<String, Object>) entry.getValue();
			if (verbData == null) {
				throw new VocabularyException("Verb '" + verbName + "' has no definition");
			}
			String verbVersion = verbData.containsKey("version") ? toString(verbData.get("version")) : defaultVersion;
			verbs.put(verbName, new VerbDefinition(
					verbName,
					toString(verbData.get("category")),
					toString(verbData.get("description")),
					verbVersion,
					Boolean.TRUE.equals(verbData.get("idempotent")),
					toStringList(verbData.get("examples")),
					buildTransition((Map<String, Object>) verbData.get("transition")),
					buildArguments(verbName, (Map<String, Object>) verbData.get("arguments"))
			));
		}
		return verbs;
	}

	private StateTransition buildTransition(Map<String, Object> transitionMap) {
		if (transitionMap == null) {
			return null;
		}
		return new StateTransition(toStringList(transitionMap.get("from")), toString(transitionMap.get("to")));
	}

	@SuppressWarnings("unchecked")
	private Map<String, ArgumentSpec> buildArguments(String verbName, Map<String, Object> argumentsMap) {
		if (argumentsMap == null) {
			return Map.of();
		}
		Map<String, ArgumentSpec> arguments = new LinkedHashMap<>();
		for (Map.Entry<String, Object> entry : argumentsMap.entrySet()) {
			Map<String, Object> argData = (Map<String, Object>) entry.getValue();
			if (argData == null) {
				throw new VocabularyException("Argument '" + entry.getKey() + "' of verb '" + verbName + "' has no definition");
			}
			arguments.put(entry.getKey(), new ArgumentSpec(
					entry.getKey(),
					ArgumentType.fromString(toString(argData.get("type"))),
					!Boolean.FALSE.equals(argData.get("required")),
					toString(argData.get("description")),
					toString(argData.get("pattern")),
					toStringList(argData.get("values"))
			));
		}
		return arguments;
	}

	private String toString(Object obj) {
		if (obj == null) {
			return null;
		}
		return obj instanceof String ? (String) obj : String.valueOf(obj);
	}

	private List<String> toStringList(Object obj) {
		if (obj == null) {
			return List.of();
		}
		if (obj instanceof List<?> list) {
			return list.stream().map(this::toString).toList();
		}
		throw new VocabularyException("Expected a list but found: " + obj);
	}
}
