package org.javai.onboarding.vocabulary;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Renders a {@link Vocabulary} as JSON for diagnostics and tooling.
 */
public final class VocabularyJsonMapper {

	private static final ObjectMapper mapper = new ObjectMapper();

	private VocabularyJsonMapper() {
	}

	public static ObjectNode toJson(Vocabulary vocabulary) {
		ObjectNode node = mapper.createObjectNode();
		node.put("domain", vocabulary.domain());
		node.put("version", vocabulary.version());
		node.put("description", vocabulary.description());
		ArrayNode states = node.putArray("states");
		vocabulary.states().forEach(states::add);

		ObjectNode categories = node.putObject("categories");
		for (VerbCategory category : vocabulary.categories().values()) {
			ObjectNode cNode = categories.putObject(category.name());
			cNode.put("description", category.description());
			ArrayNode verbs = cNode.putArray("verbs");
			category.verbs().forEach(verbs::add);
		}

		ArrayNode verbs = node.putArray("verbs");
		for (VerbDefinition verb : vocabulary.verbs().values()) {
			verbs.add(toJson(verb));
		}
		return node;
	}

	public static ObjectNode toJson(VerbDefinition verb) {
		ObjectNode vNode = mapper.createObjectNode();
		vNode.put("name", verb.name());
		vNode.put("category", verb.category());
		vNode.put("description", verb.description());
		vNode.put("idempotent", verb.idempotent());
		verb.transition().ifPresent(t -> vNode.put("toState", t.toState()));
		ArrayNode args = vNode.putArray("arguments");
		for (ArgumentSpec spec : verb.arguments().values()) {
			ObjectNode aNode = args.addObject();
			aNode.put("name", spec.name());
			aNode.put("type", spec.type().name().toLowerCase());
			aNode.put("required", spec.required());
			if (spec.pattern() != null) {
				aNode.put("pattern", spec.pattern());
			}
			if (!spec.enumValues().isEmpty()) {
				ArrayNode values = aNode.putArray("values");
				spec.enumValues().forEach(values::add);
			}
		}
		return vNode;
	}

	public static String toPrettyString(Vocabulary vocabulary) {
		return toJson(vocabulary).toPrettyString();
	}
}
