package org.javai.onboarding.domain.ubo;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.javai.onboarding.generate.GenerationRequest;
import org.javai.onboarding.generate.InstructionTemplate;

/**
 * Instruction templates of the UBO domain. Entity and person ids come from the request context
 * ({@code entity_id}, {@code person_id}) and fall back to placeholder ids.
 */
final class UboTemplates {

	static final String DEFAULT_ENTITY_ID = "entity-001";
	static final String DEFAULT_PERSON_ID = "person-001";
	static final String DEFAULT_JURISDICTION = "GB";

	private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");
	private static final Pattern JURISDICTION = Pattern.compile("\\b(?:in|from)\\s+([A-Z]{2})\\b");

	private UboTemplates() {
	}

	static List<InstructionTemplate> all() {
		return List.of(
				new InstructionTemplate("ubo_collect_entity_data", "ubo.collect-entity-data",
						List.of("collect entity data", "collect entity"),
						"(ubo.collect-entity-data (entity.name \"{entity_name}\") (jurisdiction \"{jurisdiction}\"))",
						request -> Map.of(
								"entity_name", entityName(request),
								"jurisdiction", jurisdiction(request))),
				new InstructionTemplate("ubo_map_ownership", "ubo.get-ownership-structure",
						List.of("ownership structure", "map ownership"),
						"(ubo.get-ownership-structure (entity.id \"{entity_id}\"))",
						request -> Map.of("entity_id", entityId(request))),
				new InstructionTemplate("ubo_resolve_ubos", "ubo.resolve-ubos",
						List.of("resolve ubos", "identify ubos", "identify beneficial owners"),
						"(ubo.resolve-ubos (entity.id \"{entity_id}\") (threshold {threshold}) (framework \"{framework}\"))",
						request -> Map.of(
								"entity_id", entityId(request),
								"threshold", request.contextValue("threshold").orElse("25.0"),
								"framework", framework(request.instruction()))),
				new InstructionTemplate("ubo_verify_identity", "ubo.verify-identity", List.of("verify identity"),
						"(ubo.verify-identity (person.id \"{person_id}\") (document-type \"PASSPORT\"))",
						request -> Map.of("person_id", personId(request))),
				new InstructionTemplate("ubo_screen_person", "ubo.screen-person", List.of("screen"),
						"(ubo.screen-person (person.id \"{person_id}\") (list \"{list}\"))",
						request -> Map.of(
								"person_id", personId(request),
								"list", screeningList(request.instruction()))),
				new InstructionTemplate("ubo_assess_risk", "ubo.assess-risk", List.of("assess risk"),
						"(ubo.assess-risk (entity.id \"{entity_id}\") (risk-rating \"MEDIUM\"))",
						request -> Map.of("entity_id", entityId(request))),
				new InstructionTemplate("ubo_monitor_changes", "ubo.monitor-changes", List.of("monitor"),
						"(ubo.monitor-changes (entity.id \"{entity_id}\") (frequency \"QUARTERLY\"))",
						request -> Map.of("entity_id", entityId(request))));
	}

	static String entityName(GenerationRequest request) {
		Matcher matcher = QUOTED.matcher(request.instruction());
		if (matcher.find()) {
			return literal(matcher.group(1));
		}
		return literal(request.contextValue("entity_name").orElse("Unnamed entity"));
	}

	static String jurisdiction(GenerationRequest request) {
		Matcher matcher = JURISDICTION.matcher(request.instruction());
		if (matcher.find()) {
			return matcher.group(1);
		}
		return literal(request.contextValue("jurisdiction").orElse(DEFAULT_JURISDICTION));
	}

	static String framework(String instruction) {
		String lower = instruction.toLowerCase(Locale.ROOT);
		if (lower.contains("fincen")) {
			return "FINCEN";
		}
		if (lower.contains("psc")) {
			return "UK_PSC";
		}
		return "EU_5MLD";
	}

	static String screeningList(String instruction) {
		String lower = instruction.toLowerCase(Locale.ROOT);
		if (lower.contains("pep")) {
			return "PEP";
		}
		if (lower.contains("adverse media")) {
			return "ADVERSE_MEDIA";
		}
		return "SANCTIONS";
	}

	private static String entityId(GenerationRequest request) {
		return literal(request.contextValue("entity_id").orElse(DEFAULT_ENTITY_ID));
	}

	private static String personId(GenerationRequest request) {
		return literal(request.contextValue("person_id").orElse(DEFAULT_PERSON_ID));
	}

	private static String literal(String value) {
		return StringUtils.remove(StringUtils.remove(value, '"'), '\\');
	}
}
