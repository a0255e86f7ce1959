package org.javai.onboarding.domain.ubo;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.javai.onboarding.dictionary.AttributeResolver;
import org.javai.onboarding.domain.AbstractDomain;
import org.javai.onboarding.registry.RoutingHints;
import org.javai.onboarding.statemachine.ProgressMarker;
import org.javai.onboarding.statemachine.VerbMarkerContextExtractor;
import org.javai.onboarding.vocabulary.Vocabulary;
import org.javai.onboarding.vocabulary.VocabularyRegistry;

/**
 * Ultimate beneficial ownership: collect entity data, map ownership, identify, verify and screen
 * the beneficial owners, assess risk and monitor for changes.
 */
public class UboDomain extends AbstractDomain {

	public static final String NAME = "ubo";

	private static final RoutingHints ROUTING_HINTS = new RoutingHints(
			List.of("ubo", "beneficial owner", "beneficial ownership", "ownership structure", "shareholder",
					"sanctions", "pep"),
			List.of("entity_name", "ubos_identified"),
			List.of("beneficial ownership", "ultimate beneficial ownership"));

	public UboDomain(Vocabulary vocabulary, AttributeResolver attributeResolver, Duration lookupTimeout, Clock clock) {
		super(vocabulary, contextExtractor(), UboTemplates.all(), attributeResolver, lookupTimeout, clock);
	}

	public static UboDomain create() {
		Vocabulary vocabulary = VocabularyRegistry.create().registerResource(VocabularyRegistry.resourceFor(NAME));
		return new UboDomain(vocabulary, AttributeResolver.withoutDictionary(), Duration.ofSeconds(5),
				Clock.systemUTC());
	}

	static VerbMarkerContextExtractor contextExtractor() {
		return VerbMarkerContextExtractor.builder()
				.capture("entity.name", "entity_name")
				.capture("entity.id", "entity_id")
				.capture("person.id", "person_id")
				.marker(ProgressMarker.verb("ubo.collect-entity-data", "entity_data_collected", "ENTITY_DATA_COLLECTED"))
				.marker(ProgressMarker.verb("ubo.get-ownership-structure", "ownership_mapped", "OWNERSHIP_STRUCTURE_MAPPED"))
				.marker(ProgressMarker.verb("ubo.resolve-ubos", "ubos_identified", "UBOS_IDENTIFIED"))
				.marker(ProgressMarker.verb("ubo.verify-identity", "identity_verified", "IDENTITY_VERIFICATION_COMPLETE"))
				.marker(ProgressMarker.verb("ubo.screen-person", "screening_complete", "SCREENING_COMPLETE"))
				.marker(ProgressMarker.verb("ubo.assess-risk", "risk_assessed", "RISK_ASSESSED"))
				.marker(ProgressMarker.verb("ubo.monitor-changes", "monitoring_active", "MONITORING_ACTIVE"))
				.build();
	}

	@Override
	public RoutingHints routingHints() {
		return ROUTING_HINTS;
	}
}
