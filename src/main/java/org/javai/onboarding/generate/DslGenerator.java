package org.javai.onboarding.generate;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.onboarding.DslException;
import org.javai.onboarding.dictionary.AttributeResolver;
import org.javai.onboarding.dictionary.LookupContext;
import org.javai.onboarding.validate.DslValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns free-text instructions into canonical verb invocations.
 * <p>
 * Templates are tried in order and the first whose trigger phrase occurs in the instruction
 * wins. The rendered DSL is checked with the domain's own validator before it is returned, so
 * generation and validation share one vocabulary.
 */
public class DslGenerator {

	private static final Logger logger = LoggerFactory.getLogger(DslGenerator.class);

	private final DslValidator validator;
	private final List<InstructionTemplate> templates;
	private final AttributeResolver attributeResolver;
	private final Duration lookupTimeout;
	private final Clock clock;

	public DslGenerator(DslValidator validator, List<InstructionTemplate> templates,
			AttributeResolver attributeResolver, Duration lookupTimeout, Clock clock) {
		this.validator = Objects.requireNonNull(validator, "validator must not be null");
		this.templates = List.copyOf(Objects.requireNonNull(templates, "templates must not be null"));
		this.attributeResolver = attributeResolver != null ? attributeResolver : AttributeResolver.withoutDictionary();
		this.lookupTimeout = Objects.requireNonNull(lookupTimeout, "lookupTimeout must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
	}

	public List<InstructionTemplate> templates() {
		return templates;
	}

	public GenerationResponse generateDsl(GenerationRequest request) {
		return generateDsl(LookupContext.withTimeout(lookupTimeout, clock), request);
	}

	/**
	 * @throws IllegalArgumentException if the request or its instruction is missing
	 * @throws UnsupportedInstructionException if no template matches
	 * @throws DslGenerationException if the rendered DSL is incomplete or invalid
	 */
	public GenerationResponse generateDsl(LookupContext lookupContext, GenerationRequest request) {
		if (request == null) {
			throw new IllegalArgumentException("generation request must not be null");
		}
		if (request.instruction() == null || request.instruction().isBlank()) {
			throw new IllegalArgumentException("instruction must not be empty");
		}
		String domain = validator.vocabulary().domain();
		InstructionTemplate template = templates.stream()
				.filter(t -> t.matches(request.instruction()))
				.findFirst()
				.orElseThrow(() -> new UnsupportedInstructionException(domain, request.instruction()));
		logger.debug("Instruction '{}' matched template '{}'", request.instruction(), template.pattern());

		Map<String, String> values = template.extractor().extract(request);
		TemplateRenderer renderer = new TemplateRenderer(values,
				id -> attributeResolver.generateAttributeReference(lookupContext, id));
		TemplateRenderer.RenderOutcome outcome = renderer.render(template.template());
		if (!outcome.missingValues().isEmpty()) {
			throw new DslGenerationException("Template '" + template.pattern() + "' has unbound placeholders: "
					+ outcome.missingValues());
		}
		if (!outcome.unresolvedAttributes().isEmpty()) {
			throw new DslGenerationException("Template '" + template.pattern() + "' has unresolved attributes: "
					+ outcome.unresolvedAttributes());
		}
		String dsl = outcome.value();
		try {
			validator.validateVerbs(dsl);
		}
		catch (DslException e) {
			throw new DslGenerationException("Template '" + template.pattern() + "' produced invalid "
					+ domain + " DSL: " + e.getMessage(), e);
		}

		Map<String, Object> parameters = new LinkedHashMap<>(values);
		parameters.put("pattern", template.pattern());
		parameters.put("generated_at", clock.instant().toString());
		return new GenerationResponse(dsl, template.verb(), parameters);
	}
}
