package org.javai.onboarding.domain;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.commons.lang3.StringUtils;
import org.javai.onboarding.DslException;
import org.javai.onboarding.dictionary.AttributeResolver;
import org.javai.onboarding.generate.DslGenerator;
import org.javai.onboarding.generate.GenerationRequest;
import org.javai.onboarding.generate.GenerationResponse;
import org.javai.onboarding.generate.InstructionTemplate;
import org.javai.onboarding.registry.Domain;
import org.javai.onboarding.registry.DomainMetrics;
import org.javai.onboarding.statemachine.ContextStateResolver;
import org.javai.onboarding.statemachine.StateMachine;
import org.javai.onboarding.statemachine.VerbMarkerContextExtractor;
import org.javai.onboarding.validate.DslValidator;
import org.javai.onboarding.validate.ValidationReport;
import org.javai.onboarding.vocabulary.ArgumentSpec;
import org.javai.onboarding.vocabulary.VerbCategory;
import org.javai.onboarding.vocabulary.VerbDefinition;
import org.javai.onboarding.vocabulary.Vocabulary;

/**
 * Base class for vocabulary-driven domains.
 * <p>
 * Everything a domain does is derived from its vocabulary: the state machine from the declared
 * states, the validator from the verbs, and the generator from the validator plus the domain's
 * instruction templates. Subclasses supply the vocabulary, the context extractor and the templates.
 */
public abstract class AbstractDomain implements Domain {

	private final Vocabulary vocabulary;
	private final StateMachine stateMachine;
	private final ContextStateResolver stateResolver;
	private final VerbMarkerContextExtractor contextExtractor;
	private final DslValidator validator;
	private final DslGenerator generator;
	private final Clock clock;
	private final long memoryFootprint;

	private final AtomicLong validations = new AtomicLong();
	private final AtomicLong validationFailures = new AtomicLong();
	private final AtomicLong generations = new AtomicLong();
	private final AtomicLong generationFailures = new AtomicLong();

	protected AbstractDomain(Vocabulary vocabulary, VerbMarkerContextExtractor contextExtractor,
			List<InstructionTemplate> templates, AttributeResolver attributeResolver,
			Duration lookupTimeout, Clock clock) {
		this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary must not be null");
		this.contextExtractor = Objects.requireNonNull(contextExtractor, "contextExtractor must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		this.stateMachine = new StateMachine(vocabulary.states());
		this.stateResolver = new ContextStateResolver(stateMachine, contextExtractor.markers());
		this.validator = new DslValidator(vocabulary);
		this.generator = new DslGenerator(validator, templates, attributeResolver, lookupTimeout, clock);
		this.memoryFootprint = estimateFootprint(vocabulary);
	}

	@Override
	public String name() {
		return vocabulary.domain();
	}

	@Override
	public String version() {
		return vocabulary.version();
	}

	@Override
	public String description() {
		return vocabulary.description();
	}

	/**
	 * A domain is healthy when it has verbs and a state machine to drive.
	 */
	@Override
	public boolean isHealthy() {
		return vocabulary.verbCount() > 0 && !stateMachine.states().isEmpty();
	}

	@Override
	public Vocabulary vocabulary() {
		return vocabulary;
	}

	@Override
	public List<String> validStates() {
		return stateMachine.states();
	}

	@Override
	public String initialState() {
		return stateMachine.initialState();
	}

	public StateMachine stateMachine() {
		return stateMachine;
	}

	@Override
	public void validateVerbs(String dslText) {
		validations.incrementAndGet();
		try {
			validator.validateVerbs(dslText);
		}
		catch (DslException e) {
			validationFailures.incrementAndGet();
			throw e;
		}
	}

	@Override
	public ValidationReport validate(String dslText) {
		validations.incrementAndGet();
		ValidationReport report = validator.validate(dslText);
		if (!report.isValid()) {
			validationFailures.incrementAndGet();
		}
		return report;
	}

	@Override
	public void validateStateTransition(String from, String to) {
		stateMachine.validateTransition(from, to);
	}

	@Override
	public String getCurrentState(Map<String, Object> context) {
		return stateResolver.currentState(context);
	}

	@Override
	public Map<String, Object> extractContext(String dslText) {
		return contextExtractor.extractContext(dslText);
	}

	@Override
	public GenerationResponse generateDsl(GenerationRequest request) {
		generations.incrementAndGet();
		try {
			return generator.generateDsl(request);
		}
		catch (RuntimeException e) {
			generationFailures.incrementAndGet();
			throw e;
		}
	}

	@Override
	public DomainMetrics metrics() {
		return new DomainMetrics(name(), version(), vocabulary.verbCount(), vocabulary.categories().size(),
				stateMachine.states().size(), validations.get(), validationFailures.get(),
				generations.get(), generationFailures.get(), isHealthy(), memoryFootprint, clock.instant());
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[" + name() + " " + version() + "]";
	}

	// Two bytes per character of every string the vocabulary holds; good enough for a rough total.
	private static long estimateFootprint(Vocabulary vocabulary) {
		long chars = length(vocabulary.domain()) + length(vocabulary.version()) + length(vocabulary.description());
		for (String state : vocabulary.states()) {
			chars += length(state);
		}
		for (VerbCategory category : vocabulary.categories().values()) {
			chars += length(category.name()) + length(category.description());
		}
		for (VerbDefinition verb : vocabulary.verbs().values()) {
			chars += length(verb.name()) + length(verb.description()) + length(verb.category());
			for (ArgumentSpec argument : verb.arguments().values()) {
				chars += length(argument.name()) + length(argument.description()) + length(argument.pattern());
				for (String value : argument.enumValues()) {
					chars += length(value);
				}
			}
			for (String example : verb.examples()) {
				chars += length(example);
			}
		}
		return chars * 2;
	}

	private static long length(String value) {
		return StringUtils.length(value);
	}
}
