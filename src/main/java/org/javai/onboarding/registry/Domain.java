package org.javai.onboarding.registry;

import java.util.List;
import java.util.Map;
import org.javai.onboarding.generate.GenerationRequest;
import org.javai.onboarding.generate.GenerationResponse;
import org.javai.onboarding.validate.ValidationReport;
import org.javai.onboarding.vocabulary.Vocabulary;

/**
 * One business area plugged into the {@link DomainRegistry}: a vocabulary plus the validator,
 * state machine, context extractor and generator built on it.
 * <p>
 * The registry and router depend only on this interface, so a new domain needs no registry changes.
 * Implementations must be safe for concurrent use.
 */
public interface Domain {

	String name();

	String version();

	String description();

	boolean isHealthy();

	Vocabulary vocabulary();

	/**
	 * Workflow states in order; the first is the initial state.
	 */
	List<String> validStates();

	String initialState();

	/**
	 * @throws org.javai.onboarding.validate.VerbNotFoundException on the first unknown verb
	 * @throws org.javai.onboarding.validate.EmptyDocumentException if the text has no verb
	 * @throws org.javai.onboarding.dsl.syntax.DslSyntaxException if the text is malformed
	 */
	void validateVerbs(String dslText);

	/**
	 * Full validation collecting every violation instead of stopping at the first.
	 */
	ValidationReport validate(String dslText);

	/**
	 * @throws org.javai.onboarding.statemachine.IllegalTransitionException unless {@code to} immediately follows {@code from}
	 */
	void validateStateTransition(String from, String to);

	String getCurrentState(Map<String, Object> context);

	Map<String, Object> extractContext(String dslText);

	GenerationResponse generateDsl(GenerationRequest request);

	DomainMetrics metrics();

	/**
	 * Hints used by {@link DomainRouter} to pick this domain for free text.
	 */
	default RoutingHints routingHints() {
		return RoutingHints.none();
	}
}
