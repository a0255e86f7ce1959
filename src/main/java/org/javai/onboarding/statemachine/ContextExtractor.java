package org.javai.onboarding.statemachine;

import java.util.Map;

/**
 * Recovers workflow context from accumulated DSL text.
 */
@FunctionalInterface
public interface ContextExtractor {

	/** Key under which the derived state is stored. */
	String CURRENT_STATE = "current_state";

	Map<String, Object> extractContext(String dslText);
}
