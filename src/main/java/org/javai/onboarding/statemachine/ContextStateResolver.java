package org.javai.onboarding.statemachine;

import java.util.List;
import java.util.Map;

/**
 * Infers the current state of a case from a context map.
 * <p>
 * An explicit {@code current_state} entry wins and must name a known state. Otherwise the
 * markers are inspected in chain order and inference stops at the first one that is missing,
 * so a later marker set without the earlier ones is ignored. A marker counts as set when its
 * key is present and not {@code Boolean.FALSE}.
 */
public final class ContextStateResolver {

	private final StateMachine stateMachine;
	private final List<ProgressMarker> chain;

	public ContextStateResolver(StateMachine stateMachine, List<ProgressMarker> chain) {
		if (stateMachine == null) {
			throw new IllegalArgumentException("State machine cannot be null");
		}
		this.stateMachine = stateMachine;
		this.chain = chain != null ? List.copyOf(chain) : List.of();
		for (ProgressMarker marker : this.chain) {
			if (!stateMachine.contains(marker.state())) {
				throw new IllegalArgumentException("Marker " + marker.contextKey() + " names unknown state: " + marker.state());
			}
		}
	}

	public List<ProgressMarker> chain() {
		return chain;
	}

	/**
	 * @throws IllegalTransitionException if the context names an unknown {@code current_state}
	 */
	public String currentState(Map<String, Object> context) {
		if (context == null || context.isEmpty()) {
			return stateMachine.initialState();
		}
		Object explicit = context.get(ContextExtractor.CURRENT_STATE);
		if (explicit != null) {
			String state = explicit.toString();
			if (!stateMachine.contains(state)) {
				throw new IllegalTransitionException(null, state, "unknown state: " + state);
			}
			return state;
		}
		String state = stateMachine.initialState();
		for (ProgressMarker marker : chain) {
			if (!isSet(context.get(marker.contextKey()))) {
				break;
			}
			state = marker.state();
		}
		return state;
	}

	static boolean isSet(Object value) {
		return value != null && !Boolean.FALSE.equals(value);
	}
}
