package org.javai.onboarding.statemachine;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Strictly linear workflow over an ordered list of states.
 * <p>
 * The first state is the initial one. Moving from {@code A} to {@code B} is legal only when
 * {@code B} immediately follows {@code A}: no skips, repeats or backward moves.
 */
public final class StateMachine {

	private final List<String> states;

	public StateMachine(List<String> states) {
		if (states == null || states.isEmpty()) {
			throw new IllegalArgumentException("A state machine needs at least one state");
		}
		if (states.stream().distinct().count() != states.size()) {
			throw new IllegalArgumentException("States must be unique: " + states);
		}
		this.states = List.copyOf(states);
	}

	public List<String> states() {
		return states;
	}

	public String initialState() {
		return states.get(0);
	}

	public String finalState() {
		return states.get(states.size() - 1);
	}

	public boolean contains(String state) {
		return state != null && states.contains(state);
	}

	/**
	 * @throws IllegalTransitionException unless {@code to} immediately follows {@code from}
	 */
	public void validateTransition(String from, String to) {
		int fromIndex = indexOf(from, from, to);
		int toIndex = indexOf(to, from, to);
		if (toIndex != fromIndex + 1) {
			throw new IllegalTransitionException(from, to,
					"invalid state transition from " + from + " to " + to
							+ nextState(from).map(next -> " (expected " + next + ")").orElse(" (" + from + " is final)"));
		}
	}

	public Optional<String> nextState(String state) {
		if (state == null) {
			return Optional.empty();
		}
		int index = states.indexOf(state);
		if (index < 0 || index == states.size() - 1) {
			return Optional.empty();
		}
		return Optional.of(states.get(index + 1));
	}

	/**
	 * States visited when moving forward from {@code from} to {@code to}, excluding {@code from}.
	 * Each consecutive pair in {@code [from] + result} is a legal transition.
	 *
	 * @throws IllegalTransitionException if either state is unknown or {@code to} does not lie ahead
	 */
	public List<String> pathBetween(String from, String to) {
		int fromIndex = indexOf(from, from, to);
		int toIndex = indexOf(to, from, to);
		if (toIndex <= fromIndex) {
			throw new IllegalTransitionException(from, to, "no forward path from " + from + " to " + to);
		}
		return new ArrayList<>(states.subList(fromIndex + 1, toIndex + 1));
	}

	private int indexOf(String state, String from, String to) {
		int index = state == null ? -1 : states.indexOf(state);
		if (index < 0) {
			throw new IllegalTransitionException(from, to, "unknown state: " + state);
		}
		return index;
	}
}
