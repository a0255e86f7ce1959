package org.javai.onboarding.statemachine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StateMachine")
class StateMachineTest {

	private static final List<String> STATES = List.of("CREATE", "PRODUCTS_ADDED", "KYC_STARTED",
			"SERVICES_DISCOVERED", "RESOURCES_PLANNED", "ATTRIBUTES_BOUND", "WORKFLOW_ACTIVE", "COMPLETE");

	private final StateMachine machine = new StateMachine(STATES);

	@Test
	@DisplayName("every step to the immediate successor is legal")
	void successorsAreLegal() {
		for (int i = 0; i + 1 < STATES.size(); i++) {
			String from = STATES.get(i);
			String to = STATES.get(i + 1);
			assertThatCode(() -> machine.validateTransition(from, to)).doesNotThrowAnyException();
		}
	}

	@Test
	@DisplayName("every other pair of states is illegal")
	void everythingElseIsIllegal() {
		for (int i = 0; i < STATES.size(); i++) {
			for (int j = 0; j < STATES.size(); j++) {
				if (j == i + 1) {
					continue;
				}
				String from = STATES.get(i);
				String to = STATES.get(j);
				assertThatThrownBy(() -> machine.validateTransition(from, to))
						.as("%s -> %s", from, to)
						.isInstanceOf(IllegalTransitionException.class);
			}
		}
	}

	@Test
	@DisplayName("skipping a state names the expected successor")
	void skipNamesExpectedState() {
		assertThatThrownBy(() -> machine.validateTransition("CREATE", "KYC_STARTED"))
				.isInstanceOf(IllegalTransitionException.class)
				.hasMessage("invalid state transition from CREATE to KYC_STARTED (expected PRODUCTS_ADDED)")
				.satisfies(e -> {
					IllegalTransitionException illegal = (IllegalTransitionException) e;
					assertThat(illegal.from()).isEqualTo("CREATE");
					assertThat(illegal.to()).isEqualTo("KYC_STARTED");
				});
	}

	@Test
	@DisplayName("leaving the final state is illegal")
	void finalStateIsTerminal() {
		assertThatThrownBy(() -> machine.validateTransition("COMPLETE", "CREATE"))
				.hasMessageContaining("COMPLETE is final");
	}

	@Test
	@DisplayName("unknown states are rejected")
	void unknownState() {
		assertThatThrownBy(() -> machine.validateTransition("CREATE", "LIMBO"))
				.isInstanceOf(IllegalTransitionException.class)
				.hasMessage("unknown state: LIMBO");
	}

	@Test
	@DisplayName("a null state is an unknown state")
	void nullState() {
		assertThatThrownBy(() -> machine.validateTransition(null, "CREATE"))
				.isInstanceOf(IllegalTransitionException.class)
				.hasMessage("unknown state: null");
		assertThatThrownBy(() -> machine.pathBetween("CREATE", null))
				.isInstanceOf(IllegalTransitionException.class)
				.hasMessage("unknown state: null");
		assertThat(machine.contains(null)).isFalse();
		assertThat(machine.nextState(null)).isEmpty();
	}

	@Test
	@DisplayName("initial, final and next states follow declaration order")
	void navigation() {
		assertThat(machine.initialState()).isEqualTo("CREATE");
		assertThat(machine.finalState()).isEqualTo("COMPLETE");
		assertThat(machine.nextState("KYC_STARTED")).contains("SERVICES_DISCOVERED");
		assertThat(machine.nextState("COMPLETE")).isEmpty();
		assertThat(machine.nextState("LIMBO")).isEmpty();
	}

	@Test
	@DisplayName("pathBetween lists the forward steps, each one a legal transition")
	void pathBetween() {
		List<String> path = machine.pathBetween("PRODUCTS_ADDED", "RESOURCES_PLANNED");

		assertThat(path).containsExactly("KYC_STARTED", "SERVICES_DISCOVERED", "RESOURCES_PLANNED");
		String previous = "PRODUCTS_ADDED";
		for (String next : path) {
			String from = previous;
			assertThatCode(() -> machine.validateTransition(from, next)).doesNotThrowAnyException();
			previous = next;
		}
	}

	@Test
	@DisplayName("pathBetween refuses to go backwards or stay put")
	void noBackwardPath() {
		assertThatThrownBy(() -> machine.pathBetween("KYC_STARTED", "CREATE"))
				.isInstanceOf(IllegalTransitionException.class);
		assertThatThrownBy(() -> machine.pathBetween("KYC_STARTED", "KYC_STARTED"))
				.isInstanceOf(IllegalTransitionException.class);
	}

	@Test
	@DisplayName("states must be present and unique")
	void rejectsBadStateLists() {
		assertThatThrownBy(() -> new StateMachine(List.of())).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new StateMachine(List.of("A", "B", "A"))).isInstanceOf(IllegalArgumentException.class);
	}
}
