package org.javai.onboarding.statemachine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.onboarding.dsl.syntax.DslNode;
import org.javai.onboarding.dsl.syntax.DslNodeWalker;
import org.javai.onboarding.dsl.syntax.DslParser;
import org.javai.onboarding.dsl.syntax.DslSyntaxException;
import org.javai.onboarding.dsl.syntax.DslToken;
import org.javai.onboarding.dsl.syntax.DslTokenizer;
import org.javai.onboarding.dsl.syntax.MalformedLiteralException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Context extractor driven by verb occurrences.
 * <p>
 * Captures named string values from keyword forms, sets a boolean flag for every progress verb
 * found and derives {@code current_state} from the most advanced marker present. A terminal
 * verb overrides the derived state.
 * <p>
 * A malformed quoted literal raises {@link MalformedLiteralException}. Any other syntax
 * error yields an empty context.
 *
 * <pre>
 * ContextExtractor extractor = VerbMarkerContextExtractor.builder()
 *         .capture("cbu.id", "cbu_id")
 *         .marker(ProgressMarker.captured("cbu_id", "CREATE"))
 *         .marker(ProgressMarker.verb("products.add", "products", "PRODUCTS_ADDED"))
 *         .terminal("case.close", "COMPLETE")
 *         .build();
 * </pre>
 */
public final class VerbMarkerContextExtractor implements ContextExtractor {

	private static final Logger logger = LoggerFactory.getLogger(VerbMarkerContextExtractor.class);

	private final Map<String, String> captures;
	private final List<ProgressMarker> markers;
	private final Map<String, String> terminals;

	private VerbMarkerContextExtractor(Builder builder) {
		this.captures = Map.copyOf(builder.captures);
		this.markers = List.copyOf(builder.markers);
		this.terminals = Map.copyOf(builder.terminals);
	}

	public static Builder builder() {
		return new Builder();
	}

	public List<ProgressMarker> markers() {
		return markers;
	}

	@Override
	public Map<String, Object> extractContext(String dslText) {
		Map<String, Object> context = new LinkedHashMap<>();
		if (dslText == null || dslText.isBlank()) {
			return context;
		}
		List<DslNode> nodes;
		try {
			List<DslToken> tokens = new DslTokenizer(dslText).tokenize();
			nodes = new DslParser(tokens).parse();
		}
		catch (MalformedLiteralException e) {
			throw e;
		}
		catch (DslSyntaxException e) {
			logger.debug("Cannot extract context from malformed DSL: {}", e.getMessage());
			return context;
		}

		String terminalState = null;
		for (DslNode form : DslNodeWalker.allForms(nodes)) {
			String head = form.symbol();
			String captureKey = captures.get(head);
			if (captureKey != null && !context.containsKey(captureKey)) {
				form.firstStringArgument().ifPresent(value -> context.put(captureKey, value));
			}
			for (ProgressMarker marker : markers) {
				if (head.equals(marker.verb())) {
					context.put(marker.contextKey(), Boolean.TRUE);
				}
			}
			if (terminals.containsKey(head)) {
				terminalState = terminals.get(head);
			}
		}

		String state = null;
		for (ProgressMarker marker : markers) {
			if (ContextStateResolver.isSet(context.get(marker.contextKey()))) {
				state = marker.state();
			}
		}
		if (terminalState != null) {
			state = terminalState;
		}
		if (state != null) {
			context.put(CURRENT_STATE, state);
		}
		return context;
	}

	public static final class Builder {

		private final Map<String, String> captures = new LinkedHashMap<>();
		private final List<ProgressMarker> markers = new ArrayList<>();
		private final Map<String, String> terminals = new LinkedHashMap<>();

		private Builder() {
		}

		/**
		 * Store the first string argument of the first {@code head} form under {@code contextKey}.
		 */
		public Builder capture(String head, String contextKey) {
			captures.put(Objects.requireNonNull(head, "head must not be null"),
					Objects.requireNonNull(contextKey, "contextKey must not be null"));
			return this;
		}

		/**
		 * Add a marker. Markers must be added in workflow order.
		 */
		public Builder marker(ProgressMarker marker) {
			markers.add(Objects.requireNonNull(marker, "marker must not be null"));
			return this;
		}

		public Builder terminal(String verb, String state) {
			terminals.put(Objects.requireNonNull(verb, "verb must not be null"),
					Objects.requireNonNull(state, "state must not be null"));
			return this;
		}

		public VerbMarkerContextExtractor build() {
			return new VerbMarkerContextExtractor(this);
		}
	}
}
