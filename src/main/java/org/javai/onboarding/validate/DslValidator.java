package org.javai.onboarding.validate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.javai.onboarding.dsl.syntax.DslNode;
import org.javai.onboarding.dsl.syntax.DslParser;
import org.javai.onboarding.dsl.syntax.DslSyntaxException;
import org.javai.onboarding.vocabulary.ArgumentSpec;
import org.javai.onboarding.vocabulary.VerbDefinition;
import org.javai.onboarding.vocabulary.Vocabulary;

/**
 * Checks DSL text against one domain's vocabulary.
 * <p>
 * Every form whose head looks like a verb ({@code [a-z]+(\.[a-z-]+)+}) is checked, at any
 * nesting depth. The head must either be a verb of the vocabulary, or an argument keyword
 * declared by the nearest enclosing verb, as {@code cbu.id} is inside {@code case.create}.
 * Heads of any other shape ({@code document}, {@code nature-purpose}) are structural and only
 * their children are inspected.
 * <p>
 * Keyword forms of the shape {@code (arg "value")} are also checked against the declared
 * enum values and pattern of the argument, when the enclosing verb declares one.
 * <p>
 * Instances are immutable and thread-safe.
 *
 * <pre>
 * DslValidator validator = new DslValidator(vocabulary);
 * validator.validateVerbs("(case.create (cbu.id \"CBU-1234\"))");   // throws on the first problem
 * ValidationReport report = validator.validate(text);               // collects every problem
 * </pre>
 */
public class DslValidator {

	/**
	 * Shape of a verb name: lowercase segments joined by dots, at least two segments.
	 */
	public static final Pattern VERB_SHAPE = Pattern.compile("[a-z]+(\\.[a-z-]+)+");

	private final Vocabulary vocabulary;

	public DslValidator(Vocabulary vocabulary) {
		if (vocabulary == null) {
			throw new IllegalArgumentException("Vocabulary cannot be null");
		}
		this.vocabulary = vocabulary;
	}

	public Vocabulary vocabulary() {
		return vocabulary;
	}

	public static boolean isVerbShaped(String symbol) {
		return symbol != null && VERB_SHAPE.matcher(symbol).matches();
	}

	/**
	 * Fails fast on the first unknown verb.
	 *
	 * @throws DslSyntaxException if the text is not well formed
	 * @throws VerbNotFoundException if a verb-shaped head is not part of the vocabulary
	 * @throws EmptyDocumentException if the text contains no verb at all
	 */
	public void validateVerbs(String dslText) {
		List<DslNode> nodes = DslParser.parse(dslText != null ? dslText : "");
		Scan scan = new Scan(true);
		scan.walk(nodes, null);
		if (!scan.verbShapedSeen) {
			throw new EmptyDocumentException(vocabulary.domain());
		}
	}

	/**
	 * Validates the whole document and reports every violation found, including
	 * argument values rejected by their declared enum values or pattern.
	 * <p>
	 * Never throws for invalid input; a syntax error is reported as a single
	 * {@link ViolationKind#SYNTAX} violation.
	 */
	public ValidationReport validate(String dslText) {
		List<DslNode> nodes;
		try {
			nodes = DslParser.parse(dslText != null ? dslText : "");
		}
		catch (DslSyntaxException e) {
			return new ValidationReport(vocabulary.domain(),
					List.of(new Violation(ViolationKind.SYNTAX, e.getMessage(), null, e.position())));
		}
		Scan scan = new Scan(false);
		scan.walk(nodes, null);
		if (!scan.verbShapedSeen) {
			scan.violations.add(new Violation(ViolationKind.EMPTY_DOCUMENT,
					new EmptyDocumentException(vocabulary.domain()).getMessage(), null, -1));
		}
		return new ValidationReport(vocabulary.domain(), scan.violations);
	}

	/**
	 * One pass over a parsed document. In fail-fast mode the first unknown verb is thrown
	 * and argument values are not inspected.
	 */
	private final class Scan {

		private final boolean failFast;
		private final List<Violation> violations = new ArrayList<>();
		private boolean verbShapedSeen;

		private Scan(boolean failFast) {
			this.failFast = failFast;
		}

		private void walk(List<DslNode> nodes, VerbDefinition enclosing) {
			for (DslNode node : nodes) {
				if (node.isForm()) {
					visit(node, enclosing);
				}
			}
		}

		private void visit(DslNode form, VerbDefinition enclosing) {
			String head = form.symbol();
			Optional<VerbDefinition> verb = vocabulary.verb(head);
			if (verb.isPresent()) {
				verbShapedSeen = true;
				walk(form.args(), verb.get());
				return;
			}
			if (enclosing != null && enclosing.declaresArgument(head)) {
				if (isVerbShaped(head)) {
					verbShapedSeen = true;
				}
				if (!failFast) {
					checkArgumentValue(form, enclosing.argument(head).orElseThrow());
				}
				walk(form.args(), enclosing);
				return;
			}
			if (isVerbShaped(head)) {
				verbShapedSeen = true;
				if (failFast) {
					throw new VerbNotFoundException(vocabulary.domain(), head);
				}
				violations.add(new Violation(ViolationKind.UNKNOWN_VERB,
						new VerbNotFoundException(vocabulary.domain(), head).getMessage(), head, form.position()));
			}
			walk(form.args(), enclosing);
		}

		private void checkArgumentValue(DslNode form, ArgumentSpec spec) {
			if (!spec.isConstrained()) {
				return;
			}
			form.firstStringArgument().ifPresent(value -> {
				if (!spec.accepts(value)) {
					violations.add(new Violation(ViolationKind.INVALID_ARGUMENT_VALUE,
							"invalid value for " + spec.name() + ": \"" + value + "\"" + describe(spec),
							spec.name(), form.position()));
				}
			});
		}

		private String describe(ArgumentSpec spec) {
			if (!spec.enumValues().isEmpty()) {
				return " (expected one of " + spec.enumValues() + ")";
			}
			return " (expected to match " + spec.pattern() + ")";
		}
	}
}
