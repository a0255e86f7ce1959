package org.javai.onboarding.dsl.syntax;

/**
 * Visitor interface for traversing DslNode ASTs.
 *
 * @param <R> the return type of the visitor operations
 */
public interface DslNodeVisitor<R> {

	/**
	 * Visits a form node {@code (head arg...)}.
	 */
	R visitForm(DslNode form);

	/**
	 * Visits a bare symbol such as {@code true} or an unquoted code.
	 */
	default R visitSymbol(String symbol) {
		return null;
	}

	/**
	 * Visits a literal node (string, number or attribute reference).
	 */
	default R visitLiteral(DslNode literal) {
		return null;
	}
}
