package org.javai.onboarding.dsl.syntax;

import java.util.List;
import java.util.Optional;

/**
 * Represents a node in the parsed DSL AST.
 * <p>
 * A node is either a form {@code (head arg...)}, a bare symbol, or a literal
 * (string, number, attribute reference). Forms and symbols carry a {@code symbol};
 * literals carry a {@code literalValue}.
 *
 * @param kind what sort of node this is
 * @param symbol the form head or bare symbol, {@code null} for literals
 * @param args child nodes of a form, empty otherwise
 * @param literalValue the literal text, {@code null} for forms and symbols
 * @param position the character offset of the node in the source text
 */
public record DslNode(Kind kind, String symbol, List<DslNode> args, String literalValue, int position) {

	public enum Kind {
		FORM,
		SYMBOL,
		STRING,
		NUMBER,
		ATTRIBUTE_REFERENCE
	}

	public DslNode {
		args = args != null ? List.copyOf(args) : List.of();
	}

	public static DslNode form(String head, List<DslNode> args, int position) {
		return new DslNode(Kind.FORM, head, args, null, position);
	}

	public static DslNode symbol(String symbol, int position) {
		return new DslNode(Kind.SYMBOL, symbol, List.of(), null, position);
	}

	public static DslNode string(String value, int position) {
		return new DslNode(Kind.STRING, null, List.of(), value, position);
	}

	public static DslNode number(String value, int position) {
		return new DslNode(Kind.NUMBER, null, List.of(), value, position);
	}

	public static DslNode attributeReference(String body, int position) {
		return new DslNode(Kind.ATTRIBUTE_REFERENCE, null, List.of(), body, position);
	}

	public boolean isForm() {
		return kind == Kind.FORM;
	}

	public boolean isLiteral() {
		return literalValue != null;
	}

	/**
	 * Returns the value of the first string literal argument of a form, e.g. {@code X} for {@code (cbu.id "X")}.
	 */
	public Optional<String> firstStringArgument() {
		for (DslNode arg : args) {
			if (arg.kind == Kind.STRING) {
				return Optional.of(arg.literalValue);
			}
		}
		return Optional.empty();
	}

	/**
	 * Accepts a visitor and dispatches to the appropriate visitor method.
	 *
	 * @param <R> the return type of the visitor
	 * @param visitor the visitor to accept
	 * @return the result of the visitor operation
	 */
	public <R> R accept(DslNodeVisitor<R> visitor) {
		if (kind == Kind.FORM) {
			return visitor.visitForm(this);
		}
		if (kind == Kind.SYMBOL) {
			return visitor.visitSymbol(symbol);
		}
		return visitor.visitLiteral(this);
	}
}
