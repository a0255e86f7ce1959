package org.javai.onboarding.dsl.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the onboarding DSL.
 * <p>
 * Accepts any syntactically correct document: a whitespace and comment tolerant
 * sequence of forms, symbols and literals. It knows nothing about vocabularies;
 * semantic checks are done by the validators on the resulting AST.
 *
 * <pre>
 * List&lt;DslNode&gt; nodes = DslParser.parse("(case.create (cbu.id \"CBU-1\"))");
 * </pre>
 */
public class DslParser {

	private final List<DslToken> tokens;
	private int current = 0;

	public DslParser(List<DslToken> tokens) {
		this.tokens = tokens != null ? tokens : List.of();
	}

	/**
	 * Tokenizes and parses a document in one step.
	 *
	 * @throws DslSyntaxException if the text is not well formed
	 */
	public static List<DslNode> parse(String text) {
		return new DslParser(new DslTokenizer(text).tokenize()).parse();
	}

	/**
	 * Parses the tokens into a list of top-level nodes.
	 *
	 * @return list of parsed nodes (may be empty)
	 * @throws DslSyntaxException if syntax errors are encountered
	 */
	public List<DslNode> parse() {
		List<DslNode> nodes = new ArrayList<>();
		while (!isAtEnd()) {
			nodes.add(parseExpression());
		}
		return nodes;
	}

	private DslNode parseExpression() {
		DslToken token = peek();

		return switch (token.type()) {
			case LPAREN -> parseForm();
			case IDENTIFIER -> {
				advance();
				yield DslNode.symbol(token.value(), token.position());
			}
			case STRING -> {
				advance();
				yield DslNode.string(token.value(), token.position());
			}
			case NUMBER -> {
				advance();
				yield DslNode.number(token.value(), token.position());
			}
			case ATTR_REF -> {
				advance();
				yield DslNode.attributeReference(token.value(), token.position());
			}
			case RPAREN -> throw new DslSyntaxException(
				"Unexpected ')' at position " + token.position() + ": no matching opening parenthesis", token.position());
			case EOF -> throw new DslSyntaxException("Unexpected end of input", token.position());
		};
	}

	private DslNode parseForm() {
		int startPos = peek().position();
		advance(); // '('

		if (check(DslToken.TokenType.RPAREN)) {
			throw new DslSyntaxException(
				"Empty expression at position " + startPos + ": parentheses must contain at least one element", startPos);
		}

		if (isAtEnd()) {
			throw new DslSyntaxException("Unmatched '(' at position " + startPos + ": reached end of input", startPos);
		}

		DslToken head = peek();
		if (head.type() != DslToken.TokenType.IDENTIFIER) {
			throw new DslSyntaxException(
				"Expected identifier after '(' at position " + startPos + ", found: " + head.type(), head.position());
		}
		advance();

		List<DslNode> args = new ArrayList<>();
		while (!check(DslToken.TokenType.RPAREN) && !isAtEnd()) {
			args.add(parseExpression());
		}

		if (isAtEnd()) {
			throw new DslSyntaxException("Unmatched '(' at position " + startPos + ": reached end of input", startPos);
		}

		advance(); // ')'
		return DslNode.form(head.value(), args, startPos);
	}

	private DslToken peek() {
		return tokens.get(current);
	}

	private void advance() {
		if (!isAtEnd()) {
			current++;
		}
	}

	private boolean check(DslToken.TokenType type) {
		if (isAtEnd()) return false;
		return peek().type() == type;
	}

	private boolean isAtEnd() {
		return current >= tokens.size() || peek().type() == DslToken.TokenType.EOF;
	}
}
