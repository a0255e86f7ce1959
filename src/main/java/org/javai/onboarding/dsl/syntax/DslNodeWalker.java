package org.javai.onboarding.dsl.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility class for walking DslNode ASTs with visitors.
 */
public final class DslNodeWalker {

	private DslNodeWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Walks an AST node tree in pre-order (visits node before children).
	 *
	 * @param <R> the return type of the visitor
	 * @param node the root node to start traversal from
	 * @param visitor the visitor to apply to each node
	 * @return the result of visiting the root node
	 */
	public static <R> R walkPreOrder(DslNode node, DslNodeVisitor<R> visitor) {
		if (node == null) {
			return null;
		}

		R result = node.accept(visitor);

		for (DslNode child : node.args()) {
			walkPreOrder(child, visitor);
		}

		return result;
	}

	/**
	 * Walks a list of top-level nodes in document order.
	 */
	public static <R> void walkAll(List<DslNode> nodes, DslNodeVisitor<R> visitor) {
		if (nodes == null) {
			return;
		}

		for (DslNode node : nodes) {
			walkPreOrder(node, visitor);
		}
	}

	/**
	 * Collects every form in the document, at any depth, in pre-order.
	 */
	public static List<DslNode> allForms(List<DslNode> nodes) {
		List<DslNode> forms = new ArrayList<>();
		walkAll(nodes, form -> {
			forms.add(form);
			return null;
		});
		return forms;
	}
}
