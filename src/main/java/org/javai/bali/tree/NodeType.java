package org.javai.bali.tree;

/**
 * Kinds of AST node. Terminal kinds carry a canonical value; tree kinds carry children whose
 * count must lie between {@link #minChildren()} and {@link #maxChildren()}.
 * <p>
 * The weight is the base of a tree's size; the formatter compares sizes against its inline limit.
 */
public enum NodeType {

	// terminals
	BINARY,
	DURATION,
	MOMENT,
	NUMBER,
	PERCENT,
	PROBABILITY,
	REFERENCE,
	SYMBOL,
	TAG,
	TEMPLATE,
	TEXT,
	VERSION,
	VARIABLE,
	NAME,
	LABEL,
	SHELL,

	// components
	COMPONENT(0, 2, 2),
	STRUCTURE(2, 1, 2),
	BLOCK(100, 1, 2),
	PARAMETERS(2, 1, 1),
	RANGE(2, 2, 2),
	ARRAY(0, 0, Integer.MAX_VALUE),
	TABLE(0, 0, Integer.MAX_VALUE),
	ASSOCIATION(2, 2, 2),

	// procedures
	TASK(0, 2, 2),
	PROCEDURE(0, 0, Integer.MAX_VALUE),
	STATEMENT(0, 1, Integer.MAX_VALUE),
	EVALUATE_CLAUSE(0, 1, 2),
	CHECKOUT_CLAUSE(15, 2, 2),
	SAVE_CLAUSE(9, 2, 2),
	DISCARD_CLAUSE(8, 1, 1),
	COMMIT_CLAUSE(11, 2, 2),
	PUBLISH_CLAUSE(8, 1, 1),
	QUEUE_CLAUSE(10, 2, 2),
	WAIT_CLAUSE(15, 2, 2),
	IF_CLAUSE(100, 2, Integer.MAX_VALUE),
	SELECT_CLAUSE(100, 3, Integer.MAX_VALUE),
	WHILE_CLAUSE(100, 2, 3),
	WITH_CLAUSE(100, 2, 4),
	CONTINUE_CLAUSE(13, 0, 1),
	BREAK_CLAUSE(10, 0, 1),
	RETURN_CLAUSE(6, 0, 1),
	THROW_CLAUSE(6, 1, 1),
	HANDLE_CLAUSE(100, 3, 3),
	FINISH_CLAUSE(12, 1, 1),

	// expressions
	ARITHMETIC_EXPRESSION(3, 2, 2),
	COMPARISON_EXPRESSION(9, 2, 2),
	LOGICAL_EXPRESSION(6, 2, 2),
	DEFAULT_EXPRESSION(3, 2, 2),
	EXPONENTIAL_EXPRESSION(3, 2, 2),
	FACTORIAL_EXPRESSION(1, 1, 1),
	SUBCOMPONENT_EXPRESSION(0, 2, 2),
	MESSAGE_EXPRESSION(1, 3, 3),
	FUNCTION_EXPRESSION(0, 2, 2),
	PRECEDENCE_EXPRESSION(2, 1, 1),
	DEREFERENCE_EXPRESSION(1, 1, 1),
	INVERSION_EXPRESSION(1, 1, 1),
	COMPLEMENT_EXPRESSION(4, 1, 1),
	MAGNITUDE_EXPRESSION(2, 1, 1),
	INDICES(2, 1, 1);

	private final boolean terminal;
	private final int weight;
	private final int minChildren;
	private final int maxChildren;

	NodeType() {
		this.terminal = true;
		this.weight = 0;
		this.minChildren = 0;
		this.maxChildren = 0;
	}

	NodeType(int weight, int minChildren, int maxChildren) {
		this.terminal = false;
		this.weight = weight;
		this.minChildren = minChildren;
		this.maxChildren = maxChildren;
	}

	public boolean isTerminal() {
		return terminal;
	}

	public int weight() {
		return weight;
	}

	public int minChildren() {
		return minChildren;
	}

	public int maxChildren() {
		return maxChildren;
	}

	/**
	 * Whether this kind is one of the expression forms (variables and function calls included).
	 */
	public boolean isExpression() {
		return switch (this) {
			case ARITHMETIC_EXPRESSION, COMPARISON_EXPRESSION, LOGICAL_EXPRESSION, DEFAULT_EXPRESSION,
					EXPONENTIAL_EXPRESSION, FACTORIAL_EXPRESSION, SUBCOMPONENT_EXPRESSION, MESSAGE_EXPRESSION,
					FUNCTION_EXPRESSION, PRECEDENCE_EXPRESSION, DEREFERENCE_EXPRESSION, INVERSION_EXPRESSION,
					COMPLEMENT_EXPRESSION, MAGNITUDE_EXPRESSION, VARIABLE -> true;
			default -> false;
		};
	}

	/**
	 * Whether this kind belongs to procedural code: a task, procedure, statement or clause.
	 */
	public boolean isProcedural() {
		return switch (this) {
			case TASK, PROCEDURE, STATEMENT, EVALUATE_CLAUSE, CHECKOUT_CLAUSE, SAVE_CLAUSE, DISCARD_CLAUSE,
					COMMIT_CLAUSE, PUBLISH_CLAUSE, QUEUE_CLAUSE, WAIT_CLAUSE, IF_CLAUSE, SELECT_CLAUSE, WHILE_CLAUSE,
					WITH_CLAUSE, CONTINUE_CLAUSE, BREAK_CLAUSE, RETURN_CLAUSE, THROW_CLAUSE, HANDLE_CLAUSE,
					FINISH_CLAUSE -> true;
			default -> false;
		};
	}
}
