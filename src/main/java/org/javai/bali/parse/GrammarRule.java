package org.javai.bali.parse;

/**
 * Grammar rules that label {@link ParseNode}s. Each alternative of the expression rule has
 * its own label so the tree builder can dispatch on it directly.
 */
public enum GrammarRule {
	DOCUMENT,
	TASK,
	COMPONENT,
	ELEMENT,
	STRUCTURE,
	BLOCK,
	PARAMETERS,
	RANGE,
	ARRAY,
	TABLE,
	ASSOCIATION,
	PROCEDURE,
	STATEMENT,

	EVALUATE_CLAUSE,
	RECIPIENT,
	CHECKOUT_CLAUSE,
	SAVE_CLAUSE,
	DISCARD_CLAUSE,
	COMMIT_CLAUSE,
	PUBLISH_CLAUSE,
	QUEUE_CLAUSE,
	WAIT_CLAUSE,
	IF_CLAUSE,
	SELECT_CLAUSE,
	WHILE_CLAUSE,
	WITH_CLAUSE,
	CONTINUE_CLAUSE,
	BREAK_CLAUSE,
	RETURN_CLAUSE,
	THROW_CLAUSE,
	HANDLE_CLAUSE,
	FINISH_CLAUSE,

	COMPONENT_EXPRESSION,
	VARIABLE_EXPRESSION,
	FUNCTION_EXPRESSION,
	PRECEDENCE_EXPRESSION,
	DEREFERENCE_EXPRESSION,
	INVERSION_EXPRESSION,
	MAGNITUDE_EXPRESSION,
	COMPLEMENT_EXPRESSION,
	EXPONENTIAL_EXPRESSION,
	ARITHMETIC_EXPRESSION,
	COMPARISON_EXPRESSION,
	LOGICAL_EXPRESSION,
	DEFAULT_EXPRESSION,
	MESSAGE_EXPRESSION,
	SUBCOMPONENT_EXPRESSION,
	FACTORIAL_EXPRESSION,
	INVOCATION,
	INDICES,

	NUMBER,
	REAL,
	IMAGINARY,
	PERCENT,
	TEXT,
	BINARY
}
