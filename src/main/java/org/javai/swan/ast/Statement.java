package org.javai.swan.ast;

/**
 * Statements that may appear in page and component bodies, conditional bodies and
 * table row action blocks.
 */
public sealed interface Statement
		permits HeaderStmt, TextStmt, ButtonStmt, LinkStmt, FieldStmt, InputStmt, UseStmt, ActionStmt,
		HandlerStmt, ConditionalStmt, QueryStmt, TableStmt, ChartStmt {

	/**
	 * Position of the statement's leading keyword.
	 */
	Position position();

	<R> R accept(StatementVisitor<R> visitor);
}
