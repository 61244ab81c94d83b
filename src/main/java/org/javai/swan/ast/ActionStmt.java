package org.javai.swan.ast;

/**
 * Statements that raise a named action ({@code submit} and {@code click}).
 */
public sealed interface ActionStmt extends Statement permits SubmitStmt, ClickStmt {

	String label();

	String action();
}
