package org.javai.swan.ast;

/**
 * Expression nodes. Expressions are never evaluated by the front end; they are kept
 * as data for downstream code generators.
 */
public sealed interface Expression permits Literal, IdentifierExpr, MemberExpr, BinaryExpr, UnaryExpr {

	Position position();

	<R> R accept(ExpressionVisitor<R> visitor);
}
