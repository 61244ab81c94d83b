package org.javai.swan.ast;

/**
 * Visitor over the closed set of expression variants. Every variant has its own
 * method, so introducing a new expression type breaks every visitor at compile time
 * rather than leaving it silently unhandled.
 *
 * @param <R> the return type of the visitor operations
 */
public interface ExpressionVisitor<R> {

	R visitString(StringLiteral literal);

	R visitNumber(NumberLiteral literal);

	R visitBoolean(BooleanLiteral literal);

	R visitIdentifier(IdentifierExpr identifier);

	R visitMember(MemberExpr member);

	R visitBinary(BinaryExpr binary);

	R visitUnary(UnaryExpr unary);
}
