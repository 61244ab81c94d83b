package org.javai.swan.ast;

import java.util.Objects;

/**
 * Dot access on an identifier, e.g. {@code query.page} or {@code user.role}.
 */
public record MemberExpr(IdentifierExpr object, String member, Position position) implements Expression {

	public MemberExpr {
		Objects.requireNonNull(object, "object must not be null");
		Objects.requireNonNull(member, "member must not be null");
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitMember(this);
	}
}
