package proof.ast;

import proof.print.ExpressionPrinter;

import java.util.Objects;

public record Times<N>(Expression<N> lhs, Expression<N> rhs) implements Expression<N> {
	public Times {
		Objects.requireNonNull(lhs, "lhs");
		Objects.requireNonNull(rhs, "rhs");
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitTimes(this);
	}

	@Override
	public String toString() {
		return new ExpressionPrinter().render(this);
	}
}
