package proof.ast;

import proof.print.ExpressionPrinter;

import java.util.Objects;

public record Minus<N>(Expression<N> lhs, Expression<N> rhs) implements Expression<N> {
	public Minus {
		Objects.requireNonNull(lhs, "lhs");
		Objects.requireNonNull(rhs, "rhs");
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitMinus(this);
	}

	@Override
	public String toString() {
		return new ExpressionPrinter().render(this);
	}
}
