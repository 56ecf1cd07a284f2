package proof.ast;

import proof.print.ExpressionPrinter;

import java.util.Objects;

/**
 * Quotient of two operands. Division is neither associative nor commutative.
 */
public record Divide<N>(Expression<N> lhs, Expression<N> rhs) implements Expression<N> {
	public Divide {
		Objects.requireNonNull(lhs, "lhs");
		Objects.requireNonNull(rhs, "rhs");
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitDivide(this);
	}

	@Override
	public String toString() {
		return new ExpressionPrinter().render(this);
	}
}
