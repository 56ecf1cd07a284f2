package proof.ast;

import proof.print.ExpressionPrinter;

import java.util.Objects;

/**
 * Juxtaposition of two operands, e.g. digits 1 and 4 forming 14.
 */
public record Concat<N>(Expression<N> lhs, Expression<N> rhs) implements Expression<N> {
	public Concat {
		Objects.requireNonNull(lhs, "lhs");
		Objects.requireNonNull(rhs, "rhs");
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitConcat(this);
	}

	@Override
	public String toString() {
		return new ExpressionPrinter().render(this);
	}
}
