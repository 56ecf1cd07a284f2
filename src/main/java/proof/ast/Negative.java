package proof.ast;

import proof.print.ExpressionPrinter;

import java.util.Objects;

/**
 * Unary minus applied to {@code base}.
 */
public record Negative<N>(Expression<N> base) implements Expression<N> {
	public Negative {
		Objects.requireNonNull(base, "base");
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitNegative(this);
	}

	@Override
	public String toString() {
		return new ExpressionPrinter().render(this);
	}
}
