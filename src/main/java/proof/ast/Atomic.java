package proof.ast;

import proof.print.ExpressionPrinter;

import java.util.Objects;

/**
 * Leaf holding a single number.
 */
public record Atomic<N>(N number) implements Expression<N> {
	public Atomic {
		Objects.requireNonNull(number, "number");
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitAtomic(this);
	}

	@Override
	public String toString() {
		return new ExpressionPrinter().render(this);
	}
}
