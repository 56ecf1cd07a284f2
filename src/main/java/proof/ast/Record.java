package proof.ast;

import proof.print.RecordPrinter;

import java.util.Objects;

/**
 * A target value paired with an expression claimed to equal it.
 *
 * Nothing here checks the claim; that is up to whoever built the record.
 */
public record Record<N>(N value, Expression<N> expression) {
	public Record {
		Objects.requireNonNull(value, "value");
		Objects.requireNonNull(expression, "expression");
	}

	/**
	 * Same as {@link RecordPrinter#display(Record)}, e.g. {@code 24 == 6×4}.
	 */
	@Override
	public String toString() {
		return new RecordPrinter().display(this);
	}
}
