package proof.print;

import proof.ast.Record;

import java.io.IOException;

/**
 * Text forms of a {@link Record}.
 */
public final class RecordPrinter {
	private final ExpressionPrinter expressions = new ExpressionPrinter();

	/**
	 * {@code <value> == <expression>}, e.g. {@code 24 == 6×4}.
	 */
	public String display(Record<?> record) {
		return record.value() + " == " + expressions.render(record.expression());
	}

	/**
	 * Named fields, each shown as its readable text rather than its structure:
	 * {@code Record { expression: 6×4, value: 24 }}.
	 */
	public String debug(Record<?> record) {
		return "Record { expression: " + expressions.render(record.expression())
				+ ", value: " + record.value() + " }";
	}

	public void display(Record<?> record, Appendable out) throws IOException {
		out.append(display(record));
	}

	public void debug(Record<?> record, Appendable out) throws IOException {
		out.append(debug(record));
	}
}
