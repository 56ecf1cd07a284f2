package proof.print;

import org.junit.jupiter.api.Test;
import proof.ast.Atomic;
import proof.ast.Divide;
import proof.ast.Negative;
import proof.ast.Plus;
import proof.ast.Record;
import proof.ast.Times;

import java.io.IOException;
import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class RecordPrinterTest {
	private final RecordPrinter printer = new RecordPrinter();

	private static Atomic<Integer> n(int value) {
		return new Atomic<>(value);
	}

	@Test
	void displayJoinsValueAndExpression() {
		Record<Integer> record = new Record<>(24, new Times<>(n(6), n(4)));
		assertEquals("24 == 6×4", printer.display(record));
		assertEquals("24 == 6×4", record.toString());
	}

	@Test
	void displayUsesMinimalParentheses() {
		Record<Integer> record = new Record<>(-3, new Negative<>(new Plus<>(n(1), n(2))));
		assertEquals("-3 == -(1+2)", printer.display(record));
	}

	@Test
	void debugShowsReadableFieldsNotStructure() {
		Record<Integer> record = new Record<>(1, new Divide<>(n(6), new Times<>(n(2), n(3))));
		assertEquals("Record { expression: 6÷(2×3), value: 1 }", printer.debug(record));
	}

	@Test
	void valueUsesItsOwnTextForm() {
		Record<BigDecimal> record = new Record<>(new BigDecimal("0.5"),
				new Divide<>(new Atomic<>(BigDecimal.ONE), new Atomic<>(new BigDecimal("2"))));
		assertEquals("0.5 == 1÷2", printer.display(record));
	}

	@Test
	void appendsToSink() throws IOException {
		Record<Integer> record = new Record<>(24, new Times<>(n(6), n(4)));
		StringBuilder out = new StringBuilder();
		printer.display(record, out);
		out.append('\n');
		printer.debug(record, out);
		assertEquals("24 == 6×4\nRecord { expression: 6×4, value: 24 }", out.toString());
	}
}
