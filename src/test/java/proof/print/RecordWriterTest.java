package proof.print;

import org.junit.jupiter.api.Test;
import proof.ast.Atomic;
import proof.ast.Minus;
import proof.ast.Record;
import proof.ast.Times;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class RecordWriterTest {
	private static final String NL = System.lineSeparator();

	private static final List<Record<Integer>> RECORDS = List.of(
			new Record<>(24, new Times<>(new Atomic<>(6), new Atomic<>(4))),
			new Record<>(2, new Minus<>(new Atomic<>(5), new Atomic<>(3))));

	@Test
	void writesOneDisplayLinePerRecord() throws IOException {
		StringBuilder out = new StringBuilder();
		int written = new RecordWriter(RecordWriter.Style.DISPLAY).write(RECORDS, out);
		assertEquals(2, written);
		assertEquals("24 == 6×4" + NL + "2 == 5-3" + NL, out.toString());
	}

	@Test
	void writesDebugLines() throws IOException {
		StringBuilder out = new StringBuilder();
		new RecordWriter(RecordWriter.Style.DEBUG).write(RECORDS, out);
		assertEquals("Record { expression: 6×4, value: 24 }" + NL
				+ "Record { expression: 5-3, value: 2 }" + NL, out.toString());
	}

	@Test
	void emptyInputWritesNothing() throws IOException {
		StringBuilder out = new StringBuilder();
		assertEquals(0, new RecordWriter(RecordWriter.Style.DISPLAY).write(List.of(), out));
		assertEquals("", out.toString());
	}

	@Test
	void sinkFailureStopsWriting() {
		IOException failure = new IOException("disk full");
		StringBuilder seen = new StringBuilder();
		Appendable failing = new Appendable() {
			@Override
			public Appendable append(CharSequence csq) throws IOException {
				if (seen.length() > 0) {
					throw failure;
				}
				seen.append(csq);
				return this;
			}

			@Override
			public Appendable append(CharSequence csq, int start, int end) throws IOException {
				return append(csq.subSequence(start, end));
			}

			@Override
			public Appendable append(char c) throws IOException {
				return append(String.valueOf(c));
			}
		};

		IOException thrown = assertThrows(IOException.class,
				() -> new RecordWriter(RecordWriter.Style.DISPLAY).write(RECORDS, failing));
		assertSame(failure, thrown);
		assertEquals("24 == 6×4", seen.toString());
	}

	@Test
	void rejectsMissingStyle() {
		assertThrows(NullPointerException.class, () -> new RecordWriter(null));
	}
}
