package proof.print;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import proof.ast.Record;

import java.io.IOException;
import java.util.Objects;

/**
 * Writes records to a sink, one per line.
 *
 * Failures of the sink are passed on to the caller untouched.
 */
public final class RecordWriter {
	private static final Logger LOG = LoggerFactory.getLogger(RecordWriter.class);

	public enum Style {
		/** {@code 24 == 6×4} */
		DISPLAY,
		/** {@code Record { expression: 6×4, value: 24 }} */
		DEBUG
	}

	private final RecordPrinter printer = new RecordPrinter();
	private final Style style;

	public RecordWriter(Style style) {
		this.style = Objects.requireNonNull(style, "style");
	}

	public Style style() {
		return style;
	}

	/**
	 * @return number of records written
	 */
	public int write(Iterable<? extends Record<?>> records, Appendable out) throws IOException {
		String nl = System.lineSeparator();
		int count = 0;
		for (Record<?> record : records) {
			switch (style) {
				case DISPLAY -> printer.display(record, out);
				case DEBUG -> printer.debug(record, out);
			}
			out.append(nl);
			count++;
		}
		LOG.debug("wrote {} record(s) as {}", count, style);
		return count;
	}
}
