package proof;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import proof.ast.Atomic;
import proof.ast.Concat;
import proof.ast.Divide;
import proof.ast.Expression;
import proof.ast.Minus;
import proof.ast.Negative;
import proof.ast.Plus;
import proof.ast.Record;
import proof.ast.Times;
import proof.print.RecordWriter;
import proof.print.StructurePrinter;

import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

/**
 * Prints a few built-in records so the printers can be eyeballed.
 *
 * Usage: {@code DebugMain [display|debug|tree]}
 */
public class DebugMain {
	private static final Logger LOG = LoggerFactory.getLogger(DebugMain.class);

	static final String USAGE = "Usage: DebugMain [display|debug|tree]";

	public static void main(String[] args) throws IOException {
		int status = run(args, System.out, System.err);
		if (status != 0) {
			System.exit(status);
		}
	}

	static int run(String[] args, PrintStream out, PrintStream err) throws IOException {
		if (args.length > 1) {
			err.println(USAGE);
			return 1;
		}
		String mode = args.length == 0 ? "display" : args[0];
		LOG.info("printing {} sample record(s) in {} mode", samples().size(), mode);
		switch (mode) {
			case "display" -> new RecordWriter(RecordWriter.Style.DISPLAY).write(samples(), out);
			case "debug" -> new RecordWriter(RecordWriter.Style.DEBUG).write(samples(), out);
			case "tree" -> {
				StructurePrinter structures = new StructurePrinter();
				for (Record<Integer> record : samples()) {
					out.println(record.value() + " == " + structures.describe(record.expression()));
				}
			}
			default -> {
				err.println(USAGE);
				return 1;
			}
		}
		return 0;
	}

	static List<Record<Integer>> samples() {
		return List.of(
				new Record<>(24, new Times<>(num(6), num(4))),
				new Record<>(100, sumTo100()),
				new Record<>(16, new Plus<>(new Plus<>(new Plus<>(new Plus<>(new Plus<>(
						num(1), num(1)), num(4)), num(5)), num(1)), num(4))),
				new Record<>(7, new Negative<>(new Minus<>(num(1), num(8)))),
				new Record<>(1, new Divide<>(num(6), new Times<>(num(2), num(3)))),
				new Record<>(2, new Divide<>(
						new Times<>(new Plus<>(num(1), num(1)), num(4)),
						new Minus<>(num(5), num(1)))));
	}

	// 1+2+3-4+5+6+78+9
	private static Expression<Integer> sumTo100() {
		Expression<Integer> e = new Plus<>(num(1), num(2));
		e = new Plus<>(e, num(3));
		e = new Minus<>(e, num(4));
		e = new Plus<>(e, num(5));
		e = new Plus<>(e, num(6));
		e = new Plus<>(e, new Concat<>(num(7), num(8)));
		return new Plus<>(e, num(9));
	}

	private static Atomic<Integer> num(int n) {
		return new Atomic<>(n);
	}
}
