package proof.print;

import proof.ast.Atomic;
import proof.ast.Concat;
import proof.ast.Divide;
import proof.ast.Expression;
import proof.ast.ExpressionVisitor;
import proof.ast.Minus;
import proof.ast.Negative;
import proof.ast.Plus;
import proof.ast.Times;

import java.io.IOException;

/**
 * Dumps the tree shape for diagnostics, e.g. {@code Plus { lhs: 1, rhs: 2 }}.
 *
 * Precedence is ignored and every node is shown. Leaves print as their number.
 * The output is not meant to be parsed.
 */
public final class StructurePrinter implements ExpressionVisitor<String> {
	public String describe(Expression<?> expression) {
		return expression.accept(this);
	}

	public void describe(Expression<?> expression, Appendable out) throws IOException {
		out.append(describe(expression));
	}

	@Override
	public <N> String visitAtomic(Atomic<N> atomic) {
		return String.valueOf(atomic.number());
	}

	@Override
	public <N> String visitNegative(Negative<N> negative) {
		return "Negative { lhs: " + describe(negative.base()) + " }";
	}

	@Override
	public <N> String visitConcat(Concat<N> concat) {
		return node("Concat", concat.lhs(), concat.rhs());
	}

	@Override
	public <N> String visitPlus(Plus<N> plus) {
		return node("Plus", plus.lhs(), plus.rhs());
	}

	@Override
	public <N> String visitMinus(Minus<N> minus) {
		return node("Minus", minus.lhs(), minus.rhs());
	}

	@Override
	public <N> String visitTimes(Times<N> times) {
		return node("Times", times.lhs(), times.rhs());
	}

	@Override
	public <N> String visitDivide(Divide<N> divide) {
		return node("Divide", divide.lhs(), divide.rhs());
	}

	private String node(String name, Expression<?> lhs, Expression<?> rhs) {
		return name + " { lhs: " + describe(lhs) + ", rhs: " + describe(rhs) + " }";
	}
}
