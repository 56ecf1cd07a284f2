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

import static proof.print.Precedence.bindsLooserThanProduct;

/**
 * Prints an expression with as few parentheses as its meaning allows.
 *
 * Read back with the usual precedence (unary minus, then {@code ×} and {@code ÷}, then
 * {@code +} and {@code -}, all left to right, juxtaposition tightest) the text gives a
 * tree of the same value. Nested products may come back regrouped.
 */
public final class ExpressionPrinter implements ExpressionVisitor<String> {
	public static final char TIMES = '×';
	public static final char DIVIDE = '÷';

	public String render(Expression<?> expression) {
		return expression.accept(this);
	}

	public void render(Expression<?> expression, Appendable out) throws IOException {
		out.append(render(expression));
	}

	@Override
	public <N> String visitAtomic(Atomic<N> atomic) {
		return String.valueOf(atomic.number());
	}

	@Override
	public <N> String visitNegative(Negative<N> negative) {
		return "-" + wrapIf(bindsLooserThanProduct(negative.base()), negative.base());
	}

	@Override
	public <N> String visitConcat(Concat<N> concat) {
		return render(concat.lhs()) + render(concat.rhs());
	}

	@Override
	public <N> String visitPlus(Plus<N> plus) {
		return render(plus.lhs()) + "+" + render(plus.rhs());
	}

	@Override
	public <N> String visitMinus(Minus<N> minus) {
		return render(minus.lhs()) + "-" + wrapIf(bindsLooserThanProduct(minus.rhs()), minus.rhs());
	}

	@Override
	public <N> String visitTimes(Times<N> times) {
		return wrapIf(bindsLooserThanProduct(times.lhs()), times.lhs())
				+ TIMES
				+ wrapIf(bindsLooserThanProduct(times.rhs()), times.rhs());
	}

	@Override
	public <N> String visitDivide(Divide<N> divide) {
		// any compound divisor is wrapped, products included: 6÷(2×3)
		return wrapIf(bindsLooserThanProduct(divide.lhs()), divide.lhs())
				+ DIVIDE
				+ wrapIf(!(divide.rhs() instanceof Atomic), divide.rhs());
	}

	private String wrapIf(boolean wrap, Expression<?> child) {
		String text = render(child);
		return wrap ? "(" + text + ")" : text;
	}
}
