package proof.print;

import proof.ast.Atomic;
import proof.ast.Divide;
import proof.ast.Expression;
import proof.ast.Minus;
import proof.ast.Plus;

/**
 * Binding-strength tests used when placing a child inside an operator.
 *
 * Both look at the node's own variant only, never at its children.
 */
public final class Precedence {
	private Precedence() {
	}

	/**
	 * True for a leaf number. No printing rule consults this yet.
	 */
	public static boolean isAtomicLeaf(Expression<?> node) {
		return node instanceof Atomic;
	}

	/**
	 * True for {@code +}, {@code -} and {@code ÷}.
	 *
	 * {@code ×} is left out so product chains print flat. {@code ÷} is included because
	 * a quotient nested under {@code ×} or {@code ÷} changes meaning without parentheses.
	 */
	public static boolean bindsLooserThanProduct(Expression<?> node) {
		return node instanceof Plus || node instanceof Minus || node instanceof Divide;
	}
}
