package proof.ast;

/**
 * Arithmetic expression tree over leaf numbers of type {@code N}.
 *
 * Nodes own their children and are immutable once built. The leaf type only needs a
 * text form, taken from {@link String#valueOf(Object)}.
 */
public sealed interface Expression<N> permits Atomic, Negative, Concat, Plus, Minus, Times, Divide {
	<R> R accept(ExpressionVisitor<R> visitor);
}
