package proof.ast;

/**
 * One method per {@link Expression} variant.
 */
public interface ExpressionVisitor<R> {
	<N> R visitAtomic(Atomic<N> atomic);

	<N> R visitNegative(Negative<N> negative);

	<N> R visitConcat(Concat<N> concat);

	<N> R visitPlus(Plus<N> plus);

	<N> R visitMinus(Minus<N> minus);

	<N> R visitTimes(Times<N> times);

	<N> R visitDivide(Divide<N> divide);
}
