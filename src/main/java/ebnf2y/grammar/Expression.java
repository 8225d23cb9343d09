package ebnf2y.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Ordered, non empty list of alternatives.
 *
 * The order has no meaning for the language, but it's kept as it determines the
 * numbering of generated actions and the way an LALR tool resolves conflicts.
 */
public final class Expression {

	/**
	 * Expression that only derives the empty word
	 */
	public static final Expression EMPTY = new Expression(Collections.singletonList(Alternative.EMPTY));

	public final List<Alternative> alternatives;

	public Expression(List<Alternative> alternatives) {
		if (alternatives.isEmpty()){
			throw new IllegalArgumentException("An expression needs at least one alternative");
		}
		this.alternatives = Collections.unmodifiableList(new ArrayList<>(alternatives));
	}

	public static Expression of(Alternative... alternatives){
		return new Expression(Arrays.asList(alternatives));
	}

	/**
	 * Expression with a single alternative consisting of the passed terms
	 */
	public static Expression sequence(Term... terms){
		return of(Alternative.of(terms));
	}

	public int size(){
		return alternatives.size();
	}

	public Alternative get(int index){
		return alternatives.get(index);
	}

	public boolean hasChoice(){
		return alternatives.size() > 1;
	}

	/**
	 * Removes duplicate alternatives, the first occurrence wins.
	 */
	public Expression withoutDuplicates(){
		LinkedHashSet<Alternative> set = new LinkedHashSet<>(alternatives);
		if (set.size() == alternatives.size()){
			return this;
		}
		return new Expression(new ArrayList<>(set));
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Expression && ((Expression)obj).alternatives.equals(alternatives);
	}

	@Override
	public int hashCode() {
		return alternatives.hashCode();
	}

	@Override
	public String toString() {
		return GrammarPrinter.printExpression(this);
	}
}
