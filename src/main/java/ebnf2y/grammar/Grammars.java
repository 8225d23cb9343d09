package ebnf2y.grammar;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Utility methods that walk expressions.
 */
public class Grammars {

	private Grammars(){
	}

	/**
	 * Calls the consumer for every term in the expression, nested terms included (pre order).
	 */
	public static void walkTerms(Expression expression, Consumer<Term> consumer){
		for (Alternative alternative : expression.alternatives) {
			for (Term term : alternative.terms) {
				consumer.accept(term);
				switch (term.kind){
					case GROUP:
					case OPTION:
					case REPETITION:
						walkTerms(term.expression, consumer);
						break;
					case REF:
					case TOKEN:
						break;
				}
			}
		}
	}

	/**
	 * Does the expression reference the production with the passed name at any depth?
	 */
	public static boolean references(Expression expression, String production){
		for (Alternative alternative : expression.alternatives) {
			for (Term term : alternative.terms) {
				switch (term.kind){
					case REF:
						if (term.name.equals(production)){
							return true;
						}
						break;
					case GROUP:
					case OPTION:
					case REPETITION:
						if (references(term.expression, production)){
							return true;
						}
						break;
					case TOKEN:
						break;
				}
			}
		}
		return false;
	}

	/**
	 * Adds the number of references to each production to the passed map.
	 */
	public static void countReferences(Expression expression, Map<String, Integer> counts){
		walkTerms(expression, term -> {
			if (term.isRef()){
				counts.merge(term.name, 1, Integer::sum);
			}
		});
	}

	/**
	 * Does the expression only consist of BNF terms?
	 */
	public static boolean isBnf(Expression expression){
		for (Alternative alternative : expression.alternatives) {
			for (Term term : alternative.terms) {
				if (!term.isBnf()){
					return false;
				}
			}
		}
		return true;
	}
}
