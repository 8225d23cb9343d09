package ebnf2y.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Sequence of terms, the empty sequence is the empty (epsilon) alternative.
 */
public final class Alternative {

	public static final Alternative EMPTY = new Alternative(Collections.emptyList());

	public final List<Term> terms;

	public Alternative(List<Term> terms) {
		this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
	}

	public static Alternative of(Term... terms){
		return new Alternative(Arrays.asList(terms));
	}

	public boolean isEmpty(){
		return terms.isEmpty();
	}

	public int size(){
		return terms.size();
	}

	public Term get(int index){
		return terms.get(index);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Alternative && ((Alternative)obj).terms.equals(terms);
	}

	@Override
	public int hashCode() {
		return terms.hashCode();
	}

	@Override
	public String toString() {
		return GrammarPrinter.printAlternative(this);
	}
}
