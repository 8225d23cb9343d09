package ebnf2y.transform;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import ebnf2y.grammar.Alternative;
import ebnf2y.grammar.Expression;
import ebnf2y.grammar.Grammar;
import ebnf2y.grammar.Grammars;
import ebnf2y.grammar.Production;
import ebnf2y.grammar.Term;

import static ebnf2y.Ebnf2y.LOG;

/**
 * Replaces references to productions by their alternatives and removes the inlined productions.
 *
 * An alternative <code>x P y</code> with <code>P = a | b</code> becomes the two alternatives
 * <code>x a y</code> and <code>x b y</code>, several inlined references in one alternative
 * multiply. Works on EBNF and BNF grammars, nested expressions are rewritten the same way.
 *
 * The start production, lexical productions and productions that reference themselves are never inlined.
 */
public class Inliner {

	private Inliner(){
	}

	/**
	 * Inline all productions that the level allows, until no further production is eligible
	 *
	 * @param grammar EBNF or BNF grammar
	 * @param level eligibility level
	 * @param start name of the start production, may not exist in the grammar
	 * @return rewritten grammar, the passed one for {@link InliningLevel#NONE}
	 */
	public static Grammar inline(Grammar grammar, InliningLevel level, String start){
		if (level == InliningLevel.NONE){
			return grammar;
		}
		Grammar current = grammar;
		boolean somethingChanged = true;
		while (somethingChanged){
			somethingChanged = false;
			Map<String, Integer> counts = current.referenceCounts();
			for (Production production : current.getProductions()) {
				int count = counts.get(production.name);
				if (!isEligible(current, production, start) || count == 0
						|| (level == InliningLevel.USED_ONCE && count != 1)){
					continue;
				}
				current = substitute(current, production);
				somethingChanged = true;
				break;
			}
		}
		return current;
	}

	/**
	 * Inline the passed productions, until none of them is left or the remaining ones reference themselves.
	 * Names that aren't productions of the grammar are ignored.
	 */
	public static Grammar inlineChosen(Grammar grammar, Collection<String> names){
		Grammar current = grammar;
		boolean somethingChanged = true;
		while (somethingChanged){
			somethingChanged = false;
			for (String name : names) {
				Production production = current.getProduction(name);
				if (production == null || current.referenceGraph().isSelfReferential(name)){
					continue;
				}
				current = substitute(current, production);
				somethingChanged = true;
			}
		}
		return current;
	}

	/**
	 * Could the production be inlined (regardless of the number of references)?
	 */
	public static boolean isEligible(Grammar grammar, Production production, String start){
		return !production.name.equals(start) && !production.isLexical()
				&& !grammar.referenceGraph().isSelfReferential(production.name);
	}

	/**
	 * Names of all eligible productions, sorted
	 */
	public static List<String> candidates(Grammar grammar, String start){
		List<String> names = new ArrayList<>();
		for (Production production : grammar.getProductions()) {
			if (isEligible(grammar, production, start)){
				names.add(production.name);
			}
		}
		Collections.sort(names);
		return names;
	}

	/**
	 * Replace every reference to the production and remove it if it isn't referenced anymore
	 */
	static Grammar substitute(Grammar grammar, Production inlined){
		if (Grammars.references(inlined.body, inlined.name)){
			throw new IllegalArgumentException(inlined.name + " references itself and can't be inlined");
		}
		List<Production> productions = new ArrayList<>(grammar.size());
		for (Production production : grammar.getProductions()) {
			if (production == inlined){
				productions.add(production);
			} else {
				productions.add(production.withBody(substitute(production.body, inlined)));
			}
		}
		Grammar result = grammar.withProductions(productions);
		if (result.referenceCount(inlined.name) == 0){
			result = result.without(inlined.name);
		}
		LOG.fine(() -> "inlined " + inlined.name);
		return result;
	}

	static Expression substitute(Expression expression, Production inlined){
		List<Alternative> alternatives = new ArrayList<>();
		for (Alternative alternative : expression.alternatives) {
			alternatives.addAll(substitute(alternative, inlined));
		}
		return new Expression(alternatives).withoutDuplicates();
	}

	/**
	 * Cross product expansion of a single alternative
	 */
	private static List<Alternative> substitute(Alternative alternative, Production inlined){
		List<List<Term>> partials = new ArrayList<>();
		partials.add(new ArrayList<>());
		for (Term term : alternative.terms) {
			switch (term.kind){
				case REF:
					if (term.name.equals(inlined.name)){
						List<List<Term>> expanded = new ArrayList<>();
						for (List<Term> partial : partials) {
							for (Alternative replacement : inlined.body.alternatives) {
								List<Term> terms = new ArrayList<>(partial);
								terms.addAll(replacement.terms);
								expanded.add(terms);
							}
						}
						partials = expanded;
					} else {
						append(partials, term);
					}
					break;
				case TOKEN:
					append(partials, term);
					break;
				case GROUP:
				case OPTION:
				case REPETITION:
					append(partials, term.withExpression(substitute(term.expression, inlined)));
					break;
			}
		}
		List<Alternative> result = new ArrayList<>(partials.size());
		for (List<Term> partial : partials) {
			result.add(new Alternative(partial));
		}
		return result;
	}

	private static void append(List<List<Term>> partials, Term term){
		for (List<Term> partial : partials) {
			partial.add(term);
		}
	}
}
