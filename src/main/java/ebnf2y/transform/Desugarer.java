package ebnf2y.transform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import ebnf2y.ConfigurationError;
import ebnf2y.grammar.Alternative;
import ebnf2y.grammar.Expression;
import ebnf2y.grammar.Grammar;
import ebnf2y.grammar.Production;
import ebnf2y.grammar.Provenance;
import ebnf2y.grammar.ReferenceGraph;
import ebnf2y.grammar.Term;
import ebnf2y.reader.SyntaxError;

import static ebnf2y.Ebnf2y.LOG;

/**
 * Lowers an EBNF grammar into BNF.
 *
 * Terms are lowered innermost first:
 * <ul>
 *     <li>a group with a single alternative is spliced into the enclosing alternative,
 *     a group with a choice becomes a new production <code>P = E</code></li>
 *     <li>an option becomes <code>P = ε | E</code></li>
 *     <li>a repetition becomes the left recursive <code>P = ε | P E</code></li>
 *     <li>the body of an option or repetition with a choice is lowered like a group first,
 *     so both always have two alternatives</li>
 *     <li>a character range becomes <code>P = "a" | "b" | … | "z"</code></li>
 * </ul>
 * A production created while lowering <code>Foo</code> is called <code>Foo1</code>, <code>Foo2</code>, …
 * skipping names that are already taken.
 *
 * Lexical productions that are reachable from the start production become token declarations,
 * unreachable non lexical productions are dropped.
 */
public class Desugarer {

	/**
	 * Maximum number of names tried for a single synthetic production
	 */
	public static final int MAX_NAME_RETRIES = 1000;

	/**
	 * Maximum number of characters in a lowered character range
	 */
	public static final int MAX_RANGE_SIZE = 256;

	private final Set<String> usedNames = new HashSet<>();
	private final Map<String, Integer> lastOrdinal = new HashMap<>();
	private final Map<String, Provenance> provenance = new LinkedHashMap<>();
	private int nextId;

	/**
	 * Productions created for the production that is currently lowered
	 */
	private List<Production> created;

	private Desugarer(Grammar grammar) {
		for (Production production : grammar.getProductions()) {
			usedNames.add(production.name);
		}
		nextId = grammar.nextId();
	}

	/**
	 * Lower the passed EBNF grammar
	 *
	 * @param grammar verified EBNF grammar
	 * @param start name of the start production
	 * @throws ebnf2y.grammar.StartProductionNotFoundError if there is no start production
	 * @throws NameCollisionError if no name for a synthetic production could be found
	 */
	public static DesugarResult desugar(Grammar grammar, String start){
		Production startProduction = grammar.getStart(start);
		if (startProduction.isLexical()){
			throw new ConfigurationError(String.format("start production %s is a lexical production", start));
		}
		return new Desugarer(grammar).lower(grammar, start);
	}

	private DesugarResult lower(Grammar grammar, String start){
		Set<String> reachable = new ReferenceGraph(grammar, true).reachableFrom(start);
		List<Production> productions = new ArrayList<>();
		List<String> tokens = new ArrayList<>();
		for (Production production : grammar.getProductions()) {
			if (!reachable.contains(production.name)){
				if (!production.isLexical()){
					LOG.warning(String.format("%s: production %s is unreachable from %s and dropped",
							production.location, production.name, start));
				}
				continue;
			}
			if (production.isLexical()){
				tokens.add(production.name);
				continue;
			}
			created = new ArrayList<>();
			Expression body = lowerExpression(production.body, production.name);
			productions.add(production.withBody(body));
			productions.addAll(created);
		}
		Grammar result = new Grammar(productions, tokens);
		if (!result.isBnf()){
			throw new IllegalStateException("Lowered grammar contains EBNF terms:\n" + result);
		}
		result.verify();
		return new DesugarResult(result, provenance);
	}

	private Expression lowerExpression(Expression expression, String origin){
		List<Alternative> alternatives = new ArrayList<>(expression.size());
		for (Alternative alternative : expression.alternatives) {
			alternatives.add(lowerAlternative(alternative, origin));
		}
		return new Expression(alternatives);
	}

	private Alternative lowerAlternative(Alternative alternative, String origin){
		List<Term> terms = new ArrayList<>();
		for (int i = 0; i < alternative.size(); i++){
			Term term = alternative.get(i);
			switch (term.kind){
				case REF:
					terms.add(term);
					break;
				case TOKEN:
					if (term.isRange()){
						terms.add(createRange(term, origin, i));
					} else {
						terms.add(term);
					}
					break;
				case GROUP:
					terms.addAll(flatten(lowerExpression(term.expression, origin), term, origin, i));
					break;
				case OPTION: {
					List<Term> body = flatten(lowerExpression(term.expression, origin), term, origin, i);
					String name = newName(origin, i);
					created.add(createProduction(name, Expression.of(Alternative.EMPTY, new Alternative(body))));
					terms.add(Term.ref(name, term.location));
					break;
				}
				case REPETITION: {
					List<Term> body = flatten(lowerExpression(term.expression, origin), term, origin, i);
					String name = newName(origin, i);
					List<Term> recursive = new ArrayList<>();
					recursive.add(Term.ref(name, term.location));
					recursive.addAll(body);
					created.add(createProduction(name, Expression.of(Alternative.EMPTY, new Alternative(recursive))));
					terms.add(Term.ref(name, term.location));
					break;
				}
			}
		}
		return new Alternative(terms);
	}

	/**
	 * Terms of a lowered bracket body: the terms of a single alternative, otherwise a reference to
	 * a new production holding the alternatives
	 */
	private List<Term> flatten(Expression inner, Term term, String origin, int termIndex){
		if (!inner.hasChoice()){
			return inner.get(0).terms;
		}
		String name = newName(origin, termIndex);
		created.add(createProduction(name, inner));
		return Collections.singletonList(Term.ref(name, term.location));
	}

	private Term createRange(Term range, String origin, int termIndex){
		int first = range.text.codePointAt(0);
		int last = range.rangeEnd.codePointAt(0);
		if (last - first + 1 > MAX_RANGE_SIZE){
			throw new SyntaxError(range.location, String.format("character range %s has more than %d characters",
					range, MAX_RANGE_SIZE));
		}
		List<Alternative> alternatives = new ArrayList<>();
		for (int c = first; c <= last; c++){
			alternatives.add(Alternative.of(Term.token(new String(Character.toChars(c)), range.location)));
		}
		String name = newName(origin, termIndex);
		created.add(createProduction(name, new Expression(alternatives)));
		return Term.ref(name, range.location);
	}

	private Production createProduction(String name, Expression body){
		Production production = new Production(nextId++, name, body, provenance.get(name), null);
		LOG.fine(() -> "lowered " + production);
		return production;
	}

	/**
	 * Reserves the next free name for a production derived from the passed one
	 */
	private String newName(String origin, int termIndex){
		int ordinal = lastOrdinal.getOrDefault(origin, 0);
		for (int attempt = 0; attempt < MAX_NAME_RETRIES; attempt++){
			ordinal++;
			String name = origin + ordinal;
			if (usedNames.add(name)){
				lastOrdinal.put(origin, ordinal);
				provenance.put(name, new Provenance(origin, ordinal, termIndex));
				return name;
			}
		}
		throw new NameCollisionError(origin, MAX_NAME_RETRIES);
	}
}
