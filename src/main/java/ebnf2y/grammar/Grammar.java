package ebnf2y.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Grammar consisting of productions and (for BNF grammars) token declarations.
 *
 * Grammars are immutable, every transformation creates a new grammar. Productions keep
 * their id across transformations, new productions get ids above all existing ones.
 *
 * In a grammar read from EBNF source lexical productions are ordinary productions. After
 * desugaring they are replaced by token declarations: references to them stay references,
 * but they resolve to a token instead of a production.
 */
public class Grammar {

	private final List<Production> productions;

	private final List<String> tokens;

	private final Map<String, Production> productionsByName;

	private ReferenceGraph referenceGraph;

	public Grammar(List<Production> productions) {
		this(productions, Collections.emptyList());
	}

	/**
	 * Create a new Grammar object
	 *
	 * @param productions productions, names have to be unique
	 * @param tokens declared lexical tokens
	 */
	public Grammar(List<Production> productions, List<String> tokens) {
		this.productions = Collections.unmodifiableList(new ArrayList<>(productions));
		this.tokens = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(tokens)));
		Map<String, Production> byName = new LinkedHashMap<>();
		for (Production production : productions) {
			if (byName.put(production.name, production) != null){
				throw new IllegalArgumentException(String.format("Production %s declared twice", production.name));
			}
		}
		this.productionsByName = byName;
	}

	public List<Production> getProductions(){
		return productions;
	}

	public List<String> getTokens(){
		return tokens;
	}

	public int size(){
		return productions.size();
	}

	/**
	 * @return production with the passed name or null
	 */
	public Production getProduction(String name){
		return productionsByName.get(name);
	}

	public boolean hasProduction(String name){
		return productionsByName.containsKey(name);
	}

	public boolean isToken(String name){
		return tokens.contains(name);
	}

	/**
	 * Does a reference to the passed name resolve?
	 */
	public boolean isDeclared(String name){
		return hasProduction(name) || isToken(name);
	}

	/**
	 * Returns the start production
	 *
	 * @throws StartProductionNotFoundError if there is no production with this name
	 */
	public Production getStart(String name){
		Production start = getProduction(name);
		if (start == null){
			throw new StartProductionNotFoundError(name);
		}
		return start;
	}

	/**
	 * Id for a production that is added to this grammar
	 */
	public int nextId(){
		int max = -1;
		for (Production production : productions) {
			max = Math.max(max, production.id);
		}
		return max + 1;
	}

	/**
	 * Number of references to each production of this grammar (zero for unused productions).
	 * References to tokens are not counted.
	 */
	public Map<String, Integer> referenceCounts(){
		Map<String, Integer> all = new LinkedHashMap<>();
		for (Production production : productions) {
			Grammars.countReferences(production.body, all);
		}
		Map<String, Integer> counts = new LinkedHashMap<>();
		for (Production production : productions) {
			counts.put(production.name, all.getOrDefault(production.name, 0));
		}
		return counts;
	}

	public int referenceCount(String name){
		return referenceCounts().getOrDefault(name, 0);
	}

	/**
	 * Are all terms of all productions BNF terms?
	 */
	public boolean isBnf(){
		for (Production production : productions) {
			if (!Grammars.isBnf(production.body)){
				return false;
			}
		}
		return true;
	}

	/**
	 * Checks that every reference resolves.
	 *
	 * @throws UndeclaredReferenceError for the first reference that doesn't
	 */
	public void verify(){
		for (Production production : productions) {
			Grammars.walkTerms(production.body, term -> {
				if (term.isRef() && !isDeclared(term.name)){
					throw new UndeclaredReferenceError(term.location, term.name, production.name);
				}
			});
		}
	}

	public synchronized ReferenceGraph referenceGraph(){
		if (referenceGraph == null){
			referenceGraph = new ReferenceGraph(this);
		}
		return referenceGraph;
	}

	/**
	 * New grammar with the passed productions and the token declarations of this grammar
	 */
	public Grammar withProductions(List<Production> newProductions){
		return new Grammar(newProductions, tokens);
	}

	public Grammar without(String name){
		List<Production> newProductions = new ArrayList<>(productions);
		newProductions.removeIf(p -> p.name.equals(name));
		return withProductions(newProductions);
	}

	/**
	 * Structural equality: same productions (names and bodies) in the same order and the same tokens
	 */
	@Override
	public boolean equals(Object obj) {
		return obj instanceof Grammar && ((Grammar)obj).productions.equals(productions)
				&& ((Grammar)obj).tokens.equals(tokens);
	}

	@Override
	public int hashCode() {
		return Objects.hash(productions, tokens);
	}

	@Override
	public String toString() {
		return GrammarPrinter.print(this);
	}
}
