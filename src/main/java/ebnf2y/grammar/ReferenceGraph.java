package ebnf2y.grammar;

import java.util.LinkedHashSet;
import java.util.Set;

import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.traverse.BreadthFirstIterator;

/**
 * Directed graph with an edge from each production to every production or token it references.
 */
public class ReferenceGraph {

	private final Graph<String, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);

	public ReferenceGraph(Grammar grammar) {
		this(grammar, false);
	}

	/**
	 * @param lexicalLeaves omit the edges leaving lexical productions, their bodies belong to the lexer
	 */
	public ReferenceGraph(Grammar grammar, boolean lexicalLeaves) {
		for (String token : grammar.getTokens()) {
			graph.addVertex(token);
		}
		for (Production production : grammar.getProductions()) {
			graph.addVertex(production.name);
		}
		for (Production production : grammar.getProductions()) {
			if (lexicalLeaves && production.isLexical()){
				continue;
			}
			Grammars.walkTerms(production.body, term -> {
				if (term.isRef()){
					graph.addVertex(term.name);
					graph.addEdge(production.name, term.name);
				}
			});
		}
	}

	/**
	 * Does the production reference itself directly?
	 */
	public boolean isSelfReferential(String name){
		return graph.containsEdge(name, name);
	}

	/**
	 * Names reachable from the passed one (including itself), in breadth first order
	 */
	public Set<String> reachableFrom(String start){
		Set<String> reached = new LinkedHashSet<>();
		if (!graph.containsVertex(start)){
			return reached;
		}
		BreadthFirstIterator<String, DefaultEdge> iterator = new BreadthFirstIterator<>(graph, start);
		while (iterator.hasNext()){
			reached.add(iterator.next());
		}
		return reached;
	}
}
