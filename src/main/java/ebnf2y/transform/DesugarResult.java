package ebnf2y.transform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import ebnf2y.grammar.Grammar;
import ebnf2y.grammar.Provenance;

/**
 * BNF grammar produced by the {@link Desugarer} together with the origin of each synthetic production.
 */
public class DesugarResult {

	public final Grammar grammar;

	/**
	 * Synthetic production name to provenance, in creation order
	 */
	public final Map<String, Provenance> provenance;

	public DesugarResult(Grammar grammar, Map<String, Provenance> provenance) {
		this.grammar = grammar;
		this.provenance = Collections.unmodifiableMap(new LinkedHashMap<>(provenance));
	}
}
