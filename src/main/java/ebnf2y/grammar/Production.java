package ebnf2y.grammar;

import java.util.Objects;

import ebnf2y.reader.Location;

/**
 * A named grammar rule.
 */
public final class Production {

	/**
	 * Id of the production, stays the same when the production is rewritten
	 */
	public final int id;

	public final String name;

	public final Expression body;

	/**
	 * Origin of synthetic productions, null for productions from the source
	 */
	public final Provenance provenance;

	public final Location location;

	public Production(int id, String name, Expression body, Provenance provenance, Location location) {
		this.id = id;
		this.name = Objects.requireNonNull(name);
		this.body = Objects.requireNonNull(body);
		this.provenance = provenance;
		this.location = location == null ? Location.UNKNOWN : location;
	}

	public Production(int id, String name, Expression body) {
		this(id, name, body, null, null);
	}

	public Production withBody(Expression newBody){
		return new Production(id, name, newBody, provenance, location);
	}

	public boolean isSynthetic(){
		return provenance != null;
	}

	/**
	 * Lower case names denote lexical tokens.
	 */
	public boolean isLexical(){
		return isLexical(name);
	}

	public static boolean isLexical(String name){
		return !name.isEmpty() && !Character.isUpperCase(name.codePointAt(0));
	}

	/**
	 * Does the body reference the production itself?
	 */
	public boolean isSelfReferential(){
		return Grammars.references(body, name);
	}

	/**
	 * Structural equality, ids, provenance and locations are ignored.
	 */
	@Override
	public boolean equals(Object obj) {
		return obj instanceof Production && ((Production)obj).name.equals(name) && ((Production)obj).body.equals(body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, body);
	}

	@Override
	public String toString() {
		return GrammarPrinter.printProduction(this);
	}
}
