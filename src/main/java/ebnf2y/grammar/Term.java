package ebnf2y.grammar;

import java.util.Objects;

import ebnf2y.reader.Location;

/**
 * A single element of an alternative.
 *
 * The set of term kinds is closed, every operation on terms switches over {@link Kind}.
 * Only the fields belonging to the kind are set, the others are null.
 */
public final class Term {

	public static enum Kind {
		/** reference to a production */
		REF,
		/** quoted token, optionally the start of a character range */
		TOKEN,
		/** ( ... ) */
		GROUP,
		/** [ ... ] */
		OPTION,
		/** { ... } */
		REPETITION
	}

	public final Kind kind;

	/**
	 * Name of the referenced production ({@link Kind#REF})
	 */
	public final String name;

	/**
	 * Token text ({@link Kind#TOKEN})
	 */
	public final String text;

	/**
	 * End of the character range, null for plain tokens
	 */
	public final String rangeEnd;

	/**
	 * Body of a group, option or repetition
	 */
	public final Expression expression;

	/**
	 * Source position, doesn't take part in equality
	 */
	public final Location location;

	private Term(Kind kind, String name, String text, String rangeEnd, Expression expression, Location location) {
		this.kind = kind;
		this.name = name;
		this.text = text;
		this.rangeEnd = rangeEnd;
		this.expression = expression;
		this.location = location == null ? Location.UNKNOWN : location;
	}

	public static Term ref(String name){
		return ref(name, null);
	}

	public static Term ref(String name, Location location){
		return new Term(Kind.REF, Objects.requireNonNull(name), null, null, null, location);
	}

	public static Term token(String text){
		return token(text, null);
	}

	public static Term token(String text, Location location){
		return new Term(Kind.TOKEN, null, Objects.requireNonNull(text), null, null, location);
	}

	public static Term range(String start, String end, Location location){
		return new Term(Kind.TOKEN, null, Objects.requireNonNull(start), Objects.requireNonNull(end), null, location);
	}

	public static Term group(Expression expression){
		return group(expression, null);
	}

	public static Term group(Expression expression, Location location){
		return new Term(Kind.GROUP, null, null, null, Objects.requireNonNull(expression), location);
	}

	public static Term option(Expression expression){
		return option(expression, null);
	}

	public static Term option(Expression expression, Location location){
		return new Term(Kind.OPTION, null, null, null, Objects.requireNonNull(expression), location);
	}

	public static Term repetition(Expression expression){
		return repetition(expression, null);
	}

	public static Term repetition(Expression expression, Location location){
		return new Term(Kind.REPETITION, null, null, null, Objects.requireNonNull(expression), location);
	}

	public boolean isRef(){
		return kind == Kind.REF;
	}

	public boolean isRange(){
		return kind == Kind.TOKEN && rangeEnd != null;
	}

	/**
	 * Is this term allowed in a BNF grammar?
	 */
	public boolean isBnf(){
		return kind == Kind.REF || (kind == Kind.TOKEN && rangeEnd == null);
	}

	/**
	 * Same term with a new body, only valid for groups, options and repetitions.
	 */
	public Term withExpression(Expression newExpression){
		switch (kind){
			case GROUP:
			case OPTION:
			case REPETITION:
				return new Term(kind, null, null, null, newExpression, location);
			default:
				throw new IllegalStateException(kind + " term has no expression");
		}
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Term)){
			return false;
		}
		Term other = (Term)obj;
		return kind == other.kind && Objects.equals(name, other.name) && Objects.equals(text, other.text)
				&& Objects.equals(rangeEnd, other.rangeEnd) && Objects.equals(expression, other.expression);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, name, text, rangeEnd, expression);
	}

	@Override
	public String toString() {
		return GrammarPrinter.printTerm(this);
	}
}
