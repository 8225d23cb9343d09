package ebnf2y.grammar;

import ebnf2y.LocatedEbnf2yException;
import ebnf2y.reader.Location;

/**
 * A production reference without a matching production.
 */
public class UndeclaredReferenceError extends LocatedEbnf2yException {

	public final String name;

	public UndeclaredReferenceError(Location location, String name, String referencedFrom) {
		super(location, String.format("undeclared production %s (referenced from %s)", name, referencedFrom));
		this.name = name;
	}
}
