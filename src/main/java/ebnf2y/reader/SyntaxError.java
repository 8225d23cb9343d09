package ebnf2y.reader;

import ebnf2y.LocatedEbnf2yException;

/**
 * An error thrown after encountering malformed EBNF
 */
public class SyntaxError extends LocatedEbnf2yException {

	public SyntaxError(Location location, String message) {
		super(location, message);
	}

	public static SyntaxError expected(Token found, String expected){
		return new SyntaxError(found.location, String.format("expected %s, found %s", expected, found.describe()));
	}
}
