package ebnf2y;

import ebnf2y.reader.Location;

/**
 * An error that can be attributed to a position in the EBNF source.
 */
public class LocatedEbnf2yException extends Ebnf2yException {

	public final Location errorLocation;

	public LocatedEbnf2yException(Location errorLocation, String message) {
		super(String.format("%s: %s", errorLocation == null ? Location.UNKNOWN : errorLocation, message));
		this.errorLocation = errorLocation == null ? Location.UNKNOWN : errorLocation;
	}
}
