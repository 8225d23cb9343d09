package ebnf2y.transform;

import ebnf2y.Ebnf2yException;

/**
 * No unused name for a synthetic production was found, signals an internal invariant violation.
 */
public class NameCollisionError extends Ebnf2yException {

	public NameCollisionError(String origin, int attempts) {
		super(String.format("no unused name for a production derived from %s after %d attempts", origin, attempts));
	}
}
