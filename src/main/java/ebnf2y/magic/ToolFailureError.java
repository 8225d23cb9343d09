package ebnf2y.magic;

import ebnf2y.Ebnf2yException;

/**
 * The external LALR tool couldn't be run or didn't accept any grammar.
 */
public class ToolFailureError extends Ebnf2yException {

	public ToolFailureError(String message) {
		super(message);
	}

	public ToolFailureError(String message, Throwable cause) {
		super(message, cause);
	}
}
