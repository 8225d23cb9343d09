package ebnf2y;

/**
 * Base class of all errors that abort a conversion run.
 */
public class Ebnf2yException extends RuntimeException {

	public Ebnf2yException(String message) {
		super(message);
	}

	public Ebnf2yException(String message, Throwable cause) {
		super(message, cause);
	}
}
