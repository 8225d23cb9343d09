package ebnf2y;

/**
 * Incompatible or invalid options, reported before any input is read.
 */
public class ConfigurationError extends Ebnf2yException {

	public ConfigurationError(String message) {
		super(message);
	}
}
