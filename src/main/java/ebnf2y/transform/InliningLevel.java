package ebnf2y.transform;

import ebnf2y.ConfigurationError;

/**
 * Which productions the {@link Inliner} may inline.
 */
public enum InliningLevel {
	/** inline nothing */
	NONE,
	/** inline productions that are referenced exactly once */
	USED_ONCE,
	/** inline every eligible production, can't be combined with the conflict minimizer */
	ALL;

	/**
	 * Level for the numbers used on the command line (0, 1, 2)
	 */
	public static InliningLevel fromNumber(int number){
		InliningLevel[] levels = values();
		if (number < 0 || number >= levels.length){
			throw new ConfigurationError(String.format("invalid inlining level %d, expected 0, 1 or 2", number));
		}
		return levels[number];
	}
}
