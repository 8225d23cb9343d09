package ebnf2y.magic;

/**
 * An LALR parser generator that reports the conflicts of a grammar.
 *
 * Implementations have to be usable from several threads at once.
 */
public interface LalrTool {

	/**
	 * Process the passed grammar
	 *
	 * @param grammar grammar in the input format of the tool
	 * @return conflict counts or the rejection of the grammar
	 * @throws ToolFailureError if the tool can't be run at all
	 * @throws InterruptedException if the calling thread is interrupted, the tool process is terminated
	 */
	ConflictReport check(String grammar) throws InterruptedException;
}
