package ebnf2y.magic;

import java.util.List;

import ebnf2y.grammar.Grammar;

/**
 * Best inlining configuration found by the {@link ConflictMinimizer}
 */
public class MinimizerResult {

	/**
	 * Names of the inlined candidates, in candidate order
	 */
	public final List<String> configuration;

	/**
	 * Grammar with the configuration applied
	 */
	public final Grammar grammar;

	public final ConflictReport report;

	public final long score;

	/**
	 * Were all configurations evaluated?
	 */
	public final boolean exhaustive;

	/**
	 * Number of evaluated configurations
	 */
	public final int evaluated;

	public MinimizerResult(List<String> configuration, Grammar grammar, ConflictReport report, long score,
	                       boolean exhaustive, int evaluated) {
		this.configuration = configuration;
		this.grammar = grammar;
		this.report = report;
		this.score = score;
		this.exhaustive = exhaustive;
		this.evaluated = evaluated;
	}

	@Override
	public String toString() {
		return String.format("inline %s: %s, score %d (%d configurations evaluated%s)", configuration, report,
				score, evaluated, exhaustive ? "" : ", not exhaustive");
	}
}
