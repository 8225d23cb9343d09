package ebnf2y;

import java.util.logging.Logger;

import ebnf2y.generator.SkeletonGenerator;
import ebnf2y.grammar.Grammar;
import ebnf2y.grammar.GrammarPrinter;
import ebnf2y.magic.ConflictMinimizer;
import ebnf2y.magic.LalrTool;
import ebnf2y.magic.MinimizerResult;
import ebnf2y.magic.YaccTool;
import ebnf2y.reader.EbnfReader;
import ebnf2y.transform.Desugarer;
import ebnf2y.transform.Inliner;

/**
 * Converts an EBNF grammar into a bison skeleton:
 * read, inline EBNF productions, desugar, inline BNF productions, optionally minimize the conflicts
 * and render the result.
 */
public class Ebnf2y {

	public static final Logger LOG = Logger.getLogger("ebnf2y");

	/**
	 * Outputs of a conversion
	 */
	public static class Result {

		/** Rendered bison grammar */
		public final String skeleton;

		/** Pretty printed EBNF grammar after the EBNF level inlining, null if not requested */
		public final String ebnf;

		/** Final BNF grammar */
		public final Grammar grammar;

		/** Result of the conflict minimization, null without magic */
		public final MinimizerResult minimizerResult;

		Result(String skeleton, String ebnf, Grammar grammar, MinimizerResult minimizerResult) {
			this.skeleton = skeleton;
			this.ebnf = ebnf;
			this.grammar = grammar;
			this.minimizerResult = minimizerResult;
		}
	}

	private final Options options;
	private final Config config;
	private final LalrTool tool;

	/**
	 * @throws ConfigurationError if the options can't be combined
	 */
	public Ebnf2y(Options options, Config config) {
		this(options, config, null);
	}

	/**
	 * @param tool LALR tool used for the conflict minimization, null to use the configured yacc command
	 * @throws ConfigurationError if the options can't be combined
	 */
	public Ebnf2y(Options options, Config config, LalrTool tool) {
		options.validate();
		this.options = options;
		this.config = config;
		this.tool = tool != null ? tool : new YaccTool(config.getYacc(), config.getTmpDir(), config.getToolTimeout());
	}

	/**
	 * Convert the passed grammar
	 *
	 * @param source name of the input used in error messages
	 * @param input EBNF text
	 * @throws Ebnf2yException if the grammar is malformed or the LALR tool fails
	 * @throws InterruptedException if interrupted while waiting for the LALR tool
	 */
	public Result run(String source, String input) throws InterruptedException {
		String start = options.getStart();
		Grammar ebnf = EbnfReader.read(source, input);
		LOG.fine(() -> String.format("read %d productions from %s", ebnf.size(), source.isEmpty() ? "stdin" : source));
		ebnf.getStart(start);
		Grammar inlinedEbnf = Inliner.inline(ebnf, options.getEbnfInlining(), start);
		String ebnfEcho = options.getEbnfOutput().isEmpty() ? null : GrammarPrinter.print(inlinedEbnf);
		Grammar bnf = Desugarer.desugar(inlinedEbnf, start).grammar;
		bnf = Inliner.inline(bnf, options.getBnfInlining(), start);
		SkeletonGenerator generator = new SkeletonGenerator(options.getPrefix());
		MinimizerResult minimizerResult = null;
		if (options.isMagic()){
			minimizerResult = new ConflictMinimizer(tool, generator)
					.weights(options.getReduceReduceWeight(), options.getShiftReduceWeight())
					.exhaustiveLimit(config.getExhaustiveLimit())
					.workers(config.getWorkers())
					.timeoutMillis(config.getSearchTimeout() * 1000L)
					.report(options.isMagicVerbose() ? System.err : null)
					.minimize(bnf, start);
			bnf = minimizerResult.grammar;
		}
		return new Result(generator.generate(bnf, start), ebnfEcho, bnf, minimizerResult);
	}
}
