package ebnf2y.magic;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import ebnf2y.generator.SkeletonGenerator;
import ebnf2y.grammar.Grammar;
import ebnf2y.transform.Inliner;
import ebnf2y.util.Cache;

import static ebnf2y.Ebnf2y.LOG;

/**
 * Searches the inlining configurations of a BNF grammar for the one with the lowest weighted
 * conflict score <code>wr * reduce/reduce + ws * shift/reduce</code>.
 *
 * The candidates are the productions that the {@link Inliner} could inline, ordered by name.
 * A configuration is a bit set over the candidates, bit i set means that candidate i is inlined.
 * Up to {@link #exhaustiveLimit(int)} candidates all configurations are evaluated, beyond that
 * a hill climbing search starts from the configuration that inlines nothing and toggles single
 * candidates as long as this improves the result.
 *
 * Configurations are compared by score, then by the number of productions of the resulting
 * grammar and then by their index (the bit set read as a binary number).
 *
 * An instance is used for a single search at a time, the evaluations run on a fixed thread pool.
 */
public class ConflictMinimizer {

	public static final int DEFAULT_EXHAUSTIVE_LIMIT = 12;

	public static final int MAX_EXHAUSTIVE_LIMIT = 20;

	private static final int CACHE_SIZE = 1024;

	private final LalrTool tool;
	private final SkeletonGenerator generator;
	private int reduceReduceWeight = 1;
	private int shiftReduceWeight = 1;
	private int exhaustiveLimit = DEFAULT_EXHAUSTIVE_LIMIT;
	private int workers = Runtime.getRuntime().availableProcessors();
	private long timeoutMillis = 0;
	private PrintStream report;

	public ConflictMinimizer(LalrTool tool, SkeletonGenerator generator) {
		this.tool = tool;
		this.generator = generator;
	}

	public ConflictMinimizer weights(int reduceReduceWeight, int shiftReduceWeight){
		if (reduceReduceWeight < 0 || shiftReduceWeight < 0){
			throw new IllegalArgumentException("Conflict weights have to be non negative");
		}
		this.reduceReduceWeight = reduceReduceWeight;
		this.shiftReduceWeight = shiftReduceWeight;
		return this;
	}

	/**
	 * Maximum number of candidates for which all configurations are evaluated
	 */
	public ConflictMinimizer exhaustiveLimit(int exhaustiveLimit){
		if (exhaustiveLimit < 0 || exhaustiveLimit > MAX_EXHAUSTIVE_LIMIT){
			throw new IllegalArgumentException(String.format("Exhaustive limit has to be in [0, %d], got %d",
					MAX_EXHAUSTIVE_LIMIT, exhaustiveLimit));
		}
		this.exhaustiveLimit = exhaustiveLimit;
		return this;
	}

	public ConflictMinimizer workers(int workers){
		this.workers = Math.max(1, workers);
		return this;
	}

	/**
	 * Time budget for the whole search, 0 for no limit
	 */
	public ConflictMinimizer timeoutMillis(long timeoutMillis){
		this.timeoutMillis = timeoutMillis;
		return this;
	}

	/**
	 * Write a line for every evaluated configuration to the passed stream, null disables the report
	 */
	public ConflictMinimizer report(PrintStream report){
		this.report = report;
		return this;
	}

	/**
	 * An evaluated configuration
	 */
	private static class Evaluation implements Comparable<Evaluation> {
		final BitSet configuration;
		final Grammar grammar;
		final ConflictReport report;
		final long score;

		Evaluation(BitSet configuration, Grammar grammar, ConflictReport report, long score) {
			this.configuration = configuration;
			this.grammar = grammar;
			this.report = report;
			this.score = score;
		}

		/**
		 * Is this evaluation better than the other, ignoring the configuration index?
		 */
		boolean improves(Evaluation other){
			if (score != other.score){
				return score < other.score;
			}
			return grammar.size() < other.grammar.size();
		}

		@Override
		public int compareTo(Evaluation other) {
			if (improves(other)){
				return -1;
			}
			if (other.improves(this)){
				return 1;
			}
			return compareIndices(configuration, other.configuration);
		}
	}

	/**
	 * Compares two bit sets as binary numbers
	 */
	static int compareIndices(BitSet first, BitSet second){
		BitSet difference = (BitSet)first.clone();
		difference.xor(second);
		if (difference.isEmpty()){
			return 0;
		}
		return first.get(difference.length() - 1) ? 1 : -1;
	}

	/**
	 * State of one search
	 */
	private class Search {
		final Grammar grammar;
		final String start;
		final List<String> candidates;
		final Cache<String, ConflictReport> cache = new Cache<>(CACHE_SIZE);
		final AtomicInteger evaluated = new AtomicInteger();
		final long deadline;
		final ExecutorService executor;
		private Evaluation best;
		private boolean closed = false;
		volatile boolean timedOut = false;

		Search(Grammar grammar, String start, List<String> candidates, ExecutorService executor) {
			this.grammar = grammar;
			this.start = start;
			this.candidates = candidates;
			this.executor = executor;
			this.deadline = timeoutMillis > 0 ? System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis) : 0;
		}

		Evaluation evaluate(BitSet configuration) throws InterruptedException {
			Grammar inlined = Inliner.inlineChosen(grammar, names(configuration));
			String rendered = generator.generate(inlined, start);
			ConflictReport conflicts = cache.getIfPresent(rendered);
			if (conflicts == null){
				conflicts = tool.check(rendered);
				cache.put(rendered, conflicts);
			}
			Evaluation evaluation = new Evaluation(configuration, inlined, conflicts,
					conflicts.score(reduceReduceWeight, shiftReduceWeight));
			if (!offer(evaluation)){
				throw new InterruptedException("Evaluation of " + names(configuration) + " was cancelled");
			}
			return evaluation;
		}

		/**
		 * Records a finished evaluation, unless it was cancelled or the search is over.
		 * Cancellation happens under the same lock, so a discarded evaluation never shows up.
		 *
		 * @return was the evaluation recorded?
		 */
		synchronized boolean offer(Evaluation evaluation){
			if (closed || Thread.currentThread().isInterrupted()){
				return false;
			}
			int number = evaluated.incrementAndGet();
			if (evaluation.score != ConflictReport.INFINITE && (best == null || evaluation.compareTo(best) < 0)){
				best = evaluation;
			}
			if (report != null){
				report.println(String.format("%d: inline %s -> %s, score %s, %d productions", number,
						names(evaluation.configuration), evaluation.report, formatScore(evaluation.score),
						evaluation.grammar.size()));
			}
			return true;
		}

		synchronized void close(){
			closed = true;
		}

		synchronized Evaluation best(){
			return best;
		}

		List<String> names(BitSet configuration){
			List<String> names = new ArrayList<>();
			for (int i = configuration.nextSetBit(0); i >= 0; i = configuration.nextSetBit(i + 1)){
				names.add(candidates.get(i));
			}
			return names;
		}

		boolean isOver(){
			return timedOut || (deadline != 0 && deadline - System.nanoTime() <= 0);
		}

		/**
		 * Evaluate the configurations in parallel, evaluations that miss the deadline are cancelled
		 *
		 * @return evaluations in the order of the passed configurations, null for cancelled ones
		 */
		List<Evaluation> evaluateAll(List<BitSet> configurations) throws InterruptedException {
			List<Future<Evaluation>> futures = new ArrayList<>();
			for (BitSet configuration : configurations) {
				futures.add(executor.submit(() -> evaluate(configuration)));
			}
			List<Evaluation> results = new ArrayList<>();
			try {
				for (Future<Evaluation> future : futures) {
					results.add(await(future));
				}
			} finally {
				synchronized (this){
					for (Future<Evaluation> future : futures) {
						future.cancel(true);
					}
				}
			}
			return results;
		}

		private Evaluation await(Future<Evaluation> future) throws InterruptedException {
			try {
				if (deadline == 0){
					return future.get();
				}
				long remaining = deadline - System.nanoTime();
				if (timedOut || remaining <= 0){
					return future.isDone() ? future.get() : cancel(future);
				}
				return future.get(remaining, TimeUnit.NANOSECONDS);
			} catch (TimeoutException e) {
				return cancel(future);
			} catch (CancellationException e) {
				timedOut = true;
				return null;
			} catch (ExecutionException e) {
				Throwable cause = e.getCause();
				if (cause instanceof RuntimeException){
					throw (RuntimeException)cause;
				}
				if (cause instanceof InterruptedException){
					throw (InterruptedException)cause;
				}
				throw new ToolFailureError("Evaluation failed: " + cause.getMessage(), cause);
			}
		}

		private synchronized Evaluation cancel(Future<Evaluation> future){
			future.cancel(true);
			timedOut = true;
			return null;
		}
	}

	/**
	 * Search the best inlining configuration
	 *
	 * @param grammar BNF grammar
	 * @param start name of the start production
	 * @throws ToolFailureError if the tool can't be run or rejects every evaluated configuration
	 * @throws InterruptedException if the calling thread is interrupted while waiting for the tool
	 */
	public MinimizerResult minimize(Grammar grammar, String start) throws InterruptedException {
		List<String> candidates = Inliner.candidates(grammar, start);
		boolean exhaustive = candidates.size() <= exhaustiveLimit;
		LOG.fine(() -> String.format("%d inlining candidates %s, %s search", candidates.size(), candidates,
				exhaustive ? "exhaustive" : "hill climbing"));
		ExecutorService executor = Executors.newFixedThreadPool(workers);
		Search search = new Search(grammar, start, candidates, executor);
		try {
			if (exhaustive){
				searchExhaustive(search);
			} else {
				searchHillClimbing(search);
			}
		} finally {
			search.close();
			executor.shutdownNow();
			executor.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
		}
		Evaluation best = search.best();
		if (best == null){
			throw new ToolFailureError(String.format("%s rejected all %d evaluated configurations", tool,
					search.evaluated.get()));
		}
		MinimizerResult result = new MinimizerResult(Collections.unmodifiableList(search.names(best.configuration)),
				best.grammar, best.report, best.score, exhaustive && !search.timedOut, search.evaluated.get());
		LOG.info(result.toString());
		return result;
	}

	/**
	 * Enumerates all configurations in batches, so only a few evaluations are alive at once
	 */
	private void searchExhaustive(Search search) throws InterruptedException {
		long count = 1L << search.candidates.size();
		int batchSize = workers * 4;
		long index = 0;
		while (index < count && !search.isOver()){
			List<BitSet> batch = new ArrayList<>(batchSize);
			for (; index < count && batch.size() < batchSize; index++){
				batch.add(BitSet.valueOf(new long[]{index}));
			}
			search.evaluateAll(batch);
		}
		if (index < count){
			search.timedOut = true;
		}
	}

	private void searchHillClimbing(Search search) throws InterruptedException {
		Evaluation current = search.evaluateAll(Collections.singletonList(new BitSet())).get(0);
		while (current != null && !search.timedOut){
			List<BitSet> neighbours = new ArrayList<>();
			for (int i = 0; i < search.candidates.size(); i++){
				BitSet neighbour = (BitSet)current.configuration.clone();
				neighbour.flip(i);
				neighbours.add(neighbour);
			}
			Evaluation next = current;
			for (Evaluation evaluation : search.evaluateAll(neighbours)) {
				if (evaluation != null && evaluation.improves(next)){
					next = evaluation;
				}
			}
			if (next == current){
				break;
			}
			current = next;
		}
	}

	private static String formatScore(long score){
		return score == ConflictReport.INFINITE ? "infinite" : Long.toString(score);
	}
}
