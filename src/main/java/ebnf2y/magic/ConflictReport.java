package ebnf2y.magic;

/**
 * Outcome of running the LALR tool on one grammar: the conflict counts or a rejection.
 */
public class ConflictReport {

	/**
	 * Score of a rejected grammar
	 */
	public static final long INFINITE = Long.MAX_VALUE;

	public final int reduceReduce;
	public final int shiftReduce;
	public final boolean rejected;

	/**
	 * Output of the tool
	 */
	public final String diagnostic;

	private ConflictReport(int reduceReduce, int shiftReduce, boolean rejected, String diagnostic) {
		this.reduceReduce = reduceReduce;
		this.shiftReduce = shiftReduce;
		this.rejected = rejected;
		this.diagnostic = diagnostic == null ? "" : diagnostic;
	}

	public static ConflictReport conflicts(int reduceReduce, int shiftReduce){
		return conflicts(reduceReduce, shiftReduce, "");
	}

	public static ConflictReport conflicts(int reduceReduce, int shiftReduce, String diagnostic){
		return new ConflictReport(reduceReduce, shiftReduce, false, diagnostic);
	}

	public static ConflictReport rejected(String diagnostic){
		return new ConflictReport(0, 0, true, diagnostic);
	}

	/**
	 * Weighted conflict score wr * rr + ws * sr, {@link #INFINITE} for rejected grammars
	 */
	public long score(int reduceReduceWeight, int shiftReduceWeight){
		if (rejected){
			return INFINITE;
		}
		return (long)reduceReduceWeight * reduceReduce + (long)shiftReduceWeight * shiftReduce;
	}

	@Override
	public String toString() {
		if (rejected){
			return "rejected";
		}
		return String.format("%d reduce/reduce, %d shift/reduce", reduceReduce, shiftReduce);
	}
}
