package ebnf2y;

import ebnf2y.transform.InliningLevel;

/**
 * Options of a conversion, mirroring the command line flags
 */
public class Options {

	public static final String DEFAULT_START = "SourceFile";

	public static final String USAGE = String.join("\n",
			"Usage: ebnf2y [options] [file]",
			"",
			"Options:",
			"  -ie number   Inline eligible EBNF productions: 0 none (default), 1 used once, 2 all (not with -m)",
			"  -iy number   Inline eligible BNF productions: 0 none (default), 1 used once, 2 all (not with -m)",
			"  -m           Magic: minimize wr*RR + ws*SR (reduce/reduce and shift/reduce conflicts)",
			"  -M           Like -m and write a report to stderr",
			"  -o name      Output file name, stdout if blank (default)",
			"  -oe name     Write the pretty printed EBNF to name",
			"  -p string    Prefix for token names, default blank",
			"  -start name  Start production, default " + DEFAULT_START,
			"  -wr n        Weight of reduce/reduce conflicts for -m (default 1)",
			"  -ws n        Weight of shift/reduce conflicts for -m (default 1)",
			"",
			"Reads the named EBNF file or stdin if no file is given.");

	/**
	 * Malformed command line
	 */
	public static class UsageError extends Ebnf2yException {
		public UsageError(String message) {
			super(message);
		}
	}

	private InliningLevel ebnfInlining = InliningLevel.NONE;
	private InliningLevel bnfInlining = InliningLevel.NONE;
	private boolean magic = false;
	private boolean magicVerbose = false;
	private String prefix = "";
	private String start = DEFAULT_START;
	private int reduceReduceWeight = 1;
	private int shiftReduceWeight = 1;
	private String input = "";
	private String output = "";
	private String ebnfOutput = "";

	public Options ebnfInlining(InliningLevel level){
		this.ebnfInlining = level;
		return this;
	}

	public Options bnfInlining(InliningLevel level){
		this.bnfInlining = level;
		return this;
	}

	public Options magic(boolean magic){
		this.magic = magic;
		return this;
	}

	/**
	 * Verbose magic, implies magic
	 */
	public Options magicVerbose(boolean magicVerbose){
		this.magicVerbose = magicVerbose;
		if (magicVerbose){
			magic = true;
		}
		return this;
	}

	public Options prefix(String prefix){
		this.prefix = prefix;
		return this;
	}

	public Options start(String start){
		this.start = start;
		return this;
	}

	public Options weights(int reduceReduceWeight, int shiftReduceWeight){
		this.reduceReduceWeight = reduceReduceWeight;
		this.shiftReduceWeight = shiftReduceWeight;
		return this;
	}

	public Options input(String input){
		this.input = input;
		return this;
	}

	public Options output(String output){
		this.output = output;
		return this;
	}

	public Options ebnfOutput(String ebnfOutput){
		this.ebnfOutput = ebnfOutput;
		return this;
	}

	public InliningLevel getEbnfInlining() {
		return ebnfInlining;
	}

	public InliningLevel getBnfInlining() {
		return bnfInlining;
	}

	public boolean isMagic() {
		return magic;
	}

	public boolean isMagicVerbose() {
		return magicVerbose;
	}

	public String getPrefix() {
		return prefix;
	}

	public String getStart() {
		return start;
	}

	public int getReduceReduceWeight() {
		return reduceReduceWeight;
	}

	public int getShiftReduceWeight() {
		return shiftReduceWeight;
	}

	/** Input file name, blank for stdin */
	public String getInput() {
		return input;
	}

	/** Output file name, blank for stdout */
	public String getOutput() {
		return output;
	}

	/** File name for the pretty printed EBNF, blank if it isn't written */
	public String getEbnfOutput() {
		return ebnfOutput;
	}

	/**
	 * Check that the options can be combined
	 *
	 * @throws ConfigurationError otherwise
	 */
	public void validate(){
		if (magic && (ebnfInlining == InliningLevel.ALL || bnfInlining == InliningLevel.ALL)){
			throw new ConfigurationError(String.format("magic (-m, -M) can't be combined with inlining all productions"
					+ " (-ie %d, -iy %d)", ebnfInlining.ordinal(), bnfInlining.ordinal()));
		}
		if (reduceReduceWeight < 0 || shiftReduceWeight < 0){
			throw new ConfigurationError(String.format("conflict weights have to be non negative (-wr %d, -ws %d)",
					reduceReduceWeight, shiftReduceWeight));
		}
		if (!prefix.chars().allMatch(c -> c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')
				|| (c >= '0' && c <= '9')) || (!prefix.isEmpty() && Character.isDigit(prefix.charAt(0)))){
			throw new ConfigurationError(String.format("token prefix \"%s\" isn't a valid identifier prefix", prefix));
		}
		if (start.isEmpty()){
			throw new ConfigurationError("start production name is empty");
		}
	}

	/**
	 * Parse the command line arguments, the options aren't validated
	 *
	 * @throws UsageError for unknown flags and missing or malformed flag values
	 * @throws ConfigurationError for unknown inlining levels
	 */
	public static Options parse(String[] args){
		Options options = new Options();
		int i = 0;
		for (; i < args.length && args[i].startsWith("-") && args[i].length() > 1; i++){
			String flag = args[i].startsWith("--") ? args[i].substring(1) : args[i];
			switch (flag){
				case "-ie":
					options.ebnfInlining(InliningLevel.fromNumber(intValue(args, ++i, flag)));
					break;
				case "-iy":
					options.bnfInlining(InliningLevel.fromNumber(intValue(args, ++i, flag)));
					break;
				case "-m":
					options.magic(true);
					break;
				case "-M":
					options.magicVerbose(true);
					break;
				case "-o":
					options.output(value(args, ++i, flag));
					break;
				case "-oe":
					options.ebnfOutput(value(args, ++i, flag));
					break;
				case "-p":
					options.prefix(value(args, ++i, flag));
					break;
				case "-start":
					options.start(value(args, ++i, flag));
					break;
				case "-wr":
					options.reduceReduceWeight = intValue(args, ++i, flag);
					break;
				case "-ws":
					options.shiftReduceWeight = intValue(args, ++i, flag);
					break;
				default:
					throw new UsageError("unknown flag " + args[i]);
			}
		}
		if (args.length - i > 1){
			throw new UsageError("at most one input file expected, got " + (args.length - i));
		}
		if (i < args.length){
			options.input(args[i]);
		}
		return options;
	}

	private static String value(String[] args, int index, String flag){
		if (index >= args.length){
			throw new UsageError("missing value for " + flag);
		}
		return args[index];
	}

	private static int intValue(String[] args, int index, String flag){
		String value = value(args, index, flag);
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new UsageError(String.format("%s expects a number, got \"%s\"", flag, value));
		}
	}
}
