package ebnf2y.magic;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import static ebnf2y.Ebnf2y.LOG;

/**
 * Runs a yacc style parser generator (bison by default) as a subprocess:
 * <pre>
 *     COMMAND -o OUTPUT_FILE GRAMMAR_FILE
 * </pre>
 * and reads the number of conflicts from its combined output. Each invocation
 * works in its own temporary directory.
 */
public class YaccTool implements LalrTool {

	private static final Pattern SHIFT_REDUCE = Pattern.compile("(\\d+)\\s+shift/reduce");
	private static final Pattern REDUCE_REDUCE = Pattern.compile("(\\d+)\\s+reduce/reduce");

	private final List<String> command;
	private final Path tmpDir;
	private final long timeoutSeconds;

	/**
	 * @param command executable with optional leading arguments, split at white space
	 * @param tmpDir directory for the temporary grammar files
	 * @param timeoutSeconds maximum run time of a single invocation, 0 for no limit
	 */
	public YaccTool(String command, Path tmpDir, long timeoutSeconds) {
		this.command = Arrays.asList(command.trim().split("\\s+"));
		this.tmpDir = tmpDir;
		this.timeoutSeconds = timeoutSeconds;
	}

	@Override
	public ConflictReport check(String grammar) throws InterruptedException {
		Path dir;
		try {
			Files.createDirectories(tmpDir);
			dir = Files.createTempDirectory(tmpDir, "ebnf2y");
		} catch (IOException e) {
			throw new ToolFailureError("Can't create a temporary directory in " + tmpDir, e);
		}
		try {
			return run(dir, grammar);
		} finally {
			delete(dir);
		}
	}

	private ConflictReport run(Path dir, String grammar) throws InterruptedException {
		Path in = dir.resolve("grammar.y");
		Path log = dir.resolve("tool.log");
		List<String> args = new ArrayList<>(command);
		args.addAll(Arrays.asList("-o", dir.resolve("Parser.java").toString(), in.toString()));
		ProcessBuilder builder = new ProcessBuilder(args);
		builder.environment().put("LC_ALL", "C");
		builder.environment().put("LANG", "C");
		builder.directory(dir.toFile());
		builder.redirectErrorStream(true);
		builder.redirectOutput(log.toFile());
		Process process;
		try {
			Files.write(in, grammar.getBytes(StandardCharsets.UTF_8));
			process = builder.start();
		} catch (IOException e) {
			throw new ToolFailureError(String.format("Can't run %s: %s", String.join(" ", command), e.getMessage()), e);
		}
		LOG.finer(() -> "started " + builder.command());
		try {
			if (timeoutSeconds > 0){
				if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)){
					process.destroyForcibly();
					LOG.warning(String.format("%s timed out after %d seconds", command.get(0), timeoutSeconds));
					return ConflictReport.rejected("timed out after " + timeoutSeconds + " seconds");
				}
			} else {
				process.waitFor();
			}
		} catch (InterruptedException e) {
			process.destroyForcibly();
			throw e;
		}
		String output;
		try {
			output = new String(Files.readAllBytes(log), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new ToolFailureError("Can't read the output of " + command.get(0), e);
		}
		return parse(output, process.exitValue());
	}

	/**
	 * Interpret the output of a tool run
	 *
	 * @param output combined standard and error output
	 * @param exitCode exit code of the process, everything but 0 is a rejection
	 */
	static ConflictReport parse(String output, int exitCode){
		if (exitCode != 0){
			return ConflictReport.rejected(output.trim());
		}
		return ConflictReport.conflicts(count(REDUCE_REDUCE, output), count(SHIFT_REDUCE, output), output.trim());
	}

	private static int count(Pattern pattern, String output){
		Matcher matcher = pattern.matcher(output);
		int max = 0;
		while (matcher.find()){
			max = Math.max(max, Integer.parseInt(matcher.group(1)));
		}
		return max;
	}

	private static void delete(Path dir){
		try (Stream<Path> paths = Files.walk(dir)) {
			paths.sorted(Comparator.reverseOrder()).map(Path::toFile).forEach(File::delete);
		} catch (IOException e) {
			LOG.warning("Can't delete " + dir + ": " + e.getMessage());
		}
	}

	@Override
	public String toString() {
		return String.join(" ", command);
	}
}
