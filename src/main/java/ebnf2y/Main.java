package ebnf2y;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;

import static ebnf2y.Ebnf2y.LOG;

/**
 * Command line front end, see {@link Options#USAGE}
 */
public class Main {

	private static Handler verboseHandler;

	public static void main(String[] args) {
		System.exit(run(args, System.in, System.out, System.err, Paths.get(Config.configFile)));
	}

	/**
	 * Run the tool
	 *
	 * @param configFile tool configuration, read after the options are validated
	 * @return exit code: 0 on success, 1 for conversion errors, 2 for a malformed command line
	 */
	static int run(String[] args, InputStream in, PrintStream out, PrintStream err, Path configFile){
		Options options;
		Ebnf2y ebnf2y;
		try {
			options = Options.parse(args);
			options.validate();
			if (options.isMagicVerbose()){
				enableVerboseLogging();
			}
			ebnf2y = new Ebnf2y(options, Config.load(configFile));
		} catch (Options.UsageError e) {
			err.println(e.getMessage());
			err.println(Options.USAGE);
			return 2;
		} catch (Ebnf2yException e) {
			err.println(e.getMessage());
			return 1;
		}
		try {
			String source = options.getInput();
			String input = source.isEmpty() ? readAll(in) :
					new String(Files.readAllBytes(Paths.get(source)), StandardCharsets.UTF_8);
			Ebnf2y.Result result = ebnf2y.run(source, input);
			writeOutputs(options, result, out);
			return 0;
		} catch (Ebnf2yException e) {
			err.println(e.getMessage());
			return 1;
		} catch (IOException e) {
			err.println("I/O error: " + e.getMessage());
			return 1;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			err.println("interrupted");
			return 1;
		}
	}

	/**
	 * Writes the skeleton and the EBNF echo, a skeleton file is removed again if the echo can't be written
	 */
	private static void writeOutputs(Options options, Ebnf2y.Result result, PrintStream out) throws IOException {
		Path output = options.getOutput().isEmpty() ? null : Paths.get(options.getOutput());
		if (output != null){
			Files.write(output, result.skeleton.getBytes(StandardCharsets.UTF_8));
		}
		if (result.ebnf != null){
			try {
				Files.write(Paths.get(options.getEbnfOutput()), result.ebnf.getBytes(StandardCharsets.UTF_8));
			} catch (IOException e) {
				if (output != null){
					Files.deleteIfExists(output);
				}
				throw e;
			}
		}
		if (output == null){
			out.print(result.skeleton);
			out.flush();
		}
	}

	private static String readAll(InputStream in) throws IOException {
		ByteArrayOutputStream buffer = new ByteArrayOutputStream();
		byte[] bytes = new byte[8192];
		int count;
		while ((count = in.read(bytes)) != -1){
			buffer.write(bytes, 0, count);
		}
		return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
	}

	private static synchronized void enableVerboseLogging(){
		if (verboseHandler == null){
			verboseHandler = new ConsoleHandler();
			verboseHandler.setLevel(Level.FINE);
			LOG.addHandler(verboseHandler);
			LOG.setUseParentHandlers(false);
		}
		LOG.setLevel(Level.FINE);
	}
}
