package ebnf2y;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import ebnf2y.magic.ConflictMinimizer;

import static ebnf2y.Ebnf2y.LOG;

/**
 * Tool configuration, read from the optional <code>ebnf2y.ini</code> file in the working directory.
 *
 * The file consists of <code>key = value</code> lines, lines starting with <code>#</code> are ignored.
 */
public class Config {

	public static final String configFile = "ebnf2y.ini";

	private static Map<String, String> defaultValues(){
		Map<String, String> config = new HashMap<>();
		config.put("yacc", "bison");
		config.put("tmpDir", System.getProperty("java.io.tmpdir"));
		config.put("exhaustiveLimit", Integer.toString(ConflictMinimizer.DEFAULT_EXHAUSTIVE_LIMIT));
		config.put("workers", Integer.toString(Runtime.getRuntime().availableProcessors()));
		config.put("toolTimeout", "60");
		config.put("searchTimeout", "0");
		return config;
	}

	private final Map<String, String> config;

	private Config(Map<String, String> config) {
		this.config = config;
	}

	/** Default configuration */
	public static Config defaults(String... overrides){
		Map<String, String> config = defaultValues();
		for (int i = 0; i + 1 < overrides.length; i += 2){
			if (!config.containsKey(overrides[i])){
				throw new IllegalArgumentException("Unknown config key " + overrides[i]);
			}
			config.put(overrides[i], overrides[i + 1]);
		}
		Config result = new Config(config);
		result.check();
		return result;
	}

	/**
	 * Load the configuration file from the working directory, the defaults are used if it doesn't exist
	 */
	public static Config load(){
		return load(Paths.get(configFile));
	}

	public static Config load(Path file){
		if (!Files.exists(file)){
			return defaults();
		}
		try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			return parse(file.toString(), reader);
		} catch (IOException e) {
			throw new ConfigurationError(String.format("Can't read %s: %s", file, e.getMessage()));
		}
	}

	static Config parse(String source, String content){
		try {
			return parse(source, new StringReader(content));
		} catch (IOException e) {
			throw new IllegalStateException(e);
		}
	}

	private static Config parse(String source, Reader input) throws IOException {
		Map<String, String> config = defaultValues();
		BufferedReader reader = new BufferedReader(input);
		String line;
		int lineNumber = 0;
		while ((line = reader.readLine()) != null){
			lineNumber++;
			line = line.trim();
			if (line.isEmpty() || line.startsWith("#")){
				continue;
			}
			int separator = line.indexOf('=');
			if (separator == -1){
				throw new ConfigurationError(String.format("%s:%d: expected key = value, found \"%s\"", source,
						lineNumber, line));
			}
			String key = line.substring(0, separator).trim();
			String value = line.substring(separator + 1).trim();
			if (config.containsKey(key)){
				config.put(key, value);
			} else {
				LOG.warning(String.format("%s:%d: unknown config key \"%s\"", source, lineNumber, key));
			}
		}
		Config result = new Config(config);
		result.check();
		return result;
	}

	private void check(){
		getExhaustiveLimit();
		getWorkers();
		getToolTimeout();
		getSearchTimeout();
		if (getYacc().isEmpty()){
			throw new ConfigurationError("yacc command is empty");
		}
	}

	/** Command of the LALR tool, with optional arguments */
	public String getYacc(){
		return config.get("yacc").trim();
	}

	public Path getTmpDir(){
		return Paths.get(config.get("tmpDir"));
	}

	/** Maximum number of inlining candidates for an exhaustive search */
	public int getExhaustiveLimit(){
		return getInt("exhaustiveLimit", 0, ConflictMinimizer.MAX_EXHAUSTIVE_LIMIT);
	}

	public int getWorkers(){
		return getInt("workers", 1, Integer.MAX_VALUE);
	}

	/** Seconds a single tool run may take, 0 for no limit */
	public int getToolTimeout(){
		return getInt("toolTimeout", 0, Integer.MAX_VALUE);
	}

	/** Seconds the whole search may take, 0 for no limit */
	public int getSearchTimeout(){
		return getInt("searchTimeout", 0, Integer.MAX_VALUE);
	}

	private int getInt(String key, int min, int max){
		String value = config.get(key);
		try {
			int number = Integer.parseInt(value);
			if (number < min || number > max){
				throw new ConfigurationError(String.format("config value %s = %d out of range [%d, %d]", key,
						number, min, max));
			}
			return number;
		} catch (NumberFormatException e) {
			throw new ConfigurationError(String.format("config value %s = \"%s\" isn't an integer", key, value));
		}
	}
}
