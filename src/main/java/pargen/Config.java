package pargen;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Global configuration.
 *
 * The defaults can be overridden by a <code>pargen.ini</code> file in the working directory
 * (<code>key = value</code> lines) and by system properties named <code>pargen.KEY</code>.
 */
public class Config {

	private static final Logger LOG = Logger.getLogger(Config.class.getName());

	public static final String configFile = "pargen.ini";

	private static final Map<String, String> config = new HashMap<String, String>(){{
		put("synthesizeFactoring", "no");
		put("logLevel", "INFO");
		put("sentenceLength", "0");
	}};

	/** Materialize left-factored productions instead of only reporting conflicts? */
	public static boolean synthesizeFactoring(){
		return get("synthesizeFactoring").equals("yes");
	}

	public static Level getLogLevel(){
		try {
			return Level.parse(get("logLevel"));
		} catch (IllegalArgumentException e) {
			LOG.warning("Unknown log level \"" + get("logLevel") + "\", using INFO");
			return Level.INFO;
		}
	}

	/** Maximum length of the sentences printed after the transformation, 0 disables the printing */
	public static int getSentenceLength(){
		try {
			return Integer.parseInt(get("sentenceLength"));
		} catch (NumberFormatException e) {
			throw new PargenException("Config key sentenceLength isn't a number: " + get("sentenceLength"), e);
		}
	}

	/**
	 * Value for the passed key, system properties take precedence
	 */
	public static String get(String key){
		if (!config.containsKey(key)){
			throw new PargenException("Unknown config key \"" + key + "\"");
		}
		return System.getProperty("pargen." + key, config.get(key));
	}

	public static void set(String key, String value){
		if (!config.containsKey(key)){
			throw new PargenException("Unknown config key \"" + key + "\"");
		}
		config.put(key, value);
	}

	static void loadConfig(File file){
		if (!file.exists()){
			return;
		}
		try (BufferedReader reader = new BufferedReader(new FileReader(file))) {
			String line;
			while ((line = reader.readLine()) != null){
				if (line.contains(" = ")){
					String[] parts = line.split(" = ", 2);
					String key = parts[0].trim();
					if (config.containsKey(key)){
						config.put(key, parts[1].trim());
					} else {
						LOG.warning("Unknown config key \"" + key + "\" in " + file);
					}
				}
			}
		} catch (IOException e) {
			throw new PargenException("Can't read config file " + file, e);
		}
	}

	static {
		loadConfig(new File(configFile));
	}
}
