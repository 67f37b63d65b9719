package slr;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import slr.lexer.LexerKind;

/**
 * Global settings, read from the <code>slr.ini</code> on the class path and then from
 * a <code>slr.ini</code> in the working directory (later values win).
 *
 * Each line has the form <code>key = value</code>, other lines are ignored.
 */
public class Config {

	private static final Logger LOG = Logger.getLogger(Config.class.getName());

	/** Parent of all loggers of this library, kept here so that its level isn't lost */
	private static final Logger ROOT_LOG = Logger.getLogger("slr");

	/**
	 * Publishes the records below INFO that the default console handler drops, only attached for such levels
	 */
	private static final Handler DETAIL_HANDLER = new ConsoleHandler();

	public static final String configFile = "slr.ini";

	private static final Map<String, String> config = new HashMap<String, String>(){{
		put("tokenizer", "munch");
		put("logConflicts", "no");
		put("logLevel", "INFO");
		put("cacheSize", "10");
	}};

	/** Tokenizer used if none is passed explicitly */
	public static LexerKind tokenizer(){
		return LexerKind.forName(config.get("tokenizer"));
	}

	/** Log dropped table entries as warnings? */
	public static boolean logConflicts(){
		return config.get("logConflicts").equals("yes");
	}

	public static Level logLevel(){
		return Level.parse(config.get("logLevel"));
	}

	/** Number of generators kept in the generator cache */
	public static int cacheSize(){
		return Integer.parseInt(config.get("cacheSize"));
	}

	public static String get(String key){
		return config.get(key);
	}

	/**
	 * Parse the passed lines and put all known keys into the configuration.
	 *
	 * @return number of applied entries
	 */
	static int apply(BufferedReader reader, String source) throws IOException {
		int applied = 0;
		String line;
		while ((line = reader.readLine()) != null){
			if (line.contains(" = ")){
				String[] parts = line.split(" = ", 2);
				String key = parts[0].trim();
				if (config.containsKey(key)){
					config.put(key, parts[1].trim());
					applied++;
				} else {
					LOG.warning(String.format("Unknown config key \"%s\" in %s", key, source));
				}
			}
		}
		applyLogLevel();
		return applied;
	}

	/**
	 * Set the level of the library's loggers. Levels below INFO get their own console handler, the
	 * default handlers only publish INFO and above.
	 */
	static void applyLogLevel(){
		Level level = logLevel();
		ROOT_LOG.setLevel(level);
		ROOT_LOG.removeHandler(DETAIL_HANDLER);
		if (level.intValue() < Level.INFO.intValue()){
			DETAIL_HANDLER.setLevel(level);
			ROOT_LOG.addHandler(DETAIL_HANDLER);
			ROOT_LOG.setUseParentHandlers(false);
		} else {
			ROOT_LOG.setUseParentHandlers(true);
		}
	}

	/**
	 * Makes sure that the configuration has been loaded, stages that log call it before they run.
	 */
	public static void load(){
		// loading happens in the static initializer
	}

	private static void loadConfig(){
		try (InputStream stream = Config.class.getResourceAsStream("/" + configFile)) {
			if (stream != null){
				apply(new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8)), "class path");
			}
		} catch (IOException e) {
			LOG.log(Level.WARNING, "Can't read the bundled " + configFile, e);
		}
		File file = new File(configFile);
		if (file.exists()){
			try (BufferedReader reader = new BufferedReader(new InputStreamReader(new FileInputStream(file),
					StandardCharsets.UTF_8))) {
				apply(reader, file.getAbsolutePath());
			} catch (IOException e) {
				LOG.log(Level.WARNING, "Can't read " + file.getAbsolutePath(), e);
			}
		}
		applyLogLevel();
	}

	static {
		loadConfig();
	}
}
