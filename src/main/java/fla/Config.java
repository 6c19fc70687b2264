package fla;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.logging.Logger;

/**
 * Global settings.
 *
 * Defaults are overridden by a {@code config.ini} on the class path and then by a {@code config.ini}
 * in the working directory. Each line has the form {@code key = value}.
 */
public class Config {

	public static final String configFile = "config.ini";

	private static final Logger LOG = Logger.getLogger("Config");

	private static final Map<String, String> config = new HashMap<String, String>(){{
		put("derivationLimit", "10000");
		put("finalState", "FINAL");
		put("sinkState", "SINK");
		put("powersetStatePrefix", "q");
		put("nonTerminalPrefix", "A");
	}};

	/** Maximum number of rewriting steps of a single random derivation */
	public static int derivationLimit(){
		return Integer.parseInt(config.get("derivationLimit"));
	}

	/** Name of the accepting state added when converting a grammar into an automaton */
	public static String finalState(){
		return config.get("finalState");
	}

	/** Name of the rejecting state added when completing a partial automaton */
	public static String sinkState(){
		return config.get("sinkState");
	}

	/** Prefix of the states synthesized by the powerset construction */
	public static String powersetStatePrefix(){
		return config.get("powersetStatePrefix");
	}

	/** Prefix of the non terminals synthesized when converting an automaton into a grammar */
	public static String nonTerminalPrefix(){
		return config.get("nonTerminalPrefix");
	}

	static void load(Reader source, String origin) throws IOException {
		BufferedReader reader = new BufferedReader(source);
		String line;
		while ((line = reader.readLine()) != null){
			line = line.trim();
			if (line.startsWith("#") || !line.contains("=")){
				continue;
			}
			String[] parts = line.split("=", 2);
			String key = parts[0].trim();
			String value = parts[1].trim();
			if (!config.containsKey(key)){
				LOG.warning(String.format("Unknown config key \"%s\" in %s", key, origin));
				continue;
			}
			if (key.equals("derivationLimit") && !isPositiveNumber(value)){
				LOG.warning(String.format("Ignoring derivationLimit \"%s\" in %s, not a positive number", value, origin));
				continue;
			}
			config.put(key, value);
		}
	}

	private static boolean isPositiveNumber(String value){
		try {
			return Integer.parseInt(value) > 0;
		} catch (NumberFormatException ex){
			return false;
		}
	}

	private static void loadConfig(){
		try (InputStream stream = Config.class.getResourceAsStream("/" + configFile)) {
			if (stream != null){
				load(new InputStreamReader(stream, StandardCharsets.UTF_8), "class path");
			}
		} catch (IOException e) {
			LOG.warning("Can't read the bundled " + configFile + ": " + e.getMessage());
		}
		File file = new File(configFile);
		if (file.exists()){
			try (Reader reader = new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8)) {
				load(reader, file.getAbsolutePath());
			} catch (IOException e) {
				LOG.warning("Can't read " + file.getAbsolutePath() + ": " + e.getMessage());
			}
		}
	}

	static {
		loadConfig();
	}
}
