package gocpp;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

// Commands used to run the external formatter and compiler. Both can be
// overridden in the JSON configuration file given with -c:
//
//   {
//     "formatter": {"command": ["clang-format", "-style=LLVM"]},
//     "compiler":  {"command": ["g++", "-x", "c++", "-std=c++17", "-o", "/dev/stdout", "-"]}
//   }
//
// A missing section keeps the default command.
public class GoCppToolchainOptions {
	public static final String FORMATTER_FIELD = "formatter";
	public static final String COMPILER_FIELD = "compiler";
	public static final String COMMAND_FIELD = "command";

	public static final List<String> DEFAULT_FORMATTER = Collections.unmodifiableList(Arrays.asList(
			"clang-format", "-style={BasedOnStyle: Webkit, ColumnLimit: 99}"));
	public static final List<String> DEFAULT_COMPILER = Collections.unmodifiableList(Arrays.asList(
			"g++", "-x", "c++", "-std=c++17", "-O2", "-pipe", "-fPIC", "-Wfatal-errors", "-s",
			"-o", "/dev/stdout", "-"));

	private final List<String> formatterCommand;
	private final List<String> compilerCommand;

	public GoCppToolchainOptions() {
		this.formatterCommand = DEFAULT_FORMATTER;
		this.compilerCommand = DEFAULT_COMPILER;
	}

	public GoCppToolchainOptions(JSONObject config) throws GoCppOptionException {
		this.formatterCommand = command(config, FORMATTER_FIELD, DEFAULT_FORMATTER);
		this.compilerCommand = command(config, COMPILER_FIELD, DEFAULT_COMPILER);
	}

	public static GoCppToolchainOptions parse(String json, String source) throws GoCppOptionException {
		JSONObject config;
		try {
			config = new JSONObject(json);
		} catch (JSONException e) {
			throw new GoCppOptionException(source + ": parsing error: " + e.getMessage());
		}
		return new GoCppToolchainOptions(config);
	}

	private static List<String> command(JSONObject config, String field, List<String> fallback)
			throws GoCppOptionException {
		if (!config.has(field)) {
			return fallback;
		}
		List<String> command = new ArrayList<>();
		try {
			JSONArray words = config.getJSONObject(field).getJSONArray(COMMAND_FIELD);
			for (int i = 0; i < words.length(); i++) {
				command.add(words.getString(i));
			}
		} catch (JSONException e) {
			throw new GoCppOptionException(field + ": " + e.getMessage());
		}
		if (command.isEmpty()) {
			throw new GoCppOptionException(field + ": " + COMMAND_FIELD + " must not be empty");
		}
		return Collections.unmodifiableList(command);
	}

	public List<String> getFormatterCommand() {
		return formatterCommand;
	}

	public List<String> getCompilerCommand() {
		return compilerCommand;
	}
}
