package gocpp;

import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

public class GoCppOptions {
	public static final String VERSION = "0.1.0";
	public static final String APPLY_FORMATTER = "apply";
	public static final String SKIP_FORMATTER = "skip";

	@Option(value = "Print the version and exit", aliases = { "-version" })
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = { "-help" })
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = { "-quiet" })
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution", aliases = { "-verbose" })
	public boolean logLvlVerbose = false;

	@Option(value = "-c path to a JSON file overriding the formatter and compiler commands")
	public String configFilePath;

	// positional arguments; a null input path means standard input
	public String inputFilePath;
	public boolean applyFormatter = true;
	public String outputFilePath;

	public GoCppToolchainOptions toolchain = new GoCppToolchainOptions();

	private final Options plumeOptions;
	private final String[] args;

	public GoCppOptions(String[] args) {
		this.plumeOptions = new Options("gocpp [options] [input.go] [apply|skip] [output]", this);
		this.args = args;
	}

	public void printHelp() {
		plumeOptions.printUsage();
	}

	public void parse() throws GoCppOptionException {
		String[] remainingArgs;
		try {
			remainingArgs = plumeOptions.parse(args);
		} catch (Options.ArgException e) {
			throw new GoCppOptionException(e.getMessage());
		}
		if (help || version) {
			return;
		}
		if (remainingArgs.length > 3) {
			throw new GoCppOptionException("Expected at most 3 arguments, got " + remainingArgs.length);
		}

		if (remainingArgs.length > 0) {
			inputFilePath = remainingArgs[0];
		}
		if (remainingArgs.length > 1) {
			if (remainingArgs[1].equals(APPLY_FORMATTER)) {
				applyFormatter = true;
			} else if (remainingArgs[1].equals(SKIP_FORMATTER)) {
				applyFormatter = false;
			} else {
				throw new GoCppOptionException("The second argument must be " + APPLY_FORMATTER +
						" (format the generated code) or " + SKIP_FORMATTER + " (leave it unformatted), got " +
						remainingArgs[1]);
			}
		}
		if (remainingArgs.length > 2) {
			outputFilePath = remainingArgs[2];
		}

		if (configFilePath != null && !configFilePath.isEmpty()) {
			String s;
			try {
				s = new String(Files.readAllBytes(Paths.get(configFilePath)), StandardCharsets.UTF_8);
			} catch (IOException ex) {
				throw new GoCppOptionException("Error reading configuration file: " + ex.getMessage());
			}
			toolchain = GoCppToolchainOptions.parse(s, configFilePath);
		}
	}
}
