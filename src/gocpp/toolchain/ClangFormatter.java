package gocpp.toolchain;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.logging.Logger;

/**
 * Best-effort formatting of the generated unit. The formatter being missing or failing is never fatal: the unit is
 * returned unchanged and a warning is logged.
 */
public class ClangFormatter extends ExternalTool {
	private static final Logger logger = Logger.getLogger("GoCpp Toolchain");

	public ClangFormatter(List<String> command) {
		super(command);
	}

	public String format(String source) {
		try {
			Outcome outcome = run(source.getBytes(StandardCharsets.UTF_8));
			if (outcome.getExitStatus() != 0) {
				logger.warning(getName() + " exited with status " + outcome.getExitStatus() +
						", the output will not be formatted: " + outcome.getDiagnostics().trim());
				return source;
			}
			return new String(outcome.getOutput(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			logger.warning(getName() + " is not available, the output will not be formatted: " + e.getMessage());
			return source;
		}
	}
}
