package gocpp.toolchain;

import gocpp.trans.intermediate.ExternalCompilerFailureIssue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.logging.Logger;

/**
 * Compiles a C++ unit read from standard input into an executable written to standard output.
 */
public class GppCompiler extends ExternalTool {
	private static final Logger logger = Logger.getLogger("GoCpp Toolchain");

	public GppCompiler(List<String> command) {
		super(command);
	}

	/**
	 * @return the executable's bytes
	 * @throws ExternalCompilerFailureIssue if the compiler rejects the unit
	 * @throws IOException if the compiler cannot be run
	 */
	public byte[] compile(String source) throws IOException {
		logger.fine("running " + String.join(" ", getCommand()));
		Outcome outcome = run(source.getBytes(StandardCharsets.UTF_8));
		if (outcome.getExitStatus() != 0) {
			throw new ExternalCompilerFailureIssue(getName(), outcome.getExitStatus(), source,
					outcome.getDiagnostics());
		}
		return outcome.getOutput();
	}
}
