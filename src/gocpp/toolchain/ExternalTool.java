package gocpp.toolchain;

import org.apache.commons.io.IOUtils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An external program that reads a C++ unit on standard input. Standard input is written and standard error is
 * drained on helper threads while standard output is read, so that neither side can block on a full pipe.
 */
public abstract class ExternalTool {
	private final List<String> command;

	protected ExternalTool(List<String> command) {
		if (command.isEmpty()) {
			throw new IllegalArgumentException("empty command");
		}
		this.command = Collections.unmodifiableList(new ArrayList<>(command));
	}

	public List<String> getCommand() {
		return command;
	}

	public String getName() {
		return command.get(0);
	}

	protected static class Outcome {
		private final int exitStatus;
		private final byte[] output;
		private final String diagnostics;

		Outcome(int exitStatus, byte[] output, String diagnostics) {
			this.exitStatus = exitStatus;
			this.output = output;
			this.diagnostics = diagnostics;
		}

		public int getExitStatus() {
			return exitStatus;
		}

		public byte[] getOutput() {
			return output;
		}

		public String getDiagnostics() {
			return diagnostics;
		}
	}

	private interface Transfer {
		void run() throws IOException;
	}

	private static class Pump extends Thread {
		private final Transfer transfer;
		private IOException failure;

		Pump(String name, Transfer transfer) {
			super(name);
			this.transfer = transfer;
			setDaemon(true);
		}

		@Override
		public void run() {
			try {
				transfer.run();
			} catch (IOException e) {
				failure = e;
			}
		}

		void finish() throws IOException, InterruptedException {
			join();
			if (failure != null) {
				throw failure;
			}
		}
	}

	/**
	 * Runs the command once with input on its standard input.
	 *
	 * @throws IOException if the command cannot be started or its streams fail
	 */
	protected Outcome run(byte[] input) throws IOException {
		Process process = new ProcessBuilder(command).start();
		ByteArrayOutputStream diagnostics = new ByteArrayOutputStream();
		Pump writer = new Pump(getName() + " stdin", () -> {
			try (OutputStream in = process.getOutputStream()) {
				in.write(input);
			}
		});
		Pump errors = new Pump(getName() + " stderr", () -> {
			try (InputStream err = process.getErrorStream()) {
				IOUtils.copy(err, diagnostics);
			}
		});
		writer.start();
		errors.start();
		try {
			byte[] output;
			try (InputStream out = process.getInputStream()) {
				output = IOUtils.toByteArray(out);
			}
			int status = process.waitFor();
			errors.finish();
			try {
				writer.finish();
			} catch (IOException e) {
				// a tool that exits early closes its input; its exit status tells what went wrong
				if (status == 0) {
					throw e;
				}
			}
			return new Outcome(status, output, new String(diagnostics.toByteArray(), StandardCharsets.UTF_8));
		} catch (InterruptedException e) {
			process.destroy();
			Thread.currentThread().interrupt();
			throw new InterruptedIOException("interrupted while waiting for " + getName());
		} finally {
			if (process.isAlive()) {
				process.destroyForcibly();
			}
		}
	}
}
