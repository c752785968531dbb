package gocpp;

import gocpp.errors.TopLevelIssueContext;
import gocpp.toolchain.ClangFormatter;
import gocpp.toolchain.GppCompiler;
import gocpp.trans.GoCppTransException;
import gocpp.trans.GoCppTranslator;
import gocpp.trans.intermediate.ExternalCompilerFailureIssue;
import gocpp.trans.intermediate.IOErrorIssue;
import gocpp.trans.passes.parse.option.OptionParsingPass;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Logger;

public class GoCppMain {
	private String[] cmdArgs;
	private static Logger logger;

	public GoCppMain(String[] args) {
		cmdArgs = args;
		// Get the top Logger instance
		logger = Logger.getLogger("GoCppMain");
	}

	// Creates a GoCppMain instance, and initiates run() below.
	public static void main(String[] args) {
		if (new GoCppMain(args).run()) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
			System.exit(1);
		}
	}

	private static String readSource(TopLevelIssueContext ctx, Path inputFilePath) {
		try {
			if (inputFilePath == null) {
				return IOUtils.toString(System.in, StandardCharsets.UTF_8);
			}
			return FileUtils.readFileToString(inputFilePath.toFile(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(e));
			return null;
		}
	}

	// Top-level workhorse method.
	public boolean run() {
		try {
			TopLevelIssueContext ctx = new TopLevelIssueContext();

			// Check options, set up logging.
			GoCppOptions opts = OptionParsingPass.perform(ctx, logger, cmdArgs);
			if (ctx.hasErrors()) {
				System.err.println(ctx.format());
				opts.printHelp();
				return false;
			}
			if (opts.version) {
				System.out.println("gocpp version " + GoCppOptions.VERSION);
				return true;
			}
			if (opts.help) {
				opts.printHelp();
				return true;
			}

			Path inputFilePath = opts.inputFilePath == null ? null : Paths.get(opts.inputFilePath);
			logger.info(inputFilePath == null ? "Reading Go source from standard input" :
					"Reading Go source from \"" + inputFilePath + "\"");
			String source = readSource(ctx, inputFilePath);
			checkErrors(ctx);

			logger.info("Translating Go to C++");
			String cppSource = GoCppTranslator.translate(ctx, inputFilePath, source);
			checkErrors(ctx);

			if (opts.applyFormatter) {
				logger.info("Formatting generated C++ code");
				cppSource = new ClangFormatter(opts.toolchain.getFormatterCommand()).format(cppSource);
			}

			if (opts.outputFilePath == null) {
				System.out.println(cppSource);
				return true;
			}

			GppCompiler compiler = new GppCompiler(opts.toolchain.getCompilerCommand());
			logger.info("Compiling with " + compiler.getName());
			byte[] executable;
			try {
				executable = compiler.compile(cppSource);
			} catch (ExternalCompilerFailureIssue issue) {
				ctx.error(issue);
				checkErrors(ctx);
				return false;
			}

			File outputFile = new File(opts.outputFilePath);
			logger.info("Writing executable to \"" + outputFile + "\"");
			FileUtils.writeByteArrayToFile(outputFile, executable);
			if (!outputFile.setExecutable(true)) {
				logger.warning("Could not mark \"" + outputFile + "\" as executable");
			}
		} catch (GoCppTransException e) {
			logger.severe("found issues");
			System.err.println(e.getMessage());
			return false;
		} catch (IOException e) {
			logger.severe(e.getMessage());
			return false;
		}

		return true;
	}

	private static void checkErrors(TopLevelIssueContext ctx) throws GoCppTransException {
		if (ctx.hasErrors()) {
			if (!ctx.getIssueLines().isEmpty()) {
				logger.fine("issues on line(s) " + ctx.getIssueLines());
			}
			throw new GoCppTransException(ctx.format());
		}
	}
}
