package gocpp.trans.passes.parse.option;

import gocpp.GoCppOptionException;
import gocpp.GoCppOptions;
import gocpp.errors.IssueContext;
import gocpp.trans.intermediate.OptionParserIssue;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	public static GoCppOptions perform(IssueContext ctx, Logger logger, String[] args) {
		GoCppOptions opts = new GoCppOptions(args);
		try {
			opts.parse();
		} catch (GoCppOptionException e) {
			ctx.error(new OptionParserIssue(e.getMessage()));
		}
		// set the logger's log level based on command line arguments
		Level level;
		if (opts.logLvlQuiet) {
			level = Level.WARNING;
		} else if (opts.logLvlVerbose) {
			level = Level.FINE;
		} else {
			level = Level.INFO;
		}
		logger.setLevel(level);
		Logger.getLogger("GoCpp Stage CodeGen").setLevel(level);
		Logger.getLogger("GoCpp Stage PostProcess").setLevel(level);
		Logger.getLogger("GoCpp Toolchain").setLevel(level);
		for (Handler handler : Logger.getLogger("").getHandlers()) {
			handler.setLevel(level);
		}
		return opts;
	}
}
