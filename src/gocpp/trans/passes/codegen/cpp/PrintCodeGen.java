package gocpp.trans.passes.codegen.cpp;

import gocpp.trans.intermediate.ConstructResult;
import gocpp.trans.intermediate.UnsupportedFeatureIssue;
import gocpp.trans.intermediate.UnsupportedFormatVerbIssue;
import gocpp.util.Substrings;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates the print family (fmt.Print, fmt.Println, fmt.Fprint, fmt.Fprintln and the print/println builtins) into
 * stream insertions, and renames fmt.Printf to std::printf.
 *
 * Literal arguments are inserted directly. Every other argument goes through the generic formatting helper, which
 * renders bools, narrow integers and structs the way Go prints them.
 */
public final class PrintCodeGen {
	public static final String OUT = "std::cout";
	public static final String ERR = "std::cerr";
	public static final String PRINTF = "std::printf";

	private static final Pattern PRINT_CALL = Pattern.compile(
			"(fmt\\.(?:Print|Println|Printf|Fprint|Fprintln)|print|println)\\s*\\(.*");
	private static final Pattern FORMAT_VERB = Pattern.compile("%[-+# 0]*[0-9]*(?:\\.[0-9]*)?([a-zA-Z%])");
	private static final String UNSUPPORTED_VERBS = "vT";
	private static final String SEPARATOR = "\" \"";

	private PrintCodeGen() {}

	public static boolean isPrintCall(String line) {
		return PRINT_CALL.matcher(line).matches();
	}

	public static ConstructResult transform(String line) {
		int open = line.indexOf('(');
		int close = Substrings.matchingClose(line, open);
		if (close == -1) {
			throw new UnsupportedFeatureIssue("print call spanning several lines", line);
		}
		if (!line.substring(close + 1).trim().isEmpty()) {
			throw new UnsupportedFeatureIssue("print call used inside an expression", line);
		}
		String name = line.substring(0, open).trim();
		List<String> args = new ArrayList<>(Substrings.splitTopLevel(line.substring(open + 1, close), ','));

		if (name.equals("fmt.Printf")) {
			return printf(args, line);
		}

		String stream = name.equals(name.toLowerCase()) ? ERR : OUT;
		if (name.startsWith("fmt.Fprint")) {
			if (args.isEmpty()) {
				throw new UnsupportedFeatureIssue("print call without a destination", line);
			}
			stream = destination(args.remove(0), line);
		}
		boolean newline = name.endsWith("ln");
		return insertions(stream, args, separatorMode(name), newline);
	}

	private enum Separators {
		/** between every pair of operands */
		ALWAYS,
		/** between operands when neither is a string */
		BETWEEN_NON_STRINGS,
		NEVER,
	}

	private static Separators separatorMode(String name) {
		if (name.endsWith("ln")) {
			return Separators.ALWAYS;
		}
		return name.startsWith("fmt.") ? Separators.BETWEEN_NON_STRINGS : Separators.NEVER;
	}

	private static String destination(String writer, String line) {
		switch (writer) {
			case "os.Stdout":
				return OUT;
			case "os.Stderr":
				return ERR;
			default:
				throw new UnsupportedFeatureIssue("printing to " + writer, line);
		}
	}

	private static ConstructResult insertions(String stream, List<String> args, Separators separators,
	                                          boolean newline) {
		List<String> statements = new ArrayList<>();
		StringBuilder pending = new StringBuilder();
		boolean helperUsed = false;
		for (int i = 0; i < args.size(); i++) {
			String arg = args.get(i);
			if (i > 0 && needsSeparator(separators, args.get(i - 1), arg)) {
				pending.append(" << ").append(SEPARATOR);
			}
			if (isLiteral(arg)) {
				pending.append(" << ").append(arg);
				continue;
			}
			if (pending.length() > 0) {
				statements.add(stream + pending);
				pending.setLength(0);
			}
			statements.add(DeclarationCodeGen.FORMAT_HELPER + "(" + stream + ", " + arg + ")");
			helperUsed = true;
		}
		if (newline) {
			pending.append(" << std::endl");
		} else if (args.isEmpty()) {
			pending.append(" << std::flush");
		}
		if (pending.length() > 0) {
			statements.add(stream + pending);
		}
		ConstructResult result = ConstructResult.of(String.join(";\n", statements));
		if (helperUsed) {
			result = result.with(ConstructResult.Advisory.FORMAT_HELPER_REQUIRED);
		}
		return result;
	}

	private static boolean needsSeparator(Separators separators, String previous, String next) {
		switch (separators) {
			case ALWAYS:
				return true;
			case BETWEEN_NON_STRINGS:
				return !Substrings.isStringLiteral(previous) && !Substrings.isStringLiteral(next);
			default:
				return false;
		}
	}

	static boolean isLiteral(String arg) {
		return Substrings.isStringLiteral(arg) || Substrings.isNumberLiteral(arg);
	}

	private static ConstructResult printf(List<String> args, String line) {
		if (!args.isEmpty() && Substrings.isStringLiteral(args.get(0))) {
			Matcher m = FORMAT_VERB.matcher(args.get(0));
			while (m.find()) {
				if (UNSUPPORTED_VERBS.indexOf(m.group(1).charAt(0)) != -1) {
					throw new UnsupportedFormatVerbIssue(m.group(), line);
				}
			}
		}
		return ConstructResult.of(PRINTF + "(" + String.join(", ", args) + ")");
	}
}
