package gocpp.trans.passes.validation;

import gocpp.errors.IssueContext;
import gocpp.trans.intermediate.UnsupportedLiteralFormIssue;
import gocpp.util.SourceLocation;

import java.nio.file.Path;
import java.util.List;

/**
 * Rejects literal forms that cannot be translated one line at a time. Runs over the whole unit before any line is
 * translated, so that a raw string spanning several lines is reported where it starts instead of producing
 * confusing errors for the lines inside it.
 */
public class LiteralFormValidationPass {

	private LiteralFormValidationPass() {}

	public static void perform(IssueContext ctx, Path file, List<String> lines) {
		for (int i = 0; i < lines.size(); i++) {
			String line = lines.get(i);
			if (opensRawString(line)) {
				ctx.errorAt(new SourceLocation(file, i + 1, line),
						new UnsupportedLiteralFormIssue("raw string literal spanning several lines", line.trim()));
				// the rest of the unit cannot be scanned reliably
				return;
			}
		}
	}

	/**
	 * @return whether the line ends inside a raw string literal
	 */
	static boolean opensRawString(String line) {
		char quote = 0;
		for (int i = 0; i < line.length(); i++) {
			char c = line.charAt(i);
			if (quote != 0) {
				if (c == '\\' && quote != '`') {
					i++;
				} else if (c == quote) {
					quote = 0;
				}
				continue;
			}
			if (c == '/' && i + 1 < line.length() && line.charAt(i + 1) == '/') {
				return false;
			}
			if (c == '"' || c == '\'' || c == '`') {
				quote = c;
			}
		}
		return quote == '`';
	}
}
