package gocpp.trans.passes.codegen.cpp;

import gocpp.util.Substrings;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites calls into the Go standard library that have a direct C++ counterpart. Only code outside of string and
 * character literals is touched.
 *
 * The strings package calls are renamed to helper functions (stringsContains and friends) whose definitions the
 * helper injection pass adds to the unit when they are used.
 */
public final class ExpressionRewriter {

	private static final Map<Pattern, String> REWRITES = new LinkedHashMap<>();

	static {
		REWRITES.put(Pattern.compile("(?<![\\w.])strings\\.(Contains|HasPrefix|HasSuffix|TrimSpace|Index)\\("),
				"strings$1(");
		REWRITES.put(Pattern.compile("(?<![\\w.:])len\\("), "std::size(");
		REWRITES.put(Pattern.compile("(?<![\\w.])os\\.Exit\\("), "std::exit(");
		REWRITES.put(Pattern.compile("(?<![\\w.])nil(?!\\w)"), "nullptr");
	}

	private ExpressionRewriter() {}

	public static String rewrite(String code) {
		return Substrings.rewriteOutsideLiterals(code, ExpressionRewriter::rewriteCode);
	}

	/**
	 * Turns single-line raw string literals (`a\b`) into interpreted ones ("a\\b"). Raw literals spanning lines are
	 * rejected before translation starts.
	 */
	public static String rewriteRawStrings(String code) {
		if (code.indexOf('`') == -1) {
			return code;
		}
		StringBuilder out = new StringBuilder();
		char quote = 0;
		for (int i = 0; i < code.length(); i++) {
			char c = code.charAt(i);
			if (quote == '`') {
				if (c == '`') {
					out.append('"');
					quote = 0;
				} else if (c == '\\' || c == '"') {
					out.append('\\').append(c);
				} else {
					out.append(c);
				}
				continue;
			}
			if (quote != 0) {
				out.append(c);
				if (c == '\\' && i + 1 < code.length()) {
					out.append(code.charAt(++i));
				} else if (c == quote) {
					quote = 0;
				}
				continue;
			}
			if (c == '`') {
				out.append('"');
			} else {
				out.append(c);
			}
			if (c == '"' || c == '\'' || c == '`') {
				quote = c;
			}
		}
		return out.toString();
	}

	private static String rewriteCode(String code) {
		String result = code;
		for (Map.Entry<Pattern, String> rewrite : REWRITES.entrySet()) {
			Matcher m = rewrite.getKey().matcher(result);
			result = m.replaceAll(rewrite.getValue());
		}
		return result;
	}
}
