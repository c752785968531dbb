package gocpp.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Text extraction helpers shared by the construct transformers. None of them build a syntax tree; they scan a single
 * line, keeping track of string/character literals and of bracket nesting where that matters.
 */
public final class Substrings {

	private static final Pattern NUMBER_LITERAL = Pattern.compile(
			"[-+]?(0[xX][0-9a-fA-F_]+|0[bB][01_]+|0[oO][0-7_]+|[0-9][0-9_]*(\\.[0-9_]*)?([eE][-+]?[0-9]+)?|\\.[0-9]+([eE][-+]?[0-9]+)?)");
	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	private Substrings() {}

	/**
	 * Which occurrence of a marker bounds an extracted fragment.
	 */
	public enum Anchor {
		FIRST,
		LAST,
	}

	/**
	 * Returns the text between the first occurrence of open and the first following occurrence of close, or s when
	 * either marker is missing.
	 */
	public static String between(String s, String open, String close) {
		return between(s, open, Anchor.FIRST, close, Anchor.FIRST);
	}

	/**
	 * Returns the text between open and close, choosing the leftmost or rightmost occurrence of each marker. The
	 * close marker is only searched for after the end of the chosen open marker. When either marker is missing the
	 * original string is returned unchanged.
	 */
	public static String between(String s, String open, Anchor openAnchor, String close, Anchor closeAnchor) {
		int openPos = openAnchor == Anchor.FIRST ? s.indexOf(open) : s.lastIndexOf(open);
		if (openPos == -1) {
			return s;
		}
		int start = openPos + open.length();
		int closePos;
		if (closeAnchor == Anchor.FIRST) {
			closePos = s.indexOf(close, start);
		} else {
			closePos = s.lastIndexOf(close);
			if (closePos < start) {
				closePos = -1;
			}
		}
		if (closePos == -1) {
			return s;
		}
		return s.substring(start, closePos);
	}

	/**
	 * Given the index of an opening bracket, returns the index of the bracket that closes it, or -1.
	 */
	public static int matchingClose(String s, int openIndex) {
		int depth = 0;
		char quote = 0;
		for (int i = openIndex; i < s.length(); i++) {
			char c = s.charAt(i);
			if (quote != 0) {
				if (c == '\\' && quote != '`') {
					i++;
				} else if (c == quote) {
					quote = 0;
				}
				continue;
			}
			if (c == '"' || c == '\'' || c == '`') {
				quote = c;
			} else if (c == '(' || c == '[' || c == '{') {
				depth++;
			} else if (c == ')' || c == ']' || c == '}') {
				depth--;
				if (depth == 0) {
					return i;
				}
			}
		}
		return -1;
	}

	/**
	 * Returns the index of the first c that is neither nested in brackets nor part of a literal, or -1.
	 */
	public static int indexOfTopLevel(String s, char c) {
		int depth = 0;
		char quote = 0;
		for (int i = 0; i < s.length(); i++) {
			char ch = s.charAt(i);
			if (quote != 0) {
				if (ch == '\\' && quote != '`') {
					i++;
				} else if (ch == quote) {
					quote = 0;
				}
				continue;
			}
			if (ch == c && depth == 0) {
				return i;
			}
			if (ch == '"' || ch == '\'' || ch == '`') {
				quote = ch;
			} else if (ch == '(' || ch == '[' || ch == '{') {
				depth++;
			} else if (ch == ')' || ch == ']' || ch == '}') {
				depth--;
			}
		}
		return -1;
	}

	/**
	 * Splits s on every separator that is neither nested in brackets nor part of a literal. Parts are trimmed; an
	 * all-blank input yields an empty list.
	 */
	public static List<String> splitTopLevel(String s, char separator) {
		if (s.trim().isEmpty()) {
			return Collections.emptyList();
		}
		List<String> parts = new ArrayList<>();
		int depth = 0;
		char quote = 0;
		int start = 0;
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if (quote != 0) {
				if (c == '\\' && quote != '`') {
					i++;
				} else if (c == quote) {
					quote = 0;
				}
				continue;
			}
			if (c == '"' || c == '\'' || c == '`') {
				quote = c;
			} else if (c == '(' || c == '[' || c == '{') {
				depth++;
			} else if (c == ')' || c == ']' || c == '}') {
				depth--;
			} else if (c == separator && depth == 0) {
				parts.add(s.substring(start, i).trim());
				start = i + 1;
			}
		}
		parts.add(s.substring(start).trim());
		return parts;
	}

	/**
	 * Returns the index of the top-level assignment operator's '=' (covering "=", ":=" and compound forms such as
	 * "+="), skipping comparisons ("==", "!=", "<=", ">="), or -1 if the text is not an assignment.
	 */
	public static int indexOfAssignment(String s) {
		int depth = 0;
		char quote = 0;
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if (quote != 0) {
				if (c == '\\' && quote != '`') {
					i++;
				} else if (c == quote) {
					quote = 0;
				}
				continue;
			}
			if (c == '"' || c == '\'' || c == '`') {
				quote = c;
			} else if (c == '(' || c == '[' || c == '{') {
				depth++;
			} else if (c == ')' || c == ']' || c == '}') {
				depth--;
			} else if (c == '=' && depth == 0) {
				char next = i + 1 < s.length() ? s.charAt(i + 1) : 0;
				if (next == '=') {
					i++;
					continue;
				}
				char prev = i > 0 ? s.charAt(i - 1) : 0;
				if (prev == '!' || prev == '=') {
					continue;
				}
				if ((prev == '<' || prev == '>') && !(i > 1 && s.charAt(i - 2) == prev)) {
					// "<=" and ">=" compare, "<<=" and ">>=" assign
					continue;
				}
				return i;
			}
		}
		return -1;
	}

	/**
	 * Returns the index where a trailing // comment starts, or -1 if the line has none outside of literals.
	 */
	public static int indexOfLineComment(String s) {
		char quote = 0;
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if (quote != 0) {
				if (c == '\\' && quote != '`') {
					i++;
				} else if (c == quote) {
					quote = 0;
				}
				continue;
			}
			if (c == '"' || c == '\'' || c == '`') {
				quote = c;
			} else if (c == '/' && i + 1 < s.length() && s.charAt(i + 1) == '/') {
				return i;
			}
		}
		return -1;
	}

	/**
	 * Counts occurrences of c that are not part of a string, character or raw literal.
	 */
	public static int countOutsideLiterals(String s, char c) {
		int count = 0;
		char quote = 0;
		for (int i = 0; i < s.length(); i++) {
			char ch = s.charAt(i);
			if (quote != 0) {
				if (ch == '\\' && quote != '`') {
					i++;
				} else if (ch == quote) {
					quote = 0;
				}
				continue;
			}
			if (ch == '"' || ch == '\'' || ch == '`') {
				quote = ch;
			} else if (ch == c) {
				count++;
			}
		}
		return count;
	}

	/**
	 * Applies rewrite to every stretch of s that lies outside string, character and raw literals, leaving literal
	 * text untouched.
	 */
	public static String rewriteOutsideLiterals(String s, UnaryOperator<String> rewrite) {
		StringBuilder result = new StringBuilder();
		StringBuilder code = new StringBuilder();
		char quote = 0;
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if (quote != 0) {
				result.append(c);
				if (c == '\\' && quote != '`' && i + 1 < s.length()) {
					result.append(s.charAt(++i));
				} else if (c == quote) {
					quote = 0;
				}
				continue;
			}
			if (c == '"' || c == '\'' || c == '`') {
				result.append(rewrite.apply(code.toString()));
				code.setLength(0);
				quote = c;
				result.append(c);
			} else {
				code.append(c);
			}
		}
		result.append(rewrite.apply(code.toString()));
		return result.toString();
	}

	/**
	 * True when s is exactly one double-quoted string literal.
	 */
	public static boolean isStringLiteral(String s) {
		if (s.length() < 2 || s.charAt(0) != '"' || s.charAt(s.length() - 1) != '"') {
			return false;
		}
		for (int i = 1; i < s.length() - 1; i++) {
			char c = s.charAt(i);
			if (c == '\\') {
				i++;
			} else if (c == '"') {
				return false;
			}
		}
		// a trailing escaped quote ("abc\") does not close the literal
		int backslashes = 0;
		for (int i = s.length() - 2; i > 0 && s.charAt(i) == '\\'; i--) {
			backslashes++;
		}
		return backslashes % 2 == 0;
	}

	public static boolean isNumberLiteral(String s) {
		return NUMBER_LITERAL.matcher(s).matches();
	}

	public static boolean isIdentifier(String s) {
		return IDENTIFIER.matcher(s).matches();
	}

	/**
	 * Returns the last character of s, or 0 for the empty string.
	 */
	public static char lastChar(String s) {
		return s.isEmpty() ? 0 : s.charAt(s.length() - 1);
	}

	/**
	 * Removes at most one occurrence of suffix from the end of s, then trims.
	 */
	public static String trimSuffix(String s, String suffix) {
		if (s.endsWith(suffix)) {
			return s.substring(0, s.length() - suffix.length()).trim();
		}
		return s.trim();
	}
}
