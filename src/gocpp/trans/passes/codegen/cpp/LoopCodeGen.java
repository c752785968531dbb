package gocpp.trans.passes.codegen.cpp;

import gocpp.trans.intermediate.ConstructResult;
import gocpp.trans.intermediate.SymbolFacts;
import gocpp.trans.intermediate.TranslationContext;
import gocpp.trans.intermediate.UnimplementedLoopFormIssue;
import gocpp.trans.intermediate.UnsupportedFeatureIssue;
import gocpp.util.Substrings;

import java.util.Collections;
import java.util.List;

/**
 * Translates every form of Go loop header.
 *
 * Range loops over identifiers registered as maps iterate the std::unordered_map directly with structured bindings.
 * Range loops over anything else are treated as sequences: an index loop when the index is used, element iteration
 * when it is discarded. Discarded bindings get hidden names, since "_" can only be bound once per C++ declaration.
 */
public final class LoopCodeGen {
	public static final String DISCARDED_KEY = "_k__";
	public static final String DISCARDED_VALUE = "_v__";
	public static final String DISCARDED_INDEX = "_i__";

	private static final String RANGE = "range";
	private static final String DISCARD = "_";

	private LoopCodeGen() {}

	public static ConstructResult transform(TranslationContext ctx, String line) {
		int brace = line.lastIndexOf('{');
		if (brace < "for".length()) {
			throw new UnsupportedFeatureIssue("loop header spanning several lines", line);
		}
		String header = line.substring("for".length(), brace).trim();
		if (header.isEmpty()) {
			return ConstructResult.of("for (;;) {");
		}

		if (header.equals(RANGE) || header.startsWith(RANGE + " ")) {
			return ConstructResult.of(rangeLoop(ctx.getSymbols(), line, Collections.emptyList(), true,
					header.substring(RANGE.length()).trim()));
		}
		int assign = Substrings.indexOfAssignment(header);
		if (assign != -1) {
			boolean declaring = assign > 0 && header.charAt(assign - 1) == ':';
			String right = header.substring(assign + 1).trim();
			if (right.startsWith(RANGE + " ")) {
				String left = header.substring(0, declaring ? assign - 1 : assign).trim();
				return ConstructResult.of(rangeLoop(ctx.getSymbols(), line, Substrings.splitTopLevel(left, ','),
						declaring, right.substring(RANGE.length()).trim()));
			}
		}

		if (Substrings.indexOfTopLevel(header, ';') != -1) {
			int declare = header.indexOf(":=");
			if (declare != -1) {
				header = "auto " + header.substring(0, declare).trim() + " = " + header.substring(declare + 2).trim();
			}
			return ConstructResult.of("for (" + header + ") {");
		}
		// condition-only loop
		return ConstructResult.of("for (; " + header + ";) {");
	}

	private static String rangeLoop(SymbolFacts symbols, String line, List<String> vars, boolean declaring,
	                                String source) {
		if (vars.size() > 2) {
			throw new UnimplementedLoopFormIssue("range loop binding more than two variables", line);
		}
		if (!declaring && vars.stream().anyMatch(v -> !v.equals(DISCARD))) {
			throw new UnimplementedLoopFormIssue("range loop assigning to variables declared outside the loop", line);
		}
		String first = vars.isEmpty() ? DISCARD : vars.get(0);
		String second = vars.size() < 2 ? null : vars.get(1);

		if (Substrings.isNumberLiteral(source)) {
			if (second != null) {
				throw new UnimplementedLoopFormIssue("range over an integer binds a single variable", line);
			}
			String index = first.equals(DISCARD) ? DISCARDED_INDEX : first;
			return "for (int " + index + " = 0; " + index + " < " + source + "; " + index + "++) {";
		}

		if (symbols.isMap(source)) {
			String key = first.equals(DISCARD) ? DISCARDED_KEY : first;
			String value = second == null || second.equals(DISCARD) ? DISCARDED_VALUE : second;
			return "for (auto [" + key + ", " + value + "] : " + source + ") {";
		}

		if (first.equals(DISCARD)) {
			String element = second == null || second.equals(DISCARD) ? DISCARDED_VALUE : second;
			return "for (auto " + element + " : " + source + ") {";
		}
		String header = "for (std::size_t " + first + " = 0; " + first + " < std::size(" + source + "); " +
				first + "++) {";
		if (second == null || second.equals(DISCARD)) {
			return header;
		}
		return header + "\nauto " + second + " = " + source + "[" + first + "];";
	}
}
