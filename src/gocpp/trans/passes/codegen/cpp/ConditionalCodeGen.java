package gocpp.trans.passes.codegen.cpp;

import gocpp.trans.intermediate.ConstructResult;
import gocpp.trans.intermediate.UnsupportedFeatureIssue;
import gocpp.util.Substrings;

import java.util.List;

public final class ConditionalCodeGen {

	private ConditionalCodeGen() {}

	public static ConstructResult ifHeader(String line) {
		return ConstructResult.of("if (" + condition(line, "if") + ") {");
	}

	public static ConstructResult elseIfHeader(String line) {
		return ConstructResult.of("} else if (" + condition(line, "} else if") + ") {");
	}

	private static String condition(String line, String keyword) {
		int brace = line.lastIndexOf('{');
		if (brace < keyword.length()) {
			throw new UnsupportedFeatureIssue("condition spanning several lines", line);
		}
		String header = line.substring(keyword.length(), brace).trim();
		int semicolon = Substrings.indexOfTopLevel(header, ';');
		if (semicolon == -1) {
			return header;
		}
		// if init; cond {  maps onto the C++17 if statement with initializer
		return initStatement(header.substring(0, semicolon).trim()) + "; " + header.substring(semicolon + 1).trim();
	}

	static String initStatement(String init) {
		int assign = Substrings.indexOfAssignment(init);
		if (assign < 1 || init.charAt(assign - 1) != ':') {
			return init;
		}
		String left = init.substring(0, assign - 1).trim();
		String right = init.substring(assign + 1).trim();
		List<String> names = Substrings.splitTopLevel(left, ',');
		if (names.size() > 1) {
			return "auto [" + String.join(", ", names) + "] = " + right;
		}
		return "auto " + left + " = " + right;
	}
}
