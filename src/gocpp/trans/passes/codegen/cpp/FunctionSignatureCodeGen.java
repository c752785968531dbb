package gocpp.trans.passes.codegen.cpp;

import gocpp.model.type.TypeMapper;
import gocpp.trans.intermediate.ConstructResult;
import gocpp.trans.intermediate.SymbolFacts;
import gocpp.trans.intermediate.TranslationContext;
import gocpp.trans.intermediate.UnsupportedFeatureIssue;
import gocpp.util.Substrings;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Translates a Go function header into a C++ function with a trailing return type:
 *
 * <pre>
 * func divmod(a, b int) (int, int) {   =>   auto divmod(int a, int b) -> std::tuple&lt;int, int&gt; {
 * </pre>
 *
 * The entry point always returns the process exit status type.
 */
public final class FunctionSignatureCodeGen {

	private FunctionSignatureCodeGen() {}

	public static ConstructResult transform(TranslationContext ctx, String line) {
		String rest = line.substring("func".length()).trim();
		if (rest.startsWith("(")) {
			throw new UnsupportedFeatureIssue("methods with receivers", line);
		}
		if (!rest.endsWith("{")) {
			throw new UnsupportedFeatureIssue("function body must open on the signature line", line);
		}
		rest = Substrings.trimSuffix(rest, "{");
		int open = rest.indexOf('(');
		int close = open == -1 ? -1 : Substrings.matchingClose(rest, open);
		if (close == -1) {
			throw new UnsupportedFeatureIssue("function signature spanning several lines", line);
		}
		String name = Substrings.between(rest, "", "(").trim();
		String parameters = parameterList(rest.substring(open + 1, close), ctx.getSymbols());
		String results = rest.substring(close + 1).trim();
		List<String> returns = returnTypes(results);
		if (results.startsWith("(")) {
			String inner = results.substring(1, Math.max(1, Substrings.matchingClose(results, 0)));
			if (Substrings.splitTopLevel(inner, ',').stream().anyMatch(p -> p.indexOf(' ') != -1)) {
				// named results are variables of the body like parameters
				parameterList(inner, ctx.getSymbols());
			}
		}

		String returnType;
		if (TranslationContext.ENTRY_POINT.equals(name)) {
			returnType = TypeMapper.EXIT_STATUS_TYPE;
		} else if (returns.isEmpty()) {
			returnType = "void";
		} else if (returns.size() == 1) {
			returnType = TypeMapper.map(returns.get(0));
		} else {
			returnType = TypeMapper.tupleOf(returns);
		}
		ctx.enterFunction(name, returnType);
		return ConstructResult.of("auto " + name + "(" + parameters + ") -> " + returnType + " {");
	}

	/**
	 * Turns Go parameters ("a, b int, s string") into C++ ones ("int a, int b, std::string s"). A parameter without
	 * a type takes the type of the next typed parameter to its right.
	 */
	public static String parameterList(String goParameters) {
		return parameterList(goParameters, new SymbolFacts());
	}

	/**
	 * Like {@link #parameterList(String)}, registering the map-typed parameters as maps.
	 */
	public static String parameterList(String goParameters, SymbolFacts symbols) {
		List<String> parts = Substrings.splitTopLevel(goParameters, ',');
		String[] cpp = new String[parts.size()];
		String currentType = "";
		for (int i = parts.size() - 1; i >= 0; i--) {
			String part = parts.get(i);
			int space = part.indexOf(' ');
			String name;
			if (space != -1) {
				name = part.substring(0, space).trim();
				currentType = TypeMapper.map(part.substring(space + 1));
			} else {
				name = part;
			}
			if (currentType.startsWith(MapLiteralCodeGen.CPP_MAP + "<")) {
				symbols.registerMap(name);
			}
			cpp[i] = currentType.isEmpty() ? name : currentType + " " + name;
		}
		return String.join(", ", cpp);
	}

	/**
	 * @return the Go types of the results declared after a parameter list, in order
	 */
	public static List<String> returnTypes(String goResults) {
		if (goResults.isEmpty()) {
			return Collections.emptyList();
		}
		if (!goResults.startsWith("(")) {
			return Collections.singletonList(goResults);
		}
		int close = Substrings.matchingClose(goResults, 0);
		List<String> parts = Substrings.splitTopLevel(
				goResults.substring(1, close == -1 ? goResults.length() : close), ',');
		boolean named = parts.stream().anyMatch(p -> p.indexOf(' ') != -1);
		if (!named) {
			return parts;
		}
		// named results: "x, y int, err error" shares types right to left like parameters
		String[] types = new String[parts.size()];
		String currentType = "";
		for (int i = parts.size() - 1; i >= 0; i--) {
			String part = parts.get(i);
			int space = part.indexOf(' ');
			if (space != -1) {
				currentType = part.substring(space + 1).trim();
			}
			types[i] = currentType;
		}
		return new ArrayList<>(Arrays.asList(types));
	}
}
