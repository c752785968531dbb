package gocpp.trans.passes.codegen.cpp;

import gocpp.model.type.TypeMapper;
import gocpp.trans.intermediate.ConstructResult;
import gocpp.trans.intermediate.TranslationContext;
import gocpp.util.Substrings;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Translates short variable declarations, plain and tuple assignments and return statements.
 */
public final class AssignmentCodeGen {
	private static final String DISCARD = "_";
	private static final String IGNORE = "std::ignore";
	private static final Pattern APPEND = Pattern.compile("append\\((.*)\\)");

	private AssignmentCodeGen() {}

	/**
	 * @return whether the line is an assignment of any kind (":=", "=", compound) or an increment
	 */
	public static boolean isAssignment(String line) {
		return Substrings.indexOfAssignment(line) != -1;
	}

	public static ConstructResult transform(String line) {
		int assign = Substrings.indexOfAssignment(line);
		char operator = assign > 0 ? line.charAt(assign - 1) : 0;
		if (operator == ':') {
			return shortDeclaration(line.substring(0, assign - 1).trim(), line.substring(assign + 1).trim(), line);
		}
		if ("+-*/%&|^<>".indexOf(operator) != -1) {
			// compound assignment, same spelling in C++
			return ConstructResult.of(line);
		}
		List<String> targets = Substrings.splitTopLevel(line.substring(0, assign), ',');
		String right = line.substring(assign + 1).trim();
		if (targets.size() > 1) {
			return ConstructResult.of(tupleAssignment(targets, right));
		}
		String target = targets.get(0);
		if (target.equals(DISCARD)) {
			return ConstructResult.of("static_cast<void>(" + right + ")");
		}
		String appended = appendStatement(target, right);
		if (appended != null) {
			return ConstructResult.of(appended);
		}
		return ConstructResult.of(target + " = " + DeclarationCodeGen.compositeValue(right));
	}

	private static ConstructResult shortDeclaration(String left, String right, String line) {
		List<String> names = Substrings.splitTopLevel(left, ',');
		if (names.size() == 1) {
			return DeclarationCodeGen.valueDeclaration(names.get(0), right, line);
		}
		List<String> values = Substrings.splitTopLevel(right, ',');
		if (values.size() != names.size()) {
			// a call returning several values
			List<String> bound = new ArrayList<>();
			for (int i = 0; i < names.size(); i++) {
				bound.add(names.get(i).equals(DISCARD) ? LoopCodeGen.DISCARDED_VALUE + i : names.get(i));
			}
			return ConstructResult.declaring("auto [" + String.join(", ", bound) + "] = " + right, names);
		}
		List<String> statements = new ArrayList<>();
		List<String> declared = new ArrayList<>();
		List<String> mapNames = new ArrayList<>();
		ConstructResult last = ConstructResult.consumed();
		for (int i = 0; i < names.size(); i++) {
			if (names.get(i).equals(DISCARD)) {
				statements.add("static_cast<void>(" + values.get(i) + ")");
				last = ConstructResult.consumed();
				continue;
			}
			last = DeclarationCodeGen.valueDeclaration(names.get(i), values.get(i), line);
			if (last.has(ConstructResult.Advisory.MAP_DECLARED)) {
				mapNames.add(names.get(i));
			}
			statements.add(last.getText());
			declared.add(names.get(i));
		}
		return DeclarationCodeGen.combine(statements, declared, mapNames, last);
	}

	private static String tupleAssignment(List<String> targets, String right) {
		String tied = targets.stream().map(t -> t.equals(DISCARD) ? IGNORE : t).collect(Collectors.joining(", "));
		List<String> values = Substrings.splitTopLevel(right, ',');
		String source = values.size() == targets.size() ?
				"std::make_tuple(" + String.join(", ", values) + ")" : right;
		return "std::tie(" + tied + ") = " + source;
	}

	/**
	 * Turns "xs = append(xs, a, b)" into one push_back per appended value, or returns null for anything else.
	 */
	static String appendStatement(String target, String right) {
		Matcher m = APPEND.matcher(right);
		if (!m.matches()) {
			return null;
		}
		List<String> args = Substrings.splitTopLevel(m.group(1), ',');
		if (args.size() < 2 || !args.get(0).equals(target) || args.get(args.size() - 1).endsWith("...")) {
			return null;
		}
		List<String> pushes = new ArrayList<>();
		for (String value : args.subList(1, args.size())) {
			pushes.add(target + ".push_back(" + value + ")");
		}
		return String.join(";\n", pushes);
	}

	/**
	 * Translates a return statement. Several results are wrapped into the tuple the function returns; a bare return
	 * from the entry point reports success.
	 */
	public static ConstructResult returnStatement(TranslationContext ctx, String line) {
		String expression = line.substring("return".length()).trim();
		if (expression.isEmpty()) {
			return ConstructResult.of(ctx.inEntryPoint() ? "return 0" : "return");
		}
		List<String> values = Substrings.splitTopLevel(expression, ',');
		String returnType = ctx.getReturnType();
		if (values.size() > 1 && TypeMapper.isTuple(returnType)) {
			return ConstructResult.of("return " + returnType + "{" + String.join(", ", values) + "}");
		}
		if (values.size() > 1) {
			return ConstructResult.of("return std::make_tuple(" + String.join(", ", values) + ")");
		}
		return ConstructResult.of("return " + DeclarationCodeGen.compositeValue(expression));
	}
}
