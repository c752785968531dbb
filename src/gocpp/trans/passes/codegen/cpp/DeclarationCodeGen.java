package gocpp.trans.passes.codegen.cpp;

import gocpp.model.type.TypeMapper;
import gocpp.trans.intermediate.ConstructResult;
import gocpp.trans.intermediate.TranslationContext;
import gocpp.trans.intermediate.UnrecognizedDeclarationIssue;
import gocpp.trans.intermediate.UnsupportedFeatureIssue;
import gocpp.util.Substrings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates var, const and type declarations, including struct bodies and auto-increment (iota) constant blocks.
 */
public final class DeclarationCodeGen {
	public static final String STRING_METHOD = "_to_string";
	public static final String FORMAT_HELPER = "_format_output";

	private static final Pattern IOTA = Pattern.compile("(?<![\\w.])iota(?!\\w)");
	private static final Pattern ADDRESS_OF_LITERAL = Pattern.compile("&\\s*([A-Za-z_][\\w.]*)\\s*\\{.*");
	private static final Pattern MAKE = Pattern.compile("make\\((.*)\\)");

	private DeclarationCodeGen() {}

	/**
	 * The names and optional type on the left of a declaration, e.g. "a, b int".
	 */
	static class DeclaredNames {
		final List<String> names;
		final String goType;

		DeclaredNames(List<String> names, String goType) {
			this.names = names;
			this.goType = goType;
		}
	}

	static DeclaredNames declaredNames(String left, String kind, String line) {
		List<String> parts = Substrings.splitTopLevel(left, ',');
		if (parts.isEmpty()) {
			throw new UnrecognizedDeclarationIssue(kind, line);
		}
		List<String> names = new ArrayList<>(parts);
		String last = names.get(names.size() - 1);
		String goType = null;
		int space = last.indexOf(' ');
		if (space != -1) {
			goType = last.substring(space + 1).trim();
			names.set(names.size() - 1, last.substring(0, space));
		}
		for (String name : names) {
			if (!Substrings.isIdentifier(name)) {
				throw new UnrecognizedDeclarationIssue(kind, line);
			}
		}
		return new DeclaredNames(names, goType);
	}

	/**
	 * Translates the body of a var declaration ("x int", "x = 1", "x int = 1", "a, b int").
	 */
	public static ConstructResult varDeclaration(String body, String line) {
		int assign = Substrings.indexOfAssignment(body);
		if (assign == -1) {
			DeclaredNames declared = declaredNames(body, "var", line);
			if (declared.goType == null) {
				throw new UnrecognizedDeclarationIssue("var", line);
			}
			return zeroValued(declared);
		}
		if (assign > 0 && body.charAt(assign - 1) == ':') {
			throw new UnrecognizedDeclarationIssue("var", line);
		}
		DeclaredNames declared = declaredNames(body.substring(0, assign).trim(), "var", line);
		String right = body.substring(assign + 1).trim();
		List<String> values = Substrings.splitTopLevel(right, ',');
		if (values.size() != declared.names.size()) {
			throw new UnrecognizedDeclarationIssue("var", line);
		}
		List<String> statements = new ArrayList<>();
		List<String> mapNames = new ArrayList<>();
		ConstructResult last = null;
		for (int i = 0; i < values.size(); i++) {
			String name = declared.names.get(i);
			if (declared.goType == null) {
				last = valueDeclaration(name, values.get(i), line);
			} else {
				last = typedDeclaration(name, declared.goType, values.get(i));
			}
			if (last.has(ConstructResult.Advisory.MAP_DECLARED)) {
				mapNames.add(name);
			}
			statements.add(last.getText());
		}
		return combine(statements, declared.names, mapNames, last);
	}

	/**
	 * Translates one field of an open struct body. Struct tags are dropped.
	 */
	public static ConstructResult fieldDeclaration(String body, String line) {
		String field = body;
		int tag = field.indexOf('"');
		if (tag != -1) {
			field = field.substring(0, tag).trim();
		}
		DeclaredNames declared = declaredNames(field, "struct field", line);
		if (declared.goType == null) {
			throw new UnsupportedFeatureIssue("embedded struct fields", line);
		}
		return zeroValued(declared);
	}

	private static ConstructResult zeroValued(DeclaredNames declared) {
		String cppType = TypeMapper.map(declared.goType);
		List<String> statements = new ArrayList<>();
		for (String name : declared.names) {
			statements.add(cppType + " " + name + "{}");
		}
		ConstructResult result = ConstructResult.declaring(String.join(";\n", statements), declared.names);
		if (cppType.startsWith(MapLiteralCodeGen.CPP_MAP + "<")) {
			result = result.with(ConstructResult.Advisory.MAP_DECLARED);
		}
		return result;
	}

	private static ConstructResult typedDeclaration(String name, String goType, String value) {
		String cppType = TypeMapper.map(goType);
		String text = cppType + " " + name + " = " + compositeValue(value);
		ConstructResult result = ConstructResult.declaring(text, Collections.singletonList(name));
		if (cppType.startsWith(MapLiteralCodeGen.CPP_MAP + "<")) {
			result = result.with(ConstructResult.Advisory.MAP_DECLARED);
		}
		return result;
	}

	static ConstructResult combine(List<String> statements, List<String> names, List<String> mapNames,
	                               ConstructResult last) {
		ConstructResult result = ConstructResult.declaring(String.join(";\n", statements), names);
		if (!mapNames.isEmpty()) {
			if (mapNames.size() != names.size()) {
				result = ConstructResult.declaring(result.getText(), mapNames);
			}
			result = result.with(ConstructResult.Advisory.MAP_DECLARED);
		}
		if (last.has(ConstructResult.Advisory.MAP_LITERAL_OPENED)) {
			result = result.with(ConstructResult.Advisory.MAP_LITERAL_OPENED);
		}
		return result;
	}

	/**
	 * Declares name with the inferred type of a Go expression. Map literals, make calls, slice literals, string
	 * literals and addresses of struct literals get a C++ form of their own; everything else becomes auto.
	 */
	public static ConstructResult valueDeclaration(String name, String right, String line) {
		List<String> names = Collections.singletonList(name);
		if (right.startsWith(MapLiteralCodeGen.MAP_PREFIX)) {
			return MapLiteralCodeGen.declare(name, right, line);
		}
		Matcher make = MAKE.matcher(right);
		if (make.matches()) {
			List<String> args = Substrings.splitTopLevel(make.group(1), ',');
			String cppType = TypeMapper.map(args.get(0));
			ConstructResult result;
			if (args.size() > 1 && args.get(0).startsWith("[]")) {
				result = ConstructResult.declaring(cppType + " " + name + "(" + args.get(1) + ")", names);
			} else {
				result = ConstructResult.declaring(cppType + " " + name + "{}", names);
			}
			if (args.get(0).startsWith(MapLiteralCodeGen.MAP_PREFIX)) {
				result = result.with(ConstructResult.Advisory.MAP_DECLARED);
			}
			return result;
		}
		if (right.startsWith("[]") && right.endsWith("}")) {
			int open = Substrings.indexOfTopLevel(right.substring(2), '{') + 2;
			String cppType = TypeMapper.map(right.substring(0, open));
			return ConstructResult.declaring(cppType + " " + name + right.substring(open), names);
		}
		if (Substrings.isStringLiteral(right)) {
			return ConstructResult.declaring(TypeMapper.map("string") + " " + name + " = " + right, names);
		}
		return ConstructResult.declaring("auto " + name + " = " + compositeValue(right), names);
	}

	/**
	 * Converts expressions whose Go spelling has no C++ equivalent: slice literals and addresses of struct literals.
	 */
	static String compositeValue(String value) {
		if (value.startsWith("[]") && value.endsWith("}")) {
			int open = Substrings.indexOfTopLevel(value.substring(2), '{') + 2;
			return TypeMapper.map(value.substring(0, open)) + value.substring(open);
		}
		if (ADDRESS_OF_LITERAL.matcher(value).matches()) {
			return "new " + value.substring(1).trim();
		}
		return value;
	}

	/**
	 * Translates the body of a const declaration. Inside a const block, an entry assigning iota restarts the counter
	 * and bare entries repeat the last right-hand side with the next counter value.
	 */
	public static ConstructResult constDeclaration(TranslationContext ctx, String body, boolean inBlock, String line) {
		int assign = Substrings.indexOfAssignment(body);
		if (assign == -1) {
			String[] words = body.split("\\s+");
			if (!inBlock || !ctx.hasConstTemplate() || words.length > 2 || !Substrings.isIdentifier(words[0])) {
				throw new UnrecognizedDeclarationIssue("const", line);
			}
			String cppType = words.length == 2 ? TypeMapper.map(words[1]) : ctx.getConstType();
			String value = substituteIota(ctx.getConstTemplate(), ctx.nextIota());
			return constant(words[0], cppType, value);
		}
		String left = body.substring(0, assign).trim();
		String right = body.substring(assign + 1).trim();
		String[] words = left.split("\\s+");
		if (words.length > 2 || !Substrings.isIdentifier(words[0]) || right.isEmpty()) {
			throw new UnrecognizedDeclarationIssue("const", line);
		}
		String cppType = words.length == 2 ? TypeMapper.map(words[1]) : null;
		String value;
		if (IOTA.matcher(right).find()) {
			if (inBlock) {
				ctx.startIota(right, cppType);
				value = substituteIota(right, ctx.nextIota());
			} else {
				value = substituteIota(right, 0);
			}
		} else {
			if (inBlock) {
				ctx.repeatConst(right, cppType);
			}
			value = right;
		}
		if (cppType == null && Substrings.isStringLiteral(value)) {
			cppType = TypeMapper.map("string");
		}
		return constant(words[0], cppType, value);
	}

	private static ConstructResult constant(String name, String cppType, String value) {
		String text = "const " + (cppType == null ? "auto" : cppType) + " " + name + " = " + value;
		return ConstructResult.declaring(text, Collections.singletonList(name));
	}

	static String substituteIota(String template, int value) {
		return IOTA.matcher(template).replaceAll(Integer.toString(value));
	}

	/**
	 * Translates the body of a type declaration: an alias ("Celsius float64", "Name = string") or the opening of a
	 * struct ("Person struct {").
	 */
	public static ConstructResult typeDeclaration(TranslationContext ctx, String body, boolean inBlock, String line) {
		int assign = Substrings.indexOfAssignment(body);
		if (assign != -1) {
			String name = body.substring(0, assign).trim();
			String aliased = body.substring(assign + 1).trim();
			if (!Substrings.isIdentifier(name) || aliased.isEmpty()) {
				throw new UnrecognizedDeclarationIssue("type", line);
			}
			return alias(name, aliased);
		}
		int space = body.indexOf(' ');
		if (space == -1) {
			throw new UnrecognizedDeclarationIssue("type", line);
		}
		String name = body.substring(0, space);
		String definition = body.substring(space + 1).trim();
		if (!Substrings.isIdentifier(name)) {
			throw new UnrecognizedDeclarationIssue("type", line);
		}
		if (definition.startsWith("interface")) {
			throw new UnsupportedFeatureIssue("interface types", line);
		}
		if (!definition.startsWith("struct")) {
			return alias(name, definition);
		}
		String structBody = definition.substring("struct".length()).trim();
		List<String> names = Collections.singletonList(name);
		if (structBody.equals("{}")) {
			ctx.getSymbols().registerStruct(name);
			return ConstructResult.declaring(
					"class " + name + " {\npublic:\n" + stringMethod(new ArrayList<>()) + "\n};", names);
		}
		if (!structBody.equals("{")) {
			throw new UnrecognizedDeclarationIssue("type", line);
		}
		if (inBlock) {
			throw new UnsupportedFeatureIssue("struct declarations inside a type block", line);
		}
		ctx.getSymbols().registerStruct(name);
		ctx.setStructName(name);
		return ConstructResult.declaring("class " + name + " {\npublic:", names)
				.with(ConstructResult.Advisory.STRUCT_BODY_OPENED);
	}

	private static ConstructResult alias(String name, String goType) {
		return ConstructResult.declaring("using " + name + " = " + TypeMapper.map(goType) + ";",
				Collections.singletonList(name));
	}

	/**
	 * Closes the open struct body, adding the string conversion method that renders the collected fields the way
	 * Go prints a struct value ("{Alice 30}").
	 */
	public static ConstructResult structClose(TranslationContext ctx) {
		ctx.setStructName(null);
		return ConstructResult.of(stringMethod(ctx.getSymbols().getFields()) + "\n};");
	}

	static String stringMethod(List<String> fields) {
		StringBuilder out = new StringBuilder();
		out.append("std::string ").append(STRING_METHOD).append("() const {\n");
		out.append("std::stringstream _ss;\n");
		out.append("_ss << \"{\";\n");
		for (int i = 0; i < fields.size(); i++) {
			if (i > 0) {
				out.append("_ss << \" \";\n");
			}
			out.append(FORMAT_HELPER).append("(_ss, ").append(fields.get(i)).append(");\n");
		}
		out.append("_ss << \"}\";\n");
		out.append("return _ss.str();\n");
		out.append("}");
		return out.toString();
	}
}
