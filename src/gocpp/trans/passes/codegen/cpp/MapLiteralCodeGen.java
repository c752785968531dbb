package gocpp.trans.passes.codegen.cpp;

import gocpp.model.type.TypeMapper;
import gocpp.trans.intermediate.ConstructResult;
import gocpp.trans.intermediate.UnrecognizedDeclarationIssue;
import gocpp.util.Substrings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Translates map literals into std::unordered_map initializers. A literal that closes on its own line becomes a
 * single declaration; one that stays open starts a map literal block whose entry lines are converted one by one
 * until the closing brace.
 */
public final class MapLiteralCodeGen {
	public static final String MAP_PREFIX = "map[";
	public static final String CPP_MAP = "std::unordered_map";

	private static final String KIND = "map literal";

	private MapLiteralCodeGen() {}

	/**
	 * @param name  the declared identifier
	 * @param right the right-hand side, starting with "map["
	 */
	public static ConstructResult declare(String name, String right, String line) {
		int keyClose = Substrings.matchingClose(right, MAP_PREFIX.length() - 1);
		int open = keyClose == -1 ? -1 : right.indexOf('{', keyClose);
		if (open == -1) {
			throw new UnrecognizedDeclarationIssue(KIND, line);
		}
		String keyType = TypeMapper.map(right.substring(MAP_PREFIX.length(), keyClose));
		String valueType = TypeMapper.map(right.substring(keyClose + 1, open));
		String declaration = mapType(keyType, valueType) + " " + name;
		List<String> names = Collections.singletonList(name);

		int close = Substrings.matchingClose(right, open);
		if (close == -1) {
			String entries = Substrings.trimSuffix(right.substring(open + 1).trim(), ",");
			String text = declaration + "{";
			if (!entries.isEmpty()) {
				text += "\n" + pairs(entries, line) + ",";
			}
			return ConstructResult.declaring(text, names)
					.with(ConstructResult.Advisory.MAP_DECLARED)
					.with(ConstructResult.Advisory.MAP_LITERAL_OPENED);
		}
		if (!right.substring(close + 1).trim().isEmpty()) {
			throw new UnrecognizedDeclarationIssue(KIND, line);
		}
		String entries = right.substring(open + 1, close);
		return ConstructResult.declaring(declaration + "{" + pairs(entries, line) + "}", names)
				.with(ConstructResult.Advisory.MAP_DECLARED);
	}

	/**
	 * Converts one line inside an open map literal block.
	 *
	 * @param closing whether this line closes the literal
	 */
	public static ConstructResult entryLine(String line, boolean closing) {
		String entries = line;
		if (closing) {
			int brace = line.lastIndexOf('}');
			entries = line.substring(0, brace).trim();
			if (!line.substring(brace + 1).trim().isEmpty()) {
				throw new UnrecognizedDeclarationIssue(KIND, line);
			}
		}
		entries = Substrings.trimSuffix(entries, ",");
		StringBuilder out = new StringBuilder();
		if (!entries.isEmpty()) {
			out.append(pairs(entries, line)).append(",");
		}
		if (closing) {
			if (out.length() > 0) {
				out.append("\n");
			}
			out.append("};");
		}
		if (out.length() == 0) {
			return ConstructResult.consumed();
		}
		return ConstructResult.of(out.toString());
	}

	public static String mapType(String keyType, String valueType) {
		return CPP_MAP + "<" + keyType + ", " + valueType + ">";
	}

	/**
	 * Turns Go map entries ("a": 1, "b": 2) into C++ pair initializers ({"a", 1}, {"b", 2}), keeping their order.
	 */
	public static String pairs(String entries, String line) {
		List<String> pairs = new ArrayList<>();
		for (String entry : Substrings.splitTopLevel(entries, ',')) {
			if (entry.isEmpty()) {
				continue;
			}
			int colon = Substrings.indexOfTopLevel(entry, ':');
			if (colon == -1) {
				throw new UnrecognizedDeclarationIssue(KIND, line);
			}
			pairs.add("{" + entry.substring(0, colon).trim() + ", " + entry.substring(colon + 1).trim() + "}");
		}
		return String.join(", ", pairs);
	}
}
