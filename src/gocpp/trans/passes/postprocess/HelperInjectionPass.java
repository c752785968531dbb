package gocpp.trans.passes.postprocess;

import gocpp.trans.intermediate.TranslatedUnit;
import gocpp.trans.passes.codegen.cpp.DeclarationCodeGen;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Prepends the definitions of the helper functions the translated body calls: the strings package replacements and
 * the generic formatting helper used for printing and struct string conversion.
 */
public class HelperInjectionPass {
	private static final Logger logger = Logger.getLogger("GoCpp Stage PostProcess");

	static final Map<String, String> STRING_HELPERS = new LinkedHashMap<>();

	static {
		STRING_HELPERS.put("stringsContains",
				"inline auto stringsContains(std::string const& s, std::string const& sub) -> bool\n" +
				"{\n" +
				"    return s.find(sub) != std::string::npos;\n" +
				"}");
		STRING_HELPERS.put("stringsHasPrefix",
				"inline auto stringsHasPrefix(std::string const& s, std::string const& prefix) -> bool\n" +
				"{\n" +
				"    return s.rfind(prefix, 0) == 0;\n" +
				"}");
		STRING_HELPERS.put("stringsHasSuffix",
				"inline auto stringsHasSuffix(std::string const& s, std::string const& suffix) -> bool\n" +
				"{\n" +
				"    return s.size() >= suffix.size() &&\n" +
				"        s.compare(s.size() - suffix.size(), suffix.size(), suffix) == 0;\n" +
				"}");
		STRING_HELPERS.put("stringsTrimSpace",
				"inline auto stringsTrimSpace(std::string const& s) -> std::string\n" +
				"{\n" +
				"    auto start = s.find_first_not_of(\" \\t\\n\\r\\f\\v\");\n" +
				"    if (start == std::string::npos) {\n" +
				"        return \"\";\n" +
				"    }\n" +
				"    auto end = s.find_last_not_of(\" \\t\\n\\r\\f\\v\");\n" +
				"    return s.substr(start, end - start + 1);\n" +
				"}");
		STRING_HELPERS.put("stringsIndex",
				"inline auto stringsIndex(std::string const& s, std::string const& sub) -> int\n" +
				"{\n" +
				"    auto pos = s.find(sub);\n" +
				"    return pos == std::string::npos ? -1 : static_cast<int>(pos);\n" +
				"}");
	}

	static final String STRING_CONVERSION_TRAIT =
			"template <typename T, typename = void>\n" +
			"struct _has_to_string : std::false_type {\n" +
			"};\n" +
			"\n" +
			"template <typename T>\n" +
			"struct _has_to_string<T, std::void_t<decltype(std::declval<T const&>()." +
			DeclarationCodeGen.STRING_METHOD + "())>> : std::true_type {\n" +
			"};";

	private HelperInjectionPass() {}

	public static String perform(TranslatedUnit unit) {
		String body = unit.getBody();
		List<String> helpers = new ArrayList<>();
		for (Map.Entry<String, String> helper : STRING_HELPERS.entrySet()) {
			if (calls(body, helper.getKey())) {
				helpers.add(helper.getValue());
			}
		}
		if (unit.isFormatHelperRequired() || calls(body, DeclarationCodeGen.FORMAT_HELPER)) {
			boolean structs = !unit.getStructs().isEmpty();
			if (structs) {
				helpers.add(STRING_CONVERSION_TRAIT);
			}
			helpers.add(formatHelper(structs));
		}
		if (helpers.isEmpty()) {
			return body;
		}
		logger.fine("injecting " + helpers.size() + " helper definition(s)");
		return String.join("\n\n", helpers) + "\n\n" + body;
	}

	private static boolean calls(String body, String function) {
		return Pattern.compile("(?<![\\w.:])" + Pattern.quote(function) + "\\(").matcher(body).find();
	}

	/**
	 * The generic formatting helper. Bools print as words and one-byte integers as numbers; with struct support,
	 * values with a string conversion method print through it and pointers to them get a leading "&", or print
	 * as &lt;nil&gt; when null.
	 */
	static String formatHelper(boolean structs) {
		StringBuilder out = new StringBuilder();
		out.append("template <typename T>\n");
		out.append("void ").append(DeclarationCodeGen.FORMAT_HELPER).append("(std::ostream& out, T x)\n");
		out.append("{\n");
		out.append("    if constexpr (std::is_same<T, bool>::value) {\n");
		out.append("        out << std::boolalpha << x << std::noboolalpha;\n");
		out.append("    } else if constexpr (std::is_integral<T>::value && sizeof(T) == 1) {\n");
		out.append("        out << static_cast<int>(x);\n");
		if (structs) {
			String method = DeclarationCodeGen.STRING_METHOD;
			out.append("    } else if constexpr (_has_to_string<T>::value) {\n");
			out.append("        out << x.").append(method).append("();\n");
			out.append("    } else if constexpr (std::is_pointer<T>::value &&\n");
			out.append("        _has_to_string<std::remove_pointer_t<T>>::value) {\n");
			out.append("        if (x == nullptr) {\n");
			out.append("            out << \"<nil>\";\n");
			out.append("        } else {\n");
			out.append("            out << \"&\" << x->").append(method).append("();\n");
			out.append("        }\n");
		}
		out.append("    } else {\n");
		out.append("        out << x;\n");
		out.append("    }\n");
		out.append("}");
		return out.toString();
	}
}
