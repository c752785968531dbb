package gocpp.trans.passes.postprocess;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Adds one #include line per standard header whose symbols the unit uses. Headers are emitted in sorted order and
 * each at most once.
 */
public class IncludeAggregationPass {

	static final Map<Pattern, String> HEADERS = new LinkedHashMap<>();

	static {
		header("std::array", "array");
		header("std::exit", "cstdlib");
		header("std::printf", "cstdio");
		header("std::size_t", "cstddef");
		header("std::u?int(8|16|32|64|ptr)_t", "cstdint");
		header("std::hash", "functional");
		header("std::(cout|cerr|endl|flush|boolalpha|noboolalpha)", "iostream");
		header("std::ostream", "ostream");
		header("std::size", "iterator");
		header("std::stringstream", "sstream");
		header("std::string", "string");
		header("std::(tuple|tie|ignore|make_tuple)", "tuple");
		header("std::(is_same|is_integral|is_pointer|remove_pointer_t|void_t|false_type|true_type)", "type_traits");
		header("std::unordered_map", "unordered_map");
		header("std::declval", "utility");
		header("std::vector", "vector");
	}

	private static void header(String symbol, String header) {
		HEADERS.put(Pattern.compile("(?<![\\w:])" + symbol + "(?!\\w)"), header);
	}

	private IncludeAggregationPass() {}

	public static String perform(String source) {
		Set<String> includes = new TreeSet<>();
		for (Map.Entry<Pattern, String> entry : HEADERS.entrySet()) {
			if (entry.getKey().matcher(source).find()) {
				includes.add(entry.getValue());
			}
		}
		if (includes.isEmpty()) {
			return source;
		}
		StringBuilder out = new StringBuilder();
		for (String include : includes) {
			out.append("#include <").append(include).append(">\n");
		}
		return out.append("\n").append(source).toString();
	}
}
