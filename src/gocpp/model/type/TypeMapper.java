package gocpp.model.type;

import gocpp.util.Substrings;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps Go type names onto the C++ types used for them in the generated code.
 *
 * Primitive names are looked up in a fixed table. Composite notations are mapped structurally: a pointer "*T" becomes
 * "T*", a slice "[]T" a std::vector, an array "[N]T" a std::array and "map[K]V" a std::unordered_map. Names the table
 * does not know (user defined types) are returned unchanged.
 */
public final class TypeMapper {

	public static final String TUPLE_TYPE = "std::tuple";
	public static final String EXIT_STATUS_TYPE = "int";

	private static final Map<String, String> PRIMITIVES = new HashMap<>();

	static {
		PRIMITIVES.put("bool", "bool");
		PRIMITIVES.put("string", "std::string");
		PRIMITIVES.put("int", "int");
		PRIMITIVES.put("int8", "std::int8_t");
		PRIMITIVES.put("int16", "std::int16_t");
		PRIMITIVES.put("int32", "std::int32_t");
		PRIMITIVES.put("int64", "std::int64_t");
		PRIMITIVES.put("uint", "unsigned int");
		PRIMITIVES.put("uint8", "std::uint8_t");
		PRIMITIVES.put("uint16", "std::uint16_t");
		PRIMITIVES.put("uint32", "std::uint32_t");
		PRIMITIVES.put("uint64", "std::uint64_t");
		PRIMITIVES.put("uintptr", "std::uintptr_t");
		PRIMITIVES.put("byte", "std::uint8_t");
		PRIMITIVES.put("rune", "std::int32_t");
		PRIMITIVES.put("float32", "float");
		PRIMITIVES.put("float64", "double");
		PRIMITIVES.put("error", "std::string");
	}

	private TypeMapper() {}

	public static String map(String goType) {
		String type = goType.trim();
		if (type.isEmpty()) {
			return type;
		}
		if (type.startsWith("*")) {
			return map(type.substring(1)) + "*";
		}
		if (type.startsWith("[]")) {
			return "std::vector<" + map(type.substring(2)) + ">";
		}
		if (type.startsWith("[")) {
			int close = type.indexOf(']');
			if (close > 1) {
				return "std::array<" + map(type.substring(close + 1)) + ", " + type.substring(1, close).trim() + ">";
			}
		}
		if (type.startsWith("map[")) {
			int close = Substrings.matchingClose(type, "map".length());
			if (close != -1) {
				return "std::unordered_map<" + map(type.substring("map[".length(), close)) + ", " +
						map(type.substring(close + 1)) + ">";
			}
		}
		return PRIMITIVES.getOrDefault(type, type);
	}

	/**
	 * The C++ tuple type holding the given Go element types, in order.
	 */
	public static String tupleOf(List<String> goTypes) {
		return TUPLE_TYPE + "<" + goTypes.stream().map(TypeMapper::map).collect(Collectors.joining(", ")) + ">";
	}

	public static boolean isTuple(String cppType) {
		return cppType != null && cppType.startsWith(TUPLE_TYPE + "<");
	}
}
