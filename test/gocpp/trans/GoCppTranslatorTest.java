package gocpp.trans;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.commons.io.FileUtils;
import org.junit.Test;

import gocpp.errors.TopLevelIssueContext;

public class GoCppTranslatorTest {

	private static Path example(String name) {
		return Paths.get("examples", "go", name);
	}

	private static String translateExample(String name) throws IOException {
		Path file = example(name);
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		String out = GoCppTranslator.translate(ctx, file,
				FileUtils.readFileToString(file.toFile(), StandardCharsets.UTF_8));
		assertFalse(ctx.format(), ctx.hasErrors());
		assertNotNull(out);
		return out;
	}

	@Test
	public void testHello() throws IOException {
		assertThat(translateExample("hello.go"), is(
				"#include <iostream>\n" +
				"\n" +
				"auto main() -> int {\n" +
				"std::cout << \"Hello\" << \" \" << \"World\" << std::endl;\n" +
				"return 0;\n" +
				"}\n"));
	}

	@Test
	public void testTupleReturn() throws IOException {
		String out = translateExample("tuple.go");
		assertThat(out, containsString("auto divmod(int a, int b) -> std::tuple<int, int> {\n" +
				"return std::tuple<int, int>{a / b, a % b};\n" +
				"}"));
		assertThat(out, containsString("auto [q, r] = divmod(7, 2);"));
		assertThat(out, containsString("_format_output(std::cout, q);\n" +
				"std::cout << \" \";\n" +
				"_format_output(std::cout, r);\n" +
				"std::cout << std::endl;"));
		assertThat(out, startsWith("#include <iostream>\n#include <ostream>\n#include <tuple>\n#include <type_traits>\n\n"));
		assertThat(out, not(containsString("_has_to_string")));
	}

	@Test
	public void testIota() throws IOException {
		assertThat(translateExample("iota.go"),
				containsString("const auto Red = 0;\nconst auto Green = 1;\nconst auto Blue = 2;"));
	}

	@Test
	public void testStructs() throws IOException {
		String out = translateExample("structs.go");
		assertThat(out, containsString("class Person {\n" +
				"public:\n" +
				"std::string Name{};\n" +
				"int Age{};\n" +
				"std::string _to_string() const {\n"));
		assertThat(out, containsString("auto p = Person{\"Alice\", 30};"));
		assertThat(out, containsString("auto q = new Person{\"Bob\", 25};"));
		assertThat(out, containsString("struct _has_to_string"));
		assertThat(out, containsString("#include <sstream>"));
		assertThat(out, containsString("#include <utility>"));
		// helpers come before the struct that calls them
		assertTrue(out.indexOf("void _format_output(") < out.indexOf("class Person {"));
	}

	@Test
	public void testMaps() throws IOException {
		String out = translateExample("maps.go");
		assertThat(out, containsString("std::unordered_map<std::string, int> ages{\n" +
				"{\"alice\", 31},\n" +
				"{\"bob\", 42},\n" +
				"};"));
		assertThat(out, containsString("for (auto [name, age] : ages) {"));
		assertThat(out, containsString("std::unordered_map<std::string, int> counts{{\"x\", 1}};"));
		assertThat(out, containsString("for (auto [k, _v__] : counts) {"));
		assertThat(out, containsString("#include <unordered_map>"));
	}

	@Test
	public void testSwitchWithFallthrough() throws IOException {
		String out = translateExample("switch.go");
		assertThat(out, containsString("auto _s__0 = x;\nif (_s__0 == 1) {"));
		assertThat(out, containsString("} else if (_s__0 == 2) {"));
		assertThat(out, containsString("goto _l__0;\n} else if (_s__0 == 3) {\n_l__0:"));
		assertThat(out, containsString("} else {\nstd::cout << \"other\" << std::endl;\n}\nreturn 0;\n}"));
	}

	@Test
	public void testLoops() throws IOException {
		String out = translateExample("loops.go");
		assertThat(out, containsString("std::vector<int> nums{1, 2, 3};"));
		assertThat(out, containsString("for (std::size_t i = 0; i < std::size(nums); i++) {\nauto n = nums[i];"));
		assertThat(out, containsString("for (auto n : nums) {"));
		assertThat(out, containsString("for (auto i = 0; i < 3; i++) {"));
		assertThat(out, containsString("for (; total < 10;) {\ntotal += 4;\n}"));
		assertThat(out, containsString("for (;;) {\nbreak;\n}"));
		assertThat(out, containsString("#include <cstddef>"));
		assertThat(out, containsString("#include <iterator>"));
	}

	@Test
	public void testTranslationIsRepeatable() throws IOException {
		assertThat(translateExample("switch.go"), is(translateExample("switch.go")));
	}

	@Test
	public void testMapRegisteredBeforeLoop() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		String out = GoCppTranslator.translate(ctx, null,
				"func main() {\nm := map[string]int{\"a\": 1, \"b\": 2}\nfor k, v := range m {\nfmt.Println(k, v)\n}\n}");
		assertFalse(ctx.hasErrors());
		assertThat(out, containsString("std::unordered_map<std::string, int> m{{\"a\", 1}, {\"b\", 2}};\n" +
				"for (auto [k, v] : m) {"));
		assertThat(out, not(containsString("std::size(m)")));
	}

	@Test
	public void testMultiLineRawString() throws IOException {
		Path file = example("rawstring.go");
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		String out = GoCppTranslator.translate(ctx, file,
				FileUtils.readFileToString(file.toFile(), StandardCharsets.UTF_8));
		assertNull(out);
		assertThat(ctx.getIssues().size(), is(1));
		String formatted = ctx.format();
		assertThat(formatted, startsWith("Detected 1 issue(s):\n"));
		assertThat(formatted, containsString("while translating line 6 of " + file));
		assertThat(formatted, containsString("unsupported literal form: raw string literal spanning several lines"));
	}

	@Test
	public void testEveryOffendingLineIsReported() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		String out = GoCppTranslator.translate(ctx, null,
				"package main\nfunc main() {\nfor i, v = range xs {\n}\nvar x\n}\n");
		assertNull(out);
		assertThat(ctx.getIssues().size(), is(2));
		String formatted = ctx.format();
		assertThat(formatted, containsString("while translating line 3 of <stdin>"));
		assertThat(formatted, containsString("unimplemented loop form"));
		assertThat(formatted, containsString("while translating line 5 of <stdin>"));
		assertThat(formatted, containsString("unrecognized var declaration"));
	}

	@Test
	public void testUnclosedBrace() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertNull(GoCppTranslator.translate(ctx, null, "package main\nfunc main() {\n"));
		assertThat(ctx.format(), containsString("input ends with 1 unclosed brace(s)"));
	}

	@Test
	public void testWindowsLineEndings() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		String out = GoCppTranslator.translate(ctx, null, "package main\r\n\r\nfunc main() {\r\nx := 1\r\n}\r\n");
		assertFalse(ctx.hasErrors());
		assertThat(out, is("auto main() -> int {\nauto x = 1;\nreturn 0;\n}\n"));
	}

	@Test
	public void testStringHelpers() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		String out = GoCppTranslator.translate(ctx, null,
				"package main\nimport \"strings\"\nfunc has(s string) bool {\nreturn strings.HasPrefix(s, \"go\")\n}\n");
		assertFalse(ctx.hasErrors());
		assertThat(out, containsString("inline auto stringsHasPrefix(std::string const& s, std::string const& prefix) -> bool"));
		assertThat(out, containsString("auto has(std::string s) -> bool {\nreturn stringsHasPrefix(s, \"go\");\n}"));
		assertThat(out, startsWith("#include <string>\n\n"));
	}
}
