package gocpp.trans.passes.codegen.cpp;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import org.junit.Before;
import org.junit.Test;

import gocpp.trans.intermediate.BlockKind;
import gocpp.trans.intermediate.TranslationContext;
import gocpp.trans.intermediate.UnsupportedFeatureIssue;

public class LinePipelineTest {

	private TranslationContext ctx;
	private LinePipeline pipeline;

	@Before
	public void setUp() {
		ctx = new TranslationContext();
		pipeline = new LinePipeline(ctx);
	}

	@Test
	public void testTerminate() {
		assertThat(LinePipeline.terminate("x = 1"), is("x = 1;"));
		assertThat(LinePipeline.terminate("x = 1;"), is("x = 1;"));
		assertThat(LinePipeline.terminate("if (x) {"), is("if (x) {"));
		assertThat(LinePipeline.terminate("public:"), is("public:"));
		assertThat(LinePipeline.terminate("}"), is("}"));
		assertThat(LinePipeline.terminate("auto p = Person{1}"), is("auto p = Person{1};"));
		assertThat(LinePipeline.terminate("{\"a\", 1},"), is("{\"a\", 1},"));
		assertThat(LinePipeline.terminate("return 0;\n}"), is("return 0;\n}"));
		assertThat(LinePipeline.terminate("// note"), is("// note"));
		assertThat(LinePipeline.terminate("auto a = 1;\nauto b = 2"), is("auto a = 1;\nauto b = 2;"));
	}

	@Test
	public void testLinesWithoutOutput() {
		assertNull(pipeline.translate("package main"));
		assertNull(pipeline.translate("import \"fmt\""));
		assertThat(pipeline.translate("   "), is(""));
	}

	@Test
	public void testCommentsAndSemicolons() {
		assertThat(pipeline.translate("// hello"), is("// hello"));
		assertThat(pipeline.translate("x := 1 // one"), is("auto x = 1; // one"));
		assertThat(pipeline.translate("    y := 2;"), is("auto y = 2;"));
		assertThat(pipeline.translate("/* short */"), is("/* short */"));
	}

	@Test(expected = UnsupportedFeatureIssue.class)
	public void testBlockCommentSpanningLines() {
		pipeline.translate("/* start");
	}

	@Test(expected = UnsupportedFeatureIssue.class)
	public void testUnbalancedClosingBrace() {
		pipeline.translate("}");
	}

	@Test
	public void testImportBlock() {
		assertNull(pipeline.translate("import ("));
		assertThat(ctx.getOpenBlock(), is(BlockKind.IMPORT_BLOCK));
		assertNull(pipeline.translate("\"fmt\""));
		assertNull(pipeline.translate("\"os\""));
		assertNull(pipeline.translate(")"));
		assertFalse(ctx.isBlockOpen());
	}

	@Test
	public void testVarBlock() {
		assertNull(pipeline.translate("var ("));
		assertThat(pipeline.translate("a int"), is("int a{};"));
		assertThat(pipeline.translate("b = \"x\""), is("std::string b = \"x\";"));
		assertThat(pipeline.translate("m = map[string]int{}"), is("std::unordered_map<std::string, int> m{};"));
		assertNull(pipeline.translate(")"));
		assertFalse(ctx.isBlockOpen());
		assertTrue(ctx.getSymbols().isMap("m"));
	}

	@Test(expected = UnsupportedFeatureIssue.class)
	public void testMapLiteralLeftOpenInsideVarBlock() {
		pipeline.translate("var (");
		pipeline.translate("m = map[string]int{");
	}

	@Test
	public void testMapLiteralBlock() {
		pipeline.translate("func main() {");
		assertThat(pipeline.translate("ages := map[string]int{"), is("std::unordered_map<std::string, int> ages{"));
		assertThat(ctx.getOpenBlock(), is(BlockKind.MAP_LITERAL_BLOCK));
		assertThat(pipeline.translate("\"alice\": 31,"), is("{\"alice\", 31},"));
		assertThat(pipeline.translate("}"), is("};"));
		assertFalse(ctx.isBlockOpen());
		assertThat(ctx.getBraceDepth(), is(1));
		assertThat(pipeline.translate("for k, v := range ages {"), is("for (auto [k, v] : ages) {"));
	}

	@Test
	public void testStructBody() {
		assertThat(pipeline.translate("type Point struct {"), is("class Point {\npublic:"));
		assertThat(pipeline.translate("X, Y int"), is("int X{};\nint Y{};"));
		String closed = pipeline.translate("}");
		assertThat(closed, startsWith("std::string _to_string() const {"));
		assertThat(closed, containsString("_format_output(_ss, X);\n_ss << \" \";\n_format_output(_ss, Y);"));
		assertThat(closed, endsWith("\n};"));
		assertFalse(ctx.isBlockOpen());
		assertThat(ctx.getBraceDepth(), is(0));
	}

	@Test(expected = UnsupportedFeatureIssue.class)
	public void testNestedStruct() {
		pipeline.translate("type Outer struct {");
		pipeline.translate("Inner struct {");
	}

	@Test
	public void testConstBlock() {
		assertNull(pipeline.translate("const ("));
		assertThat(pipeline.translate("Red = iota"), is("const auto Red = 0;"));
		assertThat(pipeline.translate("Green"), is("const auto Green = 1;"));
		assertNull(pipeline.translate(")"));
	}

	@Test
	public void testFunctionBodies() {
		assertThat(pipeline.translate("func f() {"), is("auto f() -> void {"));
		assertThat(pipeline.translate("}"), is("}"));
		assertNull(ctx.getFunctionName());
		assertThat(pipeline.translate("func main() {"), is("auto main() -> int {"));
		assertThat(pipeline.translate("if x {"), is("if (x) {"));
		assertThat(pipeline.translate("} else {"), is("} else {"));
		assertThat(pipeline.translate("}"), is("}"));
		assertThat(pipeline.translate("}"), is("return 0;\n}"));
	}

	@Test
	public void testSwitchWithoutClauses() {
		pipeline.translate("func f() {");
		assertThat(pipeline.translate("switch x {"), is("auto _s__0 = x;"));
		assertNull(pipeline.translate("}"));
		assertThat(pipeline.translate("}"), is("}"));
	}

	@Test
	public void testBreakLeavesSwitchInsideLoop() {
		pipeline.translate("func main() {");
		pipeline.translate("for i := 0; i < 3; i++ {");
		assertThat(pipeline.translate("switch i {"), is("auto _s__0 = i;"));
		assertThat(pipeline.translate("case 1:"), is("if (_s__0 == 1) {"));
		assertThat(pipeline.translate("break"), is("goto _l__0;"));
		assertThat(pipeline.translate("default:"), is("} else {"));
		assertThat(pipeline.translate("if i > 1 {"), is("if (i > 1) {"));
		assertThat(pipeline.translate("break"), is("goto _l__0;"));
		pipeline.translate("}");
		assertThat(pipeline.translate("}"), is("}\n_l__0:;"));
		assertThat(pipeline.translate("break"), is("break;"));
		assertThat(pipeline.translate("}"), is("}"));
	}

	@Test
	public void testBreakInsideLoopInsideSwitchLeavesLoop() {
		pipeline.translate("func f() {");
		pipeline.translate("switch x {");
		pipeline.translate("case 1:");
		assertThat(pipeline.translate("for {"), is("for (;;) {"));
		assertThat(pipeline.translate("break"), is("break;"));
		pipeline.translate("}");
		assertThat(pipeline.translate("break"), is("goto _l__0;"));
		assertThat(pipeline.translate("}"), is("}\n_l__0:;"));
		assertThat(pipeline.translate("}"), is("}"));
	}

	@Test
	public void testSwitchWithoutBreakPlacesNoLabel() {
		pipeline.translate("func f() {");
		pipeline.translate("switch x {");
		pipeline.translate("case 1:");
		pipeline.translate("y = 2");
		assertThat(pipeline.translate("}"), is("}"));
	}

	@Test
	public void testFormatHelperFlag() {
		pipeline.translate("func main() {");
		pipeline.translate("fmt.Println(\"a\")");
		assertFalse(pipeline.isFormatHelperRequired());
		assertThat(pipeline.translate("fmt.Println(x)"), is("_format_output(std::cout, x);\nstd::cout << std::endl;"));
		assertTrue(pipeline.isFormatHelperRequired());
	}

	@Test
	public void testPassthrough() {
		pipeline.translate("func main() {");
		assertThat(pipeline.translate("i++"), is("i++;"));
		assertThat(pipeline.translate("break"), is("break;"));
		assertThat(pipeline.translate("n := len(xs)"), is("auto n = std::size(xs);"));
	}
}
