package gocpp.trans.passes.codegen.cpp;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import org.junit.Before;
import org.junit.Test;

import gocpp.trans.intermediate.TranslationContext;
import gocpp.trans.intermediate.UnimplementedLoopFormIssue;

public class LoopCodeGenTest {

	private TranslationContext ctx;

	@Before
	public void setUp() {
		ctx = new TranslationContext();
		ctx.getSymbols().registerMap("m");
	}

	private String translate(String line) {
		return LoopCodeGen.transform(ctx, line).getText();
	}

	@Test
	public void testInfiniteLoop() {
		assertThat(translate("for {"), is("for (;;) {"));
	}

	@Test
	public void testThreeClauseLoop() {
		assertThat(translate("for i := 0; i < 10; i++ {"), is("for (auto i = 0; i < 10; i++) {"));
		assertThat(translate("for ; i < 10; {"), is("for (; i < 10;) {"));
	}

	@Test
	public void testConditionLoop() {
		assertThat(translate("for x < 5 {"), is("for (; x < 5;) {"));
	}

	@Test
	public void testRangeOverInteger() {
		assertThat(translate("for i := range 10 {"), is("for (int i = 0; i < 10; i++) {"));
		assertThat(translate("for range 3 {"), is("for (int _i__ = 0; _i__ < 3; _i__++) {"));
	}

	@Test
	public void testRangeOverSequence() {
		assertThat(translate("for i := range list {"), is("for (std::size_t i = 0; i < std::size(list); i++) {"));
		assertThat(translate("for i, v := range list {"),
				is("for (std::size_t i = 0; i < std::size(list); i++) {\nauto v = list[i];"));
		assertThat(translate("for _, v := range list {"), is("for (auto v : list) {"));
		assertThat(translate("for _ = range list {"), is("for (auto _v__ : list) {"));
	}

	@Test
	public void testRangeOverMap() {
		assertThat(translate("for k, v := range m {"), is("for (auto [k, v] : m) {"));
		assertThat(translate("for _, v := range m {"), is("for (auto [_k__, v] : m) {"));
		assertThat(translate("for k := range m {"), is("for (auto [k, _v__] : m) {"));
		assertThat(translate("for k, _ := range m {"), is("for (auto [k, _v__] : m) {"));
	}

	@Test(expected = UnimplementedLoopFormIssue.class)
	public void testRangeAssigningOuterVariables() {
		translate("for i, v = range list {");
	}

	@Test(expected = UnimplementedLoopFormIssue.class)
	public void testRangeWithThreeVariables() {
		translate("for a, b, c := range list {");
	}
}
