package gocpp.trans.passes.codegen.cpp;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import org.junit.Test;

public class ExpressionRewriterTest {

	@Test
	public void testStringsPackage() {
		assertThat(ExpressionRewriter.rewrite("if strings.Contains(s, \"len(\") {"),
				is("if stringsContains(s, \"len(\") {"));
		assertThat(ExpressionRewriter.rewrite("t := strings.TrimSpace(s)"), is("t := stringsTrimSpace(s)"));
		assertThat(ExpressionRewriter.rewrite("t := strings.ToUpper(s)"), is("t := strings.ToUpper(s)"));
	}

	@Test
	public void testBuiltins() {
		assertThat(ExpressionRewriter.rewrite("n := len(xs)"), is("n := std::size(xs)"));
		assertThat(ExpressionRewriter.rewrite("n := mylen(xs)"), is("n := mylen(xs)"));
		assertThat(ExpressionRewriter.rewrite("os.Exit(1)"), is("std::exit(1)"));
		assertThat(ExpressionRewriter.rewrite("p = nil"), is("p = nullptr"));
		assertThat(ExpressionRewriter.rewrite("nilValue := \"nil\""), is("nilValue := \"nil\""));
	}

	@Test
	public void testRawStrings() {
		assertThat(ExpressionRewriter.rewriteRawStrings("s := `a\\b \"q\"`"), is("s := \"a\\\\b \\\"q\\\"\""));
		assertThat(ExpressionRewriter.rewriteRawStrings("s := \"`\""), is("s := \"`\""));
		assertThat(ExpressionRewriter.rewriteRawStrings("x := 1"), is("x := 1"));
	}
}
