package gocpp.trans.passes.validation;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.nio.file.Paths;
import java.util.Arrays;

import org.junit.Test;

import gocpp.errors.TopLevelIssueContext;

public class LiteralFormValidationPassTest {

	@Test
	public void testOpensRawString() {
		assertFalse(LiteralFormValidationPass.opensRawString("x := `abc`"));
		assertTrue(LiteralFormValidationPass.opensRawString("x := `abc"));
		assertFalse(LiteralFormValidationPass.opensRawString("s := \"`\""));
		assertFalse(LiteralFormValidationPass.opensRawString("c := '`'"));
		assertFalse(LiteralFormValidationPass.opensRawString("x := 1 // `"));
	}

	@Test
	public void testReportsFirstOffendingLine() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		LiteralFormValidationPass.perform(ctx, Paths.get("banner.go"), Arrays.asList(
				"package main",
				"var banner = `first",
				"second `",
				"var other = `third"));
		assertTrue(ctx.hasErrors());
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(ctx.format(), containsString("while translating line 2 of banner.go"));
		assertThat(ctx.format(), containsString("raw string literal spanning several lines"));
	}

	@Test
	public void testAcceptsSingleLineRawStrings() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		LiteralFormValidationPass.perform(ctx, Paths.get("ok.go"), Arrays.asList("var s = `a`", "var t = \"b\""));
		assertFalse(ctx.hasErrors());
	}
}
