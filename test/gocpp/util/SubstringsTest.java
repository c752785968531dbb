package gocpp.util;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

public class SubstringsTest {

	@Test
	public void testBetween() {
		assertThat(Substrings.between("func main() {", "func ", "("), is("main"));
		assertThat(Substrings.between("abc", "x", "y"), is("abc"));
		assertThat(Substrings.between("a(b)c(d)", "(", Substrings.Anchor.FIRST, ")", Substrings.Anchor.LAST),
				is("b)c(d"));
		assertThat(Substrings.between("a(b)c(d)", "(", Substrings.Anchor.LAST, ")", Substrings.Anchor.LAST),
				is("d"));
	}

	@Test
	public void testSplitTopLevel() {
		assertThat(Substrings.splitTopLevel("a, f(b, c), \"x,y\"", ','), is(Arrays.asList("a", "f(b, c)", "\"x,y\"")));
		assertThat(Substrings.splitTopLevel("{1, 2}, m[k], ','", ','), is(Arrays.asList("{1, 2}", "m[k]", "','")));
		assertThat(Substrings.splitTopLevel("   ", ','), is(Collections.emptyList()));
	}

	@Test
	public void testIndexOfAssignment() {
		assertThat(Substrings.indexOfAssignment("x := 1"), is(3));
		assertThat(Substrings.indexOfAssignment("x = 1"), is(2));
		assertThat(Substrings.indexOfAssignment("x <<= 1"), is(4));
		assertThat(Substrings.indexOfAssignment("s := \"a=b\""), is(3));
		assertThat(Substrings.indexOfAssignment("a == b"), is(-1));
		assertThat(Substrings.indexOfAssignment("a != b"), is(-1));
		assertThat(Substrings.indexOfAssignment("x <= 1"), is(-1));
		assertThat(Substrings.indexOfAssignment("x >= 1"), is(-1));
		assertThat(Substrings.indexOfAssignment("f(a == \"=\")"), is(-1));
	}

	@Test
	public void testIndexOfLineComment() {
		assertThat(Substrings.indexOfLineComment("x := \"http://a\" // c"), is(16));
		assertThat(Substrings.indexOfLineComment("x := 1"), is(-1));
	}

	@Test
	public void testCountOutsideLiterals() {
		assertThat(Substrings.countOutsideLiterals("m := map[string]string{\"{\": \"}\"}", '{'), is(1));
		assertThat(Substrings.countOutsideLiterals("if c == '{' {", '{'), is(1));
	}

	@Test
	public void testMatchingClose() {
		assertThat(Substrings.matchingClose("f(g(x), \")\")", 1), is(11));
		assertThat(Substrings.matchingClose("f(g(x)", 1), is(-1));
	}

	@Test
	public void testRewriteOutsideLiterals() {
		assertThat(Substrings.rewriteOutsideLiterals("len(\"len(\")", s -> s.replace("len(", "size(")),
				is("size(\"len(\")"));
	}

	@Test
	public void testLiterals() {
		assertTrue(Substrings.isStringLiteral("\"a\\\"b\""));
		assertTrue(Substrings.isStringLiteral("\"\""));
		assertFalse(Substrings.isStringLiteral("\"a\" + \"b\""));
		assertFalse(Substrings.isStringLiteral("\"abc\\\""));
		assertTrue(Substrings.isNumberLiteral("3.14"));
		assertTrue(Substrings.isNumberLiteral("0x1F"));
		assertTrue(Substrings.isNumberLiteral("-7"));
		assertFalse(Substrings.isNumberLiteral("abc"));
		assertTrue(Substrings.isIdentifier("_x1"));
		assertFalse(Substrings.isIdentifier("1x"));
	}

	@Test
	public void testTrimSuffix() {
		assertThat(Substrings.trimSuffix("x := 1;", ";"), is("x := 1"));
		assertThat(Substrings.trimSuffix("x := 1;;", ";"), is("x := 1;"));
		assertThat(Substrings.trimSuffix(" x ", ";"), is("x"));
	}
}
