package gocpp.trans.passes.postprocess;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import org.junit.Test;

public class IncludeAggregationPassTest {

	@Test
	public void testSingleHeader() {
		assertThat(IncludeAggregationPass.perform("std::cout << std::endl;"),
				is("#include <iostream>\n\nstd::cout << std::endl;"));
	}

	@Test
	public void testSortedAndDeduplicated() {
		String source = "std::vector<std::string> v;\nstd::cout << std::size(v) << std::endl;\nstd::string s;";
		assertThat(IncludeAggregationPass.perform(source), is(
				"#include <iostream>\n" +
				"#include <iterator>\n" +
				"#include <string>\n" +
				"#include <vector>\n" +
				"\n" + source));
	}

	@Test
	public void testSymbolBoundaries() {
		String out = IncludeAggregationPass.perform("for (std::size_t i = 0; i < n; i++) {}\nstd::stringstream ss;");
		assertThat(out, containsString("#include <cstddef>"));
		assertThat(out, containsString("#include <sstream>"));
		assertThat(out, not(containsString("#include <iterator>")));
		assertThat(out, not(containsString("#include <string>")));
	}

	@Test
	public void testFixedWidthIntegers() {
		assertThat(IncludeAggregationPass.perform("std::int64_t x{};"), startsWith("#include <cstdint>\n"));
	}

	@Test
	public void testNoHeaders() {
		assertThat(IncludeAggregationPass.perform("int x{};"), is("int x{};"));
	}
}
