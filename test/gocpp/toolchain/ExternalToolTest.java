package gocpp.toolchain;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

public class ExternalToolTest {

	private static final String MISSING = "gocpp-no-such-tool-on-this-machine";

	@Test
	public void testFormatterFallsBackToInput() {
		ClangFormatter formatter = new ClangFormatter(Arrays.asList(MISSING, "-style=LLVM"));
		assertThat(formatter.getName(), is(MISSING));
		assertThat(formatter.format("int x;"), is("int x;"));
	}

	@Test(expected = IOException.class)
	public void testMissingCompiler() throws IOException {
		new GppCompiler(Collections.singletonList(MISSING)).compile("int main() {}");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEmptyCommand() {
		new ClangFormatter(Collections.emptyList());
	}
}
