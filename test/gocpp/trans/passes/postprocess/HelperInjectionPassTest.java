package gocpp.trans.passes.postprocess;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Collections;

import org.junit.Test;

import gocpp.trans.intermediate.TranslatedUnit;

public class HelperInjectionPassTest {

	private static final String MAIN = "auto main() -> int {\nreturn 0;\n}";

	@Test
	public void testNothingToInject() {
		assertThat(HelperInjectionPass.perform(new TranslatedUnit(MAIN, false, Collections.emptySet())), is(MAIN));
	}

	@Test
	public void testOnlyCalledStringHelpers() {
		String body = "auto ok = stringsContains(s, \"a\");";
		String out = HelperInjectionPass.perform(new TranslatedUnit(body, false, Collections.emptySet()));
		assertThat(out, startsWith("inline auto stringsContains(std::string const& s, std::string const& sub) -> bool"));
		assertThat(out, endsWith("\n\n" + body));
		assertThat(out, not(containsString("stringsIndex")));
		assertThat(out, not(containsString("_format_output")));
	}

	@Test
	public void testFormatHelperWithoutStructs() {
		String body = "_format_output(std::cout, x);";
		String out = HelperInjectionPass.perform(new TranslatedUnit(body, true, Collections.emptySet()));
		assertThat(out, startsWith("template <typename T>\nvoid _format_output(std::ostream& out, T x)\n{"));
		assertThat(out, containsString("out << std::boolalpha << x << std::noboolalpha;"));
		assertThat(out, not(containsString("_has_to_string")));
	}

	@Test
	public void testFormatHelperWithStructs() {
		String body = "class Person {\npublic:\n};\n_format_output(std::cout, p);";
		String out = HelperInjectionPass.perform(new TranslatedUnit(body, true, Collections.singleton("Person")));
		assertThat(out, startsWith("template <typename T, typename = void>\nstruct _has_to_string : std::false_type {"));
		assertThat(out, containsString("} else if constexpr (_has_to_string<T>::value) {"));
		assertThat(out, containsString("out << \"&\" << x->_to_string();"));
	}

	@Test
	public void testNullStructPointerPrintsNil() {
		String helper = HelperInjectionPass.formatHelper(true);
		int guard = helper.indexOf("if (x == nullptr) {\n            out << \"<nil>\";");
		int call = helper.indexOf("x->_to_string()");
		assertTrue(guard != -1);
		assertTrue(guard < call);
		assertThat(HelperInjectionPass.formatHelper(false), not(containsString("nullptr")));
	}

	@Test
	public void testFormatHelperCalledOnlyFromStringMethod() {
		String body = "_ss << \"{\";\n_format_output(_ss, Name);";
		String out = HelperInjectionPass.perform(new TranslatedUnit(body, false, Collections.singleton("Person")));
		assertThat(out, containsString("void _format_output(std::ostream& out, T x)"));
	}
}
