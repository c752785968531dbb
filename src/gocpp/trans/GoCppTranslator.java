package gocpp.trans;

import gocpp.errors.IssueContext;
import gocpp.trans.intermediate.TranslatedUnit;
import gocpp.trans.passes.codegen.cpp.CppCodeGenPass;
import gocpp.trans.passes.postprocess.HelperInjectionPass;
import gocpp.trans.passes.postprocess.IncludeAggregationPass;
import gocpp.trans.passes.validation.LiteralFormValidationPass;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Runs the translation passes over one Go source unit and assembles the C++17 unit.
 */
public class GoCppTranslator {

	private GoCppTranslator() {}

	/**
	 * @param file the unit's path, used in diagnostics only; null when the source was read from standard input
	 * @return the complete C++ unit, or null if any issue was reported to ctx
	 */
	public static String translate(IssueContext ctx, Path file, String source) {
		List<String> lines = Arrays.asList(source.replace("\r\n", "\n").split("\n", -1));

		LiteralFormValidationPass.perform(ctx, file, lines);
		if (ctx.hasErrors()) {
			return null;
		}
		TranslatedUnit unit = CppCodeGenPass.perform(ctx, file, lines);
		if (unit == null) {
			return null;
		}
		String withHelpers = HelperInjectionPass.perform(unit);
		return IncludeAggregationPass.perform(withHelpers);
	}
}
