package gocpp.trans.passes.codegen.cpp;

import gocpp.errors.Issue;
import gocpp.errors.IssueContext;
import gocpp.trans.intermediate.BlockKind;
import gocpp.trans.intermediate.TranslatedUnit;
import gocpp.trans.intermediate.TranslationContext;
import gocpp.trans.intermediate.UnsupportedFeatureIssue;
import gocpp.util.SourceLocation;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * The line pipeline. Every input line is either routed to the declaration block that is currently open or
 * classified by its leading keyword and handed to the matching construct transformer. Issues are reported per line;
 * translation carries on after an issue so that one run reports every offending line.
 */
public class CppCodeGenPass {
	private static final Logger logger = Logger.getLogger("GoCpp Stage CodeGen");

	private CppCodeGenPass() {}

	/**
	 * @return the translated unit, or null if any issue was reported
	 */
	public static TranslatedUnit perform(IssueContext ctx, Path file, List<String> lines) {
		TranslationContext translation = new TranslationContext();
		LinePipeline pipeline = new LinePipeline(translation);
		List<String> output = new ArrayList<>();
		SourceLocation last = SourceLocation.unknown();
		for (int i = 0; i < lines.size(); i++) {
			last = new SourceLocation(file, i + 1, lines.get(i));
			try {
				String translated = pipeline.translate(lines.get(i));
				if (translated != null && !(output.isEmpty() && translated.isEmpty())) {
					output.add(translated);
				}
			} catch (Issue issue) {
				ctx.errorAt(last, issue);
			}
		}
		if (translation.isBlockOpen()) {
			ctx.errorAt(last, new UnsupportedFeatureIssue(
					"input ends inside an open " + describe(translation.getOpenBlock()), last.getText().trim()));
		} else if (translation.getBraceDepth() != 0) {
			ctx.errorAt(last, new UnsupportedFeatureIssue(
					"input ends with " + translation.getBraceDepth() + " unclosed brace(s)", last.getText().trim()));
		}
		if (ctx.hasErrors()) {
			return null;
		}
		logger.fine("translated " + lines.size() + " line(s), " + translation.getSymbols().getStructs().size() +
				" struct type(s)");
		return new TranslatedUnit(String.join("\n", output), pipeline.isFormatHelperRequired(),
				translation.getSymbols().getStructs());
	}

	static String describe(BlockKind kind) {
		switch (kind) {
			case IMPORT_BLOCK:
				return "import block";
			case VAR_BLOCK:
				return "var block";
			case CONST_BLOCK:
				return "const block";
			case TYPE_BLOCK:
				return "type block";
			case STRUCT_BODY:
				return "struct body";
			case MAP_LITERAL_BLOCK:
				return "map literal";
			default:
				return "block";
		}
	}
}
