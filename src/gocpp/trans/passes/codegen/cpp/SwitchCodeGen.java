package gocpp.trans.passes.codegen.cpp;

import gocpp.trans.intermediate.ConstructResult;
import gocpp.trans.intermediate.SwitchFrame;
import gocpp.trans.intermediate.TranslationContext;
import gocpp.trans.intermediate.UnsupportedFeatureIssue;
import gocpp.util.Substrings;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Rewrites switch statements into an if/else-if chain.
 *
 * The switch subject is evaluated once into a hidden temporary (_s__N). Each case compares the temporary with its
 * values; the closing brace of the switch closes the last branch of the chain. Since such a chain cannot fall
 * through, a fallthrough statement becomes a goto to a fresh label (_l__N) that the next case or default clause
 * places as the first statement of its body. Likewise a break leaving the switch becomes a goto to a label placed
 * right after the chain.
 */
public final class SwitchCodeGen {

	private SwitchCodeGen() {}

	public static ConstructResult switchHeader(TranslationContext ctx, String line) {
		int brace = line.lastIndexOf('{');
		if (brace < "switch".length()) {
			throw new UnsupportedFeatureIssue("switch header spanning several lines", line);
		}
		String header = line.substring("switch".length(), brace).trim();
		String init = null;
		int semicolon = Substrings.indexOfTopLevel(header, ';');
		if (semicolon != -1) {
			init = ConditionalCodeGen.initStatement(header.substring(0, semicolon).trim());
			header = header.substring(semicolon + 1).trim();
		}
		SwitchFrame frame = ctx.openSwitch(header.isEmpty());
		StringBuilder out = new StringBuilder();
		if (init != null) {
			out.append(init).append(";");
		}
		if (!frame.isTagless()) {
			if (out.length() > 0) {
				out.append("\n");
			}
			out.append("auto ").append(frame.getSubjectVariable()).append(" = ").append(header).append(";");
		}
		if (out.length() == 0) {
			return ConstructResult.consumed();
		}
		return ConstructResult.of(out.toString());
	}

	public static ConstructResult caseClause(TranslationContext ctx, String line) {
		SwitchFrame frame = requireSwitch(ctx, line);
		int colon = Substrings.indexOfTopLevel(line, ':');
		if (colon == -1) {
			throw new UnsupportedFeatureIssue("case clause spanning several lines", line);
		}
		if (!line.substring(colon + 1).trim().isEmpty()) {
			throw new UnsupportedFeatureIssue("statements on the same line as a case clause", line);
		}
		List<String> values = Substrings.splitTopLevel(line.substring("case".length(), colon), ',');
		String condition;
		if (frame.isTagless()) {
			condition = values.size() == 1 ? values.get(0) :
					values.stream().map(v -> "(" + v + ")").collect(Collectors.joining(" || "));
		} else {
			condition = values.stream()
					.map(v -> frame.getSubjectVariable() + " == " + v)
					.collect(Collectors.joining(" || "));
		}
		String opening = frame.isFirstCase() ? "if (" : "} else if (";
		frame.caseSeen();
		return ConstructResult.of(placePendingLabel(ctx, opening + condition + ") {"));
	}

	public static ConstructResult defaultClause(TranslationContext ctx, String line) {
		SwitchFrame frame = requireSwitch(ctx, line);
		String opening = frame.isFirstCase() ? "if (true) {" : "} else {";
		frame.caseSeen();
		return ConstructResult.of(placePendingLabel(ctx, opening));
	}

	public static ConstructResult fallthrough(TranslationContext ctx, String line) {
		requireSwitch(ctx, line);
		return ConstructResult.of("goto " + ctx.allocateFallthroughLabel() + ";");
	}

	/**
	 * Translates an unlabeled break. Inside a switch clause it leaves the chain; inside a loop it stays a break.
	 */
	public static ConstructResult breakStatement(TranslationContext ctx, String line) {
		String label = ctx.switchBreakLabel();
		return ConstructResult.of(label == null ? line : "goto " + label);
	}

	private static String placePendingLabel(TranslationContext ctx, String opening) {
		String label = ctx.takePendingLabel();
		if (label == null) {
			return opening;
		}
		return opening + "\n" + label + ":";
	}

	private static SwitchFrame requireSwitch(TranslationContext ctx, String line) {
		SwitchFrame frame = ctx.currentSwitch();
		if (frame == null) {
			throw new UnsupportedFeatureIssue("clause outside of a switch statement", line);
		}
		return frame;
	}
}
