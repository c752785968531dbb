package gocpp.trans.passes.codegen.cpp;

import gocpp.trans.intermediate.BlockKind;
import gocpp.trans.intermediate.ConstructResult;
import gocpp.trans.intermediate.SwitchFrame;
import gocpp.trans.intermediate.TranslationContext;
import gocpp.trans.intermediate.UnsupportedFeatureIssue;
import gocpp.util.Substrings;

import java.util.List;
import java.util.logging.Logger;

/**
 * Translates one line at a time against a single {@link TranslationContext}.
 */
public class LinePipeline {
	private static final Logger logger = Logger.getLogger("GoCpp Stage CodeGen");
	private static final String BLOCK_END = ")";

	private final TranslationContext ctx;
	private boolean formatHelperRequired;

	public LinePipeline(TranslationContext ctx) {
		this.ctx = ctx;
		this.formatHelperRequired = false;
	}

	public boolean isFormatHelperRequired() {
		return formatHelperRequired;
	}

	/**
	 * @return the C++ text for the line, possibly spanning several lines, or null if the line produces no output
	 */
	public String translate(String rawLine) {
		String line = rawLine.trim();
		if (line.isEmpty()) {
			return "";
		}
		if (line.startsWith("//")) {
			return line;
		}
		if (line.startsWith("/*")) {
			if (!line.endsWith("*/")) {
				throw new UnsupportedFeatureIssue("block comment spanning several lines", line);
			}
			return line;
		}

		String comment = null;
		String code = line;
		int commentStart = Substrings.indexOfLineComment(line);
		if (commentStart != -1) {
			comment = line.substring(commentStart);
			code = line.substring(0, commentStart).trim();
		}
		code = Substrings.trimSuffix(code, ";");
		code = ExpressionRewriter.rewrite(ExpressionRewriter.rewriteRawStrings(code));

		int delta = Substrings.countOutsideLiterals(code, '{') - Substrings.countOutsideLiterals(code, '}');
		SwitchFrame innermost = ctx.currentSwitch();
		if (!ctx.adjustBraceDepth(delta)) {
			throw new UnsupportedFeatureIssue("closing brace without a matching opening brace", line);
		}
		List<String> breakLabels = ctx.takeClosedBreakLabels();

		ConstructResult result;
		if (innermost != null && innermost != ctx.currentSwitch() && innermost.isFirstCase() && code.equals("}")) {
			// a switch without clauses opened no branch to close
			result = ConstructResult.consumed();
		} else {
			result = ctx.isBlockOpen() ? continueBlock(code, delta) : classify(code);
		}
		record(result, line);

		String text = result.getText();
		if (text == null) {
			return comment;
		}
		text = terminate(text);
		for (String label : breakLabels) {
			text += "\n" + label + ":;";
		}
		return comment == null ? text : text + " " + comment;
	}

	private ConstructResult continueBlock(String code, int delta) {
		BlockKind kind = ctx.getOpenBlock();
		switch (kind) {
			case IMPORT_BLOCK:
				if (code.startsWith(BLOCK_END)) {
					ctx.closeBlock();
				}
				return ConstructResult.consumed();
			case VAR_BLOCK:
				if (code.equals(BLOCK_END)) {
					ctx.closeBlock();
					return ConstructResult.consumed();
				}
				return DeclarationCodeGen.varDeclaration(code, code);
			case CONST_BLOCK:
				if (code.equals(BLOCK_END)) {
					ctx.closeBlock();
					return ConstructResult.consumed();
				}
				return DeclarationCodeGen.constDeclaration(ctx, code, true, code);
			case TYPE_BLOCK:
				if (code.equals(BLOCK_END)) {
					ctx.closeBlock();
					return ConstructResult.consumed();
				}
				return DeclarationCodeGen.typeDeclaration(ctx, code, true, code);
			case STRUCT_BODY:
				if (code.equals("}")) {
					ConstructResult closed = DeclarationCodeGen.structClose(ctx);
					ctx.closeBlock();
					return closed;
				}
				if (delta != 0) {
					throw new UnsupportedFeatureIssue("nested struct types", code);
				}
				ConstructResult field = DeclarationCodeGen.fieldDeclaration(code, code);
				for (String name : field.getDeclaredNames()) {
					ctx.getSymbols().addField(name);
				}
				return field;
			case MAP_LITERAL_BLOCK:
				boolean closing = delta < 0;
				ConstructResult entries = MapLiteralCodeGen.entryLine(code, closing);
				if (closing) {
					ctx.closeBlock();
				}
				return entries;
			default:
				throw new UnsupportedFeatureIssue("line inside an unknown block", code);
		}
	}

	private ConstructResult classify(String code) {
		if (code.startsWith("package ")) {
			return ConstructResult.consumed();
		}
		if (startsWithKeyword(code, "import")) {
			if (code.endsWith("(")) {
				ctx.openBlock(BlockKind.IMPORT_BLOCK);
			}
			return ConstructResult.consumed();
		}
		if (code.startsWith("func ")) {
			return FunctionSignatureCodeGen.transform(ctx, code);
		}
		if (startsWithKeyword(code, "for")) {
			ConstructResult loop = LoopCodeGen.transform(ctx, code);
			ctx.openLoop();
			return loop;
		}
		if (startsWithKeyword(code, "switch")) {
			return SwitchCodeGen.switchHeader(ctx, code);
		}
		if (code.startsWith("case ")) {
			return SwitchCodeGen.caseClause(ctx, code);
		}
		if (code.equals("default:")) {
			return SwitchCodeGen.defaultClause(ctx, code);
		}
		if (code.equals("fallthrough")) {
			return SwitchCodeGen.fallthrough(ctx, code);
		}
		if (code.equals("break")) {
			return SwitchCodeGen.breakStatement(ctx, code);
		}
		if (code.equals("return") || code.startsWith("return ")) {
			return AssignmentCodeGen.returnStatement(ctx, code);
		}
		if (code.startsWith("if ")) {
			return ConditionalCodeGen.ifHeader(code);
		}
		if (code.startsWith("} else if ")) {
			return ConditionalCodeGen.elseIfHeader(code);
		}
		if (code.equals("var (")) {
			ctx.openBlock(BlockKind.VAR_BLOCK);
			return ConstructResult.consumed();
		}
		if (code.equals("const (")) {
			ctx.openBlock(BlockKind.CONST_BLOCK);
			return ConstructResult.consumed();
		}
		if (code.equals("type (")) {
			ctx.openBlock(BlockKind.TYPE_BLOCK);
			return ConstructResult.consumed();
		}
		if (code.startsWith("var ")) {
			return DeclarationCodeGen.varDeclaration(code.substring("var ".length()).trim(), code);
		}
		if (code.startsWith("const ")) {
			return DeclarationCodeGen.constDeclaration(ctx, code.substring("const ".length()).trim(), false, code);
		}
		if (code.startsWith("type ")) {
			return DeclarationCodeGen.typeDeclaration(ctx, code.substring("type ".length()).trim(), false, code);
		}
		if (PrintCodeGen.isPrintCall(code)) {
			return PrintCodeGen.transform(code);
		}
		if (code.equals("}")) {
			return closingBrace();
		}
		if (AssignmentCodeGen.isAssignment(code)) {
			return AssignmentCodeGen.transform(code);
		}
		return ConstructResult.of(code);
	}

	private ConstructResult closingBrace() {
		if (ctx.getBraceDepth() != 0 || ctx.getFunctionName() == null) {
			return ConstructResult.of("}");
		}
		boolean entryPoint = ctx.inEntryPoint();
		ctx.leaveFunction();
		return ConstructResult.of(entryPoint ? "return 0;\n}" : "}");
	}

	private void record(ConstructResult result, String line) {
		if (result.has(ConstructResult.Advisory.MAP_DECLARED)) {
			for (String name : result.getDeclaredNames()) {
				ctx.getSymbols().registerMap(name);
				logger.fine("registered map " + name);
			}
		}
		if (result.has(ConstructResult.Advisory.MAP_LITERAL_OPENED)) {
			if (ctx.isBlockOpen()) {
				throw new UnsupportedFeatureIssue("map literal left open inside a " +
						CppCodeGenPass.describe(ctx.getOpenBlock()), line);
			}
			ctx.openBlock(BlockKind.MAP_LITERAL_BLOCK);
		}
		if (result.has(ConstructResult.Advisory.STRUCT_BODY_OPENED)) {
			ctx.openBlock(BlockKind.STRUCT_BODY);
			logger.fine("opened body of struct " + ctx.getStructName());
		}
		if (result.has(ConstructResult.Advisory.FORMAT_HELPER_REQUIRED)) {
			formatHelperRequired = true;
		}
	}

	private static boolean startsWithKeyword(String code, String keyword) {
		if (!code.startsWith(keyword)) {
			return false;
		}
		if (code.length() == keyword.length()) {
			return true;
		}
		char next = code.charAt(keyword.length());
		return next == ' ' || next == '{' || next == '(' || next == '"';
	}

	/**
	 * Appends a statement terminator to the last line of text unless that line opens or closes a block, ends a
	 * clause label, continues a list, or already ends with one.
	 */
	static String terminate(String text) {
		String last = text.substring(text.lastIndexOf('\n') + 1).trim();
		if (last.isEmpty() || last.endsWith(";") || last.startsWith("//")) {
			return text;
		}
		switch (Substrings.lastChar(last)) {
			case '{':
			case ':':
				return text;
			case ',':
				if (Substrings.indexOfAssignment(last) != -1 || last.startsWith("return")) {
					return text + ";";
				}
				return text;
			case '}':
				if (last.startsWith("}")) {
					return text;
				}
				return text + ";";
			default:
				return text + ";";
		}
	}
}
