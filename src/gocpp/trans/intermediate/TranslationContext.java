package gocpp.trans.intermediate;

import gocpp.InternalCompilerError;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * All mutable state of one translation run. A context is created per run and handed to every transformer, so
 * independent runs never share counters or symbols.
 */
public class TranslationContext {
	public static final String SWITCH_PREFIX = "_s__";
	public static final String LABEL_PREFIX = "_l__";
	public static final String ENTRY_POINT = "main";

	private final SymbolFacts symbols;

	private int braceDepth;
	private BlockKind openBlock;

	private String functionName;
	private String returnType;

	private int iotaCounter;
	private boolean iotaSeen;
	private String constTemplate;
	private String constType;

	private int switchExpressionCounter;
	private final Deque<SwitchFrame> switches;
	private final List<String> closedBreakLabels;
	private final Deque<Integer> loops;
	private String pendingLabel;
	private int labelCounter;

	private String structName;

	public TranslationContext() {
		this.symbols = new SymbolFacts();
		this.braceDepth = 0;
		this.openBlock = BlockKind.NONE;
		this.switchExpressionCounter = -1;
		this.switches = new ArrayDeque<>();
		this.closedBreakLabels = new ArrayList<>();
		this.loops = new ArrayDeque<>();
		this.labelCounter = 0;
	}

	public SymbolFacts getSymbols() {
		return symbols;
	}

	public int getBraceDepth() {
		return braceDepth;
	}

	/**
	 * Applies the brace balance of one line.
	 *
	 * @return false if the depth would drop below zero, in which case it is left unchanged
	 */
	public boolean adjustBraceDepth(int delta) {
		if (braceDepth + delta < 0) {
			return false;
		}
		braceDepth += delta;
		while (!switches.isEmpty() && switches.peek().getBraceDepth() > braceDepth) {
			SwitchFrame closed = switches.pop();
			if (closed.getBreakLabel() != null) {
				closedBreakLabels.add(closed.getBreakLabel());
			}
		}
		while (!loops.isEmpty() && loops.peek() > braceDepth) {
			loops.pop();
		}
		return true;
	}

	public BlockKind getOpenBlock() {
		return openBlock;
	}

	public boolean isBlockOpen() {
		return openBlock != BlockKind.NONE;
	}

	public void openBlock(BlockKind kind) {
		if (openBlock != BlockKind.NONE) {
			throw new InternalCompilerError("cannot open " + kind + " while " + openBlock + " is open");
		}
		openBlock = kind;
		if (kind == BlockKind.CONST_BLOCK) {
			resetConstBlock();
		} else if (kind == BlockKind.STRUCT_BODY) {
			symbols.resetFields();
		}
	}

	public void closeBlock() {
		if (openBlock == BlockKind.CONST_BLOCK) {
			resetConstBlock();
		}
		openBlock = BlockKind.NONE;
	}

	public void enterFunction(String name, String returnType) {
		this.functionName = name;
		this.returnType = returnType;
	}

	public void leaveFunction() {
		this.functionName = null;
		this.returnType = null;
	}

	public String getFunctionName() {
		return functionName;
	}

	public String getReturnType() {
		return returnType;
	}

	public boolean inEntryPoint() {
		return ENTRY_POINT.equals(functionName);
	}

	// auto-increment constants

	private void resetConstBlock() {
		iotaCounter = 0;
		iotaSeen = false;
		constTemplate = null;
		constType = null;
	}

	/**
	 * Records an explicit iota assignment. The counter restarts from zero the first time this happens in a block.
	 */
	public void startIota(String template, String type) {
		if (!iotaSeen) {
			iotaCounter = 0;
			iotaSeen = true;
		}
		constTemplate = template;
		constType = type;
	}

	/**
	 * Records an explicit entry without iota, which bare entries that follow repeat. The counter is left alone.
	 */
	public void repeatConst(String template, String type) {
		constTemplate = template;
		constType = type;
	}

	/**
	 * @return the current counter value, then advances it
	 */
	public int nextIota() {
		return iotaCounter++;
	}

	public boolean hasConstTemplate() {
		return constTemplate != null;
	}

	/**
	 * @return the right-hand side that bare entries of the open const block repeat
	 */
	public String getConstTemplate() {
		return constTemplate;
	}

	/**
	 * @return the C++ type bare entries repeat, or null if they are untyped
	 */
	public String getConstType() {
		return constType;
	}

	// switch and fallthrough

	/**
	 * Opens a switch whose header line has already been counted into the brace depth.
	 */
	public SwitchFrame openSwitch(boolean tagless) {
		switchExpressionCounter++;
		String variable = tagless ? null : SWITCH_PREFIX + switchExpressionCounter;
		SwitchFrame frame = new SwitchFrame(variable, braceDepth);
		switches.push(frame);
		return frame;
	}

	/**
	 * @return the innermost open switch, or null outside of any switch
	 */
	public SwitchFrame currentSwitch() {
		return switches.peek();
	}

	/**
	 * Allocates a fresh label and marks it pending, so that the next case or default clause places it.
	 */
	public String allocateFallthroughLabel() {
		pendingLabel = nextLabel();
		return pendingLabel;
	}

	private String nextLabel() {
		return LABEL_PREFIX + labelCounter++;
	}

	/**
	 * Opens a loop whose header line has already been counted into the brace depth.
	 */
	public void openLoop() {
		loops.push(braceDepth);
	}

	/**
	 * @return the label placed after the innermost switch, allocating it on first use, or null if an unlabeled
	 * break here leaves a loop rather than a switch
	 */
	public String switchBreakLabel() {
		SwitchFrame frame = switches.peek();
		if (frame == null || (!loops.isEmpty() && loops.peek() > frame.getBraceDepth())) {
			return null;
		}
		if (frame.getBreakLabel() == null) {
			frame.setBreakLabel(nextLabel());
		}
		return frame.getBreakLabel();
	}

	/**
	 * @return the break labels of the switches closed by the last brace adjustment, innermost first, clearing them
	 */
	public List<String> takeClosedBreakLabels() {
		List<String> labels = new ArrayList<>(closedBreakLabels);
		closedBreakLabels.clear();
		return labels;
	}

	/**
	 * @return the pending fallthrough label, clearing it, or null if none is pending
	 */
	public String takePendingLabel() {
		String label = pendingLabel;
		pendingLabel = null;
		return label;
	}

	// struct blocks

	public String getStructName() {
		return structName;
	}

	public void setStructName(String structName) {
		this.structName = structName;
	}
}
