package gocpp.trans.intermediate;

/**
 * One open switch statement. The switch is rewritten into an if/else-if chain comparing a hidden temporary against
 * each case value; the frame remembers the temporary, whether the next clause is the first of the chain, and the
 * label a break out of the chain jumps to.
 */
public class SwitchFrame {
	private final String subjectVariable;
	private final int braceDepth;
	private boolean firstCase;
	private String breakLabel;

	public SwitchFrame(String subjectVariable, int braceDepth) {
		this.subjectVariable = subjectVariable;
		this.braceDepth = braceDepth;
		this.firstCase = true;
	}

	/**
	 * @return the hidden temporary holding the switch subject, or null for a tagless switch
	 */
	public String getSubjectVariable() {
		return subjectVariable;
	}

	public boolean isTagless() {
		return subjectVariable == null;
	}

	/**
	 * @return the brace depth of the switch body
	 */
	public int getBraceDepth() {
		return braceDepth;
	}

	public boolean isFirstCase() {
		return firstCase;
	}

	public void caseSeen() {
		firstCase = false;
	}

	/**
	 * @return the label placed after the chain, or null if no clause breaks out of it
	 */
	public String getBreakLabel() {
		return breakLabel;
	}

	public void setBreakLabel(String breakLabel) {
		this.breakLabel = breakLabel;
	}
}
