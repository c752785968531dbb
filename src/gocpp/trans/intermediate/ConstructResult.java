package gocpp.trans.intermediate;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The C++ text produced for one line of Go, along with what the line pipeline has to record about it.
 */
public class ConstructResult {

	public enum Advisory {
		/** a struct declaration opened its body on this line */
		STRUCT_BODY_OPENED,
		/** a map literal was left open at the end of this line */
		MAP_LITERAL_OPENED,
		/** the declared names hold maps */
		MAP_DECLARED,
		/** the generic formatting helper is called from the text */
		FORMAT_HELPER_REQUIRED,
	}

	private final String text;
	private final Set<Advisory> advisories;
	private final List<String> declaredNames;

	private ConstructResult(String text, Set<Advisory> advisories, List<String> declaredNames) {
		this.text = text;
		this.advisories = advisories;
		this.declaredNames = declaredNames;
	}

	public static ConstructResult of(String text) {
		return new ConstructResult(text, EnumSet.noneOf(Advisory.class), Collections.emptyList());
	}

	public static ConstructResult declaring(String text, List<String> declaredNames) {
		return new ConstructResult(text, EnumSet.noneOf(Advisory.class), declaredNames);
	}

	public static ConstructResult consumed() {
		return of(null);
	}

	public ConstructResult with(Advisory advisory) {
		Set<Advisory> copy = advisories.isEmpty() ? EnumSet.noneOf(Advisory.class) : EnumSet.copyOf(advisories);
		copy.add(advisory);
		return new ConstructResult(text, copy, declaredNames);
	}

	/**
	 * @return the C++ text, possibly spanning several lines, or null if the line produces no output
	 */
	public String getText() {
		return text;
	}

	public boolean isConsumed() {
		return text == null;
	}

	public boolean has(Advisory advisory) {
		return advisories.contains(advisory);
	}

	public List<String> getDeclaredNames() {
		return declaredNames;
	}
}
