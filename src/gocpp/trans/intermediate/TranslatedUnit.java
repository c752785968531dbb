package gocpp.trans.intermediate;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The C++ body produced by the line pipeline, before helpers and includes are added.
 */
public class TranslatedUnit {
	private final String body;
	private final boolean formatHelperRequired;
	private final Set<String> structs;

	public TranslatedUnit(String body, boolean formatHelperRequired, Set<String> structs) {
		this.body = body;
		this.formatHelperRequired = formatHelperRequired;
		this.structs = Collections.unmodifiableSet(new LinkedHashSet<>(structs));
	}

	public String getBody() {
		return body;
	}

	public boolean isFormatHelperRequired() {
		return formatHelperRequired;
	}

	/**
	 * @return the struct types declared in the unit, in declaration order
	 */
	public Set<String> getStructs() {
		return structs;
	}
}
