package gocpp.trans.intermediate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * What the translator has learned about identifiers so far: which names hold maps, which names are struct types, and
 * the fields of the struct whose body is currently open.
 */
public class SymbolFacts {
	private final Set<String> maps;
	private final Set<String> structs;
	private final List<String> fields;

	public SymbolFacts() {
		this.maps = new HashSet<>();
		this.structs = new LinkedHashSet<>();
		this.fields = new ArrayList<>();
	}

	public void registerMap(String name) {
		maps.add(name);
	}

	public boolean isMap(String name) {
		return maps.contains(name);
	}

	public void registerStruct(String name) {
		structs.add(name);
	}

	public boolean isStruct(String name) {
		return structs.contains(name);
	}

	public Set<String> getStructs() {
		return Collections.unmodifiableSet(structs);
	}

	/**
	 * Forgets the fields collected for the previous struct. Called exactly when a new struct body opens.
	 */
	public void resetFields() {
		fields.clear();
	}

	public void addField(String name) {
		fields.add(name);
	}

	/**
	 * @return the fields of the open struct body, in declaration order
	 */
	public List<String> getFields() {
		return Collections.unmodifiableList(fields);
	}
}
