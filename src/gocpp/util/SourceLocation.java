package gocpp.util;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A 1-based line position within a Go source unit, together with the text found on that line.
 */
public class SourceLocation {
	private static final String STANDARD_INPUT = "<stdin>";

	private final Path file;
	private final int line;
	private final String text;

	public SourceLocation(Path file, int line, String text) {
		this.file = file;
		this.line = line;
		this.text = text;
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, 0, "");
	}

	public Path getFile() {
		return file;
	}

	public String getFileName() {
		return file == null ? STANDARD_INPUT : file.toString();
	}

	public int getLine() {
		return line;
	}

	public String getText() {
		return text;
	}

	@Override
	public String toString() {
		return getFileName() + ":" + line;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SourceLocation that = (SourceLocation) o;
		return line == that.line &&
				Objects.equals(file, that.file) &&
				Objects.equals(text, that.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, line, text);
	}
}
