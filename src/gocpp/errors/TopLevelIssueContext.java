package gocpp.errors;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import gocpp.Unreachable;
import gocpp.formatters.IndentingWriter;
import gocpp.formatters.IssueFormattingVisitor;
import gocpp.util.SourceLocation;

/**
 * Collects the issues of one run. Formatting lists issues without a source line first, then the others in the order
 * of the lines they were found on.
 */
public class TopLevelIssueContext extends IssueContext {
	private static final Comparator<Issue> BY_LINE = Comparator.comparingInt(TopLevelIssueContext::lineOf);

	private final List<Issue> errors;

	public TopLevelIssueContext() {
		this.errors = new ArrayList<>();
	}

	private static int lineOf(Issue issue) {
		SourceLocation location = issue.getLocation();
		return location == null ? 0 : location.getLine();
	}

	@Override
	public void error(Issue err) {
		errors.add(err);
	}

	@Override
	public boolean hasErrors() {
		return !errors.isEmpty();
	}

	public List<Issue> getIssues() {
		return errors;
	}

	/**
	 * @return the Go source lines at least one issue was reported on
	 */
	public SortedSet<Integer> getIssueLines() {
		SortedSet<Integer> lines = new TreeSet<>();
		for (Issue e : errors) {
			if (e.getLocation() != null) {
				lines.add(e.getLocation().getLine());
			}
		}
		return lines;
	}

	public void format(IndentingWriter out) throws IOException {
		out.write("Detected ");
		out.write(Integer.toString(errors.size()));
		out.write(" issue(s):");
		List<Issue> ordered = new ArrayList<>(errors);
		ordered.sort(BY_LINE);
		for (Issue e : ordered) {
			out.newLine();
			e.accept(new IssueFormattingVisitor(out));
		}
	}

	public String format() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			format(out);
		} catch (IOException e) {
			throw new Unreachable("formatting issues into a string", e);
		}
		return w.toString();
	}
}
