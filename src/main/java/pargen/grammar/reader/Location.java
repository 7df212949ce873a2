package pargen.grammar.reader;

import java.io.Serializable;
import java.util.Objects;

/**
 * Position in a grammar source text, lines and columns start at 1.
 */
public class Location implements Serializable {

	public final int line;
	public final int column;

	public Location(int line, int column){
		this.line = line;
		this.column = column;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Location && ((Location) obj).line == line && ((Location) obj).column == column;
	}

	@Override
	public int hashCode() {
		return Objects.hash(line, column);
	}

	@Override
	public String toString() {
		return "[" + line + ":" + column + "]";
	}
}
