package pargen.grammar;

import java.util.Objects;

/**
 * A terminal symbol, identified by the name of its token class.
 */
public final class Terminal extends Symbol {

	/**
	 * Name of the token class
	 */
	public final String name;

	public Terminal(String name) {
		this.name = Objects.requireNonNull(name);
	}

	@Override
	public String toString() {
		return "<" + name + ">";
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Terminal && ((Terminal) obj).name.equals(name);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	protected int compareToSameKind(Symbol o) {
		return name.compareTo(((Terminal) o).name);
	}
}
