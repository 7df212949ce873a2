package pargen.grammar;

import java.util.Objects;

/**
 * A non terminal symbol.
 *
 * Named non terminals are declared by the grammar author, anonymous ones are minted by the
 * transformations via {@link Grammar#anonymousNonTerminal(NonTerminal)}. The id is unique within its grammar.
 */
public final class NonTerminal extends Symbol {

	/**
	 * Name of the non terminal, synthetic for anonymous non terminals
	 */
	public final String name;

	public final int id;

	public final boolean anonymous;

	NonTerminal(int id, String name, boolean anonymous) {
		this.id = id;
		this.name = Objects.requireNonNull(name);
		this.anonymous = anonymous;
	}

	@Override
	public String toString() {
		return name;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof NonTerminal)){
			return false;
		}
		NonTerminal other = (NonTerminal) obj;
		return other.id == id && other.anonymous == anonymous && other.name.equals(name);
	}

	@Override
	public int hashCode() {
		return id;
	}

	@Override
	protected int compareToSameKind(Symbol o) {
		NonTerminal other = (NonTerminal) o;
		int cmp = Integer.compare(id, other.id);
		return cmp != 0 ? cmp : name.compareTo(other.name);
	}
}
