package pargen.grammar;

import java.io.Serializable;

/**
 * Base class for terminal symbols and non terminal symbols.
 *
 * Symbols are immutable values. Terminals are ordered before non terminals.
 */
public abstract class Symbol implements Serializable, Comparable<Symbol> {

	Symbol() {
	}

	public boolean isTerminal(){
		return this instanceof Terminal;
	}

	public boolean isNonTerminal(){
		return this instanceof NonTerminal;
	}

	/**
	 * Compares two symbols of the same kind
	 */
	protected abstract int compareToSameKind(Symbol o);

	@Override
	public int compareTo(Symbol o) {
		if (getClass() != o.getClass()){
			return isTerminal() ? -1 : 1;
		}
		return compareToSameKind(o);
	}
}
