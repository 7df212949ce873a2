package pargen.grammar;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

/**
 * A grammar production with a left and a right hand side.
 *
 * Productions are values: two productions are equal iff both sides are equal. An empty right hand side is
 * an epsilon production.
 */
public final class Production implements Serializable, Comparable<Production> {

	/**
	 * Lexicographic order of symbol sequences, used for every ordered container of sequences
	 */
	public static final Ordering<Iterable<Symbol>> SEQUENCE_ORDER = Ordering.<Symbol>natural().lexicographical();

	/**
	 * Left hand side of the production (the associated non terminal)
	 */
	public final NonTerminal left;
	/**
	 * Right hand side of the production
	 */
	public final ImmutableList<Symbol> right;

	public Production(NonTerminal left, List<Symbol> right) {
		this.left = Objects.requireNonNull(left);
		this.right = ImmutableList.copyOf(right);
	}

	public String formatRightSide(){
		return formatSymbols(right);
	}

	/**
	 * Formats a symbol sequence, "ε" for the empty sequence.
	 */
	public static String formatSymbols(List<? extends Symbol> symbols){
		if (symbols.isEmpty()){
			return "ε";
		}
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < symbols.size(); i++) {
			builder.append(symbols.get(i));
			if (i < symbols.size() - 1) {
				builder.append(" ");
			}
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return left.toString() + " → " + formatRightSide();
	}

	public boolean isEpsilonProduction(){
		return right.isEmpty();
	}

	/**
	 * Is the first symbol of the right hand side the left hand side itself?
	 */
	public boolean isImmediatelyLeftRecursive(){
		return !right.isEmpty() && right.get(0).equals(left);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Production)){
			return false;
		}
		Production other = (Production) obj;
		return other.left.equals(left) && other.right.equals(right);
	}

	@Override
	public int hashCode() {
		return 31 * left.hashCode() + right.hashCode();
	}

	@Override
	public int compareTo(Production o) {
		int cmp = left.compareTo(o.left);
		return cmp != 0 ? cmp : SEQUENCE_ORDER.compare(right, o.right);
	}
}
