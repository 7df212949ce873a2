package pargen.transform;

import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import pargen.grammar.NonTerminal;
import pargen.grammar.Production;
import pargen.grammar.Symbol;

/**
 * Record of one attempt to disambiguate a group of colliding symbol sequences.
 */
public final class Disambiguation {

	public enum Outcome {
		/** The group consists of a single sequence */
		TRIVIAL,
		/** At most one distinct sequence is left after expanding the leading non terminals */
		CONVERGED,
		/** The expanded sequences only differ in a shared prefix or suffix */
		PREFIX_ONLY,
		/** A core segment is already being disambiguated, the group is left unresolved */
		CYCLE,
		/** The core segments have been disambiguated recursively */
		RECURSED
	}

	/**
	 * Non terminal whose conflict led to this attempt
	 */
	public final NonTerminal nonTerminal;

	/**
	 * Recursion depth, 0 for groups of the original alternatives
	 */
	public final int depth;

	public final ImmutableSet<ImmutableList<Symbol>> group;

	/**
	 * Group with all leading non terminals expanded, empty for trivial groups
	 */
	public final ImmutableSet<ImmutableList<Symbol>> expanded;

	public final ImmutableList<Symbol> prefix;

	public final ImmutableList<Symbol> suffix;

	/**
	 * Distinct sequences left after stripping prefix and suffix
	 */
	public final ImmutableSet<ImmutableList<Symbol>> cores;

	public final Outcome outcome;

	Disambiguation(NonTerminal nonTerminal, int depth, Set<? extends List<Symbol>> group,
	               Set<? extends List<Symbol>> expanded, List<Symbol> prefix, List<Symbol> suffix,
	               Set<? extends List<Symbol>> cores, Outcome outcome) {
		this.nonTerminal = nonTerminal;
		this.depth = depth;
		this.group = copy(group);
		this.expanded = copy(expanded);
		this.prefix = ImmutableList.copyOf(prefix);
		this.suffix = ImmutableList.copyOf(suffix);
		this.cores = copy(cores);
		this.outcome = outcome;
	}

	private static ImmutableSet<ImmutableList<Symbol>> copy(Set<? extends List<Symbol>> seqs){
		ImmutableSet.Builder<ImmutableList<Symbol>> builder = ImmutableSet.builder();
		for (List<Symbol> seq : seqs){
			builder.add(ImmutableList.copyOf(seq));
		}
		return builder.build();
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		builder.append(nonTerminal).append(" @").append(depth).append(" ").append(outcome).append(" {");
		boolean first = true;
		for (List<Symbol> seq : group){
			builder.append(first ? " " : " | ").append(Production.formatSymbols(seq));
			first = false;
		}
		builder.append(" }");
		if (!prefix.isEmpty() || !suffix.isEmpty()){
			builder.append(" [").append(Production.formatSymbols(prefix)).append(" ... ")
					.append(Production.formatSymbols(suffix)).append("]");
		}
		return builder.toString();
	}
}
