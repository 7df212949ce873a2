package pargen.transform;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;

import pargen.diagnostic.Diagnostic;
import pargen.grammar.Grammar;
import pargen.grammar.NonTerminal;
import pargen.grammar.Production;
import pargen.grammar.Symbol;
import pargen.grammar.Terminal;

import static pargen.grammar.Production.formatSymbols;

/**
 * Detects non terminals whose alternatives can't be decided with one token of lookahead and narrows
 * the colliding alternatives down to the segments that actually have to be told apart.
 *
 * For every conflicting non terminal the alternatives are clustered into groups with connected first
 * sets. Each group is expanded until every sequence starts with a terminal, the common prefix and suffix are
 * stripped and the remaining core segments are handled recursively. A core segment that is already being
 * handled further up aborts the group with a warning, which guarantees termination.
 *
 * The grammar itself isn't modified, see {@link PrefixSynthesizer} for the rewriting counterpart.
 */
public class LeftFactoring {

	private static final Logger LOG = Logger.getLogger(LeftFactoring.class.getName());

	private final Grammar grammar;

	private FactoringReport report;

	/**
	 * Non terminal whose conflict is currently handled
	 */
	private NonTerminal current;

	public LeftFactoring(Grammar grammar) {
		this.grammar = grammar;
	}

	public FactoringReport leftFactor(){
		LOG.info("Left-factoring grammar");
		report = new FactoringReport();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			leftFactor(nonTerminal);
		}
		FactoringReport ret = report;
		report = null;
		return ret;
	}

	private void leftFactor(NonTerminal nonTerminal){
		List<Production> productions = grammar.getProductions(nonTerminal);
		SortedSet<Terminal> colliding = collidingTerminals(productions);
		if (colliding.isEmpty()){
			return;
		}
		LOG.log(Level.FINE, "Conflict in {0}", nonTerminal);
		Diagnostic.Builder diagnostic = Diagnostic.note(String.format("Conflict in %s on lookahead %s", nonTerminal, colliding));
		grammar.getDefinitionLocation(nonTerminal).ifPresent(diagnostic::span);
		for (Production production : productions){
			diagnostic.note(production.toString());
		}
		if (LOG.isLoggable(Level.FINER)){
			for (Production production : productions){
				LOG.finer("  " + production);
			}
		}
		report.addConflict(new FactoringReport.Conflict(nonTerminal, colliding));
		report.addDiagnostic(diagnostic.build());

		Set<List<Symbol>> seqs = new TreeSet<>(Production.SEQUENCE_ORDER);
		for (Production production : productions){
			seqs.add(production.right);
		}
		current = nonTerminal;
		handleConflict(seqs, new HashSet<>(), 0);
		current = null;
	}

	/**
	 * Do at least two of the passed productions share a terminal in their first sets?
	 */
	public boolean hasConflict(Collection<Production> productions){
		return !collidingTerminals(productions).isEmpty();
	}

	/**
	 * Terminals that are in the first sets of more than one of the passed productions
	 */
	public SortedSet<Terminal> collidingTerminals(Collection<Production> productions){
		Set<Terminal> seen = new HashSet<>();
		SortedSet<Terminal> colliding = new TreeSet<>();
		for (Production production : productions){
			for (Terminal terminal : grammar.firstSetOfSymbols(production.right)){
				if (!seen.add(terminal)){
					colliding.add(terminal);
				}
			}
		}
		return colliding;
	}

	/**
	 * Clusters the passed sequences into groups whose first sets are connected by shared terminals and
	 * disambiguates each group. Empty sequences can't collide and are skipped.
	 */
	private void handleConflict(Set<? extends List<Symbol>> seqs, Set<List<Symbol>> stack, int depth){
		TreeSet<List<Symbol>> todo = new TreeSet<>(Production.SEQUENCE_ORDER);
		Map<List<Symbol>, Set<Terminal>> firsts = new HashMap<>();
		for (List<Symbol> seq : seqs){
			if (!seq.isEmpty()){
				todo.add(seq);
				firsts.put(seq, grammar.firstSetOfSymbols(seq));
			}
		}
		while (!todo.isEmpty()){
			List<Symbol> init = todo.pollFirst();
			Set<List<Symbol>> colliders = new TreeSet<>(Production.SEQUENCE_ORDER);
			colliders.add(init);
			Set<Terminal> seen = new HashSet<>(firsts.get(init));
			boolean grew = true;
			while (grew){
				grew = false;
				Iterator<List<Symbol>> iterator = todo.iterator();
				while (iterator.hasNext()){
					List<Symbol> seq = iterator.next();
					if (!Collections.disjoint(seen, firsts.get(seq))){
						seen.addAll(firsts.get(seq));
						colliders.add(seq);
						iterator.remove();
						grew = true;
					}
				}
			}
			disambiguate(colliders, stack, depth);
		}
	}

	private void disambiguate(Set<List<Symbol>> seqs, Set<List<Symbol>> stack, int depth){
		if (seqs.size() == 1){
			record(depth, seqs, Collections.emptySet(), ImmutableList.of(), ImmutableList.of(),
					Collections.emptySet(), Disambiguation.Outcome.TRIVIAL);
			return;
		}
		if (LOG.isLoggable(Level.FINER)){
			LOG.finer("Disambiguate:");
			for (List<Symbol> seq : seqs){
				LOG.finer("  " + formatSymbols(seq));
			}
		}

		Set<List<Symbol>> done = expandLeadingNonTerminals(seqs);
		if (LOG.isLoggable(Level.FINER)){
			LOG.finer("Expanded:");
			for (List<Symbol> seq : done){
				LOG.finer("  " + formatSymbols(seq));
			}
		}
		if (done.size() <= 1){
			record(depth, seqs, done, ImmutableList.of(), ImmutableList.of(),
					Collections.emptySet(), Disambiguation.Outcome.CONVERGED);
			return;
		}

		List<Symbol> prefix = commonPrefix(done);
		List<Symbol> suffix = commonSuffix(done, prefix.size());
		LOG.finer(() -> String.format("  [%s ... %s]", formatSymbols(prefix), formatSymbols(suffix)));

		Set<List<Symbol>> cores = new TreeSet<>(Production.SEQUENCE_ORDER);
		for (List<Symbol> seq : done){
			cores.add(ImmutableList.copyOf(seq.subList(prefix.size(), seq.size() - suffix.size())));
		}
		if (cores.size() < 2){
			record(depth, seqs, done, prefix, suffix, cores, Disambiguation.Outcome.PREFIX_ONLY);
			return;
		}

		if (!Collections.disjoint(stack, cores)){
			Diagnostic.Builder builder = Diagnostic.warning(String.format("Recursion in disambiguation of %s", current));
			grammar.getDefinitionLocation(current).ifPresent(builder::span);
			for (List<Symbol> core : cores){
				builder.note(formatSymbols(core));
			}
			Diagnostic diagnostic = builder.build();
			diagnostic.log(LOG);
			report.addDiagnostic(diagnostic);
			record(depth, seqs, done, prefix, suffix, cores, Disambiguation.Outcome.CYCLE);
			return;
		}
		record(depth, seqs, done, prefix, suffix, cores, Disambiguation.Outcome.RECURSED);
		stack.addAll(cores);
		handleConflict(cores, stack, depth + 1);
		stack.removeAll(cores);
	}

	/**
	 * A sequence during the expansion together with the lengths the sequence had when each non terminal
	 * was expanded at its head.
	 */
	private static class Lead {

		final List<Symbol> symbols;

		final Map<NonTerminal, Integer> expandedAt;

		Lead(List<Symbol> symbols, Map<NonTerminal, Integer> expandedAt) {
			this.symbols = symbols;
			this.expandedAt = expandedAt;
		}
	}

	/**
	 * Replaces leading non terminals by their productions (breadth first) until every sequence starts with
	 * a terminal. Empty sequences are dropped.
	 *
	 * A non terminal that reappears at the head without the sequence having become shorter stems from left
	 * recursion, such sequences aren't expanded further.
	 */
	Set<List<Symbol>> expandLeadingNonTerminals(Set<? extends List<Symbol>> seqs){
		Set<List<Symbol>> done = new TreeSet<>(Production.SEQUENCE_ORDER);
		Set<List<Symbol>> seen = new HashSet<>();
		Deque<Lead> leads = new ArrayDeque<>();
		for (List<Symbol> seq : seqs){
			ImmutableList<Symbol> copy = ImmutableList.copyOf(seq);
			if (seen.add(copy)){
				leads.add(new Lead(copy, Collections.emptyMap()));
			}
		}
		while (!leads.isEmpty()){
			Lead lead = leads.poll();
			List<Symbol> symbols = lead.symbols;
			if (symbols.isEmpty()){
				continue;
			}
			if (symbols.get(0) instanceof Terminal){
				done.add(symbols);
				continue;
			}
			NonTerminal head = (NonTerminal) symbols.get(0);
			Integer previousLength = lead.expandedAt.get(head);
			if (previousLength != null && previousLength <= symbols.size()){
				LOG.finer(() -> String.format("Not expanding left-recursive %s in %s", head, formatSymbols(symbols)));
				continue;
			}
			Map<NonTerminal, Integer> expandedAt = new HashMap<>(lead.expandedAt);
			expandedAt.put(head, symbols.size());
			List<Symbol> tail = symbols.subList(1, symbols.size());
			for (Production production : grammar.getProductions(head)){
				ImmutableList<Symbol> expansion = ImmutableList.<Symbol>builder()
						.addAll(production.right).addAll(tail).build();
				if (seen.add(expansion)){
					leads.add(new Lead(expansion, expandedAt));
				}
			}
		}
		return done;
	}

	static List<Symbol> commonPrefix(Collection<? extends List<Symbol>> seqs){
		List<Symbol> first = seqs.iterator().next();
		int length = minLength(seqs);
		int i = 0;
		outer:
		for (; i < length; i++){
			for (List<Symbol> seq : seqs){
				if (!seq.get(i).equals(first.get(i))){
					break outer;
				}
			}
		}
		return ImmutableList.copyOf(first.subList(0, i));
	}

	/**
	 * Longest common suffix that doesn't overlap with a prefix of the passed length in any sequence
	 */
	static List<Symbol> commonSuffix(Collection<? extends List<Symbol>> seqs, int prefixLength){
		List<Symbol> first = seqs.iterator().next();
		int length = minLength(seqs) - prefixLength;
		int i = 0;
		outer:
		for (; i < length; i++){
			Symbol symbol = first.get(first.size() - 1 - i);
			for (List<Symbol> seq : seqs){
				if (!seq.get(seq.size() - 1 - i).equals(symbol)){
					break outer;
				}
			}
		}
		return ImmutableList.copyOf(first.subList(first.size() - i, first.size()));
	}

	private static int minLength(Collection<? extends List<Symbol>> seqs){
		int length = Integer.MAX_VALUE;
		for (List<Symbol> seq : seqs){
			length = Math.min(length, seq.size());
		}
		return length;
	}

	private void record(int depth, Set<? extends List<Symbol>> group, Set<? extends List<Symbol>> expanded,
	                    List<Symbol> prefix, List<Symbol> suffix, Set<? extends List<Symbol>> cores,
	                    Disambiguation.Outcome outcome){
		report.addDisambiguation(new Disambiguation(current, depth, group, expanded, prefix, suffix, cores, outcome));
	}
}
