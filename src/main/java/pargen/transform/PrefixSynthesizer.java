package pargen.transform;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import pargen.grammar.Grammar;
import pargen.grammar.NonTerminal;
import pargen.grammar.Production;
import pargen.grammar.Symbol;

/**
 * Left-factors the alternatives of each non terminal syntactically.
 *
 * Alternatives <pre>A → γ α₁ | … | γ αₙ</pre> that share their first symbol are replaced by
 * <pre>A → γ A'</pre> and <pre>A' → α₁ | … | αₙ</pre>, with γ being their longest common prefix. New auxiliary
 * non terminals are processed too, until no two alternatives of a non terminal start with the same symbol.
 *
 * Leading non terminals aren't expanded, alternatives that only collide after expansion are reported by
 * {@link LeftFactoring} but stay as they are.
 */
public class PrefixSynthesizer {

	private static final Logger LOG = Logger.getLogger(PrefixSynthesizer.class.getName());

	private final Grammar grammar;

	public PrefixSynthesizer(Grammar grammar) {
		this.grammar = grammar;
	}

	/**
	 * Rewrites the grammar in place.
	 *
	 * @return the auxiliary non terminals created for each factored non terminal
	 */
	public Map<NonTerminal, List<NonTerminal>> synthesize(){
		LOG.info("Synthesizing left-factored productions");
		Map<NonTerminal, List<NonTerminal>> created = new LinkedHashMap<>();
		Deque<NonTerminal> worklist = new ArrayDeque<>(grammar.getNonTerminals());
		while (!worklist.isEmpty()){
			NonTerminal nonTerminal = worklist.poll();
			for (List<Production> group : groupByFirstSymbol(grammar.getProductions(nonTerminal))){
				NonTerminal aux = factor(nonTerminal, group);
				created.computeIfAbsent(nonTerminal, nt -> new ArrayList<>()).add(aux);
				worklist.add(aux);
			}
		}
		return created;
	}

	/**
	 * Groups of at least two productions that start with the same symbol, the passed productions have to be
	 * ordered by their right hand sides.
	 */
	private List<List<Production>> groupByFirstSymbol(List<Production> productions){
		List<List<Production>> groups = new ArrayList<>();
		List<Production> group = new ArrayList<>();
		for (Production production : productions){
			if (production.isEpsilonProduction()){
				continue;
			}
			if (!group.isEmpty() && !group.get(0).right.get(0).equals(production.right.get(0))){
				if (group.size() > 1){
					groups.add(group);
				}
				group = new ArrayList<>();
			}
			group.add(production);
		}
		if (group.size() > 1){
			groups.add(group);
		}
		return groups;
	}

	private NonTerminal factor(NonTerminal nonTerminal, List<Production> group){
		List<List<Symbol>> rights = new ArrayList<>();
		for (Production production : group){
			rights.add(production.right);
		}
		List<Symbol> prefix = LeftFactoring.commonPrefix(rights);
		NonTerminal aux = grammar.anonymousNonTerminal(nonTerminal);
		LOG.log(Level.FINE, "Factoring {0} out of {1} alternatives of {2} into {3}",
				new Object[]{Production.formatSymbols(prefix), group.size(), nonTerminal, aux});
		for (Production production : group){
			grammar.addProduction(aux, production.right.subList(prefix.size(), production.right.size()));
			grammar.removeProduction(production);
		}
		List<Symbol> symbols = new ArrayList<>(prefix);
		symbols.add(aux);
		grammar.addProduction(nonTerminal, symbols);
		return aux;
	}
}
