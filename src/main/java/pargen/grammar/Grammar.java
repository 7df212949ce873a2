package pargen.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

import pargen.PargenException;
import pargen.grammar.reader.Location;

import static pargen.util.Utils.join;

/**
 * Mutable grammar context: maps each non terminal to the ordered set of its productions.
 *
 * Productions are stored in an arena with stable indices. The per non terminal sets only hold indices,
 * ordered lexicographically by the right hand sides, so iteration is deterministic. Removing a production
 * tombstones its arena slot.
 *
 * Use the {@link GrammarBuilder} or the {@link pargen.grammar.reader.GrammarReader} to build a grammar
 * conveniently.
 */
public class Grammar {

	/**
	 * Thrown if an internal precondition of the grammar operations is violated
	 */
	public static class InvariantViolationError extends PargenException {
		InvariantViolationError(String msg){
			super(msg);
		}
	}

	/**
	 * Production arena, removed productions are null
	 */
	private final List<Production> arena = new ArrayList<>();

	private final Map<NonTerminal, TreeMap<List<Symbol>, Integer>> productionIndices = new TreeMap<>();

	private final Map<String, NonTerminal> namedNonTerminals = new HashMap<>();

	private final Map<NonTerminal, Location> definitionLocations = new HashMap<>();

	/**
	 * Source of the ids of all non terminals, named or anonymous
	 */
	private int nonTerminalCounter = 0;

	private NonTerminal start;

	/**
	 * Returns the named non terminal with the passed name, creating it on first use.
	 */
	public NonTerminal nonTerminal(String name){
		NonTerminal nonTerminal = namedNonTerminals.get(name);
		if (nonTerminal == null){
			nonTerminal = new NonTerminal(nonTerminalCounter++, name, false);
			namedNonTerminals.put(name, nonTerminal);
		}
		return nonTerminal;
	}

	public Optional<NonTerminal> getNonTerminal(String name){
		return Optional.ofNullable(namedNonTerminals.get(name));
	}

	/**
	 * Allocates a fresh non terminal that has never been used in this grammar.
	 */
	public NonTerminal anonymousNonTerminal(){
		int id = nonTerminalCounter++;
		return new NonTerminal(id, "#" + id, true);
	}

	/**
	 * Allocates a fresh non terminal, its name is derived from the passed non terminal.
	 */
	public NonTerminal anonymousNonTerminal(NonTerminal origin){
		String base = origin.name;
		if (base.contains("#")){
			base = base.substring(0, base.indexOf('#'));
		}
		int id = nonTerminalCounter++;
		return new NonTerminal(id, base + "#" + id, true);
	}

	/**
	 * Inserts the production <pre>nonTerminal → symbols</pre>, does nothing if it is already present.
	 *
	 * @return the production
	 */
	public Production addProduction(NonTerminal nonTerminal, List<Symbol> symbols){
		checkOwnNonTerminal(nonTerminal);
		for (Symbol symbol : symbols){
			if (symbol instanceof NonTerminal){
				checkOwnNonTerminal((NonTerminal) symbol);
			}
		}
		TreeMap<List<Symbol>, Integer> indices =
				productionIndices.computeIfAbsent(nonTerminal, nt -> new TreeMap<>(Production.SEQUENCE_ORDER));
		Production production = new Production(nonTerminal, symbols);
		Integer present = indices.get(production.right);
		if (present != null){
			return arena.get(present);
		}
		indices.put(production.right, arena.size());
		arena.add(production);
		return production;
	}

	/**
	 * Removes the passed production.
	 *
	 * @throws InvariantViolationError if the production isn't part of the grammar
	 */
	public void removeProduction(Production production){
		TreeMap<List<Symbol>, Integer> indices = productionIndices.get(production.left);
		Integer index = indices == null ? null : indices.remove(production.right);
		if (index == null){
			throw new InvariantViolationError(String.format("Production %s isn't part of the grammar", production));
		}
		arena.set(index, null);
	}

	public boolean containsProduction(Production production){
		TreeMap<List<Symbol>, Integer> indices = productionIndices.get(production.left);
		return indices != null && indices.containsKey(production.right);
	}

	/**
	 * Snapshot of the productions of the passed non terminal, ordered by their right hand sides
	 */
	public ImmutableList<Production> getProductions(NonTerminal nonTerminal){
		TreeMap<List<Symbol>, Integer> indices = productionIndices.get(nonTerminal);
		if (indices == null){
			return ImmutableList.of();
		}
		ImmutableList.Builder<Production> builder = ImmutableList.builder();
		for (int index : indices.values()){
			builder.add(arena.get(index));
		}
		return builder.build();
	}

	/**
	 * Snapshot of all productions, ordered by left and right hand side
	 */
	public ImmutableList<Production> getProductions(){
		ImmutableList.Builder<Production> builder = ImmutableList.builder();
		for (NonTerminal nonTerminal : productionIndices.keySet()){
			builder.addAll(getProductions(nonTerminal));
		}
		return builder.build();
	}

	/**
	 * Non terminals that own at least one production, in id order
	 */
	public ImmutableSortedSet<NonTerminal> getNonTerminals(){
		ImmutableSortedSet.Builder<NonTerminal> builder = ImmutableSortedSet.naturalOrder();
		for (Map.Entry<NonTerminal, TreeMap<List<Symbol>, Integer>> entry : productionIndices.entrySet()){
			if (!entry.getValue().isEmpty()){
				builder.add(entry.getKey());
			}
		}
		return builder.build();
	}

	/**
	 * Number of live productions
	 */
	public int size(){
		int size = 0;
		for (TreeMap<List<Symbol>, Integer> indices : productionIndices.values()){
			size += indices.size();
		}
		return size;
	}

	/**
	 * Non terminals that are used on a right hand side but don't have a production of their own
	 */
	public SortedSet<NonTerminal> findUndefinedNonTerminals(){
		SortedSet<NonTerminal> undefined = new TreeSet<>();
		Set<NonTerminal> defined = getNonTerminals();
		for (Production production : getProductions()){
			for (Symbol symbol : production.right){
				if (symbol instanceof NonTerminal && !defined.contains(symbol)){
					undefined.add((NonTerminal) symbol);
				}
			}
		}
		return undefined;
	}

	/**
	 * Calculates the set of terminals that can begin a derivation of the passed symbol sequence.
	 *
	 * Only the first symbol is taken into account, an empty sequence has an empty first set. Non terminals
	 * that are reached again while being expanded contribute nothing, therefore the calculation
	 * terminates on left recursive grammars too.
	 */
	public SortedSet<Terminal> firstSetOfSymbols(List<Symbol> symbols){
		SortedSet<Terminal> firstSet = new TreeSet<>();
		collectFirstSet(symbols, new HashSet<>(), firstSet);
		return firstSet;
	}

	public SortedSet<Terminal> firstSetOfNonTerminal(NonTerminal nonTerminal){
		return firstSetOfSymbols(Collections.singletonList(nonTerminal));
	}

	private void collectFirstSet(List<Symbol> symbols, Set<NonTerminal> visited, Set<Terminal> acc){
		if (symbols.isEmpty()){
			return;
		}
		Symbol first = symbols.get(0);
		if (first instanceof Terminal){
			acc.add((Terminal) first);
			return;
		}
		NonTerminal nonTerminal = (NonTerminal) first;
		if (!visited.add(nonTerminal)){
			return;
		}
		for (Production production : getProductions(nonTerminal)){
			collectFirstSet(production.right, visited, acc);
		}
	}

	public Optional<NonTerminal> getStart(){
		return Optional.ofNullable(start);
	}

	public void setStart(NonTerminal start){
		checkOwnNonTerminal(start);
		this.start = start;
	}

	/**
	 * Records where the passed non terminal is defined in the grammar source
	 */
	public void setDefinitionLocation(NonTerminal nonTerminal, Location location){
		definitionLocations.put(nonTerminal, location);
	}

	public Optional<Location> getDefinitionLocation(NonTerminal nonTerminal){
		return Optional.ofNullable(definitionLocations.get(nonTerminal));
	}

	private void checkOwnNonTerminal(NonTerminal nonTerminal){
		if (nonTerminal.id >= nonTerminalCounter
				|| (!nonTerminal.anonymous && namedNonTerminals.get(nonTerminal.name) != nonTerminal)){
			throw new InvariantViolationError(String.format("Non terminal %s doesn't belong to this grammar", nonTerminal));
		}
	}

	public String longDescription(){
		List<String> lines = new ArrayList<>();
		for (NonTerminal nonTerminal : getNonTerminals()){
			List<String> alternatives = new ArrayList<>();
			for (Production production : getProductions(nonTerminal)){
				alternatives.add(production.formatRightSide());
			}
			lines.add(nonTerminal + " → " + String.join(" | ", alternatives));
		}
		return "Start non terminal: " + getStart().map(NonTerminal::toString).orElse("-") + "\n" +
				"Productions: \n" + join(lines, "\n");
	}

	@Override
	public String toString() {
		return longDescription();
	}
}
