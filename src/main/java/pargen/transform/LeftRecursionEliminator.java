package pargen.transform;

import java.util.ArrayList;
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
 * Removes immediate left recursion from a grammar.
 *
 * For every non terminal <pre>A → A α₁ | … | A αₙ | β₁ | … | βₘ</pre> a fresh auxiliary non terminal A' is created
 * and the productions are replaced by <pre>A → β₁ A' | … | βₘ A'</pre> and <pre>A' → α₁ A' | … | αₙ A' | ε</pre>.
 *
 * Only productions whose first symbol is literally their own left hand side are considered; recursion
 * through other non terminals is left untouched.
 */
public class LeftRecursionEliminator {

	private static final Logger LOG = Logger.getLogger(LeftRecursionEliminator.class.getName());

	private final Grammar grammar;

	public LeftRecursionEliminator(Grammar grammar) {
		this.grammar = grammar;
	}

	/**
	 * Rewrites the grammar in place.
	 *
	 * @return map from each rewritten non terminal to its auxiliary non terminal
	 */
	public Map<NonTerminal, NonTerminal> eliminate(){
		LOG.info("Removing left-recursion");
		Map<NonTerminal, List<Production>> recursive = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			List<Production> leftRec = new ArrayList<>();
			for (Production production : grammar.getProductions(nonTerminal)){
				if (production.isImmediatelyLeftRecursive()){
					leftRec.add(production);
				}
			}
			if (!leftRec.isEmpty()){
				recursive.put(nonTerminal, leftRec);
			}
		}
		Map<NonTerminal, NonTerminal> auxiliaries = new LinkedHashMap<>();
		for (Map.Entry<NonTerminal, List<Production>> entry : recursive.entrySet()){
			auxiliaries.put(entry.getKey(), eliminate(entry.getKey(), entry.getValue()));
		}
		return auxiliaries;
	}

	private NonTerminal eliminate(NonTerminal nonTerminal, List<Production> leftRec){
		LOG.log(Level.FINE, "Removing left-recursion in {0}", nonTerminal);
		NonTerminal aux = grammar.anonymousNonTerminal(nonTerminal);

		// A → A α  becomes  A' → α A', A → A is dropped
		for (Production production : leftRec){
			if (production.right.size() == 1){
				grammar.removeProduction(production);
				continue;
			}
			List<Symbol> symbols = new ArrayList<>(production.right.subList(1, production.right.size()));
			symbols.add(aux);
			grammar.addProduction(aux, symbols);
			grammar.removeProduction(production);
		}
		grammar.addProduction(aux, new ArrayList<>());

		// A → β  becomes  A → β A'
		for (Production production : grammar.getProductions(nonTerminal)){
			List<Symbol> symbols = new ArrayList<>(production.right);
			symbols.add(aux);
			grammar.addProduction(nonTerminal, symbols);
			grammar.removeProduction(production);
		}
		if (LOG.isLoggable(Level.FINER)){
			for (Production production : grammar.getProductions(nonTerminal)){
				LOG.finer("  " + production);
			}
			for (Production production : grammar.getProductions(aux)){
				LOG.finer("  " + production);
			}
		}
		return aux;
	}
}
