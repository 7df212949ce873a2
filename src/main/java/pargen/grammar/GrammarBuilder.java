package pargen.grammar;

import java.util.ArrayList;
import java.util.List;

import pargen.PargenException;

/**
 * Allows the simple creation of grammars.
 *
 * In this class quoted strings (<code>"'+'"</code> or <code>"\"+\""</code>) are treated as terminals, the empty
 * string as ε and all other strings as names of non terminals. Nested arrays (as returned by {@link #star(Object...)}
 * and friends) are flattened.
 */
public class GrammarBuilder {

	private final Grammar grammar = new Grammar();

	/**
	 * Adds a new production.
	 *
	 * @param left name of the defining non terminal on the left hand side of the production
	 * @param right right hand side of the production
	 */
	public GrammarBuilder add(String left, Object... right){
		grammar.addProduction(grammar.nonTerminal(left), toSymbols(right));
		return this;
	}

	/**
	 * Returns it's arguments.
	 */
	public Object[] combine(Object... args){
		return args;
	}

	/**
	 * Creates rules that match the passed symbols many or zero times.
	 *
	 * @param args passed symbols
	 * @return new symbols that represent this construct
	 */
	public Object[] star(Object... args){
		NonTerminal newNonTerminal = grammar.anonymousNonTerminal();
		List<Symbol> symbols = toSymbols(args);
		symbols.add(newNonTerminal);
		grammar.addProduction(newNonTerminal, symbols);
		grammar.addProduction(newNonTerminal, new ArrayList<>());
		return new Object[]{newNonTerminal};
	}

	public Object[] or(Object... args){
		NonTerminal newNonTerminal = grammar.anonymousNonTerminal();
		for (Object arg : args){
			grammar.addProduction(newNonTerminal, toSymbols(new Object[]{arg}));
		}
		return new Object[]{newNonTerminal};
	}

	public Object[] maybe(Object... args){
		NonTerminal newNonTerminal = grammar.anonymousNonTerminal();
		grammar.addProduction(newNonTerminal, toSymbols(args));
		grammar.addProduction(newNonTerminal, new ArrayList<>());
		return new Object[]{newNonTerminal};
	}

	private List<Symbol> toSymbols(Object[] arr){
		List<Symbol> symbols = new ArrayList<>();
		for (Object obj : arr){
			if (obj instanceof Object[]){
				symbols.addAll(toSymbols((Object[]) obj));
			} else if (obj instanceof Symbol){
				symbols.add((Symbol) obj);
			} else if (obj instanceof String){
				String str = (String) obj;
				if (str.isEmpty()){
					continue;
				}
				if (isQuoted(str)){
					symbols.add(new Terminal(str.substring(1, str.length() - 1)));
				} else {
					symbols.add(grammar.nonTerminal(str));
				}
			} else {
				throw new PargenException("Right part of production object list has unsupported type " + obj);
			}
		}
		return symbols;
	}

	private static boolean isQuoted(String str){
		if (str.length() < 3){
			return false;
		}
		char first = str.charAt(0);
		return (first == '"' || first == '\'') && str.charAt(str.length() - 1) == first;
	}

	/**
	 * Returns the built grammar, the builder must not be used afterwards.
	 *
	 * @param startNonTerminal name of the start non terminal
	 */
	public Grammar toGrammar(String startNonTerminal){
		grammar.setStart(grammar.nonTerminal(startNonTerminal));
		return grammar;
	}

	public Grammar toGrammar(){
		return grammar;
	}
}
