package pargen.grammar.derive;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

import pargen.grammar.Grammar;
import pargen.grammar.NonTerminal;
import pargen.grammar.Production;
import pargen.grammar.Symbol;
import pargen.grammar.Terminal;

/**
 * Enumerates the sentences of a grammar up to a maximum length.
 *
 * Works breadth first on leftmost derivations. Sentential forms with more terminals than the maximum
 * sentence length or more symbols than the maximum form length are discarded, so the enumeration
 * terminates on every grammar, left recursive ones included.
 */
public class SentenceEnumerator {

	public static final Ordering<Iterable<Terminal>> SENTENCE_ORDER = Ordering.<Terminal>natural().lexicographical();

	private final Grammar grammar;
	private final int maxLength;
	private final int maxFormLength;

	/**
	 * @param maxLength maximum number of terminals per sentence
	 * @param maxFormLength maximum number of symbols in an intermediate sentential form
	 */
	public SentenceEnumerator(Grammar grammar, int maxLength, int maxFormLength) {
		if (maxLength < 0 || maxFormLength < maxLength){
			throw new IllegalArgumentException(String.format("Invalid bounds %d and %d", maxLength, maxFormLength));
		}
		this.grammar = grammar;
		this.maxLength = maxLength;
		this.maxFormLength = maxFormLength;
	}

	public SentenceEnumerator(Grammar grammar, int maxLength) {
		this(grammar, maxLength, 2 * maxLength + 2);
	}

	/**
	 * All sentences with at most maxLength terminals that are derivable from the passed non terminal
	 */
	public SortedSet<List<Terminal>> enumerate(NonTerminal start){
		SortedSet<List<Terminal>> sentences = new TreeSet<>(SENTENCE_ORDER);
		Set<List<Symbol>> visited = new HashSet<>();
		Deque<List<Symbol>> forms = new ArrayDeque<>();
		List<Symbol> initial = ImmutableList.of(start);
		visited.add(initial);
		forms.add(initial);
		while (!forms.isEmpty()){
			List<Symbol> form = forms.poll();
			int index = firstNonTerminal(form);
			if (index == -1){
				List<Terminal> sentence = new ArrayList<>();
				for (Symbol symbol : form){
					sentence.add((Terminal) symbol);
				}
				sentences.add(Collections.unmodifiableList(sentence));
				continue;
			}
			for (Production production : grammar.getProductions((NonTerminal) form.get(index))){
				List<Symbol> derived = ImmutableList.<Symbol>builder()
						.addAll(form.subList(0, index))
						.addAll(production.right)
						.addAll(form.subList(index + 1, form.size())).build();
				if (derived.size() <= maxFormLength && countTerminals(derived) <= maxLength && visited.add(derived)){
					forms.add(derived);
				}
			}
		}
		return sentences;
	}

	/**
	 * Sentences derivable from the start non terminal of the grammar
	 */
	public SortedSet<List<Terminal>> enumerate(){
		return enumerate(grammar.getStart().orElseThrow(() -> new IllegalStateException("Grammar without start non terminal")));
	}

	private static int firstNonTerminal(List<Symbol> form){
		for (int i = 0; i < form.size(); i++){
			if (form.get(i) instanceof NonTerminal){
				return i;
			}
		}
		return -1;
	}

	private static int countTerminals(List<Symbol> form){
		int count = 0;
		for (Symbol symbol : form){
			if (symbol instanceof Terminal){
				count++;
			}
		}
		return count;
	}
}
