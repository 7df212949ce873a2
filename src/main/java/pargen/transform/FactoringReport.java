package pargen.transform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;

import com.google.common.collect.ImmutableSortedSet;

import pargen.diagnostic.Diagnostic;
import pargen.diagnostic.Severity;
import pargen.grammar.NonTerminal;
import pargen.grammar.Terminal;

/**
 * Everything the left-factoring engine found: conflicts, disambiguation attempts and diagnostics.
 */
public class FactoringReport {

	/**
	 * A non terminal whose alternatives can't be told apart with one token of lookahead
	 */
	public static final class Conflict {

		public final NonTerminal nonTerminal;

		/**
		 * Terminals that begin more than one alternative
		 */
		public final ImmutableSortedSet<Terminal> collidingTerminals;

		Conflict(NonTerminal nonTerminal, SortedSet<Terminal> collidingTerminals) {
			this.nonTerminal = nonTerminal;
			this.collidingTerminals = ImmutableSortedSet.copyOfSorted(collidingTerminals);
		}

		@Override
		public String toString() {
			return nonTerminal + " on " + collidingTerminals;
		}
	}

	private final List<Conflict> conflicts = new ArrayList<>();
	private final List<Disambiguation> disambiguations = new ArrayList<>();
	private final List<Diagnostic> diagnostics = new ArrayList<>();

	void addConflict(Conflict conflict){
		conflicts.add(conflict);
	}

	void addDisambiguation(Disambiguation disambiguation){
		disambiguations.add(disambiguation);
	}

	void addDiagnostic(Diagnostic diagnostic){
		diagnostics.add(diagnostic);
	}

	public List<Conflict> getConflicts(){
		return Collections.unmodifiableList(conflicts);
	}

	public boolean hasConflict(NonTerminal nonTerminal){
		for (Conflict conflict : conflicts){
			if (conflict.nonTerminal.equals(nonTerminal)){
				return true;
			}
		}
		return false;
	}

	public List<Disambiguation> getDisambiguations(){
		return Collections.unmodifiableList(disambiguations);
	}

	public List<Disambiguation> getDisambiguations(Disambiguation.Outcome outcome){
		List<Disambiguation> ret = new ArrayList<>();
		for (Disambiguation disambiguation : disambiguations){
			if (disambiguation.outcome == outcome){
				ret.add(disambiguation);
			}
		}
		return ret;
	}

	public List<Diagnostic> getDiagnostics(){
		return Collections.unmodifiableList(diagnostics);
	}

	public List<Diagnostic> getDiagnostics(Severity severity){
		List<Diagnostic> ret = new ArrayList<>();
		for (Diagnostic diagnostic : diagnostics){
			if (diagnostic.severity == severity){
				ret.add(diagnostic);
			}
		}
		return ret;
	}
}
