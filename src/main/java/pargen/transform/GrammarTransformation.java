package pargen.transform;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import pargen.Config;
import pargen.grammar.Grammar;
import pargen.grammar.NonTerminal;

/**
 * Prepares a grammar for the LL table construction: removes immediate left recursion, optionally
 * left-factors common prefixes and finally reports the remaining lookahead conflicts.
 */
public class GrammarTransformation {

	public static class Result {

		/**
		 * Auxiliary non terminal of every non terminal that was left recursive
		 */
		public final Map<NonTerminal, NonTerminal> recursionAuxiliaries;

		/**
		 * Auxiliary non terminals created by the prefix synthesis, empty if it was disabled
		 */
		public final Map<NonTerminal, List<NonTerminal>> factoringAuxiliaries;

		public final FactoringReport report;

		Result(Map<NonTerminal, NonTerminal> recursionAuxiliaries,
		       Map<NonTerminal, List<NonTerminal>> factoringAuxiliaries, FactoringReport report) {
			this.recursionAuxiliaries = Collections.unmodifiableMap(recursionAuxiliaries);
			this.factoringAuxiliaries = Collections.unmodifiableMap(factoringAuxiliaries);
			this.report = report;
		}
	}

	private final boolean synthesizeFactoring;

	public GrammarTransformation(boolean synthesizeFactoring) {
		this.synthesizeFactoring = synthesizeFactoring;
	}

	public GrammarTransformation() {
		this(Config.synthesizeFactoring());
	}

	/**
	 * Transforms the passed grammar in place
	 */
	public Result transform(Grammar grammar){
		Map<NonTerminal, NonTerminal> recursionAuxiliaries = new LeftRecursionEliminator(grammar).eliminate();
		Map<NonTerminal, List<NonTerminal>> factoringAuxiliaries = Collections.emptyMap();
		if (synthesizeFactoring){
			factoringAuxiliaries = new PrefixSynthesizer(grammar).synthesize();
		}
		FactoringReport report = new LeftFactoring(grammar).leftFactor();
		return new Result(recursionAuxiliaries, factoringAuxiliaries, report);
	}
}
