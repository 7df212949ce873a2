package pargen.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import pargen.diagnostic.Diagnostic;
import pargen.diagnostic.Severity;
import pargen.grammar.Grammar;
import pargen.grammar.GrammarBuilder;
import pargen.grammar.NonTerminal;
import pargen.grammar.Symbol;
import pargen.grammar.Terminal;

import static java.time.Duration.ofSeconds;
import static org.junit.jupiter.api.Assertions.*;

public class LeftFactoringTest {

	private static final Logger LOG = Logger.getLogger(LeftFactoring.class.getName());

	private final List<LogRecord> warnings = new ArrayList<>();

	private final Handler handler = new Handler() {
		@Override
		public void publish(LogRecord record) {
			if (record.getLevel().intValue() >= Level.WARNING.intValue()){
				synchronized (warnings){
					warnings.add(record);
				}
			}
		}

		@Override
		public void flush() {
		}

		@Override
		public void close() {
		}
	};

	@BeforeEach
	public void addHandler(){
		LOG.addHandler(handler);
	}

	@AfterEach
	public void removeHandler(){
		LOG.removeHandler(handler);
	}

	private static Terminal t(String name){
		return new Terminal(name);
	}

	private static List<Disambiguation> of(FactoringReport report, NonTerminal nonTerminal){
		return report.getDisambiguations().stream()
				.filter(d -> d.nonTerminal.equals(nonTerminal)).collect(Collectors.toList());
	}

	@Test
	public void testSharedPrefix(){
		Grammar g = new GrammarBuilder().add("A", "'x'", "'y'").add("A", "'x'", "'z'").toGrammar("A");
		NonTerminal a = g.nonTerminal("A");
		LeftFactoring factoring = new LeftFactoring(g);
		assertTrue(factoring.hasConflict(g.getProductions(a)));
		FactoringReport report = factoring.leftFactor();
		assertEquals(1, report.getConflicts().size());
		assertEquals(Set.of(t("x")), report.getConflicts().get(0).collidingTerminals);

		List<Disambiguation> disambiguations = report.getDisambiguations();
		assertEquals(3, disambiguations.size());
		Disambiguation top = disambiguations.get(0);
		assertEquals(0, top.depth);
		assertEquals(Disambiguation.Outcome.RECURSED, top.outcome);
		assertEquals(List.of(t("x")), top.prefix);
		assertTrue(top.suffix.isEmpty());
		assertEquals(Set.of(List.of(t("y")), List.of(t("z"))), top.cores);
		for (Disambiguation core : disambiguations.subList(1, 3)){
			assertEquals(1, core.depth);
			assertEquals(Disambiguation.Outcome.TRIVIAL, core.outcome);
		}
		assertTrue(report.getDiagnostics(Severity.WARNING).isEmpty());
		assertEquals(1, report.getDiagnostics(Severity.NOTE).size());
		assertTrue(warnings.isEmpty());
		// nothing is rewritten
		assertEquals(2, g.size());
	}

	@Test
	public void testNoConflictsInLL1Grammar(){
		Grammar g = LeftRecursionEliminatorTest.expressionGrammar();
		new LeftRecursionEliminator(g).eliminate();
		LeftFactoring factoring = new LeftFactoring(g);
		for (NonTerminal nonTerminal : g.getNonTerminals()){
			assertFalse(factoring.hasConflict(g.getProductions(nonTerminal)), nonTerminal.toString());
		}
		FactoringReport report = factoring.leftFactor();
		assertTrue(report.getConflicts().isEmpty());
		assertTrue(report.getDisambiguations().isEmpty());
		assertTrue(report.getDiagnostics().isEmpty());
	}

	@Test
	public void testConflictThroughNonTerminals(){
		Grammar g = new GrammarBuilder()
				.add("A", "B", "'b'")
				.add("A", "C", "'c'")
				.add("A", "'d'")
				.add("B", "'x'")
				.add("C", "'y'")
				.add("C", "'x'")
				.toGrammar("A");
		LeftFactoring factoring = new LeftFactoring(g);
		assertEquals(Set.of(t("x")), factoring.collidingTerminals(g.getProductions(g.nonTerminal("A"))));
		assertFalse(factoring.hasConflict(g.getProductions(g.nonTerminal("C"))));
		FactoringReport report = factoring.leftFactor();
		assertTrue(report.hasConflict(g.nonTerminal("A")));
		assertFalse(report.hasConflict(g.nonTerminal("C")));

		List<Disambiguation> top = of(report, g.nonTerminal("A"));
		assertEquals(Disambiguation.Outcome.TRIVIAL, top.get(0).outcome);
		assertEquals(Set.of(List.of(t("d"))), top.get(0).group);
		assertEquals(2, top.get(1).group.size());
		assertEquals(Set.of(List.of(t("x"), t("b")), List.of(t("x"), t("c")), List.of(t("y"), t("c"))), top.get(1).expanded);
		assertTrue(top.get(1).prefix.isEmpty());
		assertTrue(top.get(1).suffix.isEmpty());
		assertEquals(Disambiguation.Outcome.RECURSED, top.get(1).outcome);
	}

	@Test
	public void testCommonSuffix(){
		Grammar g = new GrammarBuilder()
				.add("A", "'x'", "B", "'y'", "'z'")
				.add("A", "'x'", "C", "'y'", "'z'")
				.add("B", "'b'")
				.add("C", "'c'")
				.toGrammar("A");
		Disambiguation top = new LeftFactoring(g).leftFactor().getDisambiguations().get(0);
		assertEquals(List.of(t("x")), top.prefix);
		assertEquals(List.of(t("y"), t("z")), top.suffix);
		assertEquals(2, top.cores.size());
		assertTrue(top.cores.contains(List.of(g.nonTerminal("B"))));
	}

	@Test
	public void testSuffixDoesNotOverlapPrefix(){
		Grammar g = new GrammarBuilder().add("A", "'x'").add("A", "'x'", "'x'").toGrammar("A");
		FactoringReport report = new LeftFactoring(g).leftFactor();
		Disambiguation top = report.getDisambiguations().get(0);
		assertEquals(List.of(t("x")), top.prefix);
		assertTrue(top.suffix.isEmpty());
		assertEquals(Set.of(List.of(), List.of(t("x"))), top.cores);
		assertEquals(2, report.getDisambiguations().size());
		assertEquals(Disambiguation.Outcome.TRIVIAL, report.getDisambiguations().get(1).outcome);
	}

	@Test
	public void testPrefixAndSuffixHelpers(){
		List<List<Symbol>> seqs = List.<List<Symbol>>of(List.of(t("a"), t("b"), t("a")), List.of(t("a"), t("a")));
		assertEquals(List.of(t("a")), LeftFactoring.commonPrefix(seqs));
		assertEquals(List.of(t("a")), LeftFactoring.commonSuffix(seqs, 1));
		assertEquals(List.of(), LeftFactoring.commonSuffix(seqs, 2));
	}

	@Test
	public void testConvergingAlternatives(){
		Grammar g = new GrammarBuilder()
				.add("A", "B")
				.add("A", "C")
				.add("B", "'x'")
				.add("C", "'x'")
				.toGrammar("A");
		FactoringReport report = new LeftFactoring(g).leftFactor();
		assertTrue(report.hasConflict(g.nonTerminal("A")));
		assertEquals(1, report.getDisambiguations().size());
		assertEquals(Disambiguation.Outcome.CONVERGED, report.getDisambiguations().get(0).outcome);
	}

	@Test
	public void testClustering(){
		Grammar g = new GrammarBuilder()
				.add("A", "'a'", "'x'")
				.add("A", "'a'", "'y'")
				.add("A", "'b'")
				.add("A", "'c'", "'d'")
				.add("A", "'c'", "'e'")
				.add("A", "")
				.toGrammar("A");
		List<Disambiguation> top = new LeftFactoring(g).leftFactor().getDisambiguations().stream()
				.filter(d -> d.depth == 0).collect(Collectors.toList());
		assertEquals(3, top.size());
		assertEquals(List.of(t("a")), top.get(0).prefix);
		assertEquals(Disambiguation.Outcome.TRIVIAL, top.get(1).outcome);
		assertEquals(List.of(t("c")), top.get(2).prefix);
	}

	@Test
	public void testClusterIsConnectedThroughLaterMembers(){
		Grammar g = new GrammarBuilder()
				.add("A", "B")
				.add("A", "D")
				.add("A", "C")
				.add("B", "'x'")
				.add("B", "'y'")
				.add("C", "'y'")
				.add("C", "'z'")
				.add("D", "'z'")
				.toGrammar("A");
		FactoringReport report = new LeftFactoring(g).leftFactor();
		List<Disambiguation> top = of(report, g.nonTerminal("A")).stream()
				.filter(d -> d.depth == 0).collect(Collectors.toList());
		assertEquals(1, top.size());
		assertEquals(3, top.get(0).group.size());
		assertEquals(Set.of(List.of(t("x")), List.of(t("y")), List.of(t("z"))), top.get(0).cores);
	}

	@Test
	public void testCycleIsDetected(){
		Grammar g = new GrammarBuilder()
				.add("A", "'x'", "B", "'y'")
				.add("A", "'x'", "C", "'y'")
				.add("B", "'x'", "B", "'y'")
				.add("B", "'w'")
				.add("C", "'x'", "C", "'y'")
				.add("C", "'w'")
				.toGrammar("A");
		FactoringReport report = assertTimeoutPreemptively(ofSeconds(5), () -> new LeftFactoring(g).leftFactor());
		List<Disambiguation> cycles = report.getDisambiguations(Disambiguation.Outcome.CYCLE);
		assertFalse(cycles.isEmpty());
		Disambiguation cycle = of(report, g.nonTerminal("A")).stream()
				.filter(d -> d.outcome == Disambiguation.Outcome.CYCLE).findFirst().get();
		assertEquals(2, cycle.depth);
		assertEquals(Set.of(List.of(g.nonTerminal("B")), List.of(g.nonTerminal("C"))), cycle.cores);

		List<Diagnostic> diagnostics = report.getDiagnostics(Severity.WARNING);
		assertEquals(cycles.size(), diagnostics.size());
		assertTrue(diagnostics.get(0).message.contains("Recursion in disambiguation of A"));
		assertEquals(List.of("B", "C"), diagnostics.get(0).notes);
		assertEquals(cycles.size(), warnings.size());
	}

	@Test
	public void testTerminatesOnLeftRecursiveGrammar(){
		Grammar g = new GrammarBuilder()
				.add("A", "B", "'x'")
				.add("A", "B", "'y'")
				.add("B", "B", "'z'")
				.add("B", "'w'")
				.toGrammar("A");
		FactoringReport report = assertTimeoutPreemptively(ofSeconds(5), () -> new LeftFactoring(g).leftFactor());
		assertTrue(report.hasConflict(g.nonTerminal("A")));
		assertTrue(report.hasConflict(g.nonTerminal("B")));
		Disambiguation top = of(report, g.nonTerminal("A")).get(0);
		assertEquals(Set.of(List.of(t("w"), t("x")), List.of(t("w"), t("y"))), top.expanded);
		assertEquals(List.of(t("w")), top.prefix);
	}

	@Test
	public void testExpansionSkipsEpsilonAlternatives(){
		Grammar g = new GrammarBuilder()
				.add("A", "B", "'x'")
				.add("A", "B", "'y'")
				.add("B", "'b'")
				.add("B", "")
				.toGrammar("A");
		Set<List<Symbol>> expanded = new LeftFactoring(g).expandLeadingNonTerminals(
				Set.<List<Symbol>>of(List.of(g.nonTerminal("B"), t("x")), List.of(g.nonTerminal("B"), t("y"))));
		assertEquals(Set.of(List.of(t("b"), t("x")), List.of(t("b"), t("y")), List.of(t("x")), List.of(t("y"))), expanded);
	}
}
