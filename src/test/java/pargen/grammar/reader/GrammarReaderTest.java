package pargen.grammar.reader;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import pargen.grammar.Grammar;
import pargen.grammar.NonTerminal;
import pargen.grammar.Terminal;

import static org.junit.jupiter.api.Assertions.*;

public class GrammarReaderTest {

	@Test
	public void testExpressionGrammar(){
		Grammar g = new GrammarReader("# expressions\nS = S \"+\" T | T ;\nT = 'id' ; # leaf\n").read();
		NonTerminal s = g.getNonTerminal("S").get();
		NonTerminal t = g.getNonTerminal("T").get();
		assertEquals(s, g.getStart().get());
		assertEquals(2, g.getProductions(s).size());
		assertEquals(new Terminal("id"), g.getProductions(t).get(0).right.get(0));
		assertEquals(new Location(2, 1), g.getDefinitionLocation(s).get());
		assertEquals(new Location(3, 1), g.getDefinitionLocation(t).get());
	}

	@Test
	public void testEpsilonAndArrow(){
		Grammar g = new GrammarReader("A -> 'a' A | ;").read();
		NonTerminal a = g.getNonTerminal("A").get();
		assertTrue(g.getProductions(a).get(0).isEpsilonProduction());
		assertEquals("<a> A", g.getProductions(a).get(1).formatRightSide());
	}

	@Test
	public void testEscapedQuote(){
		Grammar g = new GrammarReader("A = '\\'' \"\\\"\";").read();
		assertEquals("<'> <\">", g.getProductions(g.getNonTerminal("A").get()).get(0).formatRightSide());
	}

	@Test
	public void testPrimedNames(){
		Grammar g = new GrammarReader("E = T E' ; E' = '+' T E' | ; T = 'id';").read();
		assertTrue(g.getNonTerminal("E'").isPresent());
		assertTrue(g.findUndefinedNonTerminals().isEmpty());
	}

	@ParameterizedTest
	@ValueSource(strings = {"", "# only a comment", "A", "A = 'a'", "A = 'a' ; A = 'b' ;", "= 'a' ;",
			"A = 'unterminated ;", "A = '' ;", "A = $ ;", "A = 'a' | | B B = 'b';"})
	public void testInvalidGrammars(String grammar){
		assertThrows(GrammarSyntaxError.class, () -> new GrammarReader(grammar).read());
	}

	@Test
	public void testErrorLocation(){
		GrammarSyntaxError error = assertThrows(GrammarSyntaxError.class,
				() -> new GrammarReader("A = 'a';\nB = $;").read());
		assertEquals(new Location(2, 5), error.errorLocation);
		assertTrue(error.getMessage().contains("[2:5]"));
	}
}
