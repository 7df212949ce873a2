package pargen.grammar.reader;

import pargen.LocatedPargenException;

/**
 * An error thrown after encountering a syntax error in a grammar description
 */
public class GrammarSyntaxError extends LocatedPargenException {

	public GrammarSyntaxError(Location location, String message) {
		super(location, message);
	}
}
