package pargen.grammar.reader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import pargen.PargenException;
import pargen.grammar.Grammar;
import pargen.grammar.NonTerminal;
import pargen.grammar.Symbol;
import pargen.grammar.Terminal;

import static pargen.util.Utils.toPrintableRepresentation;

/**
 * Reader for textual grammar descriptions like
 *
 * <pre>
 * # comment
 * expr = expr "+" term | term ;
 * term = 'id' ;
 * </pre>
 *
 * Identifiers are non terminals, quoted strings are terminals and empty alternatives are ε. The rule
 * separator is <code>=</code> or <code>-&gt;</code>. The first rule defines the start non terminal.
 */
public class GrammarReader {

	private static final Logger LOG = Logger.getLogger(GrammarReader.class.getName());

	private enum TokenType {
		IDENTIFIER, STRING, DEFINES, OR, SEMICOLON, EOF
	}

	private static class Token {

		final TokenType type;
		final String value;
		final Location location;

		Token(TokenType type, String value, Location location) {
			this.type = type;
			this.value = value;
			this.location = location;
		}

		@Override
		public String toString() {
			switch (type){
				case EOF:
					return "end of input";
				case STRING:
					return "terminal " + toPrintableRepresentation(value);
				default:
					return toPrintableRepresentation(value);
			}
		}
	}

	private final String input;
	private int pos = 0;
	private int line = 1;
	private int column = 1;
	private Token current;
	private Grammar grammar;

	public GrammarReader(String input) {
		this.input = input;
	}

	public static Grammar read(Path file){
		try {
			return new GrammarReader(new String(Files.readAllBytes(file), StandardCharsets.UTF_8)).read();
		} catch (IOException e) {
			throw new PargenException("Can't read grammar file " + file, e);
		}
	}

	/**
	 * Parses the whole input.
	 *
	 * @throws GrammarSyntaxError if the input isn't a valid grammar description
	 */
	public Grammar read(){
		grammar = new Grammar();
		next();
		if (current.type == TokenType.EOF){
			throw new GrammarSyntaxError(current.location, "Grammar without rules");
		}
		while (current.type != TokenType.EOF){
			readRule();
		}
		LOG.log(Level.FINE, "Read grammar with {0} productions", grammar.size());
		return grammar;
	}

	private void readRule(){
		Token name = expect(TokenType.IDENTIFIER);
		NonTerminal nonTerminal = grammar.nonTerminal(name.value);
		if (grammar.getDefinitionLocation(nonTerminal).isPresent()){
			throw new GrammarSyntaxError(name.location, String.format("Non terminal %s is already defined at %s",
					nonTerminal, grammar.getDefinitionLocation(nonTerminal).get()));
		}
		grammar.setDefinitionLocation(nonTerminal, name.location);
		if (!grammar.getStart().isPresent()){
			grammar.setStart(nonTerminal);
		}
		expect(TokenType.DEFINES);
		grammar.addProduction(nonTerminal, readAlternative());
		while (current.type == TokenType.OR){
			next();
			grammar.addProduction(nonTerminal, readAlternative());
		}
		expect(TokenType.SEMICOLON);
	}

	private List<Symbol> readAlternative(){
		List<Symbol> symbols = new ArrayList<>();
		while (true){
			if (current.type == TokenType.IDENTIFIER){
				symbols.add(grammar.nonTerminal(current.value));
			} else if (current.type == TokenType.STRING){
				symbols.add(new Terminal(current.value));
			} else {
				return symbols;
			}
			next();
		}
	}

	private Token expect(TokenType type){
		if (current.type != type){
			throw new GrammarSyntaxError(current.location, String.format("Expected %s but got %s",
					type.name().toLowerCase(), current));
		}
		Token token = current;
		next();
		return token;
	}

	private void next(){
		skipWhitespaceAndComments();
		Location location = new Location(line, column);
		if (pos >= input.length()){
			current = new Token(TokenType.EOF, "", location);
			return;
		}
		char ch = input.charAt(pos);
		if (Character.isLetter(ch) || ch == '_'){
			int start = pos;
			while (pos < input.length() && isIdentifierPart(input.charAt(pos))){
				advance();
			}
			current = new Token(TokenType.IDENTIFIER, input.substring(start, pos), location);
		} else if (ch == '"' || ch == '\''){
			current = new Token(TokenType.STRING, readString(ch, location), location);
		} else if (ch == '='){
			advance();
			current = new Token(TokenType.DEFINES, "=", location);
		} else if (input.startsWith("->", pos)){
			advance();
			advance();
			current = new Token(TokenType.DEFINES, "->", location);
		} else if (ch == '|'){
			advance();
			current = new Token(TokenType.OR, "|", location);
		} else if (ch == ';'){
			advance();
			current = new Token(TokenType.SEMICOLON, ";", location);
		} else {
			throw new GrammarSyntaxError(location, "Unexpected character " + toPrintableRepresentation(String.valueOf(ch)));
		}
	}

	private String readString(char quote, Location location){
		advance();
		StringBuilder builder = new StringBuilder();
		while (pos < input.length() && input.charAt(pos) != quote){
			char ch = input.charAt(pos);
			if (ch == '\n'){
				break;
			}
			if (ch == '\\' && pos + 1 < input.length()){
				advance();
				ch = input.charAt(pos);
			}
			builder.append(ch);
			advance();
		}
		if (pos >= input.length() || input.charAt(pos) != quote){
			throw new GrammarSyntaxError(location, "Unterminated terminal");
		}
		advance();
		if (builder.length() == 0){
			throw new GrammarSyntaxError(location, "Empty terminal, use an empty alternative for ε");
		}
		return builder.toString();
	}

	private static boolean isIdentifierPart(char ch){
		return Character.isLetterOrDigit(ch) || ch == '_' || ch == '\'';
	}

	private void skipWhitespaceAndComments(){
		while (pos < input.length()){
			char ch = input.charAt(pos);
			if (ch == '#'){
				while (pos < input.length() && input.charAt(pos) != '\n'){
					advance();
				}
			} else if (Character.isWhitespace(ch)){
				advance();
			} else {
				return;
			}
		}
	}

	private void advance(){
		if (input.charAt(pos) == '\n'){
			line++;
			column = 1;
		} else {
			column++;
		}
		pos++;
	}
}
