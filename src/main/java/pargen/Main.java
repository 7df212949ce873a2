package pargen;

import java.nio.file.Paths;
import java.util.List;
import java.util.SortedSet;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import pargen.diagnostic.Diagnostic;
import pargen.diagnostic.Severity;
import pargen.grammar.Grammar;
import pargen.grammar.NonTerminal;
import pargen.grammar.Terminal;
import pargen.grammar.derive.SentenceEnumerator;
import pargen.grammar.reader.GrammarReader;
import pargen.transform.GrammarTransformation;

import static pargen.util.Utils.join;

/**
 * Command line interface: reads a grammar file, transforms it and prints the result.
 *
 * <pre>pargen GRAMMAR_FILE [--synthesize] [--sentences=N] [--log=LEVEL]</pre>
 */
public class Main {

	private static final Logger LOG = Logger.getLogger("pargen");

	public static void main(String[] args) {
		String file = null;
		for (String arg : args){
			if (arg.equals("--synthesize")){
				Config.set("synthesizeFactoring", "yes");
			} else if (arg.startsWith("--sentences=")){
				Config.set("sentenceLength", arg.substring("--sentences=".length()));
			} else if (arg.startsWith("--log=")){
				Config.set("logLevel", arg.substring("--log=".length()));
			} else if (file == null && !arg.startsWith("--")){
				file = arg;
			} else {
				usage();
			}
		}
		if (file == null){
			usage();
		}
		configureLogging(Config.getLogLevel());
		try {
			System.exit(run(GrammarReader.read(Paths.get(file))) ? 0 : 1);
		} catch (PargenException e) {
			System.err.println(e.getMessage());
			System.exit(1);
		}
	}

	/**
	 * Transforms the grammar and prints it with all diagnostics.
	 *
	 * @return false if errors were found
	 */
	static boolean run(Grammar grammar){
		boolean ok = true;
		for (NonTerminal undefined : grammar.findUndefinedNonTerminals()){
			Diagnostic diagnostic = Diagnostic.error(String.format("Non terminal %s is used but never defined", undefined)).build();
			diagnostic.log(LOG);
			System.err.println(diagnostic.format());
			ok = false;
		}
		if (!ok){
			return false;
		}
		GrammarTransformation.Result result = new GrammarTransformation().transform(grammar);
		System.out.println(grammar.longDescription());
		for (Diagnostic diagnostic : result.report.getDiagnostics()){
			System.err.println(diagnostic.format());
		}
		int sentenceLength = Config.getSentenceLength();
		if (sentenceLength > 0 && grammar.getStart().isPresent()){
			SortedSet<List<Terminal>> sentences = new SentenceEnumerator(grammar, sentenceLength).enumerate();
			System.out.println("Sentences:");
			for (List<Terminal> sentence : sentences){
				System.out.println("  " + join(sentence, " "));
			}
		}
		return result.report.getDiagnostics(Severity.ERROR).isEmpty();
	}

	private static void configureLogging(Level level){
		Logger root = Logger.getLogger("");
		for (Handler handler : root.getHandlers()){
			root.removeHandler(handler);
		}
		Handler handler = new ConsoleHandler();
		handler.setLevel(level);
		root.addHandler(handler);
		LOG.setLevel(level);
	}

	private static void usage(){
		System.err.println("Usage: pargen GRAMMAR_FILE [--synthesize] [--sentences=N] [--log=LEVEL]");
		System.exit(1);
	}
}
