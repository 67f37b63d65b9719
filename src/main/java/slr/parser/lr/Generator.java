package slr.parser.lr;

import java.util.logging.Logger;

import slr.Config;
import slr.grammar.FirstFollow;
import slr.grammar.Grammar;
import slr.grammar.GrammarParser;
import slr.lexer.Lexer;
import slr.lexer.LexerKind;
import slr.util.Cache;

/**
 * Runs the whole pipeline for a grammar text: parsing and augmenting the grammar, calculating the first and
 * follow sets, building the LR(0) automaton and the SLR(1) table.
 *
 * All results are immutable, a generator can parse any number of inputs.
 */
public class Generator {

	private static final Logger LOG = Logger.getLogger(Generator.class.getName());

	private static Cache<String, Generator> cache;

	static {
		Config.load();
	}

	private final Grammar grammar;
	private final FirstFollow firstFollow;
	private final Graph graph;
	private final LRParserTable table;

	private Generator(Grammar grammar) {
		this.grammar = grammar;
		this.firstFollow = FirstFollow.calculate(grammar);
		this.graph = Graph.createFromGrammar(grammar);
		this.table = graph.toParserTable(firstFollow);
		LOG.fine(() -> String.format("Generated table with %d states for %s", table.stateCount(), grammar));
	}

	/**
	 * @throws slr.grammar.GrammarError if the text isn't a valid grammar
	 */
	public static Generator fromGrammar(String grammarText){
		return new Generator(GrammarParser.parseAugmented(grammarText));
	}

	/**
	 * @param grammar augmented or not yet augmented grammar
	 */
	public static Generator fromGrammar(Grammar grammar){
		return new Generator(grammar.isAugmented() ? grammar : grammar.augment());
	}

	/**
	 * Returns the cached generator for the passed grammar text or creates (and caches) a new one.
	 */
	public static Generator getCachedIfPossible(String grammarText){
		if (cache == null){
			cache = new Cache<>(Config.cacheSize());
		}
		Generator generator = cache.getIfPresent(grammarText);
		if (generator == null){
			generator = fromGrammar(grammarText);
			cache.put(grammarText, generator);
		}
		return generator;
	}

	public Grammar getGrammar(){
		return grammar;
	}

	public FirstFollow getFirstFollow(){
		return firstFollow;
	}

	public Graph getGraph(){
		return graph;
	}

	public LRParserTable getTable(){
		return table;
	}

	public Lexer createLexer(String input, LexerKind kind){
		return kind.create(grammar.getTerminals(), input);
	}

	/**
	 * Parse the input with the configured tokenizer
	 */
	public ParseResult parse(String input){
		return parse(input, Config.tokenizer());
	}

	public ParseResult parse(String input, LexerKind kind){
		return new LRParser(table, createLexer(input, kind)).parse();
	}
}
