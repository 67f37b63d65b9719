package slr.grammar;

import java.util.*;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Parses grammars of the form <code>E -> E + T | T ; T -> id</code>.
 *
 * Rules are separated by <code>;</code>, alternatives by <code>|</code> and symbols by whitespace. An empty
 * alternative (or one consisting only of <code>ε</code>) denotes an epsilon production. Tokens that consist
 * only of upper case letters are non terminals, all other tokens are terminals. The left hand side of the
 * first rule is the start symbol.
 *
 * A later rule for the same left hand side replaces the alternatives of the earlier one, the non terminal
 * keeps its position (and start symbol status) from its first rule.
 */
public class GrammarParser {

	private static final Logger LOG = Logger.getLogger(GrammarParser.class.getName());

	private static final Pattern NON_TERMINAL = Pattern.compile("[A-Z]+");

	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	public static final String ARROW = "->";

	private final Map<String, NonTerminal> nonTerminals = new LinkedHashMap<>();
	/**
	 * Alternatives of each rule, in the order the left hand sides first appeared
	 */
	private final Map<NonTerminal, List<List<Symbol>>> rules = new LinkedHashMap<>();
	private NonTerminal start;

	private GrammarParser(){
	}

	/**
	 * Parse the passed grammar text.
	 *
	 * @throws GrammarError if the text contains a malformed rule or no rule at all
	 */
	public static Grammar parse(String text){
		return new GrammarParser().parseRules(text);
	}

	/**
	 * Parse the passed grammar text and augment the resulting grammar.
	 */
	public static Grammar parseAugmented(String text){
		return parse(text).augment();
	}

	public static boolean isNonTerminalName(String token){
		return NON_TERMINAL.matcher(token).matches();
	}

	private Grammar parseRules(String text){
		for (String part : text.split(";")){
			String rule = part.trim();
			if (rule.isEmpty()){
				continue;
			}
			parseRule(rule);
		}
		if (start == null){
			throw GrammarError.emptyGrammar();
		}
		List<Production> productions = new ArrayList<>();
		for (Map.Entry<NonTerminal, List<List<Symbol>>> rule : rules.entrySet()){
			NonTerminal left = rule.getKey();
			List<List<Symbol>> alternatives = rule.getValue();
			for (int index = 0; index < alternatives.size(); index++){
				Production production = new Production(productions.size(), left, alternatives.get(index), index);
				left.addProduction(production);
				productions.add(production);
			}
		}
		LOG.fine(() -> String.format("Parsed %d productions, start symbol is %s", productions.size(), start));
		return new Grammar(start, productions);
	}

	private void parseRule(String rule){
		int arrow = rule.indexOf(ARROW);
		if (arrow == -1){
			throw GrammarError.malformedRule(rule, "missing '" + ARROW + "'");
		}
		if (rule.indexOf(ARROW, arrow + ARROW.length()) != -1){
			throw GrammarError.malformedRule(rule, "more than one '" + ARROW + "'");
		}
		String lhs = rule.substring(0, arrow).trim();
		String rhs = rule.substring(arrow + ARROW.length()).trim();
		if (lhs.isEmpty() || rhs.isEmpty()){
			throw GrammarError.malformedRule(rule, "empty left or right hand side");
		}
		if (!isNonTerminalName(lhs)){
			throw GrammarError.malformedRule(rule, "left hand side has to be a non terminal (upper case letters)");
		}
		NonTerminal left = nonTerminal(lhs);
		if (start == null){
			start = left;
		}
		List<List<Symbol>> alternatives = new ArrayList<>();
		for (String alternative : rhs.split("\\|", -1)){
			alternatives.add(parseAlternative(alternative.trim()));
		}
		if (rules.containsKey(left)){
			LOG.warning(String.format("Rule \"%s\" replaces the earlier alternatives of %s", rule, left));
		}
		rules.put(left, alternatives);
	}

	private List<Symbol> parseAlternative(String alternative){
		List<Symbol> right = new ArrayList<>();
		if (alternative.isEmpty() || alternative.equals(Epsilon.EPSILON.name)){
			return right;
		}
		for (String token : WHITESPACE.split(alternative)){
			if (isNonTerminalName(token)){
				right.add(nonTerminal(token));
			} else {
				right.add(new Terminal(token));
			}
		}
		return right;
	}

	private NonTerminal nonTerminal(String name){
		return nonTerminals.computeIfAbsent(name, NonTerminal::new);
	}
}
