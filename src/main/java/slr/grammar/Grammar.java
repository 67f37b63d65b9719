package slr.grammar;

import java.io.Serializable;
import java.util.*;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import slr.SLRException;

import static slr.util.Utils.join;

/**
 * Grammar consisting of terminals, non terminals and productions.
 *
 * Use the GrammarParser to build a grammar from its textual form. Terminals and non terminals are collected
 * from the productions in the order of their first appearance, the end of input terminal is always added
 * last.
 *
 * @see GrammarParser GrammarParser
 */
public class Grammar implements Serializable {

	private static final Logger LOG = Logger.getLogger(Grammar.class.getName());

	private final ImmutableList<Production> productions;

	private final NonTerminal start;

	/**
	 * Start symbol of the grammar this grammar has been augmented from, null if it isn't augmented
	 */
	private final NonTerminal augmentedFrom;

	/**
	 * Non terminals in the grammar, the augmented start symbol included
	 */
	private ImmutableSet<NonTerminal> nonTerminals;

	/**
	 * Terminals in the grammar, always contains the end of input terminal
	 */
	private ImmutableSet<Terminal> terminals;

	/**
	 * Symbols in this grammar, symbols = nonTerminals ∪ terminals (but without epsilon!), in the order of their
	 * first appearance
	 */
	private ImmutableList<Symbol> symbols;

	/**
	 * Create a new Grammar object
	 *
	 * @param start start non terminal
	 * @param productions all productions, each has to be registered at its left hand side
	 */
	public Grammar(NonTerminal start, List<Production> productions) {
		this(start, productions, null);
	}

	private Grammar(NonTerminal start, List<Production> productions, NonTerminal augmentedFrom) {
		if (productions.isEmpty()){
			throw new SLRException("A grammar needs at least one production");
		}
		this.start = start;
		this.productions = ImmutableList.copyOf(productions);
		this.augmentedFrom = augmentedFrom;
		extractSymbols();
	}

	private void extractSymbols(){
		Set<Symbol> symbols = new LinkedHashSet<>();
		Set<NonTerminal> nonTerminals = new LinkedHashSet<>();
		Set<Terminal> terminals = new LinkedHashSet<>();
		for (Production production : productions){
			symbols.add(production.left);
			nonTerminals.add(production.left);
			for (Symbol symbol : production.right){
				symbols.add(symbol);
				if (symbol instanceof NonTerminal){
					nonTerminals.add((NonTerminal) symbol);
				} else {
					terminals.add((Terminal) symbol);
				}
			}
		}
		terminals.add(Terminal.EOF);
		symbols.add(Terminal.EOF);
		for (NonTerminal nonTerminal : nonTerminals){
			if (!nonTerminal.hasProductions()){
				LOG.warning(String.format("Non terminal %s is used but has no productions", nonTerminal));
			}
		}
		this.symbols = ImmutableList.copyOf(symbols);
		this.nonTerminals = ImmutableSet.copyOf(nonTerminals);
		this.terminals = ImmutableSet.copyOf(terminals);
		LOG.fine(() -> String.format("Grammar with %d productions, %d non terminals and %d terminals",
				this.productions.size(), this.nonTerminals.size(), this.terminals.size()));
	}

	/**
	 * Insert a new start non terminal with a <pre>A' → A</pre> rule (assuming <pre>A</pre> is the current
	 * start non terminal). The new name gets additional primes until it doesn't clash with an existing one.
	 *
	 * @return new grammar
	 */
	public Grammar augment(){
		if (isAugmented()){
			throw new SLRException("The grammar is already augmented with " + start);
		}
		Set<String> names = new HashSet<>();
		for (NonTerminal nonTerminal : nonTerminals) {
			names.add(nonTerminal.name);
		}
		String startName = this.start.name + "'";
		while (names.contains(startName)) {
			startName += "'";
		}
		NonTerminal nonTerminal = new NonTerminal(startName);
		Production production = new Production(productions.size(), nonTerminal, ImmutableList.of(start), 0);
		nonTerminal.addProduction(production);
		List<Production> productions = new ArrayList<>(this.productions);
		productions.add(production);
		return new Grammar(nonTerminal, productions, start);
	}

	public boolean isAugmented(){
		return augmentedFrom != null;
	}

	/**
	 * Start symbol of the original grammar, equals the start symbol if the grammar isn't augmented
	 */
	public NonTerminal getOriginalStart(){
		return isAugmented() ? augmentedFrom : start;
	}

	public NonTerminal getStart(){
		return start;
	}

	/**
	 * The first production of the start symbol, <pre>S' → S</pre> for augmented grammars
	 */
	public Production getStartProduction(){
		if (!start.hasProductions()){
			throw new SLRException("Start symbol " + start + " has no productions");
		}
		return start.getProductions().get(0);
	}

	public List<Production> getProductions(){
		return productions;
	}

	public List<Production> getProductionOfNonTerminal(NonTerminal nonTerminal) {
		return nonTerminal.getProductions();
	}

	public Production getProductionForId(int id){
		return productions.get(id);
	}

	public Set<NonTerminal> getNonTerminals(){
		return nonTerminals;
	}

	public Set<Terminal> getTerminals(){
		return terminals;
	}

	/**
	 * All terminals and non terminals, ordered by their first appearance (end of input is the last)
	 */
	public List<Symbol> getSymbols(){
		return symbols;
	}

	public NonTerminal getNonTerminal(String name){
		for (NonTerminal nonTerminal : nonTerminals){
			if (Objects.equals(nonTerminal.name, name)){
				return nonTerminal;
			}
		}
		throw new SLRException("No such non terminal " + name);
	}

	public boolean isTerminal(String name){
		return terminals.contains(new Terminal(name));
	}

	public String longDescription(){
		return "Start non terminal: " + start + "\n" +
				"NonTerminals: " + nonTerminals + "\n" +
				"Terminals: " + terminals + "\n" +
				"Productions: \n" + join(productions, "\n");
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (NonTerminal nonTerminal : nonTerminals){
			if (!nonTerminal.hasProductions()){
				continue;
			}
			if (builder.length() > 0){
				builder.append(" ; ");
			}
			builder.append(nonTerminal).append(" -> ");
			List<String> alternatives = new ArrayList<>();
			for (Production production : nonTerminal.getProductions()){
				alternatives.add(production.isEpsilonProduction() ? "" : production.formatRightSide());
			}
			builder.append(String.join(" | ", alternatives));
		}
		return builder.toString();
	}
}
