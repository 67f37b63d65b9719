package slr.grammar;

import java.io.Serializable;
import java.util.*;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * The first and follow (k = 1) sets of all non terminals of a grammar.
 *
 * Instances are immutable and belong to the grammar they were calculated for.
 */
public class FirstFollow implements Serializable {

	private static final Logger LOG = Logger.getLogger(FirstFollow.class.getName());

	public final Grammar grammar;

	private final ImmutableMap<NonTerminal, ImmutableSet<TerminalOrEpsilon>> first1Sets;
	private final ImmutableMap<NonTerminal, ImmutableSet<Terminal>> follow1Sets;

	private FirstFollow(Grammar grammar, ImmutableMap<NonTerminal, ImmutableSet<TerminalOrEpsilon>> first1Sets,
	                    ImmutableMap<NonTerminal, ImmutableSet<Terminal>> follow1Sets) {
		this.grammar = grammar;
		this.first1Sets = first1Sets;
		this.follow1Sets = follow1Sets;
	}

	public static FirstFollow calculate(Grammar grammar){
		Map<NonTerminal, Set<TerminalOrEpsilon>> first = calculateFirst1Set(grammar);
		Map<NonTerminal, Set<Terminal>> follow = calculateFollow1Set(grammar, first);
		return new FirstFollow(grammar, freeze(grammar, first), freeze(grammar, follow));
	}

	private static <T> ImmutableMap<NonTerminal, ImmutableSet<T>> freeze(Grammar grammar,
	                                                                   Map<NonTerminal, ? extends Set<T>> sets){
		ImmutableMap.Builder<NonTerminal, ImmutableSet<T>> builder = ImmutableMap.builder();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			builder.put(nonTerminal, ImmutableSet.copyOf(sets.get(nonTerminal)));
		}
		return builder.build();
	}

	/**
	 * Least fixpoint of the first set equations: every production A → X1 … Xn adds First(X1) \ {ε} to
	 * First(A), First(X2) \ {ε} if X1 can derive ε and so on, and ε if all Xi can derive ε.
	 *
	 * Iterated until no set changes in a whole pass over the productions, this terminates for every grammar,
	 * left recursive and mutually recursive non terminals included.
	 */
	static Map<NonTerminal, Set<TerminalOrEpsilon>> calculateFirst1Set(Grammar grammar){
		Map<NonTerminal, Set<TerminalOrEpsilon>> first = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			first.put(nonTerminal, new LinkedHashSet<>());
		}
		boolean firstChanged;
		int passes = 0;
		do {
			firstChanged = false;
			passes++;
			for (Production production : grammar.getProductions()){
				Set<TerminalOrEpsilon> set = first.get(production.left);
				if (set.addAll(firstOfSequence(production.right, first))){
					firstChanged = true;
				}
			}
		} while (firstChanged);
		int finalPasses = passes;
		LOG.fine(() -> String.format("First sets stable after %d passes", finalPasses));
		return first;
	}

	private static Set<TerminalOrEpsilon> firstOfSequence(List<Symbol> symbols,
	                                                      Map<NonTerminal, ? extends Set<TerminalOrEpsilon>> first){
		Set<TerminalOrEpsilon> set = new LinkedHashSet<>();
		for (Symbol symbol : symbols){
			if (symbol instanceof Terminal){
				set.add((Terminal) symbol);
				return set;
			}
			Set<TerminalOrEpsilon> symbolFirst = first.get(symbol);
			for (TerminalOrEpsilon toe : symbolFirst){
				if (toe != Epsilon.EPSILON){
					set.add(toe);
				}
			}
			if (!symbolFirst.contains(Epsilon.EPSILON)){
				return set;
			}
		}
		set.add(Epsilon.EPSILON);
		return set;
	}

	/**
	 * Calculate the follow 1 set for all non terminals
	 *
	 * First put $ (the end of input marker) in Follow(S) (S is the start symbol). Then go through each
	 * production A → X1 … Xn from right to left with a trailer that starts as Follow(A): the trailer is added
	 * to the follow set of every non terminal Xi. Afterwards the trailer becomes First(Xi), extended by the
	 * old trailer if Xi can derive ε, or just {Xi} for a terminal Xi. Repeated until nothing changes.
	 */
	static Map<NonTerminal, Set<Terminal>> calculateFollow1Set(Grammar grammar,
	                                                          Map<NonTerminal, ? extends Set<TerminalOrEpsilon>> first){
		Map<NonTerminal, Set<Terminal>> follow = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			follow.put(nonTerminal, new LinkedHashSet<>());
		}
		follow.get(grammar.getStart()).add(Terminal.EOF);
		boolean followChanged;
		int passes = 0;
		do {
			followChanged = false;
			passes++;
			for (Production production : grammar.getProductions()){
				Set<Terminal> trailer = new LinkedHashSet<>(follow.get(production.left));
				for (int i = production.right.size() - 1; i >= 0; i--){
					Symbol symbol = production.right.get(i);
					if (symbol instanceof NonTerminal){
						if (follow.get(symbol).addAll(trailer)){
							followChanged = true;
						}
						Set<TerminalOrEpsilon> symbolFirst = first.get(symbol);
						if (!symbolFirst.contains(Epsilon.EPSILON)){
							trailer.clear();
						}
						for (TerminalOrEpsilon toe : symbolFirst){
							if (toe instanceof Terminal){
								trailer.add((Terminal) toe);
							}
						}
					} else {  // terminal
						trailer.clear();
						trailer.add((Terminal) symbol);
					}
				}
			}
		} while (followChanged);
		int finalPasses = passes;
		LOG.fine(() -> String.format("Follow sets stable after %d passes", finalPasses));
		return follow;
	}

	public Map<NonTerminal, ImmutableSet<TerminalOrEpsilon>> getFirstSets(){
		return first1Sets;
	}

	public Map<NonTerminal, ImmutableSet<Terminal>> getFollowSets(){
		return follow1Sets;
	}

	public Set<TerminalOrEpsilon> first(NonTerminal nonTerminal){
		return get(first1Sets, nonTerminal);
	}

	/**
	 * First set of an arbitrary symbol, {t} for a terminal t
	 */
	public Set<TerminalOrEpsilon> first(Symbol symbol){
		if (symbol instanceof NonTerminal){
			return first((NonTerminal) symbol);
		}
		return ImmutableSet.of((TerminalOrEpsilon) symbol);
	}

	/**
	 * First set of a sequence of symbols, contains ε if every symbol can derive ε (the empty sequence
	 * included)
	 */
	public Set<TerminalOrEpsilon> firstOfSequence(List<Symbol> symbols){
		return ImmutableSet.copyOf(firstOfSequence(symbols, first1Sets));
	}

	public Set<Terminal> follow(NonTerminal nonTerminal){
		return get(follow1Sets, nonTerminal);
	}

	/**
	 * Can the passed non terminal derive ε?
	 */
	public boolean isNullable(NonTerminal nonTerminal){
		return first(nonTerminal).contains(Epsilon.EPSILON);
	}

	private static <T> Set<T> get(Map<NonTerminal, ImmutableSet<T>> sets, NonTerminal nonTerminal){
		ImmutableSet<T> set = sets.get(nonTerminal);
		if (set == null){
			throw new IllegalArgumentException("Unknown non terminal " + nonTerminal);
		}
		return set;
	}

	public String formatFirstSets(){
		return format("FIRST", first1Sets);
	}

	public String formatFollowSets(){
		return format("FOLLOW", follow1Sets);
	}

	private static String format(String name, Map<NonTerminal, ? extends Set<? extends Symbol>> sets){
		StringBuilder builder = new StringBuilder();
		for (Map.Entry<NonTerminal, ? extends Set<? extends Symbol>> entry : sets.entrySet()){
			if (builder.length() > 0){
				builder.append("\n");
			}
			List<String> names = new ArrayList<>();
			for (Symbol symbol : entry.getValue()){
				names.add(symbol.toString());
			}
			builder.append(name).append("(").append(entry.getKey()).append(") = {")
					.append(String.join(", ", names)).append("}");
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return formatFirstSets() + "\n" + formatFollowSets();
	}
}
