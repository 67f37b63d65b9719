package slr.parser.lr;

import java.io.Serializable;
import java.util.*;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import slr.SLRException;
import slr.grammar.*;

/**
 * The canonical LR(0) automaton of an augmented grammar.
 *
 * States are numbered in the order of their discovery by a breadth first search that starts with the closure of
 * the augmented start item (state 0) and visits the symbols of each state in the grammar's symbol order.
 */
public class Graph implements Serializable {

	private static final Logger LOG = Logger.getLogger(Graph.class.getName());

	public final Grammar grammar;
	private final ImmutableList<State> states;

	private Graph(Grammar grammar, List<State> states) {
		this.grammar = grammar;
		this.states = ImmutableList.copyOf(states);
	}

	/**
	 * Add the items of all productions of each non terminal that directly follows a dot, until a whole pass
	 * doesn't add anything.
	 *
	 * @return closed item set, the passed items come first
	 */
	public static ImmutableSet<Item> closure(Grammar grammar, Collection<Item> items){
		Set<Item> closure = new LinkedHashSet<>(items);
		boolean somethingChanged = true;
		while (somethingChanged){
			somethingChanged = false;
			for (Item item : new ArrayList<>(closure)){
				if (item.inFrontOfNonTerminal()){
					NonTerminal nonTerminal = (NonTerminal) item.nextSymbol();
					for (Production production : grammar.getProductionOfNonTerminal(nonTerminal)){
						somethingChanged = closure.add(new Item(production)) || somethingChanged;
					}
				}
			}
		}
		return ImmutableSet.copyOf(closure);
	}

	/**
	 * Advance the dot over the passed symbol in all items that allow it and build the closure.
	 *
	 * @return closed item set, empty if no item can be advanced over the symbol (meaning: no transition)
	 */
	public static ImmutableSet<Item> goTo(Grammar grammar, Collection<Item> items, Symbol symbol){
		List<Item> advanced = new ArrayList<>();
		for (Item item : items){
			if (item.inFrontOf(symbol)){
				Item next = item.advance();
				if (!advanced.contains(next)){
					advanced.add(next);
				}
			}
		}
		if (advanced.isEmpty()){
			return ImmutableSet.of();
		}
		return closure(grammar, advanced);
	}

	public static Graph createFromGrammar(Grammar grammar){
		if (!grammar.isAugmented()){
			throw new SLRException("The automaton has to be built for an augmented grammar");
		}
		List<State> states = new ArrayList<>();
		Map<Set<Item>, State> stateForItems = new HashMap<>();
		Deque<State> queue = new ArrayDeque<>();
		State startState = new State(0, closure(grammar, ImmutableList.of(new Item(grammar.getStartProduction()))), 1);
		states.add(startState);
		stateForItems.put(startState.items, startState);
		queue.add(startState);
		while (!queue.isEmpty()){
			State currentState = queue.poll();
			for (Symbol symbol : grammar.getSymbols()){
				ImmutableSet<Item> items = goTo(grammar, currentState.items, symbol);
				if (items.isEmpty()){
					continue;
				}
				State nextState = stateForItems.get(items);
				if (nextState == null){
					nextState = new State(states.size(), items, kernelSize(currentState, symbol));
					states.add(nextState);
					stateForItems.put(items, nextState);
					queue.add(nextState);
				}
				currentState.addTransition(symbol, nextState);
			}
		}
		LOG.fine(() -> String.format("LR(0) automaton with %d states", states.size()));
		return new Graph(grammar, states);
	}

	private static int kernelSize(State state, Symbol symbol){
		Set<Item> kernel = new HashSet<>();
		for (Item item : state.items){
			if (item.inFrontOf(symbol)){
				kernel.add(item.advance());
			}
		}
		return kernel.size();
	}

	public List<State> getStates(){
		return states;
	}

	public State getState(int id){
		if (id < 0 || id >= states.size()){
			throw new IllegalArgumentException(String.format("No state %d, the automaton has %d states", id,
					states.size()));
		}
		return states.get(id);
	}

	public State getStartState(){
		return states.get(0);
	}

	public int size(){
		return states.size();
	}

	/**
	 * Transitions of the passed state as a map from symbol to the id of the next state
	 */
	public Map<Symbol, Integer> transitions(int state){
		Map<Symbol, Integer> transitions = new LinkedHashMap<>();
		for (Map.Entry<Symbol, State> entry : getState(state).getAdjacentStates().entrySet()){
			transitions.put(entry.getKey(), entry.getValue().id);
		}
		return transitions;
	}

	/**
	 * Build the SLR(1) table.
	 *
	 * For each state the transitions are inserted first (shifts for terminals, gotos for non terminals), then
	 * the items are visited in order: the completed augmented start item adds an accept action for the end of
	 * input, every other completed item adds a reduce action for each terminal in the follow set of its left
	 * hand side. Only the first action for a cell is kept.
	 *
	 * @param sets first and follow sets of this graph's grammar
	 */
	public LRParserTable toParserTable(FirstFollow sets){
		if (sets.grammar != grammar){
			throw new SLRException("The follow sets belong to a different grammar");
		}
		LRParserTable.Builder builder = new LRParserTable.Builder(grammar);
		builder.ensureStates(states.size());
		for (State state : states){
			for (Map.Entry<Symbol, State> entry : state.getAdjacentStates().entrySet()){
				Symbol symbol = entry.getKey();
				if (symbol instanceof Terminal){
					builder.addShift(state.id, (Terminal) symbol, entry.getValue().id);
				} else {
					builder.addGoto(state.id, (NonTerminal) symbol, entry.getValue().id);
				}
			}
			for (Item item : state.items){
				if (!item.isComplete()){
					continue;
				}
				if (item.left().equals(grammar.getStart())){
					builder.addAccept(state.id);
				} else {
					for (Terminal terminal : sets.follow(item.left())){
						builder.addReduce(state.id, terminal, item.production);
					}
				}
			}
		}
		return builder.build();
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (State state : states){
			if (state.id != 0){
				builder.append("\n–––––––\n");
			}
			builder.append(state.toString());
		}
		return builder.toString();
	}
}
