package slr.parser.lr;

import java.io.Serializable;
import java.util.*;

import com.google.common.collect.ImmutableSet;

import slr.grammar.Symbol;

/**
 * A state of the LR(0) automaton: a set of items and its outgoing transitions.
 *
 * The items are kept in the order they were added (kernel items first, then the closure items), but two
 * states with the same items in a different order are the same state.
 */
public class State implements Serializable, Comparable<State> {

	public final int id;

	public final ImmutableSet<Item> items;

	/**
	 * Number of items that aren't added by the closure
	 */
	private final int kernelSize;

	private final Map<Symbol, State> adjacentStates = new LinkedHashMap<>();

	State(int id, ImmutableSet<Item> items, int kernelSize) {
		this.id = id;
		this.items = items;
		this.kernelSize = kernelSize;
	}

	void addTransition(Symbol symbol, State state){
		adjacentStates.put(symbol, state);
	}

	/**
	 * Transitions of this state, in the order the symbols have been visited
	 */
	public Map<Symbol, State> getAdjacentStates(){
		return Collections.unmodifiableMap(adjacentStates);
	}

	public State next(Symbol symbol){
		return adjacentStates.get(symbol);
	}

	public List<Item> getKernel(){
		return items.asList().subList(0, kernelSize);
	}

	public boolean contains(Item item){
		return items.contains(item);
	}

	public boolean hasShiftableItems(){
		for (Item item : items){
			if (item.canAdvance()){
				return true;
			}
		}
		return false;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (Item item : items) {
			builder.append("\n- ").append(item);
		}
		return "State " + id + builder.toString();
	}

	@Override
	public int compareTo(State o) {
		return Integer.compare(id, o.id);
	}
}
