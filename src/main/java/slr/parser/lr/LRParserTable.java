package slr.parser.lr;

import java.io.Serializable;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import slr.Config;
import slr.grammar.*;
import slr.util.Utils;

/**
 * SLR(1) parser table: an action row (terminal → shift, reduce or accept) and a goto row
 * (non terminal → state) for each state of the automaton.
 *
 * Instances are immutable, use the {@link Builder} to create them. The builder keeps the first action that is
 * inserted for a cell, later ones are dropped and recorded as {@link Conflict}s.
 */
public class LRParserTable implements Serializable {

	private static final Logger LOG = Logger.getLogger(LRParserTable.class.getName());

	public final Grammar grammar;

	/**
	 * Mapping of terminal to action for each state.
	 */
	private final ImmutableList<ImmutableMap<Terminal, Action>> actionTable;

	/**
	 * Mapping of non terminal to next state (for each state).
	 */
	private final ImmutableList<ImmutableMap<NonTerminal, Integer>> gotoTable;

	private final ImmutableList<Conflict> conflicts;

	private LRParserTable(Grammar grammar, ImmutableList<ImmutableMap<Terminal, Action>> actionTable,
	                      ImmutableList<ImmutableMap<NonTerminal, Integer>> gotoTable, ImmutableList<Conflict> conflicts) {
		this.grammar = grammar;
		this.actionTable = actionTable;
		this.gotoTable = gotoTable;
		this.conflicts = conflicts;
	}

	public static abstract class Action implements Serializable {

		public abstract String name();

		/**
		 * Compact form used in the table grid
		 */
		public abstract String toShortString();
	}

	public static class ShiftAction extends Action {

		public final int stateToBeShifted;

		public ShiftAction(int stateToBeShifted) {
			this.stateToBeShifted = stateToBeShifted;
		}

		@Override
		public String toString() {
			return "shift(" + stateToBeShifted + ")";
		}

		@Override
		public String name() {
			return "shift";
		}

		@Override
		public String toShortString() {
			return "s" + stateToBeShifted;
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof ShiftAction && ((ShiftAction) obj).stateToBeShifted == stateToBeShifted;
		}

		@Override
		public int hashCode() {
			return stateToBeShifted;
		}
	}

	public static class ReduceAction extends Action {

		public final Production production;

		public ReduceAction(Production production) {
			this.production = production;
		}

		/**
		 * Index of the reduced production among the alternatives of its left hand side
		 */
		public int ruleIndex(){
			return production.index;
		}

		@Override
		public String toString() {
			return "reduce(" + production.left + ", " + production.index + ")";
		}

		@Override
		public String name() {
			return "reduce";
		}

		@Override
		public String toShortString() {
			return "r(" + production + ")";
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof ReduceAction && ((ReduceAction) obj).production.equals(production);
		}

		@Override
		public int hashCode() {
			return -production.id - 1;
		}
	}

	public static class Accept extends Action {

		@Override
		public String toString() {
			return "accept()";
		}

		@Override
		public String name() {
			return "accept";
		}

		@Override
		public String toShortString() {
			return "acc";
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Accept;
		}

		@Override
		public int hashCode() {
			return Integer.MIN_VALUE;
		}
	}

	/**
	 * A table cell that two actions competed for, only the kept action is part of the table
	 */
	public static class Conflict implements Serializable {

		public final int state;
		public final Terminal terminal;
		public final Action kept;
		public final Action dropped;

		public Conflict(int state, Terminal terminal, Action kept, Action dropped) {
			this.state = state;
			this.terminal = terminal;
			this.kept = kept;
			this.dropped = dropped;
		}

		/**
		 * e.g. "shift/reduce"
		 */
		public String kind(){
			return kept.name() + "/" + dropped.name();
		}

		@Override
		public String toString() {
			return String.format("%s conflict in state %d at terminal %s: kept %s, dropped %s", kind(), state,
					terminal, kept, dropped);
		}
	}

	public static class Builder {

		private final Grammar grammar;
		private final List<Map<Terminal, Action>> actionTable = new ArrayList<>();
		private final List<Map<NonTerminal, Integer>> gotoTable = new ArrayList<>();
		private final List<Conflict> conflicts = new ArrayList<>();

		public Builder(Grammar grammar) {
			this.grammar = grammar;
		}

		private void initState(int state){
			while (state >= actionTable.size()){
				actionTable.add(new LinkedHashMap<>());
				gotoTable.add(new LinkedHashMap<>());
			}
		}

		/**
		 * Insert the action if the cell is still empty
		 *
		 * @return was the action inserted?
		 */
		private boolean insert(int state, Terminal terminal, Action action){
			initState(state);
			Map<Terminal, Action> row = actionTable.get(state);
			Action cur = row.get(terminal);
			if (cur == null){
				row.put(terminal, action);
				return true;
			}
			if (!cur.equals(action)){
				printError(new Conflict(state, terminal, cur, action));
			}
			return false;
		}

		private void printError(Conflict conflict){
			conflicts.add(conflict);
			LOG.log(Config.logConflicts() ? Level.WARNING : Level.FINE, conflict.toString());
		}

		public Builder addShift(int state, Terminal terminal, int newState){
			insert(state, terminal, new ShiftAction(newState));
			return this;
		}

		public Builder addReduce(int state, Terminal terminal, Production production){
			insert(state, terminal, new ReduceAction(production));
			return this;
		}

		public Builder addAccept(int state){
			insert(state, Terminal.EOF, new Accept());
			return this;
		}

		public Builder addGoto(int state, NonTerminal nonTerminal, int newState){
			initState(state);
			gotoTable.get(state).put(nonTerminal, newState);
			return this;
		}

		/**
		 * Makes sure that the table has at least the passed number of states (states without any actions
		 * are possible)
		 */
		public Builder ensureStates(int stateCount){
			initState(stateCount - 1);
			return this;
		}

		public LRParserTable build(){
			ImmutableList.Builder<ImmutableMap<Terminal, Action>> actions = ImmutableList.builder();
			for (Map<Terminal, Action> row : actionTable){
				actions.add(ImmutableMap.copyOf(row));
			}
			ImmutableList.Builder<ImmutableMap<NonTerminal, Integer>> gotos = ImmutableList.builder();
			for (Map<NonTerminal, Integer> row : gotoTable){
				gotos.add(ImmutableMap.copyOf(row));
			}
			if (!conflicts.isEmpty()){
				LOG.fine(() -> String.format("%d table conflicts resolved by keeping the first action",
						conflicts.size()));
			}
			return new LRParserTable(grammar, actions.build(), gotos.build(), ImmutableList.copyOf(conflicts));
		}
	}

	public int stateCount(){
		return actionTable.size();
	}

	private void checkState(int state){
		if (state < 0 || state >= stateCount()){
			throw new IllegalArgumentException(String.format("No state %d, the table has %d states", state,
					stateCount()));
		}
	}

	public Map<Terminal, Action> actionRow(int state){
		checkState(state);
		return actionTable.get(state);
	}

	public Map<NonTerminal, Integer> gotoRow(int state){
		checkState(state);
		return gotoTable.get(state);
	}

	/**
	 * @return the action or null if there is none
	 */
	public Action action(int state, Terminal terminal){
		return actionRow(state).get(terminal);
	}

	/**
	 * @return the next state or null if there is none
	 */
	public Integer gotoState(int state, NonTerminal nonTerminal){
		return gotoRow(state).get(nonTerminal);
	}

	public List<Conflict> getConflicts(){
		return conflicts;
	}

	public boolean hasConflicts(){
		return !conflicts.isEmpty();
	}

	/**
	 * States whose action row contains an accept action
	 */
	public List<Integer> acceptingStates(){
		List<Integer> states = new ArrayList<>();
		for (int i = 0; i < stateCount(); i++){
			for (Action action : actionTable.get(i).values()){
				if (action instanceof Accept){
					states.add(i);
					break;
				}
			}
		}
		return states;
	}

	/**
	 * Format the table as a grid with a column per terminal (action) and per non terminal (goto), the augmented
	 * start symbol is omitted.
	 */
	@Override
	public String toString() {
		List<NonTerminal> nonTerminals = new ArrayList<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			if (!nonTerminal.equals(grammar.getStart()) || !grammar.isAugmented()){
				nonTerminals.add(nonTerminal);
			}
		}
		List<List<String>> rows = new ArrayList<>();
		List<String> header = new ArrayList<>();
		header.add("State");
		for (Terminal terminal : grammar.getTerminals()){
			header.add(terminal.toString());
		}
		for (NonTerminal nonTerminal : nonTerminals){
			header.add(nonTerminal.toString());
		}
		rows.add(header);
		for (int i = 0; i < stateCount(); i++){
			List<String> row = new ArrayList<>();
			row.add("I" + i);
			for (Terminal terminal : grammar.getTerminals()){
				Action action = actionTable.get(i).get(terminal);
				row.add(action == null ? "" : action.toShortString());
			}
			for (NonTerminal nonTerminal : nonTerminals){
				Integer next = gotoTable.get(i).get(nonTerminal);
				row.add(next == null ? "" : next.toString());
			}
			rows.add(row);
		}
		return Utils.formatTable(rows);
	}
}
