package slr.parser.lr;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import slr.grammar.NonTerminal;
import slr.grammar.Production;
import slr.lexer.Lexer;
import slr.lexer.Token;

/**
 * Table driven shift reduce parser that records every step.
 *
 * The stack alternates symbols and states and starts with state 0. Errors don't throw, they end the run with a
 * rejecting {@link ParseResult}. A parser instance is used for a single run, the table can be shared between
 * parsers.
 */
public class LRParser {

	private static final Logger LOG = Logger.getLogger(LRParser.class.getName());

	private final LRParserTable table;
	private final Lexer lexer;
	private final ArrayList<StackFrame> stack = new ArrayList<>();
	private final List<TraceRecord> trace = new ArrayList<>();
	private ParseResult result;

	public LRParser(LRParserTable table, Lexer lexer){
		this.table = table;
		this.lexer = lexer;
		stack.add(new StackFrame(null, 0));
	}

	/**
	 * Run the parser (only once, later calls return the first result).
	 */
	public ParseResult parse(){
		if (result != null){
			return result;
		}
		record(0, TraceRecord.Kind.INITIALIZE, "Initialize", "Start parsing");
		int step = 1;
		while (result == null){
			Token token = lexer.cur();
			int state = currentState();
			LRParserTable.Action action = token.known ? table.action(state, token.toTerminal()) : null;
			if (action == null){
				error(step, token, String.format("No action defined for token '%s' in state %d", token.value, state));
				break;
			}
			switch (action.name()){
				case "shift":
					int next = ((LRParserTable.ShiftAction) action).stateToBeShifted;
					stack.add(new StackFrame(token.value, next));
					lexer.next();
					record(step, TraceRecord.Kind.SHIFT, "Shift " + token.value, "Move to state " + next);
					break;
				case "reduce":
					reduce(step, token, ((LRParserTable.ReduceAction) action).production);
					break;
				case "accept":
					record(step, TraceRecord.Kind.ACCEPT, "Accept", "Input string is valid according to the grammar");
					result = new ParseResult(true, "Input accepted", trace, null);
					break;
				default:
					error(step, token, "Invalid action: " + action);
			}
			step++;
		}
		LOG.fine(() -> String.format("%s after %d steps", result, trace.size() - 1));
		return result;
	}

	private void reduce(int step, Token token, Production production){
		int size = production.rightSize();
		for (int i = 0; i < size; i++){
			stack.remove(stack.size() - 1);
		}
		int top = currentState();
		NonTerminal left = production.left;
		Integer next = table.gotoState(top, left);
		if (next == null){
			error(step, token, String.format("No goto defined for %s from state %d", left, top));
			return;
		}
		stack.add(new StackFrame(left.name, next));
		record(step, TraceRecord.Kind.REDUCE, "Reduce by " + production,
				String.format("Pop %d symbols, push %s, goto state %d", size, left, next));
	}

	private void error(int step, Token token, String message){
		record(step, TraceRecord.Kind.ERROR, "ERROR", message);
		result = new ParseResult(false, message, trace, token);
	}

	private void record(int step, TraceRecord.Kind kind, String action, String details){
		TraceRecord record = new TraceRecord(step, kind, action, stackSnapshot(), remainingInput(), details);
		trace.add(record);
		if (LOG.isLoggable(Level.FINER)){
			LOG.finer(record.toString());
		}
	}

	private List<String> stackSnapshot(){
		List<String> snapshot = new ArrayList<>();
		for (StackFrame frame : stack){
			if (frame.symbol != null){
				snapshot.add(frame.symbol);
			}
			snapshot.add(Integer.toString(frame.state));
		}
		return snapshot;
	}

	private List<String> remainingInput(){
		List<String> input = new ArrayList<>();
		for (Token token : lexer.remaining()){
			input.add(token.value);
		}
		return input;
	}

	public int currentState(){
		return stack.get(stack.size() - 1).state;
	}

	static class StackFrame {
		/**
		 * Shifted or reduced symbol, null for the bottom frame
		 */
		public final String symbol;
		public final int state;

		public StackFrame(String symbol, int state){
			this.symbol = symbol;
			this.state = state;
		}
	}
}
