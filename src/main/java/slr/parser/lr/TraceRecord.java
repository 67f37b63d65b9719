package slr.parser.lr;

import java.io.Serializable;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * One step of a parser run.
 */
public class TraceRecord implements Serializable {

	public enum Kind {
		INITIALIZE, SHIFT, REDUCE, ACCEPT, ERROR
	}

	public final int step;

	public final Kind kind;

	/**
	 * Description of the action, e.g. "Shift id" or "Reduce by E → T"
	 */
	public final String action;

	/**
	 * Stack after the step: alternating states and symbols, starting with state 0
	 */
	public final ImmutableList<String> stack;

	/**
	 * Input that hasn't been consumed after the step, ends with "$"
	 */
	public final ImmutableList<String> input;

	public final String details;

	public TraceRecord(int step, Kind kind, String action, List<String> stack, List<String> input, String details) {
		this.step = step;
		this.kind = kind;
		this.action = action;
		this.stack = ImmutableList.copyOf(stack);
		this.input = ImmutableList.copyOf(input);
		this.details = details;
	}

	public String formatStack(){
		return String.join(" ", stack);
	}

	public String formatInput(){
		return String.join(" ", input);
	}

	@Override
	public String toString() {
		return String.format("%d: %s | %s | %s | %s", step, action, formatStack(), formatInput(), details);
	}
}
