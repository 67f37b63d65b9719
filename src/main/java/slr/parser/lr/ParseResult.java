package slr.parser.lr;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

import slr.lexer.Token;
import slr.util.ParserError;
import slr.util.Utils;

/**
 * Verdict of a parser run together with the trace of all steps.
 */
public class ParseResult implements Serializable {

	private final boolean accepted;
	private final String message;
	private final ImmutableList<TraceRecord> trace;
	private final transient Token errorToken;

	ParseResult(boolean accepted, String message, List<TraceRecord> trace, Token errorToken) {
		this.accepted = accepted;
		this.message = message;
		this.trace = ImmutableList.copyOf(trace);
		this.errorToken = errorToken;
	}

	public boolean isAccepted(){
		return accepted;
	}

	/**
	 * "Input accepted" or the reason of the rejection
	 */
	public String getMessage(){
		return message;
	}

	public List<TraceRecord> getTrace(){
		return trace;
	}

	public TraceRecord lastRecord(){
		return trace.get(trace.size() - 1);
	}

	/**
	 * Token the parser stopped at if the input has been rejected, null otherwise
	 */
	public Token getErrorToken(){
		return errorToken;
	}

	/**
	 * @return this if the input has been accepted
	 * @throws ParserError otherwise
	 */
	public ParseResult orThrow(){
		if (!accepted){
			throw new ParserError(errorToken, message);
		}
		return this;
	}

	/**
	 * Format the trace as a table with the columns step, action, stack, input and details
	 */
	public String formatTrace(){
		List<List<String>> rows = new ArrayList<>();
		rows.add(ImmutableList.of("Step", "Action", "Stack", "Input", "Details"));
		for (TraceRecord record : trace){
			rows.add(ImmutableList.of(Integer.toString(record.step), record.action, record.formatStack(),
					record.formatInput(), record.details));
		}
		return Utils.formatTable(rows);
	}

	@Override
	public String toString() {
		return (accepted ? "Accepted: " : "Rejected: ") + message;
	}
}
