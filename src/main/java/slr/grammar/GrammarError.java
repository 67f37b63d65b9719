package slr.grammar;

import slr.SLRException;

/**
 * Thrown if a grammar text can't be turned into a grammar. No partial grammar is created in this case.
 */
public class GrammarError extends SLRException {

	public enum Kind {
		/** The text doesn't contain a single rule */
		EMPTY_GRAMMAR,
		/** A rule doesn't have the form <code>LHS -> RHS</code> */
		MALFORMED_RULE
	}

	public final Kind kind;

	/**
	 * Text of the offending rule, empty for {@link Kind#EMPTY_GRAMMAR}
	 */
	public final String rule;

	private GrammarError(Kind kind, String rule, String message) {
		super(message);
		this.kind = kind;
		this.rule = rule;
	}

	public static GrammarError emptyGrammar(){
		return new GrammarError(Kind.EMPTY_GRAMMAR, "", "No valid grammar rules found");
	}

	public static GrammarError malformedRule(String rule, String reason){
		return new GrammarError(Kind.MALFORMED_RULE, rule, String.format("Invalid rule \"%s\": %s", rule, reason));
	}
}
