package slr.util;

import slr.LocatedSLRException;
import slr.lexer.Token;

/**
 * An error thrown after encountering a syntax error
 */
public class ParserError extends LocatedSLRException {

	public ParserError(Token errorToken, String message) {
		super(errorToken, String.format("Error at %s: %s", errorToken.location, message));
	}
}
