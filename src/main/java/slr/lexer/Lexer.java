package slr.lexer;

import java.util.List;

/**
 * A simple interface for a pull lexer. The last token is always the end of input token ($), reading
 * past it returns it again.
 */
public interface Lexer {

	/**
	 * Get the current token (calls next() if no token has been read before).
	 */
	Token cur();

	/**
	 * Read another token and return it.
	 */
	Token next();

	/**
	 * The current token and all tokens after it.
	 */
	List<Token> remaining();

	/**
	 * All tokens of the input, the end of input token included.
	 */
	List<Token> tokens();
}
