package slr.lexer;

import slr.grammar.Terminal;

public class Token {

	/**
	 * Matched text, the name of a terminal if the token could be matched, "$" for the end of input token.
	 */
	public final String value;

	/**
	 * Does the value name a terminal of the grammar the lexer was created for?
	 */
	public final boolean known;

	public final Location location;

	public Token(String value, boolean known, Location location){
		this.value = value;
		this.known = known;
		this.location = location;
	}

	public static Token eof(Location location){
		return new Token(Terminal.EOF.name, true, location);
	}

	@Override
	public String toString() {
		return toSimpleString() + location.toString();
	}

	public String toSimpleString(){
		return value;
	}

	public boolean isEOF(){
		return isTerminal(Terminal.EOF);
	}

	public boolean isTerminal(Terminal terminal){
		return known && value.equals(terminal.name);
	}

	public Terminal toTerminal(){
		return new Terminal(value);
	}
}
