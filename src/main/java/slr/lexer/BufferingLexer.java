package slr.lexer;

import java.util.*;

import com.google.common.collect.ImmutableList;

import slr.grammar.Terminal;

/**
 * A lexer that splits the whole input into tokens up front.
 */
public abstract class BufferingLexer implements Lexer {

	private final List<Token> tokens = new ArrayList<>();
	private int index = 0;
	private Token curToken = null;

	/**
	 * Terminal names without the end of input marker, longest first (ties keep the grammar order)
	 */
	protected final List<String> terminals;

	protected final String input;

	public BufferingLexer(Collection<Terminal> terminals, String input) {
		List<String> names = new ArrayList<>();
		for (Terminal terminal : terminals){
			if (!terminal.isEOF()){
				names.add(terminal.name);
			}
		}
		names.sort(Comparator.comparingInt(String::length).reversed());
		this.terminals = Collections.unmodifiableList(names);
		this.input = input;
		initTokens();
		tokens.add(Token.eof(endLocation()));
	}

	protected abstract void initTokens();

	/**
	 * Add a token, it's known if it names a terminal or the end of input marker (a "$" in the input ends
	 * the parsed part of it)
	 */
	protected void addToken(String value, Location location){
		tokens.add(new Token(value, isTerminal(value), location));
	}

	protected boolean isTerminal(String value){
		return value.equals(Terminal.EOF.name) || terminals.contains(value);
	}

	/**
	 * Location directly after the last character of the input
	 */
	private Location endLocation(){
		return locationOf(input.length());
	}

	/**
	 * Line and column (both starting at 1) of the passed offset in the input
	 */
	protected Location locationOf(int offset){
		int line = 1;
		int column = 1;
		for (int i = 0; i < offset && i < input.length(); i++){
			if (input.charAt(i) == '\n'){
				line++;
				column = 1;
			} else {
				column++;
			}
		}
		return new Location(line, column);
	}

	@Override
	public Token cur() {
		if (curToken == null){
			return next();
		}
		return curToken;
	}

	@Override
	public Token next() {
		if (index < tokens.size()){
			curToken = tokens.get(index++);
		}
		return curToken;
	}

	@Override
	public List<Token> remaining() {
		int start = curToken == null ? 0 : index - 1;
		return ImmutableList.copyOf(tokens.subList(start, tokens.size()));
	}

	@Override
	public List<Token> tokens() {
		return ImmutableList.copyOf(tokens);
	}
}
