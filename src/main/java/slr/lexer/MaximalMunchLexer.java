package slr.lexer;

import java.util.Collection;

import slr.grammar.Terminal;

/**
 * Reads the longest terminal (or the end of input marker "$") at each position, whitespace separates tokens
 * but isn't required between them. Text that doesn't start with a terminal is collected into a single
 * unknown token that ends at the next whitespace or at the next position where a terminal starts.
 */
public class MaximalMunchLexer extends BufferingLexer {

	public MaximalMunchLexer(Collection<Terminal> terminals, String input) {
		super(terminals, input);
	}

	@Override
	protected void initTokens() {
		int pos = 0;
		while (pos < input.length()){
			if (Character.isWhitespace(input.charAt(pos))){
				pos++;
				continue;
			}
			String match = longestMatch(pos);
			if (match != null){
				addToken(match, locationOf(pos));
				pos += match.length();
				continue;
			}
			int start = pos;
			do {
				pos++;
			} while (pos < input.length() && !Character.isWhitespace(input.charAt(pos)) && longestMatch(pos) == null);
			addToken(input.substring(start, pos), locationOf(start));
		}
	}

	private String longestMatch(int pos){
		for (String terminal : terminals){
			if (input.startsWith(terminal, pos)){
				return terminal;
			}
		}
		if (input.startsWith(Terminal.EOF.name, pos)){
			return Terminal.EOF.name;
		}
		return null;
	}
}
