package slr.lexer;

import java.util.Collection;

import slr.grammar.Terminal;

/**
 * Surrounds every occurrence of every terminal (longest first) with spaces and splits the result at
 * whitespace. A "$" separated by whitespace is the end of input marker.
 *
 * Simple, but terminals that contain other terminals can be torn apart, e.g. with the terminals
 * <code>a</code> and <code>ba</code> the input <code>bba</code> becomes <code>b b a</code>.
 */
public class SubstitutionLexer extends BufferingLexer {

	public SubstitutionLexer(Collection<Terminal> terminals, String input) {
		super(terminals, input);
	}

	@Override
	protected void initTokens() {
		String processed = input;
		for (String terminal : terminals){
			processed = processed.replace(terminal, " " + terminal + " ");
		}
		int searchFrom = 0;
		for (String part : processed.trim().split("\\s+")){
			if (part.isEmpty()){
				continue;
			}
			int offset = input.indexOf(part, searchFrom);
			if (offset == -1){
				// the part spans text that has been split by an earlier substitution
				offset = searchFrom;
			}
			addToken(part, locationOf(offset));
			searchFrom = offset + part.length();
		}
	}
}
