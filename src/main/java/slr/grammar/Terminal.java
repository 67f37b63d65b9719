package slr.grammar;

/**
 * A terminal symbol, i.e. a symbol that appears literally in the parsed input.
 */
public class Terminal extends TerminalOrEpsilon {

	/**
	 * End of input marker, part of every grammar
	 */
	public static final Terminal EOF = new Terminal("$");

	public Terminal(String name) {
		super(name);
	}

	public boolean isEOF(){
		return this.equals(EOF);
	}
}
