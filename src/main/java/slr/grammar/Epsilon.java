package slr.grammar;

/**
 * The empty word. Only used in first sets, never part of a grammar's symbols.
 */
public class Epsilon extends TerminalOrEpsilon {

	public static final Epsilon EPSILON = new Epsilon();

	private Epsilon() {
		super("ε");
	}

	private Object readResolve() {
		return EPSILON;
	}
}
