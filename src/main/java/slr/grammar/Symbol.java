package slr.grammar;

import java.io.Serializable;
import java.util.Objects;

/**
 * Base class for terminal symbols, non terminal symbols and epsilon.
 *
 * Symbols are identified by their class and their name.
 */
public abstract class Symbol implements Serializable, Comparable<Symbol> {

	/**
	 * Name of the symbol as written in the grammar
	 */
	public final String name;

	protected Symbol(String name) {
		this.name = Objects.requireNonNull(name);
	}

	public boolean isEpsOrTerminal(){
		return this instanceof TerminalOrEpsilon;
	}

	@Override
	public int hashCode() {
		return name.hashCode() * 31 + getClass().hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && obj.getClass() == this.getClass() && ((Symbol)obj).name.equals(name);
	}

	@Override
	public String toString() {
		return name;
	}

	/**
	 * Non terminals come before terminals, symbols of the same kind are ordered by name.
	 */
	@Override
	public int compareTo(Symbol o) {
		int kind = Integer.compare(kindOrder(), o.kindOrder());
		if (kind != 0){
			return kind;
		}
		return name.compareTo(o.name);
	}

	private int kindOrder(){
		if (this instanceof NonTerminal){
			return 0;
		}
		return this instanceof Terminal ? 1 : 2;
	}
}
