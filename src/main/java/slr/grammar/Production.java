package slr.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A grammar production with a left and a right hand side.
 */
public class Production implements Serializable {

	/**
	 * Id of the production, productions are numbered in the order of their appearance in the grammar
	 */
	public final int id;
	/**
	 * Left hand side of the production (the associated non terminal)
	 */
	public final NonTerminal left;
	/**
	 * Right hand side of the production, empty for an epsilon production
	 */
	public final ImmutableList<Symbol> right;
	/**
	 * Position of this production among the alternatives of its left hand side
	 */
	public final int index;

	/**
	 * Terminals used in the right hand side
	 */
	public final ImmutableList<Terminal> terminals;

	/**
	 * Non terminals used in the right hand side
	 */
	public final ImmutableList<NonTerminal> nonTerminals;

	public Production(int id, NonTerminal left, List<Symbol> right, int index) {
		this.id = id;
		this.left = left;
		this.right = ImmutableList.copyOf(right);
		this.index = index;
		List<NonTerminal> nonTerminals = new ArrayList<>();
		List<Terminal> terminals = new ArrayList<>();
		for (Symbol symbol : this.right) {
			if (symbol instanceof NonTerminal){
				nonTerminals.add((NonTerminal)symbol);
			} else if (symbol instanceof Terminal){
				terminals.add((Terminal) symbol);
			} else {
				throw new IllegalArgumentException("Epsilon isn't allowed on the right hand side, use an empty list");
			}
		}
		this.nonTerminals = ImmutableList.copyOf(nonTerminals);
		this.terminals = ImmutableList.copyOf(terminals);
	}

	public String formatRightSide(){
		if (isEpsilonProduction()){
			return Epsilon.EPSILON.toString();
		}
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < right.size(); i++) {
			builder.append(right.get(i));
			if (i < right.size() - 1) {
				builder.append(" ");
			}
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return left.toString() + " → " + formatRightSide();
	}

	public boolean isEpsilonProduction(){
		return right.isEmpty();
	}

	/**
	 * Size of the right hand side.
	 */
	public int rightSize(){
		return right.size();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Production && ((Production)obj).id == id;
	}

	@Override
	public int hashCode() {
		return id;
	}
}
