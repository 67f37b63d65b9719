package slr.parser.lr;

import java.io.Serializable;
import java.util.List;

import slr.grammar.NonTerminal;
import slr.grammar.Production;
import slr.grammar.Symbol;

/**
 * An LR(0) item: a production with a dot that separates the already consumed prefix of its right hand side
 * from the remaining symbols.
 *
 * Two items are equal if their left hand sides, right hand sides and dot positions are equal, the production
 * id isn't taken into account.
 */
public class Item implements Serializable, Comparable<Item> {

	public final Production production;

	/**
	 * Index of the symbol after the dot
	 */
	public final int position;

	public Item(Production production, int position) {
		if (position < 0 || position > production.rightSize()){
			throw new IllegalArgumentException(String.format("Invalid dot position %d for %s", position, production));
		}
		this.production = production;
		this.position = position;
	}

	/**
	 * Item with the dot in front of the passed production's right hand side
	 */
	public Item(Production production){
		this(production, 0);
	}

	public NonTerminal left(){
		return production.left;
	}

	public List<Symbol> consumed(){
		return production.right.subList(0, position);
	}

	public List<Symbol> remaining(){
		return production.right.subList(position, production.rightSize());
	}

	public boolean canAdvance(){
		return position < production.rightSize();
	}

	/**
	 * Is the dot at the end of the right hand side?
	 */
	public boolean isComplete(){
		return !canAdvance();
	}

	public Item advance(){
		if (!canAdvance()){
			throw new IllegalStateException("Can't advance " + this);
		}
		return new Item(production, position + 1);
	}

	/**
	 * Symbol after the dot or null if the item is complete
	 */
	public Symbol nextSymbol(){
		if (canAdvance()){
			return production.right.get(position);
		}
		return null;
	}

	public boolean inFrontOfNonTerminal(){
		return nextSymbol() instanceof NonTerminal;
	}

	public boolean inFrontOf(Symbol symbol){
		return symbol.equals(nextSymbol());
	}

	public String formatRightSide(){
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < production.rightSize(); i++){
			if (i == position){
				builder.append("• ");
			}
			builder.append(production.right.get(i)).append(" ");
		}
		if (isComplete()){
			builder.append("•");
		}
		return builder.toString().trim();
	}

	@Override
	public String toString() {
		return production.left + " → " + formatRightSide();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Item)){
			return false;
		}
		Item other = (Item) obj;
		return other.position == position && other.production.left.equals(production.left)
				&& other.production.right.equals(production.right);
	}

	@Override
	public int hashCode() {
		return (production.left.hashCode() * 31 + production.right.hashCode()) * 31 + position;
	}

	/**
	 * Orders by production id and then by dot position
	 */
	@Override
	public int compareTo(Item o) {
		int cmp = Integer.compare(production.id, o.production.id);
		return cmp != 0 ? cmp : Integer.compare(position, o.position);
	}
}
