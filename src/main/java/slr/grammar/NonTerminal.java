package slr.grammar;

import java.util.*;

/**
 * A non terminal symbol with associated productions.
 */
public class NonTerminal extends Symbol {

	/**
	 * List of productions that have this non terminal on their left side.
	 */
	private final List<Production> productions = new ArrayList<>();

	public NonTerminal(String name) {
		super(name);
	}

	public List<Production> getProductions(){
		return Collections.unmodifiableList(productions);
	}

	public boolean hasProductions(){
		return !productions.isEmpty();
	}

	void addProduction(Production production) {
		productions.add(production);
	}

	public boolean hasEpsilonProduction(){
		for (Production production : productions) {
			if (production.isEpsilonProduction()){
				return true;
			}
		}
		return false;
	}
}
