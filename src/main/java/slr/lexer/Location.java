package slr.lexer;

import java.io.Serializable;

public class Location implements Serializable {

	public final int line;
	public final int column;

	public Location(int line, int column){
		this.line = line;
		this.column = column;
	}

	@Override
	public String toString() {
		return "[" + line + ":" + column + "]";
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Location && ((Location) obj).line == line && ((Location) obj).column == column;
	}

	@Override
	public int hashCode() {
		return line * 31 + column;
	}
}
