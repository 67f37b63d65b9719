package slr;

import slr.lexer.Location;
import slr.lexer.Token;

public class LocatedSLRException extends SLRException {

	public final Token errorToken;
	public final Location errorLocation;

	public LocatedSLRException(Token errorToken, String message) {
		super(message);
		this.errorToken = errorToken;
		if (errorToken != null) {
			this.errorLocation = errorToken.location;
		} else {
			this.errorLocation = new Location(0, 0);
		}
	}
}
