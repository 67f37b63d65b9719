package slr;

/**
 * Base class of all errors thrown by this library.
 */
public class SLRException extends RuntimeException {

	public SLRException(String message) {
		super(message);
	}

	public SLRException(String message, Throwable cause) {
		super(message, cause);
	}
}
