package pargen;

/**
 * Base class of all errors raised while reading or transforming grammars.
 */
public class PargenException extends RuntimeException {

	public PargenException(String message) {
		super(message);
	}

	public PargenException(String message, Throwable cause) {
		super(message, cause);
	}
}
