package fla;

/**
 * Base class of all errors raised while building or transforming grammars and automata.
 */
public class FLAException extends RuntimeException {

	public FLAException(String message) {
		super(message);
	}

	public FLAException(String message, Throwable cause) {
		super(message, cause);
	}
}
