package fla.grammar;

import fla.FLAException;

/**
 * Thrown while building a grammar that isn't a valid right linear grammar.
 */
public class MalformedGrammarError extends FLAException {

	public MalformedGrammarError(String message) {
		super(message);
	}
}
