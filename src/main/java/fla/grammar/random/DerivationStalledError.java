package fla.grammar.random;

import fla.FLAException;

/**
 * Thrown if a derivation can't reach a word that only consists of terminals.
 */
public class DerivationStalledError extends FLAException {

	/**
	 * Sentential form the derivation got stuck with
	 */
	public final String sententialForm;

	public DerivationStalledError(String sententialForm, String message) {
		super(message);
		this.sententialForm = sententialForm;
	}
}
