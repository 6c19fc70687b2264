package fla.automata;

import fla.FLAException;

/**
 * Thrown if an automaton definition violates the invariants of the automaton model.
 */
public class AutomatonConstructionError extends FLAException {

	public AutomatonConstructionError(String message) {
		super(message);
	}
}
