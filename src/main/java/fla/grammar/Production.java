package fla.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A right linear production: {@code A → ε}, {@code A → a} or {@code A → a B}.
 */
public class Production {

	/**
	 * Left hand side of the production (the associated non terminal)
	 */
	public final String left;

	/**
	 * First symbol of the right hand side, null for an epsilon production
	 */
	public final String terminal;

	/**
	 * Non terminal that follows the terminal, null if the production ends with the terminal
	 */
	public final String nonTerminal;

	public Production(String left, String terminal, String nonTerminal) {
		if (terminal == null && nonTerminal != null){
			throw new MalformedGrammarError(String.format("Production %s → %s doesn't start with a terminal", left, nonTerminal));
		}
		this.left = Objects.requireNonNull(left);
		this.terminal = terminal;
		this.nonTerminal = nonTerminal;
	}

	public Production(String left, String terminal) {
		this(left, terminal, null);
	}

	public static Production epsilon(String left){
		return new Production(left, null, null);
	}

	public boolean isEpsilonProduction(){
		return terminal == null;
	}

	/**
	 * Does the derivation end after applying this production?
	 */
	public boolean isTerminating(){
		return nonTerminal == null;
	}

	/**
	 * Symbols of the right hand side, empty for epsilon productions.
	 */
	public List<String> right(){
		List<String> right = new ArrayList<>(2);
		if (terminal != null){
			right.add(terminal);
		}
		if (nonTerminal != null){
			right.add(nonTerminal);
		}
		return Collections.unmodifiableList(right);
	}

	public String formatRightSide(){
		if (isEpsilonProduction()){
			return "ε";
		}
		return terminal + (nonTerminal == null ? "" : nonTerminal);
	}

	@Override
	public String toString() {
		return left + " → " + formatRightSide();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Production)){
			return false;
		}
		Production other = (Production)obj;
		return left.equals(other.left) && Objects.equals(terminal, other.terminal)
				&& Objects.equals(nonTerminal, other.nonTerminal);
	}

	@Override
	public int hashCode() {
		return Objects.hash(left, terminal, nonTerminal);
	}
}
