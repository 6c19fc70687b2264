package fla.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import fla.util.Utils;

/**
 * Trace of a single validation: the active states before the first and after every consumed symbol.
 */
public class Run {

	public enum Outcome {
		/**
		 * Whole input consumed, ended in an accepting state
		 */
		ACCEPTED,
		/**
		 * Whole input consumed, no accepting state active
		 */
		REJECTED,
		/**
		 * No transition for the symbol at {@link #getPosition()}
		 */
		NO_TRANSITION,
		/**
		 * The symbol at {@link #getPosition()} isn't part of the alphabet
		 */
		INVALID_SYMBOL
	}

	private final List<String> input;

	private final List<Set<String>> steps;

	private final Outcome outcome;

	/**
	 * Index of the symbol that aborted the run, -1 if the whole input was consumed.
	 */
	private final int position;

	Run(List<String> input, List<Set<String>> steps, Outcome outcome, int position) {
		this.input = Collections.unmodifiableList(new ArrayList<>(input));
		this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
		this.outcome = outcome;
		this.position = position;
	}

	public boolean isAccepted(){
		return outcome == Outcome.ACCEPTED;
	}

	public Outcome getOutcome(){
		return outcome;
	}

	public List<String> getInput(){
		return input;
	}

	/**
	 * Active state sets, the first entry holds the start state. A deterministic run has singleton sets.
	 */
	public List<Set<String>> getSteps(){
		return steps;
	}

	/**
	 * States active when the run ended.
	 */
	public Set<String> getLastStates(){
		return steps.isEmpty() ? Collections.emptySet() : steps.get(steps.size() - 1);
	}

	public int getPosition(){
		return position;
	}

	/**
	 * @return the symbol that aborted the run or null
	 */
	public String getOffendingSymbol(){
		return position == -1 ? null : input.get(position);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		builder.append("Validating '").append(String.join("", input)).append("'\n");
		for (int i = 0; i < steps.size(); i++){
			if (i == 0){
				builder.append("  start: ");
			} else {
				builder.append("  ").append(input.get(i - 1)).append(": ");
			}
			builder.append(Utils.formatSet(steps.get(i))).append("\n");
		}
		switch (outcome){
			case INVALID_SYMBOL:
				builder.append("Invalid symbol '").append(getOffendingSymbol()).append("' at ").append(position);
				break;
			case NO_TRANSITION:
				builder.append("No transition for '").append(getOffendingSymbol()).append("' at ").append(position);
				break;
			default:
				builder.append(outcome == Outcome.ACCEPTED ? "Accepted" : "Rejected");
		}
		return builder.toString();
	}
}
