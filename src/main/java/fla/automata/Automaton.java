package fla.automata;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import fla.Config;
import fla.convert.AutomatonToGrammar;
import fla.grammar.Grammar;
import fla.util.Utils;

import static fla.automata.Run.Outcome.INVALID_SYMBOL;

/**
 * An immutable finite automaton.
 *
 * The transition table maps a state and a symbol to a set of destination states. A missing entry
 * rejects the input, it's not an error. The {@link AcceptanceMode} decides whether one state or a set
 * of states is active while the input is consumed.
 *
 * Use the {@link AutomatonBuilder} to create instances.
 */
public class Automaton {

	static final Logger LOG = Logger.getLogger("Automata");

	private final AcceptanceMode mode;

	private final Set<String> states;

	private final Set<String> alphabet;

	/**
	 * state → symbol → destinations, only states with at least one outgoing transition have an entry
	 */
	private final Map<String, Map<String, Set<String>>> transitions;

	private final String start;

	private final Set<String> acceptingStates;

	Automaton(AcceptanceMode mode, Set<String> states, Set<String> alphabet,
	          Map<String, Map<String, Set<String>>> transitions, String start, Set<String> acceptingStates) {
		this.mode = mode;
		this.states = Collections.unmodifiableSet(new TreeSet<>(states));
		this.alphabet = Collections.unmodifiableSet(new TreeSet<>(alphabet));
		Map<String, Map<String, Set<String>>> table = new TreeMap<>();
		for (Map.Entry<String, Map<String, Set<String>>> row : transitions.entrySet()){
			Map<String, Set<String>> copiedRow = new TreeMap<>();
			for (Map.Entry<String, Set<String>> entry : row.getValue().entrySet()){
				if (!entry.getValue().isEmpty()){
					copiedRow.put(entry.getKey(), Collections.unmodifiableSet(new TreeSet<>(entry.getValue())));
				}
			}
			if (!copiedRow.isEmpty()){
				table.put(row.getKey(), Collections.unmodifiableMap(copiedRow));
			}
		}
		this.transitions = Collections.unmodifiableMap(table);
		this.start = start;
		this.acceptingStates = Collections.unmodifiableSet(new TreeSet<>(acceptingStates));
	}

	public AcceptanceMode getMode(){
		return mode;
	}

	public Set<String> getStates(){
		return states;
	}

	public Set<String> getAlphabet(){
		return alphabet;
	}

	public Map<String, Map<String, Set<String>>> getTransitions(){
		return transitions;
	}

	public String getStart(){
		return start;
	}

	public Set<String> getAcceptingStates(){
		return acceptingStates;
	}

	/**
	 * @return destinations of the transition, empty if there is none
	 */
	public Set<String> destinations(String state, String symbol){
		Map<String, Set<String>> row = transitions.get(state);
		if (row == null || !row.containsKey(symbol)){
			return Collections.emptySet();
		}
		return row.get(symbol);
	}

	/**
	 * Does the input lead to an accepting state? Returns false for inputs that contain symbols
	 * outside of the alphabet, use {@link #run(List)} to distinguish this case.
	 */
	public boolean validate(List<String> input){
		return run(input).isAccepted();
	}

	/**
	 * Validates a word whose characters are the symbols.
	 */
	public boolean validate(String word){
		return validate(Utils.splitSymbols(word));
	}

	/**
	 * Runs the automaton and records the active states after every step.
	 */
	public Run run(List<String> input){
		for (int i = 0; i < input.size(); i++){
			if (!alphabet.contains(input.get(i))){
				List<Set<String>> steps = new ArrayList<>();
				steps.add(Collections.singleton(start));
				return new Run(input, steps, INVALID_SYMBOL, i);
			}
		}
		Run run = mode.run(this, input);
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(run.toString());
		}
		return run;
	}

	public Run run(String word){
		return run(Utils.splitSymbols(word));
	}

	/**
	 * Checks that every state with outgoing transitions has exactly one destination for each symbol of
	 * the alphabet. States without any outgoing transition are skipped.
	 */
	public boolean isDeterministic(){
		for (String state : states){
			Map<String, Set<String>> row = transitions.get(state);
			if (row == null){
				continue;
			}
			for (String symbol : alphabet){
				Set<String> destinations = row.get(symbol);
				if (destinations == null || destinations.size() != 1){
					return false;
				}
			}
		}
		return true;
	}

	/**
	 * Has every transition at most one destination? Missing transitions are allowed.
	 */
	public boolean hasSingleDestinations(){
		for (Map<String, Set<String>> row : transitions.values()){
			for (Set<String> destinations : row.values()){
				if (destinations.size() > 1){
					return false;
				}
			}
		}
		return true;
	}

	/**
	 * Routes every missing transition into a new rejecting sink state. Returns this automaton if
	 * no transition is missing.
	 */
	public Automaton complete(){
		String sink = Utils.freshName(Config.sinkState(), states);
		AutomatonBuilder builder = AutomatonBuilder.from(this).addStates(sink);
		boolean sinkUsed = false;
		for (String state : states){
			for (String symbol : alphabet){
				if (destinations(state, symbol).isEmpty()){
					builder.addTransition(state, symbol, sink);
					sinkUsed = true;
				}
			}
		}
		if (!sinkUsed){
			return this;
		}
		for (String symbol : alphabet){
			builder.addTransition(sink, symbol, sink);
		}
		return builder.toAutomaton(mode);
	}

	/**
	 * Powerset construction.
	 *
	 * @see PowersetConstruction
	 */
	public Automaton convertToDFA(){
		return PowersetConstruction.determinize(this);
	}

	/**
	 * @see AutomatonToGrammar
	 */
	public Grammar convertToRegularGrammar(){
		return AutomatonToGrammar.convert(this);
	}

	public String toGraphvizString(){
		return GraphvizExporter.toDotString(this);
	}

	public String longDescription(){
		StringBuilder builder = new StringBuilder();
		builder.append("Mode: ").append(mode.name().toLowerCase()).append("\n")
				.append("States: ").append(Utils.formatSet(states)).append("\n")
				.append("Alphabet: ").append(Utils.formatSet(alphabet)).append("\n")
				.append("Start state: ").append(start).append("\n")
				.append("Accepting states: ").append(Utils.formatSet(acceptingStates)).append("\n")
				.append("Transitions:");
		for (Map.Entry<String, Map<String, Set<String>>> row : transitions.entrySet()){
			for (Map.Entry<String, Set<String>> entry : row.getValue().entrySet()){
				builder.append("\n  ").append(row.getKey()).append(" --(").append(entry.getKey()).append(")--> ")
						.append(Utils.join(entry.getValue(), ", "));
			}
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return longDescription();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Automaton)){
			return false;
		}
		Automaton other = (Automaton)obj;
		return mode == other.mode && states.equals(other.states) && alphabet.equals(other.alphabet)
				&& transitions.equals(other.transitions) && start.equals(other.start)
				&& acceptingStates.equals(other.acceptingStates);
	}

	@Override
	public int hashCode() {
		return Objects.hash(mode, states, alphabet, transitions, start, acceptingStates);
	}
}
