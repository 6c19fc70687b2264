package fla.automata;

import java.util.*;

import fla.util.Utils;

/**
 * Allows the simple creation of automata.
 *
 * <pre>
 * Automaton ndfa = new AutomatonBuilder()
 *         .addStates("q0", "q1").addSymbols("a")
 *         .addTransition("q0", "a", "q0", "q1")
 *         .setStart("q0").addAccepting("q1")
 *         .toNDFA();
 * </pre>
 *
 * The invariants of the automaton model are checked when the automaton is created.
 */
public class AutomatonBuilder {

	private final Set<String> states = new TreeSet<>();
	private final Set<String> alphabet = new TreeSet<>();
	private final Map<String, Map<String, Set<String>>> transitions = new TreeMap<>();
	private final Set<String> acceptingStates = new TreeSet<>();
	private String start;

	/**
	 * Creates a builder that already contains everything of the passed automaton.
	 */
	public static AutomatonBuilder from(Automaton automaton){
		AutomatonBuilder builder = new AutomatonBuilder()
				.addStates(automaton.getStates())
				.addSymbols(automaton.getAlphabet())
				.setStart(automaton.getStart())
				.addAccepting(automaton.getAcceptingStates());
		for (Map.Entry<String, Map<String, Set<String>>> row : automaton.getTransitions().entrySet()){
			for (Map.Entry<String, Set<String>> entry : row.getValue().entrySet()){
				builder.addTransition(row.getKey(), entry.getKey(), entry.getValue());
			}
		}
		return builder;
	}

	public AutomatonBuilder addStates(String... states){
		return addStates(Arrays.asList(states));
	}

	public AutomatonBuilder addStates(Collection<String> states){
		this.states.addAll(states);
		return this;
	}

	public AutomatonBuilder addSymbols(String... symbols){
		return addSymbols(Arrays.asList(symbols));
	}

	public AutomatonBuilder addSymbols(Collection<String> symbols){
		alphabet.addAll(symbols);
		return this;
	}

	/**
	 * Adds transitions from the state to each of the passed destinations.
	 */
	public AutomatonBuilder addTransition(String from, String symbol, String... to){
		return addTransition(from, symbol, Arrays.asList(to));
	}

	public AutomatonBuilder addTransition(String from, String symbol, Collection<String> to){
		if (!to.isEmpty()){
			transitions.computeIfAbsent(from, s -> new TreeMap<>())
					.computeIfAbsent(symbol, s -> new TreeSet<>())
					.addAll(to);
		}
		return this;
	}

	public AutomatonBuilder setStart(String start){
		this.start = start;
		return this;
	}

	public AutomatonBuilder addAccepting(String... states){
		return addAccepting(Arrays.asList(states));
	}

	public AutomatonBuilder addAccepting(Collection<String> states){
		acceptingStates.addAll(states);
		return this;
	}

	/**
	 * Has every transition added so far at most one destination?
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
	 * Creates an automaton with a single active state.
	 *
	 * @throws AutomatonConstructionError if a state has several destinations for one symbol
	 */
	public Automaton toDFA(){
		return toAutomaton(AcceptanceMode.DETERMINISTIC);
	}

	public Automaton toNDFA(){
		return toAutomaton(AcceptanceMode.NONDETERMINISTIC);
	}

	public Automaton toAutomaton(AcceptanceMode mode){
		check(mode);
		return new Automaton(mode, states, alphabet, transitions, start, acceptingStates);
	}

	private void check(AcceptanceMode mode){
		if (start == null){
			throw new AutomatonConstructionError("No start state set");
		}
		if (!states.contains(start)){
			throw new AutomatonConstructionError(String.format("Start state %s isn't one of the states %s",
					start, Utils.formatSet(states)));
		}
		for (String state : acceptingStates){
			if (!states.contains(state)){
				throw new AutomatonConstructionError(String.format("Accepting state %s isn't one of the states %s",
						state, Utils.formatSet(states)));
			}
		}
		for (Map.Entry<String, Map<String, Set<String>>> row : transitions.entrySet()){
			String from = row.getKey();
			if (!states.contains(from)){
				throw new AutomatonConstructionError(String.format("Transition from unknown state %s", from));
			}
			for (Map.Entry<String, Set<String>> entry : row.getValue().entrySet()){
				String symbol = entry.getKey();
				if (!alphabet.contains(symbol)){
					throw new AutomatonConstructionError(String.format("Symbol %s of transition from %s isn't part of the alphabet %s",
							symbol, from, Utils.formatSet(alphabet)));
				}
				for (String to : entry.getValue()){
					if (!states.contains(to)){
						throw new AutomatonConstructionError(String.format("Transition %s --(%s)--> %s leads to an unknown state",
								from, symbol, to));
					}
				}
				if (mode == AcceptanceMode.DETERMINISTIC && entry.getValue().size() > 1){
					throw new AutomatonConstructionError(String.format("Duplicate transitions aren't allowed in deterministic automata: %s --(%s)--> %s",
							from, symbol, Utils.join(entry.getValue(), ", ")));
				}
			}
		}
	}
}
