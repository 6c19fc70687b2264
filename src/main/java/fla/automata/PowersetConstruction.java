package fla.automata;

import java.util.*;
import java.util.logging.Level;

import fla.Config;
import fla.util.Utils;

import static fla.automata.Automaton.LOG;

/**
 * Converts an automaton into an equivalent deterministic automaton whose states represent
 * the reachable sets of states of the original automaton.
 *
 * The sets are explored breadth first, the symbols in their natural order, so the synthesized
 * state names ({@code q0} for the start set, then {@code q1}, {@code q2}, …) are stable.
 * Empty sets are never created: the result is partial and rejects where the original automaton
 * has no transition, call {@link Automaton#complete()} to get a total transition function.
 *
 * @url https://de.wikipedia.org/wiki/Potenzmengenkonstruktion
 */
public class PowersetConstruction {

	private final Automaton automaton;

	private final String statePrefix;

	/**
	 * Discovered sets and their names, in discovery order
	 */
	private final Map<Set<String>, String> setToName = new LinkedHashMap<>();

	private final Map<String, Set<String>> nameToSet = new LinkedHashMap<>();

	private final Automaton result;

	public PowersetConstruction(Automaton automaton) {
		this(automaton, Config.powersetStatePrefix());
	}

	public PowersetConstruction(Automaton automaton, String statePrefix) {
		this.automaton = automaton;
		this.statePrefix = statePrefix;
		this.result = construct();
	}

	public static Automaton determinize(Automaton automaton){
		return new PowersetConstruction(automaton).getResult();
	}

	public Automaton getResult(){
		return result;
	}

	/**
	 * @return the set of original states behind the passed state of the result or null
	 */
	public Set<String> getSubset(String state){
		return nameToSet.get(state);
	}

	/**
	 * Maps each state of the result to its set of original states, in discovery order.
	 */
	public Map<String, Set<String>> getSubsets(){
		return Collections.unmodifiableMap(nameToSet);
	}

	private Automaton construct(){
		AutomatonBuilder builder = new AutomatonBuilder().addSymbols(automaton.getAlphabet());
		Deque<Set<String>> queue = new ArrayDeque<>();
		Set<String> initialSet = Collections.unmodifiableSet(new TreeSet<>(Collections.singleton(automaton.getStart())));
		discover(initialSet);
		queue.add(initialSet);
		while (!queue.isEmpty()){
			Set<String> current = queue.poll();
			String currentName = setToName.get(current);
			for (String symbol : automaton.getAlphabet()){
				Set<String> next = gotoSet(current, symbol);
				if (next.isEmpty()){
					continue;
				}
				if (!setToName.containsKey(next)){
					discover(next);
					queue.add(next);
				}
				builder.addTransition(currentName, symbol, setToName.get(next));
			}
		}
		for (Map.Entry<String, Set<String>> entry : nameToSet.entrySet()){
			builder.addStates(entry.getKey());
			if (containsAcceptingState(entry.getValue())){
				builder.addAccepting(entry.getKey());
			}
		}
		builder.setStart(setToName.get(initialSet));
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("Powerset construction: %d states → %d states", automaton.getStates().size(), nameToSet.size()));
			for (Map.Entry<String, Set<String>> entry : nameToSet.entrySet()){
				LOG.fine(String.format("  %s = %s", entry.getKey(), Utils.formatSet(entry.getValue())));
			}
		}
		return builder.toDFA();
	}

	private void discover(Set<String> set){
		String name = statePrefix + setToName.size();
		setToName.put(set, name);
		nameToSet.put(name, set);
	}

	/**
	 * Union of the destinations of every state in the set for the passed symbol.
	 */
	private Set<String> gotoSet(Set<String> set, String symbol){
		Set<String> ret = new TreeSet<>();
		for (String state : set){
			ret.addAll(automaton.destinations(state, symbol));
		}
		return Collections.unmodifiableSet(ret);
	}

	private boolean containsAcceptingState(Set<String> set){
		for (String state : set){
			if (automaton.getAcceptingStates().contains(state)){
				return true;
			}
		}
		return false;
	}
}
