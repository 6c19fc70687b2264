package fla.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static fla.automata.Run.Outcome.*;

/**
 * How an automaton evaluates its input. Both modes share the same automaton data, they only differ
 * in the number of states that are active at once.
 */
public enum AcceptanceMode {

	/**
	 * A single active state, a missing transition rejects the input.
	 */
	DETERMINISTIC {
		@Override
		Run run(Automaton automaton, List<String> input) {
			List<Set<String>> steps = new ArrayList<>();
			String current = automaton.getStart();
			steps.add(Collections.singleton(current));
			for (int i = 0; i < input.size(); i++){
				Set<String> next = automaton.destinations(current, input.get(i));
				if (next.isEmpty()){
					return new Run(input, steps, NO_TRANSITION, i);
				}
				current = next.iterator().next();
				steps.add(Collections.singleton(current));
			}
			return new Run(input, steps, automaton.getAcceptingStates().contains(current) ? ACCEPTED : REJECTED, -1);
		}
	},

	/**
	 * A set of active states, the input is rejected as soon as the set becomes empty.
	 */
	NONDETERMINISTIC {
		@Override
		Run run(Automaton automaton, List<String> input) {
			List<Set<String>> steps = new ArrayList<>();
			Set<String> current = Collections.singleton(automaton.getStart());
			steps.add(current);
			for (int i = 0; i < input.size(); i++){
				Set<String> next = new TreeSet<>();
				for (String state : current){
					next.addAll(automaton.destinations(state, input.get(i)));
				}
				if (next.isEmpty()){
					return new Run(input, steps, NO_TRANSITION, i);
				}
				current = Collections.unmodifiableSet(next);
				steps.add(current);
			}
			boolean accepted = false;
			for (String state : current){
				if (automaton.getAcceptingStates().contains(state)){
					accepted = true;
					break;
				}
			}
			return new Run(input, steps, accepted ? ACCEPTED : REJECTED, -1);
		}
	};

	/**
	 * Runs the automaton on an input that only consists of alphabet symbols.
	 */
	abstract Run run(Automaton automaton, List<String> input);
}
