package fla.convert;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import fla.Config;
import fla.automata.Automaton;
import fla.grammar.Grammar;
import fla.grammar.GrammarBuilder;

/**
 * Converts a finite automaton into a right linear grammar.
 *
 * Each state gets a fresh non terminal ({@code A0} for the start state, the others numbered in the
 * natural order of their names). A transition {@code S --a--> T} becomes {@code A_S → a A_T} and
 * additionally {@code A_S → a} if {@code T} is accepting. Accepting states get an epsilon production.
 */
public class AutomatonToGrammar {

	private static final Logger LOG = Logger.getLogger("Grammar");

	public static Grammar convert(Automaton automaton){
		return convert(automaton, Config.nonTerminalPrefix());
	}

	public static Grammar convert(Automaton automaton, String nonTerminalPrefix){
		Map<String, String> names = nameStates(automaton, nonTerminalPrefix);
		GrammarBuilder builder = new GrammarBuilder()
				.addNonTerminals(names.values())
				.addTerminals(automaton.getAlphabet());
		for (Map.Entry<String, Map<String, Set<String>>> row : automaton.getTransitions().entrySet()){
			String left = names.get(row.getKey());
			for (Map.Entry<String, Set<String>> entry : row.getValue().entrySet()){
				for (String target : entry.getValue()){
					if (automaton.getAcceptingStates().contains(target)){
						builder.add(left, entry.getKey(), null);
					}
					builder.add(left, entry.getKey(), names.get(target));
				}
			}
		}
		for (String state : automaton.getAcceptingStates()){
			builder.addEpsilon(names.get(state));
		}
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine("State names: " + names);
		}
		return builder.toGrammar(names.get(automaton.getStart()));
	}

	/**
	 * Bijective renaming, the prefix is primed until no name clashes with a terminal.
	 */
	private static Map<String, String> nameStates(Automaton automaton, String prefix){
		List<String> order = new ArrayList<>();
		order.add(automaton.getStart());
		for (String state : automaton.getStates()){
			if (!state.equals(automaton.getStart())){
				order.add(state);
			}
		}
		while (clashes(prefix, order.size(), automaton.getAlphabet())){
			prefix += "'";
		}
		Map<String, String> names = new LinkedHashMap<>();
		for (int i = 0; i < order.size(); i++){
			names.put(order.get(i), prefix + i);
		}
		return names;
	}

	private static boolean clashes(String prefix, int count, Set<String> terminals){
		for (int i = 0; i < count; i++){
			if (terminals.contains(prefix + i)){
				return true;
			}
		}
		return false;
	}
}
