package fla.convert;

import java.util.logging.Logger;

import fla.Config;
import fla.automata.AcceptanceMode;
import fla.automata.Automaton;
import fla.automata.AutomatonBuilder;
import fla.grammar.Grammar;
import fla.grammar.Production;
import fla.util.Utils;

/**
 * Converts a right linear grammar into a finite automaton.
 *
 * Every non terminal becomes a state and an accepting final state is added:
 * {@code A → a} becomes {@code A --a--> FINAL}, {@code A → a B} becomes {@code A --a--> B}.
 * Epsilon productions have no transition of their own: {@code A → a B} additionally leads to
 * {@code FINAL} if {@code B → ε} exists, and the start state is accepting if the start symbol has an
 * epsilon production.
 *
 * Determinism isn't enforced. If two productions of a non terminal start with the same terminal,
 * the result evaluates its input nondeterministically, callers that need a deterministic
 * automaton have to check {@link Automaton#isDeterministic()}.
 */
public class GrammarToAutomaton {

	private static final Logger LOG = Logger.getLogger("Automata");

	public static Automaton convert(Grammar grammar){
		return convert(grammar, Config.finalState());
	}

	/**
	 * @param finalState preferred name of the final state, primed if a non terminal already has it
	 */
	public static Automaton convert(Grammar grammar, String finalState){
		String finalName = Utils.freshName(finalState, grammar.getNonTerminals());
		AutomatonBuilder builder = new AutomatonBuilder()
				.addStates(grammar.getNonTerminals())
				.addStates(finalName)
				.addSymbols(grammar.getTerminals())
				.setStart(grammar.getStart())
				.addAccepting(finalName);
		if (hasEpsilonProduction(grammar, grammar.getStart())){
			builder.addAccepting(grammar.getStart());
		}
		for (Production production : grammar.getProductions()){
			if (production.isEpsilonProduction()){
				continue;
			}
			if (production.isTerminating()){
				builder.addTransition(production.left, production.terminal, finalName);
				continue;
			}
			builder.addTransition(production.left, production.terminal, production.nonTerminal);
			if (hasEpsilonProduction(grammar, production.nonTerminal)){
				builder.addTransition(production.left, production.terminal, finalName);
			}
		}
		if (builder.hasSingleDestinations()){
			return builder.toDFA();
		}
		LOG.fine("Grammar has productions with the same terminal and different successors, using a nondeterministic automaton");
		return builder.toAutomaton(AcceptanceMode.NONDETERMINISTIC);
	}

	private static boolean hasEpsilonProduction(Grammar grammar, String nonTerminal){
		return grammar.getProductions(nonTerminal).contains(Production.epsilon(nonTerminal));
	}
}
