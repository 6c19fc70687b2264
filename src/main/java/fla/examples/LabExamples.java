package fla.examples;

import java.util.*;

import fla.automata.Automaton;
import fla.automata.AutomatonBuilder;
import fla.grammar.Grammar;

/**
 * The grammar and the nondeterministic automaton of the laboratory assignment.
 */
public class LabExamples {

	/**
	 * <pre>
	 * S → aP | bQ
	 * P → bP | cP | dQ | e
	 * Q → eQ | fQ | a
	 * </pre>
	 */
	public static Grammar labGrammar(){
		Map<String, List<String>> productions = new LinkedHashMap<>();
		productions.put("S", Arrays.asList("aP", "bQ"));
		productions.put("P", Arrays.asList("bP", "cP", "dQ", "e"));
		productions.put("Q", Arrays.asList("eQ", "fQ", "a"));
		return Grammar.of(Arrays.asList("S", "P", "Q"), Arrays.asList("a", "b", "c", "d", "e", "f"),
				productions, "S");
	}

	/**
	 * Q = {q0, q1, q2, q3}, Σ = {a, b, c}, F = {q2},
	 * δ(q0, a) = {q0, q1}, δ(q1, c) = q1, δ(q1, b) = q2, δ(q2, b) = q3, δ(q3, a) = q1
	 */
	public static Automaton variantNdfa(){
		return new AutomatonBuilder()
				.addStates("q0", "q1", "q2", "q3")
				.addSymbols("a", "b", "c")
				.addTransition("q0", "a", "q0", "q1")
				.addTransition("q1", "c", "q1")
				.addTransition("q1", "b", "q2")
				.addTransition("q2", "b", "q3")
				.addTransition("q3", "a", "q1")
				.setStart("q0")
				.addAccepting("q2")
				.toNDFA();
	}
}
