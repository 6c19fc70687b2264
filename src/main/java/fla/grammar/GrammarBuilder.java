package fla.grammar;

import java.util.*;

import fla.util.Utils;

/**
 * Allows the simple creation of right linear grammars.
 *
 * Right hand sides can be passed as literal strings ({@code "aP"}): they are split into a declared
 * terminal and the rest, which has to be empty or exactly one declared non terminal. The empty string
 * and {@code "ε"} stand for epsilon. Everything is checked by {@link #toGrammar(String)}, so terminals
 * and non terminals can be declared after the productions that use them.
 */
public class GrammarBuilder {

	private static class PendingProduction {
		final String left;
		/** Unparsed right hand side or null */
		final String literal;
		final Production production;

		PendingProduction(String left, String literal, Production production) {
			this.left = left;
			this.literal = literal;
			this.production = production;
		}
	}

	private final Set<String> nonTerminals = new LinkedHashSet<>();
	private final Set<String> terminals = new LinkedHashSet<>();
	private final List<PendingProduction> productions = new ArrayList<>();

	public GrammarBuilder addNonTerminals(String... nonTerminals){
		return addNonTerminals(Arrays.asList(nonTerminals));
	}

	public GrammarBuilder addNonTerminals(Collection<String> nonTerminals){
		this.nonTerminals.addAll(nonTerminals);
		return this;
	}

	public GrammarBuilder addTerminals(String... terminals){
		return addTerminals(Arrays.asList(terminals));
	}

	public GrammarBuilder addTerminals(Collection<String> terminals){
		this.terminals.addAll(terminals);
		return this;
	}

	/**
	 * Adds a production with a literal right hand side.
	 */
	public GrammarBuilder add(String left, String right){
		productions.add(new PendingProduction(left, right, null));
		return this;
	}

	/**
	 * Adds a production for each of the literal right hand sides.
	 */
	public GrammarBuilder add(String left, Collection<String> rights){
		for (String right : rights){
			add(left, right);
		}
		return this;
	}

	/**
	 * Adds {@code left → terminal nonTerminal}, the non terminal might be null.
	 */
	public GrammarBuilder add(String left, String terminal, String nonTerminal){
		productions.add(new PendingProduction(left, null, new Production(left, terminal, nonTerminal)));
		return this;
	}

	public GrammarBuilder addEpsilon(String left){
		productions.add(new PendingProduction(left, null, Production.epsilon(left)));
		return this;
	}

	/**
	 * Creates the grammar.
	 *
	 * @param start start non terminal
	 * @throws MalformedGrammarError if the definition isn't a valid right linear grammar
	 */
	public Grammar toGrammar(String start){
		if (!nonTerminals.contains(start)){
			throw new MalformedGrammarError(String.format("Start symbol %s isn't one of the non terminals %s",
					start, Utils.formatSet(nonTerminals)));
		}
		if (nonTerminals.contains("") || terminals.contains("")){
			throw new MalformedGrammarError("Symbols must not be empty");
		}
		Set<String> overlap = new TreeSet<>(terminals);
		overlap.retainAll(nonTerminals);
		if (!overlap.isEmpty()){
			throw new MalformedGrammarError(String.format("Terminals and non terminals must be disjoint, both contain %s",
					Utils.formatSet(overlap)));
		}
		List<String> terminalsByLength = new ArrayList<>(terminals);
		terminalsByLength.sort(Comparator.comparingInt(String::length).reversed());
		Map<String, Set<Production>> productionsPerNonTerminal = new LinkedHashMap<>();
		for (PendingProduction pending : productions){
			if (!nonTerminals.contains(pending.left)){
				throw new MalformedGrammarError(String.format("Invalid non terminal %s on the left side of a production", pending.left));
			}
			Production production = pending.production;
			if (production == null){
				production = parse(pending.left, pending.literal, terminalsByLength);
			} else {
				check(production);
			}
			productionsPerNonTerminal.computeIfAbsent(pending.left, l -> new LinkedHashSet<>()).add(production);
		}
		return new Grammar(nonTerminals, terminals, productionsPerNonTerminal, start);
	}

	private void check(Production production){
		if (production.terminal != null && !terminals.contains(production.terminal)){
			throw new MalformedGrammarError(String.format("First symbol in %s must be a terminal", production));
		}
		if (production.nonTerminal != null && !nonTerminals.contains(production.nonTerminal)){
			throw new MalformedGrammarError(String.format("Second symbol in %s must be a non terminal", production));
		}
	}

	private Production parse(String left, String right, List<String> terminalsByLength){
		if (right.isEmpty() || (right.equals("ε") && !terminals.contains("ε"))){
			return Production.epsilon(left);
		}
		boolean startsWithTerminal = false;
		for (String terminal : terminalsByLength){
			if (!right.startsWith(terminal)){
				continue;
			}
			startsWithTerminal = true;
			String rest = right.substring(terminal.length());
			if (rest.isEmpty()){
				return new Production(left, terminal);
			}
			if (nonTerminals.contains(rest)){
				return new Production(left, terminal, rest);
			}
		}
		if (!startsWithTerminal){
			throw new MalformedGrammarError(String.format("First symbol in %s → %s must be a terminal", left, right));
		}
		throw new MalformedGrammarError(String.format("The rest of %s → %s after the terminal must be a single non terminal", left, right));
	}
}
