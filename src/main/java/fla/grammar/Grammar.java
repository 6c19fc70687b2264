package fla.grammar;

import java.util.*;

import fla.automata.Automaton;
import fla.convert.GrammarToAutomaton;
import fla.grammar.random.SentenceGenerator;
import fla.util.Utils;

/**
 * Right linear grammar consisting of terminals, non terminals, productions and a start symbol.
 *
 * Every production has the form {@code A → ε}, {@code A → a} or {@code A → a B}. Instances are
 * immutable, use the {@link GrammarBuilder} or {@link #of(Collection, Collection, Map, String)}
 * to create them.
 */
public class Grammar {

	private final Set<String> nonTerminals;

	private final Set<String> terminals;

	/**
	 * Productions per left hand side, non terminals without productions have no entry
	 */
	private final Map<String, Set<Production>> productions;

	private final String start;

	Grammar(Set<String> nonTerminals, Set<String> terminals, Map<String, Set<Production>> productions, String start) {
		this.nonTerminals = Collections.unmodifiableSet(new LinkedHashSet<>(nonTerminals));
		this.terminals = Collections.unmodifiableSet(new LinkedHashSet<>(terminals));
		Map<String, Set<Production>> copy = new LinkedHashMap<>();
		for (Map.Entry<String, Set<Production>> entry : productions.entrySet()){
			copy.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
		}
		this.productions = Collections.unmodifiableMap(copy);
		this.start = start;
	}

	/**
	 * Creates a grammar from literal right hand sides, like {@code S → {"aP", "bQ"}}.
	 *
	 * @throws MalformedGrammarError if the definition isn't a valid right linear grammar
	 */
	public static Grammar of(Collection<String> nonTerminals, Collection<String> terminals,
	                         Map<String, ? extends Collection<String>> productions, String start){
		GrammarBuilder builder = new GrammarBuilder().addNonTerminals(nonTerminals).addTerminals(terminals);
		for (Map.Entry<String, ? extends Collection<String>> entry : productions.entrySet()){
			builder.add(entry.getKey(), entry.getValue());
		}
		return builder.toGrammar(start);
	}

	public Set<String> getNonTerminals(){
		return nonTerminals;
	}

	public Set<String> getTerminals(){
		return terminals;
	}

	public String getStart(){
		return start;
	}

	public boolean isNonTerminal(String symbol){
		return nonTerminals.contains(symbol);
	}

	/**
	 * Productions that have the passed non terminal on their left side.
	 */
	public Set<Production> getProductions(String nonTerminal){
		return productions.getOrDefault(nonTerminal, Collections.emptySet());
	}

	/**
	 * All productions, grouped by their left hand side.
	 */
	public List<Production> getProductions(){
		List<Production> ret = new ArrayList<>();
		for (Set<Production> set : productions.values()){
			ret.addAll(set);
		}
		return ret;
	}

	/**
	 * Derives a random word, see {@link SentenceGenerator}.
	 */
	public String derive(){
		return derive(new Random());
	}

	public String derive(Random random){
		return new SentenceGenerator(this, random).generateRandomSentence();
	}

	public ChomskyType classify(){
		return ChomskyClassifier.classify(this);
	}

	/**
	 * @see GrammarToAutomaton
	 */
	public Automaton convertToDFA(){
		return GrammarToAutomaton.convert(this);
	}

	/**
	 * Formats the productions of a non terminal as {@code S → aP | bQ}.
	 */
	public String formatProductions(String nonTerminal){
		List<String> rights = new ArrayList<>();
		for (Production production : getProductions(nonTerminal)){
			rights.add(production.formatRightSide());
		}
		Collections.sort(rights);
		return nonTerminal + " → " + String.join(" | ", rights);
	}

	public String longDescription(){
		StringBuilder builder = new StringBuilder();
		builder.append("Non terminals: ").append(Utils.formatSet(nonTerminals)).append("\n")
				.append("Terminals: ").append(Utils.formatSet(terminals)).append("\n")
				.append("Productions:");
		for (String nonTerminal : productions.keySet()){
			builder.append("\n  ").append(formatProductions(nonTerminal));
		}
		builder.append("\nStart: ").append(start);
		return builder.toString();
	}

	@Override
	public String toString() {
		return longDescription();
	}
}
