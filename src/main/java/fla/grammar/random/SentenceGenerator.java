package fla.grammar.random;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

import fla.Config;
import fla.grammar.Grammar;
import fla.grammar.Production;

/**
 * A generator of random sentences that are valid for a given grammar.
 *
 * Starting with the start symbol, the leftmost non terminal is replaced by the right hand side of
 * one of its productions, chosen uniformly at random, until only terminals are left.
 */
public class SentenceGenerator {

	private static final Logger LOG = Logger.getLogger("Grammar");

	private final Grammar grammar;

	private final Random rand;

	/**
	 * Maximum number of replacements per derivation
	 */
	private final int limit;

	public SentenceGenerator(Grammar grammar) {
		this(grammar, new Random());
	}

	public SentenceGenerator(Grammar grammar, Random rand) {
		this(grammar, rand, Config.derivationLimit());
	}

	public SentenceGenerator(Grammar grammar, Random rand, int limit) {
		if (limit < 0){
			throw new IllegalArgumentException("Negative derivation limit " + limit);
		}
		this.grammar = grammar;
		this.rand = rand;
		this.limit = limit;
	}

	/**
	 * @return a random word of the grammar's language
	 * @throws DerivationStalledError if a non terminal without productions is reached or the
	 * derivation needs more steps than allowed
	 */
	public String generateRandomSentence(){
		return derive().getWord();
	}

	/**
	 * Derives a random word and records every sentential form on the way.
	 *
	 * @throws DerivationStalledError if a non terminal without productions is reached or the
	 * derivation needs more steps than allowed
	 */
	public Derivation derive(){
		List<String> current = new ArrayList<>();
		current.add(grammar.getStart());
		List<List<String>> forms = new ArrayList<>();
		forms.add(new ArrayList<>(current));
		List<Production> applied = new ArrayList<>();
		int pos;
		while ((pos = leftmostNonTerminal(current)) != -1){
			String nonTerminal = current.get(pos);
			if (applied.size() == limit){
				throw new DerivationStalledError(String.join("", current),
						String.format("No word derived after %d steps, stuck at %s", limit, String.join("", current)));
			}
			Production production = chooseProduction(nonTerminal, current);
			current.remove(pos);
			current.addAll(pos, production.right());
			applied.add(production);
			forms.add(new ArrayList<>(current));
		}
		Derivation derivation = new Derivation(forms, applied);
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine("Derivation: " + derivation);
		}
		return derivation;
	}

	private Production chooseProduction(String nonTerminal, List<String> current){
		List<Production> options = new ArrayList<>(grammar.getProductions(nonTerminal));
		if (options.isEmpty()){
			throw new DerivationStalledError(String.join("", current),
					String.format("Non terminal %s has no productions, stuck at %s", nonTerminal, String.join("", current)));
		}
		return options.get(rand.nextInt(options.size()));
	}

	private int leftmostNonTerminal(List<String> symbols){
		for (int i = 0; i < symbols.size(); i++){
			if (grammar.isNonTerminal(symbols.get(i))){
				return i;
			}
		}
		return -1;
	}
}
