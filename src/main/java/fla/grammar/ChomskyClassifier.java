package fla.grammar;

import java.util.*;

import fla.util.Utils;

/**
 * Simplified structural classification of rule sets into the Chomsky hierarchy.
 *
 * The first matching level wins:
 * <ol>
 *     <li>Type 3 if every rule has a single non terminal on its left side and ε, a terminal or
 *     a terminal followed by a non terminal on its right side</li>
 *     <li>Type 2 if every rule has a single non terminal on its left side</li>
 *     <li>Type 0 otherwise</li>
 * </ol>
 * Context sensitive grammars aren't detected, {@link ChomskyType#TYPE_1} is never returned.
 */
public class ChomskyClassifier {

	/**
	 * A general rule, both sides are sequences of symbols. An empty right side is ε.
	 */
	public static class Rule {

		public final List<String> left;

		public final List<String> right;

		public Rule(List<String> left, List<String> right) {
			this.left = Collections.unmodifiableList(new ArrayList<>(left));
			this.right = Collections.unmodifiableList(new ArrayList<>(right));
		}

		public static Rule of(Production production){
			return new Rule(Collections.singletonList(production.left), production.right());
		}

		@Override
		public String toString() {
			return Utils.join(left, " ") + " → " + (right.isEmpty() ? "ε" : Utils.join(right, " "));
		}
	}

	private final Set<String> nonTerminals;

	private final Set<String> terminals;

	public ChomskyClassifier(Collection<String> nonTerminals, Collection<String> terminals) {
		this.nonTerminals = new HashSet<>(nonTerminals);
		this.terminals = new HashSet<>(terminals);
	}

	public static ChomskyType classify(Grammar grammar){
		List<Rule> rules = new ArrayList<>();
		for (Production production : grammar.getProductions()){
			rules.add(Rule.of(production));
		}
		return new ChomskyClassifier(grammar.getNonTerminals(), grammar.getTerminals()).classify(rules);
	}

	public ChomskyType classify(Collection<Rule> rules){
		boolean regular = true;
		for (Rule rule : rules){
			if (!hasSingleNonTerminalLeft(rule)){
				return ChomskyType.TYPE_0;
			}
			regular = regular && isRightLinear(rule);
		}
		return regular ? ChomskyType.TYPE_3 : ChomskyType.TYPE_2;
	}

	private boolean hasSingleNonTerminalLeft(Rule rule){
		return rule.left.size() == 1 && nonTerminals.contains(rule.left.get(0));
	}

	private boolean isRightLinear(Rule rule){
		switch (rule.right.size()){
			case 0:
				return true;
			case 1:
				return terminals.contains(rule.right.get(0));
			case 2:
				return terminals.contains(rule.right.get(0)) && nonTerminals.contains(rule.right.get(1));
			default:
				return false;
		}
	}
}
