package fla.grammar.random;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import fla.grammar.Production;

/**
 * The sentential forms of a finished derivation and the productions applied between them.
 */
public class Derivation {

	private final List<List<String>> sententialForms;

	private final List<Production> appliedProductions;

	Derivation(List<List<String>> sententialForms, List<Production> appliedProductions) {
		List<List<String>> forms = new ArrayList<>();
		for (List<String> form : sententialForms){
			forms.add(Collections.unmodifiableList(new ArrayList<>(form)));
		}
		this.sententialForms = Collections.unmodifiableList(forms);
		this.appliedProductions = Collections.unmodifiableList(new ArrayList<>(appliedProductions));
	}

	/**
	 * Sentential forms as symbol lists, starting with the start symbol and ending with the word.
	 */
	public List<List<String>> getSententialForms(){
		return sententialForms;
	}

	public List<Production> getAppliedProductions(){
		return appliedProductions;
	}

	/**
	 * The derived word as a list of terminals.
	 */
	public List<String> getSymbols(){
		return sententialForms.get(sententialForms.size() - 1);
	}

	public String getWord(){
		return String.join("", getSymbols());
	}

	@Override
	public String toString() {
		List<String> forms = new ArrayList<>();
		for (List<String> form : sententialForms){
			forms.add(form.isEmpty() ? "ε" : String.join("", form));
		}
		return String.join(" → ", forms);
	}
}
