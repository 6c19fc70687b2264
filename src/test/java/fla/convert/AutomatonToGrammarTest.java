package fla.convert;

import java.util.*;

import org.junit.jupiter.api.Test;

import fla.Words;
import fla.automata.Automaton;
import fla.automata.AutomatonBuilder;
import fla.examples.LabExamples;
import fla.grammar.ChomskyType;
import fla.grammar.Grammar;
import fla.grammar.Production;

import static org.junit.jupiter.api.Assertions.*;

public class AutomatonToGrammarTest {

	@Test
	public void testNames(){
		Grammar grammar = LabExamples.variantNdfa().convertToRegularGrammar();
		assertEquals(new HashSet<>(Arrays.asList("A0", "A1", "A2", "A3")), grammar.getNonTerminals());
		assertEquals(new HashSet<>(Arrays.asList("a", "b", "c")), grammar.getTerminals());
		assertEquals("A0", grammar.getStart());
	}

	@Test
	public void testProductions(){
		Grammar grammar = LabExamples.variantNdfa().convertToRegularGrammar();
		assertEquals("A0 → aA0 | aA1", grammar.formatProductions("A0"));
		assertEquals("A1 → b | bA2 | cA1", grammar.formatProductions("A1"));
		assertEquals("A2 → bA3 | ε", grammar.formatProductions("A2"));
		assertEquals("A3 → aA1", grammar.formatProductions("A3"));
		assertTrue(grammar.getProductions("A2").contains(Production.epsilon("A2")));
		assertEquals(ChomskyType.TYPE_3, grammar.classify());
	}

	@Test
	public void testLanguageIsPreserved(){
		Automaton ndfa = LabExamples.variantNdfa();
		Automaton roundTrip = ndfa.convertToRegularGrammar().convertToDFA();
		for (List<String> word : Words.upTo(ndfa.getAlphabet(), 6)){
			assertEquals(ndfa.validate(word), roundTrip.validate(word), word.toString());
		}
	}

	@Test
	public void testStartStateComesFirst(){
		Automaton automaton = new AutomatonBuilder().addStates("a0", "z").addSymbols("x")
				.addTransition("z", "x", "a0").setStart("z").addAccepting("a0").toDFA();
		Grammar grammar = AutomatonToGrammar.convert(automaton);
		assertEquals("A0", grammar.getStart());
		assertEquals("A0 → x | xA1", grammar.formatProductions("A0"));
	}

	@Test
	public void testPrefixClashesWithTerminal(){
		Automaton automaton = new AutomatonBuilder().addStates("s", "t").addSymbols("A0")
				.addTransition("s", "A0", "t").setStart("s").addAccepting("t").toDFA();
		Grammar grammar = automaton.convertToRegularGrammar();
		assertEquals(new HashSet<>(Arrays.asList("A'0", "A'1")), grammar.getNonTerminals());
		assertEquals("A'0", grammar.getStart());
		assertTrue(grammar.getProductions("A'0").contains(new Production("A'0", "A0", "A'1")));
	}

	@Test
	public void testCustomPrefix(){
		Grammar grammar = AutomatonToGrammar.convert(LabExamples.variantNdfa(), "N");
		assertEquals("N0", grammar.getStart());
		assertEquals(4, grammar.getNonTerminals().size());
	}

	@Test
	public void testAcceptingStartKeepsEmptyWord(){
		Automaton automaton = new AutomatonBuilder().addStates("s", "t").addSymbols("a", "b")
				.addTransition("s", "a", "t").addTransition("t", "b", "s")
				.setStart("s").addAccepting("s").toDFA();
		Automaton roundTrip = automaton.convertToRegularGrammar().convertToDFA();
		for (List<String> word : Words.upTo(automaton.getAlphabet(), 6)){
			assertEquals(automaton.validate(word), roundTrip.validate(word), word.toString());
		}
		assertTrue(roundTrip.validate(""));
	}
}
