package fla.automata;

import java.util.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import fla.Words;
import fla.examples.LabExamples;

import static org.junit.jupiter.api.Assertions.*;

public class PowersetConstructionTest {

	private static Set<String> set(String... states){
		return new TreeSet<>(Arrays.asList(states));
	}

	@Test
	public void testSubsetsOfLabAutomaton(){
		PowersetConstruction construction = new PowersetConstruction(LabExamples.variantNdfa());
		Map<String, Set<String>> expected = new LinkedHashMap<>();
		expected.put("q0", set("q0"));
		expected.put("q1", set("q0", "q1"));
		expected.put("q2", set("q2"));
		expected.put("q3", set("q1"));
		expected.put("q4", set("q3"));
		assertEquals(expected, construction.getSubsets());
		assertEquals(new ArrayList<>(expected.keySet()), new ArrayList<>(construction.getSubsets().keySet()));
		assertEquals(set("q0", "q1"), construction.getSubset("q1"));
		assertNull(construction.getSubset("q5"));
	}

	@Test
	public void testTransitionsOfLabAutomaton(){
		Automaton dfa = PowersetConstruction.determinize(LabExamples.variantNdfa());
		assertEquals("q0", dfa.getStart());
		assertEquals(set("q2"), dfa.getAcceptingStates());
		assertEquals(set("q1"), dfa.destinations("q0", "a"));
		assertEquals(set("q1"), dfa.destinations("q1", "a"));
		assertEquals(set("q2"), dfa.destinations("q1", "b"));
		assertEquals(set("q3"), dfa.destinations("q1", "c"));
		assertEquals(set("q4"), dfa.destinations("q2", "b"));
		assertEquals(set("q2"), dfa.destinations("q3", "b"));
		assertEquals(set("q3"), dfa.destinations("q3", "c"));
		assertEquals(set("q3"), dfa.destinations("q4", "a"));
		assertTrue(dfa.destinations("q0", "b").isEmpty());
		assertTrue(dfa.destinations("q2", "a").isEmpty());
	}

	@Test
	public void testResultIsDeterministicAfterCompletion(){
		Automaton dfa = LabExamples.variantNdfa().convertToDFA();
		assertEquals(AcceptanceMode.DETERMINISTIC, dfa.getMode());
		assertTrue(dfa.hasSingleDestinations());
		assertFalse(dfa.isDeterministic());
		assertTrue(dfa.complete().isDeterministic());
	}

	@Test
	public void testWordsOfLabAutomaton(){
		Automaton dfa = LabExamples.variantNdfa().convertToDFA();
		assertTrue(dfa.validate("ab"));
		assertTrue(dfa.validate("aab"));
		assertTrue(dfa.validate("abbab"));
		assertFalse(dfa.validate(""));
		assertFalse(dfa.validate("ac"));
		assertFalse(dfa.validate("abb"));
	}

	@Test
	public void testLanguageIsPreserved(){
		Automaton ndfa = LabExamples.variantNdfa();
		Automaton dfa = ndfa.convertToDFA();
		for (List<String> word : Words.upTo(ndfa.getAlphabet(), 6)){
			assertEquals(ndfa.validate(word), dfa.validate(word), word.toString());
		}
	}

	@ParameterizedTest
	@ValueSource(longs = {1, 2, 3, 42, 1234, 98765})
	public void testRandomAutomata(long seed){
		Random random = new Random(seed);
		List<String> states = Arrays.asList("s0", "s1", "s2", "s3");
		AutomatonBuilder builder = new AutomatonBuilder()
				.addStates(states)
				.addSymbols("a", "b")
				.setStart("s0");
		for (String from : states){
			for (String symbol : Arrays.asList("a", "b")){
				for (String to : states){
					if (random.nextInt(3) == 0){
						builder.addTransition(from, symbol, to);
					}
				}
			}
			if (random.nextBoolean()){
				builder.addAccepting(from);
			}
		}
		Automaton ndfa = builder.toNDFA();
		Automaton dfa = ndfa.convertToDFA();
		assertTrue(dfa.hasSingleDestinations());
		assertTrue(dfa.complete().isDeterministic());
		for (List<String> word : Words.upTo(ndfa.getAlphabet(), 6)){
			assertEquals(ndfa.validate(word), dfa.validate(word), word.toString());
		}
	}

	@Test
	public void testStatePrefix(){
		PowersetConstruction construction = new PowersetConstruction(LabExamples.variantNdfa(), "D");
		assertEquals(set("D0", "D1", "D2", "D3", "D4"), construction.getResult().getStates());
		assertEquals("D0", construction.getResult().getStart());
	}

	@Test
	public void testAcceptingStart(){
		Automaton ndfa = new AutomatonBuilder().addStates("x").addSymbols("a").setStart("x").addAccepting("x").toNDFA();
		Automaton dfa = ndfa.convertToDFA();
		assertTrue(dfa.validate(""));
		assertFalse(dfa.validate("a"));
		assertEquals(1, dfa.getStates().size());
	}
}
