package fla.automata;

import org.junit.jupiter.api.Test;

import fla.examples.LabExamples;

import static org.junit.jupiter.api.Assertions.*;

public class AutomatonBuilderTest {

	private AutomatonBuilder valid(){
		return new AutomatonBuilder()
				.addStates("0", "1")
				.addSymbols("a")
				.addTransition("0", "a", "1")
				.setStart("0")
				.addAccepting("1");
	}

	@Test
	public void testValidDefinition(){
		Automaton automaton = valid().toDFA();
		assertEquals(AcceptanceMode.DETERMINISTIC, automaton.getMode());
		assertEquals("0", automaton.getStart());
		assertTrue(automaton.validate("a"));
		assertEquals(AcceptanceMode.NONDETERMINISTIC, valid().toNDFA().getMode());
	}

	@Test
	public void testMissingStart(){
		AutomatonBuilder builder = new AutomatonBuilder().addStates("0").addSymbols("a");
		assertThrows(AutomatonConstructionError.class, builder::toNDFA);
	}

	@Test
	public void testUndeclaredStart(){
		assertThrows(AutomatonConstructionError.class, () -> valid().setStart("2").toNDFA());
	}

	@Test
	public void testUndeclaredAcceptingState(){
		assertThrows(AutomatonConstructionError.class, () -> valid().addAccepting("2").toNDFA());
	}

	@Test
	public void testUndeclaredSymbol(){
		assertThrows(AutomatonConstructionError.class, () -> valid().addTransition("0", "b", "1").toNDFA());
	}

	@Test
	public void testUndeclaredDestination(){
		assertThrows(AutomatonConstructionError.class, () -> valid().addTransition("0", "a", "2").toNDFA());
	}

	@Test
	public void testUndeclaredSource(){
		assertThrows(AutomatonConstructionError.class, () -> valid().addTransition("2", "a", "1").toNDFA());
	}

	@Test
	public void testDuplicateTransitionsInDFA(){
		AutomatonBuilder builder = valid().addTransition("0", "a", "0");
		assertFalse(builder.hasSingleDestinations());
		AutomatonConstructionError error = assertThrows(AutomatonConstructionError.class, builder::toDFA);
		assertTrue(error.getMessage().contains("0 --(a)--> 0, 1"), error.getMessage());
		assertEquals(2, builder.toNDFA().destinations("0", "a").size());
	}

	@Test
	public void testEmptyDestinationsAreIgnored(){
		Automaton automaton = valid().addTransition("1", "a").toDFA();
		assertFalse(automaton.getTransitions().containsKey("1"));
	}

	@Test
	public void testFromCopiesEverything(){
		Automaton ndfa = LabExamples.variantNdfa();
		assertEquals(ndfa, AutomatonBuilder.from(ndfa).toNDFA());
		assertNotEquals(ndfa, AutomatonBuilder.from(ndfa).addAccepting("q3").toNDFA());
	}

	@Test
	public void testBuilderChangesDontLeakIntoAutomata(){
		AutomatonBuilder builder = valid();
		Automaton automaton = builder.toDFA();
		builder.addStates("2").addTransition("1", "a", "2");
		assertFalse(automaton.getStates().contains("2"));
		assertTrue(automaton.destinations("1", "a").isEmpty());
	}
}
