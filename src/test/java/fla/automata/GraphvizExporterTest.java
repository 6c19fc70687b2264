package fla.automata;

import org.junit.jupiter.api.Test;

import fla.examples.LabExamples;

import static org.junit.jupiter.api.Assertions.*;

public class GraphvizExporterTest {

	@Test
	public void testDotString(){
		String dot = LabExamples.variantNdfa().toGraphvizString();
		assertTrue(dot.startsWith("digraph"), dot);
		assertTrue(dot.contains("doublecircle"), dot);
		assertTrue(dot.contains("q2"), dot);
		assertTrue(dot.contains("->"), dot);
		assertTrue(dot.contains("point"), dot);
	}

	@Test
	public void testSymbolsShareAnEdge(){
		Automaton automaton = new AutomatonBuilder().addStates("x", "y").addSymbols("a", "b")
				.addTransition("x", "a", "y").addTransition("x", "b", "y").setStart("x").addAccepting("y").toDFA();
		String dot = GraphvizExporter.toDotString(automaton);
		assertTrue(dot.contains("a, b"), dot);
	}

	@Test
	public void testStartNodeDoesNotClash(){
		Automaton automaton = new AutomatonBuilder().addStates("start").addSymbols("a").setStart("start").toDFA();
		assertTrue(GraphvizExporter.toDotString(automaton).contains("start'"));
	}
}
