package fla;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

import guru.nidi.graphviz.engine.Format;

import fla.automata.Automaton;
import fla.automata.GraphvizExporter;
import fla.automata.PowersetConstruction;
import fla.examples.LabExamples;
import fla.grammar.Grammar;
import fla.grammar.random.Derivation;
import fla.grammar.random.SentenceGenerator;
import fla.util.Utils;

/**
 * Demonstrates the laboratory grammar and automaton.
 *
 * <pre>
 * Main [-o output directory [-r]] [-s seed] [word...]
 * </pre>
 *
 * Prints the grammar and its automaton, validates five random derivations, the passed words and
 * a few random words. Converts the nondeterministic automaton and writes dot files of all automata
 * if an output directory is given ({@code -r} additionally renders them as SVG, this needs Graphviz).
 */
public class Main {

	private static final Logger LOG = Logger.getLogger("Main");

	public static void main(String[] args) {
		Path outputDir = null;
		boolean render = false;
		Random random = new Random();
		List<String> words = new ArrayList<>();
		for (int i = 0; i < args.length; i++){
			switch (args[i]){
				case "-o":
					outputDir = Paths.get(requireValue(args, ++i));
					break;
				case "-s":
					random = new Random(parseSeed(requireValue(args, ++i)));
					break;
				case "-r":
					render = true;
					break;
				default:
					words.add(args[i]);
			}
		}

		Grammar grammar = LabExamples.labGrammar();
		System.out.println(grammar.longDescription());
		System.out.println("Classification: " + grammar.classify());
		Automaton grammarDfa = grammar.convertToDFA();
		System.out.println(grammarDfa.longDescription());
		System.out.println("Deterministic: " + grammarDfa.isDeterministic());

		SentenceGenerator generator = new SentenceGenerator(grammar, random);
		for (int i = 0; i < 5; i++){
			Derivation derivation = generator.derive();
			System.out.println(derivation);
			System.out.println(grammarDfa.run(derivation.getSymbols()));
		}
		for (String word : words){
			System.out.println(grammarDfa.run(word));
		}
		for (int i = 0; i < 3; i++){
			System.out.println(grammarDfa.run(Utils.randomWord(grammar.getTerminals(), 1, 6, random)));
		}

		Automaton ndfa = LabExamples.variantNdfa();
		System.out.println(ndfa.longDescription());
		System.out.println("Deterministic: " + ndfa.isDeterministic());
		PowersetConstruction construction = new PowersetConstruction(ndfa);
		Automaton dfa = construction.getResult();
		construction.getSubsets().forEach((state, set) -> System.out.println(state + " = " + Utils.formatSet(set)));
		System.out.println(dfa.longDescription());
		System.out.println(dfa.convertToRegularGrammar().longDescription());

		if (outputDir != null){
			try {
				Files.createDirectories(outputDir);
				write(outputDir, "variant_ndfa", ndfa, render);
				write(outputDir, "variant_dfa", dfa, render);
				write(outputDir, "grammar_dfa", grammarDfa, render);
			} catch (IOException e) {
				LOG.log(Level.SEVERE, "Can't write the dot files to " + outputDir, e);
				System.exit(1);
			}
		}
	}

	static String requireValue(String[] args, int index){
		if (index >= args.length){
			throw new IllegalArgumentException("Missing value for " + args[index - 1]);
		}
		return args[index];
	}

	static long parseSeed(String seed){
		try {
			return Long.parseLong(seed);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid seed " + seed + ", expected a number", e);
		}
	}

	private static void write(Path dir, String name, Automaton automaton, boolean render) throws IOException {
		File file = dir.resolve(name + ".dot").toFile();
		Files.write(file.toPath(), automaton.toGraphvizString().getBytes(StandardCharsets.UTF_8));
		System.out.println("Wrote " + file);
		if (render){
			File svg = dir.resolve(name + ".svg").toFile();
			GraphvizExporter.renderToFile(automaton, name, Format.SVG, svg);
			System.out.println("Wrote " + svg);
		}
	}
}
