package fla.automata;

import java.io.File;
import java.io.IOException;
import java.util.*;

import guru.nidi.graphviz.attribute.Label;
import guru.nidi.graphviz.attribute.Rank;
import guru.nidi.graphviz.attribute.Shape;
import guru.nidi.graphviz.engine.Engine;
import guru.nidi.graphviz.engine.Format;
import guru.nidi.graphviz.engine.Graphviz;
import guru.nidi.graphviz.model.MutableGraph;
import guru.nidi.graphviz.model.MutableNode;

import fla.util.Utils;

import static guru.nidi.graphviz.model.Factory.*;

/**
 * Creates Graphviz graphs of automata: accepting states are double circles, an arrow from an
 * unlabeled point marks the start state and all symbols leading from one state to another share
 * an edge.
 */
public class GraphvizExporter {

	public static MutableGraph toGraph(Automaton automaton, String name){
		MutableGraph graph = mutGraph(name).setDirected(true);
		graph.graphAttrs().add(Rank.dir(Rank.RankDir.LEFT_TO_RIGHT));
		Map<String, MutableNode> nodes = new TreeMap<>();
		for (String state : automaton.getStates()){
			MutableNode node = mutNode(state);
			node.add(automaton.getAcceptingStates().contains(state) ? Shape.DOUBLE_CIRCLE : Shape.CIRCLE);
			nodes.put(state, node);
		}
		MutableNode startNode = mutNode(Utils.freshName("start", automaton.getStates()));
		startNode.add(Shape.POINT);
		startNode.addLink(to(nodes.get(automaton.getStart())));
		for (Map.Entry<String, Map<String, Set<String>>> row : automaton.getTransitions().entrySet()){
			Map<String, List<String>> transitionLabels = new TreeMap<>();
			for (Map.Entry<String, Set<String>> entry : row.getValue().entrySet()){
				for (String target : entry.getValue()){
					transitionLabels.computeIfAbsent(target, t -> new ArrayList<>()).add(entry.getKey());
				}
			}
			MutableNode from = nodes.get(row.getKey());
			for (Map.Entry<String, List<String>> label : transitionLabels.entrySet()){
				from.addLink(to(nodes.get(label.getKey())).with(Label.of(Utils.join(label.getValue(), ", "))));
			}
		}
		graph.add(startNode);
		for (MutableNode node : nodes.values()){
			graph.add(node);
		}
		return graph;
	}

	/**
	 * @return the graph in the dot language
	 */
	public static String toDotString(Automaton automaton){
		return toGraph(automaton, "automaton").toString();
	}

	/**
	 * Renders the automaton with the dot engine, requires a Graphviz installation.
	 */
	public static void renderToFile(Automaton automaton, String name, Format format, File file) throws IOException {
		Graphviz.fromGraph(toGraph(automaton, name)).engine(Engine.DOT).render(format).toFile(file);
	}
}
