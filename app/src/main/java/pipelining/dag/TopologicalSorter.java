package pipelining.dag;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import pipelining.model.Network;

/**
 * Orders merged vertices by depth-first search. The reversed postorder is a topological order.
 *
 * <p>Roots are the vertices holding the network's first layers and successors are explored in
 * reverse discovery order, so that reversing the postorder brings back the declaration order
 * wherever the graph leaves a choice.
 *
 * <p>See https://en.wikipedia.org/wiki/Topological_sorting#Depth-first_search
 */
final class TopologicalSorter {
  private enum Mark {
    UNSEEN,
    IN_PROGRESS,
    DONE
  }

  private final Network network;
  private final List<List<String>> vertices;
  private final Map<String, Integer> vertexByLayer = new HashMap<>();
  private final Mark[] marks;
  private final List<Integer> postorder = new ArrayList<>();

  private TopologicalSorter(Network network, List<List<String>> vertices) {
    this.network = network;
    this.vertices = vertices;
    this.marks = new Mark[vertices.size()];
    for (int index = 0; index < vertices.size(); index++) {
      marks[index] = Mark.UNSEEN;
      for (String layer : vertices.get(index)) {
        vertexByLayer.put(layer, index);
      }
    }
  }

  /**
   * Returns the vertices in topological order.
   *
   * @throws IllegalStateException if the layer graph has a cycle or a layer not reachable from
   *     the network input
   */
  static List<List<String>> sort(Network network, List<List<String>> vertices) {
    Objects.requireNonNull(network, "network");
    Objects.requireNonNull(vertices, "vertices");
    return new TopologicalSorter(network, vertices).run();
  }

  private List<List<String>> run() {
    List<String> firsts = network.firstLayers();
    for (int i = firsts.size() - 1; i >= 0; i--) {
      int root = vertexIndex(firsts.get(i));
      if (marks[root] == Mark.UNSEEN) {
        visit(root);
      }
    }

    if (postorder.size() != vertices.size()) {
      List<String> unreached = new ArrayList<>();
      for (int index = 0; index < vertices.size(); index++) {
        if (marks[index] == Mark.UNSEEN) {
          unreached.addAll(vertices.get(index));
        }
      }
      throw new IllegalStateException(
          "Layers not reachable from the network input: " + unreached);
    }

    List<List<String>> ordered = new ArrayList<>(vertices.size());
    for (Integer index : postorder) {
      ordered.add(vertices.get(index));
    }
    Collections.reverse(ordered);
    return ordered;
  }

  /** Depth-first search from {@code root} on an explicit stack of frames. */
  private void visit(int root) {
    Deque<Frame> stack = new ArrayDeque<>();
    stack.push(enter(root));
    while (!stack.isEmpty()) {
      Frame frame = stack.peek();
      if (frame.cursor == frame.successors.size()) {
        stack.pop();
        marks[frame.vertex] = Mark.DONE;
        postorder.add(frame.vertex);
        continue;
      }

      int successor = frame.successors.get(frame.cursor++);
      if (marks[successor] == Mark.IN_PROGRESS) {
        throw new IllegalStateException(
            "Layer graph has a cycle through "
                + vertices.get(successor)
                + " and "
                + vertices.get(frame.vertex));
      }
      if (marks[successor] == Mark.UNSEEN) {
        stack.push(enter(successor));
      }
    }
  }

  private Frame enter(int vertex) {
    marks[vertex] = Mark.IN_PROGRESS;

    List<String> members = vertices.get(vertex);
    Set<String> nextLayers = new LinkedHashSet<>();
    for (String layer : members) {
      for (String next : network.nextLayers(layer)) {
        if (!members.contains(next)) {
          nextLayers.add(next);
        }
      }
    }

    List<Integer> successors = new ArrayList<>(nextLayers.size());
    for (String next : nextLayers) {
      successors.add(vertexIndex(next));
    }
    Collections.reverse(successors);
    return new Frame(vertex, successors);
  }

  /** A vertex being visited and the position of its next unvisited successor. */
  private static final class Frame {
    final int vertex;
    final List<Integer> successors;
    int cursor;

    Frame(int vertex, List<Integer> successors) {
      this.vertex = vertex;
      this.successors = successors;
    }
  }

  private int vertexIndex(String layer) {
    Integer index = vertexByLayer.get(layer);
    if (index == null) {
      throw new IllegalStateException("Layer " + layer + " is not assigned to any vertex");
    }
    return index;
  }
}
