package pipelining.dag;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pipelining.model.Network;

/**
 * Builds the scheduling DAG of a network.
 *
 * <p>Layers without filters are merged into the vertex of their last previous layer, so a vertex
 * holds one or more layers. Vertices are then ordered with {@link TopologicalSorter} and indexed
 * in that order, and the previous/next vertex sets are derived from the layer relations.
 */
public final class SchedulingDagBuilder {
  private static final Logger LOG = LoggerFactory.getLogger(SchedulingDagBuilder.class);

  private SchedulingDagBuilder() {}

  /**
   * @throws IllegalStateException if the network is not a DAG reachable from its input, or the
   *     merge bookkeeping is inconsistent
   */
  public static SchedulingDag build(Network network) {
    Objects.requireNonNull(network, "network");

    List<List<String>> merged = mergeLayers(network);
    List<List<String>> ordered = TopologicalSorter.sort(network, merged);

    Map<String, Integer> vertexByLayer = new LinkedHashMap<>();
    for (int index = 0; index < ordered.size(); index++) {
      for (String layer : ordered.get(index)) {
        if (vertexByLayer.put(layer, index) != null) {
          throw new IllegalStateException("Layer " + layer + " assigned to two vertices");
        }
      }
    }

    Map<Integer, Set<Integer>> prevs = new LinkedHashMap<>();
    Map<Integer, Set<Integer>> nexts = new LinkedHashMap<>();
    for (int index = 0; index < ordered.size(); index++) {
      prevs.put(index, new HashSet<>());
      nexts.put(index, new HashSet<>());
    }

    for (String layer : network) {
      int vertex = vertexByLayer.get(layer);

      for (String prev : network.prevLayers(layer)) {
        int prevVertex =
            Network.INPUT_LAYER_KEY.equals(prev)
                ? SchedulingDag.INPUT_VERTEX
                : vertexByLayer.get(prev);
        if (prevVertex != vertex) {
          prevs.get(vertex).add(prevVertex);
        }
      }

      for (String next : network.nextLayers(layer)) {
        int nextVertex = vertexByLayer.get(next);
        if (nextVertex != vertex) {
          nexts.get(vertex).add(nextVertex);
        }
      }
    }

    Set<Integer> inputNexts = new HashSet<>();
    prevs.forEach(
        (vertex, vertexPrevs) -> {
          if (vertexPrevs.contains(SchedulingDag.INPUT_VERTEX)) {
            inputNexts.add(vertex);
          }
        });
    nexts.put(SchedulingDag.INPUT_VERTEX, inputNexts);

    LOG.debug(
        "Scheduling DAG of {}: {} layers in {} vertices",
        network.name(),
        network.size(),
        ordered.size());
    return new SchedulingDag(ordered, vertexByLayer, prevs, nexts);
  }

  /**
   * Assigns every layer to a vertex, in network order. A mergeable layer joins the most recent
   * vertex whose last layer feeds it, provided none of the vertex's earlier layers feeds it (their
   * output is no longer on hand) and the last layer has no other consumer (its output is
   * overwritten in place).
   */
  static List<List<String>> mergeLayers(Network network) {
    List<List<String>> vertices = new ArrayList<>();

    for (String layer : network) {
      if (!network.layer(layer).mergeable()) {
        vertices.add(newVertex(layer));
        continue;
      }

      Set<String> prevLayers = new HashSet<>(network.prevLayers(layer));
      if (prevLayers.isEmpty()) {
        throw new IllegalStateException("Mergeable layer " + layer + " has no predecessor");
      }

      int target = -1;
      for (int index = vertices.size() - 1; index >= 0; index--) {
        List<String> vertex = vertices.get(index);
        List<String> head = vertex.subList(0, vertex.size() - 1);
        String tail = vertex.get(vertex.size() - 1);
        if (disjoint(prevLayers, head)
            && prevLayers.contains(tail)
            && network.nextLayers(tail).size() == 1) {
          target = index;
          break;
        }
      }

      if (target >= 0) {
        LOG.trace("Merging layer {} into vertex {}", layer, vertices.get(target));
        vertices.get(target).add(layer);
      } else {
        vertices.add(newVertex(layer));
      }
    }

    int assigned = vertices.stream().mapToInt(List::size).sum();
    if (assigned != network.size()) {
      throw new IllegalStateException(
          "Merged " + assigned + " layers but the network has " + network.size());
    }
    return vertices;
  }

  private static List<String> newVertex(String layer) {
    List<String> vertex = new ArrayList<>();
    vertex.add(layer);
    return vertex;
  }

  private static boolean disjoint(Set<String> layers, List<String> others) {
    for (String other : others) {
      if (layers.contains(other)) {
        return false;
      }
    }
    return true;
  }
}
