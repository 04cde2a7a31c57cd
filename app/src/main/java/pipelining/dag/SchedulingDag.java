package pipelining.dag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Frozen scheduling DAG: merged layer vertices in topological order plus their adjacency.
 *
 * <p>Vertices are indexed {@code 0..V-1}. {@link #INPUT_VERTEX} is the sentinel for the network
 * input; it holds no layers, may appear in predecessor sets and has a successor set of its own.
 */
public final class SchedulingDag {
  public static final int INPUT_VERTEX = -1;

  private final List<List<String>> vertices;
  private final Map<String, Integer> vertexByLayer;
  private final Map<Integer, Set<Integer>> prevs;
  private final Map<Integer, Set<Integer>> nexts;

  SchedulingDag(
      List<List<String>> vertices,
      Map<String, Integer> vertexByLayer,
      Map<Integer, Set<Integer>> prevs,
      Map<Integer, Set<Integer>> nexts) {
    List<List<String>> frozenVertices = new ArrayList<>(vertices.size());
    for (List<String> vertex : vertices) {
      frozenVertices.add(List.copyOf(vertex));
    }
    this.vertices = List.copyOf(frozenVertices);
    this.vertexByLayer = Collections.unmodifiableMap(new LinkedHashMap<>(vertexByLayer));
    this.prevs = freeze(prevs);
    this.nexts = freeze(nexts);
  }

  private static Map<Integer, Set<Integer>> freeze(Map<Integer, Set<Integer>> adjacency) {
    Map<Integer, Set<Integer>> frozen = new LinkedHashMap<>();
    adjacency.forEach(
        (vertex, neighbours) ->
            frozen.put(vertex, Collections.unmodifiableSet(new TreeSet<>(neighbours))));
    return Collections.unmodifiableMap(frozen);
  }

  public int vertexCount() {
    return vertices.size();
  }

  /** Layer names merged into the vertex, in network order. */
  public List<String> vertex(int index) {
    Objects.checkIndex(index, vertices.size());
    return vertices.get(index);
  }

  public List<List<String>> vertices() {
    return vertices;
  }

  public int vertexOf(String layerName) {
    Integer index = vertexByLayer.get(layerName);
    if (index == null) {
      throw new IllegalArgumentException("Unknown layer: " + layerName);
    }
    return index;
  }

  public Set<Integer> predecessors(int index) {
    Objects.checkIndex(index, vertices.size());
    return prevs.get(index);
  }

  /** Successors of a vertex; also accepts {@link #INPUT_VERTEX}. */
  public Set<Integer> successors(int index) {
    Set<Integer> result = nexts.get(index);
    if (result == null) {
      throw new IndexOutOfBoundsException("No vertex " + index);
    }
    return result;
  }

  public List<String> orderedLayers() {
    List<String> layers = new ArrayList<>(vertexByLayer.size());
    for (List<String> vertex : vertices) {
      layers.addAll(vertex);
    }
    return layers;
  }

  @Override
  public String toString() {
    return "SchedulingDag" + vertices;
  }
}
