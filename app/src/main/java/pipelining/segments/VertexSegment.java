package pipelining.segments;

import java.util.List;
import java.util.Objects;

/** Candidate pipelining group: strictly increasing indices of scheduling DAG vertices. */
public record VertexSegment(List<Integer> vertices) {

  public VertexSegment {
    Objects.requireNonNull(vertices, "vertices");
    vertices = List.copyOf(vertices);
    if (vertices.isEmpty()) {
      throw new IllegalArgumentException("A vertex segment needs at least one vertex");
    }
    for (int i = 1; i < vertices.size(); i++) {
      if (vertices.get(i) <= vertices.get(i - 1)) {
        throw new IllegalArgumentException("Vertex indices must increase: " + vertices);
      }
    }
  }

  public static VertexSegment of(Integer... vertices) {
    return new VertexSegment(List.of(vertices));
  }

  public int size() {
    return vertices.size();
  }

  public int first() {
    return vertices.get(0);
  }

  public int last() {
    return vertices.get(vertices.size() - 1);
  }

  public boolean contains(int vertex) {
    return vertices.contains(vertex);
  }

  @Override
  public String toString() {
    return vertices.toString();
  }
}
