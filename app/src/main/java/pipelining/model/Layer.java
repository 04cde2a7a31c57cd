package pipelining.model;

import java.util.Objects;

/** A single network layer. Only its type matters to the scheduling DAG. */
public record Layer(LayerType type) {

  public Layer {
    Objects.requireNonNull(type, "type");
  }

  public static Layer of(LayerType type) {
    return new Layer(type);
  }

  public boolean mergeable() {
    return type.mergeable();
  }
}
