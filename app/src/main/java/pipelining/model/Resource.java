package pipelining.model;

import java.util.Objects;

/**
 * Hardware budget handed through to the segment validator. The scheduling core never looks
 * inside it.
 */
public record Resource(String name, int processingNodes) {

  public Resource {
    Objects.requireNonNull(name, "name");
    if (processingNodes < 1) {
      throw new IllegalArgumentException(
          "processingNodes must be positive, got " + processingNodes);
    }
  }
}
