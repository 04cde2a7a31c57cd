package pipelining.segments;

import java.util.BitSet;

/**
 * Per-enumeration bookkeeping of the start indices whose search has completed. A fresh context is
 * created for every top-level enumeration.
 */
final class EnumerationContext {
  private final BitSet explored;

  EnumerationContext(int vertexCount) {
    this.explored = new BitSet(vertexCount);
  }

  boolean isExplored(int startIndex) {
    return explored.get(startIndex);
  }

  void markExplored(int startIndex) {
    if (explored.get(startIndex)) {
      throw new IllegalStateException("Start vertex " + startIndex + " explored twice");
    }
    explored.set(startIndex);
  }
}
