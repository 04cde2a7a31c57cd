package pipelining.pipeline;

import java.util.Objects;
import pipelining.model.Network;
import pipelining.model.Resource;

/** Everything a segment validator sees besides the stages themselves. */
public record SegmentContext(
    Network network, int batchSize, Resource resource, double maxUtilDrop) {

  public SegmentContext {
    Objects.requireNonNull(network, "network");
    Objects.requireNonNull(resource, "resource");
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
    }
    if (!(maxUtilDrop >= 0 && maxUtilDrop <= 1)) {
      throw new IllegalArgumentException(
          "maxUtilDrop must be between [0, 1], got " + maxUtilDrop);
    }
  }
}
