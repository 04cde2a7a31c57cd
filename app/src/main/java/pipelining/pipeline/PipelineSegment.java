package pipelining.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A pipeline segment candidate: stages of layer names, run concurrently on separate slices of the
 * resource, together with the validator's verdict.
 */
public record PipelineSegment(List<List<String>> stages, SegmentContext context, boolean valid) {

  public PipelineSegment {
    Objects.requireNonNull(stages, "stages");
    Objects.requireNonNull(context, "context");
    if (stages.isEmpty()) {
      throw new IllegalArgumentException("A segment needs at least one stage");
    }
    List<List<String>> copy = new ArrayList<>(stages.size());
    for (List<String> stage : stages) {
      if (stage.isEmpty()) {
        throw new IllegalArgumentException("Empty stage in segment " + stages);
      }
      copy.add(List.copyOf(stage));
    }
    stages = List.copyOf(copy);
  }

  public int stageCount() {
    return stages.size();
  }

  public List<String> layers() {
    List<String> layers = new ArrayList<>();
    stages.forEach(layers::addAll);
    return layers;
  }

  /** Whether this is the trivial segment holding a single layer. */
  public boolean singleLayer() {
    return stages.size() == 1 && stages.get(0).size() == 1;
  }

  @Override
  public String toString() {
    return "PipelineSegment" + stages + (valid ? "" : " (rejected)");
  }
}
