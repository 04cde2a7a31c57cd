package pipelining.pipeline;

import java.util.List;

/** Accepts a segment when the resource offers at least one processing node per stage. */
public final class NodeBudgetSegmentFactory implements PipelineSegmentFactory {

  @Override
  public PipelineSegment create(List<List<String>> stages, SegmentContext context) {
    boolean fits = stages.size() <= context.resource().processingNodes();
    return new PipelineSegment(stages, context, fits);
  }
}
