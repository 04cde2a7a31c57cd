package pipelining.pipeline;

import java.util.List;

/**
 * Builds a pipeline segment and decides whether it fits the resource. Rejection is an ordinary
 * outcome, reported through {@link PipelineSegment#valid()}.
 */
@FunctionalInterface
public interface PipelineSegmentFactory {
  PipelineSegment create(List<List<String>> stages, SegmentContext context);
}
