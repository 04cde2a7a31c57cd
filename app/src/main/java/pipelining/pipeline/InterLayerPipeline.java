package pipelining.pipeline;

import com.google.common.collect.Iterators;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pipelining.dag.SchedulingDag;
import pipelining.dag.SchedulingDagBuilder;
import pipelining.model.Network;
import pipelining.model.Resource;
import pipelining.segments.VertexSegment;
import pipelining.segments.VertexSegmentEnumerator;

/**
 * Inter-layer pipeline of a network on a resource.
 *
 * <p>Builds the scheduling DAG once and turns its vertex segments into pipeline segment
 * candidates on demand.
 */
public final class InterLayerPipeline {
  private static final Logger LOG = LoggerFactory.getLogger(InterLayerPipeline.class);

  private final SegmentContext context;
  private final PipelineSegmentFactory segmentFactory;
  private final SchedulingDag dag;
  private final VertexSegmentEnumerator enumerator;

  public InterLayerPipeline(Network network, int batchSize, Resource resource) {
    this(network, batchSize, resource, PipelineDefaults.MAX_UTIL_DROP);
  }

  public InterLayerPipeline(
      Network network, int batchSize, Resource resource, double maxUtilDrop) {
    this(network, batchSize, resource, maxUtilDrop, new NodeBudgetSegmentFactory());
  }

  /**
   * @throws IllegalArgumentException if {@code batchSize} is not positive or {@code maxUtilDrop}
   *     is outside [0, 1]
   * @throws IllegalStateException if the network is not a DAG rooted at its input
   */
  public InterLayerPipeline(
      Network network,
      int batchSize,
      Resource resource,
      double maxUtilDrop,
      PipelineSegmentFactory segmentFactory) {
    Objects.requireNonNull(network, "network");
    Objects.requireNonNull(resource, "resource");
    this.segmentFactory = Objects.requireNonNull(segmentFactory, "segmentFactory");
    this.context = new SegmentContext(network, batchSize, resource, maxUtilDrop);
    this.dag = SchedulingDagBuilder.build(network);
    this.enumerator = new VertexSegmentEnumerator(dag);
  }

  public Network network() {
    return context.network();
  }

  public SegmentContext context() {
    return context;
  }

  public SchedulingDag schedulingDag() {
    return dag;
  }

  /** Layers in the topological order of the scheduling DAG. */
  public List<String> orderedLayerList() {
    return dag.orderedLayers();
  }

  /**
   * Generates the valid inter-layer pipelining segments.
   *
   * <p>Every layer first comes alone, sequentially occupying the whole resource. Then each vertex
   * segment gives a spatial candidate (one stage per vertex) if {@code partitionInterlayer} is
   * set and a temporal candidate (a single stage) if {@code hwGbufSaveWriteback} is set.
   * Candidates already produced by this call are skipped, and only segments accepted by the
   * factory are returned. Each call is an independent, lazy traversal.
   *
   * @throws IllegalStateException while iterating, if a single-layer segment is rejected
   */
  public Iterator<PipelineSegment> generateSegments(PipelineOptions options) {
    Objects.requireNonNull(options, "options");

    Set<List<List<String>>> seen = new HashSet<>();
    Iterator<PipelineSegment> singles =
        Iterators.transform(
            context.network().iterator(),
            layer -> {
              List<List<String>> stages = List.of(List.of(layer));
              seen.add(stages);
              return singleLayerSegment(stages);
            });
    if (!options.pipelining()) {
      return singles;
    }

    Iterator<List<List<String>>> candidates =
        Iterators.concat(
            Iterators.transform(enumerator.enumerate(), vseg -> candidates(vseg, options)));
    Iterator<PipelineSegment> pipelined =
        Iterators.filter(
            Iterators.transform(Iterators.filter(candidates, seen::add), this::create),
            PipelineSegment::valid);
    return Iterators.concat(singles, pipelined);
  }

  /** Drains {@link #generateSegments(PipelineOptions)} into a list. */
  public List<PipelineSegment> segments(PipelineOptions options) {
    List<PipelineSegment> segments = new ArrayList<>();
    generateSegments(options).forEachRemaining(segments::add);
    LOG.debug("{}: {} segments accepted ({})", context.network().name(), segments.size(), options);
    return segments;
  }

  private PipelineSegment singleLayerSegment(List<List<String>> stages) {
    PipelineSegment segment = create(stages);
    if (!segment.valid()) {
      throw new IllegalStateException("Single-layer segment rejected: " + stages);
    }
    return segment;
  }

  private PipelineSegment create(List<List<String>> stages) {
    return segmentFactory.create(stages, context);
  }

  private Iterator<List<List<String>>> candidates(VertexSegment vseg, PipelineOptions options) {
    Set<List<List<String>>> result = new LinkedHashSet<>();

    if (options.partitionInterlayer()) {
      List<List<String>> spatial = new ArrayList<>(vseg.size());
      for (Integer vertex : vseg.vertices()) {
        spatial.add(dag.vertex(vertex));
      }
      result.add(List.copyOf(spatial));
    }

    if (options.hwGbufSaveWriteback()) {
      List<String> flattened = new ArrayList<>();
      for (Integer vertex : vseg.vertices()) {
        flattened.addAll(dag.vertex(vertex));
      }
      result.add(List.of(List.copyOf(flattened)));
    }

    return result.iterator();
  }
}
