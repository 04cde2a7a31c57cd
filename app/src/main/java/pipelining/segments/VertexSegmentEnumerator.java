package pipelining.segments;

import com.google.common.collect.AbstractIterator;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import pipelining.dag.SchedulingDag;

/**
 * Enumerates the vertex segments allowed by {@link SegmentRules} over a scheduling DAG.
 *
 * <p>A search starting at vertex {@code s} grows a segment with vertices {@code s, s+1, ...} (the
 * frontier) until rule 1 or 2 rejects the frontier. Every time the segment satisfies rule 3 it is
 * yielded and a nested search starts right after it, with the segment's vertices counted as
 * already scheduled. A start index whose search has finished is not searched again within the
 * same enumeration.
 *
 * <p>The nesting runs on an explicit stack. Segments come out in preorder: a segment is yielded
 * before any search it spawns.
 */
public final class VertexSegmentEnumerator {
  private final SchedulingDag dag;
  private final SegmentRules rules;

  public VertexSegmentEnumerator(SchedulingDag dag) {
    this.dag = Objects.requireNonNull(dag, "dag");
    this.rules = new SegmentRules(dag);
  }

  public SegmentRules rules() {
    return rules;
  }

  /** Starts an independent enumeration from vertex 0. */
  public Iterator<VertexSegment> enumerate() {
    return new SegmentIterator(new EnumerationContext(dag.vertexCount()));
  }

  public List<VertexSegment> enumerateAll() {
    List<VertexSegment> segments = new ArrayList<>();
    enumerate().forEachRemaining(segments::add);
    return segments;
  }

  /**
   * One pending search: its start index, the segment grown so far and the next frontier. Vertices
   * below the start are scheduled by the enclosing searches or by the network input.
   */
  private static final class Search {
    final int start;
    final List<Integer> segment = new ArrayList<>();
    int frontier;

    Search(int start) {
      this.start = start;
      this.frontier = start;
    }
  }

  private final class SegmentIterator extends AbstractIterator<VertexSegment> {
    private final EnumerationContext context;
    private final Deque<Search> stack = new ArrayDeque<>();

    SegmentIterator(EnumerationContext context) {
      this.context = context;
      if (dag.vertexCount() > 0) {
        stack.push(new Search(0));
      }
    }

    @Override
    protected VertexSegment computeNext() {
      while (!stack.isEmpty()) {
        Search search = stack.peek();
        if (search.frontier >= dag.vertexCount()) {
          finish();
          continue;
        }

        int frontier = search.frontier++;
        if (!rules.canExtend(search.segment, frontier)) {
          // Shorter segments of this search have been yielded already.
          finish();
          continue;
        }

        search.segment.add(frontier);
        if (!rules.consumersClosed(search.segment, frontier)) {
          continue;
        }

        VertexSegment found = new VertexSegment(search.segment);
        int next = frontier + 1;
        if (next < dag.vertexCount() && !context.isExplored(next)) {
          stack.push(new Search(next));
        }
        return found;
      }
      return endOfData();
    }

    private void finish() {
      context.markExplored(stack.pop().start);
    }
  }
}
