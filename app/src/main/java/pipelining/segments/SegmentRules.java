package pipelining.segments;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import pipelining.dag.SchedulingDag;

/**
 * Structural rules deciding which vertices may be pipelined together.
 *
 * <ol>
 *   <li>Shared dependency: a vertex joins a non-empty segment only if one of its previous vertices
 *       is in the segment or is a previous vertex of a segment member. Otherwise co-locating them
 *       brings no benefit.
 *   <li>Single producer: a vertex with several previous vertices cannot join a segment holding any
 *       of them, since the producers' output would not be available at matching times.
 *   <li>All-or-nothing consumers: a member's next vertices are either all in the segment or none
 *       is. Holding only some of them cannot save the write-back to memory.
 * </ol>
 */
public final class SegmentRules {
  private final SchedulingDag dag;

  public SegmentRules(SchedulingDag dag) {
    this.dag = Objects.requireNonNull(dag, "dag");
  }

  /** Rule 1. */
  public boolean sharesDependency(List<Integer> segment, int frontier) {
    if (segment.isEmpty()) {
      return true;
    }
    Set<Integer> related = new HashSet<>(segment);
    for (Integer member : segment) {
      related.addAll(dag.predecessors(member));
    }
    return intersects(dag.predecessors(frontier), related);
  }

  /** Rule 2: true when the frontier has several producers and one of them is in the segment. */
  public boolean couplesPredecessors(List<Integer> segment, int frontier) {
    Set<Integer> frontierPrevs = dag.predecessors(frontier);
    return frontierPrevs.size() > 1 && intersects(frontierPrevs, segment);
  }

  /** Rules 1 and 2 together: whether {@code frontier} may extend {@code segment}. */
  public boolean canExtend(List<Integer> segment, int frontier) {
    return sharesDependency(segment, frontier) && !couplesPredecessors(segment, frontier);
  }

  /**
   * Rule 3 for a segment whose last member is {@code frontier}.
   *
   * @return true if every member has all or none of its next vertices inside the segment
   * @throws IllegalStateException if a missing next vertex does not come after the frontier, which
   *     the topological order rules out
   */
  public boolean consumersClosed(List<Integer> segment, int frontier) {
    Set<Integer> members = new HashSet<>(segment);
    for (Integer member : segment) {
      int missing = missingConsumer(members, member);
      if (missing < 0) {
        continue;
      }
      if (missing <= frontier) {
        throw new IllegalStateException(
            "Vertex " + member + " misses next vertex " + missing + " before frontier " + frontier);
      }
      return false;
    }
    return true;
  }

  /** Checks a finished segment against all three rules. */
  public boolean isValid(VertexSegment segment) {
    List<Integer> vertices = segment.vertices();
    for (int i = 1; i < vertices.size(); i++) {
      if (!canExtend(vertices.subList(0, i), vertices.get(i))) {
        return false;
      }
    }
    Set<Integer> members = new HashSet<>(vertices);
    for (Integer member : vertices) {
      if (missingConsumer(members, member) >= 0) {
        return false;
      }
    }
    return true;
  }

  /** Smallest next vertex outside a partially covered consumer set, or -1 if rule 3 holds. */
  private int missingConsumer(Set<Integer> members, int member) {
    Set<Integer> nexts = dag.successors(member);
    int inside = 0;
    int missing = Integer.MAX_VALUE;
    for (Integer next : nexts) {
      if (members.contains(next)) {
        inside++;
      } else {
        missing = Math.min(missing, next);
      }
    }
    return inside > 0 && inside < nexts.size() ? missing : -1;
  }

  private static boolean intersects(Set<Integer> set, Collection<Integer> other) {
    for (Integer value : other) {
      if (set.contains(value)) {
        return true;
      }
    }
    return false;
  }
}
