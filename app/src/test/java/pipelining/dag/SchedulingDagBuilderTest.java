package pipelining.dag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import pipelining.model.LayerType;
import pipelining.model.Network;
import pipelining.testing.TestNetworks;

final class SchedulingDagBuilderTest {

  @Test
  void mergesPoolingChainIntoItsProducer() {
    Network network =
        Network.builder("abf")
            .addLayer("a", LayerType.CONV)
            .addLayer("b", LayerType.POOLING, "a")
            .addLayer("f", LayerType.POOLING, "b")
            .build();

    SchedulingDag dag = SchedulingDagBuilder.build(network);

    assertEquals(List.of(List.of("a", "b", "f")), dag.vertices());
    assertEquals(Set.of(SchedulingDag.INPUT_VERTEX), dag.predecessors(0));
    assertEquals(Set.of(0), dag.successors(SchedulingDag.INPUT_VERTEX));
  }

  @Test
  void filteredLayersNeverMerge() {
    SchedulingDag dag = SchedulingDagBuilder.build(TestNetworks.chain());

    assertEquals(
        List.of(List.of("a"), List.of("b"), List.of("c"), List.of("d")), dag.vertices());
    assertEquals(Set.of(2), dag.predecessors(3));
    assertEquals(Set.of(), dag.successors(3));
  }

  @Test
  void doesNotMergeAfterLayerWithSeveralConsumers() {
    Network network =
        Network.builder("fork")
            .addLayer("a", LayerType.CONV)
            .addLayer("p", LayerType.POOLING, "a")
            .addLayer("q", LayerType.CONV, "a")
            .build();

    List<List<String>> merged = SchedulingDagBuilder.mergeLayers(network);

    assertEquals(List.of(List.of("a"), List.of("p"), List.of("q")), merged);
  }

  @Test
  void mergesIntoMostRecentEligibleVertex() {
    Network network =
        Network.builder("skip")
            .addLayer("a", LayerType.CONV)
            .addLayer("b", LayerType.CONV)
            .addLayer("p", LayerType.POOLING, "a")
            .build();

    SchedulingDag dag = SchedulingDagBuilder.build(network);

    assertEquals(List.of(List.of("a", "p"), List.of("b")), dag.vertices());
    assertEquals(0, dag.vertexOf("p"));
  }

  @Test
  void derivesVertexAdjacencyForResidualBlock() {
    SchedulingDag dag = SchedulingDagBuilder.build(TestNetworks.residual());

    assertEquals(
        List.of(
            List.of("conv1", "pool1"),
            List.of("conv2a"),
            List.of("conv2b", "res2"),
            List.of("fc")),
        dag.vertices());
    assertEquals(Set.of(0, 1), dag.predecessors(2), "Shortcut and main path both feed res2");
    assertEquals(Set.of(1, 2), dag.successors(0));
    assertEquals(Set.of(0), dag.successors(SchedulingDag.INPUT_VERTEX));
    assertEquals(
        List.of("conv1", "pool1", "conv2a", "conv2b", "res2", "fc"), dag.orderedLayers());
    for (int vertex = 0; vertex < dag.vertexCount(); vertex++) {
      assertFalse(dag.predecessors(vertex).contains(vertex), "No self loop at " + vertex);
      assertFalse(dag.successors(vertex).contains(vertex), "No self loop at " + vertex);
    }
  }

  @Test
  void rejectsCyclicNetwork() {
    Network network =
        Network.builder("cycle")
            .addLayer("a", LayerType.CONV)
            .addLayer("b", LayerType.CONV, "a", "c")
            .addLayer("c", LayerType.CONV, "b")
            .build();

    assertThrows(IllegalStateException.class, () -> SchedulingDagBuilder.build(network));
  }

  @Test
  void adjacencyIsFrozen() {
    SchedulingDag dag = SchedulingDagBuilder.build(TestNetworks.chain());

    assertThrows(UnsupportedOperationException.class, () -> dag.predecessors(1).add(3));
    assertThrows(UnsupportedOperationException.class, () -> dag.vertex(0).add("x"));
  }
}
