package pipelining.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import pipelining.testing.TestNetworks;

final class NetworkTest {

  @Test
  void tracksPredecessorsAndConsumersInDeclarationOrder() {
    Network network = TestNetworks.residual();

    assertEquals(6, network.size());
    assertEquals(
        List.of("conv1", "pool1", "conv2a", "conv2b", "res2", "fc"), network.layerNames());
    assertEquals(List.of(Network.INPUT_LAYER_KEY), network.prevLayers("conv1"));
    assertEquals(List.of("pool1", "conv2b"), network.prevLayers("res2"));
    assertEquals(List.of("conv2a", "res2"), network.nextLayers("pool1"));
    assertEquals(List.of(), network.nextLayers("fc"), "Output layer has no consumer");
    assertEquals(List.of("conv1"), network.firstLayers());
  }

  @Test
  void layersWithoutPredecessorsReadTheInput() {
    Network network =
        Network.builder("two-inputs")
            .addLayer("x", LayerType.CONV)
            .addLayer("y", LayerType.CONV)
            .addLayer("z", LayerType.ELTWISE, "x", "y")
            .build();

    assertEquals(List.of("x", "y"), network.firstLayers());
    assertTrue(network.layer("z").mergeable());
    assertFalse(network.layer("x").mergeable());
  }

  @Test
  void allowsPredecessorsDeclaredLater() {
    Network network =
        Network.builder("forward")
            .addLayer("a", LayerType.CONV)
            .addLayer("b", LayerType.CONV, "c")
            .addLayer("c", LayerType.CONV, "a")
            .build();

    assertEquals(List.of("b"), network.nextLayers("c"));
  }

  @Test
  void rejectsMalformedDeclarations() {
    Network.Builder builder = Network.builder("bad").addLayer("a", LayerType.CONV);

    assertThrows(IllegalArgumentException.class, () -> builder.addLayer("a", LayerType.FC));
    assertThrows(
        IllegalArgumentException.class,
        () -> builder.addLayer(Network.INPUT_LAYER_KEY, LayerType.FC));
    assertThrows(
        IllegalArgumentException.class,
        () -> Network.builder("dangling").addLayer("a", LayerType.CONV, "missing").build());
    assertThrows(
        IllegalArgumentException.class, () -> builder.addLayer("b", LayerType.CONV, "a", null));
    assertThrows(IllegalArgumentException.class, () -> TestNetworks.chain().layer("zz"));
  }

  @Test
  void resourceNeedsAtLeastOneNode() {
    assertThrows(IllegalArgumentException.class, () -> new Resource("empty", 0));
    assertEquals(4, new Resource("r", 4).processingNodes());
  }
}
