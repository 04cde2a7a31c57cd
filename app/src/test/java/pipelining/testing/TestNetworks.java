package pipelining.testing;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import pipelining.model.LayerType;
import pipelining.model.Network;

/** Small networks shared by the tests. */
public final class TestNetworks {
  private TestNetworks() {}

  /** a -> b -> c -> d, all convolutions. */
  public static Network chain() {
    return Network.builder("chain")
        .addLayer("a", LayerType.CONV)
        .addLayer("b", LayerType.CONV, "a")
        .addLayer("c", LayerType.CONV, "b")
        .addLayer("d", LayerType.CONV, "c")
        .build();
  }

  /** a feeds b and c, which both feed e. */
  public static Network diamond() {
    return Network.builder("diamond")
        .addLayer("a", LayerType.CONV)
        .addLayer("b", LayerType.CONV, "a")
        .addLayer("c", LayerType.CONV, "a")
        .addLayer("e", LayerType.CONV, "b", "c")
        .build();
  }

  /**
   * A residual block: pool1 merges into conv1's vertex and the shortcut sum res2 merges into
   * conv2b's vertex. Vertices in order: [conv1, pool1], [conv2a], [conv2b, res2], [fc].
   */
  public static Network residual() {
    return Network.builder("residual")
        .addLayer("conv1", LayerType.CONV)
        .addLayer("pool1", LayerType.POOLING, "conv1")
        .addLayer("conv2a", LayerType.CONV, "pool1")
        .addLayer("conv2b", LayerType.CONV, "conv2a")
        .addLayer("res2", LayerType.ELTWISE, "pool1", "conv2b")
        .addLayer("fc", LayerType.FC, "res2")
        .build();
  }

  /**
   * Random acyclic network whose layers only read earlier layers or the input, so every layer is
   * reachable.
   */
  public static Network random(Random random, int layerCount) {
    LayerType[] types = LayerType.values();
    Network.Builder builder = Network.builder("random-" + layerCount);
    List<String> declared = new ArrayList<>();
    for (int i = 0; i < layerCount; i++) {
      String name = "l" + i;
      List<String> prevs = new ArrayList<>();
      if (i > 0 && random.nextInt(8) != 0) {
        int fanIn = 1 + random.nextInt(Math.min(3, i));
        for (int k = 0; k < fanIn; k++) {
          String prev = declared.get(random.nextInt(i));
          if (!prevs.contains(prev)) {
            prevs.add(prev);
          }
        }
      }
      builder.addLayer(name, types[random.nextInt(types.length)], prevs.toArray(new String[0]));
      declared.add(name);
    }
    return builder.build();
  }
}
