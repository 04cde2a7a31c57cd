package pipelining.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pipelining.dag.SchedulingDag;
import pipelining.dag.SchedulingDagBuilder;
import pipelining.io.NetworkLoader;
import pipelining.model.Network;

/** Handles the `order` command: prints the scheduling vertices in topological order. */
final class OrderCommand {
  private static final Logger LOG = LoggerFactory.getLogger(OrderCommand.class);

  int execute(String[] args) throws IOException {
    if (args.length != 3 || !"--network".equals(args[1])) {
      throw new IllegalArgumentException("Usage: order --network <file.json>");
    }
    Network network = NetworkLoader.load(Path.of(args[2]));
    SchedulingDag dag = SchedulingDagBuilder.build(network);
    LOG.info("{}: {} layers in {} vertices", network.name(), network.size(), dag.vertexCount());

    List<List<String>> vertices = dag.vertices();
    for (int index = 0; index < vertices.size(); index++) {
      System.out.printf("%3d  %s  <- %s%n", index, vertices.get(index), dag.predecessors(index));
    }
    return 0;
  }
}
