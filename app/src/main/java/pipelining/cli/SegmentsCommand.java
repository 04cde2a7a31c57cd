package pipelining.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pipelining.io.NetworkLoader;
import pipelining.model.Network;
import pipelining.model.Resource;
import pipelining.pipeline.InterLayerPipeline;
import pipelining.pipeline.PipelineSegment;

/** Handles the `segments` command: enumerates and reports the accepted pipeline segments. */
final class SegmentsCommand {
  private static final Logger LOG = LoggerFactory.getLogger(SegmentsCommand.class);

  int execute(String[] args) throws IOException {
    CliOptions options = parseArgs(args);
    Network network = NetworkLoader.load(options.networkFile());
    Resource resource = new Resource("cli", options.processingNodes());

    long start = System.nanoTime();
    InterLayerPipeline pipeline =
        new InterLayerPipeline(
            network, options.batchSize(), resource, options.maxUtilDrop());
    List<PipelineSegment> segments = pipeline.segments(options.pipelineOptions());
    long elapsedMillis = (System.nanoTime() - start) / 1_000_000L;

    LOG.info(
        "{}: {} layers, {} vertices, {} segments in {} ms",
        network.name(),
        network.size(),
        pipeline.schedulingDag().vertexCount(),
        segments.size(),
        elapsedMillis);

    String report =
        new JsonReportBuilder()
            .build(pipeline, options.pipelineOptions(), segments, elapsedMillis);
    if (options.hasOutputFile()) {
      Path output = options.outputFile();
      Files.writeString(output, report, StandardCharsets.UTF_8);
      LOG.info("Report written to {}", output.toAbsolutePath());
    } else {
      System.out.println(report);
    }
    return 0;
  }

  CliOptions parseArgs(String[] args) {
    CliOptions.Builder builder = CliOptions.builder();
    Map<String, BiConsumer<CliOptions.Builder, String>> specs = optionSpecs();

    for (int i = 1; i < args.length; i++) {
      String option = args[i];
      String value = null;
      int equalsIndex = option.indexOf('=');
      if (option.startsWith("--") && equalsIndex > 0) {
        value = option.substring(equalsIndex + 1);
        option = option.substring(0, equalsIndex);
      }
      BiConsumer<CliOptions.Builder, String> spec = specs.get(option);
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + args[i]);
      }
      if (value == null) {
        if (i + 1 >= args.length) {
          throw new IllegalArgumentException("Missing value for " + option);
        }
        value = args[++i];
      }
      spec.accept(builder, value);
    }
    return builder.build();
  }

  private Map<String, BiConsumer<CliOptions.Builder, String>> optionSpecs() {
    Map<String, BiConsumer<CliOptions.Builder, String>> specs = new LinkedHashMap<>();
    specs.put("--network", (b, raw) -> b.networkFile(Path.of(raw)));
    specs.put("--batch", (b, raw) -> b.batchSize(CliParsers.parseInt(raw, "--batch")));
    specs.put("--nodes", (b, raw) -> b.processingNodes(CliParsers.parseInt(raw, "--nodes")));
    specs.put(
        "--max-util-drop",
        (b, raw) -> b.maxUtilDrop(CliParsers.parseDouble(raw, "--max-util-drop")));
    specs.put("--options", (b, raw) -> b.pipelineOptions(CliParsers.parsePipelineOptions(raw)));
    specs.put("--out", (b, raw) -> b.outputFile(Path.of(raw)));
    return specs;
  }
}
