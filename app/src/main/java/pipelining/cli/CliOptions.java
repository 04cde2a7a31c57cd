package pipelining.cli;

import java.nio.file.Path;
import java.util.Objects;
import pipelining.pipeline.PipelineDefaults;
import pipelining.pipeline.PipelineOptions;

record CliOptions(
    Path networkFile,
    int batchSize,
    int processingNodes,
    double maxUtilDrop,
    PipelineOptions pipelineOptions,
    Path outputFile) {

  static final int DEFAULT_PROCESSING_NODES = 16;

  CliOptions {
    Objects.requireNonNull(networkFile, "--network is required");
    pipelineOptions = pipelineOptions == null ? PipelineOptions.defaults() : pipelineOptions;
    if (batchSize < 1) {
      throw new IllegalArgumentException("--batch must be at least 1");
    }
    if (processingNodes < 1) {
      throw new IllegalArgumentException("--nodes must be at least 1");
    }
    if (maxUtilDrop < 0 || maxUtilDrop > 1) {
      throw new IllegalArgumentException("--max-util-drop must be between 0 and 1");
    }
  }

  boolean hasOutputFile() {
    return outputFile != null;
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private Path networkFile;
    private int batchSize = PipelineDefaults.BATCH_SIZE;
    private int processingNodes = DEFAULT_PROCESSING_NODES;
    private double maxUtilDrop = PipelineDefaults.MAX_UTIL_DROP;
    private PipelineOptions pipelineOptions = PipelineOptions.defaults();
    private Path outputFile;

    Builder networkFile(Path networkFile) {
      this.networkFile = networkFile;
      return this;
    }

    Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    Builder processingNodes(int processingNodes) {
      this.processingNodes = processingNodes;
      return this;
    }

    Builder maxUtilDrop(double maxUtilDrop) {
      this.maxUtilDrop = maxUtilDrop;
      return this;
    }

    Builder pipelineOptions(PipelineOptions pipelineOptions) {
      this.pipelineOptions = pipelineOptions;
      return this;
    }

    Builder outputFile(Path outputFile) {
      this.outputFile = outputFile;
      return this;
    }

    CliOptions build() {
      if (networkFile == null) {
        throw new IllegalArgumentException("Missing required option --network");
      }
      return new CliOptions(
          networkFile, batchSize, processingNodes, maxUtilDrop, pipelineOptions, outputFile);
    }
  }
}
