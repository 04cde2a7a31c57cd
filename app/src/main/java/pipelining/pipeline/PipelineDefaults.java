package pipelining.pipeline;

/** Shared defaults for the inter-layer pipeline. */
public final class PipelineDefaults {
  public static final double MAX_UTIL_DROP = 0.05;
  public static final int BATCH_SIZE = 1;

  private PipelineDefaults() {}
}
