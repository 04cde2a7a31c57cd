package pipelining.pipeline;

/**
 * Switches controlling which candidates are built from each vertex segment.
 *
 * @param partitionInterlayer spatial pipelining: one stage per vertex, each on its own slice of
 *     the resource
 * @param hwGbufSaveWriteback temporal pipelining: all vertices in one stage, keeping intermediate
 *     data in the global buffer instead of writing it back
 */
public record PipelineOptions(boolean partitionInterlayer, boolean hwGbufSaveWriteback) {

  public static PipelineOptions defaults() {
    return new PipelineOptions(true, true);
  }

  public static PipelineOptions none() {
    return new PipelineOptions(false, false);
  }

  public boolean pipelining() {
    return partitionInterlayer || hwGbufSaveWriteback;
  }
}
