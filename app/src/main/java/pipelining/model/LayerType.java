package pipelining.model;

/** Kinds of network layers, tagged with whether they own filter weights. */
public enum LayerType {
  CONV(true),
  FC(true),
  POOLING(false),
  ELTWISE(false),
  LOCAL_REGION(false);

  private final boolean filtered;

  LayerType(boolean filtered) {
    this.filtered = filtered;
  }

  /** Filtered layers own weights and always start their own scheduling vertex. */
  public boolean filtered() {
    return filtered;
  }

  public boolean mergeable() {
    return !filtered;
  }
}
