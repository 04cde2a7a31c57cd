package pipelining.cli;

import com.google.common.base.Splitter;
import java.util.Locale;
import pipelining.pipeline.PipelineOptions;

/** Shared helpers for CLI argument parsing. */
final class CliParsers {
  static final String PARTITION_INTERLAYER = "partition_interlayer";
  static final String HW_GBUF_SAVE_WRITEBACK = "hw_gbuf_save_writeback";

  private CliParsers() {}

  static int parseInt(String raw, String optionName) {
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  static double parseDouble(String raw, String optionName) {
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid number for " + optionName + ": " + raw);
    }
  }

  /**
   * Parses a comma separated list of enabled pipelining flags. {@code none} or an empty value
   * disables pipelining.
   */
  static PipelineOptions parsePipelineOptions(String raw) {
    boolean partitionInterlayer = false;
    boolean hwGbufSaveWriteback = false;
    if (raw == null) {
      return PipelineOptions.none();
    }
    for (String flag : Splitter.on(',').trimResults().omitEmptyStrings().split(raw)) {
      switch (flag.toLowerCase(Locale.ROOT)) {
        case PARTITION_INTERLAYER -> partitionInterlayer = true;
        case HW_GBUF_SAVE_WRITEBACK -> hwGbufSaveWriteback = true;
        case "none" -> {
          // explicit "no pipelining"
        }
        default -> throw new IllegalArgumentException("Unknown pipelining option: " + flag);
      }
    }
    return new PipelineOptions(partitionInterlayer, hwGbufSaveWriteback);
  }
}
