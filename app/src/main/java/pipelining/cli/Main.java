package pipelining.cli;

import java.io.IOException;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entrypoint.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code segments --network net.json [--batch N] [--nodes N] [--max-util-drop X]
 *       [--options partition_interlayer,hw_gbuf_save_writeback] [--out report.json]}
 *   <li>{@code order --network net.json}
 * </ul>
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String[] args) {
    if (args == null || args.length == 0) {
      LOG.error("Missing command, expected one of: segments, order");
      return 2;
    }
    try {
      return switch (args[0].toLowerCase(Locale.ROOT)) {
        case "segments" -> new SegmentsCommand().execute(args);
        case "order" -> new OrderCommand().execute(args);
        default -> {
          LOG.error("Unknown command: {}", args[0]);
          yield 2;
        }
      };
    } catch (IllegalArgumentException ex) {
      LOG.error("Invalid arguments: {}", ex.getMessage());
      return 2;
    } catch (IllegalStateException ex) {
      LOG.error("Malformed network: {}", ex.getMessage());
      return 1;
    } catch (IOException ex) {
      LOG.error("I/O failure: {}", ex.getMessage(), ex);
      return 1;
    }
  }
}
