package pipelining.io;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import pipelining.model.Layer;
import pipelining.model.LayerType;
import pipelining.model.Network;

/**
 * Reads a network description from JSON:
 *
 * <pre>{@code
 * {"name": "tiny",
 *  "layers": [
 *    {"name": "conv1", "type": "CONV"},
 *    {"name": "pool1", "type": "POOLING", "prevs": ["conv1"]}]}
 * }</pre>
 *
 * <p>A layer without {@code prevs} reads the network input.
 */
public final class NetworkLoader {
  private static final Gson GSON = new Gson();

  private NetworkLoader() {}

  public static Network load(Path path) throws IOException {
    if (!Files.exists(path)) {
      throw new IllegalArgumentException("Network file not found: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return read(reader, path.toString());
    }
  }

  public static Network parse(String json) {
    return read(new StringReader(json), "<string>");
  }

  private static Network read(Reader reader, String source) {
    NetworkSpec spec;
    try {
      spec = GSON.fromJson(reader, NetworkSpec.class);
    } catch (JsonParseException ex) {
      throw new IllegalArgumentException("Malformed network description in " + source, ex);
    }
    if (spec == null || spec.layers() == null) {
      throw new IllegalArgumentException("No layers in network description " + source);
    }

    String name = spec.name() == null || spec.name().isBlank() ? source : spec.name();
    Network.Builder builder = Network.builder(name);
    for (LayerSpec layer : spec.layers()) {
      if (layer == null) {
        throw new IllegalArgumentException("Null layer entry in " + source);
      }
      if (layer.name() == null) {
        throw new IllegalArgumentException("Unnamed layer in " + source);
      }
      List<String> prevs = layer.prevs() == null ? List.of() : layer.prevs();
      builder.addLayer(layer.name(), Layer.of(parseType(layer)), prevs);
    }
    return builder.build();
  }

  private static LayerType parseType(LayerSpec layer) {
    if (layer.type() == null) {
      throw new IllegalArgumentException("Layer " + layer.name() + " has no type");
    }
    try {
      return LayerType.valueOf(layer.type().trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "Unknown type " + layer.type() + " for layer " + layer.name(), ex);
    }
  }

  private record NetworkSpec(String name, List<LayerSpec> layers) {}

  private record LayerSpec(String name, String type, List<String> prevs) {}
}
