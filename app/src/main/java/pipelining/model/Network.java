package pipelining.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered collection of named layers together with their producer/consumer relations.
 *
 * <p>The reserved key {@link #INPUT_LAYER_KEY} stands for the external network input. A layer
 * declared without predecessors consumes the input. Predecessors may be declared after their
 * consumers, so a network is not guaranteed to be acyclic; the scheduling DAG rejects graphs that
 * are not.
 */
public final class Network implements Iterable<String> {
  public static final String INPUT_LAYER_KEY = "__INPUT__";

  private final String name;
  private final Map<String, Layer> layers;
  private final Map<String, List<String>> prevs;
  private final Map<String, List<String>> nexts;
  private final List<String> firstLayers;

  private Network(String name, Map<String, Layer> layers, Map<String, List<String>> prevs) {
    this.name = name;
    this.layers = Collections.unmodifiableMap(new LinkedHashMap<>(layers));
    this.prevs = Collections.unmodifiableMap(new LinkedHashMap<>(prevs));

    Map<String, List<String>> consumers = new LinkedHashMap<>();
    List<String> firsts = new ArrayList<>();
    for (String layerName : layers.keySet()) {
      consumers.put(layerName, new ArrayList<>());
    }
    for (Map.Entry<String, List<String>> entry : prevs.entrySet()) {
      for (String prev : entry.getValue()) {
        if (INPUT_LAYER_KEY.equals(prev)) {
          firsts.add(entry.getKey());
        } else {
          consumers.get(prev).add(entry.getKey());
        }
      }
    }
    Map<String, List<String>> frozen = new LinkedHashMap<>();
    consumers.forEach((layer, list) -> frozen.put(layer, List.copyOf(list)));
    this.nexts = Collections.unmodifiableMap(frozen);
    this.firstLayers = List.copyOf(firsts);
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String name() {
    return name;
  }

  public int size() {
    return layers.size();
  }

  public boolean contains(String layerName) {
    return layers.containsKey(layerName);
  }

  public List<String> layerNames() {
    return List.copyOf(layers.keySet());
  }

  public Layer layer(String layerName) {
    Layer layer = layers.get(layerName);
    if (layer == null) {
      throw new IllegalArgumentException("Unknown layer: " + layerName);
    }
    return layer;
  }

  /** Predecessors in declaration order; contains {@link #INPUT_LAYER_KEY} for input consumers. */
  public List<String> prevLayers(String layerName) {
    List<String> result = prevs.get(layerName);
    if (result == null) {
      throw new IllegalArgumentException("Unknown layer: " + layerName);
    }
    return result;
  }

  /** Consumers of the layer, in the order they were declared. */
  public List<String> nextLayers(String layerName) {
    List<String> result = nexts.get(layerName);
    if (result == null) {
      throw new IllegalArgumentException("Unknown layer: " + layerName);
    }
    return result;
  }

  /** Layers that read the external network input, in declaration order. */
  public List<String> firstLayers() {
    return firstLayers;
  }

  @Override
  public Iterator<String> iterator() {
    return layers.keySet().iterator();
  }

  @Override
  public String toString() {
    return "Network[" + name + ", " + layers.size() + " layers]";
  }

  /** Collects layers in declaration order and validates references on {@link #build()}. */
  public static final class Builder {
    private final String name;
    private final Map<String, Layer> layers = new LinkedHashMap<>();
    private final Map<String, List<String>> prevs = new LinkedHashMap<>();

    private Builder(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    public Builder addLayer(String layerName, LayerType type, String... prevLayers) {
      return addLayer(layerName, Layer.of(type), Arrays.asList(prevLayers));
    }

    public Builder addLayer(String layerName, Layer layer, List<String> prevLayers) {
      Objects.requireNonNull(layerName, "layerName");
      Objects.requireNonNull(layer, "layer");
      Objects.requireNonNull(prevLayers, "prevLayers");
      if (layerName.isBlank()) {
        throw new IllegalArgumentException("Layer name must not be blank");
      }
      if (INPUT_LAYER_KEY.equals(layerName)) {
        throw new IllegalArgumentException("Layer name is reserved: " + layerName);
      }
      if (layers.containsKey(layerName)) {
        throw new IllegalArgumentException("Duplicate layer: " + layerName);
      }
      Set<String> distinct = new LinkedHashSet<>();
      for (String prev : prevLayers) {
        if (prev == null) {
          throw new IllegalArgumentException("Layer " + layerName + " has a null predecessor");
        }
        distinct.add(prev);
      }
      if (distinct.isEmpty()) {
        distinct.add(INPUT_LAYER_KEY);
      }
      layers.put(layerName, layer);
      prevs.put(layerName, List.copyOf(distinct));
      return this;
    }

    public Network build() {
      for (Map.Entry<String, List<String>> entry : prevs.entrySet()) {
        for (String prev : entry.getValue()) {
          if (!INPUT_LAYER_KEY.equals(prev) && !layers.containsKey(prev)) {
            throw new IllegalArgumentException(
                "Layer " + entry.getKey() + " refers to unknown predecessor " + prev);
          }
        }
      }
      return new Network(name, layers, prevs);
    }
  }
}
