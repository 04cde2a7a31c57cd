package pipelining.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import pipelining.dag.SchedulingDag;
import pipelining.pipeline.InterLayerPipeline;
import pipelining.pipeline.PipelineOptions;
import pipelining.pipeline.PipelineSegment;

final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

  String build(
      InterLayerPipeline pipeline,
      PipelineOptions options,
      List<PipelineSegment> segments,
      long elapsedMillis) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(pipeline, options, segments, elapsedMillis));
    root.put("ordered_layers", pipeline.orderedLayerList());
    root.put("vertices", vertices(pipeline.schedulingDag()));
    root.put("segments", segmentSummaries(segments));
    return gson.toJson(root);
  }

  private Map<String, Object> meta(
      InterLayerPipeline pipeline,
      PipelineOptions options,
      List<PipelineSegment> segments,
      long elapsedMillis) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("network", pipeline.network().name());
    meta.put("layer_count", pipeline.network().size());
    meta.put("vertex_count", pipeline.schedulingDag().vertexCount());
    meta.put("batch_size", pipeline.context().batchSize());
    meta.put("resource", pipeline.context().resource().name());
    meta.put("processing_nodes", pipeline.context().resource().processingNodes());
    meta.put("max_util_drop", pipeline.context().maxUtilDrop());
    meta.put(CliParsers.PARTITION_INTERLAYER, options.partitionInterlayer());
    meta.put(CliParsers.HW_GBUF_SAVE_WRITEBACK, options.hwGbufSaveWriteback());
    meta.put("segment_count", segments.size());
    meta.put("time_ms", elapsedMillis);
    return meta;
  }

  private List<Map<String, Object>> vertices(SchedulingDag dag) {
    List<Map<String, Object>> list = new ArrayList<>();
    for (int index = 0; index < dag.vertexCount(); index++) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("index", index);
      map.put("layers", dag.vertex(index));
      map.put("prevs", dag.predecessors(index));
      map.put("nexts", dag.successors(index));
      list.add(map);
    }
    return list;
  }

  private List<Map<String, Object>> segmentSummaries(List<PipelineSegment> segments) {
    List<Map<String, Object>> list = new ArrayList<>();
    for (PipelineSegment segment : segments) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("stages", segment.stages());
      map.put("stage_count", segment.stageCount());
      list.add(map);
    }
    return list;
  }
}
