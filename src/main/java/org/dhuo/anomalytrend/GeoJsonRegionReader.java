package org.dhuo.anomalytrend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads regions from a GeoJSON FeatureCollection of Polygon / MultiPolygon features. Coordinates
 * are taken as planar map units matching the rasters. A feature with a missing or unsupported
 * geometry still becomes a region, an unusable one, so it fails on its own when aggregated.
 */
public class GeoJsonRegionReader {
  private static final Logger LOG = LoggerFactory.getLogger(GeoJsonRegionReader.class);

  private final ObjectMapper mapper = new ObjectMapper();
  private final List<String> nameProperties;

  public GeoJsonRegionReader(List<String> nameProperties) {
    this.nameProperties = nameProperties;
  }

  public List<Region> read(String path) throws IOException {
    Path regionsPath = new Path(path);
    FileSystem fs = regionsPath.getFileSystem(new Configuration());
    InputStream in = fs.open(regionsPath);
    try {
      return read(in);
    } finally {
      in.close();
    }
  }

  public List<Region> read(InputStream in) throws IOException {
    JsonNode root = mapper.readTree(in);
    if (root == null || !"FeatureCollection".equals(root.path("type").asText())) {
      throw new IOException("Expected a GeoJSON FeatureCollection");
    }
    List<Region> ret = new ArrayList<Region>();
    Set<String> seenIds = new HashSet<String>();
    int index = 0;
    for (JsonNode feature : root.path("features")) {
      Map<String, Object> properties = new LinkedHashMap<String, Object>();
      Iterator<Map.Entry<String, JsonNode>> fields = feature.path("properties").fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        if (!field.getValue().isNull()) {
          properties.put(field.getKey(), field.getValue().asText());
        }
      }
      JsonNode idNode = feature.get("id");
      String featureId = idNode == null || idNode.isNull() ? null : idNode.asText();
      String id = RegionIdResolver.resolve(properties, featureId, index, nameProperties);
      if (!seenIds.add(id)) {
        String unique = id + "_" + index;
        LOG.warn("Region id {} appears more than once; feature {} becomes {}", id, index, unique);
        id = unique;
        seenIds.add(id);
      }
      ret.add(region(id, feature.path("geometry")));
      ++index;
    }
    LOG.info("Read {} regions", ret.size());
    return ret;
  }

  private static Region region(String id, JsonNode geometry) {
    List<List<double[][]>> polygons = new ArrayList<List<double[][]>>();
    String type = geometry.path("type").asText();
    if ("Polygon".equals(type)) {
      polygons.add(rings(geometry.path("coordinates")));
    } else if ("MultiPolygon".equals(type)) {
      for (JsonNode polygon : geometry.path("coordinates")) {
        polygons.add(rings(polygon));
      }
    } else {
      LOG.warn("Region {} has unsupported geometry type '{}'", id, type);
      return Region.unusable(id, "unsupported geometry type '" + type + "'");
    }
    return Region.fromPolygons(id, polygons);
  }

  private static List<double[][]> rings(JsonNode polygon) {
    List<double[][]> ret = new ArrayList<double[][]>();
    for (JsonNode ring : polygon) {
      ret.add(ring(ring));
    }
    return ret;
  }

  private static double[][] ring(JsonNode ring) {
    double[][] ret = new double[ring.size()][];
    for (int i = 0; i < ring.size(); ++i) {
      JsonNode position = ring.get(i);
      ret[i] = new double[] {position.path(0).asDouble(Double.NaN),
          position.path(1).asDouble(Double.NaN)};
    }
    return ret;
  }
}
