package org.dhuo.anomalytrend;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Settings for one pipeline run, read from Hadoop {@link Configuration} XML: the bundled
 * {@code anomaly-trend-default.xml}, then an optional site file, then explicit overrides.
 * Values are copied into plain fields so the object can travel inside Spark closures.
 */
public class PipelineConfig implements Serializable {
  public static final String DEFAULT_RESOURCE = "anomaly-trend-default.xml";
  public static final String PREFIX = "anomalytrend.";

  public final String datasetId;
  public final String bandName;
  public final SpectralIndex index;
  public final AggregationOp aggregationOp;
  public final SeasonalWindow window;
  public final int baselineStart;
  public final int baselineEnd;
  public final List<Integer> targetYears;
  public final List<Integer> trendYears;
  public final double unitScale;
  public final double fallbackValue;
  public final double noDataSentinel;
  public final double exportScale;
  public final RegionReducer regionReducer;
  public final double regionScale;
  public final int tileFactor;
  public final List<String> regionNameProperties;
  public final int parallelism;

  private PipelineConfig(Configuration conf) {
    datasetId = required(conf, "dataset.id");
    bandName = required(conf, "band");
    index = SpectralIndex.parse(conf.getTrimmed(PREFIX + "index", "none"));
    aggregationOp = AggregationOp.parse(required(conf, "aggregation.op"));
    window = SeasonalWindow.parse(required(conf, "season.start"), required(conf, "season.end"));
    baselineStart = conf.getInt(PREFIX + "baseline.start", 0);
    baselineEnd = conf.getInt(PREFIX + "baseline.end", -1);
    targetYears = years(conf, "target.years");
    List<Integer> trend = years(conf, "trend.years");
    trendYears = trend.isEmpty() ? defaultTrendYears() : trend;
    unitScale = conf.getDouble(PREFIX + "unit.scale", 1.0);
    fallbackValue = conf.getDouble(PREFIX + "fallback.value", 0.0);
    noDataSentinel = conf.getDouble(PREFIX + "nodata.sentinel", -9999);
    exportScale = conf.getDouble(PREFIX + "export.scale", 30);
    regionReducer = RegionReducer.parse(conf.getTrimmed(PREFIX + "region.reducer", "mean"));
    regionScale = conf.getDouble(PREFIX + "region.scale", 30);
    tileFactor = conf.getInt(PREFIX + "region.tile.factor", 4);
    regionNameProperties = Collections.unmodifiableList(new ArrayList<String>(
        Arrays.asList(conf.getTrimmedStrings(PREFIX + "region.name.properties"))));
    parallelism = conf.getInt(PREFIX + "parallelism", 4);
    validate();
  }

  public static PipelineConfig fromConfiguration(Configuration conf) {
    return new PipelineConfig(conf);
  }

  /**
   * Loads the defaults, then {@code sitePath} if non-null (local path or Hadoop URI), then each
   * {@code key=value} override; override keys may omit the {@code anomalytrend.} prefix.
   */
  public static PipelineConfig load(String sitePath, String... overrides) {
    Configuration conf = new Configuration(false);
    conf.addResource(DEFAULT_RESOURCE);
    if (sitePath != null) {
      conf.addResource(new Path(sitePath));
    }
    for (String override : overrides) {
      int eq = override.indexOf('=');
      if (eq <= 0) {
        throw new IllegalArgumentException("Override must be key=value: " + override);
      }
      String key = override.substring(0, eq).trim();
      conf.set(key.startsWith(PREFIX) ? key : PREFIX + key, override.substring(eq + 1).trim());
    }
    return fromConfiguration(conf);
  }

  public List<Integer> baselineYears() {
    List<Integer> ret = new ArrayList<Integer>();
    for (int year = baselineStart; year <= baselineEnd; ++year) {
      ret.add(year);
    }
    return ret;
  }

  /** Every year any stage needs a composite for, ascending. */
  public List<Integer> allYears() {
    TreeSet<Integer> years = new TreeSet<Integer>(baselineYears());
    years.addAll(targetYears);
    years.addAll(trendYears);
    return new ArrayList<Integer>(years);
  }

  private List<Integer> defaultTrendYears() {
    TreeSet<Integer> years = new TreeSet<Integer>(baselineYears());
    years.addAll(targetYears);
    return new ArrayList<Integer>(years);
  }

  private void validate() {
    if (baselineStart > baselineEnd) {
      throw new IllegalArgumentException(
          "Baseline starts " + baselineStart + " after it ends " + baselineEnd);
    }
    if (targetYears.isEmpty()) {
      throw new IllegalArgumentException("No target years configured");
    }
    if (Double.isNaN(unitScale) || Double.isInfinite(unitScale)) {
      throw new IllegalArgumentException("unit.scale must be finite, got " + unitScale);
    }
    if (!(exportScale > 0) || !(regionScale > 0)) {
      throw new IllegalArgumentException("export.scale and region.scale must be positive");
    }
    if (tileFactor < 1 || parallelism < 1) {
      throw new IllegalArgumentException("region.tile.factor and parallelism must be >= 1");
    }
    if (index != SpectralIndex.NONE && !index.bandName.equals(bandName)) {
      throw new IllegalArgumentException(
          "Index " + index + " produces band " + index.bandName + ", not " + bandName);
    }
  }

  private static String required(Configuration conf, String key) {
    String value = conf.getTrimmed(PREFIX + key);
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException("Missing configuration " + PREFIX + key);
    }
    return value;
  }

  /** Comma-separated years, where {@code a-b} stands for every year from a to b. */
  private static List<Integer> years(Configuration conf, String key) {
    List<Integer> ret = new ArrayList<Integer>();
    for (String token : conf.getTrimmedStrings(PREFIX + key)) {
      if (token.isEmpty()) continue;
      try {
        int dash = token.indexOf('-', 1);
        if (dash > 0) {
          int first = Integer.parseInt(token.substring(0, dash).trim());
          int last = Integer.parseInt(token.substring(dash + 1).trim());
          for (int year = first; year <= last; ++year) {
            ret.add(year);
          }
        } else {
          ret.add(Integer.parseInt(token));
        }
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Bad year '" + token + "' in " + PREFIX + key, e);
      }
    }
    return Collections.unmodifiableList(new ArrayList<Integer>(new TreeSet<Integer>(ret)));
  }

  /** Source for the configured dataset, deriving the index band when one is configured. */
  public RasterTimeSeriesSource wrapSource(RasterTimeSeriesSource source) {
    return index == SpectralIndex.NONE ? source : new IndexedFrameSource(source, index);
  }

  @Override
  public String toString() {
    return "PipelineConfig[dataset=" + datasetId + " band=" + bandName + " op=" + aggregationOp
        + " window=" + window + " baseline=" + baselineStart + "-" + baselineEnd
        + " targets=" + targetYears + " trend=" + trendYears + "]";
  }
}
