package org.dhuo.anomalytrend;

import org.apache.commons.math3.stat.descriptive.StatisticalSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;

/**
 * Wires the pipeline stages together for one configuration. Nothing is computed when the
 * pipeline is built: each yearly composite is materialized the first time a caller pulls
 * something that depends on it, exactly once even under concurrent pulls, and then shared
 * read-only by every anomaly, trend and regional statistic that needs it.
 */
public class AnomalyTrendPipeline {
  private static final Logger LOG = LoggerFactory.getLogger(AnomalyTrendPipeline.class);

  private final PipelineConfig config;
  private final RasterTimeSeriesSource source;
  private final StudyArea studyArea;
  private final SeasonalCompositor compositor;
  private final ConcurrentMap<Integer, FutureTask<CompositeImage>> composites =
      new ConcurrentHashMap<Integer, FutureTask<CompositeImage>>();

  /**
   * @param rawSource the dataset; wrapped to derive the configured index band, if any.
   * @param regions every region of the run; the valid ones form the study area.
   */
  public AnomalyTrendPipeline(PipelineConfig config, RasterTimeSeriesSource rawSource,
      List<Region> regions) throws IOException {
    this.config = config;
    this.source = config.wrapSource(rawSource);
    this.studyArea = StudyArea.ofValid(regions);
    this.compositor = new SeasonalCompositor(source.getGrid(), studyArea, config.fallbackValue);
  }

  public StudyArea getStudyArea() {
    return studyArea;
  }

  /**
   * The composite for {@code year}, computing it on first use.
   */
  public CompositeImage composite(final int year) throws SchemaMismatchException, IOException {
    FutureTask<CompositeImage> task = composites.get(year);
    if (task == null) {
      FutureTask<CompositeImage> created = new FutureTask<CompositeImage>(
          new Callable<CompositeImage>() {
            @Override
            public CompositeImage call() throws Exception {
              return compositor.compositeYear(
                  source, year, config.window, config.bandName, config.aggregationOp);
            }
          });
      task = composites.putIfAbsent(year, created);
      if (task == null) {
        task = created;
        task.run();
      }
    }
    try {
      return task.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while compositing " + year, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof SchemaMismatchException) throw (SchemaMismatchException) cause;
      if (cause instanceof IOException) throw (IOException) cause;
      if (cause instanceof RuntimeException) throw (RuntimeException) cause;
      throw new IOException("Compositing " + year + " failed", cause);
    }
  }

  public List<CompositeImage> composites(List<Integer> years)
      throws SchemaMismatchException, IOException {
    List<CompositeImage> ret = new ArrayList<CompositeImage>();
    for (Integer year : years) {
      ret.add(composite(year));
    }
    return ret;
  }

  /** Anomaly of {@code targetYear} against the configured baseline. */
  public AnomalyRaster anomaly(int targetYear) throws SchemaMismatchException, IOException {
    return BaselineAnomalyEngine.anomaly(
        composites(config.baselineYears()), composite(targetYear), config.unitScale);
  }

  /** Pixel-wise trend over the configured trend years. */
  public TrendRaster pixelTrend() throws SchemaMismatchException, IOException {
    return TrendEstimator.fitTrend(composites(config.trendYears));
  }

  /**
   * One (region, year) unit: the configured statistic of that year's composite over the region,
   * null for fallback years or regions without unmasked pixels.
   *
   * @throws InvalidGeometryException if the region polygon is unusable.
   */
  public RegionYearValue regionYearValue(Region region, int year)
      throws UnitFailureException, IOException {
    return regionYearValue(composite(year), region, config);
  }

  static RegionYearValue regionYearValue(CompositeImage composite, Footprint area, String id,
      PipelineConfig config) throws InvalidGeometryException {
    Double value = null;
    Double mean = null;
    if (composite.hasData()) {
      StatisticalSummary stats = RegionalAggregator.summarize(composite.raster, composite.band,
          area, config.regionScale, config.tileFactor);
      if (stats != null) {
        value = config.regionReducer.extract(stats);
        mean = RegionReducer.MEAN.extract(stats);
      }
    } else {
      // A fallback constant is not a measurement; the region still has to be valid.
      area.checkValid();
    }
    return new RegionYearValue(id, composite.year, value, mean, composite.presence);
  }

  static RegionYearValue regionYearValue(CompositeImage composite, Region region,
      PipelineConfig config) throws InvalidGeometryException {
    return regionYearValue(composite, region, region.id, config);
  }

  /** The configured statistic over the whole study area, per trend year. */
  public SortedMap<Integer, RegionYearValue> studyAreaSeries()
      throws UnitFailureException, IOException {
    SortedMap<Integer, RegionYearValue> ret = new TreeMap<Integer, RegionYearValue>();
    for (CompositeImage composite : composites(config.trendYears)) {
      ret.put(composite.year, regionYearValue(composite, studyArea, "study_area", config));
    }
    return ret;
  }

  /**
   * Groups unit values by region and fits one trend per region on the yearly area-weighted
   * means, whatever statistic was configured for the table. Every region present in
   * {@code values} gets a result, defined or not.
   */
  public static SortedMap<String, TrendResult> regionTrends(Map<UnitKey, RegionYearValue> values) {
    SortedMap<String, SortedMap<Integer, Double>> series =
        new TreeMap<String, SortedMap<Integer, Double>>();
    for (RegionYearValue value : values.values()) {
      SortedMap<Integer, Double> perRegion = series.get(value.regionId);
      if (perRegion == null) {
        perRegion = new TreeMap<Integer, Double>();
        series.put(value.regionId, perRegion);
      }
      perRegion.put(value.year, value.mean);
    }
    SortedMap<String, TrendResult> ret = new TreeMap<String, TrendResult>();
    for (Map.Entry<String, SortedMap<Integer, Double>> entry : series.entrySet()) {
      TrendResult trend = TrendEstimator.fitTrend(entry.getValue());
      if (!trend.isDefined()) {
        LOG.info("Trend for {} undefined with {} usable years", entry.getKey(), trend.pointsUsed);
      }
      ret.put(entry.getKey(), trend);
    }
    return ret;
  }
}
