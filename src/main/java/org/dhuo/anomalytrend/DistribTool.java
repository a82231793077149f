package org.dhuo.anomalytrend;

import org.apache.spark.SparkConf;
import org.apache.spark.api.java.JavaPairRDD;
import org.apache.spark.api.java.JavaRDD;
import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.api.java.function.Function;
import org.apache.spark.api.java.function.PairFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import scala.Tuple2;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Spark job which composites every configured year of a raster time series, reduces each
 * (region, trend year) pair to one statistic, and fits per-region and per-pixel trends.
 * Years are the first grain of work; the cartesian product of regions and composites is the
 * second.
 */
public class DistribTool {
  private static final Logger LOG = LoggerFactory.getLogger(DistribTool.class);

  public static PipelineResults run(JavaSparkContext sc, PipelineConfig config,
      RasterTimeSeriesSource rawSource, List<Region> regions, String outputDir) throws Exception {
    long start = System.nanoTime();
    final PipelineConfig conf = config;
    final RasterTimeSeriesSource source = config.wrapSource(rawSource);
    final StudyArea studyArea = StudyArea.ofValid(regions);
    final GridGeometry grid = source.getGrid();
    PipelineResults results = new PipelineResults();

    // One task per year, at most parallelism at a time.
    List<Integer> years = config.allYears();
    JavaPairRDD<Integer, UnitOutcome<CompositeImage>> compositesRdd = sc.parallelize(
        years, Math.min(config.parallelism, years.size())).mapToPair(
        new PairFunction<Integer, Integer, UnitOutcome<CompositeImage>>() {
      @Override
      public Tuple2<Integer, UnitOutcome<CompositeImage>> call(Integer year) throws Exception {
        SeasonalCompositor compositor =
            new SeasonalCompositor(grid, studyArea, conf.fallbackValue);
        try {
          CompositeImage composite = compositor.compositeYear(
              source, year, conf.window, conf.bandName, conf.aggregationOp);
          return new Tuple2<Integer, UnitOutcome<CompositeImage>>(
              year, UnitOutcome.ok(composite));
        } catch (SchemaMismatchException e) {
          return new Tuple2<Integer, UnitOutcome<CompositeImage>>(
              year, UnitOutcome.<CompositeImage>failed(e.getMessage()));
        }
      }
    });
    compositesRdd.cache();
    LOG.info("Composited {} years", compositesRdd.count());

    final HashSet<Integer> trendYears = new HashSet<Integer>(config.trendYears);
    JavaPairRDD<Integer, UnitOutcome<CompositeImage>> trendCompositesRdd = compositesRdd.filter(
        new Function<Tuple2<Integer, UnitOutcome<CompositeImage>>, Boolean>() {
      @Override
      public Boolean call(Tuple2<Integer, UnitOutcome<CompositeImage>> entry) {
        return trendYears.contains(entry._1()) && entry._2().isOk();
      }
    });

    JavaRDD<Region> regionsRdd = sc.parallelize(
        regions, Math.max(1, Math.min(config.parallelism, regions.size())));
    JavaPairRDD<UnitKey, UnitOutcome<RegionYearValue>> valuesRdd = regionsRdd
        .cartesian(trendCompositesRdd)
        .coalesce(config.parallelism)
        .mapToPair(new PairFunction<Tuple2<Region, Tuple2<Integer, UnitOutcome<CompositeImage>>>,
            UnitKey, UnitOutcome<RegionYearValue>>() {
      @Override
      public Tuple2<UnitKey, UnitOutcome<RegionYearValue>> call(
          Tuple2<Region, Tuple2<Integer, UnitOutcome<CompositeImage>>> unit) throws Exception {
        Region region = unit._1();
        CompositeImage composite = unit._2()._2().value;
        UnitKey key = new UnitKey(region.id, composite.year);
        try {
          return new Tuple2<UnitKey, UnitOutcome<RegionYearValue>>(key,
              UnitOutcome.ok(AnomalyTrendPipeline.regionYearValue(composite, region, conf)));
        } catch (InvalidGeometryException e) {
          return new Tuple2<UnitKey, UnitOutcome<RegionYearValue>>(
              key, UnitOutcome.<RegionYearValue>failed(e.getMessage()));
        }
      }
    });
    valuesRdd.cache();

    // Regroup by region id and fit one trend each.
    JavaPairRDD<String, TrendResult> trendsRdd = valuesRdd.filter(
        new Function<Tuple2<UnitKey, UnitOutcome<RegionYearValue>>, Boolean>() {
      @Override
      public Boolean call(Tuple2<UnitKey, UnitOutcome<RegionYearValue>> entry) {
        return entry._2().isOk();
      }
    }).mapToPair(new PairFunction<Tuple2<UnitKey, UnitOutcome<RegionYearValue>>, String, Double[]>() {
      @Override
      public Tuple2<String, Double[]> call(Tuple2<UnitKey, UnitOutcome<RegionYearValue>> entry) {
        RegionYearValue value = entry._2().value;
        return new Tuple2<String, Double[]>(
            value.regionId, new Double[] {(double) value.year, value.mean});
      }
    }).groupByKey().mapValues(new Function<Iterable<Double[]>, TrendResult>() {
      @Override
      public TrendResult call(Iterable<Double[]> points) {
        SortedMap<Integer, Double> series = new TreeMap<Integer, Double>();
        for (Double[] point : points) {
          series.put(point[0].intValue(), point[1]);
        }
        return TrendEstimator.fitTrend(series);
      }
    });

    // Everything below is small enough to finish on the driver, keyed for stable output order.
    for (Map.Entry<Integer, UnitOutcome<CompositeImage>> entry
        : new TreeMap<Integer, UnitOutcome<CompositeImage>>(compositesRdd.collectAsMap())
            .entrySet()) {
      if (entry.getValue().isOk()) {
        results.composites.put(entry.getKey(), entry.getValue().value);
      } else {
        LOG.warn("Unit composite/{} failed: {}", entry.getKey(), entry.getValue().failure);
        results.report.failures.add("composite/" + entry.getKey() + ": " + entry.getValue().failure);
      }
    }
    for (Tuple2<UnitKey, UnitOutcome<RegionYearValue>> entry : valuesRdd.collect()) {
      if (entry._2().isOk()) {
        results.regionYearValues.put(entry._1(), entry._2().value);
      } else {
        LOG.warn("Unit {} failed: {}", entry._1(), entry._2().failure);
        results.report.failures.add(entry._1() + ": " + entry._2().failure);
      }
    }
    results.regionTrends.putAll(trendsRdd.collectAsMap());
    compositesRdd.unpersist();
    valuesRdd.unpersist();

    results.deriveFromComposites(config, studyArea);
    results.summarize(regions.size(), start);
    results.writeTo(outputDir, config);
    LOG.info("Finished in {}s with {} failed units", results.report.elapsedSeconds,
        results.report.failures.size());
    return results;
  }

  public static void main(String[] args) throws Exception {
    if (args.length < 3) {
      System.err.println("Usage: spark-submit seasonal-anomaly-trend-1.0.jar <frames dir> "
          + "<regions geojson> <output dir> [site config xml] [key=value ...]");
      System.exit(1);
    }
    String sitePath = args.length > 3 && !args[3].contains("=") ? args[3] : null;
    List<String> overrides = new ArrayList<String>(
        Arrays.asList(args).subList(sitePath == null ? 3 : 4, args.length));
    PipelineConfig config = PipelineConfig.load(sitePath, overrides.toArray(new String[0]));

    // Master should come from the environment; without one, run locally on parallelism cores.
    SparkConf sparkConf = new SparkConf()
        .setAppName("org.dhuo.anomalytrend.DistribTool")
        .setIfMissing("spark.master", "local[" + config.parallelism + "]");
    JavaSparkContext sc = new JavaSparkContext(sparkConf);
    try {
      RasterTimeSeriesSource source =
          new DirectoryFrameSource(config.datasetId, args[0], config.noDataSentinel);
      List<Region> regions = new GeoJsonRegionReader(config.regionNameProperties).read(args[1]);
      run(sc, config, source, regions, args[2]);
    } finally {
      sc.stop();
    }
  }
}
