package org.dhuo.anomalytrend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the whole pipeline in one JVM, spreading yearly composites and (region, year) units over
 * a fixed pool of {@code parallelism} threads.
 */
public class LocalTool {
  private static final Logger LOG = LoggerFactory.getLogger(LocalTool.class);

  /**
   * Composites every configured year, reduces each (region, trend year) unit, fits the trends
   * and writes everything under {@code outputDir}. A unit that fails on a schema mismatch or an
   * invalid region polygon is recorded in the report; its siblings still run.
   */
  public static PipelineResults run(PipelineConfig config, RasterTimeSeriesSource source,
      List<Region> regions, String outputDir) throws IOException, InterruptedException {
    long start = System.nanoTime();
    LOG.info("Running {} over {} regions", config, regions.size());
    final AnomalyTrendPipeline pipeline = new AnomalyTrendPipeline(config, source, regions);
    PipelineResults results = new PipelineResults();

    ExecutorService pool = Executors.newFixedThreadPool(config.parallelism);
    try {
      Map<Integer, Future<CompositeImage>> compositeFutures =
          new TreeMap<Integer, Future<CompositeImage>>();
      for (final Integer year : config.allYears()) {
        compositeFutures.put(year, pool.submit(new Callable<CompositeImage>() {
          @Override
          public CompositeImage call() throws Exception {
            return pipeline.composite(year);
          }
        }));
      }
      for (Map.Entry<Integer, Future<CompositeImage>> entry : compositeFutures.entrySet()) {
        CompositeImage composite = await(entry.getValue(), "composite/" + entry.getKey(),
            results.report);
        if (composite != null) {
          results.composites.put(entry.getKey(), composite);
        }
      }

      Map<UnitKey, Future<RegionYearValue>> unitFutures =
          new TreeMap<UnitKey, Future<RegionYearValue>>();
      for (final Region region : regions) {
        for (final Integer year : config.trendYears) {
          if (!results.composites.containsKey(year)) continue;
          unitFutures.put(new UnitKey(region.id, year), pool.submit(
              new Callable<RegionYearValue>() {
            @Override
            public RegionYearValue call() throws Exception {
              return pipeline.regionYearValue(region, year);
            }
          }));
        }
      }
      for (Map.Entry<UnitKey, Future<RegionYearValue>> entry : unitFutures.entrySet()) {
        RegionYearValue value = await(entry.getValue(), entry.getKey().toString(), results.report);
        if (value != null) {
          results.regionYearValues.put(entry.getKey(), value);
        }
      }
    } finally {
      pool.shutdown();
    }

    results.regionTrends.putAll(AnomalyTrendPipeline.regionTrends(results.regionYearValues));
    results.deriveFromComposites(config, pipeline.getStudyArea());
    results.summarize(regions.size(), start);
    results.writeTo(outputDir, config);
    LOG.info("Finished in {}s with {} failed units", results.report.elapsedSeconds,
        results.report.failures.size());
    return results;
  }

  /**
   * Waits for {@code future}. Unit failures are logged, added to {@code report} and turned into
   * null; anything else is rethrown.
   */
  static <T> T await(Future<T> future, String unit, RunReport report)
      throws IOException, InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof UnitFailureException) {
        LOG.warn("Unit {} failed: {}", unit, cause.getMessage());
        report.failures.add(unit + ": " + cause.getMessage());
        return null;
      }
      if (cause instanceof IOException) throw (IOException) cause;
      if (cause instanceof RuntimeException) throw (RuntimeException) cause;
      if (cause instanceof Error) throw (Error) cause;
      throw new IOException("Unit " + unit + " failed", cause);
    }
  }

  public static void main(String[] args) throws Exception {
    if (args.length < 3) {
      System.err.println("Usage: LocalTool <frames dir> <regions geojson> <output dir> "
          + "[site config xml] [key=value ...]");
      System.exit(1);
    }
    String sitePath = args.length > 3 && !args[3].contains("=") ? args[3] : null;
    List<String> overrides = new ArrayList<String>(
        Arrays.asList(args).subList(sitePath == null ? 3 : 4, args.length));
    PipelineConfig config = PipelineConfig.load(sitePath, overrides.toArray(new String[0]));

    RasterTimeSeriesSource source =
        new DirectoryFrameSource(config.datasetId, args[0], config.noDataSentinel);
    List<Region> regions = new GeoJsonRegionReader(config.regionNameProperties).read(args[1]);
    PipelineResults results = run(config, source, regions, args[2]);
    for (String failure : results.report.failures) {
      System.err.println("FAILED " + failure);
    }
  }
}
