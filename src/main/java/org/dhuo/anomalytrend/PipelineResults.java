package org.dhuo.anomalytrend;

import org.apache.hadoop.fs.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Everything a batch run produced, keyed so that output order never depends on which unit
 * finished first.
 */
public class PipelineResults {
  private static final Logger LOG = LoggerFactory.getLogger(PipelineResults.class);

  public SortedMap<Integer, CompositeImage> composites = new TreeMap<Integer, CompositeImage>();
  public List<AnomalyRaster> anomalies = new ArrayList<AnomalyRaster>();
  // Null if a trend year could not be composited.
  public TrendRaster pixelTrend;
  public SortedMap<UnitKey, RegionYearValue> regionYearValues =
      new TreeMap<UnitKey, RegionYearValue>();
  public SortedMap<String, TrendResult> regionTrends = new TreeMap<String, TrendResult>();
  public SortedMap<Integer, RegionYearValue> studyAreaSeries =
      new TreeMap<Integer, RegionYearValue>();
  public RunReport report = new RunReport();

  /**
   * Derives anomalies, the pixel-wise trend and the study-area series from composites that
   * were already materialized, recording anything that cannot be derived as a failure.
   */
  public void deriveFromComposites(PipelineConfig config, StudyArea studyArea) {
    List<CompositeImage> baseline = present(config.baselineYears(), "baseline");
    for (Integer target : config.targetYears) {
      CompositeImage composite = composites.get(target);
      if (composite == null || baseline == null) {
        report.failures.add("anomaly/" + target + ": missing composites");
        continue;
      }
      anomalies.add(BaselineAnomalyEngine.anomaly(baseline, composite, config.unitScale));
    }

    List<CompositeImage> trendSeries = present(config.trendYears, "trend");
    if (trendSeries != null) {
      pixelTrend = TrendEstimator.fitTrend(trendSeries);
      for (CompositeImage composite : trendSeries) {
        try {
          studyAreaSeries.put(composite.year, AnomalyTrendPipeline.regionYearValue(
              composite, studyArea, "study_area", config));
        } catch (InvalidGeometryException e) {
          LOG.warn("Study area series skipped: {}", e.getMessage());
          report.failures.add(e.getMessage());
          break;
        }
      }
    }
  }

  /** The composites for {@code years}, or null (logged) if any is missing. */
  private List<CompositeImage> present(List<Integer> years, String purpose) {
    List<CompositeImage> ret = new ArrayList<CompositeImage>();
    for (Integer year : years) {
      CompositeImage composite = composites.get(year);
      if (composite == null) {
        LOG.warn("No {} composite for {}", purpose, year);
        return null;
      }
      ret.add(composite);
    }
    return ret;
  }

  /** Fills the report counters that follow from the results themselves. */
  public void summarize(int regionCount, long startNanos) {
    report.yearsComposited = composites.size();
    report.fallbackYears = 0;
    report.framesMatched = 0;
    for (CompositeImage composite : composites.values()) {
      report.framesMatched += composite.sourceFrameCount;
      if (!composite.hasData()) ++report.fallbackYears;
    }
    report.regions = regionCount;
    report.unitsProcessed = regionYearValues.size();
    report.trendPixels = pixelTrend == null ? 0 : pixelTrend.definedPixelCount();
    report.elapsedSeconds = (System.nanoTime() - startNanos) / 1e9;
  }

  /**
   * Writes rasters (data-bearing composites, valid anomalies, trend coefficients) and tables
   * under {@code outputDir}. Fallback composites and undefined anomalies are not written as
   * rasters; their reasons are logged instead.
   */
  public void writeTo(String outputDir, PipelineConfig config) throws IOException {
    TiffRasterExporter rasters = new TiffRasterExporter(config.noDataSentinel);
    CsvTableExporter tables = new CsvTableExporter();
    String band = config.bandName;

    for (CompositeImage composite : composites.values()) {
      if (!composite.hasData()) {
        LOG.info("Skipping export of {} composite {}: {}", band, composite.year, composite.reason);
        continue;
      }
      rasters.save(composite.raster, file(outputDir, "composite_" + band + "_" + composite.year
          + ".tif"), ExportFormat.GEO_TIFF, config.exportScale);
    }
    for (AnomalyRaster anomaly : anomalies) {
      if (!anomaly.isValid()) {
        LOG.info("Skipping export of {} anomaly {}: {}", band, anomaly.targetYear, anomaly.reason);
        continue;
      }
      rasters.save(anomaly.raster, file(outputDir, "anomaly_" + band + "_" + anomaly.targetYear
          + ".tif"), ExportFormat.GEO_TIFF, config.exportScale);
    }
    if (pixelTrend != null) {
      rasters.save(pixelTrend.coefficients, file(outputDir, "trend_" + band + ".tif"),
          ExportFormat.GEO_TIFF, config.exportScale);
    }

    tables.save(ResultTable.trendTable(regionTrends), file(outputDir, "trend_stats.csv"),
        ExportFormat.CSV, 0);
    tables.save(ResultTable.regionYearTable(regionYearValues),
        file(outputDir, "region_year_stats.csv"), ExportFormat.CSV, 0);
    tables.save(ResultTable.studyAreaTable(studyAreaSeries),
        file(outputDir, "study_area_series.csv"), ExportFormat.CSV, 0);
    tables.save(ResultTable.reportTable(report), file(outputDir, "run_report.csv"),
        ExportFormat.CSV, 0);
  }

  private static String file(String dir, String name) {
    return new Path(dir, name).toString();
  }
}
