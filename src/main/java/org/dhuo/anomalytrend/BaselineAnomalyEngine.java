package org.dhuo.anomalytrend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Compares a target year's seasonal aggregate with the mean of the same aggregate over a set of
 * baseline years.
 */
public class BaselineAnomalyEngine {
  private static final Logger LOG = LoggerFactory.getLogger(BaselineAnomalyEngine.class);

  private final SeasonalCompositor compositor;
  private final RasterTimeSeriesSource source;

  public BaselineAnomalyEngine(SeasonalCompositor compositor, RasterTimeSeriesSource source) {
    this.compositor = compositor;
    this.source = source;
  }

  public AnomalyRaster anomaly(List<Integer> baselineYears, SeasonalWindow window, int targetYear,
      String band, AggregationOp op, double unitScale)
      throws SchemaMismatchException, IOException {
    List<CompositeImage> baseline =
        compositor.compositeYears(source, baselineYears, window, band, op);
    CompositeImage target = compositor.compositeYear(source, targetYear, window, band, op);
    return anomaly(baseline, target, unitScale);
  }

  /**
   * Anomaly from composites that were already built, e.g. by a lazily evaluated pipeline.
   * Fallback composites never enter the baseline mean.
   */
  public static AnomalyRaster anomaly(List<CompositeImage> baseline, CompositeImage target,
      double unitScale) {
    GridGeometry grid = target.getGrid();
    List<CompositeImage> usable = new ArrayList<CompositeImage>();
    List<Integer> usedYears = new ArrayList<Integer>();
    for (CompositeImage composite : baseline) {
      if (composite.hasData()) {
        usable.add(composite);
        usedYears.add(composite.year);
      }
    }
    if (usable.isEmpty()) {
      return undefined(target, usedYears, unitScale,
          "baseline has no data in any of " + baseline.size() + " years");
    }
    if (!target.hasData()) {
      return undefined(target, usedYears, unitScale,
          "target year " + target.year + " has no data: " + target.reason);
    }

    // Both operands go through the same unit conversion before the subtraction.
    double[] mean = baselineMean(usable).scale(unitScale).bandData(0);
    double[] current = target.raster.scale(unitScale).bandData(0);
    double[] diff = new double[grid.size()];
    for (int i = 0; i < diff.length; ++i) {
      diff[i] = current[i] - mean[i];
    }
    LOG.info("Anomaly for {} against {} baseline years", target.year, usedYears.size());
    return new AnomalyRaster(target.year, Raster.singleBand(grid, AnomalyRaster.BAND, diff),
        AnomalyRaster.Status.VALID, null, usedYears, unitScale);
  }

  /**
   * Per-pixel arithmetic mean across {@code composites}; a pixel masked in some years averages
   * the rest and stays masked only if masked in all of them.
   */
  public static Raster baselineMean(List<CompositeImage> composites) {
    GridGeometry grid = composites.get(0).getGrid();
    double[] sum = new double[grid.size()];
    int[] count = new int[grid.size()];
    for (CompositeImage composite : composites) {
      if (!composite.getGrid().equals(grid)) {
        throw new IllegalArgumentException("Composite " + composite.year + " is on "
            + composite.getGrid() + ", expected " + grid);
      }
      double[] values = composite.raster.bandData(0);
      for (int i = 0; i < values.length; ++i) {
        if (!Double.isNaN(values[i])) {
          sum[i] += values[i];
          ++count[i];
        }
      }
    }
    double[] mean = new double[grid.size()];
    for (int i = 0; i < mean.length; ++i) {
      mean[i] = count[i] == 0 ? Double.NaN : sum[i] / count[i];
    }
    return Raster.singleBand(grid, "baseline_mean", mean);
  }

  private static AnomalyRaster undefined(CompositeImage target, List<Integer> usedYears,
      double unitScale, String reason) {
    LOG.warn("Anomaly for {} is undefined: {}", target.year, reason);
    return new AnomalyRaster(target.year, Raster.masked(target.getGrid(), AnomalyRaster.BAND),
        AnomalyRaster.Status.UNDEFINED, reason, usedYears, unitScale);
  }
}
