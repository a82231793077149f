package org.dhuo.anomalytrend;

import org.apache.commons.math3.stat.descriptive.AggregateSummaryStatistics;
import org.apache.commons.math3.stat.descriptive.StatisticalSummary;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduces rasters to one scalar per region.
 *
 * <p>The region is sampled on a square lattice of spacing {@code scale}, aligned to the raster
 * origin; each sample whose point lies inside the region takes the value of the pixel under it.
 * Samples all stand for the same area, so the mean is area weighted. The lattice is walked in
 * {@code tileFactor x tileFactor} tiles whose partial statistics are merged at the end, which
 * only changes how much is held at once, not the answer.
 */
public class RegionalAggregator {

  /**
   * @return the statistic, or null if no unmasked pixel lies under the region.
   * @throws InvalidGeometryException if {@code region} is empty, degenerate or self-intersecting.
   */
  public static Double aggregate(Raster raster, String band, Footprint region,
      RegionReducer reducer, double scale, int tileFactor) throws InvalidGeometryException {
    StatisticalSummary stats = summarize(raster, band, region, scale, tileFactor);
    return stats == null ? null : reducer.extract(stats);
  }

  /**
   * Merged statistics of the samples under {@code region}, from which any {@link RegionReducer}
   * can be read; null if no unmasked pixel lies under it.
   */
  public static StatisticalSummary summarize(Raster raster, String band, Footprint region,
      double scale, int tileFactor) throws InvalidGeometryException {
    if (!(scale > 0)) {
      throw new IllegalArgumentException("scale must be positive, got " + scale);
    }
    if (tileFactor < 1) {
      throw new IllegalArgumentException("tileFactor must be at least 1, got " + tileFactor);
    }
    region.checkValid();
    GridGeometry grid = raster.getGrid();
    double[] values = raster.bandData(bandIndexOf(raster, band));

    int lastCol = (int) Math.ceil(grid.width * grid.pixelSize / scale - 1e-9) - 1;
    int lastRow = (int) Math.ceil(grid.height * grid.pixelSize / scale - 1e-9) - 1;
    Envelope bounds = region.getBounds();
    int iMin = Math.max(0, (int) Math.floor((bounds.getMinX() - grid.originX) / scale));
    int iMax = Math.min(lastCol, (int) Math.ceil((bounds.getMaxX() - grid.originX) / scale));
    int jMin = Math.max(0, (int) Math.floor((grid.originY - bounds.getMaxY()) / scale));
    int jMax = Math.min(lastRow, (int) Math.ceil((grid.originY - bounds.getMinY()) / scale));
    if (iMin > iMax || jMin > jMax) {
      return null;
    }

    List<StatisticalSummary> partials = new ArrayList<StatisticalSummary>();
    int[] colSplits = split(iMin, iMax, tileFactor);
    int[] rowSplits = split(jMin, jMax, tileFactor);
    for (int tr = 0; tr + 1 < rowSplits.length; ++tr) {
      for (int tc = 0; tc + 1 < colSplits.length; ++tc) {
        SummaryStatistics tile = new SummaryStatistics();
        for (int j = rowSplits[tr]; j < rowSplits[tr + 1]; ++j) {
          double y = grid.originY - (j + 0.5) * scale;
          int row = grid.rowOf(y);
          if (row < 0 || row >= grid.height) continue;
          for (int i = colSplits[tc]; i < colSplits[tc + 1]; ++i) {
            double x = grid.originX + (i + 0.5) * scale;
            int col = grid.colOf(x);
            if (col < 0 || col >= grid.width) continue;
            if (!region.contains(x, y)) continue;
            double v = values[row * grid.width + col];
            if (!Double.isNaN(v)) tile.addValue(v);
          }
        }
        // Empty tiles would poison the merge with NaN min/max.
        if (tile.getN() > 0) partials.add(tile);
      }
    }
    if (partials.isEmpty()) {
      return null;
    }
    return partials.size() == 1 ? partials.get(0) : AggregateSummaryStatistics.aggregate(partials);
  }

  /**
   * One value per composite, in order; fallback composites yield null because their constant
   * raster stands for missing data, not for measured values.
   */
  public static List<Double> aggregate(List<CompositeImage> stack, Footprint region,
      RegionReducer reducer, double scale, int tileFactor) throws InvalidGeometryException {
    List<Double> ret = new ArrayList<Double>();
    for (CompositeImage composite : stack) {
      if (!composite.hasData()) {
        region.checkValid();
        ret.add(null);
      } else {
        ret.add(aggregate(composite.raster, composite.band, region, reducer, scale, tileFactor));
      }
    }
    return ret;
  }

  /** Boundaries of {@code parts} near-equal half-open chunks covering [first, last]. */
  static int[] split(int first, int last, int parts) {
    int length = last - first + 1;
    int chunks = Math.min(parts, length);
    int[] ret = new int[chunks + 1];
    for (int k = 0; k <= chunks; ++k) {
      ret[k] = first + (int) ((long) length * k / chunks);
    }
    return ret;
  }

  private static int bandIndexOf(Raster raster, String band) {
    int index = raster.bandIndex(band);
    if (index < 0) {
      throw new IllegalArgumentException(
          "No band '" + band + "' in raster with bands " + raster.getBandNames());
    }
    return index;
  }
}
