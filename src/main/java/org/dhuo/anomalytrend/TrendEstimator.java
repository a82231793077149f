package org.dhuo.anomalytrend;

import org.apache.commons.math3.stat.regression.SimpleRegression;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Ordinary least-squares trend of composite values against year, either pixel by pixel across a
 * stack of yearly composites or over one scalar per year.
 */
public class TrendEstimator {
  public static final int MIN_POINTS = 2;

  /**
   * Fits {@code value = intercept + slope * year} over the non-null entries of {@code series}.
   */
  public static TrendResult fitTrend(SortedMap<Integer, Double> series) {
    SimpleRegression regression = new SimpleRegression(true);
    for (Map.Entry<Integer, Double> point : series.entrySet()) {
      Double value = point.getValue();
      if (value == null || value.isNaN()) continue;
      regression.addData(point.getKey(), value);
    }
    int n = (int) regression.getN();
    if (n < MIN_POINTS) {
      return TrendResult.undefined(n);
    }
    double slope = regression.getSlope();
    if (Double.isNaN(slope)) {
      // All points share one year.
      return TrendResult.undefined(n);
    }
    return new TrendResult(slope, regression.getIntercept(), n);
  }

  /**
   * Pixel-wise fit across {@code series}, which must hold one composite per year on a shared
   * grid. Fallback composites and masked pixels count as missing points.
   */
  public static TrendRaster fitTrend(List<CompositeImage> series) {
    if (series.isEmpty()) {
      throw new IllegalArgumentException("No composites to fit");
    }
    GridGeometry grid = series.get(0).getGrid();
    List<Integer> years = new ArrayList<Integer>();
    List<double[]> layers = new ArrayList<double[]>();
    for (CompositeImage composite : series) {
      if (!composite.getGrid().equals(grid)) {
        throw new IllegalArgumentException("Composite " + composite.year + " is on "
            + composite.getGrid() + ", expected " + grid);
      }
      if (years.contains(composite.year)) {
        throw new IllegalArgumentException("Year " + composite.year + " appears twice");
      }
      years.add(composite.year);
      if (composite.hasData()) {
        layers.add(composite.raster.bandData(0));
      } else {
        layers.add(null);
      }
    }

    double[] slope = new double[grid.size()];
    double[] intercept = new double[grid.size()];
    double[] counts = new double[grid.size()];
    SimpleRegression regression = new SimpleRegression(true);
    for (int i = 0; i < slope.length; ++i) {
      regression.clear();
      for (int k = 0; k < layers.size(); ++k) {
        double[] layer = layers.get(k);
        if (layer == null || Double.isNaN(layer[i])) continue;
        regression.addData(years.get(k), layer[i]);
      }
      counts[i] = regression.getN();
      double s = regression.getN() < MIN_POINTS ? Double.NaN : regression.getSlope();
      slope[i] = s;
      intercept[i] = Double.isNaN(s) ? Double.NaN : regression.getIntercept();
    }
    Raster coefficients = new Raster(grid, new String[] {TrendRaster.SLOPE, TrendRaster.INTERCEPT},
        new double[][] {slope, intercept});
    return new TrendRaster(
        coefficients, Raster.singleBand(grid, TrendRaster.POINTS_USED, counts), years);
  }
}
