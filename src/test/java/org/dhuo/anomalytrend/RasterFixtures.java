package org.dhuo.anomalytrend;

import java.time.LocalDate;
import java.util.Arrays;

/**
 * Small synthetic rasters shared by the tests: a 4x4 grid of 10-unit pixels covering
 * x in [0, 40], y in [0, 40].
 */
class RasterFixtures {
  static final GridGeometry GRID = new GridGeometry(0, 40, 10, 4, 4);

  static RasterFrame frame(String date, String band, double value) {
    return new RasterFrame(LocalDate.parse(date), Raster.constant(GRID, band, value));
  }

  static RasterFrame frame(String date, String band, double[] values) {
    return new RasterFrame(LocalDate.parse(date), Raster.singleBand(GRID, band, values));
  }

  /** Left two columns hold {@code left}, right two columns {@code right}. */
  static double[] halves(double left, double right) {
    double[] values = new double[GRID.size()];
    for (int row = 0; row < GRID.height; ++row) {
      for (int col = 0; col < GRID.width; ++col) {
        values[row * GRID.width + col] = col < 2 ? left : right;
      }
    }
    return values;
  }

  /** 0, 1, ..., 15 in row-major order. */
  static double[] ramp() {
    double[] values = new double[GRID.size()];
    for (int i = 0; i < values.length; ++i) {
      values[i] = i;
    }
    return values;
  }

  static double[] filled(double value) {
    double[] values = new double[GRID.size()];
    Arrays.fill(values, value);
    return values;
  }

  static CompositeImage data(int year, String band, double[] values) {
    return new CompositeImage(year, band, Raster.singleBand(GRID, band, values),
        AggregationOp.median(), 1, DataPresence.DATA,
        LocalDate.of(year, 3, 1), LocalDate.of(year, 9, 30), null);
  }

  static CompositeImage fallback(int year, String band) {
    return new CompositeImage(year, band, Raster.constant(GRID, band, 0), AggregationOp.median(),
        0, DataPresence.FALLBACK, LocalDate.of(year, 3, 1), LocalDate.of(year, 9, 30),
        "no frames");
  }

  static Region leftHalf() {
    return Region.rectangle("left", 0, 0, 20, 40);
  }

  static Region rightHalf() {
    return Region.rectangle("right", 20, 0, 40, 40);
  }

  /** Two vertices only. */
  static Region degenerate(String id) {
    return Region.polygon(id, new double[][] {{0, 0}, {10, 10}, {0, 0}});
  }
}
