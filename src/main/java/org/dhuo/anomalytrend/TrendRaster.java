package org.dhuo.anomalytrend;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

/**
 * Pixel-wise trend: a two-band raster ({@code slope}, {@code intercept}) masked wherever fewer
 * than two years had data, plus the per-pixel count of years that went into each fit.
 */
public class TrendRaster implements Serializable {
  public static final String SLOPE = "slope";
  public static final String INTERCEPT = "intercept";
  public static final String POINTS_USED = "points_used";

  public final Raster coefficients;
  public final Raster pointsUsed;
  public final List<Integer> years;

  public TrendRaster(Raster coefficients, Raster pointsUsed, List<Integer> years) {
    this.coefficients = coefficients;
    this.pointsUsed = pointsUsed;
    this.years = Collections.unmodifiableList(years);
  }

  public Raster slope() {
    return coefficients.select(SLOPE);
  }

  /** Pixels with a defined slope. */
  public int definedPixelCount() {
    return coefficients.countUnmasked(SLOPE);
  }
}
