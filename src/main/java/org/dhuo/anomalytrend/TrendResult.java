package org.dhuo.anomalytrend;

import java.io.Serializable;

/**
 * Scalar least-squares trend of a value against year. Slope and intercept are null, never 0,
 * when fewer than two usable points existed; {@link #pointsUsed} is always reported.
 */
public class TrendResult implements Serializable {
  public final Double slope;
  public final Double intercept;
  public final int pointsUsed;

  public TrendResult(Double slope, Double intercept, int pointsUsed) {
    this.slope = slope;
    this.intercept = intercept;
    this.pointsUsed = pointsUsed;
  }

  public static TrendResult undefined(int pointsUsed) {
    return new TrendResult(null, null, pointsUsed);
  }

  public boolean isDefined() {
    return slope != null;
  }

  @Override
  public String toString() {
    return isDefined()
        ? String.format("TrendResult[slope=%g intercept=%g n=%d]", slope, intercept, pointsUsed)
        : "TrendResult[UNDEFINED n=" + pointsUsed + "]";
  }
}
