package org.dhuo.anomalytrend;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

/**
 * Per-pixel difference between a target year's seasonal aggregate and the baseline mean, in
 * output units. An {@link Status#UNDEFINED} anomaly is fully masked and says why in
 * {@link #reason}; it is never a raster of zeros.
 */
public class AnomalyRaster implements Serializable {
  public static final String BAND = "anomaly";

  public enum Status {
    VALID,
    UNDEFINED
  }

  public final int targetYear;
  public final Raster raster;
  public final Status status;
  public final String reason;
  public final List<Integer> baselineYearsUsed;
  public final double unitScale;

  AnomalyRaster(int targetYear, Raster raster, Status status, String reason,
      List<Integer> baselineYearsUsed, double unitScale) {
    this.targetYear = targetYear;
    this.raster = raster;
    this.status = status;
    this.reason = reason;
    this.baselineYearsUsed = Collections.unmodifiableList(baselineYearsUsed);
    this.unitScale = unitScale;
  }

  public boolean isValid() {
    return status == Status.VALID;
  }

  @Override
  public String toString() {
    return "AnomalyRaster[" + targetYear + " " + status
        + (reason == null ? "" : " (" + reason + ")") + "]";
  }
}
