package org.dhuo.anomalytrend;

/**
 * Fatal error scoped to a single unit of work (one year, or one region/year pair). Batch runners
 * catch it per unit, report it, and carry on with the remaining units.
 */
public class UnitFailureException extends Exception {
  private final String unit;

  public UnitFailureException(String unit, String message) {
    super(unit + ": " + message);
    this.unit = unit;
  }

  public String getUnit() {
    return unit;
  }
}
