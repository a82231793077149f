package org.dhuo.anomalytrend;

/**
 * A region polygon is empty or degenerate.
 */
public class InvalidGeometryException extends UnitFailureException {
  public InvalidGeometryException(String regionId, String message) {
    super(regionId, message);
  }
}
