package org.dhuo.anomalytrend;

/**
 * The dataset schema has no band of the requested name at all.
 */
public class SchemaMismatchException extends UnitFailureException {
  public SchemaMismatchException(String datasetId, String band) {
    super(datasetId, "band '" + band + "' is not part of the dataset schema");
  }
}
