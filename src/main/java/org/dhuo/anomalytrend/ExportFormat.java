package org.dhuo.anomalytrend;

public enum ExportFormat {
  GEO_TIFF,
  CSV
}
