package org.dhuo.anomalytrend;

import java.io.IOException;

/**
 * Persists a finished artifact. {@code scale} is the output pixel size in map units and is
 * ignored by tabular formats.
 */
public interface ResultExporter<T> {
  void save(T artifact, String destination, ExportFormat format, double scale) throws IOException;
}
