package org.dhuo.anomalytrend;

import java.io.IOException;
import java.io.Serializable;
import java.util.List;
import java.util.Set;

/**
 * Supplies dated raster frames. Implementations own retrieval concerns such as timeouts; the
 * pipeline only consumes this contract. Sources are shipped to Spark executors, hence
 * {@link Serializable}.
 */
public interface RasterTimeSeriesSource extends Serializable {
  String getDatasetId();

  /** The fixed extent every frame of this dataset covers. */
  GridGeometry getGrid() throws IOException;

  /** Every band a frame of this dataset can carry. */
  Set<String> getSchemaBands() throws IOException;

  /**
   * Frames acquired within {@code range} whose extent touches {@code geometry}, in date order.
   * Each frame keeps only those of {@code bandNames} it actually carries, possibly none.
   */
  List<RasterFrame> query(Footprint geometry, DateRange range, List<String> bandNames)
      throws IOException;
}
