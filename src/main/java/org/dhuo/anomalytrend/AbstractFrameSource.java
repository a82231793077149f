package org.dhuo.anomalytrend;

import org.locationtech.jts.geom.Envelope;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Implements the geometry/band filtering of {@link #query} on top of a date-filtered listing.
 */
public abstract class AbstractFrameSource implements RasterTimeSeriesSource {
  private final String datasetId;

  protected AbstractFrameSource(String datasetId) {
    this.datasetId = datasetId;
  }

  @Override
  public String getDatasetId() {
    return datasetId;
  }

  /** All frames acquired within {@code range}, in any order. */
  protected abstract List<RasterFrame> framesIn(DateRange range) throws IOException;

  @Override
  public List<RasterFrame> query(Footprint geometry, DateRange range, List<String> bandNames)
      throws IOException {
    Envelope bounds = geometry.getBounds();
    List<RasterFrame> ret = new ArrayList<RasterFrame>();
    for (RasterFrame frame : framesIn(range)) {
      if (!range.contains(frame.date)) continue;
      if (!intersects(frame.raster.getGrid(), bounds)) continue;
      ret.add(restrict(frame, bandNames));
    }
    Collections.sort(ret, new Comparator<RasterFrame>() {
      @Override
      public int compare(RasterFrame a, RasterFrame b) {
        return a.date.compareTo(b.date);
      }
    });
    return ret;
  }

  static boolean intersects(GridGeometry grid, Envelope bounds) {
    return grid.originX < bounds.getMaxX() && grid.maxX() > bounds.getMinX()
        && grid.minY() < bounds.getMaxY() && grid.originY > bounds.getMinY();
  }

  /** Keeps the requested bands the frame carries, in request order. */
  static RasterFrame restrict(RasterFrame frame, List<String> bandNames) {
    List<String> kept = new ArrayList<String>();
    List<double[]> data = new ArrayList<double[]>();
    for (String band : bandNames) {
      int index = frame.raster.bandIndex(band);
      if (index >= 0 && !kept.contains(band)) {
        kept.add(band);
        data.add(frame.raster.bandData(index));
      }
    }
    Raster restricted = new Raster(frame.raster.getGrid(), kept.toArray(new String[0]),
        data.toArray(new double[0][]));
    return frame.withRaster(restricted);
  }
}
