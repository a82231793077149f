package org.dhuo.anomalytrend;

import org.locationtech.jts.geom.Envelope;

/**
 * A planar area that rasters can be clipped to and reduced over.
 */
public interface Footprint {
  /** True if the point lies inside or on the boundary. */
  boolean contains(double x, double y);

  Envelope getBounds();

  /**
   * @throws InvalidGeometryException if the area is empty, degenerate or self-intersecting.
   */
  void checkValid() throws InvalidGeometryException;
}
