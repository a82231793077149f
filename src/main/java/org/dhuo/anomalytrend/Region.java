package org.dhuo.anomalytrend;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.operation.valid.IsValidOp;
import org.locationtech.jts.operation.valid.TopologyValidationError;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named polygon or multipolygon supplied by the caller, in the rasters' planar map units.
 * A region whose outline could not even be built is still a region; it just fails validation.
 */
public class Region implements Footprint, Serializable {
  static final GeometryFactory FACTORY = new GeometryFactory();

  public final String id;
  private final Geometry shape;
  // Why the outline could not be built; null if it could.
  private final String defect;
  private transient volatile PreparedGeometry prepared;

  public Region(String id, Geometry shape) {
    this(id, shape, null);
  }

  private Region(String id, Geometry shape, String defect) {
    this.id = id;
    this.shape = shape;
    this.defect = defect;
  }

  public static Region unusable(String id, String reason) {
    return new Region(id, FACTORY.createPolygon(), reason);
  }

  /**
   * Builds a region from GeoJSON-style coordinates: one entry per polygon, each holding its
   * outer ring followed by its holes, every ring a list of {x, y} positions.
   */
  public static Region fromPolygons(String id, List<List<double[][]>> polygons) {
    Polygon[] parts = new Polygon[polygons.size()];
    try {
      for (int p = 0; p < parts.length; ++p) {
        List<double[][]> rings = polygons.get(p);
        if (rings.isEmpty()) {
          return unusable(id, "polygon " + p + " has no rings");
        }
        LinearRing[] holes = new LinearRing[rings.size() - 1];
        for (int h = 0; h < holes.length; ++h) {
          holes[h] = ring(rings.get(h + 1));
        }
        parts[p] = FACTORY.createPolygon(ring(rings.get(0)), holes);
      }
    } catch (IllegalArgumentException e) {
      // Unclosed rings and rings under four positions can't be constructed at all.
      return unusable(id, e.getMessage());
    }
    Geometry shape = parts.length == 1 ? parts[0] : FACTORY.createMultiPolygon(parts);
    return new Region(id, shape);
  }

  public static Region polygon(String id, double[][] outerRing) {
    List<double[][]> rings = new ArrayList<double[][]>();
    rings.add(outerRing);
    return fromPolygons(id, Collections.singletonList(rings));
  }

  /** Axis-aligned rectangle, handy for study extents. */
  public static Region rectangle(String id, double minX, double minY, double maxX, double maxY) {
    return polygon(id, new double[][] {
        {minX, minY}, {maxX, minY}, {maxX, maxY}, {minX, maxY}, {minX, minY}});
  }

  private static LinearRing ring(double[][] positions) {
    Coordinate[] coordinates = new Coordinate[positions.length];
    for (int i = 0; i < positions.length; ++i) {
      if (positions[i].length < 2) {
        throw new IllegalArgumentException("Position " + i + " has fewer than two ordinates");
      }
      coordinates[i] = new Coordinate(positions[i][0], positions[i][1]);
    }
    return FACTORY.createLinearRing(coordinates);
  }

  public Geometry getShape() {
    return shape;
  }

  @Override
  public boolean contains(double x, double y) {
    if (shape.isEmpty()) return false;
    return prepared().intersects(FACTORY.createPoint(new Coordinate(x, y)));
  }

  @Override
  public Envelope getBounds() {
    return new Envelope(shape.getEnvelopeInternal());
  }

  @Override
  public void checkValid() throws InvalidGeometryException {
    if (defect != null) {
      throw new InvalidGeometryException(id, defect);
    }
    if (shape.isEmpty()) {
      throw new InvalidGeometryException(id, "region is empty");
    }
    if (shape.getDimension() != 2) {
      throw new InvalidGeometryException(id, "region is a " + shape.getGeometryType()
          + ", not a polygon");
    }
    TopologyValidationError error = new IsValidOp(shape).getValidationError();
    if (error != null) {
      throw new InvalidGeometryException(id, error.getMessage() + " at " + error.getCoordinate());
    }
    if (shape.getArea() == 0) {
      throw new InvalidGeometryException(id, "region has zero area");
    }
  }

  // Not serialized; rebuilt on first use in each JVM.
  private PreparedGeometry prepared() {
    PreparedGeometry ret = prepared;
    if (ret == null) {
      ret = PreparedGeometryFactory.prepare(shape);
      prepared = ret;
    }
    return ret;
  }

  @Override
  public String toString() {
    return "Region[" + id + "]";
  }
}
