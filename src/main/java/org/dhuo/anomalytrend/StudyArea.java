package org.dhuo.anomalytrend;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.operation.union.UnaryUnionOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Union of the valid regions of a run; composites are clipped to it.
 */
public class StudyArea implements Footprint, Serializable {
  private static final Logger LOG = LoggerFactory.getLogger(StudyArea.class);

  private final List<Region> parts;
  private final Region union;

  public StudyArea(List<Region> parts) {
    this.parts = Collections.unmodifiableList(new ArrayList<Region>(parts));
    List<Geometry> shapes = new ArrayList<Geometry>();
    for (Region part : parts) {
      shapes.add(part.getShape());
    }
    Geometry merged = shapes.isEmpty()
        ? Region.FACTORY.createPolygon() : UnaryUnionOp.union(shapes);
    this.union = new Region("study-area", merged);
  }

  /**
   * Builds the union from {@code regions}, leaving out any region that fails validation so a
   * single broken polygon can't empty the whole study area.
   */
  public static StudyArea ofValid(List<Region> regions) {
    List<Region> valid = new ArrayList<Region>();
    for (Region region : regions) {
      try {
        region.checkValid();
        valid.add(region);
      } catch (InvalidGeometryException e) {
        // Reported again, per unit, when the region itself is aggregated.
        LOG.warn("Leaving {} out of the study area: {}", region.id, e.getMessage());
      }
    }
    return new StudyArea(valid);
  }

  public static StudyArea covering(GridGeometry grid) {
    List<Region> parts = new ArrayList<Region>();
    parts.add(Region.rectangle("extent", grid.originX, grid.minY(), grid.maxX(), grid.originY));
    return new StudyArea(parts);
  }

  public List<Region> getParts() {
    return parts;
  }

  public Geometry getShape() {
    return union.getShape();
  }

  @Override
  public boolean contains(double x, double y) {
    return union.contains(x, y);
  }

  @Override
  public Envelope getBounds() {
    return union.getBounds();
  }

  @Override
  public void checkValid() throws InvalidGeometryException {
    if (parts.isEmpty()) {
      throw new InvalidGeometryException("study-area", "no valid regions");
    }
    union.checkValid();
  }
}
