package org.dhuo.anomalytrend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;
import org.locationtech.jts.geom.Envelope;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.Arrays;

public class RegionTest {

  private static void assertInvalid(Region region, String messagePart) {
    try {
      region.checkValid();
      fail(region + " should not be valid");
    } catch (InvalidGeometryException e) {
      assertEquals(region.id, e.getUnit());
      assertTrue(e.getMessage(), e.getMessage().contains(messagePart));
    }
  }

  @Test
  public void selfIntersectingRingIsInvalid() {
    Region bowTie = Region.polygon("bowtie", new double[][] {
        {0, 0}, {30, 30}, {30, 0}, {0, 10}, {0, 0}});
    assertInvalid(bowTie, "Self-intersection");
  }

  @Test
  public void degenerateAndUnclosedRingsAreInvalid() {
    assertInvalid(RasterFixtures.degenerate("line"), "");
    assertInvalid(Region.polygon("open", new double[][] {{0, 0}, {10, 0}, {10, 10}, {0, 10}}),
        "closed");
  }

  @Test
  public void collinearRingHasNoArea() throws Exception {
    Region flat = Region.polygon("flat", new double[][] {{0, 0}, {10, 10}, {20, 20}, {0, 0}});
    try {
      flat.checkValid();
      fail("A collinear ring should not be valid");
    } catch (InvalidGeometryException e) {
      assertEquals("flat", e.getUnit());
    }
  }

  @Test
  public void containsIncludesBoundary() throws Exception {
    Region left = RasterFixtures.leftHalf();
    left.checkValid();
    assertTrue(left.contains(10, 10));
    assertTrue(left.contains(20, 10));
    assertFalse(left.contains(20.5, 10));
    assertEquals(new Envelope(0, 20, 0, 40), left.getBounds());
  }

  @Test
  public void studyAreaIsTheUnionOfValidRegions() throws Exception {
    Region bowTie = Region.polygon("bowtie", new double[][] {
        {50, 50}, {80, 80}, {80, 50}, {50, 60}, {50, 50}});
    StudyArea area = StudyArea.ofValid(Arrays.asList(
        RasterFixtures.leftHalf(), RasterFixtures.rightHalf(), bowTie));
    assertEquals(2, area.getParts().size());
    area.checkValid();
    assertEquals(1600, area.getShape().getArea(), 1e-9);
    // The shared edge is interior once the halves are merged.
    assertEquals(1, area.getShape().getNumGeometries());
    assertEquals(new Envelope(0, 40, 0, 40), area.getBounds());
    assertFalse(area.contains(60, 55));
  }

  @Test
  public void emptyStudyAreaIsInvalid() {
    StudyArea area = StudyArea.ofValid(Arrays.asList(RasterFixtures.degenerate("bad")));
    assertFalse(area.contains(10, 10));
    try {
      area.checkValid();
      fail("A study area without regions should not be valid");
    } catch (InvalidGeometryException e) {
      assertEquals("study-area", e.getUnit());
    }
  }

  @Test
  public void survivesSerialization() throws Exception {
    Region odd = Region.polygon("odd", new double[][] {{3, 2}, {38, 7}, {33, 39}, {6, 31}, {3, 2}});
    assertTrue(odd.contains(20, 20));
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    ObjectOutputStream out = new ObjectOutputStream(bytes);
    out.writeObject(odd);
    out.close();
    Region copy = (Region) new ObjectInputStream(
        new ByteArrayInputStream(bytes.toByteArray())).readObject();
    assertEquals("odd", copy.id);
    assertTrue(copy.contains(20, 20));
    assertFalse(copy.contains(1, 1));
    copy.checkValid();
  }
}
