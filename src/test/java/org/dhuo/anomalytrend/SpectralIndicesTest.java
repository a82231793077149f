package org.dhuo.anomalytrend;

import static org.dhuo.anomalytrend.RasterFixtures.GRID;
import static org.dhuo.anomalytrend.RasterFixtures.filled;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class SpectralIndicesTest {
  @Test
  public void normalizedDifference() {
    assertEquals(0.4 / 0.6, SpectralIndex.normalizedDifference(0.5, 0.1), 1e-12);
    assertTrue(Double.isNaN(SpectralIndex.normalizedDifference(0.2, -0.2)));
    assertTrue(Double.isNaN(SpectralIndex.normalizedDifference(Double.NaN, 0.1)));
  }

  @Test
  public void radarVegetationIndexUsesLinearPower() {
    assertEquals(2, SpectralIndex.radarVegetationIndex(0, 0), 1e-12);
    // VV 10x VH in power: 4 * 1 / 11.
    assertEquals(4.0 / 11, SpectralIndex.radarVegetationIndex(0, -10), 1e-12);
    assertTrue(Double.isNaN(SpectralIndex.radarVegetationIndex(-12, Double.NaN)));
  }

  @Test
  public void indexedSourceDerivesTheBand() throws Exception {
    double[] nir = filled(0.5);
    nir[3] = Double.NaN;
    Raster raster = new Raster(GRID, new String[] {"B4", "B8", "B2"},
        new double[][] {filled(0.1), nir, filled(0.05)});
    InMemoryFrameSource raw = new InMemoryFrameSource("S2", GRID,
        Collections.singletonList(new RasterFrame(LocalDate.of(2020, 6, 1), raster)));
    IndexedFrameSource source = new IndexedFrameSource(raw, SpectralIndex.NDVI);

    assertTrue(source.getSchemaBands().contains("NDVI"));
    List<RasterFrame> frames = source.query(StudyArea.covering(GRID),
        new DateRange(LocalDate.of(2020, 1, 1), LocalDate.of(2020, 12, 31)),
        Collections.singletonList("NDVI"));
    assertEquals(1, frames.size());
    Raster ndvi = frames.get(0).raster;
    assertEquals(Arrays.asList("NDVI"), ndvi.getBandNames());
    assertEquals(0.4 / 0.6, ndvi.get("NDVI", 0, 0), 1e-12);
    assertTrue(ndvi.isMasked("NDVI", 3, 0));
  }

  @Test
  public void indexAbsentWithoutBothInputs() throws Exception {
    InMemoryFrameSource raw = new InMemoryFrameSource("S1", GRID,
        Collections.singletonList(RasterFixtures.frame("2020-06-01", "VV", -10)));
    IndexedFrameSource source = new IndexedFrameSource(raw, SpectralIndex.RVI);
    assertFalse(source.getSchemaBands().contains("RVI"));
    assertEquals(SpectralIndex.RVI, SpectralIndex.parse("rvi"));
  }
}
