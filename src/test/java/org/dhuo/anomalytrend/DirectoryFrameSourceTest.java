package org.dhuo.anomalytrend;

import static org.dhuo.anomalytrend.RasterFixtures.GRID;
import static org.dhuo.anomalytrend.RasterFixtures.filled;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

public class DirectoryFrameSourceTest {
  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private File dir;

  @Before
  public void writeFrames() throws Exception {
    dir = tmp.newFolder("frames");
    TiffRasterExporter exporter = new TiffRasterExporter(-9999);
    double[] nir = filled(0.6);
    nir[0] = Double.NaN;
    exporter.save(new Raster(GRID, new String[] {"B4", "B8"}, new double[][] {filled(0.2), nir}),
        new File(dir, "2020-04-01_T31.tif").getAbsolutePath(), ExportFormat.GEO_TIFF, 10);
    exporter.save(new Raster(GRID, new String[] {"B4", "B8"},
        new double[][] {filled(0.1), filled(0.5)}),
        new File(dir, "2020-08-15.tif").getAbsolutePath(), ExportFormat.GEO_TIFF, 10);
    exporter.save(Raster.constant(GRID, "B2", 0.3),
        new File(dir, "2021-04-01.tif").getAbsolutePath(), ExportFormat.GEO_TIFF, 10);
    assertTrue(new File(dir, "notes.txt").createNewFile());
  }

  @Test
  public void schemaIsTheUnionOfFrameBands() throws Exception {
    DirectoryFrameSource source = new DirectoryFrameSource("S2", dir.getAbsolutePath(), -9999);
    assertEquals(new HashSet<String>(Arrays.asList("B4", "B8", "B2")), source.getSchemaBands());
    assertEquals(GRID, source.getGrid());
  }

  @Test
  public void queryFiltersByDateAndBand() throws Exception {
    DirectoryFrameSource source = new DirectoryFrameSource("S2", dir.getAbsolutePath(), -9999);
    List<RasterFrame> frames = source.query(StudyArea.covering(GRID),
        new DateRange(LocalDate.of(2020, 3, 1), LocalDate.of(2020, 9, 30)),
        Collections.singletonList("B8"));
    assertEquals(2, frames.size());
    assertEquals(LocalDate.of(2020, 4, 1), frames.get(0).date);
    assertEquals(LocalDate.of(2020, 8, 15), frames.get(1).date);
    assertEquals(Arrays.asList("B8"), frames.get(0).raster.getBandNames());
    assertTrue(frames.get(0).raster.isMasked("B8", 0, 0));
    assertEquals(0.5f, frames.get(1).raster.get("B8", 1, 1), 0);
    assertTrue(frames.get(0).metadata.get("source").endsWith("2020-04-01_T31.tif"));
  }

  @Test
  public void ndviFromStoredBands() throws Exception {
    PipelineConfig config = PipelineConfig.load(null, "baseline.start=2020", "baseline.end=2020",
        "target.years=2021", "aggregation.op=mean");
    RasterTimeSeriesSource source = config.wrapSource(
        new DirectoryFrameSource("S2", dir.getAbsolutePath(), config.noDataSentinel));
    SeasonalCompositor compositor = new SeasonalCompositor(GRID, StudyArea.covering(GRID), 0);
    CompositeImage composite = compositor.compositeYear(source, 2020, config.window, "NDVI",
        config.aggregationOp);
    assertEquals(DataPresence.DATA, composite.presence);
    assertEquals(2, composite.sourceFrameCount);
    double first = (0.6f - 0.2f) / (double) (0.6f + 0.2f);
    double second = (0.5f - 0.1f) / (double) (0.5f + 0.1f);
    assertEquals((first + second) / 2, composite.raster.get("NDVI", 1, 0), 1e-6);
    // Masked in one frame, so only the other contributes.
    assertEquals(second, composite.raster.get("NDVI", 0, 0), 1e-6);
  }
}
