package org.dhuo.anomalytrend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.apache.hadoop.conf.Configuration;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Collections;

public class PipelineConfigTest {
  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @Test
  public void bundledDefaults() {
    PipelineConfig config = PipelineConfig.load(null);
    assertEquals("NDVI", config.bandName);
    assertEquals(SpectralIndex.NDVI, config.index);
    assertEquals(AggregationOp.percentile(95), config.aggregationOp);
    assertEquals("03-01..09-30", config.window.toString());
    assertEquals(Arrays.asList(2019, 2020, 2021, 2022), config.baselineYears());
    assertEquals(Arrays.asList(2023, 2024), config.targetYears);
    // Empty trend years means baseline plus targets.
    assertEquals(Arrays.asList(2019, 2020, 2021, 2022, 2023, 2024), config.trendYears);
    assertEquals(RegionReducer.MEAN, config.regionReducer);
    assertEquals(-9999, config.noDataSentinel, 0);
    assertEquals(Collections.singletonList("Name"), config.regionNameProperties);
    assertTrue(config.wrapSource(new InMemoryFrameSource("x", RasterFixtures.GRID,
        Collections.<RasterFrame>emptyList())) instanceof IndexedFrameSource);
  }

  @Test
  public void siteFileThenOverrides() throws Exception {
    File site = tmp.newFile("site.xml");
    PrintStream out = new PrintStream(site, "UTF-8");
    out.println("<?xml version=\"1.0\"?><configuration>");
    out.println("<property><name>anomalytrend.band</name><value>VV</value></property>");
    out.println("<property><name>anomalytrend.index</name><value>none</value></property>");
    out.println("<property><name>anomalytrend.season.start</name><value>11-01</value></property>");
    out.println("<property><name>anomalytrend.season.end</name><value>02-28</value></property>");
    out.println("</configuration>");
    out.close();

    PipelineConfig config = PipelineConfig.load(site.getAbsolutePath(),
        "target.years=2020-2022", "anomalytrend.trend.years=2015,2018-2019",
        "aggregation.op=median", "unit.scale=1000");
    assertEquals("VV", config.bandName);
    assertEquals(SpectralIndex.NONE, config.index);
    assertTrue(config.window.wrapsYearEnd());
    assertEquals(Arrays.asList(2020, 2021, 2022), config.targetYears);
    assertEquals(Arrays.asList(2015, 2018, 2019), config.trendYears);
    assertEquals(AggregationOp.median(), config.aggregationOp);
    assertEquals(1000, config.unitScale, 0);
    assertEquals(Arrays.asList(2015, 2018, 2019, 2020, 2021, 2022), config.allYears());
  }

  @Test(expected = IllegalArgumentException.class)
  public void baselineMustNotRunBackwards() {
    PipelineConfig.load(null, "baseline.start=2023", "baseline.end=2019");
  }

  @Test(expected = IllegalArgumentException.class)
  public void indexMustProduceTheConfiguredBand() {
    PipelineConfig.load(null, "band=EVI");
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsMalformedYears() {
    PipelineConfig.load(null, "target.years=twenty");
  }

  @Test(expected = IllegalArgumentException.class)
  public void missingRequiredKey() {
    Configuration conf = new Configuration(false);
    conf.addResource(PipelineConfig.DEFAULT_RESOURCE);
    conf.set(PipelineConfig.PREFIX + "dataset.id", "");
    PipelineConfig.fromConfiguration(conf);
  }
}
