package org.dhuo.anomalytrend;

import static org.junit.Assert.assertEquals;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

public class CsvTableExporterTest {
  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @Test
  public void undefinedTrendsAreEmptyFields() throws Exception {
    SortedMap<String, TrendResult> trends = new TreeMap<String, TrendResult>();
    trends.put("b", TrendResult.undefined(1));
    trends.put("a", new TrendResult(0.5, 1.0, 3));
    File out = new File(tmp.getRoot(), "trend_stats.csv");
    new CsvTableExporter().save(ResultTable.trendTable(trends), out.getAbsolutePath(),
        ExportFormat.CSV, 0);

    List<String> lines = Files.readAllLines(out.toPath(), StandardCharsets.UTF_8);
    assertEquals(Arrays.asList("region_id,slope,intercept,points_used", "a,0.5,1.0,3", "b,,,1"),
        lines);
  }

  @Test
  public void regionYearRowsFollowKeyOrder() throws Exception {
    SortedMap<UnitKey, RegionYearValue> values = new TreeMap<UnitKey, RegionYearValue>();
    for (RegionYearValue value : new RegionYearValue[] {
        new RegionYearValue("north", 2021, 0.25, DataPresence.DATA),
        new RegionYearValue("north", 2020, null, DataPresence.FALLBACK),
        new RegionYearValue("east", 2021, 0.5, DataPresence.DATA)}) {
      values.put(value.key(), value);
    }
    File out = new File(tmp.getRoot(), "region_year_stats.csv");
    new CsvTableExporter().save(ResultTable.regionYearTable(values), out.getAbsolutePath(),
        ExportFormat.CSV, 0);
    assertEquals(Arrays.asList("region_id,year,value,presence", "east,2021,0.5,DATA",
        "north,2020,,FALLBACK", "north,2021,0.25,DATA"),
        Files.readAllLines(out.toPath(), StandardCharsets.UTF_8));
  }

  @Test
  public void quotesCellsThatNeedIt() {
    assertEquals("plain", CsvTableExporter.quote("plain"));
    assertEquals("\"a,b\"", CsvTableExporter.quote("a,b"));
    assertEquals("\"say \"\"hi\"\"\"", CsvTableExporter.quote("say \"hi\""));
    assertEquals("x,\"y,z\",", CsvTableExporter.line(Arrays.asList("x", "y,z", "")));
  }

  @Test
  public void reportListsFailures() {
    RunReport report = new RunReport();
    report.regions = 2;
    report.failures.add("bad/2020: bad: region has no rings");
    ResultTable table = ResultTable.reportTable(report);
    assertEquals(Arrays.asList("failed_units", "1"), table.rows.get(6));
    assertEquals(Arrays.asList("failure", "bad/2020: bad: region has no rings"),
        table.rows.get(7));
  }

  @Test(expected = IllegalArgumentException.class)
  public void rowsMustMatchHeader() {
    new ResultTable("a", "b").addRow("only one");
  }
}
