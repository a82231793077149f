package org.dhuo.anomalytrend;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A header plus rows of already formatted cells. Missing values are empty cells.
 */
public class ResultTable {
  public final List<String> header;
  public final List<List<String>> rows = new ArrayList<List<String>>();

  public ResultTable(String... header) {
    this.header = Collections.unmodifiableList(Arrays.asList(header));
  }

  public void addRow(Object... cells) {
    if (cells.length != header.size()) {
      throw new IllegalArgumentException(
          "Row has " + cells.length + " cells, header has " + header.size());
    }
    List<String> row = new ArrayList<String>();
    for (Object cell : cells) {
      row.add(cell == null ? "" : cell.toString());
    }
    rows.add(row);
  }

  /** One row per region: {@code region_id, slope, intercept, points_used}. */
  public static ResultTable trendTable(Map<String, TrendResult> trends) {
    ResultTable table = new ResultTable("region_id", "slope", "intercept", "points_used");
    for (Map.Entry<String, TrendResult> entry : trends.entrySet()) {
      TrendResult trend = entry.getValue();
      table.addRow(entry.getKey(), trend.slope, trend.intercept, trend.pointsUsed);
    }
    return table;
  }

  public static ResultTable regionYearTable(Map<UnitKey, RegionYearValue> values) {
    ResultTable table = new ResultTable("region_id", "year", "value", "presence");
    for (RegionYearValue value : values.values()) {
      table.addRow(value.regionId, value.year, value.value, value.presence);
    }
    return table;
  }

  public static ResultTable studyAreaTable(Map<Integer, RegionYearValue> series) {
    ResultTable table = new ResultTable("year", "value", "presence");
    for (RegionYearValue value : series.values()) {
      table.addRow(value.year, value.value, value.presence);
    }
    return table;
  }

  public static ResultTable reportTable(RunReport report) {
    ResultTable table = new ResultTable("key", "value");
    table.addRow("years_composited", report.yearsComposited);
    table.addRow("fallback_years", report.fallbackYears);
    table.addRow("frames_matched", report.framesMatched);
    table.addRow("regions", report.regions);
    table.addRow("units_processed", report.unitsProcessed);
    table.addRow("trend_pixels", report.trendPixels);
    table.addRow("failed_units", report.failures.size());
    for (String failure : report.failures) {
      table.addRow("failure", failure);
    }
    table.addRow("elapsed_seconds", String.format("%.2f", report.elapsedSeconds));
    return table;
  }
}
