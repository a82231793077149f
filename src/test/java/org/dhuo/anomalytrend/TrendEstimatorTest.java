package org.dhuo.anomalytrend;

import static org.dhuo.anomalytrend.RasterFixtures.data;
import static org.dhuo.anomalytrend.RasterFixtures.fallback;
import static org.dhuo.anomalytrend.RasterFixtures.filled;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import java.util.Arrays;
import java.util.SortedMap;
import java.util.TreeMap;

public class TrendEstimatorTest {
  @Test
  public void recoversExactLine() {
    SortedMap<Integer, Double> series = new TreeMap<Integer, Double>();
    for (int year = 2015; year <= 2020; ++year) {
      series.put(year, 0.5 * year - 1000);
    }
    TrendResult trend = TrendEstimator.fitTrend(series);
    assertTrue(trend.isDefined());
    assertEquals(0.5, trend.slope, 1e-6);
    assertEquals(-1000, trend.intercept, 1e-6);
    assertEquals(6, trend.pointsUsed);
  }

  @Test
  public void nullPointsAreExcluded() {
    SortedMap<Integer, Double> series = new TreeMap<Integer, Double>();
    series.put(2018, 1.0);
    series.put(2019, null);
    series.put(2020, 3.0);
    TrendResult trend = TrendEstimator.fitTrend(series);
    assertEquals(2, trend.pointsUsed);
    assertEquals(1, trend.slope, 1e-9);
  }

  @Test
  public void singleValidPointIsUndefined() {
    SortedMap<Integer, Double> series = new TreeMap<Integer, Double>();
    series.put(2019, null);
    series.put(2020, 0.4);
    TrendResult trend = TrendEstimator.fitTrend(series);
    assertFalse(trend.isDefined());
    assertNull(trend.slope);
    assertNull(trend.intercept);
    assertEquals(1, trend.pointsUsed);
  }

  @Test
  public void emptySeriesIsUndefined() {
    TrendResult trend = TrendEstimator.fitTrend(new TreeMap<Integer, Double>());
    assertFalse(trend.isDefined());
    assertEquals(0, trend.pointsUsed);
  }

  @Test
  public void pixelWiseFitSkipsFallbackYears() {
    TrendRaster trend = TrendEstimator.fitTrend(Arrays.asList(
        data(2018, "NDVI", filled(1)),
        fallback(2019, "NDVI"),
        data(2020, "NDVI", filled(5))));
    assertEquals(2, trend.coefficients.get(TrendRaster.SLOPE, 0, 0), 1e-9);
    assertEquals(2, trend.pointsUsed.get(TrendRaster.POINTS_USED, 3, 3), 0);
    assertEquals(RasterFixtures.GRID.size(), trend.definedPixelCount());
    assertEquals(Arrays.asList(2018, 2019, 2020), trend.years);
  }

  @Test
  public void pixelWithOnePointStaysMasked() {
    double[] sparse = filled(2);
    sparse[5] = Double.NaN;
    TrendRaster trend = TrendEstimator.fitTrend(Arrays.asList(
        data(2018, "NDVI", filled(1)), data(2019, "NDVI", sparse)));
    assertTrue(trend.coefficients.isMasked(TrendRaster.SLOPE, 1, 1));
    assertTrue(trend.coefficients.isMasked(TrendRaster.INTERCEPT, 1, 1));
    assertEquals(1, trend.pointsUsed.get(TrendRaster.POINTS_USED, 1, 1), 0);
    assertEquals(1, trend.slope().get(TrendRaster.SLOPE, 0, 0), 1e-9);
    assertEquals(RasterFixtures.GRID.size() - 1, trend.definedPixelCount());
  }

  @Test(expected = IllegalArgumentException.class)
  public void duplicateYearIsRejected() {
    TrendEstimator.fitTrend(Arrays.asList(
        data(2018, "NDVI", filled(1)), data(2018, "NDVI", filled(2))));
  }
}
