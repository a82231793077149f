package org.dhuo.anomalytrend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class AggregationOpTest {
  @Test
  public void parsesPercentilesAndNames() {
    AggregationOp p95 = AggregationOp.parse("p95");
    assertEquals(AggregationOp.Kind.PERCENTILE, p95.kind);
    assertEquals(95, p95.percentile, 0);
    assertEquals("p95", p95.toString());
    assertEquals(AggregationOp.median(), AggregationOp.parse(" MEDIAN "));
    assertEquals(AggregationOp.sum(), AggregationOp.parse("sum"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsUnknownOperator() {
    AggregationOp.parse("mode");
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsPercentileOutOfRange() {
    AggregationOp.percentile(0);
  }

  @Test
  public void reducesOnlyTheFirstNValues() {
    double[] values = {5, 1, 100};
    assertEquals(5, AggregationOp.of(AggregationOp.Kind.MAX).reduce(values, 2), 0);
    assertEquals(6, AggregationOp.sum().reduce(values, 2), 0);
    assertEquals(3, AggregationOp.of(AggregationOp.Kind.MEAN).reduce(values, 2), 0);
    assertEquals(1, AggregationOp.of(AggregationOp.Kind.MIN).reduce(values, 3), 0);
  }

  @Test
  public void medianAndPercentile() {
    assertEquals(2.5, AggregationOp.median().reduce(new double[] {4, 1, 3, 2}, 4), 1e-12);
    double[] ramp = new double[20];
    for (int i = 0; i < ramp.length; ++i) {
      ramp[i] = i + 1;
    }
    assertEquals(19.95, AggregationOp.percentile(95).reduce(ramp, 20), 1e-9);
  }

  @Test
  public void noSamplesStaysMasked() {
    assertTrue(Double.isNaN(AggregationOp.sum().reduce(new double[4], 0)));
    assertTrue(Double.isNaN(AggregationOp.percentile(95).reduce(new double[4], 0)));
  }
}
