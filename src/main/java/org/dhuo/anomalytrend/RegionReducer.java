package org.dhuo.anomalytrend;

import org.apache.commons.math3.stat.descriptive.StatisticalSummary;

import java.util.Locale;

/**
 * Statistic a region is reduced to. All of them can be merged across tiles.
 */
public enum RegionReducer {
  MEAN,
  COUNT,
  SUM,
  MIN,
  MAX,
  STD_DEV;

  public static RegionReducer parse(String text) {
    try {
      return valueOf(text.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown region reducer: " + text, e);
    }
  }

  double extract(StatisticalSummary stats) {
    switch (this) {
      case MEAN:
        return stats.getMean();
      case COUNT:
        return stats.getN();
      case SUM:
        return stats.getSum();
      case MIN:
        return stats.getMin();
      case MAX:
        return stats.getMax();
      case STD_DEV:
        return stats.getStandardDeviation();
      default:
        throw new IllegalStateException("Unhandled reducer " + this);
    }
  }
}
