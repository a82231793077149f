package org.dhuo.anomalytrend;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.io.Serializable;
import java.util.Locale;

/**
 * Per-pixel reducer used to collapse the frames of a seasonal window into one composite.
 */
public class AggregationOp implements Serializable {
  public enum Kind {
    SUM,
    MEAN,
    MEDIAN,
    MIN,
    MAX,
    PERCENTILE
  }

  public final Kind kind;
  // Only meaningful for PERCENTILE; in (0, 100].
  public final double percentile;

  private AggregationOp(Kind kind, double percentile) {
    this.kind = kind;
    this.percentile = percentile;
  }

  public static AggregationOp of(Kind kind) {
    if (kind == Kind.PERCENTILE) {
      throw new IllegalArgumentException("Use percentile(p) for PERCENTILE");
    }
    return new AggregationOp(kind, Double.NaN);
  }

  public static AggregationOp sum() {
    return of(Kind.SUM);
  }

  public static AggregationOp median() {
    return of(Kind.MEDIAN);
  }

  public static AggregationOp percentile(double p) {
    if (!(p > 0 && p <= 100)) {
      throw new IllegalArgumentException("Percentile must be in (0, 100], got " + p);
    }
    return new AggregationOp(Kind.PERCENTILE, p);
  }

  /**
   * Parses {@code sum}, {@code mean}, {@code median}, {@code min}, {@code max} or {@code pNN}
   * (e.g. {@code p95}).
   */
  public static AggregationOp parse(String text) {
    String token = text.trim().toLowerCase(Locale.ROOT);
    if (token.startsWith("p") && token.length() > 1 && Character.isDigit(token.charAt(1))) {
      try {
        return percentile(Double.parseDouble(token.substring(1)));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Bad percentile operator: " + text, e);
      }
    }
    try {
      return of(Kind.valueOf(token.toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown aggregation operator: " + text, e);
    }
  }

  /**
   * Reduces the first {@code n} entries of {@code values}, all of which must be unmasked.
   * Returns {@code NaN} when {@code n} is zero so an empty pixel stays masked.
   */
  public double reduce(double[] values, int n) {
    if (n == 0) return Double.NaN;
    switch (kind) {
      case SUM: {
        double sum = 0;
        for (int i = 0; i < n; ++i) sum += values[i];
        return sum;
      }
      case MEAN: {
        double sum = 0;
        for (int i = 0; i < n; ++i) sum += values[i];
        return sum / n;
      }
      case MIN: {
        double min = values[0];
        for (int i = 1; i < n; ++i) min = Math.min(min, values[i]);
        return min;
      }
      case MAX: {
        double max = values[0];
        for (int i = 1; i < n; ++i) max = Math.max(max, values[i]);
        return max;
      }
      case MEDIAN:
        return new Percentile(50).evaluate(values, 0, n);
      case PERCENTILE:
        return new Percentile(percentile).evaluate(values, 0, n);
      default:
        throw new IllegalStateException("Unhandled kind " + kind);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof AggregationOp)) return false;
    AggregationOp other = (AggregationOp) o;
    return kind == other.kind && Double.compare(percentile, other.percentile) == 0;
  }

  @Override
  public int hashCode() {
    return kind.hashCode() * 31 + Double.valueOf(percentile).hashCode();
  }

  @Override
  public String toString() {
    if (kind == Kind.PERCENTILE) {
      return "p" + (percentile == Math.rint(percentile)
          ? String.valueOf((long) percentile) : String.valueOf(percentile));
    }
    return kind.name().toLowerCase(Locale.ROOT);
  }
}
