package org.dhuo.anomalytrend;

import java.io.Serializable;
import java.time.LocalDate;

/**
 * Closed interval of calendar days.
 */
public class DateRange implements Serializable {
  public final LocalDate start;
  public final LocalDate end;

  public DateRange(LocalDate start, LocalDate end) {
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("Range ends " + end + " before it starts " + start);
    }
    this.start = start;
    this.end = end;
  }

  public boolean contains(LocalDate date) {
    return !date.isBefore(start) && !date.isAfter(end);
  }

  /** Smallest range covering both. */
  public DateRange span(DateRange other) {
    return new DateRange(
        start.isBefore(other.start) ? start : other.start,
        end.isAfter(other.end) ? end : other.end);
  }

  @Override
  public String toString() {
    return start + ".." + end;
  }
}
