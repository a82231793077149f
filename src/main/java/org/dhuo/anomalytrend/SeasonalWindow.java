package org.dhuo.anomalytrend;

import java.io.Serializable;
import java.time.LocalDate;
import java.time.MonthDay;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Month/day window re-applied to every calendar year. Both ends are inclusive. A window whose
 * start falls after its end (for example Nov 1 to Feb 28) runs into the following year.
 */
public class SeasonalWindow implements Serializable {
  private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("MM-dd");

  public final MonthDay start;
  public final MonthDay end;

  public SeasonalWindow(MonthDay start, MonthDay end) {
    this.start = start;
    this.end = end;
  }

  /** Parses {@code MM-dd} bounds such as {@code 03-01} and {@code 09-30}. */
  public static SeasonalWindow parse(String start, String end) {
    try {
      return new SeasonalWindow(
          MonthDay.parse(start.trim(), FORMAT), MonthDay.parse(end.trim(), FORMAT));
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException(
          "Seasonal window bounds must look like MM-dd, got " + start + " / " + end, e);
    }
  }

  public boolean wrapsYearEnd() {
    return start.isAfter(end);
  }

  /** First day of the window anchored at {@code year}. Feb 29 becomes Feb 28 off leap years. */
  public LocalDate startDate(int year) {
    return start.atYear(year);
  }

  public LocalDate endDate(int year) {
    return end.atYear(wrapsYearEnd() ? year + 1 : year);
  }

  public DateRange range(int year) {
    return new DateRange(startDate(year), endDate(year));
  }

  public boolean contains(LocalDate date, int year) {
    return range(year).contains(date);
  }

  @Override
  public String toString() {
    return FORMAT.format(start) + ".." + FORMAT.format(end);
  }
}
