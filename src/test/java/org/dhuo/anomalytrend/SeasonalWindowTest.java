package org.dhuo.anomalytrend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import java.time.LocalDate;

public class SeasonalWindowTest {
  @Test
  public void bothEndsAreInclusive() {
    SeasonalWindow window = SeasonalWindow.parse("03-01", "09-30");
    assertTrue(window.contains(LocalDate.of(2020, 3, 1), 2020));
    assertTrue(window.contains(LocalDate.of(2020, 9, 30), 2020));
    assertFalse(window.contains(LocalDate.of(2020, 2, 29), 2020));
    assertFalse(window.contains(LocalDate.of(2020, 10, 1), 2020));
    assertFalse(window.contains(LocalDate.of(2021, 5, 1), 2020));
  }

  @Test
  public void windowStartingAfterItsEndRunsIntoNextYear() {
    SeasonalWindow window = SeasonalWindow.parse("11-01", "02-28");
    assertTrue(window.wrapsYearEnd());
    assertEquals(LocalDate.of(2020, 11, 1), window.startDate(2020));
    assertEquals(LocalDate.of(2021, 2, 28), window.endDate(2020));
    assertTrue(window.contains(LocalDate.of(2021, 1, 15), 2020));
    assertFalse(window.contains(LocalDate.of(2020, 1, 15), 2020));
  }

  @Test
  public void leapDayResolvesToFeb28OffLeapYears() {
    SeasonalWindow window = SeasonalWindow.parse("02-01", "02-29");
    assertEquals(LocalDate.of(2020, 2, 29), window.endDate(2020));
    assertEquals(LocalDate.of(2021, 2, 28), window.endDate(2021));
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsMalformedBounds() {
    SeasonalWindow.parse("3/1", "09-30");
  }
}
