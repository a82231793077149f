package org.dhuo.anomalytrend;

import java.util.ArrayList;
import java.util.List;

/**
 * What a batch run did, for the final report table.
 */
public class RunReport {
  public int yearsComposited;
  public int fallbackYears;
  public long framesMatched;
  public int regions;
  public int unitsProcessed;
  public long trendPixels;
  public List<String> failures = new ArrayList<String>();
  public double elapsedSeconds;
}
