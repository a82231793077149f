package org.dhuo.anomalytrend;

import java.io.Serializable;

/**
 * A region's statistics for one year's composite. {@link #value} is the configured statistic and
 * {@link #mean} the area-weighted mean that per-region trends are fitted on; both are null when
 * the composite was a fallback or no unmasked pixel fell inside the region.
 */
public class RegionYearValue implements Serializable {
  public final String regionId;
  public final int year;
  public final Double value;
  public final Double mean;
  public final DataPresence presence;

  public RegionYearValue(String regionId, int year, Double value, Double mean,
      DataPresence presence) {
    this.regionId = regionId;
    this.year = year;
    this.value = value;
    this.mean = mean;
    this.presence = presence;
  }

  /** For statistics where the configured one is the mean. */
  public RegionYearValue(String regionId, int year, Double mean, DataPresence presence) {
    this(regionId, year, mean, mean, presence);
  }

  public UnitKey key() {
    return new UnitKey(regionId, year);
  }

  @Override
  public String toString() {
    return "RegionYearValue[" + regionId + "/" + year + " " + value + " " + presence + "]";
  }
}
