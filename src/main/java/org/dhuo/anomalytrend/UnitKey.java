package org.dhuo.anomalytrend;

import java.io.Serializable;

/**
 * Key of one (region, year) unit of work; orders by region id, then year.
 */
public class UnitKey implements Comparable<UnitKey>, Serializable {
  public final String regionId;
  public final int year;

  public UnitKey(String regionId, int year) {
    this.regionId = regionId;
    this.year = year;
  }

  @Override
  public int compareTo(UnitKey other) {
    int byRegion = regionId.compareTo(other.regionId);
    return byRegion != 0 ? byRegion : Integer.compare(year, other.year);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof UnitKey)) return false;
    UnitKey other = (UnitKey) o;
    return regionId.equals(other.regionId) && year == other.year;
  }

  @Override
  public int hashCode() {
    return regionId.hashCode() * 31 + year;
  }

  @Override
  public String toString() {
    return regionId + "/" + year;
  }
}
