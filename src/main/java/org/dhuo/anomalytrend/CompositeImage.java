package org.dhuo.anomalytrend;

import java.io.Serializable;
import java.time.LocalDate;

/**
 * The seasonal composite for one (year, band). Exactly one exists per requested year: when no
 * usable frames were found it holds the constant fallback raster and is tagged
 * {@link DataPresence#FALLBACK}, with {@link #reason} saying why.
 */
public class CompositeImage implements Serializable {
  public final int year;
  public final String band;
  public final Raster raster;
  public final AggregationOp op;
  public final int sourceFrameCount;
  public final DataPresence presence;
  public final LocalDate windowStart;
  public final LocalDate windowEnd;
  // Null for DATA composites.
  public final String reason;

  public CompositeImage(int year, String band, Raster raster, AggregationOp op,
      int sourceFrameCount, DataPresence presence, LocalDate windowStart, LocalDate windowEnd,
      String reason) {
    this.year = year;
    this.band = band;
    this.raster = raster;
    this.op = op;
    this.sourceFrameCount = sourceFrameCount;
    this.presence = presence;
    this.windowStart = windowStart;
    this.windowEnd = windowEnd;
    this.reason = reason;
  }

  public boolean hasData() {
    return presence == DataPresence.DATA;
  }

  public GridGeometry getGrid() {
    return raster.getGrid();
  }

  @Override
  public String toString() {
    return String.format("CompositeImage[%d %s %s frames=%d %s%s]", year, band, op,
        sourceFrameCount, presence, reason == null ? "" : " (" + reason + ")");
  }
}
