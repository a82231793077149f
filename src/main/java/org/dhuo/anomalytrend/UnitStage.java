package org.dhuo.anomalytrend;

/**
 * Stages a compositing unit walks through, in order. Only {@link #FINALIZED} composites are
 * handed downstream.
 */
public enum UnitStage {
  RAW_FRAMES_FILTERED,
  AGGREGATED,
  BAND_PRESENCE_CHECKED,
  DATA_PRESENCE_CHECKED,
  FINALIZED;

  public UnitStage next() {
    if (this == FINALIZED) {
      throw new IllegalStateException("FINALIZED is terminal");
    }
    return values()[ordinal() + 1];
  }
}
