package org.dhuo.anomalytrend;

/**
 * Whether a composite was computed from frames or substituted with the constant fallback.
 */
public enum DataPresence {
  DATA,
  FALLBACK
}
