package org.dhuo.anomalytrend;

import java.io.Serializable;

/**
 * Either the value a unit produced or the reason it failed. Lets a batch carry fatal unit errors
 * to the driver without aborting sibling units.
 */
public class UnitOutcome<T extends Serializable> implements Serializable {
  public final T value;
  public final String failure;

  private UnitOutcome(T value, String failure) {
    this.value = value;
    this.failure = failure;
  }

  public static <T extends Serializable> UnitOutcome<T> ok(T value) {
    return new UnitOutcome<T>(value, null);
  }

  public static <T extends Serializable> UnitOutcome<T> failed(String failure) {
    return new UnitOutcome<T>(null, failure);
  }

  public boolean isOk() {
    return failure == null;
  }
}
