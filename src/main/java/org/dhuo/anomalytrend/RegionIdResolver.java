package org.dhuo.anomalytrend;

import java.util.List;
import java.util.Map;

/**
 * Picks the identifier a region is reported under: the first non-blank name property, else the
 * feature's stable id, else its position in the input.
 */
public class RegionIdResolver {
  public static String resolve(Map<String, ?> properties, String featureId, int index,
      List<String> nameProperties) {
    if (properties != null) {
      for (String key : nameProperties) {
        Object value = properties.get(key);
        if (value != null && !value.toString().trim().isEmpty()) {
          return value.toString().trim();
        }
      }
    }
    if (featureId != null && !featureId.trim().isEmpty()) {
      return featureId.trim();
    }
    return String.valueOf(index);
  }
}
