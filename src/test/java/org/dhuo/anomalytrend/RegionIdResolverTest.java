package org.dhuo.anomalytrend;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class RegionIdResolverTest {
  private static final List<String> NAME = Collections.singletonList("Name");

  @Test
  public void namePropertyWins() {
    Map<String, Object> props = new HashMap<String, Object>();
    props.put("Name", " North field ");
    assertEquals("North field", RegionIdResolver.resolve(props, "f-7", 3, NAME));
  }

  @Test
  public void blankNameFallsBackToFeatureId() {
    Map<String, Object> props = new HashMap<String, Object>();
    props.put("Name", "   ");
    assertEquals("f-7", RegionIdResolver.resolve(props, "f-7", 3, NAME));
  }

  @Test
  public void indexIsTheLastResort() {
    assertEquals("3", RegionIdResolver.resolve(new HashMap<String, Object>(), " ", 3, NAME));
    assertEquals("0", RegionIdResolver.resolve(null, null, 0, NAME));
  }

  @Test
  public void namePropertiesAreTriedInOrder() {
    Map<String, Object> props = new HashMap<String, Object>();
    props.put("NAME_2", "District");
    props.put("label", 42);
    assertEquals("District",
        RegionIdResolver.resolve(props, null, 0, Arrays.asList("Name", "NAME_2", "label")));
    assertEquals("42", RegionIdResolver.resolve(props, null, 0, Arrays.asList("label", "NAME_2")));
  }
}
