package org.dhuo.anomalytrend;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One dated acquisition as handed out by a {@link RasterTimeSeriesSource}.
 */
public class RasterFrame implements Serializable {
  public final LocalDate date;
  public final Raster raster;
  public final Map<String, String> metadata;

  public RasterFrame(LocalDate date, Raster raster) {
    this(date, raster, Collections.<String, String>emptyMap());
  }

  public RasterFrame(LocalDate date, Raster raster, Map<String, String> metadata) {
    this.date = date;
    this.raster = raster;
    this.metadata = Collections.unmodifiableMap(new TreeMap<String, String>(metadata));
  }

  public boolean hasBand(String band) {
    return raster.hasBand(band);
  }

  public RasterFrame withRaster(Raster replacement) {
    return new RasterFrame(date, replacement, metadata);
  }

  @Override
  public String toString() {
    return "RasterFrame[" + date + " " + raster.getBandNames() + "]";
  }
}
