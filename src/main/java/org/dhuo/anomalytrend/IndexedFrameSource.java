package org.dhuo.anomalytrend;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decorates a source so a {@link SpectralIndex} band can be queried like any stored band.
 */
public class IndexedFrameSource implements RasterTimeSeriesSource {
  private final RasterTimeSeriesSource delegate;
  private final SpectralIndex index;

  public IndexedFrameSource(RasterTimeSeriesSource delegate, SpectralIndex index) {
    if (index == SpectralIndex.NONE) {
      throw new IllegalArgumentException("Wrap only for a real index");
    }
    this.delegate = delegate;
    this.index = index;
  }

  @Override
  public String getDatasetId() {
    return delegate.getDatasetId();
  }

  @Override
  public GridGeometry getGrid() throws IOException {
    return delegate.getGrid();
  }

  @Override
  public Set<String> getSchemaBands() throws IOException {
    Set<String> bands = new LinkedHashSet<String>(delegate.getSchemaBands());
    if (bands.contains(index.firstInput) && bands.contains(index.secondInput)) {
      bands.add(index.bandName);
    }
    return bands;
  }

  @Override
  public List<RasterFrame> query(Footprint geometry, DateRange range, List<String> bandNames)
      throws IOException {
    if (!bandNames.contains(index.bandName)) {
      return delegate.query(geometry, range, bandNames);
    }
    List<String> upstream = new ArrayList<String>();
    for (String band : bandNames) {
      if (!band.equals(index.bandName)) upstream.add(band);
    }
    upstream.add(index.firstInput);
    upstream.add(index.secondInput);
    List<RasterFrame> ret = new ArrayList<RasterFrame>();
    for (RasterFrame frame : delegate.query(geometry, range, upstream)) {
      Raster raster = frame.raster;
      if (raster.hasBand(index.firstInput) && raster.hasBand(index.secondInput)) {
        raster = raster.addBands(index.compute(raster));
      }
      ret.add(AbstractFrameSource.restrict(frame.withRaster(raster), bandNames));
    }
    return ret;
  }
}
