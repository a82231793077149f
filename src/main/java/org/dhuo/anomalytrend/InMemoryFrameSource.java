package org.dhuo.anomalytrend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Serves frames from a list held in memory.
 */
public class InMemoryFrameSource extends AbstractFrameSource {
  private final GridGeometry grid;
  private final List<RasterFrame> frames;
  private final Set<String> schemaBands;

  /** Schema is the union of the bands the frames carry. */
  public InMemoryFrameSource(String datasetId, GridGeometry grid, List<RasterFrame> frames) {
    this(datasetId, grid, frames, bandsOf(frames));
  }

  public InMemoryFrameSource(String datasetId, GridGeometry grid, List<RasterFrame> frames,
      Set<String> schemaBands) {
    super(datasetId);
    this.grid = grid;
    this.frames = new ArrayList<RasterFrame>(frames);
    this.schemaBands = Collections.unmodifiableSet(new LinkedHashSet<String>(schemaBands));
  }

  private static Set<String> bandsOf(List<RasterFrame> frames) {
    Set<String> bands = new LinkedHashSet<String>();
    for (RasterFrame frame : frames) {
      bands.addAll(frame.raster.getBandNames());
    }
    return bands;
  }

  @Override
  public GridGeometry getGrid() {
    return grid;
  }

  @Override
  public Set<String> getSchemaBands() {
    return schemaBands;
  }

  @Override
  protected List<RasterFrame> framesIn(DateRange range) {
    List<RasterFrame> ret = new ArrayList<RasterFrame>();
    for (RasterFrame frame : frames) {
      if (range.contains(frame.date)) ret.add(frame);
    }
    return ret;
  }
}
