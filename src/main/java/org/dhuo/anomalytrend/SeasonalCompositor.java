package org.dhuo.anomalytrend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reduces the frames falling in one year's seasonal window to a single composite.
 *
 * <p>The result is always usable downstream: if the window holds no frames, if none of them
 * carry the band, or if nothing survives inside the study area, a constant fallback raster is
 * returned instead, tagged {@link DataPresence#FALLBACK}. Only a band missing from the dataset
 * schema is fatal.
 */
public class SeasonalCompositor {
  private static final Logger LOG = LoggerFactory.getLogger(SeasonalCompositor.class);

  private final GridGeometry grid;
  private final Footprint studyArea;
  private final double fallbackValue;

  public SeasonalCompositor(GridGeometry grid, Footprint studyArea, double fallbackValue) {
    this.grid = grid;
    this.studyArea = studyArea;
    this.fallbackValue = fallbackValue;
  }

  public GridGeometry getGrid() {
    return grid;
  }

  public Footprint getStudyArea() {
    return studyArea;
  }

  /**
   * Composites {@code year} from {@code frames}, which are expected to be already filtered to
   * the study geometry and some overall date range that may span many years.
   */
  public CompositeImage composite(List<RasterFrame> frames, int year, SeasonalWindow window,
      String band, AggregationOp op) {
    LocalDate windowStart = window.startDate(year);
    LocalDate windowEnd = window.endDate(year);
    DateRange range = new DateRange(windowStart, windowEnd);
    UnitStage stage = UnitStage.RAW_FRAMES_FILTERED;

    List<RasterFrame> inWindow = new ArrayList<RasterFrame>();
    for (RasterFrame frame : frames) {
      if (range.contains(frame.date)) {
        if (!frame.raster.getGrid().equals(grid)) {
          throw new IllegalArgumentException("Frame " + frame.date + " is on "
              + frame.raster.getGrid() + ", expected " + grid);
        }
        inWindow.add(frame);
      }
    }
    int frameCount = inWindow.size();
    LOG.debug("{} {}: {} with {} frames", year, band, stage, frameCount);

    stage = stage.next();
    Raster aggregated = aggregate(inWindow, band, op);
    LOG.debug("{} {}: {}", year, band, stage);

    stage = stage.next();
    String reason = null;
    if (frameCount == 0) {
      reason = "no frames between " + windowStart + " and " + windowEnd;
    } else if (aggregated == null) {
      reason = "none of " + frameCount + " frames carry band " + band;
    }
    LOG.debug("{} {}: {}", year, band, stage);

    stage = stage.next();
    Raster clipped = null;
    if (reason == null) {
      clipped = aggregated.clip(studyArea);
      if (clipped.countUnmasked(band) == 0) {
        reason = "no unmasked pixels inside the study area";
      }
    }
    LOG.debug("{} {}: {}", year, band, stage);

    stage = stage.next();
    CompositeImage ret;
    if (reason == null) {
      ret = new CompositeImage(year, band, clipped, op, frameCount, DataPresence.DATA,
          windowStart, windowEnd, null);
    } else {
      LOG.info("Falling back to constant {} for {} {}: {}", fallbackValue, year, band, reason);
      ret = new CompositeImage(year, band, fallbackRaster(band), op, frameCount,
          DataPresence.FALLBACK, windowStart, windowEnd, reason);
    }
    LOG.debug("{} {}: {} as {}", year, band, stage, ret.presence);
    return ret;
  }

  /**
   * Queries {@code source} once for the whole span of {@code years} and composites each of them.
   * Exactly one composite per year comes back, in the order requested.
   *
   * @throws SchemaMismatchException if the dataset has no band {@code band}.
   */
  public List<CompositeImage> compositeYears(RasterTimeSeriesSource source, List<Integer> years,
      SeasonalWindow window, String band, AggregationOp op)
      throws SchemaMismatchException, IOException {
    checkSchema(source, band);
    Set<Integer> distinct = new LinkedHashSet<Integer>(years);
    if (distinct.size() != years.size()) {
      throw new IllegalArgumentException("Duplicate years in " + years);
    }
    if (years.isEmpty()) {
      return Collections.emptyList();
    }
    DateRange span = null;
    for (Integer year : years) {
      DateRange range = window.range(year);
      span = span == null ? range : span.span(range);
    }
    List<RasterFrame> frames = source.query(studyArea, span, Collections.singletonList(band));
    List<CompositeImage> ret = new ArrayList<CompositeImage>();
    for (Integer year : years) {
      ret.add(composite(frames, year, window, band, op));
    }
    return ret;
  }

  /** Single-year variant of {@link #compositeYears}. */
  public CompositeImage compositeYear(RasterTimeSeriesSource source, int year,
      SeasonalWindow window, String band, AggregationOp op)
      throws SchemaMismatchException, IOException {
    checkSchema(source, band);
    List<RasterFrame> frames = source.query(
        studyArea, window.range(year), Collections.singletonList(band));
    return composite(frames, year, window, band, op);
  }

  public static void checkSchema(RasterTimeSeriesSource source, String band)
      throws SchemaMismatchException, IOException {
    if (!source.getSchemaBands().contains(band)) {
      throw new SchemaMismatchException(source.getDatasetId(), band);
    }
  }

  /** Constant fallback, masked outside the study area. */
  Raster fallbackRaster(String band) {
    return Raster.constant(grid, band, fallbackValue).clip(studyArea);
  }

  /**
   * Per-pixel reduction over the frames carrying {@code band}, skipping masked samples.
   * Returns null if no frame carries the band.
   */
  static Raster aggregate(List<RasterFrame> frames, String band, AggregationOp op) {
    List<double[]> stack = new ArrayList<double[]>();
    GridGeometry grid = null;
    for (RasterFrame frame : frames) {
      int index = frame.raster.bandIndex(band);
      if (index < 0) continue;
      stack.add(frame.raster.bandData(index));
      grid = frame.raster.getGrid();
    }
    if (stack.isEmpty()) {
      return null;
    }
    double[] out = new double[grid.size()];
    double[] scratch = new double[stack.size()];
    for (int i = 0; i < out.length; ++i) {
      int n = 0;
      for (double[] layer : stack) {
        if (!Double.isNaN(layer[i])) {
          scratch[n++] = layer[i];
        }
      }
      out[i] = op.reduce(scratch, n);
    }
    return Raster.singleBand(grid, band, out);
  }
}
