package org.dhuo.anomalytrend;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable stack of named bands over a {@link GridGeometry}. Samples are stored row-major and
 * {@code NaN} marks a masked pixel. Every operation returns a new raster.
 */
public class Raster implements Serializable {
  private final GridGeometry grid;
  private final String[] bandNames;
  private final double[][] bands;

  public Raster(GridGeometry grid, String[] bandNames, double[][] bands) {
    if (bandNames.length != bands.length) {
      throw new IllegalArgumentException(
          "Got " + bandNames.length + " band names for " + bands.length + " bands");
    }
    this.grid = grid;
    this.bandNames = bandNames.clone();
    this.bands = new double[bands.length][];
    for (int b = 0; b < bands.length; ++b) {
      if (bands[b].length != grid.size()) {
        throw new IllegalArgumentException("Band " + bandNames[b] + " has " + bands[b].length
            + " samples, grid needs " + grid.size());
      }
      this.bands[b] = bands[b].clone();
    }
  }

  public static Raster singleBand(GridGeometry grid, String band, double[] values) {
    return new Raster(grid, new String[] {band}, new double[][] {values});
  }

  public static Raster constant(GridGeometry grid, String band, double value) {
    double[] values = new double[grid.size()];
    Arrays.fill(values, value);
    return singleBand(grid, band, values);
  }

  /** A raster whose every pixel is masked. */
  public static Raster masked(GridGeometry grid, String band) {
    return constant(grid, band, Double.NaN);
  }

  public GridGeometry getGrid() {
    return grid;
  }

  public List<String> getBandNames() {
    return Collections.unmodifiableList(Arrays.asList(bandNames));
  }

  public int getBandCount() {
    return bandNames.length;
  }

  public int bandIndex(String band) {
    for (int b = 0; b < bandNames.length; ++b) {
      if (bandNames[b].equals(band)) return b;
    }
    return -1;
  }

  public boolean hasBand(String band) {
    return bandIndex(band) >= 0;
  }

  public double get(String band, int col, int row) {
    return bands[requireBand(band)][row * grid.width + col];
  }

  public boolean isMasked(String band, int col, int row) {
    return Double.isNaN(get(band, col, row));
  }

  /** Direct view of a band for read-only use inside the package. */
  double[] bandData(int index) {
    return bands[index];
  }

  public int countUnmasked(String band) {
    double[] data = bands[requireBand(band)];
    int count = 0;
    for (double v : data) {
      if (!Double.isNaN(v)) ++count;
    }
    return count;
  }

  public Raster select(String band) {
    return select(band, band);
  }

  public Raster select(String band, String newName) {
    return new Raster(grid, new String[] {newName}, new double[][] {bands[requireBand(band)]});
  }

  public Raster addBands(Raster other) {
    if (!grid.equals(other.grid)) {
      throw new IllegalArgumentException("Cannot stack " + other.grid + " onto " + grid);
    }
    List<String> names = new ArrayList<String>(Arrays.asList(bandNames));
    names.addAll(Arrays.asList(other.bandNames));
    double[][] data = new double[bands.length + other.bands.length][];
    System.arraycopy(bands, 0, data, 0, bands.length);
    System.arraycopy(other.bands, 0, data, bands.length, other.bands.length);
    return new Raster(grid, names.toArray(new String[0]), data);
  }

  /** Multiplies every unmasked sample by {@code factor}. */
  public Raster scale(double factor) {
    double[][] data = new double[bands.length][];
    for (int b = 0; b < bands.length; ++b) {
      data[b] = new double[bands[b].length];
      for (int i = 0; i < data[b].length; ++i) {
        data[b][i] = bands[b][i] * factor;
      }
    }
    return new Raster(grid, bandNames, data);
  }

  /** Masks every pixel whose center lies outside {@code geometry}. */
  public Raster clip(Footprint geometry) {
    double[][] data = new double[bands.length][];
    for (int b = 0; b < bands.length; ++b) {
      data[b] = bands[b].clone();
    }
    for (int row = 0; row < grid.height; ++row) {
      double y = grid.centerY(row);
      for (int col = 0; col < grid.width; ++col) {
        if (!geometry.contains(grid.centerX(col), y)) {
          for (int b = 0; b < data.length; ++b) {
            data[b][row * grid.width + col] = Double.NaN;
          }
        }
      }
    }
    return new Raster(grid, bandNames, data);
  }

  /** Nearest-neighbour resampling onto the same extent at {@code scale} map units per pixel. */
  public Raster resample(double scale) {
    if (scale == grid.pixelSize) return this;
    GridGeometry target = grid.atScale(scale);
    double[][] data = new double[bands.length][target.size()];
    for (int row = 0; row < target.height; ++row) {
      int srcRow = Math.min(grid.rowOf(target.centerY(row)), grid.height - 1);
      for (int col = 0; col < target.width; ++col) {
        int srcCol = Math.min(grid.colOf(target.centerX(col)), grid.width - 1);
        for (int b = 0; b < bands.length; ++b) {
          data[b][row * target.width + col] = bands[b][srcRow * grid.width + srcCol];
        }
      }
    }
    return new Raster(target, bandNames, data);
  }

  private int requireBand(String band) {
    int index = bandIndex(band);
    if (index < 0) {
      throw new IllegalArgumentException(
          "No band '" + band + "' in raster with bands " + Arrays.toString(bandNames));
    }
    return index;
  }
}
