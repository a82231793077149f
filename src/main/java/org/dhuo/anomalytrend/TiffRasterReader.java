package org.dhuo.anomalytrend;

import ij.ImagePlus;
import ij.ImageStack;
import ij.io.Opener;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.Scanner;

/**
 * Reads rasters written by {@link TiffRasterExporter}, or plain float TIFFs with a world file.
 * Float samples are widened through their shortest decimal form; see
 * {@link TiffRasterExporter#storedValue}.
 */
public class TiffRasterReader {
  private static final Logger LOG = LoggerFactory.getLogger(TiffRasterReader.class);

  /**
   * Reads {@code path}, turning samples equal to the sentinel into masked pixels. A sentinel
   * recorded in the file's header takes precedence over {@code noDataSentinel}.
   */
  public static Raster read(String path, double noDataSentinel) throws IOException {
    return read(path, noDataSentinel, true);
  }

  /**
   * Reads {@code path} exactly as stored; sentinel samples keep their value.
   */
  public static Raster readRaw(String path) throws IOException {
    return read(path, Double.NaN, false);
  }

  private static Raster read(String path, double noDataSentinel, boolean maskSentinel)
      throws IOException {
    Path src = new Path(path);
    FileSystem fs = src.getFileSystem(new Configuration());
    File local = File.createTempFile("raster-import", ".tif");
    ImagePlus imp;
    try {
      fs.copyToLocalFile(false, src, new Path(local.getAbsolutePath()), true);
      imp = new Opener().openImage(local.getAbsolutePath());
    } finally {
      local.delete();
    }
    if (imp == null) {
      throw new IOException("ImageJ could not decode " + path);
    }

    ImageStack stack = imp.getStack();
    int width = stack.getWidth();
    int height = stack.getHeight();
    Properties header = readHeader(fs, RasterFiles.header(src));
    GridGeometry grid = header != null
        ? gridFromHeader(header, width, height)
        : gridFromWorldFile(fs, RasterFiles.worldFile(src), width, height);
    String[] bandNames = bandNames(header, stack);

    if (maskSentinel && header != null && header.getProperty(RasterFiles.HDR_NODATA) != null) {
      double recorded = Double.parseDouble(header.getProperty(RasterFiles.HDR_NODATA));
      if (Double.compare(recorded, noDataSentinel) != 0) {
        LOG.info("{} was written with no-data {}, not {}; using the recorded one",
            path, recorded, noDataSentinel);
      }
      noDataSentinel = recorded;
    }
    float sentinel = (float) noDataSentinel;
    double[][] bands = new double[stack.getSize()][width * height];
    for (int b = 0; b < bands.length; ++b) {
      float[] pixels = (float[]) stack.getProcessor(b + 1).convertToFloat().getPixels();
      for (int i = 0; i < pixels.length; ++i) {
        bands[b][i] = maskSentinel && pixels[i] == sentinel
            ? Double.NaN : RasterFiles.widen(pixels[i]);
      }
    }
    return new Raster(grid, bandNames, bands);
  }

  private static Properties readHeader(FileSystem fs, Path path) throws IOException {
    if (!fs.exists(path)) return null;
    Properties header = new Properties();
    InputStream in = fs.open(path);
    try {
      header.load(in);
    } finally {
      in.close();
    }
    return header;
  }

  private static GridGeometry gridFromHeader(Properties header, int width, int height) {
    return new GridGeometry(
        Double.parseDouble(header.getProperty(RasterFiles.HDR_ORIGIN_X)),
        Double.parseDouble(header.getProperty(RasterFiles.HDR_ORIGIN_Y)),
        Double.parseDouble(header.getProperty(RasterFiles.HDR_PIXEL_SIZE)),
        width, height);
  }

  private static GridGeometry gridFromWorldFile(FileSystem fs, Path path, int width, int height)
      throws IOException {
    if (!fs.exists(path)) {
      LOG.warn("No header or world file for {}; using a unit grid at the origin", path);
      return new GridGeometry(0, height, 1, width, height);
    }
    double[] params = new double[6];
    Scanner scan = new Scanner(fs.open(path), "UTF-8");
    try {
      for (int i = 0; i < 6; ++i) {
        params[i] = Double.parseDouble(scan.nextLine().trim());
      }
    } finally {
      scan.close();
    }
    double pixelSize = params[0];
    // World files locate the center of the upper-left pixel.
    return new GridGeometry(params[4] - pixelSize / 2, params[5] + pixelSize / 2,
        pixelSize, width, height);
  }

  private static String[] bandNames(Properties header, ImageStack stack) {
    String[] ret = new String[stack.getSize()];
    if (header != null && header.getProperty(RasterFiles.HDR_BANDS) != null) {
      String[] names = header.getProperty(RasterFiles.HDR_BANDS).split(",");
      if (names.length == ret.length) return names;
    }
    for (int i = 0; i < ret.length; ++i) {
      String label = stack.getSliceLabel(i + 1);
      ret[i] = label == null || label.trim().isEmpty() ? "b" + (i + 1) : label.trim();
    }
    return ret;
  }

  /** Band names recorded in the header of {@code path}, or null without a header. */
  static List<String> headerBands(String path) throws IOException {
    Path src = new Path(path);
    Properties header = readHeader(src.getFileSystem(new Configuration()), RasterFiles.header(src));
    if (header == null || header.getProperty(RasterFiles.HDR_BANDS) == null) {
      return null;
    }
    return Arrays.asList(header.getProperty(RasterFiles.HDR_BANDS).split(","));
  }
}
