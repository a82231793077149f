package org.dhuo.anomalytrend;

import ij.ImagePlus;
import ij.ImageStack;
import ij.io.FileSaver;
import ij.process.FloatProcessor;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Properties;

/**
 * Writes rasters as 32-bit float TIFFs, one slice per band, with masked pixels replaced by the
 * no-data sentinel. ImageJ encodes to a local temp file which is then moved onto the destination
 * file system, so destinations can be local paths or any Hadoop-supported URI.
 *
 * <p>Samples are narrowed to float32 here and nowhere else. {@link #storedValue} is what a pixel
 * becomes in the file and what {@link TiffRasterReader} gives back for it; values with at most
 * seven significant digits come back unchanged.
 */
public class TiffRasterExporter implements ResultExporter<Raster> {
  private static final Logger LOG = LoggerFactory.getLogger(TiffRasterExporter.class);

  private final double noDataSentinel;

  public TiffRasterExporter(double noDataSentinel) {
    this.noDataSentinel = noDataSentinel;
  }

  @Override
  public void save(Raster raster, String destination, ExportFormat format, double scale)
      throws IOException {
    if (format != ExportFormat.GEO_TIFF) {
      throw new IllegalArgumentException("Rasters export only as GEO_TIFF, not " + format);
    }
    Raster out = raster.resample(scale);
    ImagePlus imp = toImagePlus(out, new Path(destination).getName(), noDataSentinel);

    File local = File.createTempFile("raster-export", ".tif");
    FileSaver saver = new FileSaver(imp);
    boolean saved = out.getBandCount() > 1
        ? saver.saveAsTiffStack(local.getAbsolutePath())
        : saver.saveAsTiff(local.getAbsolutePath());
    if (!saved) {
      local.delete();
      throw new IOException("ImageJ failed to encode " + destination);
    }

    Path dst = new Path(destination);
    FileSystem fs = dst.getFileSystem(new Configuration());
    fs.copyFromLocalFile(true, true, new Path(local.getAbsolutePath()), dst);
    writeWorldFile(fs, RasterFiles.worldFile(dst), out.getGrid());
    writeHeader(fs, RasterFiles.header(dst), out);
    LOG.info("Saved {} ({} bands, {}x{})", destination, out.getBandCount(),
        out.getGrid().width, out.getGrid().height);
  }

  static ImagePlus toImagePlus(Raster raster, String title, double noDataSentinel) {
    GridGeometry grid = raster.getGrid();
    ImageStack stack = new ImageStack(grid.width, grid.height);
    List<String> bands = raster.getBandNames();
    for (int b = 0; b < bands.size(); ++b) {
      double[] values = raster.bandData(b);
      float[] pixels = new float[values.length];
      for (int i = 0; i < values.length; ++i) {
        pixels[i] = (float) (Double.isNaN(values[i]) ? noDataSentinel : values[i]);
      }
      stack.addSlice(bands.get(b), new FloatProcessor(grid.width, grid.height, pixels));
    }
    return new ImagePlus(title, stack);
  }

  /** The value {@code value} reads back as after export. */
  public static double storedValue(double value) {
    return RasterFiles.widen((float) value);
  }

  private static void writeWorldFile(FileSystem fs, Path path, GridGeometry grid)
      throws IOException {
    PrintStream out = new PrintStream(fs.create(path, true), false, "UTF-8");
    try {
      out.println(grid.pixelSize);
      out.println(0.0);
      out.println(0.0);
      out.println(-grid.pixelSize);
      out.println(grid.centerX(0));
      out.println(grid.centerY(0));
    } finally {
      out.close();
    }
  }

  private void writeHeader(FileSystem fs, Path path, Raster raster) throws IOException {
    GridGeometry grid = raster.getGrid();
    Properties header = new Properties();
    StringBuilder bands = new StringBuilder();
    for (String band : raster.getBandNames()) {
      if (bands.length() > 0) bands.append(',');
      bands.append(band);
    }
    header.setProperty(RasterFiles.HDR_BANDS, bands.toString());
    header.setProperty(RasterFiles.HDR_ORIGIN_X, Double.toString(grid.originX));
    header.setProperty(RasterFiles.HDR_ORIGIN_Y, Double.toString(grid.originY));
    header.setProperty(RasterFiles.HDR_PIXEL_SIZE, Double.toString(grid.pixelSize));
    header.setProperty(RasterFiles.HDR_NODATA, Double.toString(noDataSentinel));
    header.setProperty(RasterFiles.HDR_SAMPLE_TYPE, RasterFiles.SAMPLE_FLOAT32);
    OutputStream out = fs.create(path, true);
    try {
      header.store(out, "raster header");
    } finally {
      out.close();
    }
  }
}
