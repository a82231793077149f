package org.dhuo.anomalytrend;

import org.apache.hadoop.fs.Path;

/**
 * Sidecar naming shared by the TIFF writer and reader. Next to {@code x.tif} live an ESRI world
 * file {@code x.tfw} for GIS tools and a header {@code x.hdr} holding the exact grid, band names,
 * sample type and no-data sentinel.
 */
class RasterFiles {
  static final String HDR_BANDS = "bands";
  static final String HDR_ORIGIN_X = "originX";
  static final String HDR_ORIGIN_Y = "originY";
  static final String HDR_PIXEL_SIZE = "pixelSize";
  static final String HDR_NODATA = "nodata";
  static final String HDR_SAMPLE_TYPE = "sampleType";
  static final String SAMPLE_FLOAT32 = "float32";

  /**
   * The double a float32 sample stands for: the shortest decimal that rounds to it, so 0.1
   * stored as 0.1f reads back as 0.1 and not 0.10000000149011612.
   */
  static double widen(float sample) {
    return Double.parseDouble(Float.toString(sample));
  }

  static Path worldFile(Path tiff) {
    return sibling(tiff, ".tfw");
  }

  static Path header(Path tiff) {
    return sibling(tiff, ".hdr");
  }

  private static Path sibling(Path tiff, String extension) {
    String name = tiff.getName();
    int dot = name.lastIndexOf('.');
    String base = dot > 0 ? name.substring(0, dot) : name;
    return new Path(tiff.getParent(), base + extension);
  }
}
