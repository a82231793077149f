package org.dhuo.anomalytrend;

import java.util.Locale;

/**
 * Index bands derived per frame before compositing.
 */
public enum SpectralIndex {
  NONE(null, null, null),
  // Sentinel-2 near infrared and red.
  NDVI("NDVI", "B8", "B4"),
  // Sentinel-1 co- and cross-polarised backscatter, in dB.
  RVI("RVI", "VV", "VH");

  public final String bandName;
  public final String firstInput;
  public final String secondInput;

  SpectralIndex(String bandName, String firstInput, String secondInput) {
    this.bandName = bandName;
    this.firstInput = firstInput;
    this.secondInput = secondInput;
  }

  public static SpectralIndex parse(String text) {
    try {
      return valueOf(text.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown spectral index: " + text, e);
    }
  }

  /**
   * Computes this index from a raster carrying both input bands. Pixels masked in either input,
   * or whose denominator is zero, come out masked.
   */
  public Raster compute(Raster raster) {
    if (this == NONE) {
      throw new IllegalStateException("NONE derives no band");
    }
    double[] a = raster.bandData(raster.bandIndex(firstInput));
    double[] b = raster.bandData(raster.bandIndex(secondInput));
    double[] out = new double[a.length];
    for (int i = 0; i < out.length; ++i) {
      out[i] = this == NDVI ? normalizedDifference(a[i], b[i]) : radarVegetationIndex(a[i], b[i]);
    }
    return Raster.singleBand(raster.getGrid(), bandName, out);
  }

  static double normalizedDifference(double nir, double red) {
    double den = nir + red;
    if (Double.isNaN(den) || den == 0) return Double.NaN;
    return (nir - red) / den;
  }

  /** 4 * VH / (VV + VH) on linear power, inputs in dB. */
  static double radarVegetationIndex(double vvDb, double vhDb) {
    double vv = Math.pow(10, vvDb / 10);
    double vh = Math.pow(10, vhDb / 10);
    double den = vv + vh;
    if (Double.isNaN(den) || den == 0) return Double.NaN;
    return 4 * vh / den;
  }
}
