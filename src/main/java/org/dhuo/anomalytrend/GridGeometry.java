package org.dhuo.anomalytrend;

import java.io.Serializable;

/**
 * Fixed spatial extent shared by every raster of a run: upper-left corner, square pixel size in
 * map units, and pixel dimensions. Rows grow downward, so y decreases with the row index.
 */
public class GridGeometry implements Serializable {
  public final double originX;
  public final double originY;
  public final double pixelSize;
  public final int width;
  public final int height;

  public GridGeometry(double originX, double originY, double pixelSize, int width, int height) {
    if (!(pixelSize > 0) || width <= 0 || height <= 0) {
      throw new IllegalArgumentException(String.format(
          "Invalid grid: pixelSize=%f width=%d height=%d", pixelSize, width, height));
    }
    this.originX = originX;
    this.originY = originY;
    this.pixelSize = pixelSize;
    this.width = width;
    this.height = height;
  }

  public int size() {
    return width * height;
  }

  public double centerX(int col) {
    return originX + (col + 0.5) * pixelSize;
  }

  public double centerY(int row) {
    return originY - (row + 0.5) * pixelSize;
  }

  /** Column containing map coordinate {@code x}; may fall outside [0, width). */
  public int colOf(double x) {
    return (int) Math.floor((x - originX) / pixelSize);
  }

  /** Row containing map coordinate {@code y}; may fall outside [0, height). */
  public int rowOf(double y) {
    return (int) Math.floor((originY - y) / pixelSize);
  }

  public double maxX() {
    return originX + width * pixelSize;
  }

  public double minY() {
    return originY - height * pixelSize;
  }

  /**
   * Grid covering the same extent at a different pixel size; partial pixels at the right and
   * bottom edges are kept.
   */
  public GridGeometry atScale(double scale) {
    int w = (int) Math.ceil(width * pixelSize / scale - 1e-9);
    int h = (int) Math.ceil(height * pixelSize / scale - 1e-9);
    return new GridGeometry(originX, originY, scale, Math.max(w, 1), Math.max(h, 1));
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof GridGeometry)) return false;
    GridGeometry g = (GridGeometry) o;
    return Double.compare(originX, g.originX) == 0
        && Double.compare(originY, g.originY) == 0
        && Double.compare(pixelSize, g.pixelSize) == 0
        && width == g.width
        && height == g.height;
  }

  @Override
  public int hashCode() {
    long bits = Double.doubleToLongBits(originX);
    bits = 31 * bits + Double.doubleToLongBits(originY);
    bits = 31 * bits + Double.doubleToLongBits(pixelSize);
    return (int) (bits ^ (bits >>> 32)) * 31 * 31 + width * 31 + height;
  }

  @Override
  public String toString() {
    return String.format("GridGeometry[origin=(%f, %f) pixel=%f size=%dx%d]",
        originX, originY, pixelSize, width, height);
  }
}
