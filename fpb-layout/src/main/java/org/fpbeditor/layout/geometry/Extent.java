package org.fpbeditor.layout.geometry;

import org.fpbeditor.layout.PositionedElement;
import org.fpbeditor.layout.SystemBoundary;

/**
 * A growable bounding box. An extent that has not included anything is empty and reports no
 * coordinates.
 */
public class Extent {

  private double minX = Double.POSITIVE_INFINITY;
  private double minY = Double.POSITIVE_INFINITY;
  private double maxX = Double.NEGATIVE_INFINITY;
  private double maxY = Double.NEGATIVE_INFINITY;

  public Extent() {}

  public Extent(double x, double y, double width, double height) {
    include(x, y, width, height);
  }

  public Extent include(double x, double y, double width, double height) {
    minX = Math.min(minX, x);
    minY = Math.min(minY, y);
    maxX = Math.max(maxX, x + width);
    maxY = Math.max(maxY, y + height);
    return this;
  }

  public Extent include(PositionedElement element) {
    return include(element.getX(), element.getY(), element.getWidth(), element.getHeight());
  }

  public Extent include(SystemBoundary boundary) {
    return include(boundary.getX(), boundary.getY(), boundary.getWidth(), boundary.getHeight());
  }

  /**
   * Grows the extent by the given amount on each side.
   */
  public Extent expand(double left, double top, double right, double bottom) {
    if (!isEmpty()) {
      minX -= left;
      minY -= top;
      maxX += right;
      maxY += bottom;
    }
    return this;
  }

  public Extent copy() {
    Extent copy = new Extent();
    copy.minX = minX;
    copy.minY = minY;
    copy.maxX = maxX;
    copy.maxY = maxY;
    return copy;
  }

  public boolean isEmpty() {
    return minX > maxX;
  }

  public double getMinX() {
    return minX;
  }

  public double getMinY() {
    return minY;
  }

  public double getMaxX() {
    return maxX;
  }

  public double getMaxY() {
    return maxY;
  }

  public double getWidth() {
    return isEmpty() ? 0 : maxX - minX;
  }

  public double getHeight() {
    return isEmpty() ? 0 : maxY - minY;
  }

  @Override
  public String toString() {
    return isEmpty() ? "empty" : "[" + minX + "," + minY + " - " + maxX + "," + maxY + "]";
  }
}
