package org.fpbeditor.layout.geometry;

/**
 * Spreads equally sized items along one axis, symmetric around an anchor.
 */
public final class CenteredDistribution {

  private CenteredDistribution() {}

  /**
   * @return the length covered by {@code count} items of {@code size} separated by {@code gap};
   *         0 for no items.
   */
  public static double span(int count, double size, double gap) {
    if (count <= 0)
      return 0;
    return count * size + (count - 1) * gap;
  }

  /**
   * @return the start coordinate of each item, so that the whole span is centered on
   *         {@code anchor}.
   */
  public static double[] distribute(int count, double size, double gap, double anchor) {
    double[] positions = new double[Math.max(count, 0)];
    double start = anchor - span(count, size, gap) / 2;
    for (int i = 0; i < positions.length; i++) {
      positions[i] = start + i * (size + gap);
    }
    return positions;
  }
}
