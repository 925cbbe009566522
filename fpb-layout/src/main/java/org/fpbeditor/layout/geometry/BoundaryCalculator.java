package org.fpbeditor.layout.geometry;

import org.fpbeditor.layout.LayoutConfig;

/**
 * Derives the system boundary from the extent of the system's core (operators, internal states
 * and overflow row). Boundary states straddle the edges of the result, so the box makes room for
 * them: half a state plus a gap on sides with left or right occupants, the width of a wider top
 * or bottom row, and a fixed margin above and below for top and bottom occupants. The system
 * padding is added last.
 */
public class BoundaryCalculator {

  private final LayoutConfig config;

  public BoundaryCalculator(LayoutConfig config) {
    this.config = config;
  }

  /**
   * @return the boundary box, or null if the core extent is empty.
   */
  public Extent compute(Extent core, boolean hasLeft, boolean hasRight, int topCount,
      int bottomCount) {
    if (core.isEmpty())
      return null;

    double gap = config.getHorizontalGap();
    Extent box = core.copy();

    double side = CoordinateEngine.STATE_WIDTH / 2 + gap;
    box.expand(hasLeft ? side : 0, 0, hasRight ? side : 0, 0);

    double rowWidth = Math.max(
        CenteredDistribution.span(topCount, CoordinateEngine.STATE_WIDTH, gap),
        CenteredDistribution.span(bottomCount, CoordinateEngine.STATE_WIDTH, gap));
    if (rowWidth > box.getWidth()) {
      double extra = (rowWidth - box.getWidth()) / 2;
      box.expand(extra, 0, extra, 0);
    }

    box.expand(0, (topCount > 0) ? CoordinateEngine.BOUNDARY_MARGIN : 0, 0,
        (bottomCount > 0) ? CoordinateEngine.BOUNDARY_MARGIN : 0);

    double padding = config.getSystemPadding();
    return box.expand(padding, padding, padding, padding);
  }
}
