package org.fpbeditor.layout.classify;

import java.util.List;

import org.fpbeditor.common.State;
import org.fpbeditor.common.StateType;
import org.fpbeditor.layout.graph.Ranking;

/**
 * Side selection for boundary states whose side is not given explicitly. Only products go to the
 * top or bottom edge: a product feeding the first rank enters from the top, a product leaving
 * the last rank exits at the bottom. Everything else enters from the left and exits to the
 * right.
 */
final class BoundarySides {

  private BoundarySides() {}

  static Category inputSide(State state, List<String> targetOperators, Ranking ranking) {
    if (state.getStateType() != StateType.PRODUCT)
      return Category.BOUNDARY_LEFT;
    if (ranking.getMaxRank() > 0) {
      Integer minRank = ranking.getMinRank(targetOperators);
      if (minRank != null && minRank > 0)
        return Category.BOUNDARY_LEFT;
    }
    return Category.BOUNDARY_TOP;
  }

  static Category outputSide(State state, List<String> sourceOperators, Ranking ranking) {
    if (state.getStateType() != StateType.PRODUCT)
      return Category.BOUNDARY_RIGHT;
    if (ranking.getMaxRank() > 0) {
      Integer maxRank = ranking.getMaxRank(sourceOperators);
      if (maxRank != null && maxRank < ranking.getMaxRank())
        return Category.BOUNDARY_RIGHT;
    }
    return Category.BOUNDARY_BOTTOM;
  }
}
