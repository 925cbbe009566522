package org.fpbeditor.layout.classify;

import org.fpbeditor.common.Placement;

/**
 * Where a state is placed relative to the system boundary.
 */
public enum Category {
  BOUNDARY_TOP, BOUNDARY_BOTTOM, BOUNDARY_LEFT, BOUNDARY_RIGHT, INTERNAL, DISCONNECTED;

  /**
   * @return the category a directional placement hint names, or null for the undirected
   *         {@link Placement#BOUNDARY} hint.
   */
  public static Category fromPlacement(Placement placement) {
    switch (placement) {
      case BOUNDARY_TOP:
        return BOUNDARY_TOP;
      case BOUNDARY_BOTTOM:
        return BOUNDARY_BOTTOM;
      case BOUNDARY_LEFT:
        return BOUNDARY_LEFT;
      case BOUNDARY_RIGHT:
        return BOUNDARY_RIGHT;
      case INTERNAL:
        return INTERNAL;
      default:
        return null;
    }
  }
}
