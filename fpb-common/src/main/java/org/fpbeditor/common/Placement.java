package org.fpbeditor.common;

/**
 * Placement hint of a state relative to the system limit. {@link #BOUNDARY} leaves the side to
 * the layout, the other boundary values name it explicitly.
 */
public enum Placement {
  BOUNDARY("boundary"),
  BOUNDARY_TOP("boundary-top"),
  BOUNDARY_BOTTOM("boundary-bottom"),
  BOUNDARY_LEFT("boundary-left"),
  BOUNDARY_RIGHT("boundary-right"),
  INTERNAL("internal");

  private final String code;

  private Placement(String code) {
    this.code = code;
  }

  public String getCode() {
    return code;
  }

  public boolean isDirectional() {
    return this != BOUNDARY;
  }

  public static Placement fromCode(String code) {
    for (Placement placement : values()) {
      if (placement.code.equals(code))
        return placement;
    }
    throw new IllegalArgumentException("Unknown placement: " + code);
  }
}
