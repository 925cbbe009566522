package org.fpbeditor.layout;

/**
 * The edge of an element a connection should attach to.
 */
public enum Side {
  TOP("top"), BOTTOM("bottom"), LEFT("left"), RIGHT("right");

  private final String code;

  private Side(String code) {
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
