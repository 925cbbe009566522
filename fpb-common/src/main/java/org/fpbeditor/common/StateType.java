package org.fpbeditor.common;

public enum StateType {
  PRODUCT("product"), ENERGY("energy"), INFORMATION("information");

  private final String code;

  private StateType(String code) {
    this.code = code;
  }

  public String getCode() {
    return code;
  }

  public static StateType fromCode(String code) {
    for (StateType type : values()) {
      if (type.code.equals(code))
        return type;
    }
    throw new IllegalArgumentException("Unknown state type: " + code);
  }
}
