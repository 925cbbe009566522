package org.fpbeditor.common;

public enum FlowType {
  FLOW("flow"), ALTERNATIVE("alternativeFlow"), PARALLEL("parallelFlow");

  private final String code;

  private FlowType(String code) {
    this.code = code;
  }

  public String getCode() {
    return code;
  }

  public static FlowType fromCode(String code) {
    for (FlowType type : values()) {
      if (type.code.equals(code))
        return type;
    }
    throw new IllegalArgumentException("Unknown flow type: " + code);
  }
}
