package org.fpbeditor.common;

/**
 * The closed set of node kinds in a process description. The code is the name used in the JSON
 * contract.
 */
public enum ElementKind {
  STATE("state"), PROCESS_OPERATOR("processOperator"), TECHNICAL_RESOURCE("technicalResource");

  private final String code;

  private ElementKind(String code) {
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
