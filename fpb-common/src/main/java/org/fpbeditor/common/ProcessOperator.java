package org.fpbeditor.common;

import org.json.JSONException;
import org.json.JSONObject;

public class ProcessOperator extends Element {

  public ProcessOperator(String id, String label) {
    this(id, label, null);
  }

  public ProcessOperator(String id, String label, String systemId) {
    super(id, label, systemId);
  }

  public ProcessOperator(JSONObject jsOperator) throws JSONException {
    super(jsOperator);
  }

  @Override
  public ElementKind getKind() {
    return ElementKind.PROCESS_OPERATOR;
  }
}
