package org.fpbeditor.common;

import org.json.JSONException;
import org.json.JSONObject;

public class TechnicalResource extends Element {

  public TechnicalResource(String id, String label) {
    this(id, label, null);
  }

  public TechnicalResource(String id, String label, String systemId) {
    super(id, label, systemId);
  }

  public TechnicalResource(JSONObject jsResource) throws JSONException {
    super(jsResource);
  }

  @Override
  public ElementKind getKind() {
    return ElementKind.TECHNICAL_RESOURCE;
  }
}
