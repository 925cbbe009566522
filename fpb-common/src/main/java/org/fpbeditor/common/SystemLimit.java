package org.fpbeditor.common;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * An explicitly declared system. Elements refer to it through their system id.
 */
public class SystemLimit {

  private final String id;
  private final String label;

  public SystemLimit(String id, String label) {
    this.id = id;
    this.label = (label == null) ? id : label;
  }

  public SystemLimit(JSONObject jsLimit) throws JSONException {
    this(jsLimit.getString("id"), jsLimit.optString("label", null));
  }

  public String getId() {
    return id;
  }

  public String getLabel() {
    return label;
  }

  public JSONObject toJSON() throws JSONException {
    JSONObject json = new JSONObject();
    json.put("id", id);
    json.put("label", label);
    return json;
  }
}
