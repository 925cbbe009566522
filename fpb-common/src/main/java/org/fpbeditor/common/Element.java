package org.fpbeditor.common;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * Common part of all nodes of a process description.
 */
public abstract class Element {

  private final String id;
  private final String label;
  private final String systemId;

  protected Element(String id, String label, String systemId) {
    this.id = id;
    this.label = (label == null) ? id : label;
    this.systemId = systemId;
  }

  protected Element(JSONObject json) throws JSONException {
    this(json.getString("id"), JsonFields.optString(json, "label"),
        JsonFields.optString(json, "systemId", "system_id"));
  }

  /**
   * @return the id, unique within a model
   */
  public String getId() {
    return id;
  }

  public String getLabel() {
    return label;
  }

  /**
   * @return the id of the system this element belongs to, or null if it is not assigned to one.
   */
  public String getSystemId() {
    return systemId;
  }

  public abstract ElementKind getKind();

  public JSONObject toJSON() throws JSONException {
    JSONObject json = new JSONObject();
    json.put("id", id);
    json.put("label", label);
    if (systemId != null)
      json.put("systemId", systemId);
    return json;
  }

  @Override
  public String toString() {
    return getKind().getCode() + "(" + id + ")";
  }
}
