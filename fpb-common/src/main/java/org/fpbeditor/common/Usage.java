package org.fpbeditor.common;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * Binds a technical resource to the process operator employing it.
 */
public class Usage {

  private final String id;
  private final String processOperatorId;
  private final String technicalResourceId;
  private final String systemId;

  public Usage(String id, String processOperatorId, String technicalResourceId) {
    this(id, processOperatorId, technicalResourceId, null);
  }

  public Usage(String id, String processOperatorId, String technicalResourceId, String systemId) {
    this.id = id;
    this.processOperatorId = processOperatorId;
    this.technicalResourceId = technicalResourceId;
    this.systemId = systemId;
  }

  public Usage(JSONObject jsUsage) throws JSONException {
    this(jsUsage.getString("id"),
        JsonFields.getString(jsUsage, "processOperatorId", "process_operator_ref"),
        JsonFields.getString(jsUsage, "technicalResourceId", "technical_resource_ref"),
        JsonFields.optString(jsUsage, "systemId", "system_id"));
  }

  public String getId() {
    return id;
  }

  public String getProcessOperatorId() {
    return processOperatorId;
  }

  public String getTechnicalResourceId() {
    return technicalResourceId;
  }

  public String getSystemId() {
    return systemId;
  }

  public JSONObject toJSON() throws JSONException {
    JSONObject json = new JSONObject();
    json.put("id", id);
    json.put("processOperatorId", processOperatorId);
    json.put("technicalResourceId", technicalResourceId);
    if (systemId != null)
      json.put("systemId", systemId);
    return json;
  }
}
