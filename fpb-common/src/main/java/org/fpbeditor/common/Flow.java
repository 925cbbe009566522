package org.fpbeditor.common;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * A directed flow between a state and a process operator.
 */
public class Flow {

  private final String id;
  private final String sourceId;
  private final String targetId;
  private final FlowType flowType;
  private final String systemId;

  public Flow(String id, String sourceId, String targetId) {
    this(id, sourceId, targetId, FlowType.FLOW, null);
  }

  public Flow(String id, String sourceId, String targetId, FlowType flowType, String systemId) {
    this.id = id;
    this.sourceId = sourceId;
    this.targetId = targetId;
    this.flowType = (flowType == null) ? FlowType.FLOW : flowType;
    this.systemId = systemId;
  }

  public Flow(JSONObject jsFlow) throws JSONException {
    this(jsFlow.getString("id"), JsonFields.getString(jsFlow, "sourceId", "source_ref"),
        JsonFields.getString(jsFlow, "targetId", "target_ref"),
        readFlowType(JsonFields.optString(jsFlow, "flowType", "flow_type")),
        JsonFields.optString(jsFlow, "systemId", "system_id"));
  }

  private static FlowType readFlowType(String code) {
    return (code == null) ? FlowType.FLOW : FlowType.fromCode(code);
  }

  public String getId() {
    return id;
  }

  public String getSourceId() {
    return sourceId;
  }

  public String getTargetId() {
    return targetId;
  }

  public FlowType getFlowType() {
    return flowType;
  }

  public String getSystemId() {
    return systemId;
  }

  public JSONObject toJSON() throws JSONException {
    JSONObject json = new JSONObject();
    json.put("id", id);
    json.put("sourceId", sourceId);
    json.put("targetId", targetId);
    json.put("flowType", flowType.getCode());
    if (systemId != null)
      json.put("systemId", systemId);
    return json;
  }

  @Override
  public String toString() {
    return id + "(" + sourceId + "->" + targetId + ")";
  }
}
