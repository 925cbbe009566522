package org.fpbeditor.layout;

import org.fpbeditor.common.FlowType;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * A flow or usage of the model with optional routing hints for the renderer.
 */
public class Connection {

  private final String id;
  private final String sourceId;
  private final String targetId;
  private final FlowType flowType;
  private final boolean usage;
  private final Side sourceSide;
  private final Side targetSide;

  public Connection(String id, String sourceId, String targetId, FlowType flowType, boolean usage,
      Side sourceSide, Side targetSide) {
    this.id = id;
    this.sourceId = sourceId;
    this.targetId = targetId;
    this.flowType = flowType;
    this.usage = usage;
    this.sourceSide = sourceSide;
    this.targetSide = targetSide;
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

  /**
   * @return the flow type, or null for a usage.
   */
  public FlowType getFlowType() {
    return flowType;
  }

  public boolean isUsage() {
    return usage;
  }

  public Side getSourceSide() {
    return sourceSide;
  }

  public Side getTargetSide() {
    return targetSide;
  }

  public JSONObject toJSON() throws JSONException {
    JSONObject json = new JSONObject();
    json.put("id", id);
    json.put("sourceId", sourceId);
    json.put("targetId", targetId);
    if (flowType != null)
      json.put("flowType", flowType.getCode());
    json.put("isUsage", usage);
    if (sourceSide != null)
      json.put("sourceSide", sourceSide.getCode());
    if (targetSide != null)
      json.put("targetSide", targetSide.getCode());
    return json;
  }
}
