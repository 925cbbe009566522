package org.fpbeditor.common;

import org.json.JSONException;
import org.json.JSONObject;

public class State extends Element {

  private final StateType stateType;
  private final Placement placement;

  public State(String id, String label, StateType stateType) {
    this(id, label, stateType, null, null);
  }

  public State(String id, String label, StateType stateType, Placement placement, String systemId) {
    super(id, label, systemId);
    this.stateType = stateType;
    this.placement = placement;
  }

  public State(JSONObject jsState) throws JSONException {
    super(jsState);
    this.stateType = StateType.fromCode(
        JsonFields.getString(jsState, "stateType", "state_type"));
    String placementCode = JsonFields.optString(jsState, "placement");
    this.placement = (placementCode == null) ? null : Placement.fromCode(placementCode);
  }

  public StateType getStateType() {
    return stateType;
  }

  /**
   * @return the placement hint, or null if the layout decides on its own.
   */
  public Placement getPlacement() {
    return placement;
  }

  @Override
  public ElementKind getKind() {
    return ElementKind.STATE;
  }

  @Override
  public JSONObject toJSON() throws JSONException {
    JSONObject json = super.toJSON();
    json.put("stateType", stateType.getCode());
    if (placement != null)
      json.put("placement", placement.getCode());
    return json;
  }
}
