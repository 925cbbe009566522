package org.fpbeditor.layout;

import org.fpbeditor.common.ElementKind;
import org.fpbeditor.common.StateType;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * A node of the model with its computed rectangle.
 */
public class PositionedElement {

  private final String id;
  private final ElementKind kind;
  private final String label;
  private final double x;
  private final double y;
  private final double width;
  private final double height;
  private final StateType stateType;

  public PositionedElement(String id, ElementKind kind, String label, double x, double y,
      double width, double height, StateType stateType) {
    this.id = id;
    this.kind = kind;
    this.label = label;
    this.x = x;
    this.y = y;
    this.width = width;
    this.height = height;
    this.stateType = stateType;
  }

  public String getId() {
    return id;
  }

  public ElementKind getKind() {
    return kind;
  }

  public String getLabel() {
    return label;
  }

  public double getX() {
    return x;
  }

  public double getY() {
    return y;
  }

  public double getWidth() {
    return width;
  }

  public double getHeight() {
    return height;
  }

  public double getRight() {
    return x + width;
  }

  public double getBottom() {
    return y + height;
  }

  /**
   * @return the state type, or null if the element is not a state.
   */
  public StateType getStateType() {
    return stateType;
  }

  /**
   * @return true if the interiors of the two rectangles intersect; touching edges do not count.
   */
  public boolean overlaps(PositionedElement other) {
    return x < other.getRight() && other.x < getRight() && y < other.getBottom()
        && other.y < getBottom();
  }

  public PositionedElement translate(double dx, double dy) {
    return new PositionedElement(id, kind, label, x + dx, y + dy, width, height, stateType);
  }

  public JSONObject toJSON() throws JSONException {
    JSONObject json = new JSONObject();
    json.put("id", id);
    json.put("type", kind.getCode());
    json.put("label", label);
    json.put("x", x);
    json.put("y", y);
    json.put("width", width);
    json.put("height", height);
    if (stateType != null)
      json.put("stateType", stateType.getCode());
    return json;
  }

  @Override
  public String toString() {
    return id + "(" + x + "," + y + " " + width + "x" + height + ")";
  }
}
