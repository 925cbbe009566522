package org.fpbeditor.layout;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * The box enclosing one system. The implicit group of untagged elements has a null id.
 */
public class SystemBoundary {

  private final String id;
  private final String label;
  private final double x;
  private final double y;
  private final double width;
  private final double height;

  public SystemBoundary(String id, String label, double x, double y, double width, double height) {
    this.id = id;
    this.label = label;
    this.x = x;
    this.y = y;
    this.width = width;
    this.height = height;
  }

  public String getId() {
    return id;
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

  public double getCenterX() {
    return x + width / 2;
  }

  /**
   * @return true if the element lies fully inside this box.
   */
  public boolean contains(PositionedElement element) {
    return element.getX() >= x && element.getY() >= y && element.getRight() <= getRight()
        && element.getBottom() <= getBottom();
  }

  public SystemBoundary translate(double dx, double dy) {
    return new SystemBoundary(id, label, x + dx, y + dy, width, height);
  }

  public JSONObject toJSON() throws JSONException {
    JSONObject json = new JSONObject();
    json.put("id", (id == null) ? JSONObject.NULL : id);
    json.put("label", label);
    json.put("x", x);
    json.put("y", y);
    json.put("width", width);
    json.put("height", height);
    return json;
  }

  @Override
  public String toString() {
    return label + "(" + x + "," + y + " " + width + "x" + height + ")";
  }
}
