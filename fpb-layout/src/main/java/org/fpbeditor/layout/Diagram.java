package org.fpbeditor.layout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * The positioned result of a layout run.
 */
public class Diagram {

  private final List<PositionedElement> elements;
  private final List<Connection> connections;
  private final List<SystemBoundary> systemBoundaries;

  public Diagram(List<PositionedElement> elements, List<Connection> connections,
      List<SystemBoundary> systemBoundaries) {
    this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    this.connections = Collections.unmodifiableList(new ArrayList<>(connections));
    this.systemBoundaries = Collections.unmodifiableList(new ArrayList<>(systemBoundaries));
  }

  public List<PositionedElement> getElements() {
    return elements;
  }

  public List<Connection> getConnections() {
    return connections;
  }

  public List<SystemBoundary> getSystemBoundaries() {
    return systemBoundaries;
  }

  /**
   * @return the boundary of the first laid out system, or null if no system has one.
   */
  public SystemBoundary getPrimaryBoundary() {
    return systemBoundaries.isEmpty() ? null : systemBoundaries.get(0);
  }

  /**
   * @return the element with the given id, or null if there is none.
   */
  public PositionedElement getElement(String id) {
    for (PositionedElement element : elements) {
      if (element.getId().equals(id))
        return element;
    }
    return null;
  }

  public JSONObject toJSON() throws JSONException {
    JSONObject json = new JSONObject();

    JSONArray jsElements = new JSONArray();
    for (PositionedElement element : elements) {
      jsElements.put(element.toJSON());
    }
    json.put("elements", jsElements);

    JSONArray jsConnections = new JSONArray();
    for (Connection connection : connections) {
      jsConnections.put(connection.toJSON());
    }
    json.put("connections", jsConnections);

    JSONArray jsBoundaries = new JSONArray();
    for (SystemBoundary boundary : systemBoundaries) {
      jsBoundaries.put(boundary.toJSON());
    }
    json.put("systemLimits", jsBoundaries);

    SystemBoundary primary = getPrimaryBoundary();
    json.put("systemLimit", (primary == null) ? JSONObject.NULL : primary.toJSON());
    return json;
  }
}
