package org.fpbeditor.layout.geometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.fpbeditor.layout.PositionedElement;
import org.fpbeditor.layout.SystemBoundary;

/**
 * The positioned elements and the boundary of one system.
 */
public class SystemPlacement {

  private final List<PositionedElement> elements;
  private final SystemBoundary boundary;

  public SystemPlacement(List<PositionedElement> elements, SystemBoundary boundary) {
    this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    this.boundary = boundary;
  }

  public List<PositionedElement> getElements() {
    return elements;
  }

  /**
   * @return the boundary, or null if the system has neither states nor operators.
   */
  public SystemBoundary getBoundary() {
    return boundary;
  }

  /**
   * @return the box covering all elements and the boundary.
   */
  public Extent getExtent() {
    Extent extent = new Extent();
    for (PositionedElement element : elements) {
      extent.include(element);
    }
    if (boundary != null)
      extent.include(boundary);
    return extent;
  }

  public SystemPlacement translate(double dx, double dy) {
    List<PositionedElement> moved = new ArrayList<>(elements.size());
    for (PositionedElement element : elements) {
      moved.add(element.translate(dx, dy));
    }
    return new SystemPlacement(moved, (boundary == null) ? null : boundary.translate(dx, dy));
  }
}
